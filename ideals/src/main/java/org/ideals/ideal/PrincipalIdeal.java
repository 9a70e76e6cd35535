/*
 * Copyright (c) 2021 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.ideals.ideal;

import com.google.common.collect.ImmutableList;
import org.ideals.algebraic.Ring;
import org.ideals.lib.Ternary;

/**
 * An ideal generated by a single element.
 * @param <T>  Type of ring elements.
 */
public class PrincipalIdeal<T> extends Ideal<T> {
    PrincipalIdeal(Ring<T> ring, T gen) {
        super(ring, ImmutableList.of(gen));
    }

    @Override
    public IdealKind kind() {
        return IdealKind.PRINCIPAL;
    }

    /**
     * The generator.
     */
    public T gen() {
        return this.gens.get(0);
    }

    @Override
    public Ternary isPrincipal() {
        return Ternary.Yes;
    }

    /**
     * The ideal (0) contains only 0; otherwise x is in (g) iff g divides x.
     */
    @Override
    Ternary containsElement(T value) {
        if (this.ring.isZero(this.gen()))
            return Ternary.of(this.ring.isZero(value));
        return Ternary.of(this.ring.divides(this.gen(), value));
    }

    /**
     * True if the generator of this ideal divides the generator of other,
     * i.e., other is contained in this.
     * @return  Maybe when other is not principal.
     */
    public Ternary divides(Ideal<T> other) {
        if (other.isPrincipal() == Ternary.Yes) {
            T otherGen = this.ring.coerce(other.gen(0));
            return Ternary.of(this.ring.divides(this.gen(), otherGen));
        }
        return Ternary.Maybe;
    }

    @Override
    public String toString() {
        return "Principal ideal (" + this.gen() + ") of " + this.ring;
    }
}
