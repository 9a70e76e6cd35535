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

import org.ideals.algebraic.PrincipalIdealDomain;
import org.ideals.algebraic.Ring;
import org.ideals.lib.Ternary;

import java.util.Collections;

/**
 * An ideal of a principal ideal domain.  The generator is the gcd of
 * all the generators the ideal was created from.
 * @param <T>  Type of ring elements.
 */
public class PidIdeal<T> extends PrincipalIdeal<T> {
    final PrincipalIdealDomain<T> domain;

    PidIdeal(Ring<T> ring, PrincipalIdealDomain<T> domain, T gen) {
        super(ring, gen);
        this.domain = domain;
    }

    @Override
    public IdealKind kind() {
        return IdealKind.PID;
    }

    @Override
    public Ideal<T> plus(Ideal<T> other) {
        return this.gcd(other);
    }

    /**
     * The smallest ideal containing this and other.
     * @throws UnsupportedOperationException if other is not principal and does not contain this ideal.
     */
    public Ideal<T> gcd(Ideal<T> other) {
        if (other.isPrincipal() == Ternary.Yes) {
            T otherGen = this.ring.coerce(other.gen(0));
            T g = this.domain.gcd(this.gen(), otherGen);
            return Ideals.ideal(this.ring, Collections.singletonList(g), false);
        }
        if (other.contains(this.gen()) == Ternary.Yes)
            return other;
        throw new UnsupportedOperationException("Not implemented: sum of " + this + " and " + other);
    }

    /**
     * The remainder of f divided by the generator; f itself for the zero ideal.
     */
    @Override
    public T reduce(T f) {
        T value = this.ring.coerce(f);
        if (this.ring.isZero(this.gen()))
            return value;
        return this.domain.quoRem(value, this.gen()).remainder;
    }
}
