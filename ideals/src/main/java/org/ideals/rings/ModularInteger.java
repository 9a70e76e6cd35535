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

package org.ideals.rings;

import org.ideals.algebraic.Element;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An element of a prime field, represented by a value in [0, p).
 */
public final class ModularInteger implements Element<ModularInteger>, Comparable<ModularInteger> {
    final PrimeField field;
    final BigInteger value;

    ModularInteger(PrimeField field, BigInteger value) {
        this.field = field;
        this.value = value;
    }

    public BigInteger value() {
        return this.value;
    }

    @Override
    public PrimeField parent() {
        return this.field;
    }

    @Override
    public int compareTo(ModularInteger o) {
        return this.value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModularInteger that = (ModularInteger) o;
        return this.field.equals(that.field) && this.value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.field, this.value);
    }

    @Override
    public String toString() {
        return this.value.toString();
    }
}
