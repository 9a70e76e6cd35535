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

package org.ideals.algebraic;

import javax.annotation.Nullable;

/**
 * A commutative ring where every non-zero element is a unit.
 * Every field is a principal ideal domain: the only ideals are (0) and (1).
 * @param <T>  Type of field elements.
 */
public interface Field<T> extends Ring<T>, PrincipalIdealDomain<T> {
    /**
     * Multiplicative inverse.
     * @throws ArithmeticException if the value is zero.
     */
    T inverse(T value);

    @Override
    default boolean isUnit(T value) {
        return !this.isZero(value);
    }

    @Override
    @Nullable
    default T divide(T dividend, T divisor) {
        if (this.isZero(divisor))
            return this.isZero(dividend) ? this.zero() : null;
        return this.times(dividend, this.inverse(divisor));
    }

    @Override
    default T normalizingUnit(T value) {
        if (this.isZero(value))
            return this.one();
        return this.inverse(value);
    }

    @Override
    default T gcd(T left, T right) {
        if (this.isZero(left) && this.isZero(right))
            return this.zero();
        return this.one();
    }

    @Override
    default QuoRem<T> quoRem(T dividend, T divisor) {
        if (this.isZero(divisor))
            throw new ArithmeticException("Division by zero in " + this);
        return new QuoRem<T>(this.times(dividend, this.inverse(divisor)), this.zero());
    }

    @Override
    default PrincipalIdealDomain<T> asPrincipalIdealDomain() {
        return this;
    }
}
