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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.List;

/**
 * An algebraic structure of a ring.
 * @param <T>  Type of elements in the ring.
 */
public interface Ring<T> extends Group<T> {
    /**
     * Multiplication in the ring.
     * @param left   Left value to multiply.
     * @param right  Right value to multiply.
     * @return       The result of the multiplication.  This operation better be associative.
     */
    T times(T left, T right);

    /**
     * The neutral element for multiplication.
     */
    T one();

    /**
     * Check if a value is one.
     * @param value  Value to compare.
     * @return       True if the value is the ring one element.
     */
    default boolean isOne(T value) { return this.equal(this.one(), value); }

    /**
     * Raise a value to a non-negative power by repeated squaring.
     */
    default T power(T value, int exponent) {
        Preconditions.checkArgument(exponent >= 0, "Negative exponent %s", exponent);
        T result = this.one();
        T base = value;
        while (exponent > 0) {
            if ((exponent & 1) != 0)
                result = this.times(result, base);
            exponent >>= 1;
            if (exponent > 0)
                base = this.times(base, base);
        }
        return result;
    }

    default boolean isCommutative() {
        return true;
    }

    /**
     * The principal ideal domain operations of this ring.
     * @return  null if the ring is not known to be a principal ideal domain.
     */
    @Nullable
    default PrincipalIdealDomain<T> asPrincipalIdealDomain() {
        return null;
    }

    default boolean isPrincipalIdealDomain() {
        return this.asPrincipalIdealDomain() != null;
    }

    boolean isUnit(T value);

    /**
     * Exact division.
     * @param dividend  Value to divide.
     * @param divisor   Value to divide by.
     * @return  A value q with q * divisor == dividend, or null if there is none.
     */
    @Nullable
    T divide(T dividend, T divisor);

    /**
     * True if divisor divides value.  Zero divides only zero.
     */
    default boolean divides(T divisor, T value) {
        if (this.isZero(divisor))
            return this.isZero(value);
        return this.divide(value, divisor) != null;
    }

    /**
     * Map an arbitrary value into this ring.
     * @param value  Value to convert.
     * @return  The corresponding ring element.
     * @throws CoercionException if there is no such element.
     */
    T coerce(Object value);

    /**
     * A deterministic total order on ring elements.  It need not be compatible
     * with the ring operations.
     */
    int compare(T left, T right);

    /**
     * A unit u such that u * value is the canonical representative of the associates of value.
     * Rings with units other than one must override this.
     */
    default T normalizingUnit(T value) {
        return this.one();
    }

    default T canonicalAssociate(T value) {
        return this.times(this.normalizingUnit(value), value);
    }

    /**
     * The ring of coefficients; the ring itself when it has no coefficients.
     */
    default Ring<?> baseRing() {
        return this;
    }

    /**
     * Number of elements of the ring.
     * @return  null if the ring is infinite.
     */
    @Nullable
    BigInteger order();

    /**
     * The named generators of the ring, e.g., the variables of a polynomial ring.
     */
    default List<T> gens() {
        return ImmutableList.of();
    }
}
