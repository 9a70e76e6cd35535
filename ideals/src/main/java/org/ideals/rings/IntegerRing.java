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

import org.ideals.algebraic.CoercionException;
import org.ideals.algebraic.PrincipalIdealDomain;
import org.ideals.algebraic.QuoRem;
import org.ideals.algebraic.Ring;

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * The ring of infinite-precision integer values.
 * This implementation uses BigInteger Java integers.
 */
public class IntegerRing implements Ring<BigInteger>, PrincipalIdealDomain<BigInteger> {
    private IntegerRing() {}

    public static final IntegerRing instance = new IntegerRing();

    @Override
    public BigInteger negate(BigInteger data) {
        return data.negate();
    }

    @Override
    public BigInteger add(BigInteger left, BigInteger right) {
        return left.add(right);
    }

    @Override
    public BigInteger zero() {
        return BigInteger.ZERO;
    }

    @Override
    public BigInteger times(BigInteger left, BigInteger right) {
        return left.multiply(right);
    }

    @Override
    public BigInteger one() {
        return BigInteger.ONE;
    }

    @Override
    public boolean equal(BigInteger w0, BigInteger w1) {
        return w0.equals(w1);
    }

    @Override
    public boolean isUnit(BigInteger value) {
        return value.abs().equals(BigInteger.ONE);
    }

    @Nullable
    @Override
    public BigInteger divide(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0)
            return dividend.signum() == 0 ? BigInteger.ZERO : null;
        BigInteger[] qr = dividend.divideAndRemainder(divisor);
        if (qr[1].signum() != 0)
            return null;
        return qr[0];
    }

    /**
     * Accepts all Java integral types.
     */
    @Override
    public BigInteger coerce(Object value) {
        if (value instanceof BigInteger)
            return (BigInteger)value;
        if (isIntegral(value))
            return BigInteger.valueOf(((Number)value).longValue());
        throw new CoercionException(value, this);
    }

    static boolean isIntegral(Object value) {
        return value instanceof BigInteger || value instanceof Integer ||
                value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    @Override
    public int compare(BigInteger left, BigInteger right) {
        return left.compareTo(right);
    }

    @Override
    public BigInteger normalizingUnit(BigInteger value) {
        return value.signum() < 0 ? BigInteger.ONE.negate() : BigInteger.ONE;
    }

    @Nullable
    @Override
    public BigInteger order() {
        return null;
    }

    @Override
    public PrincipalIdealDomain<BigInteger> asPrincipalIdealDomain() {
        return this;
    }

    /**
     * The result is never negative.
     */
    @Override
    public BigInteger gcd(BigInteger left, BigInteger right) {
        return left.gcd(right);
    }

    /**
     * Floor division: the remainder has the sign of the divisor (or is zero).
     */
    @Override
    public QuoRem<BigInteger> quoRem(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0)
            throw new ArithmeticException("Division by zero");
        BigInteger[] qr = dividend.divideAndRemainder(divisor);
        BigInteger q = qr[0];
        BigInteger r = qr[1];
        if (r.signum() != 0 && r.signum() != divisor.signum()) {
            q = q.subtract(BigInteger.ONE);
            r = r.add(divisor);
        }
        return new QuoRem<BigInteger>(q, r);
    }

    @Override
    public String toString() {
        return "Integer Ring";
    }
}
