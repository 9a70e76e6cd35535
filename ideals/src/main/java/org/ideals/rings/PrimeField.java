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

import com.google.common.base.Preconditions;
import org.ideals.algebraic.CoercionException;
import org.ideals.algebraic.Field;

import java.math.BigInteger;

/**
 * The finite field with p elements, for a prime p.
 */
public class PrimeField implements Field<ModularInteger> {
    final BigInteger characteristic;

    public PrimeField(BigInteger characteristic) {
        Preconditions.checkArgument(characteristic.isProbablePrime(50),
                "%s is not a prime", characteristic);
        this.characteristic = characteristic;
    }

    public PrimeField(long characteristic) {
        this(BigInteger.valueOf(characteristic));
    }

    public BigInteger characteristic() {
        return this.characteristic;
    }

    public ModularInteger element(BigInteger value) {
        return new ModularInteger(this, value.mod(this.characteristic));
    }

    public ModularInteger element(long value) {
        return this.element(BigInteger.valueOf(value));
    }

    @Override
    public ModularInteger negate(ModularInteger data) {
        return this.element(data.value.negate());
    }

    @Override
    public ModularInteger add(ModularInteger left, ModularInteger right) {
        return this.element(left.value.add(right.value));
    }

    @Override
    public ModularInteger zero() {
        return this.element(BigInteger.ZERO);
    }

    @Override
    public ModularInteger times(ModularInteger left, ModularInteger right) {
        return this.element(left.value.multiply(right.value));
    }

    @Override
    public ModularInteger one() {
        return this.element(BigInteger.ONE);
    }

    @Override
    public boolean equal(ModularInteger left, ModularInteger right) {
        return left.equals(right);
    }

    @Override
    public ModularInteger inverse(ModularInteger value) {
        if (value.value.signum() == 0)
            throw new ArithmeticException("Division by zero in " + this);
        return this.element(value.value.modInverse(this.characteristic));
    }

    /**
     * Accepts elements of this field and Java integral values, which are reduced modulo p.
     */
    @Override
    public ModularInteger coerce(Object value) {
        if (value instanceof ModularInteger) {
            ModularInteger mi = (ModularInteger)value;
            if (mi.field.equals(this))
                return mi;
            throw new CoercionException(value, this);
        }
        if (IntegerRing.isIntegral(value))
            return this.element(IntegerRing.instance.coerce(value));
        throw new CoercionException(value, this);
    }

    @Override
    public int compare(ModularInteger left, ModularInteger right) {
        return left.compareTo(right);
    }

    @Override
    public BigInteger order() {
        return this.characteristic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.characteristic.equals(((PrimeField) o).characteristic);
    }

    @Override
    public int hashCode() {
        return this.characteristic.hashCode();
    }

    @Override
    public String toString() {
        return "Finite Field of size " + this.characteristic;
    }
}
