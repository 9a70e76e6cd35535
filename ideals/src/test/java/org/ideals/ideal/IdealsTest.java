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

import org.ideals.algebraic.CoercionException;
import org.ideals.algebraic.RingTypeException;
import org.ideals.lib.Ternary;
import org.ideals.rings.IntegerRing;
import org.ideals.rings.ModularInteger;
import org.ideals.rings.Polynomial;
import org.ideals.rings.PolynomialRing;
import org.ideals.rings.PrimeField;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

public class IdealsTest {
    static final IntegerRing ZZ = IntegerRing.instance;

    static BigInteger b(long value) {
        return BigInteger.valueOf(value);
    }

    final PolynomialRing<BigInteger> zxy = new PolynomialRing<BigInteger>(ZZ, "x", "y");
    final Polynomial<BigInteger> x = this.zxy.variable("x");
    final Polynomial<BigInteger> y = this.zxy.variable("y");

    @Test
    public void classificationTest() {
        Assert.assertEquals(IdealKind.PID, Ideals.ideal(ZZ, 4, 6).kind());
        Assert.assertEquals(IdealKind.PRINCIPAL, Ideals.ideal(this.zxy, this.x).kind());
        Assert.assertEquals(IdealKind.GENERIC, Ideals.ideal(this.zxy, this.x, this.y).kind());
        Assert.assertEquals(IdealKind.PRINCIPAL, Ideals.ideal(this.zxy, this.x, this.x).kind());
    }

    @Test
    public void pidReductionTest() {
        PidIdeal<BigInteger> ideal = (PidIdeal<BigInteger>)Ideals.ideal(ZZ, 4, 6, 10);
        Assert.assertEquals(b(2), ideal.gen());
        Assert.assertEquals(1, ideal.ngens());
        for (int a = -12; a <= 12; a++) {
            for (int c = -12; c <= 12; c++) {
                PrincipalIdeal<BigInteger> i = (PrincipalIdeal<BigInteger>)Ideals.ideal(ZZ, a, c);
                Assert.assertEquals(ZZ.gcd(b(a), b(c)), ZZ.canonicalAssociate(i.gen()));
            }
        }
    }

    @Test
    public void pidOverFieldTest() {
        PrimeField f5 = new PrimeField(5);
        PolynomialRing<ModularInteger> f5x = new PolynomialRing<ModularInteger>(f5, "x");
        Polynomial<ModularInteger> x = f5x.variable(0);
        Ideal<Polynomial<ModularInteger>> ideal = Ideals.ideal(f5x,
                f5x.subtract(f5x.power(x, 2), f5x.one()),
                f5x.add(f5x.subtract(f5x.power(x, 2), f5x.times(f5x.coerce(2), x)), f5x.one()));
        Assert.assertEquals(IdealKind.PID, ideal.kind());
        Assert.assertEquals("Principal ideal (x + 4) of Univariate Polynomial Ring in x over Finite Field of size 5",
                ideal.toString());

        Ideal<ModularInteger> unit = Ideals.ideal(f5, 3);
        Assert.assertEquals(IdealKind.PID, unit.kind());
        Assert.assertEquals(Ternary.Yes, unit.isTrivial());
    }

    @Test
    public void generatorSetEqualityTest() {
        Ideal<Polynomial<BigInteger>> i = Ideals.ideal(this.zxy, this.x, this.y);
        Ideal<Polynomial<BigInteger>> j = Ideals.ideal(this.zxy, this.y, this.x, this.x);
        Assert.assertEquals(i, j);
        Assert.assertEquals(i.hashCode(), j.hashCode());
        Assert.assertEquals(0, i.compareTo(j));
        Assert.assertNotEquals(i, Ideals.ideal(this.zxy, this.x, this.zxy.power(this.y, 2)));
    }

    @Test
    public void emptyGeneratorsTest() {
        Ideal<BigInteger> empty = Ideals.ideal(ZZ, Collections.emptyList(), true);
        Assert.assertEquals(Ideals.ideal(ZZ, ZZ.zero()), empty);
        Assert.assertTrue(empty.isZero());
        Ideal<?> polyEmpty = Ideals.ideal(this.zxy);
        Assert.assertEquals(Ideals.ideal(this.zxy, this.zxy.zero()), polyEmpty);
        Assert.assertEquals(IdealKind.PRINCIPAL, polyEmpty.kind());
    }

    @Test
    public void singleArgumentTest() {
        PolynomialRing<BigInteger> zt = new PolynomialRing<BigInteger>(ZZ, "t");
        Polynomial<BigInteger> t = zt.variable(0);
        Ideal<?> ideal = Ideals.ideal(Arrays.asList(1, t, zt.power(t, 2)));
        Assert.assertEquals(zt, ideal.ring());
        Assert.assertEquals(IdealKind.GENERIC, ideal.kind());
        Assert.assertEquals("Ideal (1, t, t^2) of Univariate Polynomial Ring in t over Integer Ring",
                ideal.toString());

        Ideal<?> element = Ideals.ideal(t);
        Assert.assertEquals(Ideals.ideal(zt, t), element);

        Ideal<?> integer = Ideals.ideal(8);
        Assert.assertEquals(IdealKind.PID, integer.kind());
        Assert.assertEquals(ZZ, integer.ring());

        Ideal<?> zero = Ideals.ideal(ZZ);
        Assert.assertTrue(zero.isZero());

        Ideal<?> again = Ideals.ideal(ideal);
        Assert.assertEquals(ideal, again);
        Assert.assertNotSame(ideal, again);
    }

    @Test
    public void invalidInputTest() {
        try {
            Ideals.ideal("hello");
            Assert.fail("A string is not a ring element");
        } catch (RingTypeException ex) {
            Assert.assertEquals("ring must be a ring, list, or element", ex.getMessage());
        }
        try {
            Ideals.ideal(Collections.emptyList());
            Assert.fail("An empty list has no ring");
        } catch (RingTypeException ex) {
            Assert.assertEquals("ring must be a ring, list, or element", ex.getMessage());
        }
        try {
            Ideals.ideal(Arrays.asList(1, null));
            Assert.fail("null is not a ring element");
        } catch (RingTypeException ex) {
            Assert.assertEquals("ring must be a ring, list, or element", ex.getMessage());
        }
        try {
            Ideals.ideal(new Object[0]);
            Assert.fail("An empty array has no ring");
        } catch (RingTypeException ex) {
            Assert.assertEquals("ring must be a ring, list, or element", ex.getMessage());
        }
        PolynomialRing<BigInteger> zu = new PolynomialRing<BigInteger>(ZZ, "u");
        PolynomialRing<BigInteger> zv = new PolynomialRing<BigInteger>(ZZ, "v");
        try {
            Ideals.ideal(Arrays.asList(zu.variable(0), zv.variable(0)));
            Assert.fail("No common ring");
        } catch (RingTypeException ex) {
            Assert.assertEquals("unable to find common ring into which all ideal generators map", ex.getMessage());
        }
    }

    @Test
    public void arrayInputTest() {
        Ideal<?> ideal = Ideals.ideal(new Object[] { 4, 6 });
        Assert.assertEquals(IdealKind.PID, ideal.kind());
        Assert.assertEquals(Ideals.ideal(ZZ, 2), ideal);
        Assert.assertEquals(Ideals.ideal(Arrays.asList(4, 6)), ideal);
    }

    @Test(expected = RingTypeException.class)
    public void nonCommutativeTest() {
        Ideals.ideal(MatrixRing.instance, MatrixRing.matrix(1, 2, 3, 4));
    }

    @Test(expected = CoercionException.class)
    public void coercionFailureTest() {
        Ideals.ideal(ZZ, 1, "x");
    }

    @Test
    public void coerceFlagTest() {
        Assert.assertEquals(b(5), ((PrincipalIdeal<BigInteger>)Ideals.ideal(ZZ, 5, false)).gen());
        Assert.assertEquals(b(7), ((PrincipalIdeal<BigInteger>)Ideals.ideal(ZZ, Arrays.asList(b(7)), false)).gen());
        try {
            Ideals.ideal(ZZ, Arrays.asList(7), false);
            Assert.fail("Integer is not an element of the integer ring");
        } catch (CoercionException ex) {
            Assert.assertEquals("7 is not an element of Integer Ring", ex.getMessage());
        }
    }

    @Test
    public void fractionalTest() {
        FractionalIdeal<BigInteger> ideal = Ideals.fractionalIdeal(ZZ, 4, 6);
        Assert.assertEquals(IdealKind.FRACTIONAL, ideal.kind());
        Assert.assertEquals(2, ideal.ngens());
        Assert.assertTrue(Ideals.isIdeal(ideal));
        Assert.assertFalse(Ideals.isIdeal(ZZ));
    }

    @Test
    public void safetyChecksTest() {
        boolean saved = Ideals.safetyChecks;
        try {
            Ideals.safetyChecks = true;
            Assert.assertEquals(b(3), ((PidIdeal<BigInteger>)Ideals.ideal(ZZ, 9, 12)).gen());
            Ideals.safetyChecks = false;
            Assert.assertEquals(b(3), ((PidIdeal<BigInteger>)Ideals.ideal(ZZ, 9, 12)).gen());
        } finally {
            Ideals.safetyChecks = saved;
        }
    }
}
