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
import org.ideals.lib.Ternary;
import org.ideals.rings.IntegerRing;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class FractionalIdealTest {
    static final IntegerRing ZZ = IntegerRing.instance;

    @Test
    public void constructionTest() {
        FractionalIdeal<BigInteger> ideal = Ideals.fractionalIdeal(ZZ, 4, 6, 4);
        Assert.assertEquals(IdealKind.FRACTIONAL, ideal.kind());
        Assert.assertEquals(ImmutableList.of(BigInteger.valueOf(4), BigInteger.valueOf(6)), ideal.gens());
        Assert.assertEquals("Fractional ideal (4, 6) of Integer Ring", ideal.toString());
        Assert.assertTrue(Ideals.fractionalIdeal(ZZ).isZero());
    }

    @Test
    public void genericBehaviorTest() {
        FractionalIdeal<BigInteger> ideal = Ideals.fractionalIdeal(ZZ, 4, 6);
        Assert.assertEquals(Ternary.Maybe, ideal.contains(8));
        Assert.assertEquals(Ternary.Maybe, ideal.isPrincipal());
        Assert.assertEquals(Ideals.fractionalIdeal(ZZ, 6, 4), ideal);
        Assert.assertEquals(new GenericIdeal<BigInteger>(ZZ, ideal.gens()), ideal);
        Assert.assertEquals(Ternary.Yes, Ideals.fractionalIdeal(ZZ, 3).isPrincipal());
    }

    @Test
    public void arithmeticReclassifiesTest() {
        Ideal<BigInteger> sum = Ideals.fractionalIdeal(ZZ, 4, 6).plus(Ideals.ideal(ZZ, 10));
        Assert.assertEquals(IdealKind.PID, sum.kind());
        Assert.assertEquals(Ideals.ideal(ZZ, 2), sum);
    }

    @Test
    public void singleGeneratorTest() {
        Ideal<BigInteger> principal = Ideals.ideal(ZZ, 4);
        FractionalIdeal<BigInteger> fractional = Ideals.fractionalIdeal(ZZ, 4);
        Assert.assertEquals(Ternary.Yes, fractional.isPrincipal());
        Assert.assertEquals(principal, fractional);
        Assert.assertEquals(fractional, principal);
        Assert.assertEquals(0, principal.compareTo(fractional));
        Assert.assertEquals(0, fractional.compareTo(principal));
        Assert.assertEquals(principal.hashCode(), fractional.hashCode());

        FractionalIdeal<BigInteger> negated = Ideals.fractionalIdeal(ZZ, -4);
        Assert.assertEquals(principal, negated);
        Assert.assertEquals(principal.hashCode(), negated.hashCode());

        FractionalIdeal<BigInteger> two = Ideals.fractionalIdeal(ZZ, 4, 6);
        Assert.assertTrue(fractional.compareTo(two) < 0);
        Assert.assertTrue(two.compareTo(principal) > 0);
        Assert.assertTrue(Ideals.fractionalIdeal(ZZ, 3).compareTo(principal) < 0);
        Assert.assertEquals(Ideals.ideal(ZZ, 2), ((PidIdeal<BigInteger>)Ideals.ideal(ZZ, 6)).gcd(fractional));
    }
}
