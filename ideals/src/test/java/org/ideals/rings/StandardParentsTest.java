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

import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;

public class StandardParentsTest {
    final StandardParents parents = StandardParents.instance;

    @Test
    public void parentOfTest() {
        PolynomialRing<BigInteger> zt = new PolynomialRing<BigInteger>(IntegerRing.instance, "t");
        Assert.assertSame(IntegerRing.instance, this.parents.parentOf(5));
        Assert.assertSame(IntegerRing.instance, this.parents.parentOf(BigInteger.TEN));
        Assert.assertSame(zt, this.parents.parentOf(zt.variable(0)));
        PrimeField f3 = new PrimeField(3);
        Assert.assertSame(f3, this.parents.parentOf(f3.one()));
        Assert.assertNull(this.parents.parentOf("t"));
    }

    @Test
    public void commonParentTest() {
        PolynomialRing<BigInteger> zt = new PolynomialRing<BigInteger>(IntegerRing.instance, "t");
        Polynomial<BigInteger> t = zt.variable(0);
        Assert.assertEquals(zt, this.parents.commonParent(Arrays.asList(1, t, zt.power(t, 2))));
        Assert.assertEquals(IntegerRing.instance, this.parents.commonParent(Arrays.asList(1, 2L)));

        PolynomialRing<BigInteger> zu = new PolynomialRing<BigInteger>(IntegerRing.instance, "u");
        Assert.assertNull(this.parents.commonParent(Arrays.asList(t, zu.variable(0))));
        Assert.assertNull(this.parents.commonParent(Arrays.asList(1, "a")));
    }
}
