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
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class PolynomialRingTest {
    final PolynomialRing<BigInteger> zxy = new PolynomialRing<BigInteger>(IntegerRing.instance, "x", "y");
    final Polynomial<BigInteger> x = this.zxy.variable("x");
    final Polynomial<BigInteger> y = this.zxy.variable("y");

    Polynomial<BigInteger> c(long value) {
        return this.zxy.coerce(value);
    }

    @Test
    public void toStringTest() {
        Polynomial<BigInteger> p = this.zxy.add(this.x, this.c(1));
        Assert.assertEquals("x^2 + 2*x + 1", this.zxy.times(p, p).toString());
        Assert.assertEquals("x - y", this.zxy.subtract(this.x, this.y).toString());
        Assert.assertEquals("-x", this.zxy.negate(this.x).toString());
        Assert.assertEquals("-3*x*y + 2", this.zxy.add(
                this.zxy.times(this.c(-3), this.zxy.times(this.x, this.y)), this.c(2)).toString());
        Assert.assertEquals("0", this.zxy.zero().toString());
        Assert.assertEquals("Multivariate Polynomial Ring in x, y over Integer Ring", this.zxy.toString());
    }

    @Test
    public void exactDivisionTest() {
        Polynomial<BigInteger> diff = this.zxy.subtract(this.zxy.power(this.x, 2), this.zxy.power(this.y, 2));
        Polynomial<BigInteger> q = this.zxy.divide(diff, this.zxy.subtract(this.x, this.y));
        Assert.assertEquals(this.zxy.add(this.x, this.y), q);
        Assert.assertNull(this.zxy.divide(this.zxy.add(this.zxy.power(this.x, 2), this.c(1)), this.x));
        Assert.assertNull(this.zxy.divide(this.zxy.times(this.c(2), this.x), this.c(4)));
        Assert.assertTrue(this.zxy.divides(this.x, this.zxy.times(this.x, this.y)));
        Assert.assertFalse(this.zxy.divides(this.zxy.zero(), this.x));
        Assert.assertTrue(this.zxy.divides(this.zxy.zero(), this.zxy.zero()));
    }

    @Test
    public void coerceTest() {
        PolynomialRing<BigInteger> zx = new PolynomialRing<BigInteger>(IntegerRing.instance, "x");
        Polynomial<BigInteger> p = zx.add(zx.variable(0), zx.one());
        Assert.assertEquals(this.zxy.add(this.x, this.c(1)), this.zxy.coerce(p));
        Assert.assertTrue(this.zxy.coerce(5).isConstant());

        PolynomialRing<ModularInteger> f5x = new PolynomialRing<ModularInteger>(new PrimeField(5), "x");
        Polynomial<ModularInteger> q = f5x.coerce(zx.add(zx.variable(0), zx.coerce(7)));
        Assert.assertEquals("x + 2", q.toString());

        PolynomialRing<BigInteger> zy = new PolynomialRing<BigInteger>(IntegerRing.instance, "y");
        try {
            zx.coerce(zy.variable(0));
            Assert.fail("y is not in Z[x]");
        } catch (CoercionException ex) {
            // expected
        }
    }

    @Test
    public void unitsTest() {
        Assert.assertTrue(this.zxy.isUnit(this.c(-1)));
        Assert.assertFalse(this.zxy.isUnit(this.c(2)));
        Assert.assertFalse(this.zxy.isUnit(this.x));
        Polynomial<BigInteger> negative = this.zxy.subtract(this.c(1), this.zxy.times(this.c(2), this.x));
        Assert.assertEquals("2*x - 1", this.zxy.canonicalAssociate(negative).toString());
    }

    @Test
    public void homogenizeTest() {
        Polynomial<BigInteger> p = this.zxy.add(this.zxy.add(this.zxy.power(this.x, 2), this.x), this.c(1));
        Assert.assertEquals("x^2 + x*y + y^2", this.zxy.homogenize(p, 1).toString());
    }

    @Test
    public void compareTest() {
        Assert.assertTrue(this.zxy.compare(this.x, this.y) > 0);
        Assert.assertTrue(this.zxy.compare(this.y, this.x) < 0);
        Assert.assertEquals(0, this.zxy.compare(this.x, this.zxy.variable(0)));
        Assert.assertTrue(this.zxy.compare(this.zxy.add(this.x, this.c(1)), this.x) > 0);
    }

    @Test
    public void principalIdealDomainTest() {
        Assert.assertFalse(this.zxy.isPrincipalIdealDomain());
        Assert.assertFalse(new PolynomialRing<BigInteger>(IntegerRing.instance, "x").isPrincipalIdealDomain());
        Assert.assertFalse(new PolynomialRing<ModularInteger>(new PrimeField(5), "x", "y").isPrincipalIdealDomain());

        PolynomialRing<ModularInteger> f5x = new PolynomialRing<ModularInteger>(new PrimeField(5), "x");
        PrincipalIdealDomain<Polynomial<ModularInteger>> domain = f5x.asPrincipalIdealDomain();
        Assert.assertNotNull(domain);
        Polynomial<ModularInteger> x = f5x.variable(0);
        Polynomial<ModularInteger> a = f5x.subtract(f5x.power(x, 2), f5x.one());
        Polynomial<ModularInteger> b = f5x.add(f5x.subtract(f5x.power(x, 2), f5x.times(f5x.coerce(2), x)), f5x.one());
        Assert.assertEquals("x + 4", domain.gcd(a, b).toString());

        QuoRem<Polynomial<ModularInteger>> qr = domain.quoRem(f5x.power(x, 3), f5x.add(f5x.power(x, 2), f5x.one()));
        Assert.assertEquals("x", qr.quotient.toString());
        Assert.assertEquals("4*x", qr.remainder.toString());
    }
}
