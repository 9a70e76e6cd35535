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

package org.ideals.benchmark;

import org.ideals.ideal.Ideal;
import org.ideals.ideal.Ideals;
import org.ideals.rings.Polynomial;
import org.ideals.rings.PolynomialRing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Constructors for standard (benchmark) ideals.
 */
public class BenchmarkIdeals {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkIdeals.class);

    private BenchmarkIdeals() {}

    /**
     * The ideal of cyclic n-roots in the first n variables of ring.
     * @param ring         Ring to construct the ideal in.
     * @param n            Number of cyclic roots; null or 0 means all variables of the ring.
     * @param homogeneous  If true the generators are homogenized with variable n - 1.
     * @param backend      Service that computes the generators.
     * @throws ArithmeticException if n is negative or larger than the number of variables.
     */
    public static <C> Ideal<Polynomial<C>> cyclic(
            PolynomialRing<C> ring, @Nullable Integer n, boolean homogeneous, NamedConstructionBackend backend) {
        return named(PolynomialConstructions.CYCLIC, ring, n, homogeneous, backend);
    }

    /**
     * The n-th Katsura ideal of ring.
     * @see #cyclic(PolynomialRing, Integer, boolean, NamedConstructionBackend)
     */
    public static <C> Ideal<Polynomial<C>> katsura(
            PolynomialRing<C> ring, @Nullable Integer n, boolean homogeneous, NamedConstructionBackend backend) {
        return named(PolynomialConstructions.KATSURA, ring, n, homogeneous, backend);
    }

    static <C> Ideal<Polynomial<C>> named(
            String name, PolynomialRing<C> ring, @Nullable Integer n,
            boolean homogeneous, NamedConstructionBackend backend) {
        int count = variableCount(ring, n);
        logger.debug("Building {} ideal with {} variables of {}", name, count, ring);
        List<Polynomial<C>> gens = backend.evaluateNamedConstruction(name, ring, count, homogeneous);
        return Ideals.ideal(ring, gens, true);
    }

    static int variableCount(PolynomialRing<?> ring, @Nullable Integer n) {
        if (n == null || n == 0)
            return ring.ngens();
        if (n < 0 || n > ring.ngens())
            throw new ArithmeticException("n must be between 1 and " + ring.ngens() + ", got " + n);
        return n;
    }

    /**
     * The field ideal (x_0^q - x_0, ..., x_n^q - x_n) where q is the order of the
     * coefficient ring and x_0..x_n are the variables of ring.
     * @throws ArithmeticException if the coefficient ring is infinite.
     */
    public static <C> Ideal<Polynomial<C>> fieldIdeal(PolynomialRing<C> ring) {
        BigInteger q = ring.baseRing().order();
        if (q == null)
            throw new ArithmeticException("Cannot construct field ideal: " + ring.baseRing() + " is infinite");
        int exponent = q.intValueExact();
        List<Polynomial<C>> gens = new ArrayList<Polynomial<C>>();
        for (Polynomial<C> x : ring.gens())
            gens.add(ring.subtract(ring.power(x, exponent), x));
        return Ideals.ideal(ring, gens, true);
    }
}
