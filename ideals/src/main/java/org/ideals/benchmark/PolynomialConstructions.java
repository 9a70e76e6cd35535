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

import org.ideals.rings.Polynomial;
import org.ideals.rings.PolynomialRing;
import org.ideals.lib.Linq;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the benchmark polynomial systems directly.
 */
public class PolynomialConstructions implements NamedConstructionBackend {
    public static final String CYCLIC = "cyclic";
    public static final String KATSURA = "katsura";

    @Override
    public <C> List<Polynomial<C>> evaluateNamedConstruction(
            String name, PolynomialRing<C> ring, int variableCount, boolean homogeneous) {
        if (variableCount < 1 || variableCount > ring.ngens())
            throw new IllegalArgumentException("Cannot use " + variableCount + " variables of " + ring);
        List<Polynomial<C>> result;
        switch (name) {
            case CYCLIC:
                result = cyclic(ring, variableCount);
                break;
            case KATSURA:
                result = katsura(ring, variableCount);
                break;
            default:
                throw new IllegalArgumentException("Unknown construction " + name);
        }
        if (homogeneous)
            result = Linq.map(result, p -> ring.homogenize(p, variableCount - 1));
        return result;
    }

    /**
     * The cyclic n-roots system: for k = 1..n-1 the sum over i of x_i x_{i+1} ... x_{i+k-1}
     * (indexes modulo n), and x_0 x_1 ... x_{n-1} - 1.
     */
    static <C> List<Polynomial<C>> cyclic(PolynomialRing<C> ring, int n) {
        List<Polynomial<C>> result = new ArrayList<Polynomial<C>>(n);
        for (int k = 1; k < n; k++) {
            Polynomial<C> sum = ring.zero();
            for (int i = 0; i < n; i++) {
                Polynomial<C> product = ring.one();
                for (int j = 0; j < k; j++)
                    product = ring.times(product, ring.variable((i + j) % n));
                sum = ring.add(sum, product);
            }
            result.add(sum);
        }
        Polynomial<C> all = ring.one();
        for (int i = 0; i < n; i++)
            all = ring.times(all, ring.variable(i));
        result.add(ring.subtract(all, ring.one()));
        return result;
    }

    /**
     * The Katsura system in u_0..u_{n-1}, where u_{-l} = u_l and u_l = 0 for |l| >= n:
     * u_0 + 2 (u_1 + ... + u_{n-1}) - 1, and for m = 0..n-2 the sum over l of u_l u_{m-l}, minus u_m.
     */
    static <C> List<Polynomial<C>> katsura(PolynomialRing<C> ring, int n) {
        List<Polynomial<C>> result = new ArrayList<Polynomial<C>>(n);
        Polynomial<C> two = ring.coerce(2);
        Polynomial<C> first = ring.subtract(ring.variable(0), ring.one());
        for (int l = 1; l < n; l++)
            first = ring.add(first, ring.times(two, ring.variable(l)));
        result.add(first);
        for (int m = 0; m < n - 1; m++) {
            Polynomial<C> p = ring.negate(ring.variable(m));
            for (int l = -(n - 1); l < n; l++) {
                int other = m - l;
                if (Math.abs(other) >= n)
                    continue;
                p = ring.add(p, ring.times(ring.variable(Math.abs(l)), ring.variable(Math.abs(other))));
            }
            result.add(p);
        }
        return result;
    }
}
