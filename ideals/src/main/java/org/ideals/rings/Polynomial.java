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

import com.google.common.collect.ImmutableSortedMap;
import org.ideals.algebraic.Element;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable polynomial with coefficients of type C.
 * Terms are kept sorted with the leading (lexicographically largest) monomial first.
 * Polynomials are created by their {@link PolynomialRing}.
 * @param <C>  Type of coefficients.
 */
public final class Polynomial<C> implements Element<Polynomial<C>> {
    final PolynomialRing<C> ring;
    final ImmutableSortedMap<Monomial, C> terms;

    Polynomial(PolynomialRing<C> ring, Map<Monomial, C> terms) {
        this.ring = ring;
        this.terms = ImmutableSortedMap.copyOf(terms, Comparator.<Monomial>reverseOrder());
    }

    @Override
    public PolynomialRing<C> parent() {
        return this.ring;
    }

    public ImmutableSortedMap<Monomial, C> terms() {
        return this.terms;
    }

    public boolean isZero() {
        return this.terms.isEmpty();
    }

    public boolean isConstant() {
        return this.terms.isEmpty() ||
                (this.terms.size() == 1 && this.terms.firstKey().isOne());
    }

    public Monomial leadingMonomial() {
        return this.terms.firstKey();
    }

    public C leadingCoefficient() {
        return this.terms.get(this.terms.firstKey());
    }

    /**
     * The coefficient of the constant term.
     */
    public C constantCoefficient() {
        C c = this.terms.get(Monomial.one(this.ring.ngens()));
        return c == null ? this.ring.baseRing().zero() : c;
    }

    /**
     * Total degree; -1 for the zero polynomial.
     */
    public int degree() {
        int result = -1;
        for (Monomial m : this.terms.keySet())
            result = Math.max(result, m.degree());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Polynomial<?> that = (Polynomial<?>) o;
        return this.ring.equals(that.ring) && this.terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.ring, this.terms);
    }

    @Override
    public String toString() {
        if (this.terms.isEmpty())
            return "0";
        StringBuilder builder = new StringBuilder();
        boolean first = true;
        for (Map.Entry<Monomial, C> e : this.terms.entrySet()) {
            Monomial m = e.getKey();
            String coefficient = e.getValue().toString();
            String term;
            if (m.isOne()) {
                term = coefficient;
            } else {
                String monomial = m.toString(this.ring.variableNames());
                if (coefficient.equals("1")) {
                    term = monomial;
                } else if (coefficient.equals("-1")) {
                    term = "-" + monomial;
                } else {
                    if (coefficient.indexOf(' ') >= 0)
                        coefficient = "(" + coefficient + ")";
                    term = coefficient + "*" + monomial;
                }
            }
            if (first) {
                builder.append(term);
                first = false;
            } else if (term.startsWith("-")) {
                builder.append(" - ").append(term.substring(1));
            } else {
                builder.append(" + ").append(term);
            }
        }
        return builder.toString();
    }
}
