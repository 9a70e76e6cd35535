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
import com.google.common.collect.ImmutableList;
import org.ideals.algebraic.Field;
import org.ideals.algebraic.PrincipalIdealDomain;
import org.ideals.algebraic.QuoRem;
import org.ideals.algebraic.Ring;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A ring of polynomials in named variables over a coefficient ring.
 * The coefficient ring is expected to be an integral domain.
 * A univariate polynomial ring over a field is a principal ideal domain.
 * @param <C>  Type of coefficients.
 */
public class PolynomialRing<C> implements Ring<Polynomial<C>> {
    final Ring<C> base;
    final ImmutableList<String> variables;
    @Nullable
    final PrincipalIdealDomain<Polynomial<C>> domain;

    @SuppressWarnings("unchecked")
    public PolynomialRing(Ring<C> base, List<String> variables) {
        Preconditions.checkArgument(!variables.isEmpty(), "A polynomial ring needs variables");
        Preconditions.checkArgument(variables.stream().distinct().count() == variables.size(),
                "Duplicate variable names in %s", variables);
        this.base = base;
        this.variables = ImmutableList.copyOf(variables);
        if (variables.size() == 1 && base instanceof Field)
            this.domain = new UnivariateDomain((Field<C>)base);
        else
            this.domain = null;
    }

    public PolynomialRing(Ring<C> base, String... variables) {
        this(base, Arrays.asList(variables));
    }

    public List<String> variableNames() {
        return this.variables;
    }

    public int ngens() {
        return this.variables.size();
    }

    /**
     * Build a polynomial from its terms; zero coefficients are dropped.
     */
    public Polynomial<C> polynomial(Map<Monomial, C> terms) {
        Map<Monomial, C> clean = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, C> e : terms.entrySet()) {
            Preconditions.checkArgument(e.getKey().size() == this.ngens(),
                    "Monomial %s has the wrong number of variables", e.getKey());
            if (!this.base.isZero(e.getValue()))
                clean.put(e.getKey(), e.getValue());
        }
        return new Polynomial<C>(this, clean);
    }

    public Polynomial<C> term(C coefficient, Monomial monomial) {
        Map<Monomial, C> terms = new HashMap<Monomial, C>();
        terms.put(monomial, coefficient);
        return this.polynomial(terms);
    }

    public Polynomial<C> constant(C value) {
        return this.term(value, Monomial.one(this.ngens()));
    }

    public Polynomial<C> variable(int index) {
        return this.term(this.base.one(), Monomial.variable(this.ngens(), index, 1));
    }

    public Polynomial<C> variable(String name) {
        int index = this.variables.indexOf(name);
        Preconditions.checkArgument(index >= 0, "No variable %s in %s", name, this);
        return this.variable(index);
    }

    @Override
    public List<Polynomial<C>> gens() {
        ImmutableList.Builder<Polynomial<C>> builder = ImmutableList.builder();
        for (int i = 0; i < this.ngens(); i++)
            builder.add(this.variable(i));
        return builder.build();
    }

    @Override
    public Ring<C> baseRing() {
        return this.base;
    }

    @Override
    public Polynomial<C> add(Polynomial<C> left, Polynomial<C> right) {
        Map<Monomial, C> result = new HashMap<Monomial, C>(left.terms);
        for (Map.Entry<Monomial, C> e : right.terms.entrySet())
            result.merge(e.getKey(), e.getValue(), this.base::add);
        return this.polynomial(result);
    }

    @Override
    public Polynomial<C> negate(Polynomial<C> data) {
        Map<Monomial, C> result = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, C> e : data.terms.entrySet())
            result.put(e.getKey(), this.base.negate(e.getValue()));
        return this.polynomial(result);
    }

    @Override
    public Polynomial<C> zero() {
        return new Polynomial<C>(this, new HashMap<Monomial, C>());
    }

    @Override
    public boolean isZero(Polynomial<C> value) {
        return value.isZero();
    }

    @Override
    public Polynomial<C> times(Polynomial<C> left, Polynomial<C> right) {
        Map<Monomial, C> result = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, C> l : left.terms.entrySet())
            for (Map.Entry<Monomial, C> r : right.terms.entrySet())
                result.merge(l.getKey().times(r.getKey()),
                        this.base.times(l.getValue(), r.getValue()), this.base::add);
        return this.polynomial(result);
    }

    /**
     * Multiply a polynomial by a single term.
     */
    Polynomial<C> times(Polynomial<C> value, C coefficient, Monomial monomial) {
        Map<Monomial, C> result = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, C> e : value.terms.entrySet())
            result.put(e.getKey().times(monomial), this.base.times(e.getValue(), coefficient));
        return this.polynomial(result);
    }

    @Override
    public Polynomial<C> one() {
        return this.constant(this.base.one());
    }

    @Override
    public boolean equal(Polynomial<C> left, Polynomial<C> right) {
        return left.equals(right);
    }

    @Override
    public boolean isUnit(Polynomial<C> value) {
        return !value.isZero() && value.isConstant() && this.base.isUnit(value.leadingCoefficient());
    }

    /**
     * Exact division by repeatedly cancelling leading terms.
     */
    @Nullable
    @Override
    public Polynomial<C> divide(Polynomial<C> dividend, Polynomial<C> divisor) {
        if (divisor.isZero())
            return dividend.isZero() ? this.zero() : null;
        Polynomial<C> remainder = dividend;
        Polynomial<C> quotient = this.zero();
        while (!remainder.isZero()) {
            Monomial m = remainder.leadingMonomial().divide(divisor.leadingMonomial());
            if (m == null)
                return null;
            C c = this.base.divide(remainder.leadingCoefficient(), divisor.leadingCoefficient());
            if (c == null)
                return null;
            quotient = this.add(quotient, this.term(c, m));
            remainder = this.subtract(remainder, this.times(divisor, c, m));
        }
        return quotient;
    }

    /**
     * Accepts polynomials of this ring, polynomials over a subset of the variables
     * whose coefficients coerce into the coefficient ring, and anything the
     * coefficient ring accepts.
     */
    @Override
    public Polynomial<C> coerce(Object value) {
        if (value instanceof Polynomial) {
            Polynomial<?> p = (Polynomial<?>)value;
            if (p.ring.equals(this)) {
                @SuppressWarnings("unchecked")
                Polynomial<C> result = (Polynomial<C>)p;
                return result;
            }
            if (this.variables.containsAll(p.ring.variables))
                return this.rename(p);
        }
        return this.constant(this.base.coerce(value));
    }

    private Polynomial<C> rename(Polynomial<?> p) {
        int[] position = new int[p.ring.ngens()];
        for (int i = 0; i < position.length; i++)
            position[i] = this.variables.indexOf(p.ring.variables.get(i));
        Map<Monomial, C> result = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, ?> e : p.terms.entrySet()) {
            int[] exponents = new int[this.ngens()];
            for (int i = 0; i < position.length; i++)
                exponents[position[i]] = e.getKey().exponent(i);
            result.merge(new Monomial(exponents), this.base.coerce(e.getValue()), this.base::add);
        }
        return this.polynomial(result);
    }

    /**
     * Compare term by term starting with the leading terms.
     */
    @Override
    public int compare(Polynomial<C> left, Polynomial<C> right) {
        Iterator<Map.Entry<Monomial, C>> li = left.terms.entrySet().iterator();
        Iterator<Map.Entry<Monomial, C>> ri = right.terms.entrySet().iterator();
        while (li.hasNext() && ri.hasNext()) {
            Map.Entry<Monomial, C> l = li.next();
            Map.Entry<Monomial, C> r = ri.next();
            int compare = l.getKey().compareTo(r.getKey());
            if (compare != 0)
                return compare;
            compare = this.base.compare(l.getValue(), r.getValue());
            if (compare != 0)
                return compare;
        }
        return Integer.compare(left.terms.size(), right.terms.size());
    }

    /**
     * The units are the units of the coefficient ring, so the leading coefficient decides.
     */
    @Override
    public Polynomial<C> normalizingUnit(Polynomial<C> value) {
        if (value.isZero())
            return this.one();
        return this.constant(this.base.normalizingUnit(value.leadingCoefficient()));
    }

    @Nullable
    @Override
    public BigInteger order() {
        return null;
    }

    @Nullable
    @Override
    public PrincipalIdealDomain<Polynomial<C>> asPrincipalIdealDomain() {
        return this.domain;
    }

    /**
     * Multiply every term by a power of a variable so that all terms have the total degree of value.
     * @param value     Polynomial to homogenize.
     * @param variable  Index of the homogenizing variable.
     */
    public Polynomial<C> homogenize(Polynomial<C> value, int variable) {
        Preconditions.checkElementIndex(variable, this.ngens());
        int degree = value.degree();
        Map<Monomial, C> result = new HashMap<Monomial, C>();
        for (Map.Entry<Monomial, C> e : value.terms.entrySet()) {
            Monomial padding = Monomial.variable(this.ngens(), variable, degree - e.getKey().degree());
            result.merge(e.getKey().times(padding), e.getValue(), this.base::add);
        }
        return this.polynomial(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PolynomialRing<?> that = (PolynomialRing<?>) o;
        return this.base.equals(that.base) && this.variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.base, this.variables);
    }

    @Override
    public String toString() {
        if (this.ngens() == 1)
            return "Univariate Polynomial Ring in " + this.variables.get(0) + " over " + this.base;
        return "Multivariate Polynomial Ring in " + String.join(", ", this.variables) + " over " + this.base;
    }

    /**
     * Euclidean operations of a univariate polynomial ring over a field.
     */
    class UnivariateDomain implements PrincipalIdealDomain<Polynomial<C>> {
        final Field<C> field;

        UnivariateDomain(Field<C> field) {
            this.field = field;
        }

        @Override
        public QuoRem<Polynomial<C>> quoRem(Polynomial<C> dividend, Polynomial<C> divisor) {
            if (divisor.isZero())
                throw new ArithmeticException("Division by zero polynomial");
            PolynomialRing<C> ring = PolynomialRing.this;
            C inverse = this.field.inverse(divisor.leadingCoefficient());
            Polynomial<C> quotient = ring.zero();
            Polynomial<C> remainder = dividend;
            while (!remainder.isZero()) {
                Monomial m = remainder.leadingMonomial().divide(divisor.leadingMonomial());
                if (m == null)
                    break;
                C c = this.field.times(remainder.leadingCoefficient(), inverse);
                quotient = ring.add(quotient, ring.term(c, m));
                remainder = ring.subtract(remainder, ring.times(divisor, c, m));
            }
            return new QuoRem<Polynomial<C>>(quotient, remainder);
        }

        /**
         * The result is monic, or zero.
         */
        @Override
        public Polynomial<C> gcd(Polynomial<C> left, Polynomial<C> right) {
            Polynomial<C> a = left;
            Polynomial<C> b = right;
            while (!b.isZero()) {
                Polynomial<C> r = this.quoRem(a, b).remainder;
                a = b;
                b = r;
            }
            return PolynomialRing.this.canonicalAssociate(a);
        }
    }
}
