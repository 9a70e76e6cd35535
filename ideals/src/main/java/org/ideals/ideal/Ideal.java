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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.ideals.algebraic.CoercionException;
import org.ideals.algebraic.Ring;
import org.ideals.lib.Linq;
import org.ideals.lib.Ternary;

import java.util.ArrayList;
import java.util.List;

/**
 * An ideal of a commutative ring, represented by a finite list of generators.
 * Ideals are immutable; the arithmetic operations build new ideals through {@link Ideals},
 * so results are classified again.
 *
 * <p>The subclasses form a closed hierarchy, enumerated by {@link IdealKind}.
 * The implementations in this class are the generic ones; questions that cannot
 * be answered generically return {@link Ternary#Maybe}.
 * @param <T>  Type of ring elements.
 */
public abstract class Ideal<T> implements Comparable<Ideal<T>> {
    final Ring<T> ring;
    /**
     * Never empty, no duplicates.  The zero ideal is generated by zero.
     */
    final ImmutableList<T> gens;

    Ideal(Ring<T> ring, List<T> gens) {
        Preconditions.checkArgument(!gens.isEmpty(), "An ideal needs at least one generator");
        this.ring = ring;
        this.gens = ImmutableList.copyOf(gens);
    }

    public abstract IdealKind kind();

    /**
     * The ring in which this ideal is contained.
     */
    public Ring<T> ring() {
        return this.ring;
    }

    public Ring<?> baseRing() {
        return this.ring.baseRing();
    }

    /**
     * The generators, usually the ones provided when the ideal was created.
     */
    public ImmutableList<T> gens() {
        return this.gens;
    }

    /**
     * Same as gens(): there is no specialized algorithm to reduce generators.
     */
    public ImmutableList<T> gensReduced() {
        return this.gens();
    }

    public int ngens() {
        return this.gens.size();
    }

    public T gen(int index) {
        return this.gens.get(index);
    }

    /**
     * Check whether a value belongs to this ideal.
     * @param value  Value to check; it is first coerced into the ring.
     * @return  No if the value is not in the ring, Maybe if membership cannot be decided.
     */
    public Ternary contains(Object value) {
        T element;
        try {
            element = this.ring.coerce(value);
        } catch (CoercionException ex) {
            return Ternary.No;
        }
        return this.containsElement(element);
    }

    /**
     * Like contains, but fails when membership cannot be decided.
     * @throws UnsupportedOperationException if membership is not implemented for this ideal.
     */
    public boolean containsOrThrow(Object value) {
        return this.contains(value).toBoolean("membership test for " + this);
    }

    /**
     * Membership test for a value already in the ring.
     */
    Ternary containsElement(T value) {
        return Ternary.Maybe;
    }

    /**
     * An element of the ring equivalent to f modulo this ideal.
     * Generically this is f itself.
     */
    public T reduce(T f) {
        return f;
    }

    public Ternary isPrincipal() {
        if (this.gens.size() <= 1)
            return Ternary.Yes;
        return Ternary.Maybe;
    }

    /**
     * True if the only generator is zero.
     */
    public boolean isZero() {
        return this.gens.size() == 1 && this.ring.isZero(this.gens.get(0));
    }

    /**
     * Yes for the zero ideal and for principal ideals generated by a unit.
     */
    public Ternary isTrivial() {
        if (this.isZero())
            return Ternary.Yes;
        if (this.isPrincipal() == Ternary.Yes)
            return Ternary.of(this.ring.isUnit(this.gens.get(0)));
        return Ternary.Maybe;
    }

    public Ternary isMaximal() {
        return Ternary.Maybe;
    }

    public Ternary isPrime() {
        return Ternary.Maybe;
    }

    /**
     * Convert a value to an ideal of this ring.
     * @param other  An ideal or something that can generate one.
     */
    Ideal<T> asIdeal(Object other) {
        if (other instanceof Ideal) {
            Ideal<?> ideal = (Ideal<?>)other;
            if (ideal.ring.equals(this.ring)) {
                @SuppressWarnings("unchecked")
                Ideal<T> result = (Ideal<T>)ideal;
                return result;
            }
        }
        return Ideals.ideal(this.ring, other, true);
    }

    /**
     * The ideal generated by the generators of both ideals.
     */
    public Ideal<T> plus(Ideal<T> other) {
        List<Object> all = new ArrayList<Object>(this.gens);
        all.addAll(other.gens);
        return Ideals.ideal(this.ring, all, true);
    }

    public Ideal<T> plus(Object other) {
        return this.plus(this.asIdeal(other));
    }

    /**
     * The ideal generated by all products of generators.
     */
    public Ideal<T> times(Ideal<T> other) {
        List<T> otherGens = Linq.map(other.gens, this.ring::coerce);
        return Ideals.ideal(this.ring, Linq.product(this.gens, otherGens, this.ring::times), true);
    }

    public Ideal<T> times(Object other) {
        return this.times(this.asIdeal(other));
    }

    boolean sameGeneratorSet(Ideal<T> other) {
        return Linq.all(this.gens, g -> Linq.any(other.gens, h -> this.ring.equal(g, h))) &&
                Linq.all(other.gens, g -> Linq.any(this.gens, h -> this.ring.equal(g, h)));
    }

    List<T> sortedGens() {
        List<T> result = new ArrayList<T>(this.gens);
        result.sort(this.ring::compare);
        return result;
    }

    /**
     * Ideals known to be principal sort before all other ideals; among them the zero
     * ideal sorts first and generators that are associates compare equal.
     * Non-associate principal ideals are ordered by the canonical associates of their
     * generators instead of always ranking the receiver greater, which keeps the order
     * antisymmetric; it does not reflect inclusion.
     * Other ideals compare equal when their generator sets coincide, and otherwise by
     * their sorted generator lists.
     */
    @Override
    public int compareTo(Ideal<T> other) {
        if (!this.ring.equals(other.ring))
            return this.ring.toString().compareTo(other.ring.toString());
        boolean principal = this.isPrincipal() == Ternary.Yes;
        boolean otherPrincipal = other.isPrincipal() == Ternary.Yes;
        if (principal && otherPrincipal)
            return this.comparePrincipal(other);
        if (principal)
            return -1;
        if (otherPrincipal)
            return 1;
        if (this.sameGeneratorSet(other))
            return 0;
        List<T> left = this.sortedGens();
        List<T> right = other.sortedGens();
        for (int i = 0; i < left.size() && i < right.size(); i++) {
            int compare = this.ring.compare(left.get(i), right.get(i));
            if (compare != 0)
                return compare;
        }
        return Integer.compare(left.size(), right.size());
    }

    int comparePrincipal(Ideal<T> other) {
        T g = this.gen(0);
        T h = this.ring.coerce(other.gen(0));
        if (this.ring.isZero(g))
            return this.ring.isZero(h) ? 0 : -1;
        if (this.ring.isZero(h))
            return 1;
        if (this.ring.divides(g, h) && this.ring.divides(h, g))
            return 0;
        int compare = this.ring.compare(this.ring.canonicalAssociate(g), this.ring.canonicalAssociate(h));
        return compare != 0 ? compare : 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ideal)) return false;
        Ideal<?> that = (Ideal<?>) o;
        if (!this.ring.equals(that.ring))
            return false;
        @SuppressWarnings("unchecked")
        Ideal<T> other = (Ideal<T>)that;
        return this.compareTo(other) == 0;
    }

    /**
     * Independent of the order of generators; for principal ideals only the
     * canonical associate of the generator matters.
     */
    @Override
    public int hashCode() {
        if (this.isPrincipal() == Ternary.Yes)
            return 31 * this.ring.hashCode() + this.ring.canonicalAssociate(this.gen(0)).hashCode();
        int result = 0;
        for (T g : this.gens)
            result += g.hashCode();
        return 31 * this.ring.hashCode() + result;
    }

    String shortString() {
        return "(" + Linq.join(", ", this.gens) + ")";
    }

    @Override
    public String toString() {
        return "Ideal " + this.shortString() + " of " + this.ring;
    }
}
