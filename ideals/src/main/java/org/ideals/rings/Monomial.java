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

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * A power product of variables, stored as a vector of exponents.
 * Monomials are ordered lexicographically, the first variable being the most significant.
 */
public final class Monomial implements Comparable<Monomial> {
    final int[] exponents;

    public Monomial(int... exponents) {
        for (int e : exponents)
            Preconditions.checkArgument(e >= 0, "Negative exponent in %s", Arrays.toString(exponents));
        this.exponents = exponents.clone();
    }

    public static Monomial one(int variables) {
        return new Monomial(new int[variables]);
    }

    public static Monomial variable(int variables, int index, int exponent) {
        int[] e = new int[variables];
        e[index] = exponent;
        return new Monomial(e);
    }

    public int size() {
        return this.exponents.length;
    }

    public int exponent(int index) {
        return this.exponents[index];
    }

    public int degree() {
        int result = 0;
        for (int e : this.exponents)
            result = Math.addExact(result, e);
        return result;
    }

    public boolean isOne() {
        for (int e : this.exponents)
            if (e != 0)
                return false;
        return true;
    }

    public Monomial times(Monomial other) {
        Preconditions.checkArgument(this.size() == other.size());
        int[] e = new int[this.size()];
        for (int i = 0; i < e.length; i++)
            e[i] = Math.addExact(this.exponents[i], other.exponents[i]);
        return new Monomial(e);
    }

    /**
     * @return  this / other, or null if other does not divide this.
     */
    @Nullable
    public Monomial divide(Monomial other) {
        Preconditions.checkArgument(this.size() == other.size());
        int[] e = new int[this.size()];
        for (int i = 0; i < e.length; i++) {
            e[i] = this.exponents[i] - other.exponents[i];
            if (e[i] < 0)
                return null;
        }
        return new Monomial(e);
    }

    @Override
    public int compareTo(Monomial o) {
        for (int i = 0; i < this.exponents.length && i < o.exponents.length; i++) {
            int compare = Integer.compare(this.exponents[i], o.exponents[i]);
            if (compare != 0)
                return compare;
        }
        return Integer.compare(this.exponents.length, o.exponents.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(this.exponents, ((Monomial) o).exponents);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.exponents);
    }

    /**
     * Render using the given variable names, e.g., x^2*y.
     */
    public String toString(List<String> variables) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < this.exponents.length; i++) {
            if (this.exponents[i] == 0)
                continue;
            if (builder.length() > 0)
                builder.append("*");
            builder.append(variables.get(i));
            if (this.exponents[i] > 1)
                builder.append("^").append(this.exponents[i]);
        }
        if (builder.length() == 0)
            return "1";
        return builder.toString();
    }

    @Override
    public String toString() {
        return Arrays.toString(this.exponents);
    }
}
