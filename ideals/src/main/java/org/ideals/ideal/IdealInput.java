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
import org.ideals.algebraic.ParentResolver;
import org.ideals.algebraic.Ring;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * The shape of the single argument given to {@link Ideals#ideal(Object)},
 * decided before any ring-specific work is done.
 */
public class IdealInput {
    public enum Shape {
        /** An existing ideal, to be derived again from its ring and generators. */
        IDEAL,
        /** A ring alone; stands for its zero ideal. */
        RING,
        /** A non-empty list of elements with a common parent ring. */
        ELEMENT_LIST,
        /** A single element with a parent ring. */
        SINGLE_ELEMENT,
        INVALID
    }

    static final String NOT_AN_ELEMENT = "ring must be a ring, list, or element";

    public final Shape shape;
    @Nullable
    public final Ring<?> ring;
    public final ImmutableList<Object> generators;
    @Nullable
    public final String error;

    private IdealInput(Shape shape, @Nullable Ring<?> ring, List<?> generators, @Nullable String error) {
        this.shape = shape;
        this.ring = ring;
        this.generators = ImmutableList.copyOf(generators);
        this.error = error;
    }

    static IdealInput invalid(String error) {
        return new IdealInput(Shape.INVALID, null, ImmutableList.of(), error);
    }

    public static IdealInput classify(@Nullable Object input, ParentResolver resolver) {
        if (input instanceof Ideal) {
            Ideal<?> ideal = (Ideal<?>)input;
            return new IdealInput(Shape.IDEAL, ideal.ring(), ideal.gens(), null);
        }
        if (input instanceof Ring)
            return new IdealInput(Shape.RING, (Ring<?>)input, ImmutableList.of(), null);
        List<Object> values = null;
        if (input instanceof Collection)
            values = new ArrayList<Object>((Collection<?>)input);
        else if (input instanceof Object[])
            values = Arrays.asList((Object[])input);
        if (values != null && !values.isEmpty()) {
            if (values.contains(null))
                return invalid(NOT_AN_ELEMENT);
            Ring<?> parent = resolver.commonParent(values);
            if (parent == null)
                return invalid("unable to find common ring into which all ideal generators map");
            return new IdealInput(Shape.ELEMENT_LIST, parent, values, null);
        }
        Ring<?> parent = values != null || input == null ? null : resolver.parentOf(input);
        if (parent == null)
            return invalid(NOT_AN_ELEMENT);
        return new IdealInput(Shape.SINGLE_ELEMENT, parent, ImmutableList.of(input), null);
    }

    @Override
    public String toString() {
        return this.shape + (this.error != null ? ": " + this.error : " " + this.generators);
    }
}
