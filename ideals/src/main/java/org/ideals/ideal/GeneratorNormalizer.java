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
import org.ideals.algebraic.CoercionException;
import org.ideals.algebraic.Ring;
import org.ideals.lib.Linq;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Turns the raw generators supplied by a caller into a list of distinct ring elements.
 */
public class GeneratorNormalizer {
    private GeneratorNormalizer() {}

    /**
     * Normalize generators.
     * @param ring    Ring the generators belong to.
     * @param raw     A collection, an array, an ideal, or a single value.
     *                A single value is always coerced.  An empty collection stands for zero.
     * @param coerce  If true every value is coerced into the ring.  Otherwise every value
     *                must already be an element of the ring.
     * @return  A non-empty list without duplicates, in order of first occurrence.
     * @throws CoercionException if some value does not belong to the ring.
     */
    public static <T> ImmutableList<T> normalize(Ring<T> ring, Object raw, boolean coerce) {
        List<?> values;
        if (raw instanceof Ideal) {
            values = ((Ideal<?>)raw).gens();
        } else if (raw instanceof Collection) {
            values = new ArrayList<Object>((Collection<?>)raw);
        } else if (raw instanceof Object[]) {
            values = Arrays.asList((Object[])raw);
        } else {
            values = Collections.singletonList(raw);
            coerce = true;
        }
        if (values.isEmpty())
            return ImmutableList.of(ring.zero());

        List<T> result = new ArrayList<T>(values.size());
        for (Object value : values) {
            T element = convert(ring, value, coerce);
            if (!Linq.any(result, e -> ring.equal(e, element)))
                result.add(element);
        }
        return ImmutableList.copyOf(result);
    }

    static <T> T convert(Ring<T> ring, Object value, boolean coerce) {
        T element = ring.coerce(value);
        if (!coerce && !element.equals(value))
            throw new CoercionException(value + " is not an element of " + ring);
        return element;
    }
}
