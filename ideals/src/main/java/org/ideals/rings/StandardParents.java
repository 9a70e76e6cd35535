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
import org.ideals.algebraic.Element;
import org.ideals.algebraic.ParentResolver;
import org.ideals.algebraic.Ring;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Java integers belong to the integer ring; {@link Element} values know their parent.
 */
public class StandardParents implements ParentResolver {
    private StandardParents() {}

    public static final StandardParents instance = new StandardParents();

    @Nullable
    @Override
    public Ring<?> parentOf(Object value) {
        if (value instanceof Element)
            return ((Element<?>)value).parent();
        if (IntegerRing.isIntegral(value))
            return IntegerRing.instance;
        return null;
    }

    /**
     * The first parent, in order of appearance, that accepts every value.
     */
    @Nullable
    @Override
    public Ring<?> commonParent(List<?> values) {
        List<Ring<?>> candidates = new ArrayList<Ring<?>>();
        for (Object value : values) {
            Ring<?> parent = this.parentOf(value);
            if (parent == null)
                return null;
            if (!candidates.contains(parent))
                candidates.add(parent);
        }
        for (Ring<?> candidate : candidates) {
            if (acceptsAll(candidate, values))
                return candidate;
        }
        return null;
    }

    static boolean acceptsAll(Ring<?> ring, List<?> values) {
        for (Object value : values) {
            try {
                ring.coerce(value);
            } catch (CoercionException ex) {
                return false;
            }
        }
        return true;
    }
}
