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

import java.util.List;

/**
 * A service that knows how to build standard systems of polynomials by name.
 */
public interface NamedConstructionBackend {
    /**
     * Evaluate a named construction.
     * @param name           Name of the construction, e.g., "cyclic" or "katsura".
     * @param ring           Ring of the result; the first variableCount variables are used.
     * @param variableCount  Number of variables of the construction.
     * @param homogeneous    If true the polynomials are homogenized with variable variableCount - 1.
     * @return  The generators of the ideal.
     */
    <C> List<Polynomial<C>> evaluateNamedConstruction(
            String name, PolynomialRing<C> ring, int variableCount, boolean homogeneous);
}
