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

package org.ideals.lib;

/**
 * Answer to a question that may not be decidable.
 */
public enum Ternary {
    Yes,
    No,
    Maybe;

    public static Ternary of(boolean value) {
        return value ? Yes : No;
    }

    public boolean isKnown() {
        return this != Maybe;
    }

    /**
     * Convert to a boolean.
     * @param question  Description of the question, used in the exception message.
     * @throws UnsupportedOperationException if the answer is not known.
     */
    public boolean toBoolean(String question) {
        switch (this) {
            case Yes:
                return true;
            case No:
                return false;
            default:
                throw new UnsupportedOperationException("Not implemented: " + question);
        }
    }
}
