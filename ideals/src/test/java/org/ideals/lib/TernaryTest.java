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

import org.junit.Assert;
import org.junit.Test;

public class TernaryTest {
    @Test
    public void conversionTest() {
        Assert.assertEquals(Ternary.Yes, Ternary.of(true));
        Assert.assertEquals(Ternary.No, Ternary.of(false));
        Assert.assertTrue(Ternary.Yes.toBoolean("q"));
        Assert.assertFalse(Ternary.No.toBoolean("q"));
        Assert.assertTrue(Ternary.No.isKnown());
        Assert.assertFalse(Ternary.Maybe.isKnown());
    }

    @Test
    public void unknownTest() {
        try {
            Ternary.Maybe.toBoolean("is (x, y) prime");
            Assert.fail();
        } catch (UnsupportedOperationException ex) {
            Assert.assertEquals("Not implemented: is (x, y) prime", ex.getMessage());
        }
    }
}
