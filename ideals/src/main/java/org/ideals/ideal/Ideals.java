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
import org.ideals.algebraic.PrincipalIdealDomain;
import org.ideals.algebraic.Ring;
import org.ideals.algebraic.RingTypeException;
import org.ideals.rings.StandardParents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Creates ideals, choosing the representation from the properties of the ring:
 * ideals of a principal ideal domain are reduced to a single generator with gcd,
 * ideals with a single generator are principal, all others are generic.
 */
public class Ideals {
    private static final Logger logger = LoggerFactory.getLogger(Ideals.class);

    /**
     * When set the factory verifies that the generator of an ideal of a principal
     * ideal domain divides all the generators it was computed from.
     */
    public static boolean safetyChecks =
            Boolean.parseBoolean(System.getProperty("ideals.safetyChecks", "true"));

    private Ideals() {}

    /**
     * The ideal generated by some values, coerced into the ring.
     * A single argument that is a collection or an ideal supplies the generators;
     * no arguments produce the zero ideal.
     */
    public static <T> Ideal<T> ideal(Ring<T> ring, Object... generators) {
        if (generators.length == 1)
            return ideal(ring, generators[0], true);
        return ideal(ring, Arrays.asList(generators), true);
    }

    /**
     * The ideal of a ring generated by some values.
     * @param ring        A commutative ring.
     * @param generators  A collection, an array, an ideal, or a single value.
     * @param coerce      Whether the generators need to be coerced into the ring.
     * @throws RingTypeException if the ring is not commutative or a generator does not belong to it.
     */
    public static <T> Ideal<T> ideal(Ring<T> ring, Object generators, boolean coerce) {
        if (!ring.isCommutative())
            throw new RingTypeException(ring + " must be a commutative ring");
        ImmutableList<T> gens = GeneratorNormalizer.normalize(ring, generators, coerce);
        return classify(ring, gens);
    }

    /**
     * Create an ideal from a single argument, using the standard parent rings.
     * @see #ideal(Object, ParentResolver)
     */
    public static Ideal<?> ideal(Object input) {
        return ideal(input, StandardParents.instance);
    }

    /**
     * Create an ideal from a single argument: an ideal (derived again from its ring and
     * generators), a ring (its zero ideal), a non-empty collection of elements (the ideal
     * they generate in their common parent ring), or a single element.
     * @throws RingTypeException if the input is none of these.
     */
    public static Ideal<?> ideal(Object input, ParentResolver resolver) {
        IdealInput classified = IdealInput.classify(input, resolver);
        logger.debug("Ideal input classified as {}", classified.shape);
        switch (classified.shape) {
            case IDEAL:
            case RING:
            case ELEMENT_LIST:
            case SINGLE_ELEMENT:
                assert classified.ring != null;
                return ideal(classified.ring, classified.generators, true);
            case INVALID:
            default:
                throw new RingTypeException(String.valueOf(classified.error));
        }
    }

    /**
     * A fractional ideal; it is never reclassified.
     */
    public static <T> FractionalIdeal<T> fractionalIdeal(Ring<T> ring, Object... generators) {
        Object raw = generators.length == 1 ? generators[0] : Arrays.asList(generators);
        return new FractionalIdeal<T>(ring, GeneratorNormalizer.normalize(ring, raw, true));
    }

    public static boolean isIdeal(Object value) {
        return value instanceof Ideal;
    }

    static <T> Ideal<T> classify(Ring<T> ring, List<T> gens) {
        PrincipalIdealDomain<T> domain = ring.asPrincipalIdealDomain();
        if (domain != null) {
            T g = gens.get(0);
            for (T h : gens.subList(1, gens.size()))
                g = domain.gcd(g, h);
            if (safetyChecks) {
                for (T h : gens) {
                    if (!ring.divides(g, h))
                        throw new IllegalStateException("gcd " + g + " does not divide " + h + " in " + ring);
                }
            }
            logger.debug("Reduced {} generators to {} in principal ideal domain {}", gens.size(), g, ring);
            return new PidIdeal<T>(ring, domain, g);
        }
        if (gens.size() == 1) {
            logger.debug("Principal ideal ({}) of {}", gens.get(0), ring);
            return new PrincipalIdeal<T>(ring, gens.get(0));
        }
        logger.debug("Generic ideal with {} generators of {}", gens.size(), ring);
        return new GenericIdeal<T>(ring, gens);
    }
}
