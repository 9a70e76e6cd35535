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

package org.ideals.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ideals.algebraic.Ring;
import org.ideals.ideal.Ideal;
import org.ideals.ideal.IdealKind;
import org.ideals.ideal.Ideals;
import org.ideals.rings.IntegerRing;
import org.ideals.rings.ModularInteger;
import org.ideals.rings.Monomial;
import org.ideals.rings.Polynomial;
import org.ideals.rings.PolynomialRing;
import org.ideals.rings.PrimeField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes ideals over the standard rings as JSON documents.
 * Decoding builds the ideal again through {@link Ideals}, so the result is
 * equal to the ideal that was encoded.
 */
public class IdealCodec {
    private static final Logger logger = LoggerFactory.getLogger(IdealCodec.class);

    static final String INTEGERS = "integers";
    static final String PRIME_FIELD = "prime-field";
    static final String POLYNOMIAL = "polynomial";

    final ObjectMapper mapper;

    public IdealCodec() {
        this.mapper = new ObjectMapper();
    }

    public String toJson(Ideal<?> ideal) {
        ObjectNode node = this.encode(ideal);
        try {
            return this.mapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
    }

    public Ideal<?> fromJson(String json) {
        JsonNode node;
        try {
            node = this.mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed ideal document", ex);
        }
        return this.decode(node);
    }

    public ObjectNode encode(Ideal<?> ideal) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("kind", ideal.kind().name());
        result.set("ring", this.encodeRing(ideal.ring()));
        ArrayNode gens = result.putArray("gens");
        for (Object g : ideal.gens())
            gens.add(this.encodeElement(ideal.ring(), g));
        logger.debug("Encoded {}", ideal);
        return result;
    }

    public Ideal<?> decode(JsonNode node) {
        String kindName = required(node, "kind").asText();
        IdealKind kind;
        try {
            kind = IdealKind.valueOf(kindName);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown ideal kind " + kindName, ex);
        }
        Ring<?> ring = this.decodeRing(required(node, "ring"));
        List<Object> gens = new ArrayList<Object>();
        for (JsonNode g : required(node, "gens"))
            gens.add(this.decodeElement(ring, g));
        logger.debug("Decoding {} ideal with {} generators", kind, gens.size());
        switch (kind) {
            case FRACTIONAL:
                return Ideals.fractionalIdeal(ring, gens);
            case GENERIC:
            case PRINCIPAL:
            case PID:
                return Ideals.ideal(ring, gens, true);
            default:
                throw new IllegalArgumentException("Unexpected kind " + kind);
        }
    }

    static JsonNode required(JsonNode node, String field) {
        JsonNode result = node.get(field);
        if (result == null)
            throw new IllegalArgumentException("Missing field " + field + " in " + node);
        return result;
    }

    public ObjectNode encodeRing(Ring<?> ring) {
        ObjectNode result = this.mapper.createObjectNode();
        if (ring instanceof IntegerRing) {
            result.put("type", INTEGERS);
        } else if (ring instanceof PrimeField) {
            result.put("type", PRIME_FIELD);
            result.put("characteristic", ((PrimeField)ring).characteristic().toString());
        } else if (ring instanceof PolynomialRing) {
            PolynomialRing<?> p = (PolynomialRing<?>)ring;
            result.put("type", POLYNOMIAL);
            ArrayNode variables = result.putArray("variables");
            for (String v : p.variableNames())
                variables.add(v);
            result.set("base", this.encodeRing(p.baseRing()));
        } else {
            throw new IllegalArgumentException("Cannot encode ring " + ring);
        }
        return result;
    }

    public Ring<?> decodeRing(JsonNode node) {
        String type = required(node, "type").asText();
        switch (type) {
            case INTEGERS:
                return IntegerRing.instance;
            case PRIME_FIELD:
                return new PrimeField(new BigInteger(required(node, "characteristic").asText()));
            case POLYNOMIAL: {
                List<String> variables = new ArrayList<String>();
                for (JsonNode v : required(node, "variables"))
                    variables.add(v.asText());
                Ring<?> base = this.decodeRing(required(node, "base"));
                return polynomialRing(base, variables);
            }
            default:
                throw new IllegalArgumentException("Unknown ring type " + type);
        }
    }

    static <C> PolynomialRing<C> polynomialRing(Ring<C> base, List<String> variables) {
        return new PolynomialRing<C>(base, variables);
    }

    JsonNode encodeElement(Ring<?> ring, Object value) {
        if (ring instanceof IntegerRing)
            return this.mapper.getNodeFactory().textNode(value.toString());
        if (ring instanceof PrimeField)
            return this.mapper.getNodeFactory().textNode(((ModularInteger)value).value().toString());
        if (ring instanceof PolynomialRing) {
            PolynomialRing<?> p = (PolynomialRing<?>)ring;
            ArrayNode terms = this.mapper.createArrayNode();
            for (Map.Entry<Monomial, ?> e : ((Polynomial<?>)value).terms().entrySet()) {
                ObjectNode term = terms.addObject();
                ArrayNode exponents = term.putArray("exponents");
                for (int i = 0; i < e.getKey().size(); i++)
                    exponents.add(e.getKey().exponent(i));
                term.set("coefficient", this.encodeElement(p.baseRing(), e.getValue()));
            }
            return terms;
        }
        throw new IllegalArgumentException("Cannot encode elements of " + ring);
    }

    Object decodeElement(Ring<?> ring, JsonNode node) {
        if (ring instanceof IntegerRing)
            return new BigInteger(node.asText());
        if (ring instanceof PrimeField)
            return ((PrimeField)ring).element(new BigInteger(node.asText()));
        if (ring instanceof PolynomialRing)
            return this.decodePolynomial((PolynomialRing<?>)ring, node);
        throw new IllegalArgumentException("Cannot decode elements of " + ring);
    }

    <C> Polynomial<C> decodePolynomial(PolynomialRing<C> ring, JsonNode node) {
        Map<Monomial, C> terms = new HashMap<Monomial, C>();
        for (JsonNode term : node) {
            JsonNode exponents = required(term, "exponents");
            int[] e = new int[exponents.size()];
            for (int i = 0; i < e.length; i++)
                e[i] = exponents.get(i).asInt();
            Object coefficient = this.decodeElement(ring.baseRing(), required(term, "coefficient"));
            terms.put(new Monomial(e), ring.baseRing().coerce(coefficient));
        }
        return ring.polynomial(terms);
    }
}
