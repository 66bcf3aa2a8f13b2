package org.lapa.analyzer.ir.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.lapa.analyzer.ir.util.Operators.evaluateBinary;
import static org.lapa.analyzer.ir.util.Operators.evaluateUnary;

public class TestOperators {

    @Test
    public void testArithmetic() {
        assertEquals(Optional.of(15L), evaluateBinary("+", 5, 10));
        assertEquals(Optional.of(2.5), evaluateBinary("+", 2, 0.5f));
        assertEquals(Optional.of("ab"), evaluateBinary("+", "a", "b"));
        assertEquals(Optional.of(-3L), evaluateBinary("-", 2, 5));
        assertEquals(Optional.of(12L), evaluateBinary("*", 3L, 4));
        assertEquals(Optional.of(2.5), evaluateBinary("/", 5, 2));
        assertEquals(Optional.of(2.0), evaluateBinary("/", 4, 2));
        assertEquals(Optional.of(1L), evaluateBinary("%", -5, 3));
        assertEquals(Optional.of(1024L), evaluateBinary("**", 2, 10));
        assertEquals(Optional.of(0.5), evaluateBinary("**", 2, -1));
    }

    @Test
    public void testNotConstant() {
        assertTrue(evaluateBinary("/", 1, 0).isEmpty());
        assertTrue(evaluateBinary("/", 1.0, 0.0).isEmpty());
        assertTrue(evaluateBinary("%", 1, 0).isEmpty());
        assertTrue(evaluateBinary("+", Long.MAX_VALUE, 1).isEmpty());
        assertTrue(evaluateBinary("**", 2, 64).isEmpty());
        assertTrue(evaluateBinary("-", "a", "b").isEmpty());
        assertTrue(evaluateBinary("<<", 1, 2).isEmpty());
        assertTrue(evaluateBinary(null, 1, 2).isEmpty());
        assertTrue(evaluateUnary("-", "x").isEmpty());
        assertTrue(evaluateUnary("-", Long.MIN_VALUE).isEmpty());
    }

    @Test
    public void testLogicAndComparison() {
        assertEquals(Optional.of(0L), evaluateBinary("and", 0, 5));
        assertEquals(Optional.of(5L), evaluateBinary("and", 1, 5));
        assertEquals(Optional.of("x"), evaluateBinary("or", "", "x"));
        assertEquals(Optional.of(true), evaluateBinary("==", 1, 1.0));
        assertEquals(Optional.of(true), evaluateBinary("!=", "a", "b"));
        assertEquals(Optional.of(true), evaluateBinary("<", 1, 2.5));
        assertEquals(Optional.of(false), evaluateBinary(">=", "a", "b"));
        assertTrue(evaluateBinary("<", "a", 1).isEmpty());
        assertEquals(Optional.of(true), evaluateUnary("not", List.of()));
        assertEquals(Optional.of(-3L), evaluateUnary("-", 3));
    }
}
