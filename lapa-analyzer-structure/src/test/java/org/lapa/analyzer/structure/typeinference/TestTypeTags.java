package org.lapa.analyzer.structure.typeinference;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.lapa.analyzer.structure.typeinference.TypeTags.*;

public class TestTypeTags {

    @Test
    public void testUnify() {
        assertEquals(INT, unify(List.of(INT, INT)));
        assertEquals(INT, unify(List.of(UNKNOWN, INT, UNKNOWN)));
        assertEquals(UNKNOWN, unify(List.of(UNKNOWN, INT, STR)));
        assertEquals(UNKNOWN, unify(List.of(UNKNOWN)));
        assertEquals(ANY, unify(List.of(INT, STR)));
        assertEquals(ANY, unify(List.of()));
    }

    @Test
    public void testResolveBinary() {
        assertEquals(STR, resolveBinary("+", STR, STR));
        assertEquals(BOOL, resolveBinary("==", STR, STR));
        assertEquals(UNKNOWN, resolveBinary("and", BOOL, BOOL));
        assertEquals(FLOAT, resolveBinary("/", INT, FLOAT));
        assertEquals(INT, resolveBinary("-", INT, BOOL));
        assertEquals(BOOL, resolveBinary(">=", INT, FLOAT));
        assertEquals(UNKNOWN, resolveBinary("+", UNKNOWN, INT));
        assertEquals(UNKNOWN, resolveBinary("+", STR, BOOL));
        assertEquals(UNKNOWN, resolveBinary("%", INT, FLOAT));
    }
}
