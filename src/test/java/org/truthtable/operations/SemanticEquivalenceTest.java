package org.truthtable.operations;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticEquivalenceTest {

    private final SemanticEquivalence operation = new SemanticEquivalence();

    @Test
    @DisplayName("p->q equivale a -p|q su una tabella condivisa di 4 righe")
    void materialImplication() {
        DecisionResult result = operation.evaluate("p->q", "-p|q");
        assertTrue(result.verdict());
        assertEquals(4, result.table().rowCount());
        assertEquals(List.of("p", "q"), result.table().variables());
        assertEquals("SIM", result.label());
    }

    @ParameterizedTest
    @CsvSource({
            "p&q,       q&p,            true",
            "-(p&q),    -p|-q,          true",
            "p<->q,     (p->q)&(q->p),  true",
            "p,         p&(q|-q),       true",
            "p->q,      q->p,           false",
            "p|q,       p&q,            false"
    })
    void equivalence(String first, String second, boolean expected) {
        assertEquals(expected, operation.evaluate(first, second).verdict());
    }

    @Test
    void reflexiveAndSymmetric() {
        assertTrue(operation.evaluate("p->q|r", "p->q|r").verdict());
        assertEquals(operation.evaluate("p->q", "q->p").verdict(), operation.evaluate("q->p", "p->q").verdict());
        assertEquals(operation.evaluate("-p|q", "p->q").verdict(), operation.evaluate("p->q", "-p|q").verdict());
    }

    @Test
    void transitive() {
        assertTrue(operation.evaluate("p->q", "-p|q").verdict());
        assertTrue(operation.evaluate("-p|q", "-(p&-q)").verdict());
        assertTrue(operation.evaluate("p->q", "-(p&-q)").verdict());
    }

    @Test
    void differentVariableSetsShareOneTable() {
        DecisionResult result = operation.evaluate("p", "p&(q|-q)");
        assertTrue(result.verdict());
        assertEquals(4, result.table().rowCount());
    }

    @Test
    void lineFormat() {
        assertEquals("[NAO, [[p, q, p|q, p&q], [V, V, V, V], [V, F, V, F], [F, V, V, F], [F, F, F, F]]]",
                operation.execute("EQ,p|q,p&q").format());
        assertThrows(IllegalArgumentException.class, () -> operation.execute("EQ,p"));
    }
}
