package org.truthtable.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.truthtable.syntax.Formula.*;

class FormulaTest {

    private static final Formula P = variable("p");
    private static final Formula Q = variable("q");
    private static final Formula R = variable("r");

    @Nested
    @DisplayName("Struttura")
    class Structure {

        @Test
        void leafAndOperatorNodes() {
            assertTrue(P.isAtom());
            assertNull(P.operator());
            assertEquals("p", P.name());

            Formula negation = not(P);
            assertEquals(Formula.Type.NOT, negation.type());
            assertEquals(Operator.NEGATION, negation.operator());
            assertEquals(P, negation.operand());

            Formula implication = implies(P, Q);
            assertEquals(Formula.Type.IMPLIES, implication.type());
            assertEquals(P, implication.left());
            assertEquals(Q, implication.right());
            assertEquals(List.of(P, Q), implication.children());
        }

        @Test
        void wrongAccessorsFail() {
            assertThrows(IllegalStateException.class, P::operand);
            assertThrows(IllegalStateException.class, P::left);
            assertThrows(IllegalStateException.class, () -> not(P).right());
            assertThrows(IllegalStateException.class, () -> and(P, Q).name());
        }

        @Test
        void invalidConstruction() {
            assertThrows(IllegalArgumentException.class, () -> binary(Operator.NEGATION, P, Q));
            assertThrows(IllegalArgumentException.class, () -> and(P, null));
            assertThrows(IllegalArgumentException.class, () -> not(null));
            assertThrows(IllegalArgumentException.class, () -> variable("pq"));
        }

        @Test
        void structuralEquality() {
            assertEquals(and(P, not(Q)), and(variable("p"), not(variable("q"))));
            assertEquals(and(P, not(Q)).hashCode(), and(variable("p"), not(variable("q"))).hashCode());
            assertNotEquals(and(P, Q), and(Q, P));
            assertNotEquals(and(P, Q), or(P, Q));
        }
    }

    @Nested
    @DisplayName("Sottoformule")
    class Subformulas {

        @Test
        @DisplayName("Pre-ordine con ripetizioni")
        void preOrderWithDuplicates() {
            Formula formula = and(P, not(P));
            assertEquals(List.of(formula, P, not(P), P), formula.subformulas());
        }

        @Test
        void variablesInFirstOccurrenceOrder() {
            Formula formula = or(and(Q, P), Q);
            assertEquals(List.of("q", "p"), List.copyOf(formula.variables()));
        }

        @Test
        void sizeAndDepth() {
            Formula formula = and(P, not(Q));
            assertEquals(4, formula.size());
            assertEquals(3, formula.depth());
            assertEquals(1, P.depth());
        }
    }

    @Nested
    @DisplayName("Resa testuale")
    class Rendering {

        @Test
        void lowerPrecedenceChildIsParenthesized() {
            assertEquals("(p|q)&r", and(or(P, Q), R).render());
            assertEquals("p->(q<->r)", implies(P, iff(Q, R)).render());
            assertEquals("-(p&q)", not(and(P, Q)).render());
        }

        @Test
        void higherOrEqualPrecedenceChildIsBare() {
            assertEquals("p&q|r", or(and(P, Q), R).render());
            assertEquals("-p->q", implies(not(P), Q).render());
            assertEquals("p->q<->q|r", iff(implies(P, Q), or(Q, R)).render());
            assertEquals("--p", not(not(P)).render());
        }

        @Test
        @DisplayName("Stessa precedenza a destra: nessuna parentesi")
        void samePrecedenceRightOperandIsBare() {
            assertEquals("p&q&r", and(P, and(Q, R)).render());
            assertEquals("p&q&r", and(and(P, Q), R).render());
        }

        @Test
        void toStringIsRender() {
            Formula formula = iff(P, not(or(Q, R)));
            assertEquals("p<->-(q|r)", formula.toString());
        }
    }
}
