package org.truthtable.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.truthtable.parser.FormulaParser;
import org.truthtable.syntax.Formula;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {

    private static Valuation valuation(Object... namesAndValues) {
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            values.put((String) namesAndValues[i], (Boolean) namesAndValues[i + 1]);
        }
        return new Valuation(values);
    }

    @Nested
    @DisplayName("Universo delle variabili")
    class Variables {

        @Test
        void unionSortedByLetterThenIndex() {
            List<Formula> formulas = List.of(
                    FormulaParser.parse("q->p"),
                    FormulaParser.parse("r1&p10"),
                    FormulaParser.parse("p2|p"));
            assertEquals(List.of("p", "p2", "p10", "q", "r1"), Interpreter.variablesOf(formulas));
        }

        @Test
        @DisplayName("Lo stesso insieme di variabili dà sempre lo stesso ordine")
        void orderDoesNotDependOnInputOrder() {
            List<String> first = Interpreter.variablesOf(List.of(FormulaParser.parse("q&p")));
            List<String> second = Interpreter.variablesOf(List.of(FormulaParser.parse("p&q")));
            assertEquals(first, second);
        }

        @Test
        void repeatedVariablesCountOnce() {
            assertEquals(List.of("p"), Interpreter.variablesOf(List.of(FormulaParser.parse("p&-p|p"))));
        }
    }

    @Nested
    @DisplayName("Enumerazione canonica")
    class Enumeration {

        @Test
        @DisplayName("La prima variabile è il bit più significativo, vero per primo")
        void canonicalOrder() {
            List<Valuation> valuations = Interpreter.valuations(List.of("p", "q"));
            assertEquals(List.of(
                    valuation("p", true, "q", true),
                    valuation("p", true, "q", false),
                    valuation("p", false, "q", true),
                    valuation("p", false, "q", false)), valuations);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2, 3, 5, 8})
        void rowCountIsPowerOfTwoAndRowsAreDistinct(int n) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                names.add("p" + i);
            }
            List<Valuation> valuations = Interpreter.valuations(names);
            assertEquals(1 << n, valuations.size());
            assertEquals(valuations.size(), new HashSet<>(valuations).size());
        }

        @Test
        void noVariablesGiveOneEmptyValuation() {
            assertEquals(List.of(Valuation.empty()), Interpreter.valuations(List.of()));
        }

        @Test
        void tooManyVariablesAreRejected() {
            List<String> names = new ArrayList<>();
            for (int i = 0; i <= Interpreter.MAX_VARIABLES; i++) {
                names.add("p" + i);
            }
            assertThrows(IllegalArgumentException.class, () -> Interpreter.valuations(names));
        }
    }

    @Nested
    @DisplayName("Funzioni di verità")
    class Evaluation {

        @ParameterizedTest(name = "p={0}, q={1}")
        @CsvSource({
                "true,  true,  false, true,  true,  true,  true",
                "true,  false, false, false, true,  false, false",
                "false, true,  true,  false, true,  true,  false",
                "false, false, true,  false, false, true,  true"
        })
        void connectives(boolean p, boolean q, boolean notP, boolean and, boolean or,
                         boolean implies, boolean iff) {
            Valuation v = valuation("p", p, "q", q);
            assertEquals(notP, Interpreter.evaluate(FormulaParser.parse("-p"), v));
            assertEquals(and, Interpreter.evaluate(FormulaParser.parse("p&q"), v));
            assertEquals(or, Interpreter.evaluate(FormulaParser.parse("p|q"), v));
            assertEquals(implies, Interpreter.evaluate(FormulaParser.parse("p->q"), v));
            assertEquals(iff, Interpreter.evaluate(FormulaParser.parse("p<->q"), v));
        }

        @ParameterizedTest
        @ValueSource(strings = {"p", "p&q", "p->q|-r", "-(p<->q)&r"})
        @DisplayName("--e vale quanto e in ogni valutazione")
        void negationInvolution(String text) {
            Formula formula = FormulaParser.parse(text);
            Formula doubleNegation = Formula.not(Formula.not(formula));
            for (Valuation v : Interpreter.valuations(Interpreter.variablesOf(List.of(formula)))) {
                assertEquals(Interpreter.evaluate(formula, v), Interpreter.evaluate(doubleNegation, v));
            }
        }

        @Test
        void unboundVariableIsAnInvariantViolation() {
            UnboundVariableException e = assertThrows(UnboundVariableException.class,
                    () -> Interpreter.evaluate(FormulaParser.parse("p&q"), valuation("p", true)));
            assertEquals("q", e.getVariable());
        }
    }

    @Nested
    @DisplayName("Costruzione tabella")
    class TableConstruction {

        @Test
        void resultsFollowInputOrder() {
            Formula first = FormulaParser.parse("p->q");
            Formula second = FormulaParser.parse("p&q");
            TruthTable table = Interpreter.buildTable(first, second);

            assertEquals(List.of("p", "q"), table.variables());
            assertEquals(List.of(first, second), table.formulas());
            assertEquals(List.of(true, false, true, true), table.column(0));
            assertEquals(List.of(true, false, false, false), table.column(1));
        }

        @Test
        void buildingTwiceGivesIdenticalTables() {
            List<Formula> formulas = List.of(FormulaParser.parse("p|q->r"), FormulaParser.parse("-r"));
            assertEquals(Interpreter.buildTable(formulas).rows(), Interpreter.buildTable(formulas).rows());
        }

        @Test
        void emptyFormulaListGivesOneRow() {
            TruthTable table = Interpreter.buildTable(List.of());
            assertEquals(1, table.rowCount());
            assertEquals(Valuation.empty(), table.row(0).valuation());
        }

        @Test
        void modelQueries() {
            Formula p = FormulaParser.parse("p");
            Formula implication = FormulaParser.parse("p->q");
            TruthTable table = Interpreter.buildTable(p, implication);

            assertEquals(List.of(0, 1), List.copyOf(Interpreter.modelsOf(table, p)));
            assertEquals(List.of(0, 2, 3), List.copyOf(Interpreter.modelsOf(table, implication)));
            assertEquals(List.of(0), List.copyOf(Interpreter.commonModels(table, List.of(p, implication))));
        }
    }
}
