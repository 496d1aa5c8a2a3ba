package org.truthtable.semantics;

import org.junit.jupiter.api.Test;
import org.truthtable.parser.FormulaParser;
import org.truthtable.syntax.Formula;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableTest {

    private final Formula implication = FormulaParser.parse("p->q");
    private final Formula disjunction = FormulaParser.parse("-p|q");
    private final TruthTable table = Interpreter.buildTable(implication, disjunction);

    @Test
    void modelsOfEquivalentFormulasCoincide() {
        assertEquals(4, table.rowCount());
        assertEquals(Set.of(0, 2, 3), table.modelsOf(implication));
        assertEquals(table.modelsOf(implication), table.modelsOf(disjunction));
    }

    @Test
    void commonModelsOfEmptySelectionAreAllRows() {
        assertEquals(Set.of(0, 1, 2, 3), table.commonModels(List.of()));
        assertEquals(table.allRows(), table.commonModels(List.of()));
    }

    @Test
    void commonModelsIsIntersection() {
        TruthTable shared = Interpreter.buildTable(FormulaParser.parse("p"), FormulaParser.parse("-q"));
        assertEquals(Set.of(1), shared.commonModels());
    }

    @Test
    void untrackedFormulaIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> table.modelsOf(FormulaParser.parse("q")));
    }

    @Test
    void rowsCarryValuations() {
        TruthTableRow row = table.row(1);
        assertEquals(1, row.index());
        assertTrue(row.valuation().valueOf("p"));
        assertFalse(row.valuation().valueOf("q"));
        assertEquals(List.of(false, false), row.results());
        assertFalse(row.allTrue());
        assertTrue(table.row(0).allTrue());
    }

    @Test
    void rowsAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> table.rows().clear());
        assertThrows(UnsupportedOperationException.class, () -> table.row(0).results().set(0, false));
        assertThrows(UnsupportedOperationException.class, () -> table.row(0).valuation().asMap().put("p", false));
    }

    @Test
    void render() {
        TruthTable single = Interpreter.buildTable(FormulaParser.parse("p|-p"));
        assertEquals("[p, p|-p], [V, V], [F, V]", single.render());
        assertEquals("[p, q, p->q, -p|q], [V, V, V, V], [V, F, F, F], [F, V, V, V], [F, F, V, V]",
                table.render());
    }

    @Test
    void valuationRejectsNullValues() {
        Map<String, Boolean> values = new HashMap<>();
        values.put("p", null);
        assertThrows(IllegalArgumentException.class, () -> new Valuation(values));
    }
}
