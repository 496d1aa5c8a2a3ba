package org.truthtable.operations;

import org.junit.jupiter.api.Test;
import org.truthtable.parser.FormulaSyntaxException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationDispatcherTest {

    private final OperationDispatcher dispatcher = new OperationDispatcher();

    @Test
    void standardOperationsAreRegistered() {
        assertEquals(List.of("S", "EQ", "C", "CL"), List.copyOf(dispatcher.symbols()));
    }

    @Test
    void dispatchesBySymbol() {
        assertEquals("TAUTOLOGIA", dispatcher.execute("S,p|-p").label());
        assertEquals("SIM", dispatcher.execute("EQ,p->q,-p|q").label());
        assertEquals("NAO", dispatcher.execute("C,[p,-p]").label());
        assertEquals("SIM", dispatcher.execute("CL,[p,p->q],q").label());
    }

    @Test
    void whitespaceIsStrippedBeforeDispatch() {
        assertEquals("TAUTOLOGIA", dispatcher.execute(" S , p | -p ").label());
        assertEquals("SIM", dispatcher.execute("CL, [p, p -> q], q").label());
    }

    @Test
    void errors() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.execute("X,p"));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.execute("S"));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.execute(null));
        assertThrows(FormulaSyntaxException.class, () -> dispatcher.execute("S,p&"));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.register(new SemanticStatus()));
    }
}
