package org.truthtable.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.truthtable.antlr.PropositionalFormulaBaseVisitor;
import org.truthtable.antlr.PropositionalFormulaParser.AndContext;
import org.truthtable.antlr.PropositionalFormulaParser.FormulaContext;
import org.truthtable.antlr.PropositionalFormulaParser.IffContext;
import org.truthtable.antlr.PropositionalFormulaParser.ImpliesContext;
import org.truthtable.antlr.PropositionalFormulaParser.NotContext;
import org.truthtable.antlr.PropositionalFormulaParser.OrContext;
import org.truthtable.antlr.PropositionalFormulaParser.ParContext;
import org.truthtable.antlr.PropositionalFormulaParser.VarContext;
import org.truthtable.antlr.PropositionalFormulaParser.WordContext;
import org.truthtable.syntax.Formula;
import org.truthtable.syntax.Operator;
import org.truthtable.syntax.PropositionalVariable;

import java.util.List;
import java.util.logging.Logger;

/**
 * VISITOR ALBERO SINTATTICO - Conversione da parse tree ANTLR a {@link Formula}
 *
 * Ogni livello di precedenza della grammatica produce una lista piatta di operandi
 * separati dallo stesso operatore; il visitor la riduce da sinistra a destra,
 * realizzando l'associatività a sinistra di tutti i connettivi binari.
 *
 * OPERATORI (in ordine di precedenza crescente):
 * - Biimplicazione (<->): a <-> b <-> c ~ (a <-> b) <-> c
 * - Implicazione (->):    a -> b -> c ~ (a -> b) -> c
 * - Disgiunzione (|):     a | b | c ~ (a | b) | c
 * - Congiunzione (&):     a & b & c ~ (a & b) & c
 * - Negazione (-):        --a ~ -(-a), lega più stretto di ogni binario
 *
 * Le parentesi vengono consumate qui e non compaiono nell'albero risultante.
 */
class FormulaTreeVisitor extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeVisitor.class.getName());

    private final String text;

    FormulaTreeVisitor(String text) {
        this.text = text;
    }

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.finest("Albero costruito: " + formula);
        return formula;
    }

    //endregion

    //region LIVELLI BINARI (ASSOCIATIVI A SINISTRA)

    @Override
    public Formula visitIff(IffContext ctx) {
        return foldLeft(Operator.BIIMPLICATION, ctx.implication());
    }

    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        return foldLeft(Operator.IMPLICATION, ctx.disjunction());
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        return foldLeft(Operator.DISJUNCTION, ctx.conjunction());
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        return foldLeft(Operator.CONJUNCTION, ctx.negation());
    }

    /**
     * Riduce gli operandi da sinistra: [a, b, c] ~ op(op(a, b), c).
     * Con un solo operando restituisce l'operando stesso, senza nodo aggiuntivo.
     */
    private Formula foldLeft(Operator operator, List<? extends ParserRuleContext> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(operator, result, visit(operands.get(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONE, PARENTESI E VARIABILI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    /**
     * Valida la parola letta dal lexer come nome di variabile.
     * Nomi come "pq" o "1p" vengono rifiutati interi, mai troncati.
     */
    @Override
    public Formula visitWord(WordContext ctx) {
        Token token = ctx.WORD().getSymbol();
        String name = token.getText();
        if (!PropositionalVariable.isValidName(name)) {
            throw new FormulaSyntaxException("Nome variabile non valido: '" + name + "'",
                    text, token.getCharPositionInLine());
        }
        return Formula.variable(name);
    }

    //endregion
}
