package org.dice.kripke.parsing;

import org.apache.commons.lang.StringUtils;
import org.dice.kripke.RandomFormulas;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.Expressions;
import org.dice.kripke.parsing.ast.operands.Atom;
import org.dice.kripke.parsing.ast.operands.Constant;
import org.dice.kripke.parsing.ast.operators.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.TreeSet;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertNull;
import static junit.framework.TestCase.assertSame;
import static junit.framework.TestCase.assertTrue;
import static junit.framework.TestCase.fail;

public class TestRecursiveDescentParser {

    @Test
    public void enforcesOperatorPrecedence() throws Exception {
        assertEquals("((p & q) | r)", parse("p & q | r"));
        assertEquals("(p | (q & r))", parse("p | q & r"));
        assertEquals("((p | q) -> (r & s))", parse("p | q -> r & s"));
        assertEquals("((p -> q) <-> r)", parse("p -> q <-> r"));
        assertEquals("(p <-> (q -> r))", parse("p <-> q -> r"));
        assertEquals("(~p & q)", parse("~p & q"));
        assertEquals("([]p -> <>p)", parse("[]p -> <>p"));
    }

    @Test
    public void groupsLeftAssociativeOperatorsToTheLeft() throws Exception {
        assertEquals("((p & q) & r)", parse("p & q & r"));
        assertEquals("((p | q) | r)", parse("p | q | r"));
    }

    @Test
    public void groupsRightAssociativeOperatorsToTheRight() throws Exception {
        assertEquals("(p -> (q -> r))", parse("p -> q -> r"));
        assertEquals("(p <-> (q <-> r))", parse("p <-> q <-> r"));
        assertEquals("((p -> q) -> r)", parse("(p -> q) -> r"));
    }

    @Test
    public void bindsPrefixOperatorsTightly() throws Exception {
        assertEquals("~(p & q)", parse("~(p & q)"));
        assertEquals("~[]~p", parse("~ [] ~ p"));
        assertEquals("([a]p & q)", parse("[a]p & q"));
        assertEquals("[a]<b>p", parse("[a]<b>p"));
        assertEquals("(<>~p | []q)", parse("<>~p | []q"));
    }

    @Test
    public void stripsRedundantParentheses() throws Exception {
        assertEquals("p", parse("((p))"));
        assertEquals("(p & q)", parse("(((p) & (q)))"));
    }

    @Test
    public void buildsTheExpectedTree() throws Exception {
        Expression expected = new Implies(
                new And(new Atom("p"), new Not(new Atom("q"))),
                new Box("a", new Diamond(new Atom("r"))));
        assertEquals(expected, RecursiveDescentParser.parse("p & ~q -> [a]<>r"));
    }

    @Test
    public void mapsMissingAgentToDefaultRelation() throws Exception {
        Box box = (Box) RecursiveDescentParser.parse("[]p");
        assertNull(box.getAgent());
        Diamond diamond = (Diamond) RecursiveDescentParser.parse("<agent7>p");
        assertEquals("agent7", diamond.getAgent());
    }

    @Test
    public void parsesConstants() throws Exception {
        assertSame(Constant.TRUE, RecursiveDescentParser.parse("true"));
        assertEquals("(false | p)", parse("false | p"));
    }

    @Test
    public void roundTripsRenderedExpressions() throws Exception {
        RandomFormulas random = new RandomFormulas(42L);
        for (int i = 0; i < 500; i++) {
            Expression expression = random.expression(6);
            assertEquals(expression.render(), expression, RecursiveDescentParser.parse(expression.render()));
        }
    }

    @Test
    public void parsesDeterministically() throws Exception {
        String formula = "[a](p -> <b>q) <-> ~(r | true) & <>[]s";
        assertEquals(RecursiveDescentParser.parse(formula), RecursiveDescentParser.parse(formula));
    }

    @Test
    public void reportsDepthAndAtoms() throws Exception {
        Expression expression = RecursiveDescentParser.parse("[]p & ~(q | <>p)");
        assertEquals(4, expression.depth());
        assertEquals(8, Expressions.size(expression));
        assertEquals(new TreeSet<String>(Arrays.asList("p", "q")), Expressions.atoms(expression));
    }

    @Test
    public void addsErrorOnMissingOperand() throws Exception {
        assertParseError(ParserErrors.MissingOperand, "p &", 3);
        assertParseError(ParserErrors.MissingOperand, "", 0);
        assertParseError(ParserErrors.MissingOperand, "& p", 0);
        assertParseError(ParserErrors.MissingOperand, "p | -> q", 4);
        assertParseError(ParserErrors.MissingOperand, "()", 1);
        assertParseError(ParserErrors.MissingOperand, "~", 1);
        assertParseError(ParserErrors.MissingOperand, "[a]", 3);
    }

    @Test
    public void addsErrorOnMissingRightParen() throws Exception {
        assertParseError(ParserErrors.MissingRightParen, "(p & q", 0);
        assertParseError(ParserErrors.MissingRightParen, "(p & (q | r)", 0);
        assertParseError(ParserErrors.MissingRightParen, "p & (q | r", 4);
        assertParseError(ParserErrors.MissingRightParen, "(p q)", 0);
    }

    @Test
    public void addsErrorOnMissingLeftParen() throws Exception {
        assertParseError(ParserErrors.MissingLeftParen, "p & q)", 5);
        assertParseError(ParserErrors.MissingLeftParen, "(p))", 3);
    }

    @Test
    public void addsErrorOnTrailingInput() throws Exception {
        assertParseError(ParserErrors.TrailingInput, "p q", 2);
        assertParseError(ParserErrors.TrailingInput, "(p & q) ~r", 8);
    }

    @Test
    public void addsErrorOnMalformedAgentLabel() throws Exception {
        assertParseError(ParserErrors.MalformedAgentLabel, "p & [x", 4);
    }

    @Test
    public void passesLexErrorsThrough() throws Exception {
        try {
            RecursiveDescentParser.parse("p & q$");
            fail("expected a lex error");
        } catch (LexException ex) {
            assertEquals('$', ex.getOffendingCharacter());
            assertEquals(5, ex.getPosition());
        }
    }

    @Test
    public void limitsNesting() throws Exception {
        assertParseError(new RecursiveDescentParser(new Lexer("~~~~p"), 3), ParserErrors.NestingTooDeep, 3);
        assertParseError(new RecursiveDescentParser(new Lexer("p & p & p & p & p"), 3), ParserErrors.NestingTooDeep, 14);
        assertParseError(new RecursiveDescentParser(new Lexer("((((p))))"), 3), ParserErrors.NestingTooDeep, 3);
    }

    @Test
    public void acceptsNestingUpToTheDefaultLimit() throws Exception {
        String formula = StringUtils.repeat("~", 200) + "p";
        assertEquals(200, RecursiveDescentParser.parse(formula).depth());

        String tooDeep = StringUtils.repeat("(", 300) + "p" + StringUtils.repeat(")", 300);
        assertParseError(new RecursiveDescentParser(new Lexer(tooDeep)), ParserErrors.NestingTooDeep, 256);
    }

    @Test
    public void failuresCarryReadableMessages() throws Exception {
        try {
            RecursiveDescentParser.parse("(p & q");
            fail("expected a parse error");
        } catch (ParseException ex) {
            assertTrue(ex.getMessage(), ex.getMessage().contains("unmatched opening parenthesis"));
            assertTrue(ex.getMessage(), ex.getMessage().contains("position 0"));
        }
    }

    private String parse(String input) throws FormulaException {
        return RecursiveDescentParser.parse(input).render();
    }

    private void assertParseError(ParserErrors expected, String input, int position) throws FormulaException {
        assertParseError(new RecursiveDescentParser(new Lexer(input)), expected, position);
    }

    private void assertParseError(RecursiveDescentParser parser, ParserErrors expected, int position) throws FormulaException {
        try {
            Expression ast = parser.parse();
            fail("expected " + expected + " but parsed " + ast);
        } catch (ParseException ex) {
            assertEquals(ex.getMessage(), expected, ex.getError());
            assertEquals(ex.getMessage(), position, ex.getPosition());
        }
    }
}
