package org.dice.kripke.parsing;

import org.dice.kripke.KripkeSettings;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.operands.Atom;
import org.dice.kripke.parsing.ast.operands.Constant;
import org.dice.kripke.parsing.ast.operators.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link Expression} from the symbols of a {@link Lexer}, one method per precedence
 * level, weakest first. The whole input has to be consumed and any problem aborts the parse,
 * so a tree is either complete or not returned at all.
 *
 * A parser reads its lexer once; create a new one per formula.
 */
public class RecursiveDescentParser {

    private static final Logger log = LoggerFactory.getLogger( RecursiveDescentParser.class );

    private final Lexer lexer;
    private final int maxDepth;
    private int symbol;
    private Expression root;
    // depth of the tree held in root
    private int rootDepth;
    // how many groups, prefix operators and right associative operators we are inside of
    private int nesting;

    public RecursiveDescentParser(Lexer lexer) {
        this(lexer, KripkeSettings.configured().getMaxParseDepth());
    }

    public RecursiveDescentParser(Lexer lexer, int maxDepth) {
        this.lexer  = lexer;
        this.maxDepth = maxDepth;
        this.symbol = Lexer.NONE;
    }

    public static Expression parse(String formula) throws FormulaException {
        return new RecursiveDescentParser(new Lexer(formula)).parse();
    }

    public static Expression parse(String formula, KripkeSettings settings) throws FormulaException {
        return new RecursiveDescentParser(new Lexer(formula), settings.getMaxParseDepth()).parse();
    }

    public Expression parse() throws FormulaException {
        advance();
        iffExpression();
        if(symbol != Lexer.EOF){
            if(symbol == Lexer.RIGHT){
                throw error(ParserErrors.MissingLeftParen, "')' has no matching '('", lexer.getPosition());
            }
            throw error(ParserErrors.TrailingInput,
                    String.format("unexpected %s '%s'", Lexer.describe(symbol), lexer), lexer.getPosition());
        }
        log.debug("Parsed '{}' as {}", lexer.getInput(), root);
        return root;
    }

    // right associative: a <-> b <-> c is a <-> (b <-> c)
    private void iffExpression() throws FormulaException {
        impliesExpression();
        if (symbol == Lexer.IFF) {
            int operator = lexer.getPosition();
            Expression left = root;
            int leftDepth = rootDepth;
            advance();
            enter(operator);
            iffExpression();
            leave();
            combine(new Iff(left, root), leftDepth, operator);
        }
    }

    // right associative: a -> b -> c is a -> (b -> c)
    private void impliesExpression() throws FormulaException {
        orExpression();
        if (symbol == Lexer.IMPLIES) {
            int operator = lexer.getPosition();
            Expression left = root;
            int leftDepth = rootDepth;
            advance();
            enter(operator);
            impliesExpression();
            leave();
            combine(new Implies(left, root), leftDepth, operator);
        }
    }

    private void orExpression() throws FormulaException {
        andExpression();
        while (symbol == Lexer.OR) {
            int operator = lexer.getPosition();
            Expression left = root;
            int leftDepth = rootDepth;
            advance();
            andExpression();
            combine(new Or(left, root), leftDepth, operator);
        }
    }

    private void andExpression() throws FormulaException {
        unaryExpression();
        while (symbol == Lexer.AND) {
            int operator = lexer.getPosition();
            Expression left = root;
            int leftDepth = rootDepth;
            advance();
            unaryExpression();
            combine(new And(left, root), leftDepth, operator);
        }
    }

    private void unaryExpression() throws FormulaException {
        int operator = lexer.getPosition();
        switch (symbol){
            case Lexer.NOT:
                advance();
                enter(operator);
                unaryExpression();
                leave();
                wrap(new Not(root), operator);
                break;

            case Lexer.BOX: {
                final String agent = lexer.getAgent();
                advance();
                enter(operator);
                unaryExpression();
                leave();
                wrap(new Box(agent, root), operator);
                break;
            }

            case Lexer.DIAMOND: {
                final String agent = lexer.getAgent();
                advance();
                enter(operator);
                unaryExpression();
                leave();
                wrap(new Diamond(agent, root), operator);
                break;
            }

            default:
                primary();
        }
    }

    private void primary() throws FormulaException {
        switch (symbol){
            case Lexer.ATOM:
                root = new Atom(lexer.toString());
                rootDepth = 0;
                advance();
                break;

            case Lexer.TRUE:
            case Lexer.FALSE:
                root = Constant.of(symbol == Lexer.TRUE);
                rootDepth = 0;
                advance();
                break;

            case Lexer.LEFT:
                final int open = lexer.getPosition();
                advance();
                enter(open);
                iffExpression();
                leave();
                if(symbol != Lexer.RIGHT){
                    String found = symbol == Lexer.EOF ? Lexer.describe(symbol) : String.format("'%s'", lexer);
                    throw error(ParserErrors.MissingRightParen,
                            String.format("'(' is never closed, found %s", found), open);
                }
                advance();
                break;

            case Lexer.EOF:
                throw error(ParserErrors.MissingOperand, "expected an operand but reached end of input", lexer.getPosition());

            default:
                throw error(ParserErrors.MissingOperand,
                        String.format("expected an operand but found %s '%s'", Lexer.describe(symbol), lexer),
                        lexer.getPosition());
        }
    }

    private void advance() throws FormulaException {
        symbol = lexer.nextSymbol();
    }

    private void combine(Expression node, int leftDepth, int position) throws ParseException {
        root = node;
        rootDepth = Math.max(leftDepth, rootDepth) + 1;
        checkDepth(rootDepth, position);
    }

    private void wrap(Expression node, int position) throws ParseException {
        root = node;
        rootDepth++;
        checkDepth(rootDepth, position);
    }

    private void enter(int position) throws ParseException {
        nesting++;
        checkDepth(nesting, position);
    }

    private void leave() {
        nesting--;
    }

    private void checkDepth(int depth, int position) throws ParseException {
        if(depth > maxDepth){
            throw error(ParserErrors.NestingTooDeep, String.format("more than %d levels", maxDepth), position);
        }
    }

    private ParseException error(ParserErrors kind, String detail, int position) {
        ParseException ex = new ParseException(kind, detail, position);
        log.debug("Failed to parse '{}': {}", lexer.getInput(), ex.getMessage());
        return ex;
    }
}
