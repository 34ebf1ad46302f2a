package org.dice.kripke.parsing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits formula text into symbols. The parser pulls one symbol at a time through
 * {@link #nextSymbol()}; {@link #toString()}, {@link #getPosition()} and {@link #getAgent()}
 * describe the symbol that was read last.
 */
public class Lexer {

    private final String input;
    private int cursor = 0;

    private int symbol = NONE;
    private String currentToken = "";
    private int position = 0;
    private String agent = null;

    public static final int EOF   = -1;
    public static final int ATOM  = 999;

    public static final int NONE  = 0;

    public static final int OR      = 1;
    public static final int AND     = 2;
    public static final int NOT     = 3;
    public static final int IMPLIES = 4;
    public static final int IFF     = 5;

    public static final int LEFT    = 6;
    public static final int RIGHT   = 7;
    public static final int BOX     = 8;
    public static final int DIAMOND = 9;
    public static final int TRUE    = 10;
    public static final int FALSE   = 11;

    private static final String sLPAREN  = "(";
    private static final String sRPAREN  = ")";
    private static final String sAND     = "&";
    private static final String sOR      = "|";
    private static final String sNOT     = "~";
    private static final String sIMPLIES = "->";
    private static final String sIFF     = "<->";
    private static final String sTRUE    = "true";
    private static final String sFALSE   = "false";

    private static final char BOX_OPEN      = '[';
    private static final char BOX_CLOSE     = ']';
    private static final char DIAMOND_OPEN  = '<';
    private static final char DIAMOND_CLOSE = '>';

    // longest spelling first, so "<->" is never read as a diamond and "->" never as a stray '-'
    private static final Map<String, Integer> operatorToCode = generateOperatorToCode();
    private static Map<String, Integer> generateOperatorToCode(){
        Map<String, Integer> hm = new LinkedHashMap<String, Integer>();

        hm.put(sIFF, IFF);
        hm.put(sIMPLIES, IMPLIES);

        hm.put(sLPAREN, LEFT);
        hm.put(sRPAREN, RIGHT);

        hm.put(sOR,  OR);
        hm.put(sAND, AND);
        hm.put(sNOT, NOT);
        return hm;
    }

    private static final Map<String, Integer> keywordToCode = generateKeywordToCode();
    private static Map<String, Integer> generateKeywordToCode(){
        Map<String, Integer> hm = new HashMap<String, Integer>();
        hm.put(sTRUE, TRUE);
        hm.put(sFALSE, FALSE);
        return hm;
    }

    public Lexer(String s) {
        input = s == null ? "" : s;
    }

    public int nextSymbol() throws FormulaException {
        skipWhitespace();
        agent = null;
        position = cursor;

        if(cursor >= input.length()){
            currentToken = "";
            symbol = EOF;
            return symbol;
        }

        char c = input.charAt(cursor);
        if(isIdentifierStart(c)){
            currentToken = readIdentifier();
            Integer keyword = keywordToCode.get(currentToken);
            symbol = keyword != null ? keyword : ATOM;
            return symbol;
        }

        for(Map.Entry<String, Integer> operator : operatorToCode.entrySet()){
            if(input.startsWith(operator.getKey(), cursor)){
                cursor += operator.getKey().length();
                currentToken = operator.getKey();
                symbol = operator.getValue();
                return symbol;
            }
        }

        if(c == BOX_OPEN){
            return modalOperator(BOX_OPEN, BOX_CLOSE, BOX);
        }
        // a '<' that starts neither "<->" nor a diamond is a comparison character we don't support
        if(c == DIAMOND_OPEN && isDiamond()){
            return modalOperator(DIAMOND_OPEN, DIAMOND_CLOSE, DIAMOND);
        }
        throw new LexException(c, cursor);
    }

    // "<>" or "<agent>" at the cursor
    private boolean isDiamond() {
        int i = cursor + 1;
        if(i < input.length() && isIdentifierStart(input.charAt(i))){
            i++;
            while(i < input.length() && isIdentifierPart(input.charAt(i))){
                i++;
            }
        }
        return i < input.length() && input.charAt(i) == DIAMOND_CLOSE;
    }

    public static List<Token> tokenize(String inputString) throws FormulaException {
        Lexer temp = new Lexer(inputString);
        List<Token> tokens = new ArrayList<Token>();
        int symbol;
        do {
            symbol = temp.nextSymbol();
            tokens.add(new Token(symbol, temp.toString(), temp.getPosition(), temp.getAgent()));
        } while (symbol != Lexer.EOF);
        return tokens;
    }

    public static String describe(int symbol) {
        switch (symbol){
            case EOF:     return "end of input";
            case ATOM:    return "atom";
            case OR:      return "'" + sOR + "'";
            case AND:     return "'" + sAND + "'";
            case NOT:     return "'" + sNOT + "'";
            case IMPLIES: return "'" + sIMPLIES + "'";
            case IFF:     return "'" + sIFF + "'";
            case LEFT:    return "'" + sLPAREN + "'";
            case RIGHT:   return "'" + sRPAREN + "'";
            case BOX:     return "box";
            case DIAMOND: return "diamond";
            case TRUE:    return sTRUE;
            case FALSE:   return sFALSE;
            default:      return "nothing";
        }
    }

    public String getInput() {
        return input;
    }

    public int getSymbol() {
        return symbol;
    }

    public int getPosition() {
        return position;
    }

    public String getAgent() {
        return agent;
    }

    public String toString() {
        return this.currentToken;
    }

    private int modalOperator(char open, char close, int code) throws ParseException {
        int start = cursor;
        cursor++;
        String label = null;
        if(cursor < input.length() && isIdentifierStart(input.charAt(cursor))){
            label = readIdentifier();
        }
        if(cursor >= input.length() || input.charAt(cursor) != close){
            throw new ParseException(ParserErrors.MalformedAgentLabel,
                    String.format("expected an agent name followed by '%s' after '%s'", close, open), start);
        }
        cursor++;
        currentToken = input.substring(start, cursor);
        agent = label;
        symbol = code;
        return symbol;
    }

    private String readIdentifier() {
        int start = cursor;
        cursor++;
        while(cursor < input.length() && isIdentifierPart(input.charAt(cursor))){
            cursor++;
        }
        return input.substring(start, cursor);
    }

    private void skipWhitespace() {
        while(cursor < input.length() && Character.isWhitespace(input.charAt(cursor))){
            cursor++;
        }
    }

    /**
     * Whether the text reads as a single identifier, the spelling of atoms and agent labels.
     */
    public static boolean isIdentifier(String text) {
        if(text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))){
            return false;
        }
        for(int i = 1; i < text.length(); i++){
            if(!isIdentifierPart(text.charAt(i))){
                return false;
            }
        }
        return true;
    }

    public static boolean isKeyword(String text) {
        return keywordToCode.containsKey(text);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '_';
    }
}
