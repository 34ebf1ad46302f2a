package org.dice.kripke.parsing;

/**
 * A symbol read by the {@link Lexer} together with its spelling and where it starts.
 */
public class Token {

    private final int symbol;
    private final String text;
    private final int position;
    private final String agent;

    public Token(int symbol, String text, int position, String agent) {
        this.symbol = symbol;
        this.text = text;
        this.position = position;
        this.agent = agent;
    }

    public int getSymbol() {
        return symbol;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Agent label of a box or diamond, {@code null} for the default relation and for every other symbol.
     */
    public String getAgent() {
        return agent;
    }

    @Override
    public String toString() {
        return String.format("%s@%d", symbol == Lexer.EOF ? "<EOF>" : text, position);
    }
}
