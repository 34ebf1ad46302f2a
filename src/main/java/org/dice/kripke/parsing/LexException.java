package org.dice.kripke.parsing;

/**
 * Raised by the {@link Lexer} when no token can start at a character.
 */
public class LexException extends FormulaException {

    private final char offendingCharacter;

    public LexException(char offendingCharacter, int position) {
        super(String.format("Unrecognized character '%s'", offendingCharacter), position);
        this.offendingCharacter = offendingCharacter;
    }

    public char getOffendingCharacter() {
        return offendingCharacter;
    }
}
