package org.dice.kripke.parsing;

/**
 * Base class of the errors raised while turning formula text into an expression tree.
 * Carries the zero based position in the source text where the problem was detected.
 */
public abstract class FormulaException extends Exception {

    private final int position;

    protected FormulaException(String message, int position) {
        super(String.format("%s at position %d", message, position));
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
