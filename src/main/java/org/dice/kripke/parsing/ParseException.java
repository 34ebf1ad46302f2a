package org.dice.kripke.parsing;

public class ParseException extends FormulaException {

    private final ParserErrors error;

    public ParseException(ParserErrors error, String detail, int position) {
        super(String.format("%s: %s", error.getDescription(), detail), position);
        this.error = error;
    }

    public ParserErrors getError() {
        return error;
    }
}
