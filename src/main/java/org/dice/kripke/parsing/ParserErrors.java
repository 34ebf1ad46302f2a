package org.dice.kripke.parsing;

public enum ParserErrors {
    MissingLeftParen(1, "unmatched closing parenthesis"),
    MissingRightParen(2, "unmatched opening parenthesis"),
    MissingOperand(3, "missing operand"),
    TrailingInput(4, "trailing input after expression"),
    MalformedAgentLabel(5, "malformed agent label"),
    NestingTooDeep(6, "formula nested too deeply");

    public int value;
    private final String description;

    ParserErrors(int value, String description){
        this.value = value;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
