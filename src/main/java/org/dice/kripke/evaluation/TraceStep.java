package org.dice.kripke.evaluation;

import org.dice.kripke.parsing.ast.Expression;

/**
 * One link of a {@link Trace}: the value a sub-expression has at a world and why.
 */
public class TraceStep {

    private final Expression expression;
    private final String world;
    private final boolean value;
    private final String reason;

    public TraceStep(Expression expression, String world, boolean value, String reason) {
        this.expression = expression;
        this.world = world;
        this.value = value;
        this.reason = reason;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getWorld() {
        return world;
    }

    public boolean getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s : %s", world, value ? "|=" : "|/=", expression.render(), reason);
    }
}
