package org.dice.kripke.parsing.ast.operators;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.dice.kripke.parsing.Lexer;
import org.dice.kripke.parsing.ast.Expression;

/**
 * A box or diamond. The agent names the accessibility relation the operator quantifies
 * over; {@code null} (or an empty label) stands for the default relation.
 */
public abstract class ModalOperator extends UnaryOperator {

    private final String agent;

    ModalOperator(String agent, Expression child) {
        super(child);
        this.agent = Strings.emptyToNull(agent);
        Preconditions.checkArgument(this.agent == null || Lexer.isIdentifier(this.agent),
                "agent label must be an identifier: %s", this.agent);
    }

    public String getAgent() {
        return agent;
    }

    public boolean hasAgent() {
        return agent != null;
    }

    protected String agentLabel() {
        return agent == null ? "" : agent;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equal(agent, ((ModalOperator) o).agent);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(agent);
    }
}
