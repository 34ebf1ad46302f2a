package org.dice.kripke.parsing.ast.operators;

import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;

/**
 * Possibility: holds at a world when the operand holds at some accessible world.
 */
public class Diamond extends ModalOperator {
	public Diamond(Expression child){
		this(null, child);
	}

	public Diamond(String agent, Expression child){
		super(agent, child);
	}

	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}

	public String render() {
		return String.format("<%s>%s", agentLabel(), child.render());
	}
}
