package org.dice.kripke.parsing.ast.operators;

import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;

/**
 * Necessity: holds at a world when the operand holds at every accessible world.
 */
public class Box extends ModalOperator {
	public Box(Expression child){
		this(null, child);
	}

	public Box(String agent, Expression child){
		super(agent, child);
	}

	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}

	public String render() {
		return String.format("[%s]%s", agentLabel(), child.render());
	}
}
