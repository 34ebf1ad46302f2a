package org.dice.kripke.parsing.ast.operators;

import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;

public class And extends BinaryOperator {
	public And(Expression left, Expression right){
		super(left, right);
	}

	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}

	public String render() {
		return String.format("(%s & %s)", left.render(), right.render());
	}
}
