package org.dice.kripke.parsing.ast.operands;

import com.google.common.collect.ImmutableList;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;

import java.util.List;

/**
 * The literals {@code true} (holds at every world) and {@code false} (holds nowhere).
 */
public final class Constant implements Expression {

	public static final Constant TRUE = new Constant(true);
	public static final Constant FALSE = new Constant(false);

	private final boolean value;

	private Constant(boolean value) {
		this.value = value;
	}

	public static Constant of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public boolean getValue() {
		return value;
	}

	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}

	public String render() {
		return String.valueOf(value);
	}

	public List<Expression> children() {
		return ImmutableList.of();
	}

	public int depth() {
		return 0;
	}

	@Override
	public String toString(){
		return this.render();
	}
}
