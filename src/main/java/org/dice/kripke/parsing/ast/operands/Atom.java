package org.dice.kripke.parsing.ast.operands;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.dice.kripke.parsing.Lexer;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;

import java.util.List;

public class Atom implements Expression {
	private final String name;

	public Atom(String name) {
		Preconditions.checkArgument(Lexer.isIdentifier(name), "atom name must be an identifier: %s", name);
		Preconditions.checkArgument(!Lexer.isKeyword(name), "%s is reserved and cannot name an atom", name);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}

	public String render() {
		return name;
	}

	public List<Expression> children() {
		return ImmutableList.of();
	}

	public int depth() {
		return 0;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Atom && ((Atom) o).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
