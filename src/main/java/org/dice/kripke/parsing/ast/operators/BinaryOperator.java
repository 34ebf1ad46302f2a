package org.dice.kripke.parsing.ast.operators;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.dice.kripke.parsing.ast.Expression;

import java.util.List;

public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;

    BinaryOperator(Expression left, Expression right){
        this.left = Preconditions.checkNotNull(left, "left operand");
        this.right = Preconditions.checkNotNull(right, "right operand");
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public List<Expression> children() {
        return ImmutableList.of(left, right);
    }

    public int depth() {
        return Math.max(left.depth(), right.depth()) + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        BinaryOperator other = (BinaryOperator) o;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getClass().hashCode() + left.hashCode()) + right.hashCode();
    }

	@Override
	public String toString(){
		return this.render();
	}
}
