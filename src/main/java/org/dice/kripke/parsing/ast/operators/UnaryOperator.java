package org.dice.kripke.parsing.ast.operators;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.dice.kripke.parsing.ast.Expression;

import java.util.List;

public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        this.child = Preconditions.checkNotNull(child, "operand");
    }

    public Expression getChild() {
        return child;
    }

    public List<Expression> children() {
        return ImmutableList.of(child);
    }

    public int depth() {
        return child.depth() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return child.equals(((UnaryOperator) o).child);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + child.hashCode();
    }

    @Override
    public String toString(){
        return this.render();
    }
}
