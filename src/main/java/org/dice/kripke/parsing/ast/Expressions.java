package org.dice.kripke.parsing.ast;

import org.dice.kripke.parsing.ast.operands.Atom;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

public final class Expressions {

    private Expressions() {
    }

    /**
     * Names of all atoms occurring in the expression, sorted.
     */
    public static Set<String> atoms(Expression expression) {
        Set<String> names = new TreeSet<String>();
        Deque<Expression> todo = new ArrayDeque<Expression>();
        todo.push(expression);
        while (!todo.isEmpty()) {
            Expression current = todo.pop();
            if (current instanceof Atom) {
                names.add(((Atom) current).getName());
            }
            for (Expression child : current.children()) {
                todo.push(child);
            }
        }
        return names;
    }

    /**
     * Number of nodes in the expression tree.
     */
    public static int size(Expression expression) {
        int size = 0;
        Deque<Expression> todo = new ArrayDeque<Expression>();
        todo.push(expression);
        while (!todo.isEmpty()) {
            Expression current = todo.pop();
            size++;
            for (Expression child : current.children()) {
                todo.push(child);
            }
        }
        return size;
    }
}
