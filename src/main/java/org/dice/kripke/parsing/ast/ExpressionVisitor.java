package org.dice.kripke.parsing.ast;

import org.dice.kripke.parsing.ast.operands.Atom;
import org.dice.kripke.parsing.ast.operands.Constant;
import org.dice.kripke.parsing.ast.operators.And;
import org.dice.kripke.parsing.ast.operators.Box;
import org.dice.kripke.parsing.ast.operators.Diamond;
import org.dice.kripke.parsing.ast.operators.Iff;
import org.dice.kripke.parsing.ast.operators.Implies;
import org.dice.kripke.parsing.ast.operators.Not;
import org.dice.kripke.parsing.ast.operators.Or;

/**
 * One method per expression variant. Adding a variant means adding a method here,
 * which every visitor then has to implement.
 */
public interface ExpressionVisitor<R> {
    R visit(Atom atom);
    R visit(Constant constant);
    R visit(Not not);
    R visit(And and);
    R visit(Or or);
    R visit(Implies implies);
    R visit(Iff iff);
    R visit(Box box);
    R visit(Diamond diamond);
}
