package org.dice.kripke.evaluation;

import org.apache.commons.lang.StringUtils;
import org.dice.kripke.model.KripkeModel;
import org.dice.kripke.parsing.ast.Expression;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * The worlds at which every sub-expression of a formula holds, computed in one bottom-up pass
 * by {@link Evaluator#annotate(Expression)}. Nodes are looked up by identity.
 */
public class Annotation {

    private final KripkeModel model;
    private final Expression root;
    private final Map<Expression, BitSet> worldSets;

    Annotation(KripkeModel model, Expression root, Map<Expression, BitSet> worldSets) {
        this.model = model;
        this.root = root;
        this.worldSets = worldSets;
    }

    public Expression getRoot() {
        return root;
    }

    public KripkeModel getModel() {
        return model;
    }

    /**
     * @throws IllegalArgumentException if the expression is not a node of the annotated tree
     */
    public boolean holds(Expression expression, int world) {
        return worldSet(expression).get(world);
    }

    /**
     * Names of the worlds where the node holds, in model order.
     */
    public List<String> worldsWhere(Expression expression) {
        BitSet set = worldSet(expression);
        List<String> names = new ArrayList<String>(set.cardinality());
        for (int w = set.nextSetBit(0); w >= 0; w = set.nextSetBit(w + 1)) {
            names.add(model.nameOf(w));
        }
        return names;
    }

    private BitSet worldSet(Expression expression) {
        BitSet set = worldSets.get(expression);
        if (set == null) {
            throw new IllegalArgumentException(String.format("%s is not part of %s", expression, root));
        }
        return set;
    }

    /**
     * Every sub-expression with the worlds where it holds, indented by nesting.
     */
    @Override
    public String toString() {
        List<String> lines = new ArrayList<String>();
        describe(root, 0, lines);
        return StringUtils.join(lines, "\n");
    }

    private void describe(Expression expression, int level, List<String> lines) {
        lines.add(String.format("%s%s holds in {%s}", StringUtils.repeat("    ", level), expression.render(),
                StringUtils.join(worldsWhere(expression), ", ")));
        for (Expression child : expression.children()) {
            describe(child, level + 1, lines);
        }
    }
}
