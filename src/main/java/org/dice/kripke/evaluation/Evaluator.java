package org.dice.kripke.evaluation;

import com.google.common.base.Preconditions;
import org.dice.kripke.KripkeSettings;
import org.dice.kripke.model.KripkeModel;
import org.dice.kripke.model.ModelShapeException;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.ExpressionVisitor;
import org.dice.kripke.parsing.ast.operands.Atom;
import org.dice.kripke.parsing.ast.operands.Constant;
import org.dice.kripke.parsing.ast.operators.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which worlds of a {@link KripkeModel} satisfy a formula.
 *
 * <p>Box quantifies universally over the worlds accessible under its relation and holds at a
 * world without successors; diamond quantifies existentially and fails there.
 *
 * <p>The evaluator keeps nothing between calls besides the model and its limits, so one
 * instance can serve any number of threads.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger( Evaluator.class );

    private final KripkeModel model;
    private final int maxDepth;

    public Evaluator(KripkeModel model) {
        this(model, KripkeSettings.configured());
    }

    public Evaluator(KripkeModel model, KripkeSettings settings) {
        this.model = Preconditions.checkNotNull(model, "model");
        this.maxDepth = settings.getMaxEvaluationDepth();
    }

    public KripkeModel getModel() {
        return model;
    }

    public boolean sat(Expression expression, String world) {
        return sat(expression, model.indexOf(world));
    }

    /**
     * Whether the expression holds at a single world. Each sub-expression is decided at most
     * once per world during the call, so shared successors are not re-explored.
     *
     * @throws ModelShapeException if the world is not in the model
     * @throws EvaluationDepthException if the expression is nested too deeply
     */
    public boolean sat(Expression expression, int world) {
        checkWorld(world);
        return holds(expression, world, 0, new IdentityHashMap<Expression, Map<Integer, Boolean>>());
    }

    /**
     * Evaluates the expression at every world and explains each world where it fails.
     */
    public SatisfactionResult satisfyingWorlds(Expression expression) {
        Annotation annotation = annotate(expression);
        List<String> satisfying = new ArrayList<String>();
        List<String> nonSatisfying = new ArrayList<String>();
        Map<String, Trace> counterexamples = new LinkedHashMap<String, Trace>();

        for (int w = 0; w < model.worldCount(); w++) {
            String name = model.nameOf(w);
            if (annotation.holds(expression, w)) {
                satisfying.add(name);
            } else {
                nonSatisfying.add(name);
                counterexamples.put(name, trace(annotation, w));
            }
        }
        log.debug("{} holds at {} of {} worlds", expression, satisfying.size(), model.worldCount());
        return new SatisfactionResult(expression, satisfying, nonSatisfying, counterexamples);
    }

    /**
     * True when the expression holds at every world of the model.
     */
    public boolean entails(Expression expression) {
        return satisfyingWorlds(expression).entails();
    }

    /**
     * The worlds where each sub-expression holds.
     */
    public Annotation annotate(Expression expression) {
        Map<Expression, BitSet> worldSets = new IdentityHashMap<Expression, BitSet>();
        worldSet(expression, 0, worldSets);
        return new Annotation(model, expression, worldSets);
    }

    public Trace explain(Expression expression, String world) {
        return explain(expression, model.indexOf(world));
    }

    /**
     * Why the expression has the value it has at the world: a counterexample where it fails,
     * a witness where it holds.
     */
    public Trace explain(Expression expression, int world) {
        checkWorld(world);
        return trace(annotate(expression), world);
    }

    private void checkWorld(int world) {
        if (world < 0 || world >= model.worldCount()) {
            throw new ModelShapeException(String.format("Unknown world index %d, model has %d worlds", world, model.worldCount()));
        }
    }

    private EvaluationDepthException depthExceeded(Expression expression) {
        log.debug("Evaluation depth limit {} exceeded at {}", maxDepth, expression);
        return new EvaluationDepthException(maxDepth);
    }

    private boolean holds(Expression expression, int world, int depth, Map<Expression, Map<Integer, Boolean>> decided) {
        if (depth > maxDepth) {
            throw depthExceeded(expression);
        }
        Map<Integer, Boolean> byWorld = decided.get(expression);
        if (byWorld == null) {
            byWorld = new HashMap<Integer, Boolean>();
            decided.put(expression, byWorld);
        }
        Boolean value = byWorld.get(world);
        if (value == null) {
            value = expression.accept(new PointwiseSatisfaction(world, depth, decided));
            byWorld.put(world, value);
        }
        return value;
    }

    private BitSet worldSet(Expression expression, int depth, Map<Expression, BitSet> worldSets) {
        if (depth > maxDepth) {
            throw depthExceeded(expression);
        }
        BitSet set = expression.accept(new WorldSets(depth, worldSets));
        worldSets.put(expression, set);
        return set;
    }

    private Trace trace(Annotation annotation, int world) {
        List<TraceStep> steps = new ArrayList<TraceStep>();
        Expression current = annotation.getRoot();
        int at = world;
        // every step moves to a strictly smaller sub-expression, so this ends at a leaf at the latest
        while (current != null) {
            Explanation explanation = current.accept(new Explainer(annotation, at));
            steps.add(new TraceStep(current, model.nameOf(at), annotation.holds(current, at), explanation.reason));
            current = explanation.next;
            at = explanation.nextWorld;
        }
        return new Trace(steps);
    }

    private static String relationName(String agent) {
        return agent == null ? "the default relation" : "the relation of agent " + agent;
    }

    private class PointwiseSatisfaction implements ExpressionVisitor<Boolean> {

        private final int world;
        private final int depth;
        private final Map<Expression, Map<Integer, Boolean>> decided;

        PointwiseSatisfaction(int world, int depth, Map<Expression, Map<Integer, Boolean>> decided) {
            this.world = world;
            this.depth = depth;
            this.decided = decided;
        }

        private boolean child(Expression expression) {
            return child(expression, world);
        }

        private boolean child(Expression expression, int at) {
            return holds(expression, at, depth + 1, decided);
        }

        public Boolean visit(Atom atom) {
            return model.valuationOf(world).contains(atom.getName());
        }

        public Boolean visit(Constant constant) {
            return constant.getValue();
        }

        public Boolean visit(Not not) {
            return !child(not.getChild());
        }

        public Boolean visit(And and) {
            return child(and.getLeft()) && child(and.getRight());
        }

        public Boolean visit(Or or) {
            return child(or.getLeft()) || child(or.getRight());
        }

        public Boolean visit(Implies implies) {
            return !child(implies.getLeft()) || child(implies.getRight());
        }

        public Boolean visit(Iff iff) {
            return child(iff.getLeft()) == child(iff.getRight());
        }

        public Boolean visit(Box box) {
            for (int successor : model.successors(world, box.getAgent())) {
                if (!child(box.getChild(), successor)) {
                    return false;
                }
            }
            return true;
        }

        public Boolean visit(Diamond diamond) {
            for (int successor : model.successors(world, diamond.getAgent())) {
                if (child(diamond.getChild(), successor)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Computes the set of worlds where a node holds from the sets of its children, recording
     * every set on the way.
     */
    private class WorldSets implements ExpressionVisitor<BitSet> {

        private final int depth;
        private final Map<Expression, BitSet> worldSets;
        private final int worlds = model.worldCount();

        WorldSets(int depth, Map<Expression, BitSet> worldSets) {
            this.depth = depth;
            this.worldSets = worldSets;
        }

        // a private copy, the child's own set stays in the annotation
        private BitSet child(Expression expression) {
            return (BitSet) worldSet(expression, depth + 1, worldSets).clone();
        }

        public BitSet visit(Atom atom) {
            BitSet set = new BitSet(worlds);
            for (int w = 0; w < worlds; w++) {
                if (model.valuationOf(w).contains(atom.getName())) {
                    set.set(w);
                }
            }
            return set;
        }

        public BitSet visit(Constant constant) {
            BitSet set = new BitSet(worlds);
            if (constant.getValue()) {
                set.set(0, worlds);
            }
            return set;
        }

        public BitSet visit(Not not) {
            BitSet set = child(not.getChild());
            set.flip(0, worlds);
            return set;
        }

        public BitSet visit(And and) {
            BitSet set = child(and.getLeft());
            set.and(child(and.getRight()));
            return set;
        }

        public BitSet visit(Or or) {
            BitSet set = child(or.getLeft());
            set.or(child(or.getRight()));
            return set;
        }

        public BitSet visit(Implies implies) {
            BitSet set = child(implies.getLeft());
            set.flip(0, worlds);
            set.or(child(implies.getRight()));
            return set;
        }

        public BitSet visit(Iff iff) {
            BitSet set = child(iff.getLeft());
            set.xor(child(iff.getRight()));
            set.flip(0, worlds);
            return set;
        }

        public BitSet visit(Box box) {
            BitSet operand = child(box.getChild());
            BitSet set = new BitSet(worlds);
            for (int w = 0; w < worlds; w++) {
                if (allIn(model.successors(w, box.getAgent()), operand)) {
                    set.set(w);
                }
            }
            return set;
        }

        public BitSet visit(Diamond diamond) {
            BitSet operand = child(diamond.getChild());
            BitSet set = new BitSet(worlds);
            for (int w = 0; w < worlds; w++) {
                if (anyIn(model.successors(w, diamond.getAgent()), operand)) {
                    set.set(w);
                }
            }
            return set;
        }

        private boolean allIn(Set<Integer> successors, BitSet operand) {
            for (int successor : successors) {
                if (!operand.get(successor)) {
                    return false;
                }
            }
            return true;
        }

        private boolean anyIn(Set<Integer> successors, BitSet operand) {
            for (int successor : successors) {
                if (operand.get(successor)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class Explanation {
        private final String reason;
        private final Expression next;
        private final int nextWorld;

        private Explanation(String reason, Expression next, int nextWorld) {
            this.reason = reason;
            this.next = next;
            this.nextWorld = nextWorld;
        }

        static Explanation settled(String reason) {
            return new Explanation(reason, null, -1);
        }

        static Explanation follow(String reason, Expression next, int nextWorld) {
            return new Explanation(reason, next, nextWorld);
        }
    }

    /**
     * Picks the child, or the accessible world, that accounts for a node's value.
     */
    private class Explainer implements ExpressionVisitor<Explanation> {

        private final Annotation annotation;
        private final int world;

        Explainer(Annotation annotation, int world) {
            this.annotation = annotation;
            this.world = world;
        }

        private boolean value(Expression expression) {
            return annotation.holds(expression, world);
        }

        private Explanation follow(String reason, Expression next) {
            return Explanation.follow(reason, next, world);
        }

        public Explanation visit(Atom atom) {
            return Explanation.settled(String.format("%s is %s at %s",
                    atom.getName(), value(atom) ? "true" : "false", model.nameOf(world)));
        }

        public Explanation visit(Constant constant) {
            return Explanation.settled(constant.getValue() ? "true holds at every world" : "false holds at no world");
        }

        public Explanation visit(Not not) {
            return follow(value(not.getChild()) ? "operand is true" : "operand is false", not.getChild());
        }

        public Explanation visit(And and) {
            if (!value(and.getLeft())) {
                return follow("left operand is false", and.getLeft());
            }
            if (!value(and.getRight())) {
                return follow("right operand is false", and.getRight());
            }
            return follow("both operands are true", and.getLeft());
        }

        public Explanation visit(Or or) {
            if (value(or.getLeft())) {
                return follow("left operand is true", or.getLeft());
            }
            if (value(or.getRight())) {
                return follow("right operand is true", or.getRight());
            }
            return follow("both operands are false", or.getLeft());
        }

        public Explanation visit(Implies implies) {
            if (!value(implies.getLeft())) {
                return follow("premise is false", implies.getLeft());
            }
            if (value(implies.getRight())) {
                return follow("conclusion is true", implies.getRight());
            }
            return follow("premise is true but conclusion is false", implies.getRight());
        }

        public Explanation visit(Iff iff) {
            boolean left = value(iff.getLeft());
            boolean right = value(iff.getRight());
            if (left == right) {
                return follow(left ? "both sides are true" : "both sides are false", iff.getLeft());
            }
            return follow(String.format("left side is %s but right side is %s", left, right), iff.getLeft());
        }

        public Explanation visit(Box box) {
            Set<Integer> successors = model.successors(world, box.getAgent());
            if (successors.isEmpty()) {
                return Explanation.settled(String.format("%s has no successors under %s, so the box holds vacuously",
                        model.nameOf(world), relationName(box.getAgent())));
            }
            for (int successor : successors) {
                if (!annotation.holds(box.getChild(), successor)) {
                    return Explanation.follow(String.format("operand fails at successor %s", model.nameOf(successor)),
                            box.getChild(), successor);
                }
            }
            return Explanation.follow(String.format("operand holds at all %d successors", successors.size()),
                    box.getChild(), successors.iterator().next());
        }

        public Explanation visit(Diamond diamond) {
            Set<Integer> successors = model.successors(world, diamond.getAgent());
            if (successors.isEmpty()) {
                return Explanation.settled(String.format("%s has no successors under %s, so the diamond fails",
                        model.nameOf(world), relationName(diamond.getAgent())));
            }
            for (int successor : successors) {
                if (annotation.holds(diamond.getChild(), successor)) {
                    return Explanation.follow(String.format("operand holds at successor %s", model.nameOf(successor)),
                            diamond.getChild(), successor);
                }
            }
            return Explanation.follow(String.format("operand fails at all %d successors", successors.size()),
                    diamond.getChild(), successors.iterator().next());
        }
    }
}
