package org.dice.kripke.evaluation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang.StringUtils;
import org.dice.kripke.parsing.ast.Expression;

import java.util.List;
import java.util.Map;

/**
 * Partition of a model's worlds into those that satisfy a formula and those that don't,
 * with a counterexample trace for each world that doesn't.
 */
public class SatisfactionResult {

    private final Expression expression;
    private final ImmutableList<String> satisfying;
    private final ImmutableList<String> nonSatisfying;
    private final ImmutableMap<String, Trace> counterexamples;

    public SatisfactionResult(Expression expression, List<String> satisfying, List<String> nonSatisfying,
                              Map<String, Trace> counterexamples) {
        this.expression = expression;
        this.satisfying = ImmutableList.copyOf(satisfying);
        this.nonSatisfying = ImmutableList.copyOf(nonSatisfying);
        this.counterexamples = ImmutableMap.copyOf(counterexamples);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<String> getSatisfying() {
        return satisfying;
    }

    public List<String> getNonSatisfying() {
        return nonSatisfying;
    }

    public boolean isSatisfiedAt(String world) {
        return satisfying.contains(world);
    }

    /**
     * @return the counterexample for a world that fails the formula, null for a world that satisfies it
     */
    public Trace getCounterexample(String world) {
        return counterexamples.get(world);
    }

    public Map<String, Trace> getCounterexamples() {
        return counterexamples;
    }

    /**
     * True when the formula holds at every world of the model.
     */
    public boolean entails() {
        return nonSatisfying.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("M %s %s\n", entails() ? "|=" : "|/=", expression.render()));
        sb.append(String.format("satisfying     : {%s}\n", StringUtils.join(satisfying, ", ")));
        sb.append(String.format("not satisfying : {%s}", StringUtils.join(nonSatisfying, ", ")));
        for (String world : nonSatisfying) {
            sb.append(String.format("\ncounterexample at %s:\n%s", world, counterexamples.get(world)));
        }
        return sb.toString();
    }
}
