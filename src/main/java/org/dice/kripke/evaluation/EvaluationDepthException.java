package org.dice.kripke.evaluation;

/**
 * Raised instead of overflowing the stack when a formula is nested deeper than the
 * evaluator allows.
 */
public class EvaluationDepthException extends RuntimeException {

    private final int maxDepth;

    public EvaluationDepthException(int maxDepth) {
        super(String.format("Formula nesting exceeds the evaluation depth limit of %d", maxDepth));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
