package org.dice.kripke;

/**
 * Names of the configuration properties read by {@link KripkeSettings}.
 */
public interface KripkeParams {

    String PREFIX = "kripke.";

    // deepest formula the parser accepts, counting groups and operators. This is the depth of the
    // tree, so a flat chain like p0 & p1 & ... & pn is n levels deep; raise it together with
    // the evaluation depth for long chains
    String MAX_PARSE_DEPTH = PREFIX + "maxParseDepth";

    // deepest recursion the evaluator allows before giving up
    String MAX_EVALUATION_DEPTH = PREFIX + "maxEvaluationDepth";

    // classpath resource holding the defaults
    String RESOURCE = "kripke.properties";
}
