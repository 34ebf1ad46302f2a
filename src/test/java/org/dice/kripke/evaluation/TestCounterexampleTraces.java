package org.dice.kripke.evaluation;

import org.dice.kripke.RandomFormulas;
import org.dice.kripke.model.ExplicitKripkeModel;
import org.dice.kripke.model.KripkeModel;
import org.dice.kripke.parsing.FormulaException;
import org.dice.kripke.parsing.RecursiveDescentParser;
import org.dice.kripke.parsing.ast.Expression;
import org.dice.kripke.parsing.ast.operands.Atom;
import org.dice.kripke.parsing.ast.operands.Constant;
import org.dice.kripke.parsing.ast.operators.ModalOperator;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertNull;
import static junit.framework.TestCase.assertTrue;

public class TestCounterexampleTraces {

    /*
     * w0 -> w1 -> w2, w0 -> w2 under the default relation, w2 has no successors
     * p at w1, q at w0 and w2
     */
    private static final KripkeModel MODEL = ExplicitKripkeModel.builder()
            .addWorlds("w0", "w1", "w2")
            .addValuation("w0", "q")
            .addValuation("w1", "p")
            .addValuation("w2", "q")
            .addTransition("w0", "w1")
            .addTransition("w0", "w2")
            .addTransition("w1", "w2")
            .build();

    private final Evaluator evaluator = new Evaluator(MODEL);

    @Test
    public void followsFailingSuccessorOfBox() throws Exception {
        Trace trace = counterexample("[]p", "w0");

        assertEquals(Arrays.asList("w0", "w2"), trace.getWorlds());
        assertEquals("operand fails at successor w2", trace.getRoot().getReason());
        assertEquals("p is false at w2", trace.getLast().getReason());
        assertFalse(trace.getLast().getValue());
    }

    @Test
    public void stopsAtWorldWithoutSuccessorsForDiamond() throws Exception {
        Trace trace = counterexample("<>q", "w2");

        assertEquals(1, trace.getSteps().size());
        assertEquals("w2 has no successors under the default relation, so the diamond fails", trace.getRoot().getReason());
    }

    @Test
    public void namesTheAgentWithoutSuccessors() throws Exception {
        Trace trace = counterexample("<a>q", "w0");
        assertTrue(trace.getRoot().getReason(), trace.getRoot().getReason().contains("the relation of agent a"));
    }

    @Test
    public void followsTheFalseConjunct() throws Exception {
        Trace trace = counterexample("q & p", "w0");

        assertEquals(2, trace.getSteps().size());
        assertEquals("right operand is false", trace.getRoot().getReason());
        assertEquals("p", trace.getLast().getExpression().render());
    }

    @Test
    public void followsTheConclusionOfAFailedImplication() throws Exception {
        Trace trace = counterexample("q -> <>q", "w2");

        assertEquals("premise is true but conclusion is false", trace.getRoot().getReason());
        assertEquals("<>q", trace.getSteps().get(1).getExpression().render());
        assertEquals(2, trace.getSteps().size());
    }

    @Test
    public void negationFlipsTheValueAlongTheTrace() throws Exception {
        Trace trace = counterexample("~q", "w0");

        assertFalse(trace.getRoot().getValue());
        assertTrue(trace.getLast().getValue());
        assertEquals("q is true at w0", trace.getLast().getReason());
    }

    @Test
    public void explainsBothSidesOfAFailedEquivalence() throws Exception {
        Trace trace = counterexample("p <-> q", "w0");
        assertEquals("left side is false but right side is true", trace.getRoot().getReason());
    }

    @Test
    public void explainsSatisfiedBoxWithoutSuccessors() throws Exception {
        Trace trace = evaluator.explain(parse("[]false"), "w2");

        assertTrue(trace.getValue());
        assertEquals(1, trace.getSteps().size());
        assertTrue(trace.getRoot().getReason(), trace.getRoot().getReason().contains("holds vacuously"));
    }

    @Test
    public void witnessesDiamondAcrossSeveralSteps() throws Exception {
        Trace trace = evaluator.explain(parse("<><>q"), "w0");

        assertTrue(trace.getValue());
        assertEquals(Arrays.asList("w0", "w1", "w2"), trace.getWorlds());
        assertEquals("q is true at w2", trace.getLast().getReason());
    }

    @Test
    public void resultsOnlyCarryCounterexamplesForFailingWorlds() throws Exception {
        SatisfactionResult result = evaluator.satisfyingWorlds(parse("[]q"));

        assertEquals(Arrays.asList("w1", "w2"), result.getSatisfying());
        assertNull(result.getCounterexample("w1"));
        assertEquals(1, result.getCounterexamples().size());
        assertFalse(result.getCounterexample("w0").getValue());
    }

    @Test
    public void rendersOneIndentedLinePerStep() throws Exception {
        String[] lines = counterexample("[]p", "w0").toString().split("\n");

        assertEquals(2, lines.length);
        assertEquals("w0 |/= []p : operand fails at successor w2", lines[0]);
        assertEquals("  w2 |/= p : p is false at w2", lines[1]);
    }

    @Test
    public void everyTraceEndsAtSomethingThatSettlesIt() throws Exception {
        RandomFormulas random = new RandomFormulas(23L);
        for (int round = 0; round < 50; round++) {
            ExplicitKripkeModel model = random.model(5);
            Evaluator evaluator = new Evaluator(model);
            for (int i = 0; i < 20; i++) {
                Expression e = random.expression(5);
                for (int w = 0; w < model.worldCount(); w++) {
                    Trace trace = evaluator.explain(e, w);
                    assertEquals(e.render(), evaluator.sat(e, w), trace.getValue());
                    assertTrue(trace.getSteps().size() <= e.depth() + 1);

                    TraceStep last = trace.getLast();
                    Expression settled = last.getExpression();
                    if (settled instanceof ModalOperator) {
                        int at = model.indexOf(last.getWorld());
                        assertTrue(model.successors(at, ((ModalOperator) settled).getAgent()).isEmpty());
                    } else {
                        assertTrue(settled.render(), settled instanceof Atom || settled instanceof Constant);
                    }
                    assertStepsAreConsistent(evaluator, trace.getSteps());
                }
            }
        }
    }

    private void assertStepsAreConsistent(Evaluator evaluator, List<TraceStep> steps) {
        for (TraceStep step : steps) {
            assertEquals(step.toString(), evaluator.sat(step.getExpression(), step.getWorld()), step.getValue());
        }
    }

    private Trace counterexample(String formula, String world) throws FormulaException {
        Trace trace = evaluator.satisfyingWorlds(parse(formula)).getCounterexample(world);
        assertFalse(trace.getValue());
        return trace;
    }

    private Expression parse(String formula) throws FormulaException {
        return RecursiveDescentParser.parse(formula);
    }
}
