package org.dice.kripke.evaluation;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain of steps from a formula at a world down to the atom, constant or successor-less
 * world that settles its value. For a world that fails the formula this is the counterexample;
 * for a world that satisfies it, the witness.
 */
public class Trace {

    private final ImmutableList<TraceStep> steps;

    public Trace(List<TraceStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A trace needs at least one step");
        }
        this.steps = ImmutableList.copyOf(steps);
    }

    public List<TraceStep> getSteps() {
        return steps;
    }

    public TraceStep getRoot() {
        return steps.get(0);
    }

    public TraceStep getLast() {
        return steps.get(steps.size() - 1);
    }

    /**
     * Worlds visited by the trace, in order, one entry per step.
     */
    public List<String> getWorlds() {
        List<String> worlds = new ArrayList<String>(steps.size());
        for (TraceStep step : steps) {
            worlds.add(step.getWorld());
        }
        return worlds;
    }

    public boolean getValue() {
        return getRoot().getValue();
    }

    @Override
    public String toString() {
        List<String> lines = new ArrayList<String>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            lines.add(StringUtils.repeat("  ", i) + steps.get(i));
        }
        return StringUtils.join(lines, "\n");
    }
}
