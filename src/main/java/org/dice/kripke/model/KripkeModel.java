package org.dice.kripke.model;

import java.util.List;
import java.util.Set;

/**
 * Read only view of a finite Kripke model. Worlds are addressed by their index
 * {@code 0 .. worldCount() - 1}; names are only needed to report results.
 *
 * Implementations must not change while an evaluation is running.
 */
public interface KripkeModel {

    /**
     * World names, position i holding the name of world i.
     */
    List<String> listWorlds();

    int worldCount();

    /**
     * @throws ModelShapeException if there is no world with this name
     */
    int indexOf(String world);

    /**
     * @throws ModelShapeException if the index is out of range
     */
    String nameOf(int world);

    /**
     * Atoms true at the world; every other atom is false there.
     *
     * @throws ModelShapeException if the index is out of range
     */
    Set<String> valuationOf(int world);

    /**
     * Worlds reachable from {@code world} in one step of the agent's relation, or of the
     * default relation when {@code agent} is null. Empty when there are no such edges.
     *
     * @throws ModelShapeException if the index is out of range
     */
    Set<Integer> successors(int world, String agent);

    /**
     * Labels of the named relations in the model. The default relation has no label.
     */
    Set<String> agents();
}
