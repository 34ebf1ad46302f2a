package org.dice.kripke.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A Kripke model held in memory, assembled with a {@link Builder}.
 */
public final class ExplicitKripkeModel implements KripkeModel {

    // key of the default relation
    private static final String DEFAULT_RELATION = "";

    private final ImmutableList<String> worlds;
    private final ImmutableMap<String, Integer> indices;
    private final ImmutableList<ImmutableSet<String>> valuation;
    private final ImmutableMap<String, ImmutableList<ImmutableSet<Integer>>> relations;

    private ExplicitKripkeModel(ImmutableList<String> worlds,
                                ImmutableList<ImmutableSet<String>> valuation,
                                ImmutableMap<String, ImmutableList<ImmutableSet<Integer>>> relations) {
        this.worlds = worlds;
        this.valuation = valuation;
        this.relations = relations;

        ImmutableMap.Builder<String, Integer> indexBuilder = ImmutableMap.builder();
        for (int i = 0; i < worlds.size(); i++) {
            indexBuilder.put(worlds.get(i), i);
        }
        this.indices = indexBuilder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> listWorlds() {
        return worlds;
    }

    public int worldCount() {
        return worlds.size();
    }

    public int indexOf(String world) {
        Integer index = indices.get(world);
        if (index == null) {
            throw new ModelShapeException(String.format("Unknown world: %s", world));
        }
        return index;
    }

    public String nameOf(int world) {
        checkWorld(world);
        return worlds.get(world);
    }

    public Set<String> valuationOf(int world) {
        checkWorld(world);
        return valuation.get(world);
    }

    public Set<Integer> successors(int world, String agent) {
        checkWorld(world);
        ImmutableList<ImmutableSet<Integer>> relation = relations.get(relationKey(agent));
        if (relation == null) {
            return ImmutableSet.of();
        }
        return relation.get(world);
    }

    public Set<String> agents() {
        ImmutableSet.Builder<String> agents = ImmutableSet.builder();
        for (String key : relations.keySet()) {
            if (!DEFAULT_RELATION.equals(key)) {
                agents.add(key);
            }
        }
        return agents.build();
    }

    /**
     * Worlds with no successors under the agent's relation (the default relation for null).
     * Every box holds and every diamond fails at these worlds.
     */
    public Set<String> blindWorlds(String agent) {
        ImmutableSet.Builder<String> blind = ImmutableSet.builder();
        for (int w = 0; w < worlds.size(); w++) {
            if (successors(w, agent).isEmpty()) {
                blind.add(worlds.get(w));
            }
        }
        return blind.build();
    }

    private void checkWorld(int world) {
        if (world < 0 || world >= worlds.size()) {
            throw new ModelShapeException(String.format("Unknown world index %d, model has %d worlds", world, worlds.size()));
        }
    }

    private static String relationKey(String agent) {
        return Strings.nullToEmpty(agent);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("W    = {").append(StringUtils.join(worlds, ", ")).append("}\n");
        for (Map.Entry<String, ImmutableList<ImmutableSet<Integer>>> relation : relations.entrySet()) {
            List<String> pairs = new ArrayList<String>();
            for (int from = 0; from < worlds.size(); from++) {
                for (int to : relation.getValue().get(from)) {
                    pairs.add(String.format("(%s, %s)", worlds.get(from), worlds.get(to)));
                }
            }
            String label = DEFAULT_RELATION.equals(relation.getKey()) ? "R" : "R(" + relation.getKey() + ")";
            sb.append(StringUtils.rightPad(label, 4)).append(" = {").append(StringUtils.join(pairs, ", ")).append("}\n");
        }
        Map<String, Set<String>> byAtom = new LinkedHashMap<String, Set<String>>();
        for (String atom : new TreeSet<String>(allAtoms())) {
            Set<String> holdsIn = new LinkedHashSet<String>();
            for (int w = 0; w < worlds.size(); w++) {
                if (valuation.get(w).contains(atom)) {
                    holdsIn.add(worlds.get(w));
                }
            }
            byAtom.put(atom, holdsIn);
        }
        for (Map.Entry<String, Set<String>> entry : byAtom.entrySet()) {
            sb.append(String.format("V(%s) = {%s}\n", entry.getKey(), StringUtils.join(entry.getValue(), ", ")));
        }
        return sb.toString().trim();
    }

    private Set<String> allAtoms() {
        Set<String> atoms = new LinkedHashSet<String>();
        for (ImmutableSet<String> atomsAtWorld : valuation) {
            atoms.addAll(atomsAtWorld);
        }
        return atoms;
    }

    /**
     * Collects worlds, valuations and transitions. Worlds have to be declared with
     * {@link #addWorld(String)} before {@link #build()}, in any order relative to the
     * valuations and transitions that mention them.
     */
    public static final class Builder {

        private final Set<String> worlds = new LinkedHashSet<String>();
        private final SetMultimap<String, String> valuation = LinkedHashMultimap.create();
        private final Map<String, SetMultimap<String, String>> relations = new LinkedHashMap<String, SetMultimap<String, String>>();

        private Builder() {
        }

        public Builder addWorld(String world) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(world), "world name must not be empty");
            worlds.add(world);
            return this;
        }

        public Builder addWorlds(String... worlds) {
            return addWorlds(Arrays.asList(worlds));
        }

        public Builder addWorlds(Collection<String> worlds) {
            for (String world : worlds) {
                addWorld(world);
            }
            return this;
        }

        /**
         * Makes the atoms true at the world.
         */
        public Builder addValuation(String world, String... atoms) {
            valuation.putAll(world, Arrays.asList(atoms));
            return this;
        }

        /**
         * Makes the atom true at each of the worlds, V(atom) = {worlds}.
         */
        public Builder addVals(String atom, String... worlds) {
            for (String world : worlds) {
                valuation.put(world, atom);
            }
            return this;
        }

        public Builder addTransition(String from, String to) {
            return addTransition(null, from, to);
        }

        /**
         * Adds the edge {@code (from, to)} to the agent's relation, or to the default relation
         * when the agent is null.
         */
        public Builder addTransition(String agent, String from, String to) {
            String key = relationKey(agent);
            SetMultimap<String, String> relation = relations.get(key);
            if (relation == null) {
                relation = LinkedHashMultimap.create();
                relations.put(key, relation);
            }
            relation.put(from, to);
            return this;
        }

        /**
         * @throws ModelShapeException if a valuation or transition mentions an undeclared world
         */
        public ExplicitKripkeModel build() {
            ImmutableList<String> worldList = ImmutableList.copyOf(worlds);
            Map<String, Integer> index = new LinkedHashMap<String, Integer>();
            for (int i = 0; i < worldList.size(); i++) {
                index.put(worldList.get(i), i);
            }

            for (String world : valuation.keySet()) {
                requireDeclared(index, world, "valuation");
            }

            ImmutableList.Builder<ImmutableSet<String>> valuationBuilder = ImmutableList.builder();
            for (String world : worldList) {
                valuationBuilder.add(ImmutableSet.copyOf(valuation.get(world)));
            }

            ImmutableMap.Builder<String, ImmutableList<ImmutableSet<Integer>>> relationBuilder = ImmutableMap.builder();
            for (Map.Entry<String, SetMultimap<String, String>> relation : relations.entrySet()) {
                String where = DEFAULT_RELATION.equals(relation.getKey())
                        ? "default accessibility relation"
                        : String.format("accessibility relation of agent %s", relation.getKey());
                List<Set<Integer>> successors = new ArrayList<Set<Integer>>();
                for (int i = 0; i < worldList.size(); i++) {
                    successors.add(new LinkedHashSet<Integer>());
                }
                for (Map.Entry<String, String> edge : relation.getValue().entries()) {
                    int from = requireDeclared(index, edge.getKey(), where);
                    int to = requireDeclared(index, edge.getValue(), where);
                    successors.get(from).add(to);
                }
                ImmutableList.Builder<ImmutableSet<Integer>> frozen = ImmutableList.builder();
                for (Set<Integer> s : successors) {
                    frozen.add(ImmutableSet.copyOf(s));
                }
                relationBuilder.put(relation.getKey(), frozen.build());
            }

            return new ExplicitKripkeModel(worldList, valuationBuilder.build(), relationBuilder.build());
        }

        private static int requireDeclared(Map<String, Integer> index, String world, String where) {
            Integer i = index.get(world);
            if (i == null) {
                throw new ModelShapeException(String.format("The %s refers to unknown world %s", where, world));
            }
            return i;
        }
    }
}
