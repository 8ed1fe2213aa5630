package com.specdrift.variant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.specdrift.model.Effect;

public class DependencyGraphBuilder {
    private final Set<DependencyRule> rules;

    public DependencyGraphBuilder() {
        this(EnumSet.allOf(DependencyRule.class));
    }

    public DependencyGraphBuilder(Set<DependencyRule> rules) {
        this.rules = rules.isEmpty() ? EnumSet.noneOf(DependencyRule.class) : EnumSet.copyOf(rules);
    }

    public EffectDependencyGraph build(List<Effect> effects) {
        List<EffectTokens> tokens = effects.stream().map(EffectTokens::of).toList();
        EffectDependencyGraph graph = new EffectDependencyGraph(effects.size());
        for (int i = 0; i < tokens.size(); i++) {
            for (int j = 0; j < tokens.size(); j++) {
                if (i != j && dependsOn(tokens.get(j), tokens.get(i))) {
                    graph.addEdge(i, j);
                }
            }
        }
        return graph;
    }

    public boolean dependsOn(Effect dependent, Effect prerequisite) {
        return dependsOn(EffectTokens.of(dependent), EffectTokens.of(prerequisite));
    }

    private boolean dependsOn(EffectTokens dependent, EffectTokens prerequisite) {
        return rules.stream().anyMatch(rule -> rule.applies(dependent, prerequisite));
    }

    /**
     * Returns up to {@code limit} distinct effect orderings that respect every edge of
     * {@code graph}. A cyclic graph only admits the original ordering.
     */
    public List<List<Effect>> enumerateOrderings(EffectDependencyGraph graph, List<Effect> effects, int limit) {
        if (graph.size() != effects.size()) {
            throw new IllegalArgumentException("graph has " + graph.size() + " nodes but " + effects.size() + " effects were given");
        }
        if (limit <= 0) {
            return List.of();
        }
        if (!graph.isAcyclic()) {
            return List.of(List.copyOf(effects));
        }

        List<List<Effect>> orderings = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        Iterator<int[]> candidates = new TopologicalOrderings(graph);
        while (orderings.size() < limit && candidates.hasNext()) {
            List<Effect> ordering = Arrays.stream(candidates.next())
                    .mapToObj(effects::get)
                    .toList();
            if (seen.add(ordering.stream().map(Effect::description).toList())) {
                orderings.add(ordering);
            }
        }
        return List.copyOf(orderings);
    }
}
