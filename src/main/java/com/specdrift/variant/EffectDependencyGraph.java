package com.specdrift.variant;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public final class EffectDependencyGraph {
    private final List<Set<Integer>> successors;

    EffectDependencyGraph(int size) {
        this.successors = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            successors.add(new TreeSet<>());
        }
    }

    void addEdge(int from, int to) {
        successors.get(from).add(to);
    }

    public int size() {
        return successors.size();
    }

    public boolean hasEdge(int from, int to) {
        return successors.get(from).contains(to);
    }

    public Set<Integer> successors(int node) {
        return Set.copyOf(successors.get(node));
    }

    public int edgeCount() {
        return successors.stream().mapToInt(Set::size).sum();
    }

    int[] inDegrees() {
        int[] inDegrees = new int[size()];
        for (Set<Integer> targets : successors) {
            for (int target : targets) {
                inDegrees[target]++;
            }
        }
        return inDegrees;
    }

    public boolean isAcyclic() {
        int[] inDegrees = inDegrees();
        List<Integer> ready = new ArrayList<>();
        for (int i = 0; i < inDegrees.length; i++) {
            if (inDegrees[i] == 0) {
                ready.add(i);
            }
        }
        int visited = 0;
        while (!ready.isEmpty()) {
            int node = ready.remove(ready.size() - 1);
            visited++;
            for (int target : successors.get(node)) {
                if (--inDegrees[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return visited == size();
    }

    @Override
    public String toString() {
        return "EffectDependencyGraph{" +
                "nodes=" + size() +
                ", successors=" + successors +
                '}';
    }
}
