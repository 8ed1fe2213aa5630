package com.specdrift.variant;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily enumerates every topological ordering of an acyclic {@link EffectDependencyGraph}.
 *
 * <p>Backtracking runs on an explicit stack and only advances when the caller asks for the next
 * ordering, so stopping early costs nothing. Candidates are tried in ascending index order, which
 * makes the first ordering the lexicographically smallest one (the original order whenever the
 * original order is valid). The iterator cannot be rewound; create a new one to start over.
 */
final class TopologicalOrderings implements Iterator<int[]> {
    private final EffectDependencyGraph graph;
    private final int[] inDegrees;
    private final boolean[] placed;
    private final int[] order;
    private final int[] cursor;
    private int depth;
    private int[] pending;

    TopologicalOrderings(EffectDependencyGraph graph) {
        this.graph = graph;
        int size = graph.size();
        this.inDegrees = graph.inDegrees();
        this.placed = new boolean[size];
        this.order = new int[size];
        this.cursor = new int[size + 1];
        this.depth = 0;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public int[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no further topological ordering");
        }
        int[] result = pending;
        pending = null;
        return result;
    }

    private int[] advance() {
        int size = graph.size();
        while (depth >= 0) {
            if (depth == size) {
                int[] result = order.clone();
                stepBack();
                return result;
            }
            int candidate = nextCandidate(cursor[depth]);
            if (candidate < 0) {
                cursor[depth] = 0;
                stepBack();
                continue;
            }
            cursor[depth] = candidate + 1;
            place(candidate);
            depth++;
            cursor[depth] = 0;
        }
        return null;
    }

    private int nextCandidate(int from) {
        for (int node = from; node < placed.length; node++) {
            if (!placed[node] && inDegrees[node] == 0) {
                return node;
            }
        }
        return -1;
    }

    private void place(int node) {
        order[depth] = node;
        placed[node] = true;
        for (int target : graph.successors(node)) {
            inDegrees[target]--;
        }
    }

    private void stepBack() {
        depth--;
        if (depth < 0) {
            return;
        }
        int node = order[depth];
        placed[node] = false;
        for (int target : graph.successors(node)) {
            inDegrees[target]++;
        }
    }
}
