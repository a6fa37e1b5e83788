package com.flowchart.fsmc.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable, CSR-encoded transition graph of one machine.
 *
 * <p>
 * States are indexed in insertion order. Outgoing targets of state {@code i}
 * are stored in {@code targetList[targetOffset[i] .. targetOffset[i+1])}, in
 * the order the transitions were added. Unlike a dependency graph a state
 * machine may contain cycles and self-loops, so none are rejected; the
 * structure only answers reachability and shortest-path questions.
 */
@Log4j2
public final class StateTopology {
    private final String[] names;
    private final int[] targetOffset;
    private final int[] targetList;
    private final Map<String, Integer> nameToIndex;

    private StateTopology(String[] names, int[] targetOffset, int[] targetList, Map<String, Integer> nameToIndex) {
        this.names = names;
        this.targetOffset = targetOffset;
        this.targetList = targetList;
        this.nameToIndex = nameToIndex;
    }

    public int stateCount() {
        return names.length;
    }

    public String name(int i) {
        return names[i];
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Resolves a state name to its index. */
    public int index(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown state: " + name);
        return idx;
    }

    public int targetCount(int i) {
        return targetOffset[i + 1] - targetOffset[i];
    }

    public int target(int i, int k) {
        return targetList[targetOffset[i] + k];
    }

    /** States reachable from {@code start} (inclusive), by breadth-first search. */
    public BitSet reachableFrom(String start) {
        BitSet seen = new BitSet(names.length);
        int[] queue = new int[names.length];
        int head = 0, tail = 0;
        int s = index(start);
        seen.set(s);
        queue[tail++] = s;
        while (head < tail) {
            int curr = queue[head++];
            for (int f = targetOffset[curr]; f < targetOffset[curr + 1]; f++) {
                int next = targetList[f];
                if (!seen.get(next)) {
                    seen.set(next);
                    queue[tail++] = next;
                }
            }
        }
        return seen;
    }

    /** Names of states not reachable from {@code start}, in index order. */
    public List<String> unreachableFrom(String start) {
        BitSet seen = reachableFrom(start);
        List<String> out = new ArrayList<>();
        for (int i = seen.nextClearBit(0); i < names.length; i = seen.nextClearBit(i + 1))
            out.add(names[i]);
        return out;
    }

    /**
     * Breadth-first predecessor table from {@code start}: {@code pred[i]} is the
     * state preceding {@code i} on a shortest path, {@code -1} for the start
     * state and {@code -2} for unreachable states.
     */
    public int[] shortestPathTree(String start) {
        int[] pred = new int[names.length];
        Arrays.fill(pred, -2);
        int[] queue = new int[names.length];
        int head = 0, tail = 0;
        int s = index(start);
        pred[s] = -1;
        queue[tail++] = s;
        while (head < tail) {
            int curr = queue[head++];
            for (int f = targetOffset[curr]; f < targetOffset[curr + 1]; f++) {
                int next = targetList[f];
                if (pred[next] == -2) {
                    pred[next] = curr;
                    queue[tail++] = next;
                }
            }
        }
        return pred;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder collecting states and transitions before compaction. */
    public static final class Builder {
        private final List<String> states = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<List<Integer>> forward = new ArrayList<>();

        /** Adds a state; repeated names are ignored. */
        public Builder addState(String name) {
            if (nameToIdx.containsKey(name))
                return this;
            nameToIdx.put(name, states.size());
            states.add(name);
            forward.add(new ArrayList<>());
            return this;
        }

        /** Adds a transition. Both endpoints must already be states. */
        public Builder addTransition(String from, String to) {
            forward.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public boolean hasState(String name) {
            return nameToIdx.containsKey(name);
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown state: " + name);
            return idx;
        }

        public StateTopology build() {
            int n = states.size();
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++)
                offsets[i + 1] = offsets[i] + forward.get(i).size();

            int[] flat = new int[offsets[n]];
            for (int i = 0; i < n; i++) {
                List<Integer> targets = forward.get(i);
                for (int k = 0; k < targets.size(); k++)
                    flat[offsets[i] + k] = targets.get(k);
            }
            log.debug("Built state topology: {} states, {} transitions", n, flat.length);
            return new StateTopology(states.toArray(new String[0]), offsets, flat, new HashMap<>(nameToIdx));
        }
    }
}
