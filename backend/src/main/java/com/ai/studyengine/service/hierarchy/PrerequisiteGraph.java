package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.exception.PrerequisiteCycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Cycle detection over prerequisite edges between leaves. Leaves are
 * identified by their ordinal in traversal order; an edge {@code a -> b}
 * means "a requires b".
 */
public final class PrerequisiteGraph {

    private PrerequisiteGraph() {
    }

    /**
     * Returns one cycle as a list of ordinals (first element repeated at the
     * end), or an empty list when the graph is acyclic.
     */
    public static List<Integer> findCycle(int leafCount, Map<Integer, ? extends List<Integer>> requires) {
        int[] state = new int[leafCount]; // 0 = new, 1 = on stack, 2 = done
        Deque<Integer> stack = new ArrayDeque<>();
        for (int start = 0; start < leafCount; start++) {
            if (state[start] == 0) {
                List<Integer> cycle = visit(start, requires, state, stack);
                if (!cycle.isEmpty())
                    return cycle;
            }
        }
        return Collections.emptyList();
    }

    private static List<Integer> visit(int node, Map<Integer, ? extends List<Integer>> requires,
                                       int[] state, Deque<Integer> stack) {
        state[node] = 1;
        stack.push(node);
        List<Integer> edges = requires.get(node);
        for (int next : edges == null ? List.<Integer>of() : edges) {
            if (next < 0 || next >= state.length)
                continue;
            if (state[next] == 1) {
                List<Integer> cycle = new ArrayList<>();
                for (int n : stack) {
                    cycle.add(n);
                    if (n == next)
                        break;
                }
                Collections.reverse(cycle);
                cycle.add(next);
                return cycle;
            }
            if (state[next] == 0) {
                List<Integer> cycle = visit(next, requires, state, stack);
                if (!cycle.isEmpty())
                    return cycle;
            }
        }
        stack.pop();
        state[node] = 2;
        return Collections.emptyList();
    }

    /**
     * @throws PrerequisiteCycleException naming the leaves on the first cycle found
     */
    public static void requireAcyclic(int leafCount, Map<Integer, ? extends List<Integer>> requires,
                                      IntFunction<String> titleOf) {
        List<Integer> cycle = findCycle(leafCount, requires);
        if (!cycle.isEmpty()) {
            throw new PrerequisiteCycleException(cycle.stream().map(titleOf::apply).toList());
        }
    }
}
