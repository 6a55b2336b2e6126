package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.SequenceFlow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds where the branches of a split converge again.
 *
 * <p>The merge point is the element reachable from every branch that is closest (in
 * breadth-first order) to the first branch. Searches never pass through the split itself or
 * through elements on the current traversal path, so loop-backs do not count as convergence.
 */
class MergePointFinder {

    /**
     * Finds the merge point of a split.
     *
     * @param graph process graph
     * @param splitId id of the splitting element
     * @param branchTargets first element of each branch, in branch order
     * @param path elements on the current traversal path
     * @return merge point, or empty when the branches never converge
     */
    Optional<String> find(ProcessGraph graph, String splitId, List<String> branchTargets, Set<String> path) {
        List<String> distinctTargets = new ArrayList<>(new LinkedHashSet<>(branchTargets));
        if (distinctTargets.isEmpty()) {
            return Optional.empty();
        }
        if (distinctTargets.size() == 1) {
            String only = distinctTargets.get(0);
            return path.contains(only) || only.equals(splitId) ? Optional.empty() : Optional.of(only);
        }

        List<Set<String>> reachable = new ArrayList<>();
        for (String target : distinctTargets) {
            reachable.add(reach(graph, target, splitId, path));
        }

        // reach() returns breadth-first order, so the first common element is the nearest one
        for (String candidate : reachable.get(0)) {
            boolean common = reachable.stream().allMatch(set -> set.contains(candidate));
            if (common) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Set<String> reach(ProcessGraph graph, String start, String splitId, Set<String> path) {
        Set<String> seen = new LinkedHashSet<>();
        if (start.equals(splitId) || path.contains(start)) {
            return seen;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (SequenceFlow flow : graph.outgoing(current)) {
                String next = flow.targetId();
                if (next.equals(splitId) || path.contains(next) || !seen.add(next)) {
                    continue;
                }
                queue.add(next);
            }
        }
        return seen;
    }
}
