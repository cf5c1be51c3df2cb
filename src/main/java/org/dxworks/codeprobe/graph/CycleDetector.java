package org.dxworks.codeprobe.graph;

import org.dxworks.codeprobe.model.Cycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Depth-first cycle search over a {@link DependencyGraph}.
 *
 * <p>Uses an explicit frame stack instead of recursion so deep import chains cannot exhaust the
 * call stack. Reaching a node that is still on the exploration path closes a cycle, reported as
 * the path from that node's position to the repeat. Fully explored nodes are never entered again,
 * so the search terminates on any finite graph and visits every edge once.</p>
 */
public final class CycleDetector {

    private CycleDetector() {}

    public static List<Cycle> findCycles(DependencyGraph graph) {
        List<Cycle> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String root : graph.nodes()) {
            if (visited.contains(root)) continue;

            enter(root, graph, visited, onPath, path, stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.neighbors.hasNext()) {
                    stack.pop();
                    onPath.remove(frame.node);
                    path.remove(path.size() - 1);
                    continue;
                }

                String next = frame.neighbors.next();
                if (onPath.contains(next)) {
                    List<String> chain = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    chain.add(next);
                    cycles.add(new Cycle(chain));
                } else if (!visited.contains(next)) {
                    enter(next, graph, visited, onPath, path, stack);
                }
            }
        }
        return cycles;
    }

    private static void enter(String node, DependencyGraph graph, Set<String> visited, Set<String> onPath,
                              List<String> path, Deque<Frame> stack) {
        visited.add(node);
        onPath.add(node);
        path.add(node);
        stack.push(new Frame(node, graph.dependenciesOf(node).iterator()));
    }

    private static final class Frame {
        final String node;
        final Iterator<String> neighbors;

        Frame(String node, Iterator<String> neighbors) {
            this.node = node;
            this.neighbors = neighbors;
        }
    }
}
