package org.bpmnlite.compiler.verifier;

import org.bpmnlite.compiler.bpmn.models.GatewayDirection;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bpmn.models.IRNode;
import org.bpmnlite.compiler.errors.BpmnCompileException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Structural checks run on a parsed graph before lowering.
 * The first violation found is thrown as a VERIFICATION_ERROR; the graph is never repaired.
 */
public class BpmnVerifier {

    public static void verify(IRGraph graph) {
        int start = checkSingleStart(graph);
        checkReachability(graph, start);
        checkBoundaryAttachments(graph);
        checkBoundaryFlows(graph);
        checkAmbiguousBranching(graph);
        checkGatewayArity(graph);
    }

    private static int checkSingleStart(IRGraph graph) {
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            if (graph.node(i) instanceof IRNode.Start) {
                starts.add(i);
            }
        }
        if (starts.size() != 1) {
            throw BpmnCompileException.verification("expected exactly one start event, found " + starts.size());
        }
        return starts.get(0);
    }

    private static void checkReachability(IRGraph graph, int start) {
        Map<String, List<Integer>> boundariesByActivity = boundariesByActivity(graph);

        Set<Integer> visited = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            List<Integer> next = new ArrayList<>();
            graph.outgoing(current).forEach(edge -> next.add(edge.target()));
            next.addAll(boundariesByActivity.getOrDefault(graph.node(current).id(), List.of()));
            for (int target : next) {
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }

        if (visited.size() != graph.nodeCount()) {
            String unreachable = IntStream.range(0, graph.nodeCount())
                    .filter(i -> !visited.contains(i))
                    .mapToObj(i -> graph.node(i).id())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw BpmnCompileException.verification("nodes not reachable from the start event: " + unreachable);
        }
    }

    private static void checkBoundaryAttachments(IRGraph graph) {
        for (IRNode node : graph.nodes()) {
            if (!node.isBoundary()) {
                continue;
            }
            IRNode target = graph.findIndexById(node.attachedTo()).map(graph::node).orElse(null);
            if (target == null) {
                throw BpmnCompileException.verification("boundary event '" + node.id()
                        + "' is attached to unknown element '" + node.attachedTo() + "'");
            }
            if (!target.isActivity()) {
                throw BpmnCompileException.verification("boundary event '" + node.id()
                        + "' is attached to '" + target.id() + "', which is not a task");
            }
        }
    }

    private static void checkBoundaryFlows(IRGraph graph) {
        Map<String, String> timerBoundaryByActivity = new HashMap<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            IRNode node = graph.node(i);
            if (!node.isBoundary()) {
                continue;
            }
            if (graph.outgoing(i).isEmpty()) {
                throw BpmnCompileException.verification("boundary event '" + node.id() + "' has no outgoing flow");
            }
            if (node instanceof IRNode.BoundaryTimer) {
                String previous = timerBoundaryByActivity.putIfAbsent(node.attachedTo(), node.id());
                if (previous != null) {
                    throw BpmnCompileException.verification("activity '" + node.attachedTo()
                            + "' has more than one timer boundary ('" + previous + "', '" + node.id() + "')");
                }
            }
        }
    }

    private static void checkAmbiguousBranching(IRGraph graph) {
        for (int i = 0; i < graph.nodeCount(); i++) {
            IRNode node = graph.node(i);
            if (node.isGateway() || graph.outgoing(i).size() <= 1) {
                continue;
            }
            long unconditioned = graph.outgoing(i).stream()
                    .filter(edge -> !edge.payload().isConditional())
                    .count();
            if (unconditioned > 1) {
                throw BpmnCompileException.verification("'" + node.id() + "' has " + unconditioned
                        + " unconditioned outgoing flows; at most one default flow is allowed");
            }
        }
    }

    private static void checkGatewayArity(IRGraph graph) {
        for (int i = 0; i < graph.nodeCount(); i++) {
            GatewayDirection direction = directionOf(graph.node(i));
            if (direction == null) {
                continue;
            }
            String id = graph.node(i).id();
            if (direction == GatewayDirection.DIVERGING && graph.outgoing(i).size() <= 1) {
                throw BpmnCompileException.verification("diverging gateway '" + id
                        + "' needs more than one outgoing flow, has " + graph.outgoing(i).size());
            }
            if (direction == GatewayDirection.CONVERGING && graph.incoming(i).size() <= 1) {
                throw BpmnCompileException.verification("converging gateway '" + id
                        + "' needs more than one incoming flow, has " + graph.incoming(i).size());
            }
            if (direction == GatewayDirection.CONVERGING && graph.outgoing(i).size() > 1) {
                throw BpmnCompileException.verification("converging gateway '" + id
                        + "' allows at most one outgoing flow, has " + graph.outgoing(i).size());
            }
        }
    }

    private static GatewayDirection directionOf(IRNode node) {
        if (node instanceof IRNode.GatewayAnd and) {
            return and.direction();
        }
        if (node instanceof IRNode.GatewayInclusive inclusive) {
            return inclusive.direction();
        }
        return null;
    }

    private static Map<String, List<Integer>> boundariesByActivity(IRGraph graph) {
        Map<String, List<Integer>> result = new HashMap<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            IRNode node = graph.node(i);
            if (node.isBoundary()) {
                result.computeIfAbsent(node.attachedTo(), k -> new ArrayList<>()).add(i);
            }
        }
        return result;
    }
}
