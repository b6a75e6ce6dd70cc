package org.bpmnlite.compiler.bytecode;

import org.bpmnlite.compiler.bpmn.models.GatewayDirection;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bpmn.models.IRNode;
import org.bpmnlite.compiler.bpmn.models.TimerSpec;
import org.bpmnlite.compiler.bytecode.models.CycleSpec;
import org.bpmnlite.compiler.bytecode.models.ErrorRoute;
import org.bpmnlite.compiler.bytecode.models.InclusiveBranch;
import org.bpmnlite.compiler.bytecode.models.Instr;
import org.bpmnlite.compiler.bytecode.models.JoinPlanEntry;
import org.bpmnlite.compiler.bytecode.models.Program;
import org.bpmnlite.compiler.bytecode.models.RaceEntry;
import org.bpmnlite.compiler.bytecode.models.WaitArm;
import org.bpmnlite.compiler.bytecode.models.WaitPlanEntry;
import org.bpmnlite.compiler.bytecode.models.WaitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Lowers a verified {@link IRGraph} into a linear {@link Program}.
 * <p>
 * Lowering runs in two passes over a deterministic node order: the first computes how many
 * instructions every node needs and from that its address, the second emits the instructions
 * with every jump target already known.
 */
public class BytecodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BytecodeGenerator.class);

    static final String NO_MATCHING_FLOW = "no outgoing condition matched and there is no default flow";

    private final IRGraph graph;
    private final Map<String, Integer> indexById = new HashMap<>();
    private final Map<Integer, List<Integer>> boundariesByActivity = new HashMap<>();

    private List<Integer> order;
    private final Map<Integer, Integer> nextInOrder = new HashMap<>();
    private final Map<Integer, Integer> address = new HashMap<>();
    private final Map<Integer, Integer> size = new HashMap<>();
    private final Map<Integer, Integer> joinIds = new HashMap<>();

    private BytecodeGenerator(IRGraph graph) {
        this.graph = graph;
        for (int i = 0; i < graph.nodeCount(); i++) {
            indexById.put(graph.node(i).id(), i);
        }
        for (int i = 0; i < graph.nodeCount(); i++) {
            IRNode node = graph.node(i);
            if (node.isBoundary()) {
                Integer activity = indexById.get(node.attachedTo());
                if (activity == null) {
                    throw new IllegalStateException("Boundary '" + node.id() + "' is attached to unknown '"
                            + node.attachedTo() + "'; verify the graph before lowering");
                }
                boundariesByActivity.computeIfAbsent(activity, k -> new ArrayList<>()).add(i);
            }
        }
        boundariesByActivity.values().forEach(list -> list.sort(Comparator.comparing(i -> graph.node(i).id())));
    }

    /**
     * Lowers a graph that has already passed {@code BpmnVerifier.verify}.
     */
    public static Program lower(IRGraph graph) {
        return new BytecodeGenerator(graph).generate();
    }

    private Program generate() {
        order = linearize();
        assignJoinIds();
        layout();
        return emit();
    }

    /**
     * Start first, then always the ready node (all predecessors placed) with the smallest id.
     * Cycles are broken by taking the smallest-id node with at least one placed predecessor.
     */
    private List<Integer> linearize() {
        int start = -1;
        for (int i = 0; i < graph.nodeCount(); i++) {
            if (graph.node(i) instanceof IRNode.Start) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            throw new IllegalStateException("Graph has no start event; verify the graph before lowering");
        }

        List<Integer> placedOrder = new ArrayList<>();
        Set<Integer> placed = new HashSet<>();
        placedOrder.add(start);
        placed.add(start);

        while (placed.size() < graph.nodeCount()) {
            Integer ready = null;
            Integer linked = null;
            Integer any = null;
            for (int i = 0; i < graph.nodeCount(); i++) {
                if (placed.contains(i)) {
                    continue;
                }
                List<Integer> predecessors = predecessors(i);
                boolean allPlaced = placed.containsAll(predecessors);
                boolean somePlaced = predecessors.stream().anyMatch(placed::contains);
                if (allPlaced && (ready == null || smallerId(i, ready))) {
                    ready = i;
                }
                if (somePlaced && (linked == null || smallerId(i, linked))) {
                    linked = i;
                }
                if (any == null || smallerId(i, any)) {
                    any = i;
                }
            }
            int chosen = ready != null ? ready : linked != null ? linked : any;
            placedOrder.add(chosen);
            placed.add(chosen);
        }

        Integer following = null;
        for (int pos = placedOrder.size() - 1; pos >= 0; pos--) {
            int node = placedOrder.get(pos);
            nextInOrder.put(node, following);
            if (!graph.node(node).isBoundary()) {
                following = node;
            }
        }
        return placedOrder;
    }

    private List<Integer> predecessors(int node) {
        List<Integer> result = new ArrayList<>();
        graph.incoming(node).forEach(edge -> result.add(edge.source()));
        IRNode n = graph.node(node);
        if (n.isBoundary()) {
            result.add(indexById.get(n.attachedTo()));
        }
        return result;
    }

    private boolean smallerId(int a, int b) {
        return graph.node(a).id().compareTo(graph.node(b).id()) < 0;
    }

    private void assignJoinIds() {
        int next = 0;
        for (int node : order) {
            if (isConverging(graph.node(node))) {
                joinIds.put(node, next++);
            }
        }
    }

    private void layout() {
        int addr = 0;
        for (int node : order) {
            address.put(node, addr);
            int n = sizeOf(node);
            size.put(node, n);
            addr += n;
        }
    }

    private int sizeOf(int node) {
        IRNode n = graph.node(node);
        if (n.isBoundary()) {
            return 0;
        }
        if (n instanceof IRNode.End) {
            return 1;
        }
        if (n instanceof IRNode.GatewayAnd || n instanceof IRNode.GatewayInclusive) {
            if (isConverging(n) && graph.outgoing(node).isEmpty()) {
                return 2;
            }
            return 1;
        }
        int body = n instanceof IRNode.Start || n instanceof IRNode.GatewayXor ? 0 : 1;
        return body + routingSize(node);
    }

    /**
     * Instructions needed to leave a node with sequential semantics: branches for conditional flows,
     * then a jump to the default flow, a fall-through, an implicit end or a failure.
     */
    private int routingSize(int node) {
        List<IRGraph.Edge> outgoing = graph.outgoing(node);
        if (outgoing.isEmpty()) {
            return 1;
        }
        if (fallsThrough(node)) {
            return 0;
        }
        int conditional = (int) outgoing.stream().filter(edge -> edge.payload().isConditional()).count();
        return conditional + 1;
    }

    private boolean fallsThrough(int node) {
        List<IRGraph.Edge> outgoing = graph.outgoing(node);
        return outgoing.size() == 1
                && !outgoing.get(0).payload().isConditional()
                && Integer.valueOf(outgoing.get(0).target()).equals(nextInOrder.get(node));
    }

    private Program emit() {
        List<Instr> instructions = new ArrayList<>();
        Set<String> manifest = new LinkedHashSet<>();
        SortedMap<Integer, String> debugMap = new TreeMap<>();
        SortedMap<String, String> boundaryMap = new TreeMap<>();
        SortedMap<String, RaceEntry> racePlan = new TreeMap<>();
        SortedMap<Integer, JoinPlanEntry> joinPlan = new TreeMap<>();
        SortedMap<Integer, WaitPlanEntry> waitPlan = new TreeMap<>();
        SortedMap<String, List<ErrorRoute>> errorRoutes = new TreeMap<>();
        int waitIds = 0;

        for (int node : order) {
            IRNode n = graph.node(node);
            int base = address.get(node);
            if (instructions.size() != base) {
                throw new IllegalStateException("Layout mismatch at '" + n.id() + "': expected address " + base
                        + ", emitted " + instructions.size());
            }
            if (size.get(node) > 0) {
                debugMap.put(base, n.id());
            }

            if (n instanceof IRNode.Start) {
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.End end) {
                instructions.add(end.terminate() ? new Instr.EndTerminate() : new Instr.End());
            } else if (n instanceof IRNode.ServiceTask task) {
                manifest.add(task.taskType());
                instructions.add(new Instr.ExecNative(task.taskType()));
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.HumanWait human) {
                int waitId = waitIds++;
                manifest.add(human.taskKind());
                waitPlan.put(waitId, new WaitPlanEntry(WaitType.HUMAN, human.name(), human.corrKeySource(), human.id()));
                instructions.add(new Instr.WaitMsg(waitId, human.name(), human.corrKeySource(), human.taskKind()));
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.MessageWait message) {
                int waitId = waitIds++;
                waitPlan.put(waitId, new WaitPlanEntry(WaitType.MESSAGE, message.name(), message.corrKeySource(),
                        message.id()));
                instructions.add(new Instr.WaitMsg(waitId, message.name(), message.corrKeySource(), null));
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.TimerWait timer) {
                instructions.add(timerInstruction(timer.spec()));
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.GatewayXor) {
                emitRouting(node, instructions);
            } else if (n instanceof IRNode.GatewayAnd and) {
                if (and.direction() == GatewayDirection.DIVERGING) {
                    instructions.add(new Instr.Fork(graph.outgoing(node).stream()
                            .map(edge -> address.get(edge.target()))
                            .toList()));
                } else {
                    int joinId = joinIds.get(node);
                    int expected = graph.incoming(node).size();
                    int next = joinContinuation(node, base);
                    joinPlan.put(joinId, new JoinPlanEntry(and.id(), expected, next, false));
                    instructions.add(new Instr.Join(joinId, expected, next));
                    emitJoinEnd(node, instructions);
                }
            } else if (n instanceof IRNode.GatewayInclusive inclusive) {
                if (inclusive.direction() == GatewayDirection.DIVERGING) {
                    instructions.add(forkInclusive(node));
                } else {
                    int joinId = joinIds.get(node);
                    int next = joinContinuation(node, base);
                    joinPlan.put(joinId, new JoinPlanEntry(inclusive.id(), graph.incoming(node).size(), next, true));
                    instructions.add(new Instr.JoinDynamic(joinId, next));
                    emitJoinEnd(node, instructions);
                }
            }
            // Boundary nodes emit nothing; they only feed the race plan below.
        }

        for (Map.Entry<Integer, List<Integer>> entry : boundariesByActivity.entrySet()) {
            int activity = entry.getKey();
            String activityId = graph.node(activity).id();
            List<WaitArm> arms = new ArrayList<>();
            List<ErrorRoute> routes = new ArrayList<>();
            arms.add(new WaitArm.Internal(address.get(activity) + 1));

            for (int boundary : entry.getValue()) {
                IRNode b = graph.node(boundary);
                int resumeAt = escalationAddress(boundary);
                boundaryMap.put(b.id(), activityId);
                if (b instanceof IRNode.BoundaryTimer timer) {
                    arms.add(timerArm(timer, resumeAt));
                } else if (b instanceof IRNode.BoundaryError error) {
                    arms.add(new WaitArm.Error(error.errorCode(), resumeAt));
                    routes.add(new ErrorRoute(error.errorCode(), resumeAt, error.id()));
                }
            }

            racePlan.put(activityId, new RaceEntry(address.get(activity), arms));
            if (!routes.isEmpty()) {
                // stable: specific codes keep boundary id order, catch-alls move to the end
                routes.sort(Comparator.comparing(ErrorRoute::isCatchAll));
                errorRoutes.put(activityId, List.copyOf(routes));
            }
        }

        List<String> taskManifest = new ArrayList<>(manifest);
        String version = ProgramHasher.hash(new ProgramHasher.HashedContent(
                instructions, taskManifest, boundaryMap, racePlan, joinPlan, waitPlan, errorRoutes));

        log.debug("Lowered {} nodes into {} instructions, version {}", order.size(), instructions.size(), version);

        return Program.builder()
                .instructions(instructions)
                .taskManifest(taskManifest)
                .bytecodeVersion(version)
                .boundaryMap(boundaryMap)
                .racePlan(racePlan)
                .joinPlan(joinPlan)
                .waitPlan(waitPlan)
                .errorRoutes(errorRoutes)
                .debugMap(debugMap)
                .build();
    }

    private void emitRouting(int node, List<Instr> instructions) {
        List<IRGraph.Edge> outgoing = graph.outgoing(node);
        if (outgoing.isEmpty()) {
            instructions.add(new Instr.End());
            return;
        }
        if (fallsThrough(node)) {
            return;
        }

        // the last unconditioned flow in declaration order is the default
        Integer defaultTarget = null;
        String defaultFlow = null;
        for (IRGraph.Edge edge : outgoing) {
            int target = address.get(edge.target());
            if (edge.payload().isConditional()) {
                instructions.add(new Instr.BranchIf(edge.payload().condition(), target));
            } else {
                if (defaultFlow != null) {
                    log.warn("'{}' has more than one unconditioned outgoing flow; '{}' replaces '{}' as the default",
                            graph.node(node).id(), edge.payload().id(), defaultFlow);
                }
                defaultTarget = target;
                defaultFlow = edge.payload().id();
            }
        }

        if (defaultTarget != null) {
            instructions.add(new Instr.Jump(defaultTarget));
        } else {
            instructions.add(new Instr.Fail(graph.node(node).id(), NO_MATCHING_FLOW));
        }
    }

    /**
     * A converging gateway has at most one outgoing flow once verified.
     */
    private int joinContinuation(int node, int base) {
        List<IRGraph.Edge> outgoing = graph.outgoing(node);
        return outgoing.isEmpty() ? base + 1 : address.get(outgoing.get(0).target());
    }

    private void emitJoinEnd(int node, List<Instr> instructions) {
        if (graph.outgoing(node).isEmpty()) {
            instructions.add(new Instr.End());
        }
    }

    private Instr forkInclusive(int node) {
        List<IRGraph.Edge> outgoing = graph.outgoing(node);
        List<IRGraph.Edge> unconditioned = outgoing.stream().filter(edge -> !edge.payload().isConditional()).toList();
        Integer defaultTarget = unconditioned.size() == 1 ? address.get(unconditioned.get(0).target()) : null;

        List<InclusiveBranch> branches = new ArrayList<>();
        for (IRGraph.Edge edge : outgoing) {
            if (edge.payload().isConditional()) {
                branches.add(new InclusiveBranch(edge.payload().condition(), address.get(edge.target())));
            } else if (defaultTarget == null) {
                branches.add(new InclusiveBranch(null, address.get(edge.target())));
            }
        }

        Integer joinId = pairedJoin(node);
        if (joinId == null) {
            log.debug("Inclusive gateway '{}' has no converging inclusive gateway downstream", graph.node(node).id());
        }
        return new Instr.ForkInclusive(branches, joinId, defaultTarget);
    }

    /**
     * Breadth-first search along flows for the nearest converging inclusive gateway.
     */
    private Integer pairedJoin(int fork) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        seen.add(fork);
        queue.add(fork);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (IRGraph.Edge edge : graph.outgoing(current)) {
                int target = edge.target();
                if (!seen.add(target)) {
                    continue;
                }
                IRNode t = graph.node(target);
                if (t instanceof IRNode.GatewayInclusive && isConverging(t)) {
                    return joinIds.get(target);
                }
                queue.add(target);
            }
        }
        return null;
    }

    private int escalationAddress(int boundary) {
        List<IRGraph.Edge> outgoing = graph.outgoing(boundary);
        if (outgoing.isEmpty()) {
            throw new IllegalStateException("Boundary '" + graph.node(boundary).id()
                    + "' has no outgoing flow; verify the graph before lowering");
        }
        return address.get(outgoing.get(0).target());
    }

    private static Instr timerInstruction(TimerSpec spec) {
        if (spec instanceof TimerSpec.Date date) {
            return new Instr.WaitUntil(date.deadlineMs());
        }
        if (spec instanceof TimerSpec.Cycle cycle) {
            return new Instr.WaitFor(cycle.intervalMs());
        }
        return new Instr.WaitFor(((TimerSpec.Duration) spec).ms());
    }

    private static WaitArm timerArm(IRNode.BoundaryTimer timer, int resumeAt) {
        TimerSpec spec = timer.spec();
        if (spec instanceof TimerSpec.Date date) {
            return new WaitArm.Deadline(date.deadlineMs(), resumeAt, timer.interrupting());
        }
        if (spec instanceof TimerSpec.Cycle cycle) {
            return new WaitArm.Timer(cycle.intervalMs(), resumeAt, timer.interrupting(),
                    new CycleSpec(cycle.intervalMs(), cycle.maxFires()));
        }
        return new WaitArm.Timer(((TimerSpec.Duration) spec).ms(), resumeAt, timer.interrupting(), null);
    }

    private static boolean isConverging(IRNode node) {
        if (node instanceof IRNode.GatewayAnd and) {
            return and.direction() == GatewayDirection.CONVERGING;
        }
        if (node instanceof IRNode.GatewayInclusive inclusive) {
            return inclusive.direction() == GatewayDirection.CONVERGING;
        }
        return false;
    }
}
