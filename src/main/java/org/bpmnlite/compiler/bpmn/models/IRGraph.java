package org.bpmnlite.compiler.bpmn.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Directed workflow graph stored as an arena: nodes are addressed by their index in {@link #nodes()},
 * edges connect node indices and keep the order in which their sequence flows were declared.
 * <p>
 * Instances are immutable; use {@link #builder()} to assemble one.
 */
public final class IRGraph {

    /**
     * A resolved sequence flow between two node indices.
     */
    public record Edge(int source, int target, IREdge payload) {
    }

    private final List<IRNode> nodes;
    private final List<Edge> edges;
    private final List<List<Edge>> outgoing;
    private final List<List<Edge>> incoming;

    private IRGraph(List<IRNode> nodes, List<Edge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        List<List<Edge>> out = new ArrayList<>();
        List<List<Edge>> in = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        for (Edge edge : this.edges) {
            out.get(edge.source()).add(edge);
            in.get(edge.target()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    private static List<List<Edge>> freeze(List<List<Edge>> lists) {
        List<List<Edge>> frozen = new ArrayList<>(lists.size());
        for (List<Edge> list : lists) {
            frozen.add(List.copyOf(list));
        }
        return Collections.unmodifiableList(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public IRNode node(int index) {
        return nodes.get(index);
    }

    public List<IRNode> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Outgoing edges of a node in flow-declaration order.
     */
    public List<Edge> outgoing(int index) {
        return outgoing.get(index);
    }

    public List<Edge> incoming(int index) {
        return incoming.get(index);
    }

    /**
     * Linear lookup by BPMN id. The graph keeps no permanent string index.
     */
    public Optional<Integer> findIndexById(String id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(id)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * Mutable assembly stage used while parsing (and by tests building graphs by hand).
     */
    public static final class Builder {
        private final List<IRNode> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder() {
        }

        /**
         * @return the index of the added node
         */
        public int addNode(IRNode node) {
            nodes.add(node);
            return nodes.size() - 1;
        }

        public Builder addEdge(int source, int target, IREdge payload) {
            if (source < 0 || source >= nodes.size() || target < 0 || target >= nodes.size()) {
                throw new IllegalArgumentException("Edge '" + payload.id() + "' connects unknown node index");
            }
            edges.add(new Edge(source, target, payload));
            return this;
        }

        public int nodeCount() {
            return nodes.size();
        }

        public IRGraph build() {
            return new IRGraph(nodes, edges);
        }
    }
}
