package com.ukboards.network.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected bipartite graph of organisations and board members keyed by node id.
 *
 * <p>Node inserts are first-write-wins and there are no parallel edges. Every edge joins a
 * side 0 node to a side 1 node; inserts that would break that are rejected. Iteration follows
 * insertion order. Not thread safe: a graph belongs to the client building it.
 */
public class BoardGraph {
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> adjacency = new LinkedHashMap<>();
    private int edgeCount;

    public boolean addNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.id())) {
            return false;
        }
        nodes.put(node.id(), node);
        adjacency.put(node.id(), new LinkedHashMap<>());
        return true;
    }

    /**
     * Adds an edge between two existing nodes. Argument order does not matter.
     *
     * @return false when the edge already exists
     * @throws IllegalArgumentException when either node is missing
     * @throws IllegalStateException when both nodes sit on the same side
     */
    public boolean addEdge(String nodeId, String otherId, JsonNode data) {
        GraphNode first = requireNode(nodeId);
        GraphNode second = requireNode(otherId);
        if (first.bipartite() == second.bipartite()) {
            throw new IllegalStateException(
                "Edge " + nodeId + " - " + otherId + " would join two nodes on side " + first.bipartite()
            );
        }
        if (hasEdge(nodeId, otherId)) {
            return false;
        }
        GraphNode organisation = first.isOrganisation() ? first : second;
        GraphNode member = first.isOrganisation() ? second : first;
        GraphEdge edge = new GraphEdge(organisation.id(), member.id(), data);
        adjacency.get(organisation.id()).put(member.id(), edge);
        adjacency.get(member.id()).put(organisation.id(), edge);
        edgeCount++;
        return true;
    }

    private GraphNode requireNode(String id) {
        GraphNode node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return node;
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean hasEdge(String nodeId, String otherId) {
        Map<String, GraphEdge> neighbours = adjacency.get(nodeId);
        return neighbours != null && neighbours.containsKey(otherId);
    }

    public Optional<GraphEdge> edge(String nodeId, String otherId) {
        Map<String, GraphEdge> neighbours = adjacency.get(nodeId);
        return neighbours == null ? Optional.empty() : Optional.ofNullable(neighbours.get(otherId));
    }

    public Set<String> neighbors(String id) {
        Map<String, GraphEdge> neighbours = adjacency.get(id);
        if (neighbours == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(neighbours.keySet()));
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<GraphEdge> edges() {
        List<GraphEdge> edges = new ArrayList<>(edgeCount);
        for (Map.Entry<String, Map<String, GraphEdge>> entry : adjacency.entrySet()) {
            for (GraphEdge edge : entry.getValue().values()) {
                if (edge.organisationId().equals(entry.getKey())) {
                    edges.add(edge);
                }
            }
        }
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Set<String>> connectedComponents() {
        List<Set<String>> components = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String start : nodes.keySet()) {
            if (!seen.add(start)) {
                continue;
            }
            Set<String> component = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            component.add(start);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String next : adjacency.get(current).keySet()) {
                    if (seen.add(next)) {
                        component.add(next);
                        queue.add(next);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    public int connectedComponentsCount() {
        return connectedComponents().size();
    }

    public boolean isConnected() {
        return !nodes.isEmpty() && connectedComponentsCount() == 1;
    }

    public boolean isBipartite() {
        for (GraphEdge edge : edges()) {
            GraphNode organisation = nodes.get(edge.organisationId());
            GraphNode member = nodes.get(edge.memberId());
            if (organisation.bipartite() == member.bipartite()) {
                return false;
            }
        }
        return true;
    }

    public void requireBipartite() {
        if (!isBipartite()) {
            throw new IllegalStateException("Board graph is no longer bipartite");
        }
    }

    public Set<String> idsOfSide(int bipartite) {
        Set<String> ids = new LinkedHashSet<>();
        for (GraphNode node : nodes.values()) {
            if (node.bipartite() == bipartite) {
                ids.add(node.id());
            }
        }
        return ids;
    }

    /**
     * Ids of every node of each of {@code kinds}, sorted. Kinds with no nodes map to an empty set.
     */
    public Map<NodeKind, Set<String>> kindsIds(Collection<NodeKind> kinds) {
        Map<NodeKind, Set<String>> result = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : kinds) {
            result.put(kind, new TreeSet<>());
        }
        for (GraphNode node : nodes.values()) {
            result.computeIfAbsent(node.kind(), ignored -> new TreeSet<>()).add(node.id());
        }
        return result;
    }

    public BoardGraph copy() {
        BoardGraph copy = new BoardGraph();
        copy.composeWith(this);
        return copy;
    }

    /**
     * Adds the nodes and edges of {@code other} that this graph lacks. Existing nodes and edges keep
     * their attributes.
     */
    public BoardGraph composeWith(BoardGraph other) {
        for (GraphNode node : other.nodes.values()) {
            addNode(node);
        }
        for (GraphEdge edge : other.edges()) {
            addEdge(edge.organisationId(), edge.memberId(), edge.data());
        }
        return this;
    }

    public static BoardGraph compose(BoardGraph first, BoardGraph second) {
        return first.copy().composeWith(second);
    }

    public void removeNodes(Collection<String> ids) {
        for (String id : ids) {
            Map<String, GraphEdge> neighbours = adjacency.remove(id);
            if (neighbours == null) {
                continue;
            }
            for (String neighbour : neighbours.keySet()) {
                adjacency.get(neighbour).remove(id);
                edgeCount--;
            }
            nodes.remove(id);
        }
    }

    public void clear() {
        nodes.clear();
        adjacency.clear();
        edgeCount = 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoardGraph other)) {
            return false;
        }
        return nodes.equals(other.nodes) && new LinkedHashSet<>(edges()).equals(new LinkedHashSet<>(other.edges()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, new LinkedHashSet<>(edges()));
    }

    @Override
    public String toString() {
        return "BoardGraph{nodes=" + nodes.size() + ", edges=" + edgeCount + "}";
    }
}
