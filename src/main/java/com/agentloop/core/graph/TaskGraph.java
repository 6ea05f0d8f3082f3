package com.agentloop.core.graph;

import com.agentloop.core.error.CycleException;
import com.agentloop.core.error.DuplicateIdException;
import com.agentloop.core.error.InvalidTransitionException;
import com.agentloop.core.error.UnknownNodeException;
import com.agentloop.core.model.TaskNode;
import com.agentloop.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The decomposition of one goal into dependent task nodes for a single planning pass.
 * <p>
 * Nodes keep their insertion order, which is also the dispatch order when several
 * nodes become ready together. The dependency relation is kept acyclic on every
 * insertion. Dependencies may name nodes that are added later; {@link #verifyDependencies()}
 * checks that every reference resolves once the graph is fully assembled.
 * <p>
 * Not thread-safe: a graph is owned by exactly one loop controller.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final String goal;
    private final int planVersion;
    private final LinkedHashMap<String, TaskNode> nodes = new LinkedHashMap<>();

    public TaskGraph(String goal, int planVersion) {
        this.goal = goal;
        this.planVersion = planVersion;
    }

    /**
     * Rebuilds a graph from persisted nodes. Nodes that were in flight when the
     * snapshot was taken go back to {@link TaskStatus#PENDING}.
     */
    public static TaskGraph restore(String goal, int planVersion, Collection<TaskNode> persisted) {
        var graph = new TaskGraph(goal, planVersion);
        for (TaskNode node : persisted) {
            TaskNode restored = node.status() == TaskStatus.RUNNING || node.status() == TaskStatus.READY
                    ? node.withStatus(TaskStatus.PENDING)
                    : node;
            graph.addNode(restored);
        }
        return graph;
    }

    public String goal() {
        return goal;
    }

    public int planVersion() {
        return planVersion;
    }

    /**
     * Inserts a node. The graph is left untouched when the insertion fails.
     *
     * @throws DuplicateIdException if a node with the same id exists
     * @throws CycleException if the node's dependency edges would close a cycle
     */
    public void addNode(TaskNode node) {
        if (nodes.containsKey(node.id())) {
            throw new DuplicateIdException(node.id());
        }
        List<String> cycle = findPathBack(node);
        if (!cycle.isEmpty()) {
            throw new CycleException(node.id(), cycle);
        }
        nodes.put(node.id(), node);
    }

    /**
     * Depth-first search from the new node's dependencies looking for the node itself.
     * Returns the offending path, or an empty list when no cycle would form.
     */
    private List<String> findPathBack(TaskNode candidate) {
        String target = candidate.id();
        Set<String> visited = new HashSet<>();
        for (String dep : candidate.dependencies()) {
            Deque<String> path = new ArrayDeque<>();
            path.addLast(target);
            if (reaches(dep, target, visited, path)) {
                return new ArrayList<>(path);
            }
        }
        return List.of();
    }

    private boolean reaches(String current, String target, Set<String> visited, Deque<String> path) {
        path.addLast(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            TaskNode node = nodes.get(current);
            if (node != null) {
                for (String dep : node.dependencies()) {
                    if (reaches(dep, target, visited, path)) {
                        return true;
                    }
                }
            }
        }
        path.removeLast();
        return false;
    }

    /**
     * @throws UnknownNodeException if any dependency names a node that is not in the graph
     */
    public void verifyDependencies() {
        for (TaskNode node : nodes.values()) {
            for (String dep : node.dependencies()) {
                if (!nodes.containsKey(dep)) {
                    throw new UnknownNodeException(dep, node.id());
                }
            }
        }
    }

    /**
     * Pending nodes whose dependencies have all succeeded or been skipped, in insertion order.
     */
    public List<TaskNode> readyNodes() {
        var ready = new ArrayList<TaskNode>();
        for (TaskNode node : nodes.values()) {
            if (node.status() != TaskStatus.PENDING) {
                continue;
            }
            if (dependenciesSatisfied(node)) {
                ready.add(node);
            } else {
                log.debug("  {} [{}] waiting on {}", node.id(), node.capabilityRef(), node.dependencies());
            }
        }
        return ready;
    }

    private boolean dependenciesSatisfied(TaskNode node) {
        for (String dep : node.dependencies()) {
            TaskNode d = nodes.get(dep);
            if (d == null || !d.status().satisfiesDependents()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Moves a node along one allowed transition.
     *
     * @param resultOrError output for {@link TaskStatus#SUCCEEDED}, diagnostic for
     *                      {@link TaskStatus#FAILED} or {@link TaskStatus#SKIPPED}; ignored otherwise
     * @return the updated node
     * @throws UnknownNodeException if the id is absent
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public TaskNode mark(String id, TaskStatus status, String resultOrError) {
        TaskNode current = require(id);
        if (!current.status().allowedNext().contains(status)) {
            throw new InvalidTransitionException(id, current.status(), status);
        }
        if (status == TaskStatus.READY && !dependenciesSatisfied(current)) {
            throw new InvalidTransitionException(id, "dependencies " + current.dependencies() + " are not satisfied");
        }
        TaskNode updated = switch (status) {
            case SUCCEEDED -> current.succeeded(resultOrError);
            case FAILED -> current.failed(resultOrError);
            case SKIPPED -> current.skipped(resultOrError);
            default -> current.withStatus(status);
        };
        nodes.put(id, updated);
        return updated;
    }

    /**
     * Returns a failed node to pending for another attempt.
     *
     * @throws InvalidTransitionException if the node is not failed
     */
    public TaskNode resetForRetry(String id) {
        TaskNode current = require(id);
        if (current.status() != TaskStatus.FAILED) {
            throw new InvalidTransitionException(id, "only failed nodes can be retried, status is " + current.status());
        }
        TaskNode updated = current.resetForRetry();
        nodes.put(id, updated);
        return updated;
    }

    /**
     * Skips every pending node that can no longer run because a dependency failed
     * permanently, directly or through another blocked node.
     *
     * @return ids of the nodes skipped by this call, in insertion order
     */
    public List<String> skipBlocked() {
        Set<String> blocked = new HashSet<>();
        for (TaskNode node : nodes.values()) {
            if (node.status() == TaskStatus.FAILED) {
                blocked.add(node.id());
            }
        }
        var skipped = new ArrayList<String>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (TaskNode node : List.copyOf(nodes.values())) {
                if (node.status() != TaskStatus.PENDING || blocked.contains(node.id())) {
                    continue;
                }
                for (String dep : node.dependencies()) {
                    if (blocked.contains(dep)) {
                        mark(node.id(), TaskStatus.SKIPPED, "blocked by " + dep);
                        blocked.add(node.id());
                        skipped.add(node.id());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return skipped;
    }

    /** True when every node has succeeded, failed permanently or been skipped. */
    public boolean isTerminal() {
        return nodes.values().stream().allMatch(n -> n.status().isFinished());
    }

    public boolean hasFailures() {
        return nodes.values().stream().anyMatch(n -> n.status() == TaskStatus.FAILED);
    }

    public TaskNode get(String id) {
        return require(id);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public List<TaskNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<TaskNode> nodesWithStatus(TaskStatus status) {
        return nodes.values().stream().filter(n -> n.status() == status).toList();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Counts by status, every status present, in declaration order. */
    public Map<TaskStatus, Long> statusCounts() {
        var counts = new LinkedHashMap<TaskStatus, Long>();
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        for (TaskNode node : nodes.values()) {
            counts.merge(node.status(), 1L, Long::sum);
        }
        return counts;
    }

    private TaskNode require(String id) {
        TaskNode node = nodes.get(id);
        if (node == null) {
            throw new UnknownNodeException(id);
        }
        return node;
    }
}
