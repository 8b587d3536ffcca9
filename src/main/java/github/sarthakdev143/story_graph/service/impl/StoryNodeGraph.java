package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.ProjectionWarning;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.WarningType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

final class StoryNodeGraph {

    static final Comparator<StoryNode> SIBLING_ORDER = Comparator
            .comparingLong(StoryNode::sequence)
            .thenComparing(StoryNode::id)
            .thenComparing(StoryNode::toString);

    private final Map<String, StoryNode> nodesById;
    private final Map<String, List<StoryNode>> childrenByParent;
    private final StoryNode origin;
    private final List<ProjectionWarning> warnings;

    private StoryNodeGraph(
            Map<String, StoryNode> nodesById,
            Map<String, List<StoryNode>> childrenByParent,
            StoryNode origin,
            List<ProjectionWarning> warnings) {
        this.nodesById = nodesById;
        this.childrenByParent = childrenByParent;
        this.origin = origin;
        this.warnings = List.copyOf(warnings);
    }

    static StoryNodeGraph of(Collection<StoryNode> nodes) {
        List<StoryNode> ordered = new ArrayList<>();
        if (nodes != null) {
            for (StoryNode node : nodes) {
                if (node != null) {
                    ordered.add(node);
                }
            }
        }
        ordered.sort(SIBLING_ORDER);

        // the first copy of an id in sibling order is kept
        Map<String, StoryNode> nodesById = new LinkedHashMap<>();
        List<ProjectionWarning> duplicates = new ArrayList<>();
        for (StoryNode node : ordered) {
            if (nodesById.putIfAbsent(node.id(), node) != null) {
                duplicates.add(new ProjectionWarning(
                        node.id(),
                        WarningType.DUPLICATE_ID,
                        "Node id " + node.id() + " occurs more than once; only the first copy was kept."));
            }
        }

        StoryNode origin = findOrigin(nodesById.values());
        if (origin == null) {
            return new StoryNodeGraph(nodesById, Map.of(), null, duplicates);
        }

        Map<String, List<StoryNode>> childrenByParent = new HashMap<>();
        for (StoryNode node : nodesById.values()) {
            if (node == origin || node.parentId() == null) {
                continue;
            }
            StoryNode parent = nodesById.get(node.parentId());
            if (parent == null || !Objects.equals(parent.canvasId(), node.canvasId())) {
                continue;
            }
            childrenByParent.computeIfAbsent(parent.id(), ignored -> new ArrayList<>()).add(node);
        }

        Set<String> reachable = collectReachable(origin, childrenByParent);
        List<ProjectionWarning> warnings = new ArrayList<>(duplicates);
        for (StoryNode node : nodesById.values()) {
            if (!reachable.contains(node.id())) {
                warnings.add(describeUnreachable(node, nodesById));
            }
        }

        return new StoryNodeGraph(nodesById, childrenByParent, origin, warnings);
    }

    Optional<StoryNode> origin() {
        return Optional.ofNullable(origin);
    }

    Optional<StoryNode> find(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodesById.get(nodeId));
    }

    Collection<StoryNode> nodes() {
        return nodesById.values();
    }

    List<StoryNode> children(String parentId, AnchorType anchorType) {
        List<StoryNode> children = childrenByParent.getOrDefault(parentId, List.of());
        List<StoryNode> matching = new ArrayList<>();
        for (StoryNode child : children) {
            if (child.anchorType() == anchorType) {
                matching.add(child);
            }
        }
        return matching;
    }

    List<ProjectionWarning> warnings() {
        return warnings;
    }

    private static StoryNode findOrigin(Collection<StoryNode> nodes) {
        StoryNode fallback = null;
        for (StoryNode node : nodes) {
            if (node.isRootOrigin()) {
                return node;
            }
            if (fallback == null && node.anchorType() == AnchorType.ORIGIN) {
                fallback = node;
            }
        }
        return fallback;
    }

    private static Set<String> collectReachable(StoryNode origin, Map<String, List<StoryNode>> childrenByParent) {
        Set<String> reachable = new HashSet<>();
        Deque<StoryNode> pending = new ArrayDeque<>();
        pending.push(origin);
        while (!pending.isEmpty()) {
            StoryNode current = pending.pop();
            if (!reachable.add(current.id())) {
                continue;
            }
            for (StoryNode child : childrenByParent.getOrDefault(current.id(), List.of())) {
                if (isPlaceable(child.anchorType())) {
                    pending.push(child);
                }
            }
        }
        return reachable;
    }

    private static boolean isPlaceable(AnchorType anchorType) {
        return anchorType == AnchorType.APPEND
                || anchorType == AnchorType.TOP
                || anchorType == AnchorType.PREPEND;
    }

    private static ProjectionWarning describeUnreachable(StoryNode node, Map<String, StoryNode> nodesById) {
        if (node.isRootOrigin()) {
            return new ProjectionWarning(
                    node.id(),
                    WarningType.DUPLICATE_ORIGIN,
                    "Node " + node.id() + " is an additional origin and was left out.");
        }
        StoryNode parent = node.parentId() == null ? null : nodesById.get(node.parentId());
        if (node.parentId() != null
                && (parent == null || !Objects.equals(parent.canvasId(), node.canvasId()))) {
            return new ProjectionWarning(
                    node.id(),
                    WarningType.DANGLING_PARENT,
                    "Parent " + node.parentId() + " of node " + node.id() + " does not exist on this canvas.");
        }
        return new ProjectionWarning(
                node.id(),
                WarningType.UNREACHABLE,
                "Node " + node.id() + " is not connected to the origin.");
    }
}
