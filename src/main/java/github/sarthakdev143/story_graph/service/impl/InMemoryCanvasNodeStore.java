package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.service.CanvasNodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class InMemoryCanvasNodeStore implements CanvasNodeStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCanvasNodeStore.class);
    private static final double EPSILON = 1e-9;

    // canvasId -> (nodeId -> node), insertion ordered; a canvas map is never swapped out, every
    // write to it holds its monitor
    private final Map<String, Map<String, StoryNode>> canvases = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxNodesPerCanvas;

    public InMemoryCanvasNodeStore(@Value("${story-graph.canvas.max-nodes:5000}") int maxNodesPerCanvas) {
        this.maxNodesPerCanvas = maxNodesPerCanvas;
    }

    @Override
    public List<StoryNode> snapshot(String canvasId) {
        Map<String, StoryNode> nodes = canvases.get(canvasId);
        if (nodes == null) {
            return List.of();
        }
        synchronized (nodes) {
            return List.copyOf(nodes.values());
        }
    }

    @Override
    public List<StoryNode> replace(String canvasId, List<StoryNode> nodes) {
        List<StoryNode> incoming = nodes == null ? List.of() : nodes;
        for (StoryNode node : incoming) {
            if (!Objects.equals(canvasId, node.canvasId())) {
                throw new IllegalArgumentException(
                        "node " + node.id() + " belongs to canvas " + node.canvasId() + ", not " + canvasId + ".");
            }
        }
        if (incoming.size() > maxNodesPerCanvas) {
            throw new IllegalArgumentException(
                    "canvas " + canvasId + " supports at most " + maxNodesPerCanvas + " nodes.");
        }

        Map<String, StoryNode> canvas = canvasNodes(canvasId);
        List<StoryNode> stored;
        synchronized (canvas) {
            canvas.clear();
            for (StoryNode node : incoming) {
                canvas.put(node.id(), node.withSequence(sequence.incrementAndGet()));
            }
            stored = List.copyOf(canvas.values());
        }
        logger.info("Replaced canvas {} with {} nodes", canvasId, stored.size());
        return stored;
    }

    @Override
    public StoryNode add(StoryNode node) {
        Map<String, StoryNode> canvas = canvasNodes(node.canvasId());
        StoryNode stored;
        synchronized (canvas) {
            if (canvas.containsKey(node.id())) {
                throw new IllegalArgumentException("node " + node.id() + " already exists on canvas " + node.canvasId() + ".");
            }
            if (canvas.size() >= maxNodesPerCanvas) {
                throw new IllegalArgumentException(
                        "canvas " + node.canvasId() + " already holds the maximum of " + maxNodesPerCanvas + " nodes.");
            }
            stored = node.withSequence(sequence.incrementAndGet());
            canvas.put(stored.id(), stored);
        }
        logger.info(
                "Added {} node {} anchor={} parent={} on canvas {}",
                stored.type(),
                stored.id(),
                stored.anchorType(),
                stored.parentId(),
                stored.canvasId());
        return stored;
    }

    @Override
    public Optional<StoryNode> update(String canvasId, String nodeId, NodeUpdateRequest update) {
        Map<String, StoryNode> canvas = canvases.get(canvasId);
        if (canvas == null) {
            return Optional.empty();
        }

        StoryNode updated;
        synchronized (canvas) {
            StoryNode current = canvas.get(nodeId);
            if (current == null) {
                return Optional.empty();
            }
            if (update == null || update.isEmpty()) {
                return Optional.of(current);
            }
            updated = applyUpdate(current, update);
            canvas.put(nodeId, updated);
        }
        logger.info("Updated node {} on canvas {}: {}", nodeId, canvasId, update);
        return Optional.of(updated);
    }

    @Override
    public boolean remove(String canvasId, String nodeId) {
        Map<String, StoryNode> canvas = canvases.get(canvasId);
        if (canvas == null) {
            return false;
        }

        boolean removed;
        synchronized (canvas) {
            removed = canvas.remove(nodeId) != null;
        }
        if (removed) {
            logger.info("Removed node {} from canvas {}", nodeId, canvasId);
        }
        return removed;
    }

    private Map<String, StoryNode> canvasNodes(String canvasId) {
        return canvases.computeIfAbsent(canvasId, ignored -> new LinkedHashMap<>());
    }

    private StoryNode applyUpdate(StoryNode current, NodeUpdateRequest update) {
        StoryNode merged = new StoryNode(
                current.id(),
                current.canvasId(),
                current.type(),
                update.parentId() != null ? update.parentId() : current.parentId(),
                update.anchorType() != null ? update.anchorType() : current.anchorType(),
                update.lane() != null ? update.lane() : current.lane(),
                update.drift() != null ? update.drift() : current.drift(),
                update.mediaInPoint() != null ? update.mediaInPoint() : current.mediaInPoint(),
                update.mediaOutPoint() != null ? update.mediaOutPoint() : current.mediaOutPoint(),
                update.playbackRate() != null ? update.playbackRate() : current.playbackRate(),
                current.assetId(),
                current.sequence());

        double inPoint = merged.mediaInPoint() == null ? 0.0 : merged.mediaInPoint();
        if (merged.mediaOutPoint() != null && merged.mediaOutPoint() < inPoint - EPSILON) {
            throw new IllegalArgumentException(
                    "mediaOutPoint "
                            + merged.mediaOutPoint()
                            + " of node "
                            + current.id()
                            + " must be greater than or equal to mediaInPoint "
                            + inPoint
                            + ".");
        }
        return merged;
    }
}
