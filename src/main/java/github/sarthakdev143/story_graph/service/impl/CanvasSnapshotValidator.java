package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.dto.StoryNodeRequest;
import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.NodeType;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.ZoneType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class CanvasSnapshotValidator {

    private static final double MAX_MEDIA_SECONDS = 24.0 * 60.0 * 60.0;
    private static final double EPSILON = 1e-9;

    private final int maxNodesPerCanvas;
    private final int maxLane;

    public CanvasSnapshotValidator(
            @Value("${story-graph.canvas.max-nodes:5000}") int maxNodesPerCanvas,
            @Value("${story-graph.canvas.max-lane:64}") int maxLane) {
        this.maxNodesPerCanvas = maxNodesPerCanvas;
        this.maxLane = maxLane;
    }

    public List<StoryNode> normalizeAndValidate(String canvasId, List<StoryNodeRequest> nodes) {
        String normalizedCanvasId = requireCanvasId(canvasId);
        if (nodes == null) {
            throw new IllegalArgumentException("nodes is required.");
        }
        if (nodes.size() > maxNodesPerCanvas) {
            throw new IllegalArgumentException("nodes supports at most " + maxNodesPerCanvas + " entries per canvas.");
        }

        List<StoryNode> normalized = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        String rootOriginId = null;

        for (int index = 0; index < nodes.size(); index++) {
            StoryNodeRequest node = nodes.get(index);
            String prefix = "nodes[" + index + "].";
            if (node == null) {
                throw new IllegalArgumentException("nodes[" + index + "] must not be null.");
            }

            String id = requireText(node.id(), prefix + "id");
            if (!seenIds.add(id)) {
                throw new IllegalArgumentException(prefix + "id " + id + " is used by more than one node.");
            }

            String parentId = trimToNull(node.parentId());
            if (id.equals(parentId)) {
                throw new IllegalArgumentException(prefix + "parentId must not reference the node itself.");
            }

            if (node.anchorType() == AnchorType.ORIGIN && parentId == null) {
                if (rootOriginId != null) {
                    throw new IllegalArgumentException(
                            "nodes must contain at most one ORIGIN node without a parent; found "
                                    + rootOriginId
                                    + " and "
                                    + id
                                    + ".");
                }
                rootOriginId = id;
            }

            Integer lane = node.lane();
            requireLane(lane, prefix + "lane");

            double inPoint = nonNegativeOrDefault(node.mediaInPoint(), 0.0, prefix + "mediaInPoint");
            Double outPoint = node.mediaOutPoint() == null
                    ? null
                    : requireOutPoint(node.mediaOutPoint(), inPoint, prefix + "mediaOutPoint");
            double rate = positiveOrDefault(node.playbackRate(), 1.0, prefix + "playbackRate");

            normalized.add(new StoryNode(
                    id,
                    normalizedCanvasId,
                    node.type() == null ? NodeType.SPINE : node.type(),
                    parentId,
                    node.anchorType(),
                    lane,
                    node.drift() == null ? 0 : node.drift(),
                    inPoint,
                    outPoint,
                    rate,
                    trimToNull(node.assetId()),
                    index));
        }

        return normalized;
    }

    public NodeInsertionRequest normalizeInsertion(NodeInsertionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("insertion request is required.");
        }

        double duration = nonNegativeOrDefault(request.mediaDurationSec(), 0.0, "mediaDurationSec");
        if (duration > MAX_MEDIA_SECONDS) {
            throw new IllegalArgumentException("mediaDurationSec must be at most " + MAX_MEDIA_SECONDS + " seconds.");
        }

        return new NodeInsertionRequest(
                trimToNull(request.targetNodeId()),
                request.zone() == null ? ZoneType.APPEND : request.zone(),
                trimToNull(request.assetId()),
                duration);
    }

    public NodeUpdateRequest normalizeUpdate(String nodeId, NodeUpdateRequest update) {
        if (update == null) {
            throw new IllegalArgumentException("update is required.");
        }
        requireLane(update.lane(), "lane");

        String parentId = trimToNull(update.parentId());
        if (parentId != null && parentId.equals(nodeId)) {
            throw new IllegalArgumentException("parentId must not reference the node itself.");
        }
        if (update.anchorType() == AnchorType.ORIGIN && parentId != null) {
            throw new IllegalArgumentException("anchorType ORIGIN cannot be combined with a parentId.");
        }

        Double inPoint = update.mediaInPoint() == null
                ? null
                : nonNegativeOrDefault(update.mediaInPoint(), 0.0, "mediaInPoint");
        Double outPoint = update.mediaOutPoint() == null
                ? null
                : requireOutPoint(update.mediaOutPoint(), inPoint == null ? 0.0 : inPoint, "mediaOutPoint");
        Double rate = update.playbackRate() == null
                ? null
                : positiveOrDefault(update.playbackRate(), 1.0, "playbackRate");

        return new NodeUpdateRequest(
                update.drift(),
                inPoint,
                outPoint,
                rate,
                update.lane(),
                parentId,
                update.anchorType());
    }

    private void requireLane(Integer lane, String fieldName) {
        if (lane == null) {
            return;
        }
        if (lane < 0) {
            throw new IllegalArgumentException(fieldName + " must be greater than or equal to 0.");
        }
        if (lane > maxLane) {
            throw new IllegalArgumentException(fieldName + " must be at most " + maxLane + ".");
        }
    }

    private String requireCanvasId(String canvasId) {
        if (canvasId == null || canvasId.isBlank()) {
            throw new IllegalArgumentException("canvasId is required.");
        }
        return canvasId.trim();
    }

    private String requireText(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return value.trim();
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private double requireOutPoint(Double value, double inPoint, String fieldName) {
        double outPoint = requireFinite(value, fieldName);
        if (outPoint < inPoint - EPSILON) {
            throw new IllegalArgumentException(fieldName + " must be greater than or equal to mediaInPoint.");
        }
        return outPoint;
    }

    private double nonNegativeOrDefault(Double value, double defaultValue, String fieldName) {
        if (value == null) {
            return defaultValue;
        }
        double normalized = requireFinite(value, fieldName);
        if (normalized < 0.0) {
            throw new IllegalArgumentException(fieldName + " must be greater than or equal to 0.");
        }
        return normalized;
    }

    private double positiveOrDefault(Double value, double defaultValue, String fieldName) {
        if (value == null) {
            return defaultValue;
        }
        double normalized = requireFinite(value, fieldName);
        if (normalized <= EPSILON) {
            throw new IllegalArgumentException(fieldName + " must be greater than 0.");
        }
        return normalized;
    }

    private double requireFinite(Double value, String fieldName) {
        if (value == null || !Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be a finite number.");
        }
        return value;
    }
}
