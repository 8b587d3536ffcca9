package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.NodeType;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.ZoneType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class NodePlacementPlanner {

    public StoryNode plan(
            String canvasId,
            String newNodeId,
            Collection<StoryNode> nodes,
            NodeInsertionRequest request) {
        StoryNodeGraph graph = StoryNodeGraph.of(nodes);
        ZoneType zone = request.zone() == null ? ZoneType.APPEND : request.zone();
        double outPoint = request.mediaDurationSec() == null ? 0.0 : request.mediaDurationSec();

        Optional<StoryNode> parent = resolveParent(graph, request.targetNodeId());
        if (parent.isEmpty()) {
            return new StoryNode(
                    newNodeId,
                    canvasId,
                    NodeType.SPINE,
                    null,
                    AnchorType.ORIGIN,
                    0,
                    0,
                    0.0,
                    outPoint,
                    1.0,
                    request.assetId(),
                    0);
        }

        StoryNode parentNode = parent.get();
        int parentLane = parentNode.laneOrDefault();
        NodeType type = zone == ZoneType.STACK ? NodeType.SATELLITE : NodeType.SPINE;
        int lane = zone == ZoneType.STACK ? parentLane + 1 : parentLane;

        return new StoryNode(
                newNodeId,
                canvasId,
                type,
                parentNode.id(),
                zone.anchorType(),
                lane,
                0,
                0.0,
                outPoint,
                1.0,
                request.assetId(),
                0);
    }

    public Optional<StoryNode> spineTail(Collection<StoryNode> nodes) {
        return spineTail(StoryNodeGraph.of(nodes));
    }

    private Optional<StoryNode> resolveParent(StoryNodeGraph graph, String targetNodeId) {
        if (targetNodeId != null && !targetNodeId.isBlank()) {
            StoryNode target = graph.find(targetNodeId.trim())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "targetNodeId " + targetNodeId + " does not exist on this canvas."));
            return Optional.of(target);
        }
        return spineTail(graph);
    }

    private Optional<StoryNode> spineTail(StoryNodeGraph graph) {
        Optional<StoryNode> origin = graph.origin();
        if (origin.isEmpty()) {
            return Optional.empty();
        }

        StoryNode tail = origin.get();
        List<StoryNode> appended = graph.children(tail.id(), AnchorType.APPEND);
        while (!appended.isEmpty()) {
            tail = appended.get(appended.size() - 1);
            appended = graph.children(tail.id(), AnchorType.APPEND);
        }
        return Optional.of(tail);
    }
}
