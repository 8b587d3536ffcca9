package github.sarthakdev143.story_graph.service;

import github.sarthakdev143.story_graph.dto.CanvasProjectionResponse;
import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;

import java.util.List;
import java.util.Optional;

public interface CanvasProjectionService {

    List<StoryNode> nodes(String canvasId);

    List<StoryNode> replaceNodes(String canvasId, List<StoryNode> nodes);

    StoryNode insertNode(String canvasId, NodeInsertionRequest request);

    Optional<StoryNode> updateNode(String canvasId, String nodeId, NodeUpdateRequest update);

    boolean removeNode(String canvasId, String nodeId);

    GraphLayout layout(String canvasId);

    TimelineState timeline(String canvasId);

    CanvasProjectionResponse project(String canvasId);

    DropZone resolveDropZone(String canvasId, double x, double y);
}
