package github.sarthakdev143.story_graph.service;

import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.model.StoryNode;

import java.util.List;
import java.util.Optional;

/**
 * Source of node snapshots for a canvas. Projections only ever read the list returned by
 * {@link #snapshot(String)}, which never changes after it is handed out.
 */
public interface CanvasNodeStore {

    List<StoryNode> snapshot(String canvasId);

    List<StoryNode> replace(String canvasId, List<StoryNode> nodes);

    StoryNode add(StoryNode node);

    Optional<StoryNode> update(String canvasId, String nodeId, NodeUpdateRequest update);

    boolean remove(String canvasId, String nodeId);
}
