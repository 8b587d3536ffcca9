package github.sarthakdev143.story_graph.dto;

import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.NodeType;

public record StoryNodeRequest(
        String id,
        NodeType type,
        String parentId,
        AnchorType anchorType,
        Integer lane,
        Integer drift,
        Double mediaInPoint,
        Double mediaOutPoint,
        Double playbackRate,
        String assetId) {
}
