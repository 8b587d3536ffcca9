package github.sarthakdev143.story_graph.dto;

import github.sarthakdev143.story_graph.model.ZoneType;

public record NodeInsertionRequest(
        String targetNodeId,
        ZoneType zone,
        String assetId,
        Double mediaDurationSec) {
}
