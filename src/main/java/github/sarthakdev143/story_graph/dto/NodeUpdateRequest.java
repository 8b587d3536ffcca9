package github.sarthakdev143.story_graph.dto;

import github.sarthakdev143.story_graph.model.AnchorType;

public record NodeUpdateRequest(
        Integer drift,
        Double mediaInPoint,
        Double mediaOutPoint,
        Double playbackRate,
        Integer lane,
        String parentId,
        AnchorType anchorType) {

    public boolean isEmpty() {
        return drift == null
                && mediaInPoint == null
                && mediaOutPoint == null
                && playbackRate == null
                && lane == null
                && parentId == null
                && anchorType == null;
    }
}
