package github.sarthakdev143.story_graph.model.layout;

import github.sarthakdev143.story_graph.model.ZoneType;

public record DropZone(
        String targetNodeId,
        ZoneType type,
        double ghostX,
        double ghostY,
        double ghostWidth) {

    public boolean isGenesis() {
        return targetNodeId == null;
    }
}
