package github.sarthakdev143.story_graph.model;

public record StoryNode(
        String id,
        String canvasId,
        NodeType type,
        String parentId,
        AnchorType anchorType,
        Integer lane,
        int drift,
        Double mediaInPoint,
        Double mediaOutPoint,
        Double playbackRate,
        String assetId,
        long sequence) {

    public StoryNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id is required.");
        }
        if (lane != null && lane < 0) {
            throw new IllegalArgumentException("lane of node " + id + " must be greater than or equal to 0.");
        }
        type = type == null ? NodeType.SPINE : type;
        parentId = parentId == null || parentId.isBlank() ? null : parentId;
        playbackRate = playbackRate == null ? 1.0 : playbackRate;
    }

    public int laneOrDefault() {
        return lane == null ? 0 : lane;
    }

    public boolean isRootOrigin() {
        return anchorType == AnchorType.ORIGIN && parentId == null;
    }

    public StoryNode withSequence(long newSequence) {
        return new StoryNode(
                id,
                canvasId,
                type,
                parentId,
                anchorType,
                lane,
                drift,
                mediaInPoint,
                mediaOutPoint,
                playbackRate,
                assetId,
                newSequence);
    }
}
