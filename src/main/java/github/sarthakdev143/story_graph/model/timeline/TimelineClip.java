package github.sarthakdev143.story_graph.model.timeline;

public record TimelineClip(
        String id,
        String nodeId,
        String assetId,
        double start,
        double end,
        int lane,
        String color,
        String label,
        double duration) {
}
