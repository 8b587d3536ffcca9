package github.sarthakdev143.story_graph.model;

public record ProjectionWarning(
        String nodeId,
        WarningType type,
        String message) {
}
