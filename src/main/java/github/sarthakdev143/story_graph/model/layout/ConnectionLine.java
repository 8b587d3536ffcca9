package github.sarthakdev143.story_graph.model.layout;

import github.sarthakdev143.story_graph.model.ConnectionKind;

public record ConnectionLine(
        String id,
        double fromX,
        double fromY,
        double toX,
        double toY,
        ConnectionKind kind) {

    public String pathStyle() {
        return kind.pathStyle();
    }
}
