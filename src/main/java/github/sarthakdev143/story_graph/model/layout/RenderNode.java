package github.sarthakdev143.story_graph.model.layout;

import github.sarthakdev143.story_graph.model.StoryNode;

public record RenderNode(
        StoryNode node,
        double x,
        double y,
        double width,
        double height,
        String color,
        String borderColor,
        boolean origin,
        String trackLabel) {

    public double right() {
        return x + width;
    }
}
