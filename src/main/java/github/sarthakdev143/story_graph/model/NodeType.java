package github.sarthakdev143.story_graph.model;

public enum NodeType {
    SPINE("#A855F7", "#7C3AED"),
    SATELLITE("#06B6D4", "#0891B2"),
    CONTAINER("#6B7280", "#4B5563");

    private final String color;
    private final String borderColor;

    NodeType(String color, String borderColor) {
        this.color = color;
        this.borderColor = borderColor;
    }

    public String color() {
        return color;
    }

    public String borderColor() {
        return borderColor;
    }
}
