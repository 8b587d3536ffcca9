package github.sarthakdev143.story_graph.model;

public enum AnchorType {
    ORIGIN,
    APPEND,
    PREPEND,
    TOP
}
