package github.sarthakdev143.story_graph.model;

public enum ConnectionKind {
    APPEND,
    STACK,
    PREPEND;

    public static ConnectionKind forAnchor(AnchorType anchorType) {
        return switch (anchorType) {
            case TOP -> STACK;
            case PREPEND -> PREPEND;
            case ORIGIN, APPEND -> APPEND;
        };
    }

    public String pathStyle() {
        return switch (this) {
            case APPEND -> "curve";
            case STACK -> "right-angle";
            case PREPEND -> "straight";
        };
    }
}
