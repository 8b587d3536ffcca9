package github.sarthakdev143.story_graph.model.layout;

public final class LayoutConstants {

    public static final double BASE_NODE_WIDTH = 300;
    public static final double NODE_HEIGHT = 100;
    public static final double GAP_BETWEEN_NODES = 100;
    public static final double CANVAS_PADDING = 50;
    public static final double DROP_HIT_MARGIN = 20;

    private LayoutConstants() {
    }
}
