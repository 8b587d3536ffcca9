package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.model.ZoneType;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.layout.RenderNode;
import org.springframework.stereotype.Component;

import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.BASE_NODE_WIDTH;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.CANVAS_PADDING;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.DROP_HIT_MARGIN;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.GAP_BETWEEN_NODES;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.NODE_HEIGHT;

@Component
public class DropZoneResolver {

    private static final double APPEND_BAND_START = 0.7;
    private static final double STACK_BAND_END = 0.5;
    private static final double PREPEND_BAND_END = 0.2;

    public DropZone resolve(double x, double y, GraphLayout layout) {
        if (layout == null || layout.nodes().isEmpty()) {
            return new DropZone(null, ZoneType.APPEND, CANVAS_PADDING, 0, BASE_NODE_WIDTH);
        }

        for (RenderNode renderNode : layout.nodes()) {
            if (isHit(renderNode, x, y)) {
                return zoneWithin(renderNode, x - renderNode.x(), y - renderNode.y());
            }
        }

        RenderNode rightmost = layout.nodes().get(0);
        for (RenderNode candidate : layout.nodes()) {
            if (candidate.right() > rightmost.right()) {
                rightmost = candidate;
            }
        }
        return appendZone(rightmost);
    }

    private boolean isHit(RenderNode node, double x, double y) {
        return x >= node.x() - DROP_HIT_MARGIN
                && x <= node.right() + DROP_HIT_MARGIN
                && y >= node.y() - DROP_HIT_MARGIN
                && y <= node.y() + node.height() + DROP_HIT_MARGIN;
    }

    private DropZone zoneWithin(RenderNode node, double relativeX, double relativeY) {
        // first matching band wins: right 30% appends, top half stacks, left 20% prepends
        if (relativeX > node.width() * APPEND_BAND_START) {
            return appendZone(node);
        }
        if (relativeY < node.height() * STACK_BAND_END) {
            return new DropZone(
                    node.node().id(),
                    ZoneType.STACK,
                    node.x(),
                    node.y() - NODE_HEIGHT - GAP_BETWEEN_NODES,
                    BASE_NODE_WIDTH);
        }
        if (relativeX < node.width() * PREPEND_BAND_END) {
            return new DropZone(
                    node.node().id(),
                    ZoneType.PREPEND,
                    node.x() - BASE_NODE_WIDTH - GAP_BETWEEN_NODES,
                    node.y(),
                    BASE_NODE_WIDTH);
        }
        return appendZone(node);
    }

    private DropZone appendZone(RenderNode node) {
        return new DropZone(
                node.node().id(),
                ZoneType.APPEND,
                node.right() + GAP_BETWEEN_NODES,
                node.y(),
                BASE_NODE_WIDTH);
    }
}
