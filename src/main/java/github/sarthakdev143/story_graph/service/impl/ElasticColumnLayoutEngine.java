package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.ConnectionKind;
import github.sarthakdev143.story_graph.model.NodeType;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.layout.ConnectionLine;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.layout.RenderNode;
import github.sarthakdev143.story_graph.service.GraphLayoutEngine;
import github.sarthakdev143.story_graph.service.NodeWidthPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.CANVAS_PADDING;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.GAP_BETWEEN_NODES;
import static github.sarthakdev143.story_graph.model.layout.LayoutConstants.NODE_HEIGHT;

@Component
public class ElasticColumnLayoutEngine implements GraphLayoutEngine {

    private final NodeWidthPolicy widthPolicy;
    private final DropZoneResolver dropZoneResolver;

    public ElasticColumnLayoutEngine(NodeWidthPolicy widthPolicy, DropZoneResolver dropZoneResolver) {
        this.widthPolicy = widthPolicy;
        this.dropZoneResolver = dropZoneResolver;
    }

    @Override
    public GraphLayout computeLayout(Collection<StoryNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return GraphLayout.empty();
        }

        StoryNodeGraph graph = StoryNodeGraph.of(nodes);
        Optional<StoryNode> origin = graph.origin();
        if (origin.isEmpty()) {
            return GraphLayout.empty();
        }

        LayoutPass pass = new LayoutPass(graph);
        double rightmost = pass.place(origin.get(), null, null);
        double minY = Math.min(pass.minY, 0);

        return new GraphLayout(
                pass.renderNodes,
                pass.connections,
                rightmost + CANVAS_PADDING,
                Math.abs(minY) + NODE_HEIGHT + CANVAS_PADDING,
                graph.warnings());
    }

    @Override
    public DropZone resolveZone(double x, double y, GraphLayout layout) {
        return dropZoneResolver.resolve(x, y, layout);
    }

    static String trackLabel(double y) {
        long track = Math.round(Math.abs(y) / (NODE_HEIGHT + GAP_BETWEEN_NODES)) + 1;
        return "V" + track;
    }

    private record Box(double x, double y, double width) {

        double right() {
            return x + width;
        }
    }

    private final class LayoutPass {

        private final StoryNodeGraph graph;
        private final List<RenderNode> renderNodes = new ArrayList<>();
        private final List<ConnectionLine> connections = new ArrayList<>();
        private final Map<String, Double> elasticWidths = new HashMap<>();
        private double minY;

        private LayoutPass(StoryNodeGraph graph) {
            this.graph = graph;
        }

        private double place(StoryNode node, Box anchor, Box parent) {
            Box box = position(node, anchor);
            emit(node, box, parent);

            double rightmost = box.right();

            Box previous = box;
            for (StoryNode child : graph.children(node.id(), AnchorType.APPEND)) {
                rightmost = Math.max(rightmost, place(child, previous, box));
                previous = position(child, previous);
            }

            for (StoryNode child : graph.children(node.id(), AnchorType.TOP)) {
                rightmost = Math.max(rightmost, place(child, box, box));
            }

            for (StoryNode child : graph.children(node.id(), AnchorType.PREPEND)) {
                rightmost = Math.max(rightmost, place(child, box, box));
            }

            return rightmost;
        }

        private Box position(StoryNode node, Box anchor) {
            double width = renderedWidth(node);
            if (anchor == null) {
                return new Box(CANVAS_PADDING, 0, width);
            }
            return switch (node.anchorType()) {
                case ORIGIN -> new Box(CANVAS_PADDING, 0, width);
                case APPEND -> new Box(anchor.right() + GAP_BETWEEN_NODES, anchor.y(), width);
                case TOP -> new Box(anchor.x(), anchor.y() - NODE_HEIGHT - GAP_BETWEEN_NODES, width);
                case PREPEND -> new Box(anchor.x() - width - GAP_BETWEEN_NODES, anchor.y(), width);
            };
        }

        private void emit(StoryNode node, Box box, Box parent) {
            renderNodes.add(new RenderNode(
                    node,
                    box.x(),
                    box.y(),
                    box.width(),
                    NODE_HEIGHT,
                    node.type().color(),
                    node.type().borderColor(),
                    node.anchorType() == AnchorType.ORIGIN,
                    trackLabel(box.y())));
            minY = Math.min(minY, box.y());

            if (parent != null) {
                connections.add(connect(node, box, parent));
            }
        }

        private ConnectionLine connect(StoryNode node, Box child, Box parent) {
            String id = "conn-" + node.id();
            ConnectionKind kind = ConnectionKind.forAnchor(node.anchorType());
            double halfHeight = NODE_HEIGHT / 2;
            return switch (kind) {
                case APPEND -> new ConnectionLine(
                        id,
                        parent.right(),
                        parent.y() + halfHeight,
                        child.x(),
                        child.y() + halfHeight,
                        kind);
                case STACK -> new ConnectionLine(
                        id,
                        parent.x() + parent.width() / 2,
                        parent.y(),
                        child.x() + child.width() / 2,
                        child.y() + NODE_HEIGHT,
                        kind);
                case PREPEND -> new ConnectionLine(
                        id,
                        child.right(),
                        child.y() + halfHeight,
                        parent.x(),
                        parent.y() + halfHeight,
                        kind);
            };
        }

        private double renderedWidth(StoryNode node) {
            return node.type() == NodeType.SPINE ? elasticWidth(node) : widthPolicy.baseWidth(node);
        }

        private double elasticWidth(StoryNode node) {
            Double known = elasticWidths.get(node.id());
            if (known != null) {
                return known;
            }

            double width = widthPolicy.baseWidth(node);
            for (StoryNode stacked : graph.children(node.id(), AnchorType.TOP)) {
                width = Math.max(width, elasticWidth(stacked));
            }
            elasticWidths.put(node.id(), width);
            return width;
        }
    }
}
