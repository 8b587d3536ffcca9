package github.sarthakdev143.story_graph.model.layout;

import github.sarthakdev143.story_graph.model.ProjectionWarning;

import java.util.List;

public record GraphLayout(
        List<RenderNode> nodes,
        List<ConnectionLine> connections,
        double totalWidth,
        double totalHeight,
        List<ProjectionWarning> warnings) {

    public GraphLayout {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static GraphLayout empty() {
        return new GraphLayout(List.of(), List.of(), 0, 0, List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
