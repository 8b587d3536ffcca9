package github.sarthakdev143.story_graph.dto;

import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;

public record CanvasProjectionResponse(
        String canvasId,
        int nodeCount,
        GraphLayout layout,
        TimelineState timeline) {
}
