package github.sarthakdev143.story_graph.model.timeline;

import github.sarthakdev143.story_graph.model.ProjectionWarning;

import java.util.List;

public record TimelineState(
        List<TimelineRow> rows,
        double totalDuration,
        List<ProjectionWarning> warnings) {

    public TimelineState {
        rows = rows == null ? List.of() : List.copyOf(rows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
