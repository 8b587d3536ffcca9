package github.sarthakdev143.story_graph.model.timeline;

import github.sarthakdev143.story_graph.model.TrackKind;

import java.util.List;

public record TimelineRow(
        int id,
        String label,
        TrackKind kind,
        List<TimelineClip> clips) {

    public TimelineRow {
        clips = clips == null ? List.of() : List.copyOf(clips);
    }
}
