package github.sarthakdev143.story_graph.model;

public enum WarningType {
    DANGLING_PARENT,
    UNREACHABLE,
    DUPLICATE_ORIGIN,
    DUPLICATE_ID,
    INVALID_PLAYBACK_RATE
}
