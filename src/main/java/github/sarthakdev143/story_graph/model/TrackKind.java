package github.sarthakdev143.story_graph.model;

public enum TrackKind {
    VIDEO,
    AUDIO
}
