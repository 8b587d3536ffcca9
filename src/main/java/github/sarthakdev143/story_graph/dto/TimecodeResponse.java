package github.sarthakdev143.story_graph.dto;

public record TimecodeResponse(
        double seconds,
        int fps,
        String timecode,
        String simple) {
}
