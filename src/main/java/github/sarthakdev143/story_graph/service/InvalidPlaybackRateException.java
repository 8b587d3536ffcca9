package github.sarthakdev143.story_graph.service;

public class InvalidPlaybackRateException extends IllegalArgumentException {

    private final String nodeId;
    private final double playbackRate;

    public InvalidPlaybackRateException(String nodeId, double playbackRate) {
        super("playbackRate of node " + nodeId + " must be a finite number greater than 0 but was " + playbackRate + ".");
        this.nodeId = nodeId;
        this.playbackRate = playbackRate;
    }

    public String nodeId() {
        return nodeId;
    }

    public double playbackRate() {
        return playbackRate;
    }
}
