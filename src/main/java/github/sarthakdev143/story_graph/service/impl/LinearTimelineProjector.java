package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.NodeType;
import github.sarthakdev143.story_graph.model.ProjectionWarning;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.TrackKind;
import github.sarthakdev143.story_graph.model.WarningType;
import github.sarthakdev143.story_graph.model.timeline.TimelineClip;
import github.sarthakdev143.story_graph.model.timeline.TimelineRow;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;
import github.sarthakdev143.story_graph.service.InvalidPlaybackRateException;
import github.sarthakdev143.story_graph.service.TimelineProjector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

@Component
public class LinearTimelineProjector implements TimelineProjector {

    static final int MIN_VIDEO_LANE = 2;
    static final int AUDIO_ROW_ID = -1;

    private static final double MILLIS_PER_SECOND = 1000.0;

    @Override
    public TimelineState project(Collection<StoryNode> nodes) {
        StoryNodeGraph graph = StoryNodeGraph.of(nodes);
        Optional<StoryNode> origin = graph.origin();
        if (origin.isEmpty()) {
            return new TimelineState(buildRows(Map.of()), 0, List.of());
        }

        TimelinePass pass = new TimelinePass(graph);
        pass.visit(origin.get(), 0);

        List<ProjectionWarning> warnings = new ArrayList<>(graph.warnings());
        warnings.addAll(pass.warnings);
        return new TimelineState(buildRows(pass.clipsByLane), Math.max(pass.latestEnd, 0), warnings);
    }

    /**
     * Source duration on the timeline: {@code (out - in) / rate}. A missing out point means a
     * zero-length clip.
     *
     * @throws InvalidPlaybackRateException if the rate is not a finite number above zero
     */
    public static double durationOf(StoryNode node) {
        double rate = node.playbackRate() == null ? 1.0 : node.playbackRate();
        if (!Double.isFinite(rate) || rate <= 0) {
            throw new InvalidPlaybackRateException(node.id(), rate);
        }
        double inPoint = node.mediaInPoint() == null ? 0.0 : node.mediaInPoint();
        double outPoint = node.mediaOutPoint() == null ? inPoint : node.mediaOutPoint();
        return (outPoint - inPoint) / rate;
    }

    private static List<TimelineRow> buildRows(Map<Integer, List<TimelineClip>> clipsByLane) {
        int highestLane = MIN_VIDEO_LANE;
        for (int lane : clipsByLane.keySet()) {
            highestLane = Math.max(highestLane, lane);
        }

        List<TimelineRow> rows = new ArrayList<>();
        for (int lane = highestLane; lane >= 0; lane--) {
            rows.add(new TimelineRow(
                    lane,
                    "V" + (lane + 1),
                    TrackKind.VIDEO,
                    clipsByLane.getOrDefault(lane, List.of())));
        }
        rows.add(new TimelineRow(AUDIO_ROW_ID, "A1", TrackKind.AUDIO, List.of()));
        return rows;
    }

    private static final class TimelinePass {

        private final StoryNodeGraph graph;
        private final Map<Integer, List<TimelineClip>> clipsByLane = new TreeMap<>();
        private final List<ProjectionWarning> warnings = new ArrayList<>();
        private double latestEnd;

        private TimelinePass(StoryNodeGraph graph) {
            this.graph = graph;
        }

        private OptionalDouble visit(StoryNode node, double start) {
            double duration;
            try {
                duration = durationOf(node);
            } catch (InvalidPlaybackRateException e) {
                warnings.add(new ProjectionWarning(node.id(), WarningType.INVALID_PLAYBACK_RATE, e.getMessage()));
                return OptionalDouble.empty();
            }

            double end = start + duration;
            record(node, start, end, duration);

            for (StoryNode child : graph.children(node.id(), AnchorType.TOP)) {
                visit(child, start + driftSeconds(child));
            }

            double chainEnd = end;
            for (StoryNode child : graph.children(node.id(), AnchorType.APPEND)) {
                OptionalDouble childEnd = visit(child, chainEnd + driftSeconds(child));
                if (childEnd.isPresent()) {
                    chainEnd = childEnd.getAsDouble();
                }
            }

            for (StoryNode child : graph.children(node.id(), AnchorType.PREPEND)) {
                visit(child, start);
            }

            return OptionalDouble.of(end);
        }

        private void record(StoryNode node, double start, double end, double duration) {
            int lane = node.laneOrDefault();
            boolean spine = lane == 0;
            NodeType style = spine ? NodeType.SPINE : NodeType.SATELLITE;
            TimelineClip clip = new TimelineClip(
                    "clip-" + node.id(),
                    node.id(),
                    node.assetId(),
                    start,
                    end,
                    lane,
                    style.color(),
                    style.name(),
                    duration);
            clipsByLane.computeIfAbsent(lane, ignored -> new ArrayList<>()).add(clip);
            latestEnd = Math.max(latestEnd, end);
        }

        private static double driftSeconds(StoryNode node) {
            return node.drift() / MILLIS_PER_SECOND;
        }
    }
}
