package github.sarthakdev143.story_graph.service.impl;

import github.sarthakdev143.story_graph.dto.CanvasProjectionResponse;
import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.model.ProjectionWarning;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;
import github.sarthakdev143.story_graph.service.CanvasNodeStore;
import github.sarthakdev143.story_graph.service.CanvasProjectionService;
import github.sarthakdev143.story_graph.service.GraphLayoutEngine;
import github.sarthakdev143.story_graph.service.TimelineProjector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Service
public class DefaultCanvasProjectionService implements CanvasProjectionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultCanvasProjectionService.class);

    private final CanvasNodeStore nodeStore;
    private final GraphLayoutEngine layoutEngine;
    private final TimelineProjector timelineProjector;
    private final NodePlacementPlanner placementPlanner;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final Counter projectionCounter;
    private final int maxLane;

    public DefaultCanvasProjectionService(
            CanvasNodeStore nodeStore,
            GraphLayoutEngine layoutEngine,
            TimelineProjector timelineProjector,
            NodePlacementPlanner placementPlanner,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry,
            @Value("${story-graph.canvas.max-lane:64}") int maxLane) {
        this.nodeStore = nodeStore;
        this.layoutEngine = layoutEngine;
        this.timelineProjector = timelineProjector;
        this.placementPlanner = placementPlanner;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.projectionCounter = meterRegistry.counter("story_graph.projections");
        this.maxLane = maxLane;
    }

    @Override
    public List<StoryNode> nodes(String canvasId) {
        return nodeStore.snapshot(canvasId);
    }

    @Override
    public List<StoryNode> replaceNodes(String canvasId, List<StoryNode> nodes) {
        return nodeStore.replace(canvasId, nodes);
    }

    @Override
    public StoryNode insertNode(String canvasId, NodeInsertionRequest request) {
        List<StoryNode> snapshot = nodeStore.snapshot(canvasId);
        StoryNode planned = placementPlanner.plan(canvasId, UUID.randomUUID().toString(), snapshot, request);
        if (planned.laneOrDefault() > maxLane) {
            throw new IllegalArgumentException(
                    "stacking on node " + planned.parentId() + " would exceed the highest lane V" + (maxLane + 1) + ".");
        }
        StoryNode stored = nodeStore.add(planned);

        meterRegistry.counter("story_graph.nodes.inserted", "anchor", stored.anchorType().name()).increment();
        if (stored.parentId() == null) {
            logger.info("Genesis: created ORIGIN node {} on canvas {}", stored.id(), canvasId);
        } else {
            logger.info(
                    "Inserted {} node {} anchor={} on V{} relative to node {} on canvas {}",
                    stored.type(),
                    stored.id(),
                    stored.anchorType(),
                    stored.laneOrDefault() + 1,
                    stored.parentId(),
                    canvasId);
        }
        return stored;
    }

    @Override
    public Optional<StoryNode> updateNode(String canvasId, String nodeId, NodeUpdateRequest update) {
        return nodeStore.update(canvasId, nodeId, update);
    }

    @Override
    public boolean removeNode(String canvasId, String nodeId) {
        return nodeStore.remove(canvasId, nodeId);
    }

    @Override
    public GraphLayout layout(String canvasId) {
        GraphLayout layout = layoutEngine.computeLayout(nodeStore.snapshot(canvasId));
        projectionCounter.increment();
        reportWarnings(canvasId, layout.warnings());
        return layout;
    }

    @Override
    public TimelineState timeline(String canvasId) {
        TimelineState timeline = timelineProjector.project(nodeStore.snapshot(canvasId));
        projectionCounter.increment();
        reportWarnings(canvasId, timeline.warnings());
        return timeline;
    }

    @Override
    public CanvasProjectionResponse project(String canvasId) {
        List<StoryNode> snapshot = nodeStore.snapshot(canvasId);

        CompletableFuture<GraphLayout> layoutFuture = CompletableFuture.supplyAsync(
                () -> layoutEngine.computeLayout(snapshot),
                taskExecutor);
        CompletableFuture<TimelineState> timelineFuture = CompletableFuture.supplyAsync(
                () -> timelineProjector.project(snapshot),
                taskExecutor);

        GraphLayout layout = await(layoutFuture);
        TimelineState timeline = await(timelineFuture);
        projectionCounter.increment();

        Set<ProjectionWarning> warnings = new LinkedHashSet<>(layout.warnings());
        warnings.addAll(timeline.warnings());
        reportWarnings(canvasId, warnings);

        return new CanvasProjectionResponse(canvasId, snapshot.size(), layout, timeline);
    }

    @Override
    public DropZone resolveDropZone(String canvasId, double x, double y) {
        GraphLayout layout = layoutEngine.computeLayout(nodeStore.snapshot(canvasId));
        return layoutEngine.resolveZone(x, y, layout);
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private void reportWarnings(String canvasId, Collection<ProjectionWarning> warnings) {
        for (ProjectionWarning warning : warnings) {
            meterRegistry.counter("story_graph.projection.warnings", "type", warning.type().name()).increment();
            logger.warn("Canvas {} integrity warning {}: {}", canvasId, warning.type(), warning.message());
        }
    }
}
