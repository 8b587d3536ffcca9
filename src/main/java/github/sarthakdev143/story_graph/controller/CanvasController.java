package github.sarthakdev143.story_graph.controller;

import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.dto.StoryNodeRequest;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.service.CanvasProjectionService;
import github.sarthakdev143.story_graph.service.impl.CanvasSnapshotValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/canvases/{canvasId}")
public class CanvasController {

    private static final Logger logger = LoggerFactory.getLogger(CanvasController.class);

    private final CanvasProjectionService projectionService;
    private final CanvasSnapshotValidator snapshotValidator;

    public CanvasController(CanvasProjectionService projectionService, CanvasSnapshotValidator snapshotValidator) {
        this.projectionService = projectionService;
        this.snapshotValidator = snapshotValidator;
    }

    @GetMapping("/nodes")
    public ResponseEntity<?> getNodes(@PathVariable String canvasId) {
        return respond("Loading nodes", canvasId, () -> ResponseEntity.ok(projectionService.nodes(canvasId)));
    }

    @PutMapping(value = "/nodes", consumes = "application/json")
    public ResponseEntity<?> replaceNodes(
            @PathVariable String canvasId,
            @RequestBody(required = false) List<StoryNodeRequest> nodes) {
        return respond("Replacing nodes", canvasId, () -> {
            List<StoryNode> normalized = snapshotValidator.normalizeAndValidate(canvasId, nodes);
            return ResponseEntity.ok(projectionService.replaceNodes(canvasId, normalized));
        });
    }

    @PostMapping(value = "/nodes", consumes = "application/json")
    public ResponseEntity<?> insertNode(
            @PathVariable String canvasId,
            @RequestBody(required = false) NodeInsertionRequest request) {
        return respond("Inserting node", canvasId, () -> {
            NodeInsertionRequest normalized = snapshotValidator.normalizeInsertion(request);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(projectionService.insertNode(canvasId, normalized));
        });
    }

    @PatchMapping(value = "/nodes/{nodeId}", consumes = "application/json")
    public ResponseEntity<?> updateNode(
            @PathVariable String canvasId,
            @PathVariable String nodeId,
            @RequestBody(required = false) NodeUpdateRequest update) {
        return respond("Updating node", canvasId, () -> {
            NodeUpdateRequest normalized = snapshotValidator.normalizeUpdate(nodeId, update);
            return projectionService.updateNode(canvasId, nodeId, normalized)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> notFound(canvasId, nodeId));
        });
    }

    @DeleteMapping("/nodes/{nodeId}")
    public ResponseEntity<?> removeNode(@PathVariable String canvasId, @PathVariable String nodeId) {
        return respond("Removing node", canvasId, () -> projectionService.removeNode(canvasId, nodeId)
                ? ResponseEntity.noContent().build()
                : notFound(canvasId, nodeId));
    }

    @GetMapping("/layout")
    public ResponseEntity<?> getLayout(@PathVariable String canvasId) {
        return respond("Computing layout", canvasId, () -> ResponseEntity.ok(projectionService.layout(canvasId)));
    }

    @GetMapping("/timeline")
    public ResponseEntity<?> getTimeline(@PathVariable String canvasId) {
        return respond("Projecting timeline", canvasId, () -> ResponseEntity.ok(projectionService.timeline(canvasId)));
    }

    @GetMapping("/projection")
    public ResponseEntity<?> getProjection(@PathVariable String canvasId) {
        return respond("Projecting canvas", canvasId, () -> ResponseEntity.ok(projectionService.project(canvasId)));
    }

    @GetMapping("/drop-zone")
    public ResponseEntity<?> getDropZone(
            @PathVariable String canvasId,
            @RequestParam("x") double x,
            @RequestParam("y") double y) {
        return respond("Resolving drop zone", canvasId, () -> {
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new IllegalArgumentException("x and y must be finite numbers.");
            }
            return ResponseEntity.ok(projectionService.resolveDropZone(canvasId, x, y));
        });
    }

    private ResponseEntity<?> respond(String action, String canvasId, Supplier<ResponseEntity<?>> handler) {
        try {
            return handler.get();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("{} failed for canvas {}", action, canvasId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(action + " failed. Please try again.");
        }
    }

    private ResponseEntity<?> notFound(String canvasId, String nodeId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body("Node not found for id: " + nodeId + " on canvas " + canvasId);
    }
}
