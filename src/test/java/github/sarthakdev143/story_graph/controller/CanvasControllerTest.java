package github.sarthakdev143.story_graph.controller;

import github.sarthakdev143.story_graph.dto.CanvasProjectionResponse;
import github.sarthakdev143.story_graph.dto.NodeInsertionRequest;
import github.sarthakdev143.story_graph.dto.NodeUpdateRequest;
import github.sarthakdev143.story_graph.model.AnchorType;
import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.ZoneType;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;
import github.sarthakdev143.story_graph.service.CanvasProjectionService;
import github.sarthakdev143.story_graph.service.impl.CanvasSnapshotValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static github.sarthakdev143.story_graph.StoryNodeFixtures.CANVAS_ID;
import static github.sarthakdev143.story_graph.StoryNodeFixtures.appended;
import static github.sarthakdev143.story_graph.StoryNodeFixtures.origin;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CanvasController.class)
class CanvasControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CanvasProjectionService projectionService;

    @MockitoBean
    private CanvasSnapshotValidator snapshotValidator;

    @Test
    void getNodesReturnsSnapshot() throws Exception {
        when(projectionService.nodes(CANVAS_ID)).thenReturn(List.of(origin("o", 10.0)));

        mockMvc.perform(get("/api/canvases/canvas-1/nodes"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$[0].id").value("o"))
                .andExpect(jsonPath("$[0].anchorType").value("ORIGIN"))
                .andExpect(jsonPath("$[0].mediaOutPoint").value(10.0));
    }

    @Test
    void replaceNodesValidatesBeforeStoring() throws Exception {
        List<StoryNode> normalized = List.of(origin("o", 10.0), appended("a", "o", 5.0, 1));
        when(snapshotValidator.normalizeAndValidate(eq(CANVAS_ID), anyList())).thenReturn(normalized);
        when(projectionService.replaceNodes(CANVAS_ID, normalized)).thenReturn(normalized);

        mockMvc.perform(put("/api/canvases/canvas-1/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [
                                  {"id": "o", "anchorType": "ORIGIN", "mediaOutPoint": 10},
                                  {"id": "a", "parentId": "o", "anchorType": "APPEND", "mediaOutPoint": 5}
                                ]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].parentId").value("o"));

        verify(projectionService).replaceNodes(CANVAS_ID, normalized);
    }

    @Test
    void replaceNodesReturnsBadRequestForInvalidSnapshot() throws Exception {
        when(snapshotValidator.normalizeAndValidate(eq(CANVAS_ID), anyList()))
                .thenThrow(new IllegalArgumentException("nodes[0].playbackRate must be greater than 0."));

        mockMvc.perform(put("/api/canvases/canvas-1/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"id\": \"o\", \"anchorType\": \"ORIGIN\", \"playbackRate\": 0}]"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Invalid request: nodes[0].playbackRate")));

        verifyNoInteractions(projectionService);
    }

    @Test
    void insertNodeReturnsCreated() throws Exception {
        NodeInsertionRequest normalized = new NodeInsertionRequest("o", ZoneType.STACK, "asset-3", 4.0);
        when(snapshotValidator.normalizeInsertion(any())).thenReturn(normalized);
        when(projectionService.insertNode(CANVAS_ID, normalized)).thenReturn(new StoryNode(
                "n-1", CANVAS_ID, null, "o", AnchorType.TOP, 1, 0, 0.0, 4.0, 1.0, "asset-3", 5));

        mockMvc.perform(post("/api/canvases/canvas-1/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetNodeId\": \"o\", \"zone\": \"stack\", \"assetId\": \"asset-3\", \"mediaDurationSec\": 4}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("n-1"))
                .andExpect(jsonPath("$.anchorType").value("TOP"))
                .andExpect(jsonPath("$.lane").value(1));
    }

    @Test
    void insertNodeReturnsBadRequestWhenCanvasIsFull() throws Exception {
        NodeInsertionRequest normalized = new NodeInsertionRequest(null, ZoneType.APPEND, null, 1.0);
        when(snapshotValidator.normalizeInsertion(any())).thenReturn(normalized);
        when(projectionService.insertNode(CANVAS_ID, normalized))
                .thenThrow(new IllegalArgumentException("canvas canvas-1 already holds the maximum of 2 nodes."));

        mockMvc.perform(post("/api/canvases/canvas-1/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mediaDurationSec\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid request: canvas canvas-1 already holds the maximum of 2 nodes."));
    }

    @Test
    void updateNodeReturnsBadRequestWhenPointsWouldCross() throws Exception {
        NodeUpdateRequest normalized = new NodeUpdateRequest(null, null, 2.0, null, null, null, null);
        when(snapshotValidator.normalizeUpdate(eq("a"), any())).thenReturn(normalized);
        when(projectionService.updateNode(CANVAS_ID, "a", normalized))
                .thenThrow(new IllegalArgumentException("mediaOutPoint 2.0 of node a must be greater than or equal to mediaInPoint 5.0."));

        mockMvc.perform(patch("/api/canvases/canvas-1/nodes/a")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mediaOutPoint\": 2}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("must be greater than or equal to mediaInPoint 5.0")));
    }

    @Test
    void insertNodeRejectsUnknownZone() throws Exception {
        mockMvc.perform(post("/api/canvases/canvas-1/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"zone\": \"SIDEWAYS\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(projectionService);
    }

    @Test
    void updateNodeReturnsNotFoundForMissingNode() throws Exception {
        NodeUpdateRequest normalized = new NodeUpdateRequest(500, null, null, null, null, null, null);
        when(snapshotValidator.normalizeUpdate(eq("missing"), any())).thenReturn(normalized);
        when(projectionService.updateNode(CANVAS_ID, "missing", normalized)).thenReturn(Optional.empty());

        mockMvc.perform(patch("/api/canvases/canvas-1/nodes/missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"drift\": 500}"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Node not found for id: missing on canvas canvas-1"));
    }

    @Test
    void updateNodeReturnsUpdatedNode() throws Exception {
        NodeUpdateRequest normalized = new NodeUpdateRequest(500, null, null, null, null, null, null);
        when(snapshotValidator.normalizeUpdate(eq("a"), any())).thenReturn(normalized);
        when(projectionService.updateNode(CANVAS_ID, "a", normalized))
                .thenReturn(Optional.of(appended("a", "o", 5.0, 1)));

        mockMvc.perform(patch("/api/canvases/canvas-1/nodes/a")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"drift\": 500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("a"));
    }

    @Test
    void removeNodeReturnsNoContentOrNotFound() throws Exception {
        when(projectionService.removeNode(CANVAS_ID, "a")).thenReturn(true);
        when(projectionService.removeNode(CANVAS_ID, "b")).thenReturn(false);

        mockMvc.perform(delete("/api/canvases/canvas-1/nodes/a"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/canvases/canvas-1/nodes/b"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getProjectionReturnsLayoutAndTimeline() throws Exception {
        CanvasProjectionResponse projection = new CanvasProjectionResponse(
                CANVAS_ID,
                0,
                GraphLayout.empty(),
                new TimelineState(List.of(), 0, List.of()));
        when(projectionService.project(CANVAS_ID)).thenReturn(projection);

        mockMvc.perform(get("/api/canvases/canvas-1/projection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canvasId").value(CANVAS_ID))
                .andExpect(jsonPath("$.nodeCount").value(0))
                .andExpect(jsonPath("$.layout.totalWidth").value(0.0))
                .andExpect(jsonPath("$.timeline.totalDuration").value(0.0));
    }

    @Test
    void getLayoutReturnsServerErrorWhenProjectionFails() throws Exception {
        when(projectionService.layout(CANVAS_ID)).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/canvases/canvas-1/layout"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string("Computing layout failed. Please try again."));
    }

    @Test
    void getDropZoneReturnsResolvedZone() throws Exception {
        when(projectionService.resolveDropZone(CANVAS_ID, 270.0, 50.0))
                .thenReturn(new DropZone("o", ZoneType.APPEND, 400, 0, 300));

        mockMvc.perform(get("/api/canvases/canvas-1/drop-zone")
                        .param("x", "270")
                        .param("y", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetNodeId").value("o"))
                .andExpect(jsonPath("$.type").value("APPEND"))
                .andExpect(jsonPath("$.ghostX").value(400.0));
    }

    @Test
    void getDropZoneRejectsNonFiniteCoordinates() throws Exception {
        mockMvc.perform(get("/api/canvases/canvas-1/drop-zone")
                        .param("x", "NaN")
                        .param("y", "50"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid request: x and y must be finite numbers."));

        verifyNoInteractions(projectionService);
    }
}
