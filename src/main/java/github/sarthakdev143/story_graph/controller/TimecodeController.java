package github.sarthakdev143.story_graph.controller;

import github.sarthakdev143.story_graph.dto.TimecodeResponse;
import github.sarthakdev143.story_graph.format.Timecodes;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/timecode")
public class TimecodeController {

    private final int defaultFps;

    public TimecodeController(@Value("${story-graph.timecode.default-fps:24}") int defaultFps) {
        this.defaultFps = defaultFps;
    }

    @GetMapping
    public ResponseEntity<?> format(
            @RequestParam("seconds") double seconds,
            @RequestParam(value = "fps", required = false) Integer fpsInput) {
        int fps = fpsInput == null ? defaultFps : fpsInput;
        try {
            return ResponseEntity.ok(new TimecodeResponse(
                    seconds,
                    fps,
                    Timecodes.formatTimecode(seconds, fps),
                    Timecodes.formatSimple(seconds)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }
}
