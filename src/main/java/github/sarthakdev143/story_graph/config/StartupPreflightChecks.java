package github.sarthakdev143.story_graph.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "story-graph.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    static final String DEFAULT_FPS_PROPERTY = "story-graph.timecode.default-fps";
    static final String MAX_NODES_PROPERTY = "story-graph.canvas.max-nodes";
    static final String MAX_LANE_PROPERTY = "story-graph.canvas.max-lane";
    private static final int MAX_FPS = 240;
    private static final int LANE_CEILING = 1024;

    private final Environment environment;

    public StartupPreflightChecks(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkDefaultFps();
        checkMaxNodes();
        checkMaxLane();
    }

    void checkDefaultFps() {
        int fps = readInt(DEFAULT_FPS_PROPERTY, 24);
        if (fps < 1 || fps > MAX_FPS) {
            throw new IllegalStateException(
                    DEFAULT_FPS_PROPERTY + " must be between 1 and " + MAX_FPS + " but was " + fps + ".");
        }
    }

    void checkMaxNodes() {
        int maxNodes = readInt(MAX_NODES_PROPERTY, 5000);
        if (maxNodes < 1) {
            throw new IllegalStateException(MAX_NODES_PROPERTY + " must be at least 1 but was " + maxNodes + ".");
        }
    }

    void checkMaxLane() {
        int maxLane = readInt(MAX_LANE_PROPERTY, 64);
        if (maxLane < 0 || maxLane > LANE_CEILING) {
            throw new IllegalStateException(
                    MAX_LANE_PROPERTY + " must be between 0 and " + LANE_CEILING + " but was " + maxLane + ".");
        }
    }

    private int readInt(String property, int defaultValue) {
        String value = environment.getProperty(property);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(property + " must be an integer but was '" + value + "'.", e);
        }
    }
}
