package github.sarthakdev143.story_graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ZoneType {
    APPEND,
    STACK,
    PREPEND;

    @JsonCreator
    public static ZoneType fromInput(String input) {
        if (input == null || input.isBlank()) {
            return APPEND;
        }

        try {
            return ZoneType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("zone must be one of APPEND, STACK, PREPEND.");
        }
    }

    public AnchorType anchorType() {
        return switch (this) {
            case APPEND -> AnchorType.APPEND;
            case STACK -> AnchorType.TOP;
            case PREPEND -> AnchorType.PREPEND;
        };
    }
}
