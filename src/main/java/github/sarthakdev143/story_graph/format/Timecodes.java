package github.sarthakdev143.story_graph.format;

import java.util.Locale;

public final class Timecodes {

    public static final int DEFAULT_FPS = 24;

    private Timecodes() {
    }

    /**
     * Formats a timeline position as {@code HH:MM:SS:FF}. Every field is floored, so a position
     * is shown as the frame it falls in.
     */
    public static String formatTimecode(double seconds, int fps) {
        requirePosition(seconds);
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be greater than 0.");
        }

        long totalFrames = (long) Math.floor(seconds * fps);
        long frames = totalFrames % fps;
        long totalSeconds = (long) Math.floor(seconds);
        long secs = totalSeconds % 60;
        long totalMinutes = totalSeconds / 60;
        long mins = totalMinutes % 60;
        long hours = totalMinutes / 60;

        return String.format(Locale.ROOT, "%02d:%02d:%02d:%02d", hours, mins, secs, frames);
    }

    public static String formatTimecode(double seconds) {
        return formatTimecode(seconds, DEFAULT_FPS);
    }

    public static String formatSimple(double seconds) {
        requirePosition(seconds);
        long totalSeconds = (long) Math.floor(seconds);
        return String.format(Locale.ROOT, "%d:%02d", totalSeconds / 60, totalSeconds % 60);
    }

    private static void requirePosition(double seconds) {
        if (!Double.isFinite(seconds) || seconds < 0) {
            throw new IllegalArgumentException("seconds must be a finite number greater than or equal to 0.");
        }
    }
}
