package github.sarthakdev143.beat_cutter.model;

import java.util.Locale;

public enum OutputResolution {
    HD_720P(1280, 720),
    FULL_HD(1920, 1088);

    private final int width;
    private final int height;

    OutputResolution(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public static OutputResolution fromInput(String input) {
        if (input == null || input.isBlank()) {
            return FULL_HD;
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "720p", "hd_720p" -> HD_720P;
            case "1080p", "full_hd" -> FULL_HD;
            default -> throw new IllegalArgumentException("resolution must be one of 720p, 1080p.");
        };
    }
}
