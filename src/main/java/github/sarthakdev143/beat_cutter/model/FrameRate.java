package github.sarthakdev143.beat_cutter.model;

import java.util.Locale;

/**
 * Frame rate as a reduced rational, e.g. {@code 24000/1001} for NTSC film.
 */
public record FrameRate(long numerator, long denominator) {

    public FrameRate {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Frame rate denominator must be positive.");
        }
        if (numerator <= 0) {
            throw new IllegalArgumentException("Frame rate numerator must be positive.");
        }
        long divisor = gcd(numerator, denominator);
        numerator = numerator / divisor;
        denominator = denominator / divisor;
    }

    public static FrameRate of(long framesPerSecond) {
        return new FrameRate(framesPerSecond, 1);
    }

    /**
     * Parses ffprobe's {@code r_frame_rate} notation ({@code "30000/1001"} or a plain integer).
     */
    public static FrameRate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Frame rate is required.");
        }

        String trimmed = value.trim();
        int slash = trimmed.indexOf('/');
        try {
            if (slash < 0) {
                return new FrameRate(Long.parseLong(trimmed), 1);
            }
            long numerator = Long.parseLong(trimmed.substring(0, slash).trim());
            long denominator = Long.parseLong(trimmed.substring(slash + 1).trim());
            return new FrameRate(numerator, denominator);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Frame rate must look like <numerator>/<denominator>: " + value, ex);
        }
    }

    public double toDouble() {
        return (double) numerator / denominator;
    }

    public double frameIntervalSeconds() {
        return (double) denominator / numerator;
    }

    /**
     * Value for ffmpeg's {@code -r} option.
     */
    public String toFfmpegValue() {
        return denominator == 1
                ? Long.toString(numerator)
                : String.format(Locale.ROOT, "%d/%d", numerator, denominator);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }

    private static long gcd(long a, long b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
