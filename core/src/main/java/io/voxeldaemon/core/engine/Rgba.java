package io.voxeldaemon.core.engine;

import java.util.Locale;

/**
 * A voxel color. Components are in {@code 0..255}.
 *
 * @param r red
 * @param g green
 * @param b blue
 * @param a alpha, 255 is opaque
 */
public record Rgba(int r, int g, int b, int a) {

    public static final Rgba WHITE = new Rgba(255, 255, 255, 255);

    public Rgba {
        check("r", r);
        check("g", g);
        check("b", b);
        check("a", a);
    }

    /** Opaque color. */
    public static Rgba opaque(int r, int g, int b) {
        return new Rgba(r, g, b, 255);
    }

    /** {@code RRGGBB} in lower-case hex, alpha dropped. */
    public String hex() {
        return String.format(Locale.ROOT, "%02x%02x%02x", r, g, b);
    }

    private static void check(String component, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("color component " + component + " out of range: " + value);
        }
    }
}
