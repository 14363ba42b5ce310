package org.Aayush.proximity.accessibility;

/**
 * 8-bit RGB colour produced by {@link HeatRamp}.
 */
public record HeatColor(int r, int g, int b) {

    /**
     * CSS {@code rgb(r,g,b)} form.
     */
    public String toCss() {
        return "rgb(" + r + "," + g + "," + b + ")";
    }
}
