package org.Aayush.proximity.accessibility;

import lombok.experimental.UtilityClass;

/**
 * Distance-to-colour ramp for accessibility heat cells.
 * <p>
 * The ramp has three anchors (near, mid, far) and interpolates linearly inside each half:
 * {@code [0, 0.5)} runs near to mid, {@code [0.5, 1]} runs mid to far.
 * </p>
 */
@UtilityClass
public class HeatRamp {
    public static final HeatColor NEAR = new HeatColor(40, 200, 60);
    public static final HeatColor MID = new HeatColor(255, 220, 60);
    public static final HeatColor FAR = new HeatColor(220, 40, 40);

    /**
     * Normalizes a distance into {@code [0, 1]}.
     *
     * @param meters distance in meters.
     * @param maxMeters distance mapped to 1; non-positive values map everything to 1.
     */
    public static double heatValue(double meters, double maxMeters) {
        if (!(maxMeters > 0.0d)) {
            return 1.0d;
        }
        double t = meters / maxMeters;
        if (Double.isNaN(t)) {
            return 1.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, t));
    }

    /**
     * Colour for a distance.
     */
    public static HeatColor colorFor(double meters, double maxMeters) {
        return colorAt(heatValue(meters, maxMeters));
    }

    /**
     * Colour for a normalized heat value in {@code [0, 1]}.
     */
    public static HeatColor colorAt(double t) {
        if (t < 0.5d) {
            return interpolate(NEAR, MID, t / 0.5d);
        }
        return interpolate(MID, FAR, (t - 0.5d) / 0.5d);
    }

    private static HeatColor interpolate(HeatColor from, HeatColor to, double u) {
        return new HeatColor(
                channel(from.r(), to.r(), u),
                channel(from.g(), to.g(), u),
                channel(from.b(), to.b(), u)
        );
    }

    private static int channel(int from, int to, double u) {
        return (int) Math.round(from + (to - from) * u);
    }
}
