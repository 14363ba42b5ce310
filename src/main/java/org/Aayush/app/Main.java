package org.Aayush.app;

import org.Aayush.proximity.accessibility.AccessibilityService;
import org.Aayush.proximity.accessibility.AccessibilitySummary;
import org.Aayush.proximity.index.GeoPoint;
import org.Aayush.proximity.index.ProximityMatch;

import java.util.List;
import java.util.Map;

/**
 * Local smoke run: indexes a small sample of Brisbane stops and reports accessibility at a location.
 */
public class Main {
    static final double DEFAULT_LAT = -27.4698;
    static final double DEFAULT_LON = 153.0251;

    static final List<GeoPoint> SAMPLE_STOPS = List.of(
            new GeoPoint("600029", -27.4700, 153.0260),
            new GeoPoint("600011", -27.4655, 153.0237),
            new GeoPoint("600248", -27.4748, 153.0273),
            new GeoPoint("001951", -27.4668, 153.0297),
            new GeoPoint("010802", -27.4602, 153.0355),
            new GeoPoint("600284", -27.4784, 153.0198),
            new GeoPoint("003104", -27.4840, 153.0390),
            new GeoPoint("005840", -27.4975, 153.0137),
            new GeoPoint("000040", -27.4516, 153.0417),
            new GeoPoint("310001", -27.5350, 153.0420)
    );

    static final String USAGE = "Usage: Main [<lat> <lon>]";

    /**
     * Runs the smoke routine.
     *
     * @param args optional {@code <lat> <lon>}; defaults to Brisbane CBD.
     */
    public static void main(String[] args) {
        double lat = DEFAULT_LAT;
        double lon = DEFAULT_LON;
        if (args.length == 1 || args.length > 2) {
            printUsage();
            return;
        }
        if (args.length == 2) {
            try {
                lat = Double.parseDouble(args[0]);
                lon = Double.parseDouble(args[1]);
            } catch (NumberFormatException e) {
                System.err.println("Invalid coordinate: " + e.getMessage());
                printUsage();
                return;
            }
            if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
                System.err.println("Invalid coordinate: lat and lon must be finite");
                printUsage();
                return;
            }
        }

        AccessibilityService service = AccessibilityService.withDefaults();
        service.publish(SAMPLE_STOPS);

        System.out.printf("Indexed %d stops%n", service.currentIndex().size());
        System.out.printf("Query (%.4f, %.4f)%n", lat, lon);
        for (ProximityMatch match : service.nearestStops(lat, lon, 3)) {
            System.out.printf("  stop %s at %.0f m%n", match.id(), match.meters());
        }

        AccessibilitySummary summary = service.summarize(lat, lon);
        if (summary.nearestMeters().isPresent()) {
            System.out.printf("Nearest stop: %.0f m%n", summary.nearestMeters().getAsDouble());
        } else {
            System.out.println("Nearest stop: none in range");
        }
        for (Map.Entry<Double, Integer> entry : summary.countsByRadius().entrySet()) {
            System.out.printf("Stops within %.0f m: %d%n", entry.getKey(), entry.getValue());
        }
    }

    private static void printUsage() {
        System.err.println(USAGE);
    }
}
