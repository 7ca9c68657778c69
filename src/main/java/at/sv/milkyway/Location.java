package at.sv.milkyway;

import java.util.Locale;

/**
 * Observer location in degrees.
 */
public record Location(double lat, double lng) {

    public Location {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90 degrees: " + lat);
        }
        if (Double.isNaN(lng) || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180 degrees: " + lng);
        }
    }

    public static Location of(double lat, double lng) {
        return new Location(lat, lng);
    }

    /**
     * @return the location rounded to two decimals, e.g. "48.20,16.39"
     */
    public String toKey() {
        return String.format(Locale.ROOT, "%.2f,%.2f", lat, lng);
    }

    @Override
    public String toString() {
        return "[" + lat + "," + lng + ']';
    }
}
