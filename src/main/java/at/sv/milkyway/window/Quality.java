package at.sv.milkyway.window;

import java.util.Locale;

public enum Quality {
    EXCELLENT(0.8),
    GOOD(0.6),
    FAIR(0.4),
    POOR(0);

    private final double minimumScore;

    Quality(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public static Quality of(double averageScore) {
        for (Quality quality : values()) {
            if (averageScore >= quality.minimumScore) {
                return quality;
            }
        }
        return POOR;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String capitalizedLabel() {
        String label = label();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
