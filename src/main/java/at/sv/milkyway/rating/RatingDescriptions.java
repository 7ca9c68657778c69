package at.sv.milkyway.rating;

public final class RatingDescriptions {

    private RatingDescriptions() {
    }

    public static String describe(int stars) {
        return switch (stars) {
            case 0 -> "No visibility - Milky Way not visible during dark hours";
            case 1 -> "Poor visibility - significant light pollution or unfavorable conditions";
            case 2 -> "Fair visibility - some details visible with patience";
            case 3 -> "Good visibility - clear Milky Way structure visible";
            case 4 -> "Excellent visibility - optimal conditions for observation and photography";
            default -> "Unknown visibility";
        };
    }
}
