package at.sv.milkyway.rating;

/**
 * @param stars  0 (not visible) to 4 (excellent)
 * @param points altitude and darkness points minus the moon penalty, never negative
 */
public record VisibilityRating(int stars, double points, String reason) {

    public String description() {
        return RatingDescriptions.describe(stars);
    }
}
