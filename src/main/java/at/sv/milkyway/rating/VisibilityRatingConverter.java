package at.sv.milkyway.rating;

import at.sv.milkyway.Location;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.moon.MoonInterference;
import at.sv.milkyway.time.NightWindow;
import at.sv.milkyway.time.TimezoneResolver;
import at.sv.milkyway.window.OptimalWindow;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Point based star rating, independent of the integrated observation score.
 * <ul>
 *     <li>altitude: 1.5 points per degree above the horizon, at most 50 (reached at about 33°)</li>
 *     <li>moon: minus up to 30 points, scaled by {@link MoonInterference}</li>
 *     <li>darkness: 30 points for at least 8 hours, 25 for 6, 20 for 4, 10 for 2</li>
 * </ul>
 */
@Slf4j
public final class VisibilityRatingConverter {

    static final double POINTS_PER_DEGREE = 1.5;
    static final double MAX_ALTITUDE_POINTS = 50;
    static final double MAX_MOON_PENALTY = 30;
    static final int DAYLIGHT_START_HOUR = 6;
    static final int DAYLIGHT_END_HOUR = 18;

    private final TimezoneResolver timezoneResolver;

    public VisibilityRatingConverter(TimezoneResolver timezoneResolver) {
        this.timezoneResolver = timezoneResolver;
    }

    /**
     * @param coreAltitude altitude of the galactic core in degrees, typically at the start of the optimal window
     */
    public VisibilityRating convert(double coreAltitude, LunarState moon, NightWindow night, OptimalWindow window,
                                    Location location) {
        double altitudePoints = altitudePoints(coreAltitude);
        double moonPenalty = MAX_MOON_PENALTY * MoonInterference.of(moon.getIllumination(), moon.getAltitude());
        double darkHours = night.getDarkDuration();
        int darknessPoints = darknessPoints(darkHours);
        double points = Math.max(0, altitudePoints - moonPenalty + darknessPoints);

        if (window.getStartTime() == null) {
            return new VisibilityRating(0, points, "No optimal viewing window");
        }
        if (window.getDuration() <= 0) {
            return new VisibilityRating(0, points, "Optimal viewing window has no duration");
        }
        int localHour = timezoneResolver.localHour(window.getStartTime(), location);
        if (localHour >= DAYLIGHT_START_HOUR && localHour <= DAYLIGHT_END_HOUR) {
            log.debug("Window start {} is at local hour {}, rating 0", window.getStartTime(), localHour);
            return new VisibilityRating(0, points, "Optimal viewing window starts during daylight hours");
        }
        String reason = String.format(Locale.ROOT, "Altitude %.0f° (+%.0f), moon (-%.0f), %.1f h of darkness (+%d)",
                coreAltitude, altitudePoints, moonPenalty, darkHours, darknessPoints);
        return new VisibilityRating(toStars(points), points, reason);
    }

    static double altitudePoints(double altitude) {
        return Math.max(0, Math.min(MAX_ALTITUDE_POINTS, altitude * POINTS_PER_DEGREE));
    }

    static int darknessPoints(double darkHours) {
        if (darkHours >= 8) return 30;
        if (darkHours >= 6) return 25;
        if (darkHours >= 4) return 20;
        if (darkHours >= 2) return 10;
        return 0;
    }

    static int toStars(double points) {
        if (points >= 60) return 4;
        if (points >= 45) return 3;
        if (points >= 25) return 2;
        return 1;
    }
}
