package at.sv.milkyway;

import at.sv.milkyway.core.GalacticCoreState;
import at.sv.milkyway.time.NightWindow;
import at.sv.milkyway.window.OptimalWindow;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public final class FormatUtil {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");
    private static final Duration ASSUMED_CORE_VISIBILITY = Duration.ofHours(6);

    private FormatUtil() {
    }

    public static String formatTime(ZonedDateTime time, ZoneId zone) {
        return TIME_FORMATTER.format(time.withZoneSameInstant(zone));
    }

    /**
     * @return the start of the window as HH:mm, or an empty string if there is none
     */
    public static String formatWindowStart(OptimalWindow window, ZoneId zone) {
        if (window.getStartTime() == null) {
            return "";
        }
        return formatTime(window.getStartTime(), zone);
    }

    /**
     * @return e.g. "2h 15m", "45m" or "3h"; empty if there is no window
     */
    public static String formatWindowDuration(OptimalWindow window) {
        if (window.getDuration() <= 0 || window.getStartTime() == null) {
            return "";
        }
        int hours = (int) Math.floor(window.getDuration());
        int minutes = (int) Math.round((window.getDuration() % 1) * 60);
        if (minutes == 60) {
            hours++;
            minutes = 0;
        }
        if (hours == 0) {
            return minutes + "m";
        }
        if (minutes == 0) {
            return hours + "h";
        }
        return hours + "h " + minutes + "m";
    }

    /**
     * @return the rise time of the core, or its transit if it does not rise, as HH:mm
     */
    public static String formatCoreRise(GalacticCoreState core, ZoneId zone) {
        ZonedDateTime time = core.getRiseTime() != null ? core.getRiseTime() : core.getTransitTime();
        if (time == null) {
            return "Not visible";
        }
        return formatTime(time, zone);
    }

    /**
     * A missing set time is treated as six hours after rise.
     *
     * @return the overlap of core visibility and darkness, e.g. "3h 20m"
     */
    public static String formatDarkOverlap(GalacticCoreState core, NightWindow night) {
        if (core.getRiseTime() == null || !night.hasDarkness()) {
            return "No dark time";
        }
        ZonedDateTime coreEnd = core.getSetTime() != null
                ? core.getSetTime()
                : core.getRiseTime().plus(ASSUMED_CORE_VISIBILITY);
        ZonedDateTime start = core.getRiseTime().isAfter(night.getNight()) ? core.getRiseTime() : night.getNight();
        ZonedDateTime end = coreEnd.isBefore(night.getDayEnd()) ? coreEnd : night.getDayEnd();
        if (!start.isBefore(end)) {
            return "No overlap";
        }
        Duration overlap = Duration.between(start, end);
        return overlap.toHours() + "h " + overlap.toMinutesPart() + "m";
    }
}
