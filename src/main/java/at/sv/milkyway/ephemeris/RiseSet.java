package at.sv.milkyway.ephemeris;

import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

/**
 * Rise and set times of a body. Either may be missing, e.g. if the body is always up or down on the given day.
 */
public record RiseSet(@Nullable ZonedDateTime rise, @Nullable ZonedDateTime set) {

    public static final RiseSet NONE = new RiseSet(null, null);
}
