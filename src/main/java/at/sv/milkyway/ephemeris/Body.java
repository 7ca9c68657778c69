package at.sv.milkyway.ephemeris;

public enum Body {
    SUN,
    MOON
}
