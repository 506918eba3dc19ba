package nl.bytesoflife.rs274x.model;

/**
 * G74 / G75 quadrant convention for circular interpolation.
 */
public enum QuadrantMode {
    SINGLE,
    MULTI
}
