package nl.bytesoflife.rs274x.model;

public enum InterpolationMode {
    LINEAR,
    SINGLE_QUADRANT_ARC,
    MULTI_QUADRANT_ARC
}
