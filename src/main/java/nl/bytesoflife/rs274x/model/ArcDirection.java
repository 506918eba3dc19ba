package nl.bytesoflife.rs274x.model;

public enum ArcDirection {
    CLOCKWISE,
    COUNTERCLOCKWISE
}
