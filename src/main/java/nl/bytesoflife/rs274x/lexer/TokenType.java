package nl.bytesoflife.rs274x.lexer;

public enum TokenType {
    // Parameters (%...%)
    FORMAT_SPEC,
    UNIT,
    APERTURE_DEFINE,
    APERTURE_MACRO,
    POLARITY,
    STEP_REPEAT,
    ATTRIBUTE,
    IMAGE_PARAMETER,
    UNKNOWN_PARAMETER,

    // Commands (*-terminated)
    COMMAND,
    OPERATION,
    APERTURE_SELECT,
    PROGRAM_END,
    MOVE
}
