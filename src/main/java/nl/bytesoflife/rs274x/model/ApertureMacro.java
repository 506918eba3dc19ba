package nl.bytesoflife.rs274x.model;

import java.util.List;

/**
 * A named aperture macro: its primitive definition lines in order, comment primitives removed.
 * Primitives are kept as text and never evaluated.
 */
public record ApertureMacro(String name, List<String> primitives) {

    public ApertureMacro {
        primitives = List.copyOf(primitives);
    }
}
