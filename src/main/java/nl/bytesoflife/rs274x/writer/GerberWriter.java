package nl.bytesoflife.rs274x.writer;

import nl.bytesoflife.rs274x.model.Aperture;
import nl.bytesoflife.rs274x.model.ApertureMacro;
import nl.bytesoflife.rs274x.model.Function;
import nl.bytesoflife.rs274x.model.GerberDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link GerberDocument} back to RS-274X text: header parameters, macros and
 * apertures first, then the function sequence, terminated by {@code M02*}.
 *
 * <p>Coordinate data is written as stored, so it must already match the document's format.
 */
public class GerberWriter {

    private static final Logger log = LoggerFactory.getLogger(GerberWriter.class);
    private static final String NL = "\n";

    public void write(GerberDocument document, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(document, out);
        }
        log.debug("Wrote {}", file);
    }

    public void write(GerberDocument document, Writer out) throws IOException {
        out.write("%FS" + document.getFormat().toParameterBody() + "*%" + NL);
        out.write("%MO" + document.getUnit().getCode() + "*%" + NL);

        for (ApertureMacro macro : document.getMacros().values()) {
            out.write(macroBlock(macro) + NL);
        }
        for (Aperture aperture : document.getApertures().values()) {
            out.write(apertureBlock(aperture) + NL);
        }
        for (Function function : document.getFunctions()) {
            out.write(functionLine(function) + NL);
        }
        out.write("M02*" + NL);
        out.flush();
    }

    public String writeToString(GerberDocument document) {
        StringWriter out = new StringWriter();
        try {
            write(document, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    static String macroBlock(ApertureMacro macro) {
        if (macro.primitives().isEmpty()) {
            return "%AM" + macro.name() + "*%";
        }
        return "%AM" + macro.name() + "*" + NL + String.join("*" + NL, macro.primitives()) + "*%";
    }

    static String apertureBlock(Aperture aperture) {
        String mods = aperture.modifiers().isEmpty() ? "" : "," + aperture.modifiers();
        return "%AD" + aperture.code() + aperture.typeToken() + mods + "*%";
    }

    static String functionLine(Function function) {
        if (function instanceof Function.ApertureSelect select) {
            return select.code() + "*";
        }
        if (function instanceof Function.ParamCall param) {
            return "%" + param.raw() + "*%";
        }
        return commandLine((Function.Command) function);
    }

    private static String commandLine(Function.Command command) {
        StringBuilder sb = new StringBuilder();
        if (command.func() != null) {
            sb.append(command.func());
        }
        if (command.comment() != null) {
            if (command.func() == null) {
                sb.append("G04");
            }
            if (!command.comment().isEmpty()) {
                sb.append(' ').append(command.comment());
            }
            return sb.append('*').toString();
        }
        if (command.coord() != null) {
            sb.append(command.coord());
        }
        if (command.op() != null) {
            sb.append(command.op());
        }
        return sb.append('*').toString();
    }
}
