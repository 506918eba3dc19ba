package nl.bytesoflife.rs274x.writer;

import nl.bytesoflife.rs274x.model.FormatUpdate;
import nl.bytesoflife.rs274x.model.GerberDocument;
import nl.bytesoflife.rs274x.parser.GerberParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GerberWriterTest {

    private final GerberWriter writer = new GerberWriter();
    private final GerberParser parser = new GerberParser();

    @Test
    void writesHeaderApertureAndFunctions() {
        GerberDocument doc = new GerberDocument();
        doc.format(new FormatUpdate().zero("L").coordinates("A").integerDigits(2).decimalDigits(5));
        doc.setUnit("MM");
        doc.defineAperture("D10", "C", "0.010");
        doc.defineAperture("D11", "R", "");
        doc.selectAperture("D10");
        doc.addParameter("LPD");
        doc.addCommand("G04", null, null, "outline");
        doc.addCommand("G01", "X0Y0", "D02", null);
        doc.addCommand(null, "X200000", "D01", null);

        String text = writer.writeToString(doc);

        assertEquals(String.join("\n",
                "%FSLAX25Y25*%",
                "%MOMM*%",
                "%ADD10C,0.010*%",
                "%ADD11R*%",
                "D10*",
                "%LPD*%",
                "G04 outline*",
                "G01X0Y0D02*",
                "X200000D01*",
                "M02*",
                ""), text);
    }

    @Test
    void writesMacroBeforeApertures() {
        GerberDocument doc = new GerberDocument();
        doc.defineMacro("OC8", List.of("0 Octagon", "5,1,8,0,0,1.08239X$1,22.5"));
        doc.defineMacro("EMPTY", List.of());
        doc.defineAperture("D11", "OC8", "0.05");

        String text = writer.writeToString(doc);

        assertTrue(text.contains("%AMOC8*\n5,1,8,0,0,1.08239X$1,22.5*%\n%AMEMPTY*%\n%ADD11OC8,0.05*%\n"));
    }

    @Test
    void writtenFileParsesToSameDocument() throws IOException {
        GerberDocument original = parser.parse(Path.of("src/test/resources/gerber/arcs.gbr"));

        GerberDocument reparsed = parser.parse(writer.writeToString(original));

        assertEquals(original.getFormat(), reparsed.getFormat());
        assertEquals(original.getUnit(), reparsed.getUnit());
        assertEquals(original.getMacros(), reparsed.getMacros());
        assertEquals(original.getApertures(), reparsed.getApertures());
        assertEquals(original.getFunctions(), reparsed.getFunctions());
        assertEquals(original.getWidth(), reparsed.getWidth(), 1e-9);
        assertEquals(original.getHeight(), reparsed.getHeight(), 1e-9);
    }

    @Test
    void writesToFile(@TempDir Path dir) throws IOException {
        GerberDocument doc = parser.parse(Path.of("src/test/resources/gerber/square.gbr"));
        Path out = dir.resolve("square-copy.gbr");

        writer.write(doc, out);

        List<String> lines = Files.readAllLines(out);
        assertEquals("%FSLAX34Y34*%", lines.get(0));
        assertEquals("%MOMM*%", lines.get(1));
        assertEquals("%ADD10C,0.1000*%", lines.get(2));
        assertEquals("G04 Square board outline, 10 x 5 mm*", lines.get(3));
        assertEquals("%TF.FileFunction,Profile,NP*%", lines.get(4));
        assertEquals("M02*", lines.get(lines.size() - 1));
        assertEquals(10.0, parser.parse(out).getWidth(), 1e-9);
    }
}
