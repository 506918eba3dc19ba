package nl.bytesoflife.rs274x.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GerberLexerTest {

    private final GerberLexer lexer = new GerberLexer();

    @ParameterizedTest
    @CsvSource({
            "G01, COMMAND",
            "G04 a comment, COMMAND",
            "G02X100Y0I-50J0D01, COMMAND",
            "D02, OPERATION",
            "D1, OPERATION",
            "D10, APERTURE_SELECT",
            "D123, APERTURE_SELECT",
            "M02, PROGRAM_END",
            "M2, PROGRAM_END",
            "M00, PROGRAM_END",
            "M01, COMMAND",
            "X100Y200D01, MOVE",
            "Y-50, MOVE"
    })
    void classifiesCommands(String command, TokenType expected) {
        assertEquals(expected, lexer.classifyCommand(command));
    }

    @Test
    void tokenizeSplitsOnAsterisk() {
        List<Token> tokens = lexer.tokenizeCommands("D10*X0Y0D02* *", 3);

        assertEquals(2, tokens.size());
        assertEquals(TokenType.APERTURE_SELECT, tokens.get(0).type());
        assertEquals("X0Y0D02", tokens.get(1).value());
        assertEquals(3, tokens.get(1).line());
    }

    @Test
    void commentKeepsRestOfCommand() {
        CommandParts parts = lexer.parseCommand("G04 Board outline, 10 x 5 mm");

        assertEquals("G04", parts.func());
        assertEquals("Board outline, 10 x 5 mm", parts.comment());
        assertNull(parts.coord());
    }

    @Test
    void commandWithCoordinatesAndOperation() {
        CommandParts parts = lexer.parseCommand("G03X100Y200I-50J0D01");

        assertEquals("G03", parts.func());
        assertEquals("X100Y200I-50J0", parts.coord());
        assertEquals("D01", parts.op());
    }

    @Test
    void bareCommandHasNoData() {
        CommandParts parts = lexer.parseCommand("G75");

        assertEquals(new CommandParts("G75", null, null, null), parts);
    }

    @Test
    void apertureSelectAfterG54() {
        CommandParts parts = lexer.parseCommand("G54D11");

        assertNull(parts.coord());
        assertEquals("D11", parts.op());
    }

    @Test
    void invalidDataAfterCommandCode() {
        assertNull(lexer.parseCommand("G01Z100"));
    }

    @Test
    void moveParts() {
        assertEquals(new CommandParts(null, "X100Y200", "D02", null), lexer.parseMove("X100Y200D02"));
        assertEquals(new CommandParts(null, "X100", null, null), lexer.parseMove("X100"));
        assertEquals(new CommandParts(null, null, "D01", null), lexer.parseMove("D01"));
    }

    @Test
    void parameterBlockWithSeveralParameters() {
        assertEquals(List.of("FSLAX24Y24", "MOIN"), lexer.splitParameterBlock("FSLAX24Y24*MOIN*"));
    }

    @Test
    void macroBlockKeptWhole() {
        List<String> bodies = lexer.splitParameterBlock("AMOC8*5,1,8,0,0,1.08239X$1,22.5*");

        assertEquals(1, bodies.size());
        assertEquals("AMOC8*5,1,8,0,0,1.08239X$1,22.5*", bodies.get(0));
    }

    @Test
    void classifiesParameters() {
        Token fs = lexer.classifyParameter("FSLAX25Y25", 1);
        assertEquals(TokenType.FORMAT_SPEC, fs.type());
        assertEquals("FS", fs.code());
        assertEquals("LAX25Y25", fs.value());
        assertTrue(fs.isParameter());

        assertEquals(TokenType.ATTRIBUTE, lexer.classifyParameter("TF.FileFunction,Copper,L1,Top", 2).type());
        assertEquals(TokenType.IMAGE_PARAMETER, lexer.classifyParameter("IPPOS", 2).type());
        assertEquals(TokenType.POLARITY, lexer.classifyParameter("LPD", 2).type());
        assertEquals(TokenType.UNKNOWN_PARAMETER, lexer.classifyParameter("XY123", 2).type());
    }
}
