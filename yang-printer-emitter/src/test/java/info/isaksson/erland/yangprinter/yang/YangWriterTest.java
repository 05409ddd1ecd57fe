package info.isaksson.erland.yangprinter.yang;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class YangWriterTest {

    @Test
    void emitIndentsTwoSpacesPerLevel() throws Exception {
        StringWriter sw = new StringWriter();
        YangWriter root = new YangWriter(sw);
        YangWriter deeper = root.nested().nested();

        root.emit("a {");
        deeper.emit("b;");
        root.emit("}");

        assertEquals("a {\n    b;\n}\n", sw.toString());
    }

    @Test
    void singleLineTextIsQuotedOneLevelDeeperWithBlankLineAfter() throws Exception {
        String out = TestModels.render(1, w -> w.printText("description", "Plain text."));

        assertEquals("  description\n    \"Plain text.\";\n\n", out);
    }

    @Test
    void multiLineTextIsReindentedOnEveryContinuationLine() throws Exception {
        String out = TestModels.render(1, w -> w.printText("description", "line one\nline two\n  indented"));

        assertEquals("  description\n"
                + "    \"line one\n"
                + "    line two\n"
                + "      indented\";\n"
                + "\n", out);
        assertEquals(1, out.split("\";", -1).length - 1, "literal must be terminated exactly once");
    }

    @Test
    void textBytesOtherThanLineBreaksAreNotTouched() throws Exception {
        String text = "say \"hi\"\tand \\ carry\r on åäö";
        String out = TestModels.render(w -> w.printText("reference", text));

        assertEquals("reference\n  \"" + text + "\";\n\n", out);
    }

    @Test
    void trailingLineBreakLeavesIndentedClosingQuote() throws Exception {
        String out = TestModels.render(w -> w.printText("contact", "a\n"));

        assertEquals("contact\n  \"a\n  \";\n\n", out);
    }

    @Test
    void nestedContextDoesNotChangeOuterLevel() throws Exception {
        StringWriter sw = new StringWriter();
        YangWriter outer = new YangWriter(sw).nested();
        YangWriter inner = outer.nested();

        inner.emit("x;");
        outer.emit("y;");

        assertEquals("    x;\n  y;\n", sw.toString());
    }
}
