package info.isaksson.erland.yangprinter.yang;

import java.io.IOException;
import java.io.Writer;

/**
 * Output sink plus the current nesting level.
 *
 * <p>Instances are immutable: {@link #nested()} returns a new context one level deeper that
 * shares the sink, so returning from a block (normally or by exception) restores the outer
 * level without bookkeeping.</p>
 */
final class YangWriter {

    private static final String INDENT = "  ";

    private final Writer out;
    private final int level;

    YangWriter(Writer out) {
        this(out, 0);
    }

    private YangWriter(Writer out, int level) {
        this.out = out;
        this.level = level;
    }

    YangWriter nested() {
        return new YangWriter(out, level + 1);
    }

    /** Write one indented line. */
    void emit(String text) throws IOException {
        indent(level);
        out.write(text);
        out.write('\n');
    }

    /**
     * Write {@code field} on its own line and {@code text} as a quoted literal one level
     * deeper. Continuation lines of a multi-line text are re-indented; nothing else in the
     * text is changed.
     */
    void printText(String field, String text) throws IOException {
        emit(field);

        int inner = level + 1;
        indent(inner);
        out.write('"');
        int start = 0;
        int nl;
        while ((nl = text.indexOf('\n', start)) >= 0) {
            out.write(text, start, nl - start + 1);
            indent(inner);
            start = nl + 1;
        }
        out.write(text, start, text.length() - start);
        out.write("\";\n\n");
    }

    private void indent(int n) throws IOException {
        for (int i = 0; i < n; i++) {
            out.write(INDENT);
        }
    }

    static String quote(String value) {
        return "\"" + value + "\"";
    }
}
