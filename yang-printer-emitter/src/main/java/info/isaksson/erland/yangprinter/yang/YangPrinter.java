package info.isaksson.erland.yangprinter.yang;

import info.isaksson.erland.yangprinter.model.Identity;
import info.isaksson.erland.yangprinter.model.Import;
import info.isaksson.erland.yangprinter.model.Include;
import info.isaksson.erland.yangprinter.model.Module;
import info.isaksson.erland.yangprinter.model.Revision;
import info.isaksson.erland.yangprinter.model.SchemaNode;
import info.isaksson.erland.yangprinter.model.Typedef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Public API: print a {@link Module} as YANG text.
 *
 * <p>The printer keeps no state between calls, so one instance can serve concurrent calls on
 * distinct models and sinks. The model is only read. A failing sink aborts printing with the
 * sink's {@link IOException}; whatever was written before stays in the sink.</p>
 */
public final class YangPrinter {

    private static final Logger LOG = LoggerFactory.getLogger(YangPrinter.class);

    /** Print to a character sink. The sink is neither flushed nor closed. */
    public void print(Module module, Writer out) throws IOException {
        if (module == null) throw new IllegalArgumentException("module must not be null");
        if (out == null) throw new IllegalArgumentException("out must not be null");

        LOG.debug("Printing module {}", module.name);
        printModule(new YangWriter(out), module);
    }

    /**
     * Print UTF-8 encoded text to a byte sink. The stream is flushed but not closed.
     *
     * <p>The encoder hands bytes to {@code out} in chunks, so a failing byte sink is reported
     * when a chunk is written or at the final flush, not necessarily at the first statement
     * it cannot take. Pass a {@link Writer} to observe every write.</p>
     */
    public void print(Module module, OutputStream out) throws IOException {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        print(module, writer);
        writer.flush();
    }

    /** Write the module to {@code outFile}, creating parent directories as needed. */
    public void write(Module module, Path outFile) throws IOException {
        if (outFile == null) throw new IllegalArgumentException("outFile must not be null");
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
            print(module, writer);
        }
    }

    public String printToString(Module module) {
        StringWriter sw = new StringWriter();
        try {
            print(module, sw);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    private static void printModule(YangWriter w, Module module) throws IOException {
        w.emit("module " + module.name + " {");
        YangWriter body = w.nested();

        body.emit("namespace " + YangWriter.quote(module.namespace) + ";");
        body.emit("prefix " + YangWriter.quote(module.prefix) + ";");
        if (module.version() != null) {
            body.emit("yang-version " + YangWriter.quote(module.version().keyword) + ";");
        }

        for (Import imp : module.imports) {
            body.emit("import " + YangWriter.quote(imp.moduleName) + " {");
            YangWriter inner = body.nested();
            inner.emit("prefix " + YangWriter.quote(imp.prefix) + ";");
            if (imp.revisionDate != null) {
                inner.emit("revision-date " + YangWriter.quote(imp.revisionDate) + ";");
            }
            body.emit("}");
        }

        for (Include inc : module.includes) {
            if (inc.revisionDate == null) {
                body.emit("include " + YangWriter.quote(inc.submoduleName) + ";");
            } else {
                body.emit("include " + YangWriter.quote(inc.submoduleName) + " {");
                body.nested().emit("revision-date " + YangWriter.quote(inc.revisionDate) + ";");
                body.emit("}");
            }
        }

        if (module.organization() != null) {
            body.printText("organization", module.organization());
        }
        if (module.contact() != null) {
            body.printText("contact", module.contact());
        }
        if (module.description() != null) {
            body.printText("description", module.description());
        }
        if (module.reference() != null) {
            body.printText("reference", module.reference());
        }

        for (Revision rev : module.revisions) {
            printRevision(body, rev);
        }

        for (Identity ident : module.identities) {
            TypePrinter.printIdentity(body, ident);
        }
        for (Typedef tpdf : module.typedefs) {
            TypePrinter.printTypedef(body, module, tpdf);
        }

        for (SchemaNode node : module.data) {
            NodePrinter.dispatch(body, node, NodePrinter.DATA_DEF_KINDS);
        }

        w.emit("}");
    }

    private static void printRevision(YangWriter w, Revision rev) throws IOException {
        if (rev.description == null && rev.reference == null) {
            w.emit("revision " + YangWriter.quote(rev.date) + ";");
            return;
        }
        w.emit("revision " + YangWriter.quote(rev.date) + " {");
        YangWriter body = w.nested();
        if (rev.description != null) {
            body.printText("description", rev.description);
        }
        if (rev.reference != null) {
            body.printText("reference", rev.reference);
        }
        w.emit("}");
    }
}
