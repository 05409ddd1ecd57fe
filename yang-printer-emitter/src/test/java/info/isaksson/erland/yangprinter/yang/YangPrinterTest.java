package info.isaksson.erland.yangprinter.yang;

import info.isaksson.erland.yangprinter.model.BaseType;
import info.isaksson.erland.yangprinter.model.ContainerNode;
import info.isaksson.erland.yangprinter.model.Include;
import info.isaksson.erland.yangprinter.model.LeafNode;
import info.isaksson.erland.yangprinter.model.Module;
import info.isaksson.erland.yangprinter.model.Revision;
import info.isaksson.erland.yangprinter.model.TypeRef;
import info.isaksson.erland.yangprinter.model.YangVersion;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class YangPrinterTest {

    private final YangPrinter printer = new YangPrinter();

    private static String golden(String resource) throws Exception {
        Path path = Path.of(YangPrinterTest.class.getClassLoader().getResource(resource).toURI());
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Test
    void printsModuleMatchingGolden() throws Exception {
        Module sys = TestModels.exampleSystem(TestModels.exampleBase());

        assertEquals(golden("yang/golden/example-system.yang"), printer.printToString(sys));
    }

    @Test
    void minimalModuleHasOnlyHeader() {
        Module m = new Module("empty", "urn:empty", "e");

        assertEquals("module empty {\n  namespace \"urn:empty\";\n  prefix \"e\";\n}\n", printer.printToString(m));
    }

    @Test
    void yangVersionOneZero() {
        Module m = new Module("v", "urn:v", "v");
        m.setVersion(YangVersion.V1_0);

        assertTrue(printer.printToString(m).contains("  yang-version \"1.0\";\n"));
    }

    @Test
    void includeWithRevisionDateUsesBlockForm() {
        Module m = new Module("inc", "urn:inc", "i");
        m.includes.add(new Include("plain-sub", null));
        m.includes.add(new Include("dated-sub", "2019-03-04"));

        String out = printer.printToString(m);

        assertTrue(out.contains("  include \"plain-sub\";\n"), out);
        assertTrue(out.contains("  include \"dated-sub\" {\n    revision-date \"2019-03-04\";\n  }\n"), out);
    }

    @Test
    void revisionFormsDependOnPresentFields() {
        Module m = new Module("rev", "urn:rev", "r");
        m.revisions.add(new Revision("2020-01-01"));
        m.revisions.add(new Revision("2021-01-01", null, "RFC 1"));
        m.revisions.add(new Revision("2022-01-01", "Both.", "RFC 2"));

        String out = printer.printToString(m);

        assertTrue(out.contains("  revision \"2020-01-01\";\n"), out);
        assertTrue(out.contains("  revision \"2021-01-01\" {\n"
                + "    reference\n"
                + "      \"RFC 1\";\n"
                + "\n"
                + "  }\n"), out);
        assertFalse(out.contains("revision \"2021-01-01\" {\n    description"), out);
        assertTrue(out.contains("  revision \"2022-01-01\" {\n"
                + "    description\n"
                + "      \"Both.\";\n"
                + "\n"
                + "    reference\n"
                + "      \"RFC 2\";\n"
                + "\n"
                + "  }\n"), out);
    }

    @Test
    void metaFieldsPrintInFixedOrder() {
        Module m = new Module("meta", "urn:meta", "meta");
        m.setReference("R");
        m.setDescription("Line 1\nLine 2");
        m.setContact("C");
        m.setOrganization("O");

        String out = printer.printToString(m);

        assertTrue(out.indexOf("  organization\n") < out.indexOf("  contact\n"));
        assertTrue(out.indexOf("  contact\n") < out.indexOf("  description\n"));
        assertTrue(out.indexOf("  description\n") < out.indexOf("  reference\n"));
        assertTrue(out.contains("  description\n    \"Line 1\n    Line 2\";\n\n"), out);
    }

    @Test
    void byteSinkReceivesUtf8() throws Exception {
        Module m = new Module("utf", "urn:utf", "u");
        m.setDescription("Grüße");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        printer.print(m, bytes);

        assertArrayEquals(printer.printToString(m).getBytes(StandardCharsets.UTF_8), bytes.toByteArray());
    }

    @Test
    void writeCreatesParentDirectories() throws Exception {
        Module sys = TestModels.exampleSystem(TestModels.exampleBase());
        Path out = Files.createTempDirectory("yang-printer-test").resolve("nested/dir/example-system.yang");

        printer.write(sys, out);

        assertEquals(golden("yang/golden/example-system.yang"), Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void sinkFailureAbortsPrinting() {
        Module sys = TestModels.exampleSystem(TestModels.exampleBase());
        FailingWriter sink = new FailingWriter(200);

        IOException ex = assertThrows(IOException.class, () -> printer.print(sys, sink));

        assertEquals("disk full", ex.getMessage());
        assertEquals(1, sink.attemptsAfterLimit, "no write may follow the failed one");
    }

    @Test
    void byteSinkFailureSurfacesAsIOException() {
        Module sys = TestModels.exampleSystem(TestModels.exampleBase());
        OutputStream broken = new OutputStream() {
            @Override public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }

            @Override public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("broken pipe");
            }
        };

        IOException ex = assertThrows(IOException.class, () -> printer.print(sys, broken));

        assertEquals("broken pipe", ex.getMessage());
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> printer.printToString(null));
        assertThrows(IllegalArgumentException.class,
                () -> printer.print(new Module("m", "urn:m", "m"), (Writer) null));
    }

    @Test
    void concurrentPrintsOfDistinctModelsMatchSequentialOutput() throws Exception {
        List<Module> models = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            models.add(wideModel("model-" + i, 50 + i));
        }
        List<String> expected = new ArrayList<>();
        for (Module m : models) {
            expected.add(printer.printToString(m));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (Module m : models) {
                futures.add(pool.submit(() -> printer.printToString(m)));
            }
            for (int i = 0; i < models.size(); i++) {
                assertEquals(expected.get(i), futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void printingDoesNotModifyTheModel() {
        Module sys = TestModels.exampleSystem(TestModels.exampleBase());
        String first = printer.printToString(sys);

        assertEquals(first, printer.printToString(sys));
        assertEquals(1, sys.data.size());
        assertNull(sys.data.get(0).parent());
    }

    private static Module wideModel(String name, int leaves) {
        Module m = new Module(name, "urn:" + name, name);
        ContainerNode root = m.addData(new ContainerNode(m, "root"));
        root.setConfig(true);
        for (int i = 0; i < leaves; i++) {
            LeafNode leaf = root.addChild(new LeafNode(m, "leaf-" + i, TypeRef.builtin(BaseType.STRING)));
            leaf.setConfig(i % 3 == 0 ? Boolean.FALSE : null);
            leaf.setDescription("Leaf " + i + "\nof " + name);
        }
        return m;
    }

    /** Accepts {@code limit} characters, then fails every write. */
    private static final class FailingWriter extends Writer {
        private final int limit;
        private int written;
        int attemptsAfterLimit;

        FailingWriter(int limit) {
            this.limit = limit;
        }

        @Override public void write(char[] cbuf, int off, int len) throws IOException {
            if (written + len > limit) {
                attemptsAfterLimit++;
                throw new IOException("disk full");
            }
            written += len;
        }

        @Override public void flush() {
        }

        @Override public void close() {
        }
    }
}
