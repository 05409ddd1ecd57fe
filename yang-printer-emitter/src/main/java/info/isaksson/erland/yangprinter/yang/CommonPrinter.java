package info.isaksson.erland.yangprinter.yang;

import info.isaksson.erland.yangprinter.model.Definition;
import info.isaksson.erland.yangprinter.model.SchemaNode;

import java.io.IOException;
import java.util.Objects;

/** Substatements shared by every definition: config (nodes only), status, description, reference. */
final class CommonPrinter {

    private CommonPrinter() {}

    static void printCommon(YangWriter w, Definition def) throws IOException {
        if (def.status() != null) {
            w.emit("status " + YangWriter.quote(def.status().keyword) + ";");
        }
        if (def.description() != null) {
            w.printText("description", def.description());
        }
        if (def.reference() != null) {
            w.printText("reference", def.reference());
        }
    }

    /**
     * Like {@link #printCommon} but first emits {@code config} when the node is a root or its
     * effective config differs from the parent's.
     */
    static void printCommonWithConfig(YangWriter w, SchemaNode node) throws IOException {
        Boolean effective = node.effectiveConfig();
        if (effective != null) {
            boolean print = node.isRoot() || !Objects.equals(effective, node.parent().effectiveConfig());
            if (print) {
                w.emit("config " + YangWriter.quote(effective.toString()) + ";");
            }
        }
        printCommon(w, node);
    }
}
