package info.isaksson.erland.yangprinter.yang;

import info.isaksson.erland.yangprinter.model.EnumValue;
import info.isaksson.erland.yangprinter.model.Identity;
import info.isaksson.erland.yangprinter.model.Module;
import info.isaksson.erland.yangprinter.model.TypeRef;
import info.isaksson.erland.yangprinter.model.Typedef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/** Prints type uses, typedefs and identities. */
final class TypePrinter {

    private static final Logger LOG = LoggerFactory.getLogger(TypePrinter.class);

    private TypePrinter() {}

    /**
     * Print a type use. Identity references are qualified relative to {@code module}, the module
     * that owns the statement being printed.
     */
    static void printType(YangWriter w, Module module, TypeRef type) throws IOException {
        w.emit("type " + type.qualifiedName() + " {");
        YangWriter body = w.nested();

        switch (type.base()) {
            case ENUMERATION:
                for (EnumValue ev : type.enums()) {
                    body.emit("enum " + YangWriter.quote(ev.name()) + " {");
                    YangWriter enumBody = body.nested();
                    CommonPrinter.printCommon(enumBody, ev);
                    enumBody.emit("value " + ev.value() + ";");
                    body.emit("}");
                }
                break;
            case IDENTITYREF:
                if (type.identity() != null) {
                    body.emit("base " + qualify(module, type.identity()) + ";");
                }
                break;
            default:
                LOG.debug("No body printed for type {} with base {}", type.qualifiedName(), type.base());
                break;
        }

        w.emit("}");
    }

    static void printTypedef(YangWriter w, Module module, Typedef tpdf) throws IOException {
        w.emit("typedef " + tpdf.name() + " {");
        YangWriter body = w.nested();
        CommonPrinter.printCommon(body, tpdf);
        printType(body, module, tpdf.type());
        w.emit("}");
    }

    static void printIdentity(YangWriter w, Identity ident) throws IOException {
        w.emit("identity " + ident.name() + " {");
        YangWriter body = w.nested();
        CommonPrinter.printCommon(body, ident);
        if (ident.base() != null) {
            body.emit("base " + qualify(ident.module(), ident.base()) + ";");
        }
        w.emit("}");
    }

    /** {@code prefix:name} when the identity belongs to another module, else its bare name. */
    static String qualify(Module current, Identity ident) {
        if (ident.module() == current) {
            return ident.name();
        }
        return ident.module().prefix + ":" + ident.name();
    }
}
