package info.isaksson.erland.yangprinter.json;

import info.isaksson.erland.yangprinter.model.BaseType;
import info.isaksson.erland.yangprinter.model.ChoiceNode;
import info.isaksson.erland.yangprinter.model.ContainerNode;
import info.isaksson.erland.yangprinter.model.Definition;
import info.isaksson.erland.yangprinter.model.EnumValue;
import info.isaksson.erland.yangprinter.model.GroupingNode;
import info.isaksson.erland.yangprinter.model.Identity;
import info.isaksson.erland.yangprinter.model.Import;
import info.isaksson.erland.yangprinter.model.Include;
import info.isaksson.erland.yangprinter.model.InteriorNode;
import info.isaksson.erland.yangprinter.model.LeafListNode;
import info.isaksson.erland.yangprinter.model.LeafNode;
import info.isaksson.erland.yangprinter.model.ListNode;
import info.isaksson.erland.yangprinter.model.Module;
import info.isaksson.erland.yangprinter.model.NodeKind;
import info.isaksson.erland.yangprinter.model.Revision;
import info.isaksson.erland.yangprinter.model.SchemaNode;
import info.isaksson.erland.yangprinter.model.Status;
import info.isaksson.erland.yangprinter.model.TypeRef;
import info.isaksson.erland.yangprinter.model.Typedef;
import info.isaksson.erland.yangprinter.model.UsesNode;
import info.isaksson.erland.yangprinter.model.YangVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Links a parsed {@link SchemaDocument} into {@link Module} objects.
 *
 * <p>Two passes: first every module with its identities, so references can point forward and
 * across modules; then identity bases, typedefs and the data tree.</p>
 */
public final class SchemaModelAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaModelAssembler.class);

    public List<Module> assemble(SchemaDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");

        Map<String, Module> byName = new LinkedHashMap<>();
        List<Module> modules = new ArrayList<>();

        for (DocModule dm : doc.modules) {
            Module m = declareModule(dm);
            if (byName.putIfAbsent(m.name, m) != null) {
                throw new SchemaModelException("Duplicate module: " + m.name);
            }
            modules.add(m);
        }

        for (int i = 0; i < modules.size(); i++) {
            Module m = modules.get(i);
            DocModule dm = doc.modules.get(i);
            Linker linker = new Linker(m, byName);

            for (DocIdentity di : dm.identities) {
                if (di.base != null && !di.base.isBlank()) {
                    linker.identity(di.name).setBase(linker.resolveIdentity(di.base, "identity " + di.name));
                }
            }
            for (DocTypedef dt : dm.typedefs) {
                m.typedefs.add(linker.typedef(dt));
            }
            for (DocNode dn : dm.data) {
                m.addData(linker.node(dn));
            }
        }

        LOG.debug("Assembled {} module(s): {}", modules.size(), byName.keySet());
        return modules;
    }

    private static Module declareModule(DocModule dm) {
        String name = require(dm.name, "module name", "document");
        Module m = new Module(
                name,
                require(dm.namespace, "namespace", "module " + name),
                require(dm.prefix, "prefix", "module " + name));
        m.setVersion(parse(() -> YangVersion.fromKeyword(dm.yangVersion), "module " + name));
        m.setOrganization(dm.organization);
        m.setContact(dm.contact);
        m.setDescription(dm.description);
        m.setReference(dm.reference);

        for (DocImport di : dm.imports) {
            m.imports.add(new Import(
                    require(di.module, "import module", "module " + name),
                    require(di.prefix, "import prefix", "module " + name + " import " + di.module),
                    di.revisionDate));
        }
        for (DocInclude di : dm.includes) {
            m.includes.add(new Include(require(di.submodule, "include submodule", "module " + name), di.revisionDate));
        }
        for (DocRevision dr : dm.revisions) {
            m.revisions.add(new Revision(require(dr.date, "revision date", "module " + name), dr.description, dr.reference));
        }
        Set<String> identityNames = new HashSet<>();
        for (DocIdentity di : dm.identities) {
            Identity ident = new Identity(m, require(di.name, "identity name", "module " + name));
            if (!identityNames.add(ident.name())) {
                throw new SchemaModelException("Duplicate identity " + ident.name() + " in module " + name);
            }
            common(ident, di.status, di.description, di.reference, "identity " + di.name);
            m.identities.add(ident);
        }
        return m;
    }

    /** Second-pass resolution within one module. */
    private static final class Linker {
        private final Module module;
        private final Map<String, Module> modules;

        Linker(Module module, Map<String, Module> modules) {
            this.module = module;
            this.modules = modules;
        }

        Identity identity(String name) {
            return findIdentity(module, name, "module " + module.name);
        }

        /** Resolve {@code [prefix:]name} against this module and its imports. */
        Identity resolveIdentity(String ref, String context) {
            String prefix = null;
            String name = ref.trim();
            int colon = name.indexOf(':');
            if (colon >= 0) {
                prefix = name.substring(0, colon);
                name = name.substring(colon + 1);
            }
            return findIdentity(moduleForPrefix(prefix, context), name, context);
        }

        private Module moduleForPrefix(String prefix, String context) {
            if (prefix == null || prefix.equals(module.prefix)) return module;
            for (Import imp : module.imports) {
                if (imp.prefix.equals(prefix)) {
                    Module target = modules.get(imp.moduleName);
                    if (target == null) {
                        throw new SchemaModelException("Module " + imp.moduleName + " imported as '" + prefix
                                + "' by " + module.name + " is not in the document (" + context + ")");
                    }
                    return target;
                }
            }
            throw new SchemaModelException("Unknown prefix '" + prefix + "' in module " + module.name + " (" + context + ")");
        }

        private static Identity findIdentity(Module owner, String name, String context) {
            for (Identity ident : owner.identities) {
                if (ident.name().equals(name)) return ident;
            }
            throw new SchemaModelException("No identity " + name + " in module " + owner.name + " (" + context + ")");
        }

        Typedef typedef(DocTypedef dt) {
            String name = require(dt.name, "typedef name", "module " + module.name);
            if (dt.type == null) {
                throw new SchemaModelException("Typedef " + name + " in module " + module.name + " has no type");
            }
            Typedef tpdf = new Typedef(module, name, type(dt.type, "typedef " + name));
            common(tpdf, dt.status, dt.description, dt.reference, "typedef " + name);
            return tpdf;
        }

        TypeRef type(DocType dt, String context) {
            String name = require(dt.name, "type name", context);
            BaseType base;
            if (dt.base != null) {
                base = parse(() -> BaseType.fromKeyword(dt.base), context);
            } else {
                BaseType builtin = BaseType.builtin(name);
                base = builtin == null ? BaseType.UNKNOWN : builtin;
            }

            List<EnumValue> enums = new ArrayList<>();
            for (DocEnum de : dt.enums) {
                String enumName = require(de.name, "enum name", context);
                if (de.value == null) {
                    throw new SchemaModelException("Enum " + enumName + " has no value (" + context + ")");
                }
                EnumValue ev = new EnumValue(enumName, de.value);
                common(ev, de.status, de.description, de.reference, context + " enum " + enumName);
                enums.add(ev);
            }

            Identity identity = null;
            if (dt.identity != null && !dt.identity.isBlank()) {
                identity = resolveIdentity(dt.identity, context);
            }
            return new TypeRef(name, dt.prefix, base, enums, identity);
        }

        SchemaNode node(DocNode dn) {
            String name = require(dn.name, "node name", "module " + module.name);
            NodeKind kind = parse(() -> NodeKind.fromKeyword(dn.kind), "node " + name);
            String context = kind.keyword + " " + name;

            SchemaNode node;
            switch (kind) {
                case CONTAINER: {
                    ContainerNode c = new ContainerNode(module, name);
                    addTypedefs(c.typedefs, dn);
                    addChildren(c, dn);
                    node = c;
                    break;
                }
                case CHOICE: {
                    ChoiceNode c = new ChoiceNode(module, name);
                    addChildren(c, dn);
                    node = c;
                    break;
                }
                case LEAF:
                    node = new LeafNode(module, name, type(requireType(dn, context), context));
                    break;
                case LEAF_LIST:
                    node = new LeafListNode(module, name, type(requireType(dn, context), context));
                    break;
                case LIST: {
                    ListNode l = new ListNode(module, name);
                    addTypedefs(l.typedefs, dn);
                    addChildren(l, dn);
                    for (String key : dn.keys) {
                        l.addKey(findKeyLeaf(l, key, context));
                    }
                    node = l;
                    break;
                }
                case GROUPING: {
                    GroupingNode g = new GroupingNode(module, name);
                    addTypedefs(g.typedefs, dn);
                    addChildren(g, dn);
                    node = g;
                    break;
                }
                case USES:
                    node = new UsesNode(module, name);
                    break;
                default:
                    throw new SchemaModelException("Unsupported node kind " + kind + " (" + context + ")");
            }

            node.setConfig(dn.config);
            common(node, dn.status, dn.description, dn.reference, context);
            return node;
        }

        private void addTypedefs(List<Typedef> target, DocNode dn) {
            for (DocTypedef dt : dn.typedefs) {
                target.add(typedef(dt));
            }
        }

        private void addChildren(InteriorNode parent, DocNode dn) {
            for (DocNode child : dn.children) {
                parent.addChild(node(child));
            }
        }

        private static DocType requireType(DocNode dn, String context) {
            if (dn.type == null) throw new SchemaModelException("Missing type (" + context + ")");
            return dn.type;
        }

        private static LeafNode findKeyLeaf(ListNode list, String key, String context) {
            for (SchemaNode child : list.children()) {
                if (child instanceof LeafNode && child.name().equals(key)) {
                    return (LeafNode) child;
                }
            }
            throw new SchemaModelException("Key " + key + " is not a leaf child (" + context + ")");
        }
    }

    private static void common(Definition def, String status, String description, String reference, String context) {
        def.setStatus(parse(() -> Status.fromKeyword(status), context));
        def.setDescription(description);
        def.setReference(reference);
    }

    private static String require(String value, String what, String context) {
        if (value == null || value.isBlank()) {
            throw new SchemaModelException("Missing " + what + " (" + context + ")");
        }
        return value;
    }

    private static <T> T parse(Supplier<T> parser, String context) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new SchemaModelException(ex.getMessage() + " (" + context + ")", ex);
        }
    }
}
