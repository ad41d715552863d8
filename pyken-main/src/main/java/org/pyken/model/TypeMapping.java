package org.pyken.model;

import org.pyken.parser.ImportDecl;
import org.pyken.parser.SourceModule;
import org.pyken.parser.TypeDecl;
import org.pyken.parser.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps Python type annotations to Aiken types.
 * <p>
 * The builtin table is static. A mapping instance adds the types a file
 * declares itself and the names it imports from {@code aiken} and
 * {@code cardano} modules, which take precedence over the table.
 */
public final class TypeMapping {

    public static final String PLACEHOLDER = "Data";

    /** Internal table name of Python tuples; the mapped text is always {@code (A, B, ...)}. */
    private static final String TUPLE = "Tuple";

    public record Entry(String pythonName, String aikenName, ConversionRule rule, String module) {}

    /**
     * Result of mapping one annotation.
     *
     * @param unknown Python names that had no mapping and were replaced by {@link #PLACEHOLDER}
     */
    public record ResolvedType(String text, ConversionRule rule, Set<TypeImport> imports, List<String> unknown) {

        public boolean isKnown() {
            return unknown.isEmpty();
        }
    }

    private static final Map<String, Entry> TABLE = table();

    private final Set<String> declared;
    /** bound name → the entry of its {@code use} line */
    private final Map<String, TypeImport> imported;

    private TypeMapping(Set<String> declared, Map<String, TypeImport> imported) {
        this.declared = declared;
        this.imported = imported;
    }

    public static TypeMapping builtin() {
        return new TypeMapping(Set.of(), Map.of());
    }

    public static TypeMapping forModule(SourceModule module) {
        Set<String> declared = new HashSet<>();
        for (TypeDecl type : module.types()) {
            declared.add(type.name());
        }
        Map<String, TypeImport> imported = new HashMap<>();
        for (ImportDecl decl : module.imports()) {
            for (ImportDecl.ImportedName name : decl.names()) {
                String entry = name.alias() == null ? name.name() : name.name() + " as " + name.alias();
                imported.put(name.boundName(), new TypeImport(decl.module(), entry));
            }
        }
        return new TypeMapping(declared, imported);
    }

    public static Optional<Entry> lookup(String pythonName) {
        return Optional.ofNullable(TABLE.get(pythonName));
    }

    public static Map<String, Entry> entries() {
        return TABLE;
    }

    public ResolvedType resolve(Expr annotation) {
        Resolution resolution = new Resolution();
        String text = resolution.map(annotation);
        return new ResolvedType(text, resolution.rule, Collections.unmodifiableSet(resolution.imports),
                                List.copyOf(resolution.unknown));
    }

    public boolean isDeclared(String name) {
        return declared.contains(name);
    }

    private final class Resolution {

        private final Set<TypeImport> imports = new TreeSet<>();
        private final List<String> unknown = new ArrayList<>();
        private ConversionRule rule;

        String map(Expr annotation) {
            if (annotation instanceof Expr.NoneLiteral) {
                return record(ConversionRule.IDENTITY, "Void");
            }
            if (annotation instanceof Expr.StringLiteral forward) {
                // forward reference: "Datum" or "cardano.Transaction"
                String name = forward.value().trim();
                String last = name.substring(name.lastIndexOf('.') + 1);
                if (last.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                    return named(last);
                }
                return placeholder(name);
            }
            if (annotation instanceof Expr.Name name) {
                return named(name.id());
            }
            if (annotation instanceof Expr.Attribute attribute) {
                return named(attribute.attribute());
            }
            if (annotation instanceof Expr.Subscript subscript) {
                return generic(subscript);
            }
            return placeholder(annotation.getClass().getSimpleName());
        }

        private String named(String name) {
            if (declared.contains(name)) {
                return record(ConversionRule.IDENTITY, name);
            }
            TypeImport typeImport = imported.get(name);
            if (typeImport != null) {
                imports.add(typeImport);
                return record(ConversionRule.IDENTITY, name);
            }
            Entry entry = TABLE.get(name);
            if (entry == null) {
                return placeholder(name);
            }
            if (entry.module() != null) {
                imports.add(new TypeImport(entry.module(), baseName(entry.aikenName())));
            }
            switch (entry.rule()) {
                case GENERIC:
                    return record(ConversionRule.GENERIC, bareGeneric(entry.aikenName()));
                case OPTIONAL:
                    return record(ConversionRule.OPTIONAL,
                                  entry.aikenName().contains("<") ? entry.aikenName() : "Option<Data>");
                default:
                    return record(entry.rule(), entry.aikenName());
            }
        }

        private String generic(Expr.Subscript subscript) {
            String base = subscript.value() instanceof Expr.Name name ? name.id()
                    : subscript.value() instanceof Expr.Attribute attribute ? attribute.attribute() : null;
            Entry entry = base == null ? null : TABLE.get(base);
            List<Expr> arguments = subscript.index() instanceof Expr.TupleDisplay tuple
                    ? tuple.elements() : List.of(subscript.index());
            if (entry == null || (entry.rule() != ConversionRule.GENERIC && entry.rule() != ConversionRule.OPTIONAL
                    && entry.rule() != ConversionRule.OPAQUE)) {
                return placeholder(base == null ? "subscript" : base);
            }
            if (entry.rule() == ConversionRule.OPAQUE) {
                // Union[...] and friends carry no usable structure
                return record(ConversionRule.OPAQUE, entry.aikenName());
            }
            if (entry.module() != null) {
                imports.add(new TypeImport(entry.module(), baseName(entry.aikenName())));
            }
            record(entry.rule(), aikenOf(entry));
            List<String> mapped = new ArrayList<>();
            for (Expr argument : arguments) {
                mapped.add(map(argument));
            }
            String aiken = aikenOf(entry);
            String text;
            if (entry.rule() == ConversionRule.OPTIONAL) {
                text = "Option<" + mapped.get(0) + ">";
            } else if (aiken.equals(TUPLE)) {
                text = "(" + String.join(", ", mapped) + ")";
            } else if (aiken.equals("Dict") && mapped.size() != 2) {
                text = "Dict<Data, Data>";
            } else {
                text = aiken + "<" + String.join(", ", mapped) + ">";
            }
            return record(entry.rule(), text);
        }

        private String placeholder(String name) {
            unknown.add(name);
            return record(ConversionRule.OPAQUE, PLACEHOLDER);
        }

        /** The outermost rule wins: the first one recorded. */
        private String record(ConversionRule conversion, String text) {
            if (rule == null) {
                rule = conversion;
            }
            return text;
        }
    }

    private static String aikenOf(Entry entry) {
        return baseName(entry.aikenName());
    }

    private static String baseName(String aikenName) {
        int angle = aikenName.indexOf('<');
        return angle < 0 ? aikenName : aikenName.substring(0, angle);
    }

    private static String bareGeneric(String aikenName) {
        switch (baseName(aikenName)) {
            case "Dict":
                return baseName(aikenName) + "<Data, Data>";
            case TUPLE:
                return "(Data, Data)";
            default:
                return baseName(aikenName) + "<Data>";
        }
    }

    private static Map<String, Entry> table() {
        Map<String, Entry> table = new LinkedHashMap<>();
        add(table, "int", "Int", ConversionRule.IDENTITY, null);
        add(table, "bool", "Bool", ConversionRule.IDENTITY, null);
        add(table, "str", "String", ConversionRule.IDENTITY, null);
        add(table, "bytes", "ByteArray", ConversionRule.IDENTITY, null);
        add(table, "bytearray", "ByteArray", ConversionRule.IDENTITY, null);
        add(table, "float", "Int", ConversionRule.NARROWING, null);
        add(table, "None", "Void", ConversionRule.IDENTITY, null);

        add(table, "Any", "Data", ConversionRule.OPAQUE, null);
        add(table, "object", "Data", ConversionRule.OPAQUE, null);
        add(table, "Data", "Data", ConversionRule.OPAQUE, null);
        add(table, "Union", "Data", ConversionRule.OPAQUE, null);
        add(table, "Redeemer", "Data", ConversionRule.OPAQUE, null);

        add(table, "Optional", "Option", ConversionRule.OPTIONAL, null);
        add(table, "Datum", "Option<Data>", ConversionRule.OPTIONAL, null);

        add(table, "list", "List", ConversionRule.GENERIC, null);
        add(table, "List", "List", ConversionRule.GENERIC, null);
        add(table, "dict", "Dict", ConversionRule.GENERIC, "aiken/collection/dict");
        add(table, "Dict", "Dict", ConversionRule.GENERIC, "aiken/collection/dict");
        add(table, "tuple", TUPLE, ConversionRule.GENERIC, null);
        add(table, "Tuple", TUPLE, ConversionRule.GENERIC, null);

        add(table, "Context", "ScriptContext", ConversionRule.IDENTITY, "cardano/script_context");
        add(table, "ScriptContext", "ScriptContext", ConversionRule.IDENTITY, "cardano/script_context");
        add(table, "Transaction", "Transaction", ConversionRule.IDENTITY, "cardano/transaction");
        add(table, "OutputReference", "OutputReference", ConversionRule.IDENTITY, "cardano/transaction");
        add(table, "Output", "Output", ConversionRule.IDENTITY, "cardano/transaction");
        add(table, "Input", "Input", ConversionRule.IDENTITY, "cardano/transaction");
        add(table, "Address", "Address", ConversionRule.IDENTITY, "cardano/address");
        add(table, "Credential", "Credential", ConversionRule.IDENTITY, "cardano/address");
        add(table, "PolicyId", "PolicyId", ConversionRule.IDENTITY, "cardano/assets");
        add(table, "AssetName", "AssetName", ConversionRule.IDENTITY, "cardano/assets");
        add(table, "Value", "Value", ConversionRule.IDENTITY, "cardano/assets");
        add(table, "VerificationKeyHash", "VerificationKeyHash", ConversionRule.IDENTITY, "aiken/crypto");
        add(table, "ScriptHash", "ScriptHash", ConversionRule.IDENTITY, "aiken/crypto");
        return Collections.unmodifiableMap(table);
    }

    private static void add(Map<String, Entry> table, String python, String aiken, ConversionRule rule, String module) {
        if (table.putIfAbsent(python, new Entry(python, aiken, rule, module)) != null) {
            throw new IllegalStateException("Duplicate type mapping for " + python);
        }
    }
}
