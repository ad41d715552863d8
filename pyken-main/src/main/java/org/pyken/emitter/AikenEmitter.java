package org.pyken.emitter;

import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.ir.NameRef;
import org.pyken.model.FunctionRole;
import org.pyken.model.FunctionSpec;
import org.pyken.model.MappedParameter;
import org.pyken.model.TranslationUnit;
import org.pyken.model.TypeImport;
import org.pyken.model.TypeMapping;
import org.pyken.model.ValidatorSpec;
import org.pyken.parser.FunctionMetadata;
import org.pyken.parser.ImportDecl;
import org.pyken.parser.SourceModule;
import org.pyken.parser.TypeDecl;
import org.pyken.translator.TranslatedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Renders the translated functions of one source file as an Aiken module.
 * <p>
 * Layout: header comment, {@code use} lines sorted by module, the declared types
 * the functions need (in declaration order), then one block per validator,
 * helper or test in source order. Handlers of a validator class share a block.
 * The output is a pure function of its inputs.
 */
public final class AikenEmitter {

    private static final Logger log = LoggerFactory.getLogger(AikenEmitter.class);

    static final String HEADER = "// Generated by pyken from %s. Do not edit.";

    private final SourceModule module;
    private final TypeMapping types;
    private final DiagnosticSink sink;

    /** module path → names imported with {@code use module.{...}} */
    private final Map<String, Set<String>> braced = new TreeMap<>();
    /** module path → alias, or the empty string for a plain {@code use module} */
    private final Map<String, String> plain = new TreeMap<>();
    /** module qualifiers the output refers to, such as {@code list} */
    private final Set<String> qualifiers = new TreeSet<>();

    public AikenEmitter(SourceModule module, TypeMapping types, DiagnosticSink sink) {
        this.module = module;
        this.types = types;
        this.sink = sink;
    }

    /**
     * @param functions translated functions in source order
     */
    public String emit(List<TranslatedFunction> functions) {
        braced.clear();
        plain.clear();
        qualifiers.clear();

        ReferenceCollector references = new ReferenceCollector();
        for (TranslatedFunction translated : functions) {
            TranslationUnit unit = translated.unit();
            references.collect(unit.body());
            for (MappedParameter parameter : unit.parameters()) {
                references.collectType(parameter.type());
            }
            if (unit instanceof FunctionSpec spec) {
                references.collectType(spec.returnType());
            }
            addAll(unit.imports());
            addAll(translated.imports());
            for (String path : translated.modules()) {
                plain.putIfAbsent(path, "");
            }
        }

        qualifiers.addAll(references.modules());
        String typeSection = typeDeclarations(references);
        sourceImports(references);
        String functionSection = blocks(functions);

        StringBuilder out = new StringBuilder();
        out.append(String.format(HEADER, module.fileName())).append('\n');
        String useSection = useLines();
        if (!useSection.isEmpty()) {
            out.append('\n').append(useSection);
        }
        if (!typeSection.isEmpty()) {
            out.append('\n').append(typeSection);
        }
        if (!functionSection.isEmpty()) {
            out.append('\n').append(functionSection);
        }
        log.debug("Emitted {} functions for {}", functions.size(), module.fileName());
        return out.toString();
    }

    // ── Imports ──

    private void addAll(Set<TypeImport> imports) {
        for (TypeImport typeImport : imports) {
            braced.computeIfAbsent(typeImport.module(), k -> new TreeSet<>()).add(typeImport.name());
        }
    }

    /** Keep the source imports the output refers to. */
    private void sourceImports(ReferenceCollector references) {
        for (ImportDecl decl : module.imports()) {
            if (decl.isPlain()) {
                if (references.modules().contains(decl.boundName())) {
                    String last = decl.module().substring(decl.module().lastIndexOf('/') + 1);
                    plain.put(decl.module(), decl.boundName().equals(last) ? "" : decl.boundName());
                }
                continue;
            }
            for (ImportDecl.ImportedName name : decl.names()) {
                if (references.names().contains(name.boundName())) {
                    String entry = name.alias() == null ? name.name() : name.name() + " as " + name.alias();
                    braced.computeIfAbsent(decl.module(), k -> new TreeSet<>()).add(entry);
                }
            }
        }
    }

    private String useLines() {
        Set<String> paths = new TreeSet<>(plain.keySet());
        paths.addAll(braced.keySet());
        StringBuilder sb = new StringBuilder();
        for (String path : paths) {
            String alias = plain.get(path);
            Set<String> names = braced.get(path);
            if (alias != null && (!alias.isEmpty() || names == null)) {
                sb.append("use ").append(path);
                if (!alias.isEmpty()) {
                    sb.append(" as ").append(alias);
                }
                sb.append('\n');
            }
            if (names != null) {
                sb.append("use ").append(path).append(".{").append(String.join(", ", names)).append("}\n");
            }
        }
        return sb.toString();
    }

    // ── Types ──

    private String typeDeclarations(ReferenceCollector references) {
        Set<String> needed = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>(references.names());
        Map<String, String> rendered = new LinkedHashMap<>();
        while (!pending.isEmpty()) {
            String name = pending.remove(0);
            if (!needed.add(name)) {
                continue;
            }
            module.type(name).ifPresent(decl -> {
                ReferenceCollector fieldTypes = new ReferenceCollector();
                rendered.put(name, typeDeclaration(decl, fieldTypes));
                pending.addAll(fieldTypes.names());
                references.names().addAll(fieldTypes.names());
            });
        }

        StringBuilder sb = new StringBuilder();
        for (TypeDecl decl : module.types()) {
            String text = rendered.get(decl.name());
            if (text != null) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text);
            }
        }
        return sb.toString();
    }

    private String typeDeclaration(TypeDecl decl, ReferenceCollector fieldTypes) {
        SourceWriter printer = new SourceWriter();
        printer.println("pub type " + decl.name() + " {");
        printer.indent();
        if (decl instanceof TypeDecl.SumType sum) {
            for (TypeDecl.Member member : sum.members()) {
                printer.println(member.name());
            }
        } else {
            TypeDecl.RecordType record = (TypeDecl.RecordType) decl;
            for (TypeDecl.Field field : record.fields()) {
                String type = TypeMapping.PLACEHOLDER;
                if (field.annotation() != null) {
                    TypeMapping.ResolvedType resolved = types.resolve(field.annotation());
                    for (String unknown : resolved.unknown()) {
                        sink.report(DiagnosticKind.UNKNOWN_TYPE, decl.location(), decl.name(),
                                    "Unknown type '" + unknown + "' for field '" + field.name() + "'; using "
                                    + TypeMapping.PLACEHOLDER);
                    }
                    addAll(resolved.imports());
                    type = resolved.text();
                }
                fieldTypes.collectType(type);
                printer.println(IdentifierSanitizer.field(field.name()) + ": " + type + ",");
            }
        }
        printer.unindent();
        printer.println("}");
        return printer.getSource();
    }

    // ── Functions ──

    private String blocks(List<TranslatedFunction> functions) {
        IdentifierSanitizer topLevel = new IdentifierSanitizer(sink, null, SourceLocation.UNKNOWN);
        Map<String, List<ValidatorSpec>> groups = new LinkedHashMap<>();
        List<Object> order = new ArrayList<>();
        for (TranslatedFunction translated : functions) {
            TranslationUnit unit = translated.unit();
            if (unit instanceof ValidatorSpec validator) {
                List<ValidatorSpec> handlers = groups.get(validator.validatorName());
                if (handlers == null) {
                    handlers = new ArrayList<>();
                    groups.put(validator.validatorName(), handlers);
                    order.add(validator.validatorName());
                    topLevel.name(validator.validatorName(), validator.function().location());
                }
                handlers.add(validator);
            } else {
                order.add(unit);
                topLevel.name(unit.function().name(), unit.function().location());
            }
        }

        SourceWriter printer = new SourceWriter();
        Iterator<Object> it = order.iterator();
        while (it.hasNext()) {
            Object block = it.next();
            if (block instanceof String name) {
                validator(printer, topLevel, name, groups.get(name));
            } else {
                function(printer, topLevel, (FunctionSpec) block);
            }
            if (it.hasNext()) {
                printer.println();
            }
        }
        return printer.getSource();
    }

    private void validator(SourceWriter printer, IdentifierSanitizer topLevel, String name, List<ValidatorSpec> handlers) {
        printer.println("validator " + topLevel.name(name) + " {");
        printer.indent();
        for (int i = 0; i < handlers.size(); i++) {
            ValidatorSpec handler = handlers.get(i);
            IdentifierSanitizer locals = locals(topLevel, handler);
            printer.print(handler.kind().handlerName());
            parameters(printer, locals, handler.parameters());
            printer.println(" {");
            body(printer, topLevel, locals, handler);
            if (i + 1 < handlers.size()) {
                printer.println();
            }
        }
        printer.unindent();
        printer.println("}");
    }

    private void function(SourceWriter printer, IdentifierSanitizer topLevel, FunctionSpec spec) {
        IdentifierSanitizer locals = locals(topLevel, spec);
        String name = topLevel.name(spec.function().name());
        if (spec.role() == FunctionRole.TEST) {
            printer.print("test " + name);
            parameters(printer, locals, spec.parameters());
        } else {
            printer.print("fn " + name);
            parameters(printer, locals, spec.parameters());
            if (spec.returnType() != null) {
                printer.print(" -> " + spec.returnType());
            }
        }
        printer.println(" {");
        body(printer, topLevel, locals, spec);
    }

    private void body(SourceWriter printer, IdentifierSanitizer topLevel, IdentifierSanitizer locals,
                      TranslationUnit unit) {
        printer.indent();
        new AikenPrintVisitor(printer, topLevel, locals).printBody(unit.body());
        printer.unindent();
        printer.println("}");
    }

    /**
     * Local names of one function. Parameters are named first, then the body's
     * bindings in order, so made-up names yield to source names.
     */
    private IdentifierSanitizer locals(IdentifierSanitizer topLevel, TranslationUnit unit) {
        FunctionMetadata function = unit.function();
        IdentifierSanitizer locals = new IdentifierSanitizer(sink, function.qualifiedName(), function.location())
                .reserve(topLevel.taken())
                .reserve(qualifiers);
        for (MappedParameter parameter : unit.parameters()) {
            locals.name(parameter.name(), parameter.location());
        }
        for (String value : new ReferenceCollector().collect(unit.body()).values()) {
            if (!value.startsWith(NameRef.SYNTHETIC_PREFIX)) {
                locals.name(value);
            }
        }
        return locals;
    }

    private static void parameters(SourceWriter printer, IdentifierSanitizer locals, List<MappedParameter> parameters) {
        printer.print("(");
        for (int i = 0; i < parameters.size(); i++) {
            MappedParameter parameter = parameters.get(i);
            if (i > 0) {
                printer.print(", ");
            }
            printer.print(locals.name(parameter.name(), parameter.location()));
            if (parameter.type() != null) {
                printer.print(": " + parameter.type());
            }
        }
        printer.print(")");
    }
}
