package org.pyken.model;

import org.pyken.TranslationException;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.FunctionMetadata;
import org.pyken.parser.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Classifies functions and checks validator signatures against the arity table
 * of {@link ValidatorKind}.
 */
public final class ValidatorModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ValidatorModelBuilder.class);

    private static final Set<String> CONTEXT_TYPES = Set.of("ScriptContext", "Transaction");

    private final TypeMapping types;
    private final DiagnosticSink sink;

    public ValidatorModelBuilder(TypeMapping types, DiagnosticSink sink) {
        this.types = types;
        this.sink = sink;
    }

    /**
     * The validator kind of {@code function}, or {@code null} for helpers and tests.
     */
    public static ValidatorKind kindOf(FunctionMetadata function) {
        if (function.group() != null) {
            return ValidatorKind.fromTag(function.name());
        }
        if (function.decorators().isEmpty()) {
            return null;
        }
        for (String decorator : function.decorators()) {
            if (ValidatorKind.isPurposeTag(decorator)) {
                return ValidatorKind.fromTag(decorator);
            }
        }
        return ValidatorKind.FALLBACK;
    }

    /**
     * @throws TranslationException with {@link DiagnosticKind#ARITY_MISMATCH} when a validator signature does not
     *                              match its kind
     */
    public TranslationUnit build(FunctionMetadata function) {
        ValidatorKind kind = kindOf(function);
        if (kind == null) {
            return buildFunction(function);
        }
        return buildValidator(function, kind);
    }

    private ValidatorSpec buildValidator(FunctionMetadata function, ValidatorKind kind) {
        List<Parameter> declared = function.parameters();
        if (declared.size() != kind.arity()) {
            throw sink.fatal(DiagnosticKind.ARITY_MISMATCH, function.location(), function.qualifiedName(),
                             String.format("%s handler '%s' takes %d parameters (%s) but declares %d",
                                           kind.handlerName(), function.qualifiedName(), kind.arity(),
                                           describe(kind), declared.size()));
        }

        Set<TypeImport> imports = new TreeSet<>();
        List<MappedParameter> parameters = new ArrayList<>();
        for (int i = 0; i < declared.size(); i++) {
            Parameter parameter = declared.get(i);
            ParameterRole role = kind.roles().get(i);
            TypeMapping.ResolvedType resolved = parameter.annotation() == null ? null : resolve(function, parameter);
            if (resolved != null && role != ParameterRole.CONTEXT && CONTEXT_TYPES.contains(resolved.text())) {
                throw sink.fatal(DiagnosticKind.ARITY_MISMATCH, parameter.location(), function.qualifiedName(),
                                 String.format("parameter '%s' of %s handler '%s' is a %s but position %d is the %s",
                                               parameter.name(), kind.handlerName(), function.qualifiedName(),
                                               resolved.text(), i + 1, role.name().toLowerCase()));
            }
            String type = roleType(role, resolved);
            if (resolved != null) {
                imports.addAll(resolved.imports());
            } else if (role == ParameterRole.CONTEXT) {
                imports.add(new TypeImport("cardano/script_context", "ScriptContext"));
            }
            parameters.add(new MappedParameter(parameter.name(), type, role, parameter.location()));
        }
        log.debug("{} handler {} mapped to {}", kind.handlerName(), function.qualifiedName(), parameters);
        return new ValidatorSpec(function, kind, parameters, imports, null);
    }

    private FunctionSpec buildFunction(FunctionMetadata function) {
        FunctionRole role = function.name().startsWith("test_") ? FunctionRole.TEST : FunctionRole.HELPER;
        Set<TypeImport> imports = new TreeSet<>();
        List<MappedParameter> parameters = new ArrayList<>();
        for (Parameter parameter : function.parameters()) {
            String type = null;
            if (parameter.annotation() != null) {
                TypeMapping.ResolvedType resolved = resolve(function, parameter);
                imports.addAll(resolved.imports());
                type = resolved.text();
            }
            parameters.add(new MappedParameter(parameter.name(), type, null, parameter.location()));
        }
        String returnType = null;
        if (function.returnType() != null && role == FunctionRole.HELPER) {
            TypeMapping.ResolvedType resolved = types.resolve(function.returnType());
            warnUnknown(function, function.location(), resolved, "return type of '" + function.qualifiedName() + "'");
            imports.addAll(resolved.imports());
            returnType = resolved.text();
        }
        return new FunctionSpec(function, role, parameters, returnType, imports, null);
    }

    private TypeMapping.ResolvedType resolve(FunctionMetadata function, Parameter parameter) {
        TypeMapping.ResolvedType resolved = types.resolve(parameter.annotation());
        warnUnknown(function, parameter.location(), resolved, "parameter '" + parameter.name() + "'");
        return resolved;
    }

    private void warnUnknown(FunctionMetadata function, SourceLocation location,
                             TypeMapping.ResolvedType resolved, String subject) {
        for (String unknown : resolved.unknown()) {
            sink.report(DiagnosticKind.UNKNOWN_TYPE, location, function.qualifiedName(),
                        "Unknown type '" + unknown + "' for " + subject + "; using " + TypeMapping.PLACEHOLDER);
        }
    }

    private static String roleType(ParameterRole role, TypeMapping.ResolvedType resolved) {
        switch (role) {
            case DATUM:
                if (resolved == null) {
                    return "Option<Data>";
                }
                return resolved.rule() == ConversionRule.OPTIONAL ? resolved.text() : "Option<" + resolved.text() + ">";
            case REDEEMER:
                return resolved == null ? "Data" : resolved.text();
            default:
                return resolved == null ? "ScriptContext" : resolved.text();
        }
    }

    private static String describe(ValidatorKind kind) {
        return kind.roles().stream().map(r -> r.name().toLowerCase()).collect(Collectors.joining(", "));
    }
}
