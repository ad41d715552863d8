package org.pyken.parser;

import java.util.List;
import java.util.Optional;

/**
 * The analyzed contents of one source file, in source order.
 */
public record SourceModule(String fileName,
                           List<ImportDecl> imports,
                           List<TypeDecl> types,
                           List<FunctionMetadata> functions,
                           List<String> validatorGroups) {

    public SourceModule {
        imports = List.copyOf(imports);
        types = List.copyOf(types);
        functions = List.copyOf(functions);
        validatorGroups = List.copyOf(validatorGroups);
    }

    public Optional<TypeDecl> type(String name) {
        return types.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public Optional<TypeDecl.SumType> sumType(String name) {
        return type(name).filter(TypeDecl.SumType.class::isInstance).map(TypeDecl.SumType.class::cast);
    }

    public boolean isValidatorGroup(String name) {
        return validatorGroups.contains(name);
    }

    /** Whether {@code name} is defined by a top-level function of this file. */
    public boolean isFunction(String name) {
        return functions.stream().anyMatch(f -> f.group() == null && f.name().equals(name));
    }
}
