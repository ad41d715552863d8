package org.pyken.model;

import org.pyken.ir.IrNode;
import org.pyken.parser.FunctionMetadata;

import java.util.List;
import java.util.Set;

/**
 * An undecorated function: a helper {@code fn} or an Aiken {@code test}.
 *
 * @param returnType mapped return annotation, or {@code null} when absent
 */
public record FunctionSpec(FunctionMetadata function,
                           FunctionRole role,
                           List<MappedParameter> parameters,
                           String returnType,
                           Set<TypeImport> imports,
                           IrNode body) implements TranslationUnit {

    public FunctionSpec {
        parameters = List.copyOf(parameters);
        imports = Set.copyOf(imports);
    }

    @Override
    public FunctionSpec withBody(IrNode body) {
        return new FunctionSpec(function, role, parameters, returnType, imports, body);
    }
}
