package org.pyken.model;

import org.pyken.ir.IrNode;
import org.pyken.parser.FunctionMetadata;

import java.util.List;
import java.util.Set;

/**
 * A validator handler whose parameters match the roles of its kind one to one.
 */
public record ValidatorSpec(FunctionMetadata function,
                            ValidatorKind kind,
                            List<MappedParameter> parameters,
                            Set<TypeImport> imports,
                            IrNode body) implements TranslationUnit {

    public ValidatorSpec {
        parameters = List.copyOf(parameters);
        imports = Set.copyOf(imports);
        if (parameters.size() != kind.arity()) {
            throw new IllegalArgumentException(kind + " requires " + kind.arity() + " parameters, got " + parameters.size());
        }
    }

    /** Name of the enclosing Aiken {@code validator} block, before sanitising. */
    public String validatorName() {
        return function.group() != null ? function.group() : function.name();
    }

    @Override
    public ValidatorSpec withBody(IrNode body) {
        return new ValidatorSpec(function, kind, parameters, imports, body);
    }
}
