package org.pyken.parser;

import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.ast.Expr;
import org.pyken.parser.ast.Stmt;

import java.util.List;

/**
 * Everything the analyzer learned about one function definition.
 * <p>
 * Parameters keep their declaration order. {@code group} is the class name for
 * handlers declared inside a validator class and {@code null} otherwise.
 * {@code unsupported} lists the constructs that exclude the function from output.
 */
public record FunctionMetadata(String name,
                               List<Parameter> parameters,
                               List<String> decorators,
                               List<Stmt> body,
                               Expr returnType,
                               SourceLocation location,
                               String group,
                               List<UnsupportedConstruct> unsupported) {

    public FunctionMetadata {
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
        body = List.copyOf(body);
        unsupported = List.copyOf(unsupported);
    }

    public boolean returnsNone() {
        return returnType instanceof Expr.NoneLiteral;
    }

    public boolean isSupported() {
        return unsupported.isEmpty();
    }

    /** Name used in diagnostics: {@code Group.method} for grouped handlers. */
    public String qualifiedName() {
        return group == null ? name : group + "." + name;
    }
}
