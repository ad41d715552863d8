package org.pyken.translator;

import org.pyken.model.TranslationUnit;
import org.pyken.model.TypeImport;

import java.util.Set;

/**
 * A function whose body has been translated.
 *
 * @param modules Aiken modules the body calls into, e.g. {@code aiken/collection/list}
 * @param imports names the body's local annotations need, on top of {@link TranslationUnit#imports()}
 */
public record TranslatedFunction(TranslationUnit unit, Set<String> modules, Set<TypeImport> imports) {

    public TranslatedFunction {
        modules = Set.copyOf(modules);
        imports = Set.copyOf(imports);
    }
}
