package org.pyken.model;

import org.pyken.ir.IrNode;
import org.pyken.parser.FunctionMetadata;

import java.util.List;
import java.util.Set;

/**
 * A function ready for translation: its signature is mapped and checked, and
 * its body is filled in by the translator.
 */
public sealed interface TranslationUnit permits ValidatorSpec, FunctionSpec {

    FunctionMetadata function();

    List<MappedParameter> parameters();

    /** Names the signature needs in scope. */
    Set<TypeImport> imports();

    /** Translated body, or {@code null} before translation. */
    IrNode body();

    TranslationUnit withBody(IrNode body);
}
