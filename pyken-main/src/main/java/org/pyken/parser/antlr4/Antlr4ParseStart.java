package org.pyken.parser.antlr4;

import org.antlr.v4.runtime.tree.ParseTree;

/**
 * The start production for Antlr.
 * Tells Antlr what piece of Python it can expect.
 */
@FunctionalInterface
public interface Antlr4ParseStart {

    ParseTree parse(PyKenParser parser);

    Antlr4ParseStart FILE_INPUT = PyKenParser::fileInput;
    Antlr4ParseStart EXPRESSION = PyKenParser::test;
}
