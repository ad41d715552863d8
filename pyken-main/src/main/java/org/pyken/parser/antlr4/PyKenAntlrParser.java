package org.pyken.parser.antlr4;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.pyken.SourceParseException;

/**
 * Runs the generated lexer and parser over Python source. The first syntax
 * error aborts the parse with a {@link SourceParseException}; no error recovery
 * is attempted.
 */
public final class PyKenAntlrParser {

    private PyKenAntlrParser() {
    }

    public static PyKenParser.FileInputContext parseFile(String source, String fileName) {
        return (PyKenParser.FileInputContext) parse(source, fileName, Antlr4ParseStart.FILE_INPUT);
    }

    public static PyKenParser.TestContext parseExpression(String expression) {
        return (PyKenParser.TestContext) parse(expression, "<expression>", Antlr4ParseStart.EXPRESSION);
    }

    public static ParseTree parse(String source, String fileName, Antlr4ParseStart start) {
        String text = source;
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        // the indentation logic needs a final line break to close the last block
        if (!text.endsWith("\n")) {
            text = text + "\n";
        }
        ThrowingErrorListener errorListener = new ThrowingErrorListener(fileName);

        PyKenLexer lexer = new PyKenLexer(CharStreams.fromString(text, fileName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        PyKenParser parser = new PyKenParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        return start.parse(parser);
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String fileName;

        ThrowingErrorListener(String fileName) {
            this.fileName = fileName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new SourceParseException("Parse error at " + line + ":" + (charPositionInLine + 1) + " - " + msg,
                                           fileName, line, charPositionInLine + 1, e);
        }
    }
}
