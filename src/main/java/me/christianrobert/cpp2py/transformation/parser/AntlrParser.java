package me.christianrobert.cpp2py.transformation.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.cpp2py.antlr.CppLexer;
import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.context.TranslationException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper around the ANTLR C++ parser.
 * Handles parser instantiation and error collection; syntax errors are never printed,
 * they are returned in the {@link ParseResult}.
 *
 * Uses a two-stage parsing strategy:
 * 1. Try SLL(*) mode first (fast, low memory)
 * 2. Fall back to LL(*) mode with full error recovery if SLL fails
 *
 * This is the only class that directly instantiates ANTLR parsers. It is stateless, so
 * batch workers share one instance; the DFA cache is cleared after every parse so that
 * long batches do not accumulate parser state.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Parses a complete translation unit.
     *
     * @param source C++ source text (may be empty)
     * @return ParseResult containing the parse tree and any errors
     * @throws TranslationException if the source is null or the parser fails unexpectedly
     */
    public ParseResult parse(String source) {
        if (source == null) {
            throw new TranslationException("C++ source cannot be null");
        }

        log.debug("Parsing translation unit ({} chars)", source.length());

        try {
            return parseTwoStage(source);
        } catch (TranslationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to parse C++ source", e);
            throw new TranslationException("Failed to parse C++ source: " + e.getMessage(),
                    abbreviate(source), "ANTLR parsing", e);
        }
    }

    private ParseResult parseTwoStage(String source) {
        List<String> errors = new ArrayList<>();
        BaseErrorListener collector = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Line %d:%d - %s", line, charPositionInLine + 1, msg);
                errors.add(error);
                log.debug("Parse error: {}", error);
            }
        };

        CppLexer lexer = new CppLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        CppParser parser = new CppParser(tokens);
        try {
            // Stage 1: SLL(*) with bail-out on the first ambiguity or error
            parser.removeErrorListeners();
            parser.setErrorHandler(new BailErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

            CppParser.TranslationUnitContext tree;
            try {
                log.trace("Attempting SLL(*) parse");
                tree = parser.translationUnit();
            } catch (ParseCancellationException sllFailure) {
                log.trace("SLL(*) parse failed, falling back to LL(*)");

                // Stage 2: LL(*) with full error recovery and error collection
                tokens.seek(0);
                parser.reset();
                parser.removeErrorListeners();
                parser.addErrorListener(collector);
                parser.setErrorHandler(new DefaultErrorStrategy());
                parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                tree = parser.translationUnit();
            }

            return new ParseResult(tree, errors, source);

        } finally {
            parser.getInterpreter().clearDFA();
        }
    }

    private static String abbreviate(String source) {
        return source.length() <= 200 ? source : source.substring(0, 200) + "...";
    }
}
