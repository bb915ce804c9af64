package com.typstparser;

import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.cst.CstNode;
import com.typstparser.cst.CstParseResult;
import com.typstparser.cst.CstProjector;
import com.typstparser.diagnostics.DiagnosticsCollector;
import com.typstparser.diagnostics.ParseError;
import com.typstparser.lower.AstLowering;
import com.typstparser.lower.RangeNormalizer;
import com.typstparser.syntax.Parser;
import com.typstparser.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points for parsing Typst source into a lossless concrete tree or a
 * typed tree.
 *
 * <p>Both entry points run the same parser and report the same errors for
 * the same text and mode. Calls share no state and may run concurrently.</p>
 */
public final class TypstParser {

    private static final Logger logger = LoggerFactory.getLogger(TypstParser.class);

    private TypstParser() {
    }

    public static CstParseResult parse(String text) {
        return parse(text, ParseOptions.DEFAULT);
    }

    /**
     * Parses the text and mirrors the concrete tree.
     */
    public static CstParseResult parse(String text, ParseOptions options) {
        SyntaxNode root = parseSyntax(text, options);
        RangeNormalizer ranges = new RangeNormalizer(root);
        List<ParseError> errors = DiagnosticsCollector.collect(root, ranges);
        CstNode cst = new CstProjector(ranges).project(root);
        logger.debug("Projected concrete tree with {} errors", errors.size());
        return new CstParseResult(cst, errors);
    }

    public static AstParseResult parseAst(String text) {
        return parseAst(text, ParseOptions.DEFAULT);
    }

    /**
     * Parses the text and lowers it into typed nodes.
     *
     * @throws com.typstparser.lower.LoweringException if the concrete tree
     *         has a shape the lowering rules do not cover
     */
    public static AstParseResult parseAst(String text, ParseOptions options) {
        SyntaxNode root = parseSyntax(text, options);
        RangeNormalizer ranges = new RangeNormalizer(root);
        List<ParseError> errors = DiagnosticsCollector.collect(root, ranges);
        List<AstNode> body = new AstLowering(ranges).lowerRoot(root);
        logger.debug("Lowered {} top-level nodes with {} errors", body.size(), errors.size());
        return new AstParseResult(body, errors);
    }

    /**
     * Runs the concrete parser alone.
     */
    public static SyntaxNode parseSyntax(String text, ParseOptions options) {
        ParseMode mode = options == null ? ParseMode.MARKUP : options.mode();
        logger.debug("Parsing {} characters in {} mode", text.length(), mode.label());
        return Parser.parse(text, mode.lexMode());
    }
}
