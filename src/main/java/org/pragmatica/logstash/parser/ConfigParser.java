package org.pragmatica.logstash.parser;

import org.pragmatica.logstash.error.ConfigParseException;
import org.pragmatica.logstash.error.ParseError;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the grammar over a text and reports failures as {@link ConfigParseException}.
 * <p>
 * Parsing is all or nothing: either the requested node is returned or an exception carrying a
 * {@link ParseError} is thrown. Unexpected exceptions raised while parsing are wrapped as
 * {@link ParseError.Internal}, so callers deal with a single failure type.
 */
public final class ConfigParser {
    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    private final ParserConfig config;
    private final LogstashGrammar grammar;

    private ConfigParser(ParserConfig config) {
        this.config = config;
        this.grammar = new LogstashGrammar();
    }

    public static ConfigParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static ConfigParser create(ParserConfig config) {
        return new ConfigParser(config);
    }

    public ParserConfig config() {
        return config;
    }

    public Document parseDocument(String text) {
        return (Document) parse(text, NodeKind.DOCUMENT, false);
    }

    /**
     * Parse a text holding a single node of the given kind.
     *
     * @param allowTrailing when true, text left after the node is ignored instead of being an error
     */
    public Node parse(String text, NodeKind kind, boolean allowTrailing) {
        if (text == null || text.isBlank()) {
            throw new ConfigParseException(new ParseError.EmptyInput());
        }
        try {
            return run(text, kind, allowTrailing);
        } catch (ConfigParseException e) {
            log.debug("Parsing {} failed: {}", kind, e.getMessage());
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Parsing {} failed unexpectedly", kind, e);
            throw new ConfigParseException(new ParseError.Internal(e));
        }
    }

    private Node run(String text, NodeKind kind, boolean allowTrailing) {
        var ctx = ParsingContext.create(text, config);
        ctx.skipTrivia();
        var result = grammar.ruleFor(kind).parse(ctx);
        if (result.isFailure()) {
            throw new ConfigParseException(errorAtFurthest(ctx, text));
        }
        if (!allowTrailing) {
            ctx.skipTrivia();
            if (!ctx.isAtEnd()) {
                ctx.updateFurthest("end of input");
                throw new ConfigParseException(errorAtFurthest(ctx, text));
            }
        }
        log.debug("Parsed {} from {} characters, {} memoized results", kind, ctx.pos(), ctx.cacheSize());
        return result.value();
    }

    private static ParseError errorAtFurthest(ParsingContext ctx, String text) {
        var location = ctx.furthestLocation();
        var expected = ctx.furthestExpected().isEmpty() ? "valid configuration" : ctx.furthestExpected();
        if (location.offset() >= text.length()) {
            return new ParseError.UnexpectedEof(location, expected);
        }
        return new ParseError.UnexpectedInput(location, found(text, location.offset()), expected);
    }

    private static String found(String text, int offset) {
        var codePoint = text.codePointAt(offset);
        return switch (codePoint) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> new String(Character.toChars(codePoint));
        };
    }
}
