package org.pragmatica.logstash.parser;

import org.pragmatica.logstash.error.ConfigParseException;
import org.pragmatica.logstash.error.LiteralDecodeException;
import org.pragmatica.logstash.error.ParseError;
import org.pragmatica.logstash.tree.Branch;
import org.pragmatica.logstash.tree.Clause;
import org.pragmatica.logstash.tree.Composite;
import org.pragmatica.logstash.tree.Declaration;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Expression;
import org.pragmatica.logstash.tree.Expression.BooleanOperator;
import org.pragmatica.logstash.tree.Expression.ComparisonOperator;
import org.pragmatica.logstash.tree.Expression.RegexOperator;
import org.pragmatica.logstash.tree.Literal;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;
import org.pragmatica.logstash.tree.Section;
import org.pragmatica.logstash.tree.SectionType;
import org.pragmatica.logstash.tree.SourceLocation;
import org.pragmatica.logstash.tree.SourceSpan;
import org.pragmatica.logstash.tree.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Grammar of the Logstash pipeline configuration language.
 * <p>
 * Each rule is a method over a {@link ParsingContext}. Choices are ordered and backtrack: a rule
 * that fails leaves the position where it started. Terminals report what they expected to the
 * context, which keeps the furthest failure for error messages. Whitespace and comments are
 * skipped explicitly between tokens, so node spans never include trailing trivia.
 * <p>
 * Instances hold no parse state and can be shared between threads.
 */
public final class LogstashGrammar {

    @FunctionalInterface
    interface Rule<T> {
        ParseResult<? extends T> parse(ParsingContext ctx);
    }

    // Packrat rule ids
    private static final int RVALUE = 1;
    private static final int EXPRESSION = 2;

    private static final List<String> COMPARISON_SYMBOLS = List.of("==", "!=", "<=", ">=", "<", ">");
    private static final List<String> REGEX_SYMBOLS = List.of("=~", "!~");
    private static final List<BooleanOperator> AND_TIER = List.of(BooleanOperator.AND,
                                                                  BooleanOperator.XOR,
                                                                  BooleanOperator.NAND);

    /**
     * Rule that parses a fragment of the given kind.
     */
    Rule<Node> ruleFor(NodeKind kind) {
        return switch (kind) {
            case STRING -> this::string;
            case BAREWORD -> this::bareword;
            case NUMBER -> this::number;
            case BOOLEAN -> this::bool;
            case REGEX -> this::regex;
            case SELECTOR -> this::selector;
            case ARRAY -> this::array;
            case MAP -> this::map;
            case MAP_ENTRY -> this::mapEntry;
            case ATTRIBUTE -> this::attribute;
            case PLUGIN -> this::plugin;
            case COMPARISON -> this::comparison;
            case REGEX_MATCH -> this::regexMatch;
            case MEMBERSHIP -> this::membership;
            case NEGATION -> this::negation;
            case BOOLEAN_COMBINATION -> this::booleanCombination;
            case METHOD_CALL -> this::methodCall;
            case RVALUE -> this::rvalue;
            case IF -> this::ifClause;
            case ELSE_IF -> this::elseIfClause;
            case ELSE -> this::elseClause;
            case BRANCH -> this::branch;
            case SECTION -> this::section;
            case DOCUMENT -> this::document;
            case VALUE -> this::value;
            case CONDITION -> this::condition;
        };
    }

    // === Document structure ===

    ParseResult<Document> document(ParsingContext ctx) {
        var start = ctx.location();
        var sections = new ArrayList<Section>();
        var first = section(ctx);
        if (first.isFailure()) {
            return backtrack(ctx, start);
        }
        sections.add(first.value());
        while (true) {
            var before = ctx.location();
            ctx.skipTrivia();
            var next = section(ctx);
            if (next.isFailure()) {
                ctx.restoreLocation(before);
                break;
            }
            sections.add(next.value());
        }
        return success(ctx, new Document(sections, spanFrom(ctx, start)));
    }

    ParseResult<Section> section(ParsingContext ctx) {
        var start = ctx.location();
        var type = sectionType(ctx);
        if (type.isEmpty()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var body = block(ctx);
        if (body.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Section(type.get(), body.value(), spanFrom(ctx, start)));
    }

    private Optional<SectionType> sectionType(ParsingContext ctx) {
        for (var type : SectionType.values()) {
            if (keyword(ctx, type.keyword())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code { (branch / plugin)* }}
     */
    private ParseResult<List<Statement>> block(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "{")) {
            return backtrack(ctx, start);
        }
        var statements = new ArrayList<Statement>();
        ctx.skipTrivia();
        while (true) {
            var statement = statement(ctx);
            if (statement.isFailure()) {
                break;
            }
            statements.add(statement.value());
            ctx.skipTrivia();
        }
        if (!literal(ctx, "}")) {
            return backtrack(ctx, start);
        }
        return success(ctx, statements);
    }

    private ParseResult<Statement> statement(ParsingContext ctx) {
        var branch = branch(ctx);
        if (branch.isSuccess()) {
            return branch.map(Statement.class::cast);
        }
        return plugin(ctx).map(Statement.class::cast);
    }

    // === Branches ===

    ParseResult<Branch> branch(ParsingContext ctx) {
        var start = ctx.location();
        var first = ifClause(ctx);
        if (first.isFailure()) {
            return backtrack(ctx, start);
        }
        var clauses = new ArrayList<Clause>();
        clauses.add(first.value());
        while (true) {
            var before = ctx.location();
            ctx.skipTrivia();
            var elseIf = elseIfClause(ctx);
            if (elseIf.isFailure()) {
                ctx.restoreLocation(before);
                break;
            }
            clauses.add(elseIf.value());
        }
        var before = ctx.location();
        ctx.skipTrivia();
        var otherwise = elseClause(ctx);
        if (otherwise.isSuccess()) {
            clauses.add(otherwise.value());
        } else {
            ctx.restoreLocation(before);
        }
        return success(ctx, new Branch(clauses, spanFrom(ctx, start)));
    }

    ParseResult<Clause.If> ifClause(ParsingContext ctx) {
        var start = ctx.location();
        if (!keyword(ctx, "if")) {
            return backtrack(ctx, start);
        }
        return guardedBlock(ctx, start)
                .map(guarded -> new Clause.If(guarded.condition(), guarded.body(), spanFrom(ctx, start)));
    }

    ParseResult<Clause.ElseIf> elseIfClause(ParsingContext ctx) {
        var start = ctx.location();
        if (!keyword(ctx, "else")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!keyword(ctx, "if")) {
            return backtrack(ctx, start);
        }
        return guardedBlock(ctx, start)
                .map(guarded -> new Clause.ElseIf(guarded.condition(), guarded.body(), spanFrom(ctx, start)));
    }

    ParseResult<Clause.Else> elseClause(ParsingContext ctx) {
        var start = ctx.location();
        if (!keyword(ctx, "else")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var body = block(ctx);
        if (body.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Clause.Else(body.value(), spanFrom(ctx, start)));
    }

    private record Guarded(Node condition, List<Statement> body) {
    }

    private ParseResult<Guarded> guardedBlock(ParsingContext ctx, SourceLocation start) {
        ctx.skipTrivia();
        var condition = condition(ctx);
        if (condition.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var body = block(ctx);
        if (body.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Guarded(condition.value(), body.value()));
    }

    // === Plugins and values ===

    ParseResult<Declaration.Plugin> plugin(ParsingContext ctx) {
        var start = ctx.location();
        var name = name(ctx);
        if (name.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!literal(ctx, "{")) {
            return backtrack(ctx, start);
        }
        var attributes = new ArrayList<Declaration.Attribute>();
        ctx.skipTrivia();
        while (true) {
            var attribute = attribute(ctx);
            if (attribute.isFailure()) {
                break;
            }
            attributes.add(attribute.value());
            ctx.skipTrivia();
        }
        if (!literal(ctx, "}")) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Declaration.Plugin(name.value().text(), attributes, spanFrom(ctx, start)));
    }

    ParseResult<Declaration.Attribute> attribute(ParsingContext ctx) {
        var start = ctx.location();
        var name = name(ctx);
        if (name.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!literal(ctx, "=>")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var value = value(ctx);
        if (value.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Declaration.Attribute(name.value(), value.value(), spanFrom(ctx, start)));
    }

    /**
     * Plugin and attribute names: {@code [A-Za-z0-9_-]+} or a quoted string.
     */
    ParseResult<Literal.Name> name(ParsingContext ctx) {
        var start = ctx.location();
        while (!ctx.isAtEnd() && isNameChar(ctx.peek())) {
            ctx.advance();
        }
        if (ctx.pos() > start.offset()) {
            var text = ctx.substring(start.offset(), ctx.pos());
            return success(ctx, new Literal.Bareword(text, spanFrom(ctx, start)));
        }
        ctx.updateFurthest("name");
        return string(ctx).map(Literal.Name.class::cast);
    }

    ParseResult<Node> value(ParsingContext ctx) {
        return firstOf(ctx,
                       this::plugin,
                       this::bool,
                       this::bareword,
                       this::string,
                       this::number,
                       this::array,
                       this::map);
    }

    ParseResult<Composite.ArrayValue> array(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "[")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var elements = commaSeparated(ctx, this::value);
        ctx.skipTrivia();
        if (!literal(ctx, "]")) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Composite.ArrayValue(elements, spanFrom(ctx, start)));
    }

    ParseResult<Composite.MapValue> map(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "{")) {
            return backtrack(ctx, start);
        }
        var entries = new ArrayList<Composite.MapEntry>();
        ctx.skipTrivia();
        while (true) {
            var entry = mapEntry(ctx);
            if (entry.isFailure()) {
                break;
            }
            entries.add(entry.value());
            ctx.skipTrivia();
        }
        if (!literal(ctx, "}")) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Composite.MapValue(entries, spanFrom(ctx, start)));
    }

    ParseResult<Composite.MapEntry> mapEntry(ParsingContext ctx) {
        var start = ctx.location();
        var key = mapKey(ctx);
        if (key.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!literal(ctx, "=>")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var value = value(ctx);
        if (value.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Composite.MapEntry(key.value(), value.value(), spanFrom(ctx, start)));
    }

    /**
     * Hash keys: number, bareword or string.
     */
    ParseResult<Literal.Key> mapKey(ParsingContext ctx) {
        return firstOf(ctx, this::number, this::bareword, this::string);
    }

    // === Conditions ===

    /**
     * Boolean combination of expressions. {@code and}, {@code xor} and {@code nand} bind tighter than
     * {@code or}; both tiers associate to the left.
     */
    ParseResult<Node> condition(ParsingContext ctx) {
        var start = ctx.location();
        var first = andTier(ctx);
        if (first.isFailure()) {
            return first;
        }
        var left = first.value();
        while (true) {
            var before = ctx.location();
            ctx.skipTrivia();
            if (!keyword(ctx, BooleanOperator.OR.symbol())) {
                ctx.restoreLocation(before);
                break;
            }
            ctx.skipTrivia();
            var right = andTier(ctx);
            if (right.isFailure()) {
                ctx.restoreLocation(before);
                break;
            }
            left = new Expression.BooleanCombination(left, BooleanOperator.OR, right.value(), false,
                                                     spanFrom(ctx, start));
        }
        return success(ctx, left);
    }

    private ParseResult<Node> andTier(ParsingContext ctx) {
        var start = ctx.location();
        var first = expression(ctx);
        if (first.isFailure()) {
            return first;
        }
        var left = first.value();
        while (true) {
            var before = ctx.location();
            ctx.skipTrivia();
            var operator = andTierOperator(ctx);
            if (operator.isEmpty()) {
                ctx.restoreLocation(before);
                break;
            }
            ctx.skipTrivia();
            var right = expression(ctx);
            if (right.isFailure()) {
                ctx.restoreLocation(before);
                break;
            }
            left = new Expression.BooleanCombination(left, operator.get(), right.value(), false,
                                                     spanFrom(ctx, start));
        }
        return success(ctx, left);
    }

    private Optional<BooleanOperator> andTierOperator(ParsingContext ctx) {
        for (var operator : AND_TIER) {
            if (keyword(ctx, operator.symbol())) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    ParseResult<Expression.BooleanCombination> booleanCombination(ParsingContext ctx) {
        var start = ctx.location();
        var condition = condition(ctx);
        if (condition.isFailure()) {
            return backtrack(ctx, start);
        }
        if (condition.value() instanceof Expression.BooleanCombination combination) {
            return success(ctx, combination);
        }
        ctx.updateFurthest("boolean operator");
        return backtrack(ctx, start);
    }

    ParseResult<Node> expression(ParsingContext ctx) {
        return memo(ctx, EXPRESSION, this::expressionAlternatives);
    }

    private ParseResult<Node> expressionAlternatives(ParsingContext ctx) {
        return firstOf(ctx,
                       this::groupedCondition,
                       this::negation,
                       this::membership,
                       this::comparison,
                       this::regexMatch,
                       this::rvalue);
    }

    private ParseResult<Node> groupedCondition(ParsingContext ctx) {
        var start = ctx.location();
        var inner = parenthesized(ctx);
        if (inner.isFailure()) {
            return backtrack(ctx, start);
        }
        if (inner.value() instanceof Expression.BooleanCombination combination) {
            return success(ctx, combination.asGrouped(spanFrom(ctx, start)));
        }
        return inner;
    }

    private ParseResult<Node> parenthesized(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "(")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var inner = condition(ctx);
        if (inner.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!literal(ctx, ")")) {
            return backtrack(ctx, start);
        }
        return success(ctx, inner.value());
    }

    ParseResult<Expression.Negation> negation(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "!")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var operand = firstOf(ctx, this::parenthesized, this::rvalue);
        if (operand.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Expression.Negation(operand.value(), spanFrom(ctx, start)));
    }

    /**
     * {@code rvalue in rvalue} or {@code rvalue not in rvalue}; comments may sit between {@code not} and {@code in}.
     */
    ParseResult<Expression.Membership> membership(ParsingContext ctx) {
        var start = ctx.location();
        var value = rvalue(ctx);
        if (value.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var negated = false;
        if (keyword(ctx, "not")) {
            negated = true;
            ctx.skipTrivia();
        }
        if (!keyword(ctx, "in")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var collection = rvalue(ctx);
        if (collection.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Expression.Membership(value.value(), collection.value(), negated, spanFrom(ctx, start)));
    }

    ParseResult<Expression.Comparison> comparison(ParsingContext ctx) {
        var start = ctx.location();
        var left = rvalue(ctx);
        if (left.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var operator = operator(ctx, COMPARISON_SYMBOLS).flatMap(ComparisonOperator::fromSymbol);
        if (operator.isEmpty()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var right = rvalue(ctx);
        if (right.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Expression.Comparison(left.value(), operator.get(), right.value(), spanFrom(ctx, start)));
    }

    ParseResult<Expression.RegexMatch> regexMatch(ParsingContext ctx) {
        var start = ctx.location();
        var left = rvalue(ctx);
        if (left.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var operator = operator(ctx, REGEX_SYMBOLS).flatMap(RegexOperator::fromSymbol);
        if (operator.isEmpty()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        ParseResult<Literal> pattern = firstOf(ctx, this::string, this::regex);
        if (pattern.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Expression.RegexMatch(left.value(), operator.get(), pattern.value(), spanFrom(ctx, start)));
    }

    private Optional<String> operator(ParsingContext ctx, List<String> symbols) {
        for (var symbol : symbols) {
            if (literal(ctx, symbol)) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    ParseResult<Expression.RValue> rvalue(ParsingContext ctx) {
        return memo(ctx, RVALUE, this::rvalueAlternatives);
    }

    private ParseResult<Expression.RValue> rvalueAlternatives(ParsingContext ctx) {
        var start = ctx.location();
        ParseResult<Node> primary = firstOf(ctx,
                                            this::string,
                                            this::number,
                                            this::selector,
                                            this::array,
                                            this::methodCall,
                                            this::regex);
        if (primary.isFailure()) {
            return backtrack(ctx, start);
        }
        return success(ctx, new Expression.RValue(primary.value(), spanFrom(ctx, start)));
    }

    ParseResult<Expression.MethodCall> methodCall(ParsingContext ctx) {
        var start = ctx.location();
        var name = bareword(ctx);
        if (name.isFailure()) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        if (!literal(ctx, "(")) {
            return backtrack(ctx, start);
        }
        ctx.skipTrivia();
        var arguments = commaSeparated(ctx, this::rvalue);
        ctx.skipTrivia();
        if (!literal(ctx, ")")) {
            return backtrack(ctx, start);
        }
        var unwrapped = arguments.stream()
                                 .map(Expression.RValue::value)
                                 .toList();
        return success(ctx, new Expression.MethodCall(name.value().value(), unwrapped, spanFrom(ctx, start)));
    }

    // === Literals ===

    /**
     * Double- or single-quoted string; a backslash escapes the next character.
     */
    ParseResult<Literal.QuotedString> string(ParsingContext ctx) {
        var start = ctx.location();
        if (ctx.isAtEnd() || (ctx.peek() != '"' && ctx.peek() != '\'')) {
            ctx.updateFurthest("string");
            return backtrack(ctx, start);
        }
        var quote = ctx.advance();
        while (!ctx.isAtEnd() && ctx.peek() != quote) {
            if (ctx.advance() == '\\' && !ctx.isAtEnd()) {
                ctx.advance();
            }
        }
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("closing " + quote);
            return backtrack(ctx, start);
        }
        ctx.advance();
        var lexeme = ctx.substring(start.offset(), ctx.pos());
        try {
            return success(ctx, Literal.QuotedString.parse(lexeme, spanFrom(ctx, start)));
        } catch (LiteralDecodeException e) {
            throw new ConfigParseException(new ParseError.InvalidLiteral(start, lexeme, e.reason()));
        }
    }

    /**
     * {@code [A-Za-z_][A-Za-z0-9_]+}
     */
    ParseResult<Literal.Bareword> bareword(ParsingContext ctx) {
        var start = ctx.location();
        if (ctx.isAtEnd() || !isBarewordStart(ctx.peek())) {
            ctx.updateFurthest("bareword");
            return backtrack(ctx, start);
        }
        ctx.advance();
        while (!ctx.isAtEnd() && isIdentifierChar(ctx.peek())) {
            ctx.advance();
        }
        if (ctx.pos() - start.offset() < 2) {
            ctx.restoreLocation(start);
            ctx.updateFurthest("bareword");
            return backtrack(ctx, start);
        }
        var text = ctx.substring(start.offset(), ctx.pos());
        return success(ctx, new Literal.Bareword(text, spanFrom(ctx, start)));
    }

    /**
     * {@code -?[0-9]+(\.[0-9]+)?}
     */
    ParseResult<Literal.Numeric> number(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.isAtEnd() && ctx.peek() == '-') {
            ctx.advance();
        }
        if (skipDigits(ctx) == 0) {
            ctx.updateFurthest("number");
            return backtrack(ctx, start);
        }
        if (ctx.remaining() >= 2 && ctx.peek() == '.' && isDigit(ctx.peek(1))) {
            ctx.advance();
            skipDigits(ctx);
        }
        var lexeme = ctx.substring(start.offset(), ctx.pos());
        return success(ctx, Literal.Numeric.parse(lexeme, spanFrom(ctx, start)));
    }

    ParseResult<Literal.Bool> bool(ParsingContext ctx) {
        var start = ctx.location();
        if (keyword(ctx, "true")) {
            return success(ctx, new Literal.Bool(true, spanFrom(ctx, start)));
        }
        if (keyword(ctx, "false")) {
            return success(ctx, new Literal.Bool(false, spanFrom(ctx, start)));
        }
        return backtrack(ctx, start);
    }

    /**
     * {@code /.../} where {@code \/} is the only escape; the pattern is kept without the slashes.
     */
    ParseResult<Literal.Regex> regex(ParsingContext ctx) {
        var start = ctx.location();
        if (!literal(ctx, "/")) {
            return backtrack(ctx, start);
        }
        var bodyStart = ctx.pos();
        while (!ctx.isAtEnd() && ctx.peek() != '/') {
            if (ctx.startsWith("\\/")) {
                ctx.advance();
            }
            ctx.advance();
        }
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("closing /");
            return backtrack(ctx, start);
        }
        var body = ctx.substring(bodyStart, ctx.pos());
        ctx.advance();
        return success(ctx, new Literal.Regex(body, spanFrom(ctx, start)));
    }

    /**
     * One or more {@code [segment]} parts read as a single token.
     */
    ParseResult<Literal.Selector> selector(ParsingContext ctx) {
        var start = ctx.location();
        var segments = 0;
        while (selectorSegment(ctx)) {
            segments++;
        }
        if (segments == 0) {
            ctx.updateFurthest("selector");
            return backtrack(ctx, start);
        }
        var raw = ctx.substring(start.offset(), ctx.pos());
        return success(ctx, new Literal.Selector(raw, spanFrom(ctx, start)));
    }

    private boolean selectorSegment(ParsingContext ctx) {
        var start = ctx.location();
        if (ctx.isAtEnd() || ctx.peek() != '[') {
            return false;
        }
        ctx.advance();
        var contentStart = ctx.pos();
        while (!ctx.isAtEnd() && ctx.peek() != '[' && ctx.peek() != ']' && ctx.peek() != ',') {
            ctx.advance();
        }
        if (ctx.pos() == contentStart || ctx.isAtEnd() || ctx.peek() != ']') {
            ctx.restoreLocation(start);
            return false;
        }
        ctx.advance();
        return true;
    }

    // === Combinators ===

    @SafeVarargs
    private <T> ParseResult<T> firstOf(ParsingContext ctx, Rule<T>... alternatives) {
        var start = ctx.location();
        for (var alternative : alternatives) {
            var result = alternative.parse(ctx);
            if (result.isSuccess()) {
                return success(ctx, result.value());
            }
            ctx.restoreLocation(start);
        }
        return backtrack(ctx, start);
    }

    /**
     * {@code (item (, item)*)?}
     */
    private <T> List<T> commaSeparated(ParsingContext ctx, Rule<T> item) {
        var items = new ArrayList<T>();
        var first = item.parse(ctx);
        if (first.isFailure()) {
            return items;
        }
        items.add(first.value());
        while (true) {
            var before = ctx.location();
            ctx.skipTrivia();
            if (!literal(ctx, ",")) {
                ctx.restoreLocation(before);
                break;
            }
            ctx.skipTrivia();
            var next = item.parse(ctx);
            if (next.isFailure()) {
                ctx.restoreLocation(before);
                break;
            }
            items.add(next.value());
        }
        return items;
    }

    private <T> ParseResult<T> memo(ParsingContext ctx, int ruleId, Rule<T> rule) {
        var cached = ctx.<T>getCached(ruleId);
        if (cached.isPresent()) {
            return cached.get();
        }
        var startPos = ctx.pos();
        ParseResult<T> result = ParseResult.covariant(rule.parse(ctx));
        ctx.cacheAt(ruleId, startPos, result);
        return result;
    }

    private static boolean literal(ParsingContext ctx, String text) {
        if (ctx.startsWith(text)) {
            ctx.advance(text.length());
            return true;
        }
        ctx.updateFurthest("'" + text + "'");
        return false;
    }

    /**
     * Literal word not followed by an identifier character.
     */
    private static boolean keyword(ParsingContext ctx, String word) {
        if (ctx.startsWith(word)
            && (ctx.remaining() == word.length() || !isIdentifierChar(ctx.peek(word.length())))) {
            ctx.advance(word.length());
            return true;
        }
        ctx.updateFurthest("'" + word + "'");
        return false;
    }

    private static int skipDigits(ParsingContext ctx) {
        var count = 0;
        while (!ctx.isAtEnd() && isDigit(ctx.peek())) {
            ctx.advance();
            count++;
        }
        return count;
    }

    private static <T> ParseResult<T> success(ParsingContext ctx, T value) {
        return ParseResult.success(value, ctx.location());
    }

    private static <T> ParseResult<T> backtrack(ParsingContext ctx, SourceLocation start) {
        ctx.restoreLocation(start);
        return ParseResult.failure(ctx.furthestLocation(), ctx.furthestExpected());
    }

    private static Optional<SourceSpan> spanFrom(ParsingContext ctx, SourceLocation start) {
        return Optional.of(ctx.spanFrom(start));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isBarewordStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierChar(char c) {
        return isBarewordStart(c) || isDigit(c);
    }

    static boolean isNameChar(char c) {
        return isIdentifierChar(c) || c == '-';
    }
}
