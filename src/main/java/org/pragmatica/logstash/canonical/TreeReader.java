package org.pragmatica.logstash.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import org.pragmatica.logstash.error.LiteralDecodeException;
import org.pragmatica.logstash.error.TreeShapeException;
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
import org.pragmatica.logstash.tree.Statement;
import org.pragmatica.logstash.tree.StringEscapes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

import static org.pragmatica.logstash.canonical.TreeTags.*;

/**
 * Builds configuration nodes from the canonical tagged tree.
 * <p>
 * Besides tagged objects, plain JSON values are accepted where their meaning is clear: a string
 * reads as a bareword (or as a quoted string when it is not a valid bareword), a number as a
 * number, a boolean as a boolean, an array as an array, and an object whose key is not a tag as
 * a hash. Attribute and hash-entry names are read back with the name and key grammar, so
 * {@code "\"my field\""} becomes a quoted string and {@code add_tag} a bareword.
 * <p>
 * Shape errors are reported as {@link TreeShapeException} naming what was wrong.
 */
public final class TreeReader {
    private static final Logger log = LoggerFactory.getLogger(TreeReader.class);

    private static final Pattern PLAIN_NAME_SHAPE = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern BAREWORD_SHAPE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]+");
    private static final Pattern NUMBER_SHAPE = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private TreeReader() {
    }

    public static Node fromTree(JsonNode tree) {
        return guarded(() -> read(tree));
    }

    /**
     * Read a tree expected to hold a node of the given kind. Attribute and hash entry trees have
     * the shape of a one-entry plain object, so they can only be read back this way.
     */
    public static Node fromTree(JsonNode tree, NodeKind kind) {
        return guarded(() -> readAs(tree, kind));
    }

    private interface Reading {
        Node read();
    }

    private static Node guarded(Reading reading) {
        try {
            var node = reading.read();
            log.debug("Read {} from canonical tree", node.kind());
            return node;
        } catch (IllegalArgumentException | LiteralDecodeException e) {
            throw new TreeShapeException(e.getMessage(), e);
        }
    }

    private static Node readAs(JsonNode tree, NodeKind kind) {
        return switch (kind) {
            case ATTRIBUTE -> attribute(tree);
            case MAP_ENTRY -> mapEntry(tree);
            case RVALUE -> new Expression.RValue(read(tree));
            case VALUE, CONDITION -> read(tree);
            default -> expectKind(read(tree), kind);
        };
    }

    private static Node expectKind(Node node, NodeKind kind) {
        if (node.kind() != kind) {
            throw new TreeShapeException("Expected " + kind + " but the tree holds " + node.kind());
        }
        return node;
    }

    // === Dispatch ===

    private static Node read(JsonNode tree) {
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            throw new TreeShapeException("Null is not a configuration node");
        }
        if (tree.isTextual()) {
            return plainText(tree.asText());
        }
        if (tree.isNumber()) {
            return number(tree, "number");
        }
        if (tree.isBoolean()) {
            return new Literal.Bool(tree.booleanValue());
        }
        if (tree.isArray()) {
            return new Composite.ArrayValue(list(tree, TreeReader::read));
        }
        if (tree.isObject()) {
            if (tree.size() == 1) {
                var entry = tree.properties().iterator().next();
                if (TreeTags.isTag(entry.getKey())) {
                    return tagged(entry.getKey(), entry.getValue());
                }
            }
            return hashEntries(tree);
        }
        throw new TreeShapeException("Unsupported tree value of type " + tree.getNodeType());
    }

    private static Node tagged(String tag, JsonNode value) {
        return switch (tag) {
            case STRING -> Literal.QuotedString.parse(text(value, tag));
            case BAREWORD -> new Literal.Bareword(text(value, tag));
            case NUMBER -> number(value, tag);
            case BOOLEAN -> bool(value, tag);
            case REGEX -> new Literal.Regex(text(value, tag));
            case SELECTOR -> new Literal.Selector(text(value, tag));
            case ARRAY -> new Composite.ArrayValue(list(array(value, tag), TreeReader::read));
            case HASH -> hashEntries(object(value, tag));
            case PLUGIN -> plugin(value);
            case COMPARISON -> comparison(value);
            case REGEX_MATCH -> regexMatch(value);
            case IN -> membership(value, IN, false);
            case NOT_IN -> membership(value, NOT_IN, true);
            case NEGATION -> negation(value);
            case BOOLEAN_COMBINATION -> booleanCombination(value);
            case METHOD_CALL -> methodCall(value);
            case IF, ELSE_IF, ELSE -> clause(tag, value);
            case BRANCH -> branch(value);
            case SECTION -> section(value);
            case CONFIG -> new Document(list(array(value, tag), item -> as(read(item), Section.class, "config section")));
            default -> throw new TreeShapeException("Unknown tag '" + tag + "'");
        };
    }

    // === Values ===

    private static Node plainText(String text) {
        return BAREWORD_SHAPE.matcher(text).matches()
               ? new Literal.Bareword(text)
               : Literal.QuotedString.of(text);
    }

    private static Literal.Numeric number(JsonNode value, String context) {
        if (!value.isNumber()) {
            throw new TreeShapeException(context + " must be a number, got " + value.getNodeType());
        }
        return value.isIntegralNumber()
               ? Literal.Numeric.of(value.bigIntegerValue())
               : Literal.Numeric.of(value.doubleValue());
    }

    private static Literal.Bool bool(JsonNode value, String context) {
        if (!value.isBoolean()) {
            throw new TreeShapeException(context + " must be a boolean, got " + value.getNodeType());
        }
        return new Literal.Bool(value.booleanValue());
    }

    private static Composite.MapValue hashEntries(JsonNode object) {
        var entries = new ArrayList<Composite.MapEntry>(object.size());
        for (var property : object.properties()) {
            entries.add(new Composite.MapEntry(key(property.getKey()), read(property.getValue())));
        }
        return new Composite.MapValue(entries);
    }

    private static Composite.MapEntry mapEntry(JsonNode tree) {
        var property = single(tree, "hash entry");
        return new Composite.MapEntry(key(property.getKey()), read(property.getValue()));
    }

    private static Declaration.Attribute attribute(JsonNode tree) {
        var property = single(tree, "attribute");
        return new Declaration.Attribute(name(property.getKey()), read(property.getValue()));
    }

    private static Declaration.Plugin plugin(JsonNode value) {
        object(value, PLUGIN);
        rejectUnknownKeys(value, Set.of(PLUGIN_NAME, ATTRIBUTES), PLUGIN);
        var name = text(field(value, PLUGIN_NAME, PLUGIN), PLUGIN + "." + PLUGIN_NAME);
        var attributes = value.has(ATTRIBUTES)
                         ? list(array(value.get(ATTRIBUTES), PLUGIN + "." + ATTRIBUTES), TreeReader::attribute)
                         : List.<Declaration.Attribute>of();
        return new Declaration.Plugin(name, attributes);
    }

    // === Expressions ===

    private static Expression.Comparison comparison(JsonNode value) {
        expectFields(value, COMPARISON, LEFT, OPERATOR, RIGHT);
        var symbol = text(value.get(OPERATOR), COMPARISON + "." + OPERATOR);
        var operator = ComparisonOperator.fromSymbol(symbol)
                                         .orElseThrow(() -> unknownOperator(COMPARISON, symbol));
        return new Expression.Comparison(read(value.get(LEFT)), operator, read(value.get(RIGHT)));
    }

    private static Expression.RegexMatch regexMatch(JsonNode value) {
        expectFields(value, REGEX_MATCH, LEFT, OPERATOR, PATTERN);
        var symbol = text(value.get(OPERATOR), REGEX_MATCH + "." + OPERATOR);
        var operator = RegexOperator.fromSymbol(symbol)
                                    .orElseThrow(() -> unknownOperator(REGEX_MATCH, symbol));
        var patternTree = value.get(PATTERN);
        Node pattern = patternTree.isTextual() ? new Literal.Regex(patternTree.asText()) : read(patternTree);
        if (!(pattern instanceof Literal.Regex) && !(pattern instanceof Literal.QuotedString)) {
            throw new TreeShapeException(REGEX_MATCH + "." + PATTERN + " must be a regexp or a string, got " + pattern.kind());
        }
        return new Expression.RegexMatch(read(value.get(LEFT)), operator, (Literal) pattern);
    }

    private static Expression.Membership membership(JsonNode value, String tag, boolean negated) {
        expectFields(value, tag, VALUE, OPERATOR, COLLECTION);
        var symbol = text(value.get(OPERATOR), tag + "." + OPERATOR);
        var expected = negated ? "not in" : "in";
        if (!expected.equals(symbol)) {
            throw new TreeShapeException(tag + " requires operator '" + expected + "', got '" + symbol + "'");
        }
        return new Expression.Membership(read(value.get(VALUE)), read(value.get(COLLECTION)), negated);
    }

    private static Expression.Negation negation(JsonNode value) {
        object(value, NEGATION);
        rejectUnknownKeys(value, Set.of(OPERATOR, EXPRESSION), NEGATION);
        if (value.has(OPERATOR) && !"!".equals(value.get(OPERATOR).asText())) {
            throw unknownOperator(NEGATION, value.get(OPERATOR).asText());
        }
        return new Expression.Negation(read(field(value, EXPRESSION, NEGATION)));
    }

    private static Expression.BooleanCombination booleanCombination(JsonNode value) {
        expectFields(value, BOOLEAN_COMBINATION, LEFT, OPERATOR, RIGHT);
        var symbol = text(value.get(OPERATOR), BOOLEAN_COMBINATION + "." + OPERATOR);
        var operator = BooleanOperator.fromSymbol(symbol)
                                      .orElseThrow(() -> unknownOperator(BOOLEAN_COMBINATION, symbol));
        return new Expression.BooleanCombination(read(value.get(LEFT)), operator, read(value.get(RIGHT)));
    }

    private static Expression.MethodCall methodCall(JsonNode value) {
        object(value, METHOD_CALL);
        rejectUnknownKeys(value, Set.of(METHOD_NAME, ARGUMENTS), METHOD_CALL);
        var name = text(field(value, METHOD_NAME, METHOD_CALL), METHOD_CALL + "." + METHOD_NAME);
        var arguments = value.has(ARGUMENTS)
                        ? list(array(value.get(ARGUMENTS), METHOD_CALL + "." + ARGUMENTS), TreeReader::read)
                        : List.<Node>of();
        return new Expression.MethodCall(name, arguments);
    }

    // === Control flow ===

    private static Clause clause(String tag, JsonNode value) {
        if (ELSE.equals(tag)) {
            return new Clause.Else(statements(array(value, tag), tag));
        }
        expectFields(value, tag, EXPR, BODY);
        var condition = read(value.get(EXPR));
        var body = statements(array(value.get(BODY), tag + "." + BODY), tag);
        return IF.equals(tag) ? new Clause.If(condition, body) : new Clause.ElseIf(condition, body);
    }

    private static Branch branch(JsonNode value) {
        var clauses = list(array(value, BRANCH), item -> as(read(item), Clause.class, "branch clause"));
        return new Branch(clauses);
    }

    private static Section section(JsonNode value) {
        var property = single(value, SECTION);
        var type = SectionType.fromKeyword(property.getKey())
                              .orElseThrow(() -> new TreeShapeException(
                                      "Unknown section type '" + property.getKey() + "', expected input, filter or output"));
        return new Section(type, statements(array(property.getValue(), SECTION + "." + property.getKey()), SECTION));
    }

    private static List<Statement> statements(JsonNode array, String context) {
        return list(array, item -> as(read(item), Statement.class, context + " body item (plugin or branch)"));
    }

    // === Names and keys ===

    private static Literal.Name name(String text) {
        if (PLAIN_NAME_SHAPE.matcher(text).matches()) {
            return new Literal.Bareword(text);
        }
        return quotedOrWrapped(text);
    }

    private static Literal.Key key(String text) {
        if (NUMBER_SHAPE.matcher(text).matches()) {
            return Literal.Numeric.parse(text);
        }
        if (BAREWORD_SHAPE.matcher(text).matches()) {
            return new Literal.Bareword(text);
        }
        return quotedOrWrapped(text);
    }

    private static Literal.QuotedString quotedOrWrapped(String text) {
        if (text.length() >= 2 && StringEscapes.isQuote(text.charAt(0)) && text.charAt(text.length() - 1) == text.charAt(0)) {
            return Literal.QuotedString.parse(text);
        }
        return Literal.QuotedString.of(text);
    }

    // === Shape checks ===

    private static <T> T as(Node node, Class<T> type, String context) {
        if (!type.isInstance(node)) {
            throw new TreeShapeException("Expected " + context + ", got " + node.kind());
        }
        return type.cast(node);
    }

    private static <T> List<T> list(JsonNode array, Function<JsonNode, T> reader) {
        var items = new ArrayList<T>(array.size());
        array.forEach(item -> items.add(reader.apply(item)));
        return items;
    }

    private static Map.Entry<String, JsonNode> single(JsonNode tree, String context) {
        if (tree == null || !tree.isObject() || tree.size() != 1) {
            var size = tree != null && tree.isObject() ? tree.size() + " keys" : describe(tree);
            throw new TreeShapeException(context + " must be an object with exactly one key, got " + size);
        }
        return tree.properties().iterator().next();
    }

    private static void expectFields(JsonNode value, String context, String... names) {
        object(value, context);
        rejectUnknownKeys(value, Set.of(names), context);
        for (var name : names) {
            field(value, name, context);
        }
    }

    private static void rejectUnknownKeys(JsonNode value, Set<String> known, String context) {
        for (var property : value.properties()) {
            if (!known.contains(property.getKey())) {
                throw new TreeShapeException(context + " has unexpected field '" + property.getKey()
                                             + "', allowed fields are " + known);
            }
        }
    }

    private static JsonNode field(JsonNode value, String name, String context) {
        var field = value.get(name);
        if (field == null || field.isNull()) {
            throw new TreeShapeException(context + " is missing field '" + name + "'");
        }
        return field;
    }

    private static String text(JsonNode value, String context) {
        if (value == null || !value.isTextual()) {
            throw new TreeShapeException(context + " must be a string, got " + describe(value));
        }
        return value.asText();
    }

    private static JsonNode array(JsonNode value, String context) {
        if (value == null || !value.isArray()) {
            throw new TreeShapeException(context + " must be an array, got " + describe(value));
        }
        return value;
    }

    private static JsonNode object(JsonNode value, String context) {
        if (value == null || !value.isObject()) {
            throw new TreeShapeException(context + " must be an object, got " + describe(value));
        }
        return value;
    }

    private static TreeShapeException unknownOperator(String context, String symbol) {
        return new TreeShapeException(context + " has unknown operator '" + symbol + "'");
    }

    private static String describe(JsonNode value) {
        return value == null ? "nothing" : value.getNodeType().toString();
    }
}
