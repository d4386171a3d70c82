package org.pragmatica.logstash.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.logstash.tree.Branch;
import org.pragmatica.logstash.tree.Clause;
import org.pragmatica.logstash.tree.Composite;
import org.pragmatica.logstash.tree.Declaration;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Expression;
import org.pragmatica.logstash.tree.Literal;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeVisitor;
import org.pragmatica.logstash.tree.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;

import static org.pragmatica.logstash.canonical.TreeTags.*;

/**
 * Converts configuration nodes to the canonical tagged tree.
 * <p>
 * {@link Expression.RValue} is transparent: its operand is written directly.
 * <p>
 * A hash is written as a JSON object, so of two entries with the same key source text only the
 * last one is kept. The value of such a hash is unchanged, its rendered source is not.
 */
public final class TreeWriter implements NodeVisitor<Void, JsonNode> {
    private static final Logger log = LoggerFactory.getLogger(TreeWriter.class);
    private static final TreeWriter INSTANCE = new TreeWriter();
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private TreeWriter() {
    }

    public static JsonNode toTree(Node node) {
        return node.accept(INSTANCE, null);
    }

    // === Literals ===

    @Override
    public JsonNode visitString(Literal.QuotedString node, Void input) {
        return tagged(STRING, FACTORY.textNode(node.lexeme()));
    }

    @Override
    public JsonNode visitBareword(Literal.Bareword node, Void input) {
        return tagged(BAREWORD, FACTORY.textNode(node.value()));
    }

    @Override
    public JsonNode visitNumber(Literal.Numeric node, Void input) {
        var value = node.value();
        JsonNode number;
        if (value instanceof Long longValue) {
            number = FACTORY.numberNode(longValue);
        } else if (value instanceof BigInteger bigValue) {
            number = FACTORY.numberNode(bigValue);
        } else {
            number = FACTORY.numberNode(value.doubleValue());
        }
        return tagged(NUMBER, number);
    }

    @Override
    public JsonNode visitBoolean(Literal.Bool node, Void input) {
        return tagged(BOOLEAN, FACTORY.booleanNode(node.value()));
    }

    @Override
    public JsonNode visitRegex(Literal.Regex node, Void input) {
        return tagged(REGEX, FACTORY.textNode(node.toSource()));
    }

    @Override
    public JsonNode visitSelector(Literal.Selector node, Void input) {
        return tagged(SELECTOR, FACTORY.textNode(node.raw()));
    }

    // === Values ===

    @Override
    public JsonNode visitArray(Composite.ArrayValue node, Void input) {
        return tagged(ARRAY, list(node.elements()));
    }

    @Override
    public JsonNode visitMap(Composite.MapValue node, Void input) {
        var entries = FACTORY.objectNode();
        for (var entry : node.entries()) {
            var key = entry.key().toSource();
            if (entries.has(key)) {
                log.debug("Hash key {} repeats, keeping the last entry", key);
            }
            entries.set(key, entry.value().accept(this, input));
        }
        return tagged(HASH, entries);
    }

    @Override
    public JsonNode visitMapEntry(Composite.MapEntry node, Void input) {
        return tagged(node.key().toSource(), node.value().accept(this, input));
    }

    @Override
    public JsonNode visitAttribute(Declaration.Attribute node, Void input) {
        return tagged(node.name().toSource(), node.value().accept(this, input));
    }

    @Override
    public JsonNode visitPlugin(Declaration.Plugin node, Void input) {
        var fields = FACTORY.objectNode();
        fields.put(PLUGIN_NAME, node.name());
        fields.set(ATTRIBUTES, list(node.attributes()));
        return tagged(PLUGIN, fields);
    }

    // === Expressions ===

    @Override
    public JsonNode visitComparison(Expression.Comparison node, Void input) {
        return binary(COMPARISON, LEFT, node.left(), node.operator().symbol(), RIGHT, node.right());
    }

    @Override
    public JsonNode visitRegexMatch(Expression.RegexMatch node, Void input) {
        return binary(REGEX_MATCH, LEFT, node.left(), node.operator().symbol(), PATTERN, node.pattern());
    }

    @Override
    public JsonNode visitMembership(Expression.Membership node, Void input) {
        return binary(node.negated() ? NOT_IN : IN, VALUE, node.value(), node.operator(), COLLECTION, node.collection());
    }

    @Override
    public JsonNode visitNegation(Expression.Negation node, Void input) {
        var fields = FACTORY.objectNode();
        fields.put(OPERATOR, "!");
        fields.set(EXPRESSION, node.expression().accept(this, input));
        return tagged(NEGATION, fields);
    }

    @Override
    public JsonNode visitBooleanCombination(Expression.BooleanCombination node, Void input) {
        return binary(BOOLEAN_COMBINATION, LEFT, node.left(), node.operator().symbol(), RIGHT, node.right());
    }

    @Override
    public JsonNode visitMethodCall(Expression.MethodCall node, Void input) {
        var fields = FACTORY.objectNode();
        fields.put(METHOD_NAME, node.name());
        fields.set(ARGUMENTS, list(node.arguments()));
        return tagged(METHOD_CALL, fields);
    }

    @Override
    public JsonNode visitRValue(Expression.RValue node, Void input) {
        return node.value().accept(this, input);
    }

    // === Control flow ===

    @Override
    public JsonNode visitIf(Clause.If node, Void input) {
        return guarded(IF, node.condition(), node.body());
    }

    @Override
    public JsonNode visitElseIf(Clause.ElseIf node, Void input) {
        return guarded(ELSE_IF, node.condition(), node.body());
    }

    @Override
    public JsonNode visitElse(Clause.Else node, Void input) {
        return tagged(ELSE, list(node.body()));
    }

    @Override
    public JsonNode visitBranch(Branch node, Void input) {
        return tagged(BRANCH, list(node.clauses()));
    }

    @Override
    public JsonNode visitSection(Section node, Void input) {
        return tagged(SECTION, tagged(node.type().keyword(), list(node.body())));
    }

    @Override
    public JsonNode visitDocument(Document node, Void input) {
        return tagged(CONFIG, list(node.sections()));
    }

    private ObjectNode binary(String tag, String leftName, Node left, String operator, String rightName, Node right) {
        var fields = FACTORY.objectNode();
        fields.set(leftName, left.accept(this, null));
        fields.put(OPERATOR, operator);
        fields.set(rightName, right.accept(this, null));
        return tagged(tag, fields);
    }

    private ObjectNode guarded(String tag, Node condition, List<? extends Node> body) {
        var fields = FACTORY.objectNode();
        fields.set(EXPR, condition.accept(this, null));
        fields.set(BODY, list(body));
        return tagged(tag, fields);
    }

    private ArrayNode list(List<? extends Node> nodes) {
        var array = FACTORY.arrayNode(nodes.size());
        nodes.forEach(node -> array.add(node.accept(this, null)));
        return array;
    }

    private static ObjectNode tagged(String tag, JsonNode value) {
        var object = FACTORY.objectNode();
        object.set(tag, value);
        return object;
    }
}
