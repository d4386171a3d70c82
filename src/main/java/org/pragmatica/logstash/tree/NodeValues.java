package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decoded values of configuration nodes.
 * <p>
 * Literals yield their decoded value, arrays a {@link List}, maps a {@link LinkedHashMap},
 * attributes a single-entry map, plugins {@code {name: [attributes]}}, sections
 * {@code {type: [items]}} and documents a list of sections. Guard expressions yield their
 * canonical text, with boolean combinations fully parenthesized.
 */
public final class NodeValues implements NodeVisitor<ValueContext, Object> {
    private static final NodeValues INSTANCE = new NodeValues();

    private NodeValues() {
    }

    public static Object of(Node node) {
        return of(node, ValueContext.PLAIN);
    }

    public static Object of(Node node, ValueContext context) {
        return node.accept(INSTANCE, context);
    }

    /**
     * Canonical text of a guard expression or one of its operands.
     */
    public static String expressionText(Node node) {
        return String.valueOf(of(node, ValueContext.EXPRESSION));
    }

    @Override
    public Object visitString(Literal.QuotedString node, ValueContext context) {
        return context == ValueContext.EXPRESSION ? node.lexeme() : node.value();
    }

    @Override
    public Object visitBareword(Literal.Bareword node, ValueContext context) {
        return node.value();
    }

    @Override
    public Object visitNumber(Literal.Numeric node, ValueContext context) {
        return context == ValueContext.EXPRESSION ? node.canonicalText() : node.value();
    }

    @Override
    public Object visitBoolean(Literal.Bool node, ValueContext context) {
        return context == ValueContext.EXPRESSION ? node.toSource() : (Object) node.value();
    }

    @Override
    public Object visitRegex(Literal.Regex node, ValueContext context) {
        return node.toSource();
    }

    @Override
    public Object visitSelector(Literal.Selector node, ValueContext context) {
        return node.raw();
    }

    @Override
    public Object visitArray(Composite.ArrayValue node, ValueContext context) {
        if (context == ValueContext.EXPRESSION) {
            return joined(node.elements(), "[", "]");
        }
        var values = new ArrayList<>(node.elements().size());
        node.elements().forEach(element -> values.add(element.accept(this, context)));
        return values;
    }

    @Override
    public Object visitMap(Composite.MapValue node, ValueContext context) {
        if (context == ValueContext.EXPRESSION) {
            return joined(node.entries(), "{", "}");
        }
        var values = new LinkedHashMap<>();
        node.entries().forEach(entry -> values.put(entry.key().accept(this, context), entry.value().accept(this, context)));
        return values;
    }

    @Override
    public Object visitMapEntry(Composite.MapEntry node, ValueContext context) {
        if (context == ValueContext.EXPRESSION) {
            return expressionText(node.key()) + " => " + expressionText(node.value());
        }
        return single(node.key().accept(this, context), node.value().accept(this, context));
    }

    @Override
    public Object visitAttribute(Declaration.Attribute node, ValueContext context) {
        return single(node.name().text(), node.value().accept(this, ValueContext.PLAIN));
    }

    @Override
    public Object visitPlugin(Declaration.Plugin node, ValueContext context) {
        return single(node.name(), list(node.attributes()));
    }

    @Override
    public Object visitComparison(Expression.Comparison node, ValueContext context) {
        return expressionText(node.left()) + " " + node.operator().symbol() + " " + expressionText(node.right());
    }

    @Override
    public Object visitRegexMatch(Expression.RegexMatch node, ValueContext context) {
        return expressionText(node.left()) + " " + node.operator().symbol() + " " + expressionText(node.pattern());
    }

    @Override
    public Object visitMembership(Expression.Membership node, ValueContext context) {
        return expressionText(node.value()) + " " + node.operator() + " " + expressionText(node.collection());
    }

    @Override
    public Object visitNegation(Expression.Negation node, ValueContext context) {
        return "!(" + expressionText(node.expression()) + ")";
    }

    @Override
    public Object visitBooleanCombination(Expression.BooleanCombination node, ValueContext context) {
        return "(" + expressionText(node.left()) + " " + node.operator().symbol() + " " + expressionText(node.right()) + ")";
    }

    @Override
    public Object visitMethodCall(Expression.MethodCall node, ValueContext context) {
        return node.name() + joined(node.arguments(), "(", ")");
    }

    @Override
    public Object visitRValue(Expression.RValue node, ValueContext context) {
        return node.value().accept(this, context);
    }

    @Override
    public Object visitIf(Clause.If node, ValueContext context) {
        var value = new LinkedHashMap<String, Object>();
        value.put("if", expressionText(node.condition()));
        value.put("body", list(node.body()));
        return value;
    }

    @Override
    public Object visitElseIf(Clause.ElseIf node, ValueContext context) {
        var value = new LinkedHashMap<String, Object>();
        value.put("else if", expressionText(node.condition()));
        value.put("body", list(node.body()));
        return value;
    }

    @Override
    public Object visitElse(Clause.Else node, ValueContext context) {
        return single("else", list(node.body()));
    }

    @Override
    public Object visitBranch(Branch node, ValueContext context) {
        return list(node.clauses());
    }

    @Override
    public Object visitSection(Section node, ValueContext context) {
        return single(node.type().keyword(), list(node.body()));
    }

    @Override
    public Object visitDocument(Document node, ValueContext context) {
        return list(node.sections());
    }

    private List<Object> list(List<? extends Node> nodes) {
        var values = new ArrayList<>(nodes.size());
        nodes.forEach(node -> values.add(node.accept(this, ValueContext.PLAIN)));
        return values;
    }

    private static Map<Object, Object> single(Object key, Object value) {
        var map = new LinkedHashMap<>(2);
        map.put(key, value);
        return map;
    }

    private static String joined(List<? extends Node> nodes, String open, String close) {
        return nodes.stream()
                    .map(NodeValues::expressionText)
                    .collect(Collectors.joining(", ", open, close));
    }
}
