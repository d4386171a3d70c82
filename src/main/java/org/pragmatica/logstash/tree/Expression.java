package org.pragmatica.logstash.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Guard expressions of conditional branches.
 */
public sealed interface Expression extends Node permits Expression.Comparison, Expression.RegexMatch,
        Expression.Membership, Expression.Negation, Expression.BooleanCombination, Expression.MethodCall,
        Expression.RValue {

    enum ComparisonOperator {
        EQ("=="),
        NE("!="),
        LE("<="),
        GE(">="),
        LT("<"),
        GT(">");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<ComparisonOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    enum RegexOperator {
        MATCH("=~"),
        NO_MATCH("!~");

        private final String symbol;

        RegexOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<RegexOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    /**
     * Boolean connectives. {@code and}, {@code xor} and {@code nand} share a precedence tier above {@code or}.
     */
    enum BooleanOperator {
        AND("and", 2),
        XOR("xor", 2),
        NAND("nand", 2),
        OR("or", 1);

        private final String symbol;
        private final int precedence;

        BooleanOperator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean associative() {
            return this != NAND;
        }

        public boolean bindsTighterThan(BooleanOperator other) {
            return precedence > other.precedence;
        }

        public static Optional<BooleanOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    record Comparison(Node left, ComparisonOperator operator, Node right, Optional<SourceSpan> span)
            implements Expression {
        public Comparison {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(span, "span");
        }

        public Comparison(Node left, ComparisonOperator operator, Node right) {
            this(left, operator, right, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPARISON;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitComparison(this, input);
        }
    }

    /**
     * {@code left =~ pattern} or {@code left !~ pattern}; the pattern is a regex or a string.
     */
    record RegexMatch(Node left, RegexOperator operator, Literal pattern, Optional<SourceSpan> span)
            implements Expression {
        public RegexMatch {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(span, "span");
            if (!(pattern instanceof Literal.Regex) && !(pattern instanceof Literal.QuotedString)) {
                throw new IllegalArgumentException("Regex match pattern must be a regex or a string, got " + pattern.kind());
            }
        }

        public RegexMatch(Node left, RegexOperator operator, Literal pattern) {
            this(left, operator, pattern, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.of(left, pattern);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.REGEX_MATCH;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitRegexMatch(this, input);
        }
    }

    /**
     * {@code value in collection}, or {@code value not in collection} when negated.
     */
    record Membership(Node value, Node collection, boolean negated, Optional<SourceSpan> span) implements Expression {
        public Membership {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(span, "span");
        }

        public Membership(Node value, Node collection, boolean negated) {
            this(value, collection, negated, Optional.empty());
        }

        public String operator() {
            return negated ? "not in" : "in";
        }

        @Override
        public List<Node> children() {
            return List.of(value, collection);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MEMBERSHIP;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitMembership(this, input);
        }
    }

    record Negation(Node expression, Optional<SourceSpan> span) implements Expression {
        public Negation {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(span, "span");
        }

        public Negation(Node expression) {
            this(expression, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.of(expression);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NEGATION;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitNegation(this, input);
        }
    }

    /**
     * {@code left op right}. {@code grouped} records explicit parentheses around the whole combination
     * in the source; it affects rendering only.
     */
    record BooleanCombination(Node left, BooleanOperator operator, Node right, boolean grouped,
                              Optional<SourceSpan> span) implements Expression {
        public BooleanCombination {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(span, "span");
        }

        public BooleanCombination(Node left, BooleanOperator operator, Node right) {
            this(left, operator, right, false, Optional.empty());
        }

        public BooleanCombination asGrouped(Optional<SourceSpan> groupSpan) {
            return new BooleanCombination(left, operator, right, true, groupSpan);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN_COMBINATION;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitBooleanCombination(this, input);
        }
    }

    record MethodCall(String name, List<Node> arguments, Optional<SourceSpan> span) implements Expression {
        public MethodCall {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(span, "span");
        }

        public MethodCall(String name, List<Node> arguments) {
            this(name, arguments, Optional.empty());
        }

        public static MethodCall of(String name, Node... arguments) {
            return new MethodCall(name, List.of(arguments));
        }

        @Override
        public List<Node> children() {
            return arguments;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.METHOD_CALL;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitMethodCall(this, input);
        }
    }

    /**
     * Marks a primary operand: string, number, selector, array, method call or regex.
     */
    record RValue(Node value, Optional<SourceSpan> span) implements Expression {
        public RValue {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(span, "span");
            if (!isPrimary(value)) {
                throw new IllegalArgumentException("Not a primary operand: " + value.kind());
            }
        }

        public RValue(Node value) {
            this(value, Optional.empty());
        }

        public static boolean isPrimary(Node node) {
            return node instanceof Literal.QuotedString
                   || node instanceof Literal.Numeric
                   || node instanceof Literal.Selector
                   || node instanceof Literal.Regex
                   || node instanceof Composite.ArrayValue
                   || node instanceof MethodCall;
        }

        @Override
        public List<Node> children() {
            return List.of(value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RVALUE;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitRValue(this, input);
        }
    }
}
