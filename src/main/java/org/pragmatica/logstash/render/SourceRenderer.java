package org.pragmatica.logstash.render;

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
import org.pragmatica.logstash.tree.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders configuration nodes back to Logstash syntax.
 * <p>
 * The visitor input is the indentation of the line the node starts on. Blocks open their brace
 * on that line and close it on a line of their own at the same indentation. Boolean combinations
 * get parentheses only where operator precedence requires them or where the source had them.
 */
public final class SourceRenderer implements NodeVisitor<Integer, String> {
    private static final Logger log = LoggerFactory.getLogger(SourceRenderer.class);
    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final RenderConfig config;

    private SourceRenderer(RenderConfig config) {
        this.config = config;
    }

    public static SourceRenderer create() {
        return create(RenderConfig.DEFAULT);
    }

    public static SourceRenderer create(RenderConfig config) {
        return new SourceRenderer(config);
    }

    public String render(Node node) {
        var text = node.accept(this, 0);
        log.debug("Rendered {} to {} characters", node.kind(), text.length());
        return text;
    }

    // === Literals ===

    @Override
    public String visitString(Literal.QuotedString node, Integer indent) {
        return node.lexeme();
    }

    @Override
    public String visitBareword(Literal.Bareword node, Integer indent) {
        return node.value();
    }

    @Override
    public String visitNumber(Literal.Numeric node, Integer indent) {
        return node.lexeme();
    }

    @Override
    public String visitBoolean(Literal.Bool node, Integer indent) {
        return node.toSource();
    }

    @Override
    public String visitRegex(Literal.Regex node, Integer indent) {
        return "/" + node.pattern() + "/";
    }

    @Override
    public String visitSelector(Literal.Selector node, Integer indent) {
        return node.raw();
    }

    // === Values ===

    @Override
    public String visitArray(Composite.ArrayValue node, Integer indent) {
        return node.elements()
                   .stream()
                   .map(element -> element.accept(this, indent))
                   .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitMap(Composite.MapValue node, Integer indent) {
        return block(node.entries(), indent, "\n");
    }

    @Override
    public String visitMapEntry(Composite.MapEntry node, Integer indent) {
        return node.key().toSource() + " => " + node.value().accept(this, indent);
    }

    @Override
    public String visitAttribute(Declaration.Attribute node, Integer indent) {
        return node.name().toSource() + " => " + node.value().accept(this, indent);
    }

    @Override
    public String visitPlugin(Declaration.Plugin node, Integer indent) {
        return pluginName(node.name()) + " " + block(node.attributes(), indent, "\n");
    }

    // === Expressions ===

    @Override
    public String visitComparison(Expression.Comparison node, Integer indent) {
        return operand(node.left()) + " " + node.operator().symbol() + " " + operand(node.right());
    }

    @Override
    public String visitRegexMatch(Expression.RegexMatch node, Integer indent) {
        return operand(node.left()) + " " + node.operator().symbol() + " " + operand(node.pattern());
    }

    @Override
    public String visitMembership(Expression.Membership node, Integer indent) {
        return operand(node.value()) + " " + node.operator() + " " + operand(node.collection());
    }

    @Override
    public String visitNegation(Expression.Negation node, Integer indent) {
        var inner = node.expression();
        var text = operand(inner);
        if (inner instanceof Expression.BooleanCombination combination && combination.grouped()) {
            return "!" + text;
        }
        return isCompound(inner) ? "!(" + text + ")" : "!" + text;
    }

    @Override
    public String visitBooleanCombination(Expression.BooleanCombination node, Integer indent) {
        var text = side(node.left(), node.operator(), false) + " " + node.operator().symbol() + " "
                   + side(node.right(), node.operator(), true);
        return node.grouped() ? "(" + text + ")" : text;
    }

    @Override
    public String visitMethodCall(Expression.MethodCall node, Integer indent) {
        return node.name() + node.arguments()
                                 .stream()
                                 .map(this::operand)
                                 .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitRValue(Expression.RValue node, Integer indent) {
        return node.value().accept(this, indent);
    }

    // === Control flow ===

    @Override
    public String visitIf(Clause.If node, Integer indent) {
        return "if " + operand(node.condition()) + " " + body(node.body(), indent);
    }

    @Override
    public String visitElseIf(Clause.ElseIf node, Integer indent) {
        return "else if " + operand(node.condition()) + " " + body(node.body(), indent);
    }

    @Override
    public String visitElse(Clause.Else node, Integer indent) {
        return "else " + body(node.body(), indent);
    }

    @Override
    public String visitBranch(Branch node, Integer indent) {
        return node.clauses()
                   .stream()
                   .map(clause -> clause.accept(this, indent))
                   .collect(Collectors.joining(" "));
    }

    @Override
    public String visitSection(Section node, Integer indent) {
        return node.type().keyword() + " " + block(node.body(), indent, "\n\n");
    }

    @Override
    public String visitDocument(Document node, Integer indent) {
        return node.sections()
                   .stream()
                   .map(section -> section.accept(this, indent))
                   .collect(Collectors.joining("\n\n", "", "\n"));
    }

    // === Layout ===

    private String body(List<Statement> statements, int indent) {
        return block(statements, indent, "\n");
    }

    /**
     * {@code {}, items one per line one level deeper, then {@code }} at the current indentation.
     */
    private String block(List<? extends Node> items, int indent, String separator) {
        var inner = indent + config.indentWidth();
        var out = new StringBuilder("{\n");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            out.append(pad(inner)).append(items.get(i).accept(this, inner));
        }
        if (!items.isEmpty()) {
            out.append('\n');
        }
        return out.append(pad(indent)).append('}').toString();
    }

    private String operand(Node node) {
        return node.accept(this, 0);
    }

    /**
     * Operators of one tier associate to the left, so a right operand of the same tier keeps its
     * parentheses unless both operators are the same associative one.
     */
    private String side(Node operand, Expression.BooleanOperator parent, boolean right) {
        if (operand instanceof Expression.BooleanCombination child && !child.grouped()) {
            var op = child.operator();
            var needsGroup = parent.bindsTighterThan(op)
                             || right && parent.precedence() == op.precedence() && !(parent == op && op.associative());
            if (needsGroup) {
                return "(" + operand(child) + ")";
            }
        }
        return operand(operand);
    }

    private static boolean isCompound(Node node) {
        return node instanceof Expression.Comparison
               || node instanceof Expression.RegexMatch
               || node instanceof Expression.Membership
               || node instanceof Expression.BooleanCombination
               || node instanceof Expression.Negation;
    }

    private static String pluginName(String name) {
        return PLAIN_NAME.matcher(name).matches() ? name : Literal.QuotedString.of(name).lexeme();
    }

    private static String pad(int width) {
        return " ".repeat(width);
    }
}
