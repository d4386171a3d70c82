package org.pragmatica.logstash.render;

import org.pragmatica.logstash.tree.Declaration;
import org.pragmatica.logstash.tree.Expression;
import org.pragmatica.logstash.tree.Literal;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.Section;

/**
 * Indented outline of a tree for debugging, one node per line:
 * <pre>
 * Section(filter)
 *   Plugin(mutate)
 *     Attribute
 *       Bareword(add_tag)
 * </pre>
 */
public final class NodePrinter {
    private NodePrinter() {
    }

    public static String print(Node node) {
        var out = new StringBuilder();
        print(node, 0, out);
        return out.toString();
    }

    private static void print(Node node, int depth, StringBuilder out) {
        out.append("  ".repeat(depth))
           .append(label(node))
           .append('\n');
        node.children()
            .forEach(child -> print(child, depth + 1, out));
    }

    private static String label(Node node) {
        var name = node.getClass().getSimpleName();
        if (node instanceof Literal literal) {
            return name + "(" + literal.toSource() + ")";
        }
        if (node instanceof Declaration.Plugin plugin) {
            return name + "(" + plugin.name() + ")";
        }
        if (node instanceof Section section) {
            return name + "(" + section.type().keyword() + ")";
        }
        if (node instanceof Expression.Comparison comparison) {
            return name + "(" + comparison.operator().symbol() + ")";
        }
        if (node instanceof Expression.RegexMatch match) {
            return name + "(" + match.operator().symbol() + ")";
        }
        if (node instanceof Expression.Membership membership) {
            return name + "(" + membership.operator() + ")";
        }
        if (node instanceof Expression.BooleanCombination combination) {
            return name + "(" + combination.operator().symbol() + ")";
        }
        if (node instanceof Expression.MethodCall call) {
            return name + "(" + call.name() + ")";
        }
        return name;
    }
}
