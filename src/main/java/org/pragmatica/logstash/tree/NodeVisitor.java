package org.pragmatica.logstash.tree;

/**
 * Visitor over every node type, with an input threaded through the traversal.
 *
 * @param <I> input passed down by the caller (render indent, value context, ...)
 * @param <O> result of visiting a node
 */
public interface NodeVisitor<I, O> {
    O visitString(Literal.QuotedString node, I input);

    O visitBareword(Literal.Bareword node, I input);

    O visitNumber(Literal.Numeric node, I input);

    O visitBoolean(Literal.Bool node, I input);

    O visitRegex(Literal.Regex node, I input);

    O visitSelector(Literal.Selector node, I input);

    O visitArray(Composite.ArrayValue node, I input);

    O visitMap(Composite.MapValue node, I input);

    O visitMapEntry(Composite.MapEntry node, I input);

    O visitAttribute(Declaration.Attribute node, I input);

    O visitPlugin(Declaration.Plugin node, I input);

    O visitComparison(Expression.Comparison node, I input);

    O visitRegexMatch(Expression.RegexMatch node, I input);

    O visitMembership(Expression.Membership node, I input);

    O visitNegation(Expression.Negation node, I input);

    O visitBooleanCombination(Expression.BooleanCombination node, I input);

    O visitMethodCall(Expression.MethodCall node, I input);

    O visitRValue(Expression.RValue node, I input);

    O visitIf(Clause.If node, I input);

    O visitElseIf(Clause.ElseIf node, I input);

    O visitElse(Clause.Else node, I input);

    O visitBranch(Branch node, I input);

    O visitSection(Section node, I input);

    O visitDocument(Document node, I input);
}
