package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Conditional chain {@code if ... else if ... else ...}.
 * <p>
 * The clause order is checked on construction: exactly one {@link Clause.If} first, any number
 * of {@link Clause.ElseIf} after it, and at most one {@link Clause.Else}, which must be last.
 */
public record Branch(List<Clause> clauses, Optional<SourceSpan> span) implements Statement {

    public Branch {
        clauses = List.copyOf(clauses);
        Objects.requireNonNull(span, "span");
        checkOrder(clauses);
    }

    public Branch(List<Clause> clauses) {
        this(clauses, Optional.empty());
    }

    public static Branch of(Clause.If first, Clause... rest) {
        var list = new ArrayList<Clause>(rest.length + 1);
        list.add(first);
        list.addAll(List.of(rest));
        return new Branch(list);
    }

    private static void checkOrder(List<Clause> clauses) {
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("Branch must contain an if clause");
        }
        if (!(clauses.get(0) instanceof Clause.If)) {
            throw new IllegalArgumentException("Branch must start with an if clause, got " + clauses.get(0).kind());
        }
        for (int i = 1; i < clauses.size(); i++) {
            var clause = clauses.get(i);
            if (clause instanceof Clause.If) {
                throw new IllegalArgumentException("Branch may contain only one if clause, found another at position " + i);
            }
            if (clause instanceof Clause.Else && i != clauses.size() - 1) {
                throw new IllegalArgumentException("Else clause must be last in a branch, found at position " + i);
            }
        }
    }

    public Clause.If ifClause() {
        return (Clause.If) clauses.get(0);
    }

    public List<Clause.ElseIf> elseIfClauses() {
        return clauses.stream()
                      .filter(Clause.ElseIf.class::isInstance)
                      .map(Clause.ElseIf.class::cast)
                      .toList();
    }

    public Optional<Clause.Else> elseClause() {
        var last = clauses.get(clauses.size() - 1);
        return last instanceof Clause.Else elseClause ? Optional.of(elseClause) : Optional.empty();
    }

    @Override
    public List<Node> children() {
        return List.copyOf(clauses);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BRANCH;
    }

    @Override
    public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
        return visitor.visitBranch(this, input);
    }
}
