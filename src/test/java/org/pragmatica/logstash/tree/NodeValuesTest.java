package org.pragmatica.logstash.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.logstash.tree.Expression.BooleanOperator;
import org.pragmatica.logstash.tree.Expression.ComparisonOperator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NodeValuesTest {

    private static Node field(String raw) {
        return new Expression.RValue(new Literal.Selector(raw));
    }

    private static Node number(String lexeme) {
        return new Expression.RValue(Literal.Numeric.parse(lexeme));
    }

    @Test
    void literals_plainContext_yieldDecodedValues() {
        assertThat(NodeValues.of(Literal.QuotedString.parse("'a\\tb'"))).isEqualTo("a\tb");
        assertThat(NodeValues.of(Literal.Numeric.parse("7"))).isEqualTo(7L);
        assertThat(NodeValues.of(Literal.Numeric.parse("7.25"))).isEqualTo(7.25);
        assertThat(NodeValues.of(new Literal.Bool(false))).isEqualTo(false);
        assertThat(NodeValues.of(new Literal.Regex("x+"))).isEqualTo("/x+/");
        assertThat(NodeValues.of(new Literal.Selector("[a][b]"))).isEqualTo("[a][b]");
    }

    @Test
    void literals_expressionContext_yieldSourceText() {
        assertThat(NodeValues.of(Literal.QuotedString.parse("'x'"), ValueContext.EXPRESSION)).isEqualTo("'x'");
        assertThat(NodeValues.of(Literal.Numeric.parse("1.50"), ValueContext.EXPRESSION)).isEqualTo("1.5");
        assertThat(NodeValues.of(new Literal.Bool(true), ValueContext.EXPRESSION)).isEqualTo("true");
    }

    @Test
    void composites_yieldCollections() {
        var array = Composite.ArrayValue.of(Literal.QuotedString.of("a"), Literal.Numeric.of(1));
        var map = Composite.MapValue.of(new Composite.MapEntry(new Literal.Bareword("kk"), Literal.Numeric.of(1)),
                                        new Composite.MapEntry(Literal.QuotedString.of("s"), array));

        assertThat(NodeValues.of(array)).isEqualTo(List.of("a", 1L));
        assertThat(NodeValues.of(map)).isEqualTo(Map.of("kk", 1L, "s", List.of("a", 1L)));
    }

    @Test
    void map_equality_ignoresEntryOrder() {
        var first = Composite.MapValue.of(new Composite.MapEntry(new Literal.Bareword("aa"), Literal.Numeric.of(1)),
                                          new Composite.MapEntry(new Literal.Bareword("bb"), Literal.Numeric.of(2)));
        var second = Composite.MapValue.of(new Composite.MapEntry(new Literal.Bareword("bb"), Literal.Numeric.of(2)),
                                           new Composite.MapEntry(new Literal.Bareword("aa"), Literal.Numeric.of(1)));

        assertThat(NodeValues.of(first)).isEqualTo(NodeValues.of(second));
        assertThat(NodeValues.of(first)).isInstanceOf(LinkedHashMap.class);
    }

    @Test
    void plugin_yieldsNameToAttributeList() {
        var plugin = Declaration.Plugin.of("mutate",
                                           Declaration.Attribute.of("add_tag", Composite.ArrayValue.of(Literal.QuotedString.of("ok"))));

        assertThat(NodeValues.of(plugin)).isEqualTo(Map.of("mutate", List.of(Map.of("add_tag", List.of("ok")))));
    }

    @Test
    void expressions_yieldCanonicalText() {
        var lower = new Expression.Comparison(field("[status]"), ComparisonOperator.GE, number("200"));
        var upper = new Expression.Comparison(field("[status]"), ComparisonOperator.LT, number("300"));
        var combination = new Expression.BooleanCombination(lower, BooleanOperator.AND, upper);

        assertThat(NodeValues.expressionText(lower)).isEqualTo("[status] >= 200");
        assertThat(NodeValues.expressionText(combination)).isEqualTo("([status] >= 200 and [status] < 300)");
        assertThat(NodeValues.expressionText(new Expression.Negation(field("[f]")))).isEqualTo("!([f])");
    }

    @Test
    void expressions_operandsKeepQuotes() {
        var membership = new Expression.Membership(new Expression.RValue(Literal.QuotedString.of("x")),
                                                   new Expression.RValue(Composite.ArrayValue.of(Literal.QuotedString.of("x"),
                                                                                                 Literal.Numeric.of(2))),
                                                   true);
        var call = Expression.MethodCall.of("lower", new Literal.Selector("[a]"), Literal.QuotedString.of("b"));
        var match = new Expression.RegexMatch(field("[a]"), Expression.RegexOperator.MATCH, new Literal.Regex("^x"));

        assertThat(NodeValues.expressionText(membership)).isEqualTo("\"x\" not in [\"x\", 2]");
        assertThat(NodeValues.expressionText(call)).isEqualTo("lower([a], \"b\")");
        assertThat(NodeValues.expressionText(match)).isEqualTo("[a] =~ /^x/");
    }

    @Test
    void branch_yieldsClauseValues() {
        var body = List.<Statement>of(Declaration.Plugin.of("drop"));
        var branch = Branch.of(new Clause.If(field("[a]"), body),
                               new Clause.ElseIf(new Expression.Comparison(field("[b]"), ComparisonOperator.EQ, number("1")), body),
                               new Clause.Else(List.of()));

        @SuppressWarnings("unchecked")
        var clauses = (List<Map<String, Object>>) NodeValues.of(branch);

        assertThat(clauses).hasSize(3);
        assertThat(clauses.get(0)).containsEntry("if", "[a]")
                                  .containsEntry("body", List.of(Map.of("drop", List.of())));
        assertThat(clauses.get(1)).containsEntry("else if", "[b] == 1");
        assertThat(clauses.get(2)).containsEntry("else", List.of());
    }

    @Test
    void document_yieldsSectionList() {
        var document = Document.of(Section.of(SectionType.INPUT, Declaration.Plugin.of("stdin")),
                                   Section.of(SectionType.OUTPUT));

        assertThat(NodeValues.of(document)).isEqualTo(List.of(Map.of("input", List.of(Map.of("stdin", List.of()))),
                                                              Map.of("output", List.of())));
    }
}
