package org.pragmatica.logstash.canonical;

import org.junit.jupiter.api.Test;
import org.pragmatica.logstash.parser.ConfigParser;
import org.pragmatica.logstash.tree.Branch;
import org.pragmatica.logstash.tree.Clause;
import org.pragmatica.logstash.tree.Composite;
import org.pragmatica.logstash.tree.Declaration;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Expression;
import org.pragmatica.logstash.tree.Expression.BooleanOperator;
import org.pragmatica.logstash.tree.Expression.ComparisonOperator;
import org.pragmatica.logstash.tree.Literal;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;
import org.pragmatica.logstash.tree.Section;
import org.pragmatica.logstash.tree.SectionType;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeWriterTest {

    private final CanonicalTree canonical = CanonicalTree.create();

    private String json(Node node) {
        return canonical.toJson(node);
    }

    private static Node field(String raw) {
        return new Expression.RValue(new Literal.Selector(raw));
    }

    // === Leaves ===

    @Test
    void toTree_leaves_useMinimalShape() {
        assertEquals("{\"number\":123}", json(Literal.Numeric.of(123)));
        assertEquals("{\"number\":2.5}", json(Literal.Numeric.parse("2.50")));
        assertEquals("{\"number\":123456789012345678901234}", json(Literal.Numeric.of(new BigInteger("123456789012345678901234"))));
        assertEquals("{\"ls_string\":\"\\\"hi\\\"\"}", json(Literal.QuotedString.of("hi")));
        assertEquals("{\"ls_string\":\"'hi'\"}", json(Literal.QuotedString.parse("'hi'")));
        assertEquals("{\"ls_bare_word\":\"rubydebug\"}", json(new Literal.Bareword("rubydebug")));
        assertEquals("{\"boolean\":true}", json(new Literal.Bool(true)));
        assertEquals("{\"regexp\":\"/^a\\\\/b/\"}", json(new Literal.Regex("^a\\/b")));
        assertEquals("{\"selector_node\":\"[field]\"}", json(new Literal.Selector("[field]")));
    }

    @Test
    void toTree_composites() {
        var map = Composite.MapValue.of(new Composite.MapEntry(Literal.QuotedString.of("k"), Literal.Numeric.of(1)),
                                        new Composite.MapEntry(new Literal.Bareword("bb"),
                                                               Composite.ArrayValue.of(new Literal.Bool(false))));

        assertEquals("{\"hash\":{\"\\\"k\\\"\":{\"number\":1},\"bb\":{\"array\":[{\"boolean\":false}]}}}", json(map));
        assertEquals("{\"bb\":{\"number\":2}}",
                     json(new Composite.MapEntry(new Literal.Bareword("bb"), Literal.Numeric.of(2))));
    }

    @Test
    void toTree_plugin_listsAttributes() {
        var plugin = Declaration.Plugin.of("mutate",
                                           Declaration.Attribute.of("add_tag", Composite.ArrayValue.of(Literal.QuotedString.of("ok"))));

        assertEquals("{\"plugin\":{\"plugin_name\":\"mutate\",\"attributes\":"
                     + "[{\"add_tag\":{\"array\":[{\"ls_string\":\"\\\"ok\\\"\"}]}}]}}",
                     json(plugin));
    }

    // === Expressions ===

    @Test
    void toTree_comparison_dropsRValueWrappers() {
        var comparison = new Expression.Comparison(field("[a]"), ComparisonOperator.GE, new Expression.RValue(Literal.Numeric.of(1)));

        assertEquals("{\"compare_expression\":{\"left\":{\"selector_node\":\"[a]\"},\"operator\":\">=\","
                     + "\"right\":{\"number\":1}}}",
                     json(comparison));
    }

    @Test
    void toTree_expressionFamily() {
        var match = new Expression.RegexMatch(field("[a]"), Expression.RegexOperator.MATCH, new Literal.Regex("x"));
        var in = new Expression.Membership(field("[a]"), field("[b]"), false);
        var notIn = new Expression.Membership(field("[a]"), field("[b]"), true);
        var negation = new Expression.Negation(field("[a]"));
        var combination = new Expression.BooleanCombination(field("[a]"), BooleanOperator.XOR, field("[b]"));
        var call = Expression.MethodCall.of("lower", new Literal.Selector("[a]"));

        assertEquals("{\"regex_expression\":{\"left\":{\"selector_node\":\"[a]\"},\"operator\":\"=~\","
                     + "\"pattern\":{\"regexp\":\"/x/\"}}}", json(match));
        assertEquals("{\"in_expression\":{\"value\":{\"selector_node\":\"[a]\"},\"operator\":\"in\","
                     + "\"collection\":{\"selector_node\":\"[b]\"}}}", json(in));
        assertEquals("{\"not_in_expression\":{\"value\":{\"selector_node\":\"[a]\"},\"operator\":\"not in\","
                     + "\"collection\":{\"selector_node\":\"[b]\"}}}", json(notIn));
        assertEquals("{\"negative_expression\":{\"operator\":\"!\",\"expression\":{\"selector_node\":\"[a]\"}}}",
                     json(negation));
        assertEquals("{\"boolean_expression\":{\"left\":{\"selector_node\":\"[a]\"},\"operator\":\"xor\","
                     + "\"right\":{\"selector_node\":\"[b]\"}}}", json(combination));
        assertEquals("{\"method_call\":{\"method_name\":\"lower\",\"arguments\":[{\"selector_node\":\"[a]\"}]}}",
                     json(call));
    }

    // === Control flow ===

    @Test
    void toTree_branchSectionAndDocument() {
        var branch = Branch.of(new Clause.If(field("[a]"), List.of(Declaration.Plugin.of("drop"))),
                               new Clause.ElseIf(field("[b]"), List.of()),
                               new Clause.Else(List.of()));
        var document = Document.of(Section.of(SectionType.FILTER, branch));

        assertEquals("{\"config\":[{\"plugin_section\":{\"filter\":[{\"branch\":["
                     + "{\"if_condition\":{\"expr\":{\"selector_node\":\"[a]\"},"
                     + "\"body\":[{\"plugin\":{\"plugin_name\":\"drop\",\"attributes\":[]}}]}},"
                     + "{\"else_if_condition\":{\"expr\":{\"selector_node\":\"[b]\"},\"body\":[]}},"
                     + "{\"else_condition\":[]}]}]}}]}",
                     json(document));
    }

    @Test
    void toTree_parsedAndBuiltNodes_giveSameTree() {
        var parsed = ConfigParser.create().parse("[a] >= 1", NodeKind.CONDITION, false);
        var built = new Expression.Comparison(new Literal.Selector("[a]"), ComparisonOperator.GE, Literal.Numeric.of(1));

        assertEquals(TreeWriter.toTree(built), TreeWriter.toTree(parsed));
    }

    @Test
    void toJson_prettyPrint_isMultiLine() {
        var pretty = CanonicalTree.create(new TreeConfig(true)).toJson(Literal.Numeric.of(1));

        assertTrue(pretty.contains("\n"));
        assertEquals(Literal.Numeric.of(1), canonical.fromJson(pretty));
    }

    @Test
    void toTree_hashWithRepeatedKey_keepsLastEntry() {
        var hash = ConfigParser.create().parse("{ xx => 1 xx => 2 }", NodeKind.MAP, false);

        assertEquals("{\"hash\":{\"xx\":{\"number\":2}}}", json(hash));
        assertEquals(1, ((Composite.MapValue) TreeReader.fromTree(TreeWriter.toTree(hash))).entries().size());
    }
}
