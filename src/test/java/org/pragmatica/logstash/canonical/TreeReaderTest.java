package org.pragmatica.logstash.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.pragmatica.logstash.error.TreeShapeException;
import org.pragmatica.logstash.parser.ConfigParser;
import org.pragmatica.logstash.render.SourceRenderer;
import org.pragmatica.logstash.tree.Composite;
import org.pragmatica.logstash.tree.Declaration;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Expression;
import org.pragmatica.logstash.tree.Literal;
import org.pragmatica.logstash.tree.NodeKind;
import org.pragmatica.logstash.tree.NodeValues;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeReaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode tree(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    // === Plain values ===

    @Test
    void fromTree_plainScalars_inferLiteralKind() throws JsonProcessingException {
        assertThat(TreeReader.fromTree(tree("\"rubydebug\""))).isEqualTo(new Literal.Bareword("rubydebug"));
        assertThat(TreeReader.fromTree(tree("\"two words\""))).isEqualTo(Literal.QuotedString.of("two words"));
        assertThat(TreeReader.fromTree(tree("\"x\""))).isEqualTo(Literal.QuotedString.of("x"));
        assertThat(TreeReader.fromTree(tree("42"))).isEqualTo(Literal.Numeric.of(42));
        assertThat(TreeReader.fromTree(tree("2.5"))).isEqualTo(Literal.Numeric.of(2.5));
        assertThat(TreeReader.fromTree(tree("true"))).isEqualTo(new Literal.Bool(true));
    }

    @Test
    void fromTree_hugeInteger_staysIntegral() throws JsonProcessingException {
        var number = (Literal.Numeric) TreeReader.fromTree(tree("123456789012345678901234"));

        assertThat(number.value()).isEqualTo(new BigInteger("123456789012345678901234"));
    }

    @Test
    void fromTree_plainContainers_becomeArrayAndHash() throws JsonProcessingException {
        var array = TreeReader.fromTree(tree("[1, \"ab\", [true]]"));
        var hash = TreeReader.fromTree(tree("{\"field_one\": 1, \"\\\"quoted\\\"\": \"value here\", \"7\": false}"));

        assertThat(array).isInstanceOf(Composite.ArrayValue.class);
        assertThat(NodeValues.of(array)).isEqualTo(List.of(1L, "ab", List.of(true)));
        var entries = ((Composite.MapValue) hash).entries();
        assertThat(entries).hasSize(3);
        assertThat(entries.get(0).key()).isEqualTo(new Literal.Bareword("field_one"));
        assertThat(entries.get(1).key()).isEqualTo(Literal.QuotedString.parse("\"quoted\""));
        assertThat(entries.get(2).key()).isEqualTo(Literal.Numeric.parse("7"));
    }

    @Test
    void fromTree_singleUntaggedKey_isHash() throws JsonProcessingException {
        var node = TreeReader.fromTree(tree("{\"add_tag\": [\"ok\"]}"));

        assertThat(node).isInstanceOf(Composite.MapValue.class);
    }

    // === Kind-directed reading ===

    @Test
    void fromTree_attributeKind_readsNameAndValue() throws JsonProcessingException {
        var attribute = (Declaration.Attribute) TreeReader.fromTree(tree("{\"add_tag\": {\"array\": [\"ok\"]}}"),
                                                                    NodeKind.ATTRIBUTE);
        var quoted = (Declaration.Attribute) TreeReader.fromTree(tree("{\"my field\": 1}"), NodeKind.ATTRIBUTE);

        assertThat(attribute.name()).isEqualTo(new Literal.Bareword("add_tag"));
        assertThat(attribute.value()).isInstanceOf(Composite.ArrayValue.class);
        assertThat(quoted.name()).isEqualTo(Literal.QuotedString.of("my field"));
    }

    @Test
    void fromTree_mapEntryKind_readsKey() throws JsonProcessingException {
        var entry = (Composite.MapEntry) TreeReader.fromTree(tree("{\"-5\": \"x y\"}"), NodeKind.MAP_ENTRY);

        assertThat(entry.key()).isEqualTo(Literal.Numeric.parse("-5"));
    }

    @Test
    void fromTree_rvalueKind_wrapsOperand() throws JsonProcessingException {
        var node = TreeReader.fromTree(tree("{\"selector_node\": \"[a]\"}"), NodeKind.RVALUE);

        assertThat(node).isEqualTo(new Expression.RValue(new Literal.Selector("[a]")));
    }

    @Test
    void fromTree_kindMismatch_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"number\": 1}"), NodeKind.STRING))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("Expected STRING");
    }

    // === Tagged values ===

    @Test
    void fromTree_regexpWithOrWithoutSlashes() throws JsonProcessingException {
        assertThat(TreeReader.fromTree(tree("{\"regexp\": \"/ab/\"}"))).isEqualTo(new Literal.Regex("ab"));
        assertThat(TreeReader.fromTree(tree("{\"regexp\": \"ab\"}"))).isEqualTo(new Literal.Regex("ab"));
    }

    @Test
    void fromTree_regexExpression_acceptsPlainPattern() throws JsonProcessingException {
        var match = (Expression.RegexMatch) TreeReader.fromTree(tree("""
            {"regex_expression": {"left": {"selector_node": "[a]"}, "operator": "!~", "pattern": "^x"}}"""));

        assertThat(match.operator()).isEqualTo(Expression.RegexOperator.NO_MATCH);
        assertThat(match.pattern()).isEqualTo(new Literal.Regex("^x"));
    }

    @Test
    void fromTree_pluginWithoutAttributes_isAccepted() throws JsonProcessingException {
        var plugin = TreeReader.fromTree(tree("{\"plugin\": {\"plugin_name\": \"drop\"}}"));

        assertThat(plugin).isEqualTo(Declaration.Plugin.of("drop"));
    }

    // === Shape errors ===

    @Test
    void fromTree_unknownField_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"plugin\": {\"plugin_name\": \"x1\", \"bogus\": 1}}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("unexpected field 'bogus'");
    }

    @Test
    void fromTree_missingField_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"compare_expression\": {\"left\": 1, \"operator\": \"==\"}}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("missing field 'right'");
    }

    @Test
    void fromTree_unknownOperator_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("""
            {"boolean_expression": {"left": 1, "operator": "but", "right": 2}}""")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("unknown operator 'but'");
    }

    @Test
    void fromTree_branchWithoutIf_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"branch\": [{\"else_condition\": []}]}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("must start with an if clause");
    }

    @Test
    void fromTree_attributeWithTwoKeys_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"aa\": 1, \"bb\": 2}"), NodeKind.ATTRIBUTE))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("exactly one key");
    }

    @Test
    void fromTree_sectionBodyWithValue_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"plugin_section\": {\"filter\": [1]}}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("plugin or branch");
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"plugin_section\": {\"middle\": []}}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("Unknown section type 'middle'");
    }

    @Test
    void fromTree_badLexemeOrNull_isRejected() {
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"ls_string\": \"no quotes\"}")))
                .isInstanceOf(TreeShapeException.class);
        assertThatThrownBy(() -> TreeReader.fromTree(JsonNodeFactory.instance.nullNode()))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("Null");
        assertThatThrownBy(() -> TreeReader.fromTree(tree("{\"number\": \"1\"}")))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("must be a number");
    }

    @Test
    void fromJson_malformedText_isRejected() {
        assertThatThrownBy(() -> CanonicalTree.create().fromJson("{\"config\": ["))
                .isInstanceOf(TreeShapeException.class)
                .hasMessageContaining("Malformed");
    }

    // === Round trips ===

    @Test
    void fromTree_ofWrittenTree_keepsValueAndSource() {
        var text = """
            input { beats { port => 5044 ssl => false } }
            filter {
              if [type] == "apache" and [status] in [200, 201] {
                grok { match => { "message" => "%{COMBINEDAPACHELOG}" } }
              } else if [path] =~ /\\/var\\/log/ or !([tags]) {
                mutate { 'rename' => { "old" => "new" } add_tag => [] }
              } else {
                drop {}
              }
            }
            output { elasticsearch { hosts => ["localhost:9200"] index => "logs-%{+YYYY.MM.dd}" codec => json { } } }
            """;
        var document = ConfigParser.create().parseDocument(text);
        var renderer = SourceRenderer.create();

        var restored = (Document) TreeReader.fromTree(TreeWriter.toTree(document));

        assertThat(NodeValues.of(restored)).isEqualTo(NodeValues.of(document));
        assertThat(renderer.render(restored)).isEqualTo(renderer.render(document));
        assertThat(TreeWriter.toTree(restored)).isEqualTo(TreeWriter.toTree(document));
    }

    @Test
    void fromTree_ofGroupedMixedTierCondition_keepsMeaning() {
        var parser = ConfigParser.create();
        var renderer = SourceRenderer.create();

        for (var text : List.of("filter { if [a] nand ([b] and [c]) { drop {} } }",
                                "filter { if [a] and ([b] xor [c]) { drop {} } }")) {
            var document = parser.parseDocument(text);

            var restored = (Document) TreeReader.fromTree(TreeWriter.toTree(document));
            var rendered = renderer.render(restored);

            assertThat(rendered).isEqualTo(renderer.render(document));
            assertThat(NodeValues.of(parser.parseDocument(rendered))).isEqualTo(NodeValues.of(document));
        }
    }
}
