package org.pragmatica.logstash.canonical;

import java.util.Set;

/**
 * Keys of the canonical tagged tree. Each node serializes as a single-key object whose key is its tag.
 */
public final class TreeTags {
    private TreeTags() {
    }

    public static final String STRING = "ls_string";
    public static final String BAREWORD = "ls_bare_word";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";
    public static final String REGEX = "regexp";
    public static final String SELECTOR = "selector_node";
    public static final String ARRAY = "array";
    public static final String HASH = "hash";
    public static final String PLUGIN = "plugin";
    public static final String COMPARISON = "compare_expression";
    public static final String REGEX_MATCH = "regex_expression";
    public static final String IN = "in_expression";
    public static final String NOT_IN = "not_in_expression";
    public static final String NEGATION = "negative_expression";
    public static final String BOOLEAN_COMBINATION = "boolean_expression";
    public static final String METHOD_CALL = "method_call";
    public static final String IF = "if_condition";
    public static final String ELSE_IF = "else_if_condition";
    public static final String ELSE = "else_condition";
    public static final String BRANCH = "branch";
    public static final String SECTION = "plugin_section";
    public static final String CONFIG = "config";

    // Field names
    public static final String PLUGIN_NAME = "plugin_name";
    public static final String ATTRIBUTES = "attributes";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String OPERATOR = "operator";
    public static final String PATTERN = "pattern";
    public static final String VALUE = "value";
    public static final String COLLECTION = "collection";
    public static final String EXPRESSION = "expression";
    public static final String METHOD_NAME = "method_name";
    public static final String ARGUMENTS = "arguments";
    public static final String EXPR = "expr";
    public static final String BODY = "body";

    public static final Set<String> ALL = Set.of(STRING, BAREWORD, NUMBER, BOOLEAN, REGEX, SELECTOR, ARRAY, HASH,
                                                  PLUGIN, COMPARISON, REGEX_MATCH, IN, NOT_IN, NEGATION,
                                                  BOOLEAN_COMBINATION, METHOD_CALL, IF, ELSE_IF, ELSE, BRANCH,
                                                  SECTION, CONFIG);

    public static boolean isTag(String key) {
        return ALL.contains(key);
    }
}
