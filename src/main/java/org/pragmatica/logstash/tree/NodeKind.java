package org.pragmatica.logstash.tree;

/**
 * Kinds of configuration tree nodes. Also used to pick the grammar rule when parsing a fragment.
 * {@link #VALUE} and {@link #CONDITION} are parse targets only: they accept any attribute value
 * or any guard expression respectively and are never reported by {@link Node#kind()}.
 */
public enum NodeKind {
    STRING,
    BAREWORD,
    NUMBER,
    BOOLEAN,
    REGEX,
    SELECTOR,
    ARRAY,
    MAP,
    MAP_ENTRY,
    ATTRIBUTE,
    PLUGIN,
    COMPARISON,
    REGEX_MATCH,
    MEMBERSHIP,
    NEGATION,
    BOOLEAN_COMBINATION,
    METHOD_CALL,
    RVALUE,
    IF,
    ELSE_IF,
    ELSE,
    BRANCH,
    SECTION,
    DOCUMENT,
    VALUE,
    CONDITION
}
