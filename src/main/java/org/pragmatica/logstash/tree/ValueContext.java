package org.pragmatica.logstash.tree;

/**
 * Where a node's value is consumed. Operands of guard expressions read as their expression
 * text (strings keep their quotes), plain attribute values read as decoded values.
 */
public enum ValueContext {
    PLAIN,
    EXPRESSION
}
