package org.pragmatica.logstash.tree;

/**
 * An item of a section or branch body: a plugin or a nested branch.
 */
public sealed interface Statement extends Node permits Declaration.Plugin, Branch {
}
