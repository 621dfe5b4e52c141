package org.dxworks.uischema.analyzer;

import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/**
 * Grammars a component source can be parsed with, in the order they are tried.
 */
public enum SourceDialect {
    TYPESCRIPT("typescript"),
    // The JavaScript grammar is the one that understands JSX markup
    JAVASCRIPT_JSX("javascript-jsx");

    private static final TSLanguage TS_LANGUAGE = new TreeSitterTypescript();
    private static final TSLanguage JS_LANGUAGE = new TreeSitterJavascript();

    private final String name;

    SourceDialect(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    TSLanguage grammar() {
        return this == TYPESCRIPT ? TS_LANGUAGE : JS_LANGUAGE;
    }
}
