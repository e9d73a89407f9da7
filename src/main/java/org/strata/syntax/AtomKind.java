package org.strata.syntax;

/**
 * Lexical category of an atom. Only string literals and comments are eligible for
 * replacement moves; every other token either matches exactly or is novel.
 */
public enum AtomKind {
    NORMAL,
    STRING,
    COMMENT
}
