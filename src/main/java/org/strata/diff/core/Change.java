package org.strata.diff.core;

import org.strata.syntax.SyntaxNode;

/**
 * Change-map entry.
 *
 * @param kind classification.
 * @param opposite aligned node on the other side, or {@code null} for novel nodes.
 */
public record Change(ChangeKind kind, SyntaxNode opposite) {
}
