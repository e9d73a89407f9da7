package org.strata.diff.core;

import org.strata.diff.graph.Vertex;
import org.strata.syntax.ListNode;
import org.strata.syntax.SyntaxNode;
import org.strata.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Folds a reconstructed edit path into a {@link ChangeMap}.
 *
 * <p>Each move classifies the node(s) under the cursors of its source vertex:</p>
 * <ul>
 * <li>unchanged node: both subtrees, pairwise, as {@link ChangeKind#UNCHANGED},</li>
 * <li>unchanged delimiter: the two list nodes only; their children are classified by later moves,</li>
 * <li>replaced string/comment: both atoms with the refinement kind,</li>
 * <li>novel moves: the single node on that side,</li>
 * <li>exits: nothing.</li>
 * </ul>
 */
final class ChangeMapPopulator {
    static final String REASON_NODE_UNCLASSIFIED = "DIFF_NODE_UNCLASSIFIED";

    private ChangeMapPopulator() {
    }

    /**
     * Classifies every node touched by {@code steps}.
     */
    static void populate(List<PathStep> steps, ChangeMap changeMap) {
        for (PathStep step : steps) {
            Vertex from = step.from();
            SyntaxNode lhs = from.lhsSyntax();
            SyntaxNode rhs = from.rhsSyntax();
            switch (step.edge().kind()) {
                case UNCHANGED_NODE -> insertDeepUnchanged(lhs, rhs, changeMap);
                case ENTER_UNCHANGED_DELIMITER -> {
                    changeMap.insert(lhs, ChangeKind.UNCHANGED, rhs);
                    changeMap.insert(rhs, ChangeKind.UNCHANGED, lhs);
                }
                case REPLACED_STRING -> {
                    changeMap.insert(lhs, ChangeKind.REPLACED_STRING, rhs);
                    changeMap.insert(rhs, ChangeKind.REPLACED_STRING, lhs);
                }
                case REPLACED_COMMENT -> {
                    changeMap.insert(lhs, ChangeKind.REPLACED_COMMENT, rhs);
                    changeMap.insert(rhs, ChangeKind.REPLACED_COMMENT, lhs);
                }
                case NOVEL_ATOM_LHS, ENTER_NOVEL_DELIMITER_LHS -> changeMap.insert(lhs, ChangeKind.NOVEL_OLD, null);
                case NOVEL_ATOM_RHS, ENTER_NOVEL_DELIMITER_RHS -> changeMap.insert(rhs, ChangeKind.NOVEL_NEW, null);
                case EXIT_DELIMITER_BOTH, EXIT_DELIMITER_LHS, EXIT_DELIMITER_RHS -> {
                    // Leaving a list consumes no node.
                }
            }
        }
    }

    /**
     * Verifies that every node of both trees received a classification.
     *
     * @throws DiffInvariantException naming the first unclassified node.
     */
    static void requireComplete(SyntaxTree lhs, SyntaxTree rhs, ChangeMap changeMap) {
        requireComplete(lhs, changeMap, "old");
        requireComplete(rhs, changeMap, "new");
    }

    private static void requireComplete(SyntaxTree tree, ChangeMap changeMap, String side) {
        tree.forEachNode(node -> {
            if (!changeMap.contains(node)) {
                throw new DiffInvariantException(
                        REASON_NODE_UNCLASSIFIED,
                        side + "-side node " + node + " was not classified"
                );
            }
        });
    }

    /**
     * Marks two structurally equal subtrees unchanged, pairing nodes position by position.
     */
    private static void insertDeepUnchanged(SyntaxNode lhs, SyntaxNode rhs, ChangeMap changeMap) {
        ArrayDeque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(rhs);
        pending.push(lhs);
        while (!pending.isEmpty()) {
            SyntaxNode left = pending.pop();
            SyntaxNode right = pending.pop();
            changeMap.insert(left, ChangeKind.UNCHANGED, right);
            changeMap.insert(right, ChangeKind.UNCHANGED, left);
            if (left instanceof ListNode && right instanceof ListNode) {
                List<SyntaxNode> leftChildren = ((ListNode) left).children();
                List<SyntaxNode> rightChildren = ((ListNode) right).children();
                for (int i = leftChildren.size() - 1; i >= 0; i--) {
                    pending.push(rightChildren.get(i));
                    pending.push(leftChildren.get(i));
                }
            }
        }
    }
}
