package org.strata.diff.graph;

import lombok.EqualsAndHashCode;
import org.strata.syntax.ListNode;

import java.util.Objects;

/**
 * Record of lists the cursors are currently inside.
 *
 * <ul>
 * <li>{@code POP_BOTH}: a pair of lists entered together via an unchanged delimiter; both sides
 * must finish their children before either can leave.</li>
 * <li>{@code POP_EITHER}: lists entered novelly on one side. Each side can leave its own lists
 * independently, innermost first.</li>
 * </ul>
 */
@EqualsAndHashCode
public final class EnteredDelimiter {

    public enum Kind {
        POP_BOTH,
        POP_EITHER
    }

    private final Kind kind;
    private final ListNode lhsList;
    private final ListNode rhsList;
    private final PersistentStack<ListNode> lhsDelimiters;
    private final PersistentStack<ListNode> rhsDelimiters;

    private EnteredDelimiter(
            Kind kind,
            ListNode lhsList,
            ListNode rhsList,
            PersistentStack<ListNode> lhsDelimiters,
            PersistentStack<ListNode> rhsDelimiters
    ) {
        this.kind = kind;
        this.lhsList = lhsList;
        this.rhsList = rhsList;
        this.lhsDelimiters = lhsDelimiters;
        this.rhsDelimiters = rhsDelimiters;
    }

    static EnteredDelimiter popBoth(ListNode lhsList, ListNode rhsList) {
        return new EnteredDelimiter(
                Kind.POP_BOTH,
                Objects.requireNonNull(lhsList, "lhsList"),
                Objects.requireNonNull(rhsList, "rhsList"),
                null,
                null
        );
    }

    static EnteredDelimiter popEither(PersistentStack<ListNode> lhsDelimiters, PersistentStack<ListNode> rhsDelimiters) {
        return new EnteredDelimiter(
                Kind.POP_EITHER,
                null,
                null,
                Objects.requireNonNull(lhsDelimiters, "lhsDelimiters"),
                Objects.requireNonNull(rhsDelimiters, "rhsDelimiters")
        );
    }

    public Kind kind() {
        return kind;
    }

    ListNode lhsList() {
        return lhsList;
    }

    ListNode rhsList() {
        return rhsList;
    }

    PersistentStack<ListNode> lhsDelimiters() {
        return lhsDelimiters;
    }

    PersistentStack<ListNode> rhsDelimiters() {
        return rhsDelimiters;
    }

    // ------------------------------------------------------------------------
    // Stack transitions
    // ------------------------------------------------------------------------

    /**
     * Records a list entered novelly on the old side.
     */
    static PersistentStack<EnteredDelimiter> pushLhs(PersistentStack<EnteredDelimiter> entered, ListNode list) {
        EnteredDelimiter top = entered.peek();
        if (top != null && top.kind == Kind.POP_EITHER) {
            return entered.pop().push(popEither(top.lhsDelimiters.push(list), top.rhsDelimiters));
        }
        return entered.push(popEither(PersistentStack.<ListNode>empty().push(list), PersistentStack.empty()));
    }

    /**
     * Records a list entered novelly on the new side.
     */
    static PersistentStack<EnteredDelimiter> pushRhs(PersistentStack<EnteredDelimiter> entered, ListNode list) {
        EnteredDelimiter top = entered.peek();
        if (top != null && top.kind == Kind.POP_EITHER) {
            return entered.pop().push(popEither(top.lhsDelimiters, top.rhsDelimiters.push(list)));
        }
        return entered.push(popEither(PersistentStack.empty(), PersistentStack.<ListNode>empty().push(list)));
    }

    /**
     * Records a pair of lists entered together.
     */
    static PersistentStack<EnteredDelimiter> pushBoth(
            PersistentStack<EnteredDelimiter> entered,
            ListNode lhsList,
            ListNode rhsList
    ) {
        return entered.push(popBoth(lhsList, rhsList));
    }

    /**
     * Result of leaving one list: the list that was left and the remaining stack.
     */
    record Popped(ListNode lhsList, ListNode rhsList, PersistentStack<EnteredDelimiter> remaining) {
    }

    /**
     * Leaves the innermost pair entered together, or returns {@code null} if the top is not a pair.
     */
    static Popped tryPopBoth(PersistentStack<EnteredDelimiter> entered) {
        EnteredDelimiter top = entered.peek();
        if (top == null || top.kind != Kind.POP_BOTH) {
            return null;
        }
        return new Popped(top.lhsList, top.rhsList, entered.pop());
    }

    /**
     * Leaves the innermost novel old-side list, or returns {@code null} when there is none on top.
     */
    static Popped tryPopLhs(PersistentStack<EnteredDelimiter> entered) {
        EnteredDelimiter top = entered.peek();
        if (top == null || top.kind != Kind.POP_EITHER || top.lhsDelimiters.isEmpty()) {
            return null;
        }
        PersistentStack<ListNode> remainingLhs = top.lhsDelimiters.pop();
        PersistentStack<EnteredDelimiter> remaining = entered.pop();
        if (!remainingLhs.isEmpty() || !top.rhsDelimiters.isEmpty()) {
            remaining = remaining.push(popEither(remainingLhs, top.rhsDelimiters));
        }
        return new Popped(top.lhsDelimiters.peek(), null, remaining);
    }

    /**
     * Leaves the innermost novel new-side list, or returns {@code null} when there is none on top.
     */
    static Popped tryPopRhs(PersistentStack<EnteredDelimiter> entered) {
        EnteredDelimiter top = entered.peek();
        if (top == null || top.kind != Kind.POP_EITHER || top.rhsDelimiters.isEmpty()) {
            return null;
        }
        PersistentStack<ListNode> remainingRhs = top.rhsDelimiters.pop();
        PersistentStack<EnteredDelimiter> remaining = entered.pop();
        if (!top.lhsDelimiters.isEmpty() || !remainingRhs.isEmpty()) {
            remaining = remaining.push(popEither(top.lhsDelimiters, remainingRhs));
        }
        return new Popped(null, top.rhsDelimiters.peek(), remaining);
    }

    @Override
    public String toString() {
        if (kind == Kind.POP_BOTH) {
            return "PopBoth{" + lhsList.id() + "," + rhsList.id() + '}';
        }
        return "PopEither{lhs=" + lhsDelimiters.size() + ",rhs=" + rhsDelimiters.size() + '}';
    }
}
