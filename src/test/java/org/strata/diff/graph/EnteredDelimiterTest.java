package org.strata.diff.graph;

import org.strata.syntax.ListNode;
import org.strata.syntax.SyntaxArena;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entered Delimiter Stack Tests")
class EnteredDelimiterTest {

    private ListNode lhsOuter;
    private ListNode lhsInner;
    private ListNode rhsList;

    @BeforeEach
    void setUp() {
        SyntaxArena arena = new SyntaxArena();
        lhsInner = arena.list("[", "]", arena.atom("x"));
        lhsOuter = arena.list("(", ")", lhsInner);
        rhsList = arena.list("(", ")", arena.atom("y"));
    }

    @Test
    @DisplayName("Novel entries on the same side extend one pop-either frame")
    void testNovelEntriesShareFrame() {
        PersistentStack<EnteredDelimiter> entered = PersistentStack.empty();
        entered = EnteredDelimiter.pushLhs(entered, lhsOuter);
        entered = EnteredDelimiter.pushLhs(entered, lhsInner);
        entered = EnteredDelimiter.pushRhs(entered, rhsList);

        assertEquals(1, entered.size());
        EnteredDelimiter top = entered.peek();
        assertEquals(EnteredDelimiter.Kind.POP_EITHER, top.kind());
        assertEquals(2, top.lhsDelimiters().size());
        assertEquals(1, top.rhsDelimiters().size());
    }

    @Test
    @DisplayName("Popping the lhs side leaves innermost first and keeps the rhs side")
    void testPopLhsOrder() {
        PersistentStack<EnteredDelimiter> entered = PersistentStack.empty();
        entered = EnteredDelimiter.pushLhs(entered, lhsOuter);
        entered = EnteredDelimiter.pushLhs(entered, lhsInner);
        entered = EnteredDelimiter.pushRhs(entered, rhsList);

        EnteredDelimiter.Popped first = EnteredDelimiter.tryPopLhs(entered);
        assertNotNull(first);
        assertSame(lhsInner, first.lhsList());
        EnteredDelimiter.Popped second = EnteredDelimiter.tryPopLhs(first.remaining());
        assertSame(lhsOuter, second.lhsList());
        assertNull(EnteredDelimiter.tryPopLhs(second.remaining()), "lhs side exhausted");

        EnteredDelimiter.Popped rhs = EnteredDelimiter.tryPopRhs(second.remaining());
        assertSame(rhsList, rhs.rhsList());
        assertTrue(rhs.remaining().isEmpty(), "Empty frames are dropped");
    }

    @Test
    @DisplayName("Pairs entered together must be left together")
    void testPopBoth() {
        PersistentStack<EnteredDelimiter> entered = EnteredDelimiter.pushBoth(PersistentStack.empty(), lhsOuter, rhsList);

        assertNull(EnteredDelimiter.tryPopLhs(entered));
        assertNull(EnteredDelimiter.tryPopRhs(entered));
        EnteredDelimiter.Popped popped = EnteredDelimiter.tryPopBoth(entered);
        assertNotNull(popped);
        assertSame(lhsOuter, popped.lhsList());
        assertSame(rhsList, popped.rhsList());
        assertTrue(popped.remaining().isEmpty());
    }

    @Test
    @DisplayName("A pair entered inside a novel list shadows it until left")
    void testNestedFrames() {
        PersistentStack<EnteredDelimiter> entered = EnteredDelimiter.pushLhs(PersistentStack.empty(), lhsOuter);
        entered = EnteredDelimiter.pushBoth(entered, lhsInner, rhsList);
        entered = EnteredDelimiter.pushLhs(entered, lhsInner);

        assertEquals(3, entered.size(), "Novel entry above a pair opens a new frame");
        assertNull(EnteredDelimiter.tryPopBoth(entered));
        assertNull(EnteredDelimiter.tryPopBoth(PersistentStack.empty()));
    }

    @Test
    @DisplayName("Frames compare by content")
    void testEquality() {
        PersistentStack<EnteredDelimiter> first = EnteredDelimiter.pushBoth(PersistentStack.empty(), lhsOuter, rhsList);
        PersistentStack<EnteredDelimiter> second = EnteredDelimiter.pushBoth(PersistentStack.empty(), lhsOuter, rhsList);
        PersistentStack<EnteredDelimiter> other = EnteredDelimiter.pushBoth(PersistentStack.empty(), lhsInner, rhsList);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
    }
}
