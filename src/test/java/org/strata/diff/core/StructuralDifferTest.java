package org.strata.diff.core;

import org.strata.diff.search.FrontierQueueType;
import org.strata.syntax.AtomNode;
import org.strata.syntax.ListNode;
import org.strata.syntax.SyntaxArena;
import org.strata.syntax.SyntaxNode;
import org.strata.syntax.SyntaxTree;
import org.strata.testutil.RandomTrees;
import org.strata.testutil.SyntaxFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Structural Differ Tests")
class StructuralDifferTest {

    private SyntaxArena arena;
    private StructuralDiffer differ;

    @BeforeEach
    void setUp() {
        arena = new SyntaxArena();
        differ = StructuralDiffer.builder()
                .config(DiffConfig.builder().graphLimit(1_000_000).build())
                .build();
    }

    private SyntaxTree parse(String source) {
        return SyntaxFixtures.parse(arena, source);
    }

    private static void assertAllClassified(SyntaxTree lhs, SyntaxTree rhs, ChangeMap map) {
        for (SyntaxNode node : SyntaxFixtures.allNodes(lhs)) {
            ChangeKind kind = map.kindOf(node);
            assertNotNull(kind, "old-side node " + node + " unclassified");
            assertNotEquals(ChangeKind.NOVEL_NEW, kind, "old-side node marked as new");
        }
        for (SyntaxNode node : SyntaxFixtures.allNodes(rhs)) {
            ChangeKind kind = map.kindOf(node);
            assertNotNull(kind, "new-side node " + node + " unclassified");
            assertNotEquals(ChangeKind.NOVEL_OLD, kind, "new-side node marked as old");
        }
    }

    @Nested
    @DisplayName("1. Alignments")
    class AlignmentTests {

        @Test
        @DisplayName("Identical trees are fully unchanged at zero cost")
        void testIdentity() {
            SyntaxTree lhs = parse("(a [b \"s\"]) ; note\n c");
            SyntaxTree rhs = parse("(a [b \"s\"]) ; note\n c");

            DiffResult result = differ.diff(lhs, rhs);

            assertTrue(result.isCompleted());
            assertEquals(0L, result.totalCost());
            ChangeMap map = result.changeMap();
            assertTrue(map.isSealed());
            assertEquals(lhs.nodeCount() + rhs.nodeCount(), map.countOf(ChangeKind.UNCHANGED));

            List<SyntaxNode> left = SyntaxFixtures.allNodes(lhs);
            List<SyntaxNode> right = SyntaxFixtures.allNodes(rhs);
            for (int i = 0; i < left.size(); i++) {
                assertSame(right.get(i), map.opposite(left.get(i)), "Nodes pair up position by position");
                assertSame(left.get(i), map.opposite(right.get(i)));
            }
        }

        @Test
        @DisplayName("Disjoint trees are entirely novel")
        void testDisjoint() {
            SyntaxTree lhs = parse("a (b)");
            SyntaxTree rhs = parse("[c] d");

            DiffResult result = differ.diff(lhs, rhs);

            assertEquals(1800L, result.totalCost());
            assertEquals(3, result.changeMap().countOf(ChangeKind.NOVEL_OLD));
            assertEquals(3, result.changeMap().countOf(ChangeKind.NOVEL_NEW));
            assertNull(result.changeMap().opposite(lhs.firstRoot()));
        }

        @Test
        @DisplayName("Changed atom inside equal delimiters keeps the list unchanged")
        void testChangedAtomInList() {
            SyntaxTree lhs = parse("[foo]");
            SyntaxTree rhs = parse("[bar]");

            DiffResult result = differ.diff(lhs, rhs);
            ChangeMap map = result.changeMap();

            assertEquals(600L, result.totalCost());
            assertEquals(ChangeKind.UNCHANGED, map.kindOf(lhs.firstRoot()));
            assertSame(rhs.firstRoot(), map.opposite(lhs.firstRoot()));
            assertEquals(ChangeKind.NOVEL_OLD, map.kindOf(SyntaxFixtures.findAtom(lhs, "foo")));
            assertEquals(ChangeKind.NOVEL_NEW, map.kindOf(SyntaxFixtures.findAtom(rhs, "bar")));
        }

        @Test
        @DisplayName("An inserted atom is the only novel node")
        void testInsertion() {
            SyntaxTree lhs = parse("a b");
            SyntaxTree rhs = parse("a x b");

            DiffResult result = differ.diff(lhs, rhs);
            ChangeMap map = result.changeMap();

            assertEquals(300L, result.totalCost());
            assertEquals(ChangeKind.NOVEL_NEW, map.kindOf(SyntaxFixtures.findAtom(rhs, "x")));
            assertSame(SyntaxFixtures.findAtom(rhs, "b"), map.opposite(SyntaxFixtures.findAtom(lhs, "b")));
            assertEquals(4, map.countOf(ChangeKind.UNCHANGED));
        }

        @Test
        @DisplayName("Similar strings are paired as a replacement")
        void testStringReplacement() {
            SyntaxTree lhs = parse("(f \"abc\")");
            SyntaxTree rhs = parse("(f \"abd\")");

            DiffResult result = differ.diff(lhs, rhs);
            ChangeMap map = result.changeMap();
            AtomNode oldString = SyntaxFixtures.findAtom(lhs, "\"abc\"");
            AtomNode newString = SyntaxFixtures.findAtom(rhs, "\"abd\"");

            assertEquals(170L, result.totalCost());
            assertEquals(ChangeKind.REPLACED_STRING, map.kindOf(oldString));
            assertSame(newString, map.opposite(oldString));
            assertSame(oldString, map.opposite(newString));
        }

        @Test
        @DisplayName("Similar comments are paired as a replacement")
        void testCommentReplacement() {
            SyntaxTree lhs = parse("; counts the widgets");
            SyntaxTree rhs = parse("; counts the gadgets");

            ChangeMap map = differ.diff(lhs, rhs).changeMap();

            assertEquals(ChangeKind.REPLACED_COMMENT, map.kindOf(lhs.firstRoot()));
            assertEquals(ChangeKind.REPLACED_COMMENT, map.kindOf(rhs.firstRoot()));
        }

        @Test
        @DisplayName("Wrapping a node marks only the new list as novel")
        void testWrapping() {
            SyntaxTree lhs = parse("a");
            SyntaxTree rhs = parse("(a)");

            DiffResult result = differ.diff(lhs, rhs);
            ChangeMap map = result.changeMap();
            ListNode wrapper = (ListNode) rhs.firstRoot();

            assertEquals(301L, result.totalCost());
            assertEquals(ChangeKind.NOVEL_NEW, map.kindOf(wrapper));
            assertEquals(ChangeKind.UNCHANGED, map.kindOf(lhs.firstRoot()));
            assertSame(wrapper.firstChild(), map.opposite(lhs.firstRoot()));
        }

        @Test
        @DisplayName("Absent sides diff as empty trees")
        void testAbsentSides() {
            SyntaxTree rhs = parse("a (b)");

            DiffResult inserted = differ.diff(null, rhs);
            assertEquals(900L, inserted.totalCost());
            assertEquals(3, inserted.changeMap().countOf(ChangeKind.NOVEL_NEW));

            DiffResult nothing = differ.diff(null, SyntaxTree.empty());
            assertEquals(0L, nothing.totalCost());
            assertTrue(nothing.changeMap().isEmpty());
            assertEquals(0, nothing.stats().getPathLength());
        }
    }

    @Nested
    @DisplayName("2. Contracts")
    class ContractTests {

        @Test
        @DisplayName("Trees from different arenas are rejected")
        void testArenaMismatch() {
            SyntaxTree lhs = parse("a");
            SyntaxTree rhs = SyntaxFixtures.parse(new SyntaxArena(), "a");

            DiffEngineException ex = assertThrows(DiffEngineException.class, () -> differ.diff(lhs, rhs));
            assertEquals(StructuralDiffer.REASON_ARENA_MISMATCH, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[" + StructuralDiffer.REASON_ARENA_MISMATCH + "]"));
        }

        @Test
        @DisplayName("diffInto fills a caller-owned map and seals it")
        void testDiffInto() {
            SyntaxTree lhs = parse("a");
            SyntaxTree rhs = parse("b");
            ChangeMap target = new ChangeMap();

            DiffResult result = differ.diffInto(lhs, rhs, target);

            assertSame(target, result.changeMap());
            assertTrue(target.isSealed());
            assertEquals(2, target.size());
        }

        @Test
        @DisplayName("diffInto refuses non-empty or sealed maps")
        void testDiffIntoRejectsUsedMap() {
            SyntaxTree lhs = parse("a");
            SyntaxTree rhs = parse("a");

            ChangeMap used = differ.diff(lhs, rhs).changeMap();
            DiffEngineException ex = assertThrows(DiffEngineException.class, () -> differ.diffInto(lhs, rhs, used));
            assertEquals(StructuralDiffer.REASON_CHANGE_MAP_NOT_EMPTY, ex.getReasonCode());

            ChangeMap sealedEmpty = new ChangeMap();
            sealedEmpty.seal();
            assertThrows(DiffEngineException.class, () -> differ.diffInto(lhs, rhs, sealedEmpty));
            assertThrows(NullPointerException.class, () -> differ.diffInto(lhs, rhs, null));
        }

        @Test
        @DisplayName("Exceeding the graph limit returns a bail-out result")
        void testGraphLimit() {
            StructuralDiffer tight = StructuralDiffer.builder()
                    .config(DiffConfig.builder().graphLimit(5).build())
                    .build();
            SyntaxTree lhs = parse("(a b c) (d e f)");
            SyntaxTree rhs = parse("(f e d) (c b a)");
            ChangeMap target = new ChangeMap();

            DiffResult result = tight.diffInto(lhs, rhs, target);

            assertTrue(result.exceededGraphLimit());
            assertFalse(result.isCompleted());
            assertEquals(DiffResult.Outcome.EXCEEDED_GRAPH_LIMIT, result.outcome());
            assertEquals(5, result.stats().getGraphLimit());
            assertTrue(result.stats().getVerticesAllocated() > 5);
            assertThrows(IllegalStateException.class, result::changeMap);
            assertTrue(target.isEmpty(), "No partial classification is published");
            assertFalse(target.isSealed());
        }

        @Test
        @DisplayName("Default construction reads configuration")
        void testDefaults() {
            StructuralDiffer fromProperties = StructuralDiffer.create();
            assertNotNull(fromProperties.config());
            assertEquals(DiffConfig.DEFAULT_GRAPH_LIMIT, StructuralDiffer.builder().build().config().getGraphLimit());
        }
    }

    @Nested
    @DisplayName("3. Randomized Properties")
    class PropertyTests {

        @Test
        @DisplayName("Every node is classified and pairings are symmetric")
        void testCompleteness() {
            RandomTrees trees = new RandomTrees(2024L, 3, 4);
            for (int round = 0; round < 40; round++) {
                SyntaxArena syntax = new SyntaxArena();
                SyntaxTree lhs = trees.next(syntax);
                SyntaxTree rhs = trees.next(syntax);

                ChangeMap map = differ.diff(lhs, rhs).changeMap();

                assertAllClassified(lhs, rhs, map);
                assertEquals(lhs.nodeCount() + rhs.nodeCount(), map.size());
                for (SyntaxNode node : SyntaxFixtures.allNodes(lhs)) {
                    Change change = map.get(node);
                    if (change.kind().isPaired()) {
                        assertSame(node, map.opposite(change.opposite()));
                        if (change.kind() == ChangeKind.UNCHANGED && node.isAtom()) {
                            assertTrue(node.structurallyEquals(change.opposite()));
                        }
                    } else {
                        assertNull(change.opposite());
                    }
                }
            }
        }

        @Test
        @DisplayName("Diffing is deterministic and independent of the frontier")
        void testDeterminism() {
            StructuralDiffer heapDiffer = StructuralDiffer.builder()
                    .config(DiffConfig.builder().graphLimit(1_000_000).queueType(FrontierQueueType.HEAP).build())
                    .build();
            RandomTrees trees = new RandomTrees(99L, 3, 4);
            for (int round = 0; round < 20; round++) {
                SyntaxArena syntax = new SyntaxArena();
                SyntaxTree lhs = trees.next(syntax);
                SyntaxTree rhs = trees.next(syntax);

                DiffResult first = differ.diff(lhs, rhs);
                DiffResult second = differ.diff(lhs, rhs);
                DiffResult heap = heapDiffer.diff(lhs, rhs);

                assertEquals(first.totalCost(), second.totalCost());
                assertEquals(first.totalCost(), heap.totalCost());
                for (SyntaxNode node : SyntaxFixtures.allNodes(lhs)) {
                    assertEquals(first.changeMap().get(node), second.changeMap().get(node));
                    assertEquals(first.changeMap().get(node), heap.changeMap().get(node));
                }
            }
        }

        @Test
        @DisplayName("Traced settle distances are monotone and end at the total cost")
        void testTrace() {
            StructuralDiffer tracing = StructuralDiffer.builder()
                    .config(DiffConfig.builder().traceDistances(true).build())
                    .build();
            SyntaxTree lhs = parse("(a b) [c \"d\"]");
            SyntaxTree rhs = parse("(a c) [b \"e\"]");

            DiffResult result = tracing.diff(lhs, rhs);
            long[] trace = result.stats().getPoppedDistances();

            assertEquals(result.stats().getVerticesPopped(), trace.length);
            for (int i = 1; i < trace.length; i++) {
                assertTrue(trace[i - 1] <= trace[i]);
            }
            assertEquals(result.totalCost(), trace[trace.length - 1]);
            assertEquals(0, differ.diff(lhs, rhs).stats().getPoppedDistances().length, "Tracing is off by default");
        }
    }
}
