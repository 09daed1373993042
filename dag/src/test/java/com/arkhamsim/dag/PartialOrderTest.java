package com.arkhamsim.dag;

import com.arkhamsim.dag.exceptions.CycleException;
import com.arkhamsim.dag.exceptions.GraphInvariantViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.arkhamsim.dag.TestLocationFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class PartialOrderTest {

    @Nested
    @DisplayName("addEdge")
    class AddEdge {
        @Test
        void reverseEdge_isRejected() {
            var po = new PartialOrder<Location>();
            po.addNode(A);
            po.addNode(B);
            po.addEdge(A, B);

            var ex = assertThrows(CycleException.class, () -> po.addEdge(B, A));
            assertEquals(B, ex.tail());
            assertEquals(A, ex.head());
            assertEquals(Set.of(new Edge<>(A, B)), po.edges());
        }

        @Test
        void transitiveShortcut_isAllowed_butClosingEdgeIsNot() {
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            po.addEdge(B, C);
            po.addEdge(A, C);
            assertThrows(CycleException.class, () -> po.addEdge(C, A));
            assertEquals(3, po.edges().size());
        }

        @Test
        void selfLoop_isAlwaysRejected() {
            var po = new PartialOrder<Location>();
            assertThrows(CycleException.class, () -> po.addEdge(A, A));
            // also for a node nobody has seen yet: nothing is inserted
            assertTrue(po.nodes().isEmpty());

            po.addNode(B);
            assertThrows(CycleException.class, () -> po.addEdge(B, B));
        }

        @Test
        void rejection_doesNotMutate() {
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            po.addEdge(B, C);
            po.addEdge(C, D);
            var before = po.snapshot();

            assertThrows(CycleException.class, () -> po.addEdge(D, A));
            assertEquals(before, po.snapshot());
        }

        @Test
        void duplicateEdge_isANoOp() {
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            po.addEdge(A, B);
            assertEquals(Set.of(new Edge<>(A, B)), po.edges());
        }

        @Test
        void diamond_isNotMistakenForACycle() {
            // A→B→D and A→C→D: the search from A meets D twice on different branches
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            po.addEdge(A, C);
            po.addEdge(B, D);
            po.addEdge(C, D);

            po.addEdge(E, A);
            assertThrows(CycleException.class, () -> po.addEdge(D, E));
            assertEquals(5, po.edges().size());
        }

        @Test
        void preExistingCycle_isReportedAsInvariantViolation() {
            var corrupted = new DirectedGraph<Location>();
            corrupted.addEdge(A, B);
            corrupted.addEdge(B, A);
            var po = new PartialOrder<>(corrupted);

            var ex = assertThrows(GraphInvariantViolationException.class, () -> po.addEdge(C, A));
            assertTrue(ex.getMessage().contains("contains a cycle"), ex.getMessage());
            assertFalse(po.containsNode(C));
        }
    }

    @Nested
    @DisplayName("tryAddEdge")
    class TryAddEdge {
        @Test
        void returnsEdgeOnSuccess() {
            var po = new PartialOrder<Location>();
            assertEquals(new Edge<>(A, B), po.tryAddEdge(A, B).valueOrThrow());
        }

        @Test
        void returnsErrorOnCycle() {
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            var errs = po.tryAddEdge(B, A).errorsOrThrow();
            assertEquals(1, errs.size());
            assertTrue(errs.get(0).contains("creates a cycle"), errs.get(0));
        }

        @Test
        void stillThrowsOnCorruptedGraph() {
            var corrupted = new DirectedGraph<Location>();
            corrupted.addEdge(A, B);
            corrupted.addEdge(B, A);
            var po = new PartialOrder<>(corrupted);
            assertThrows(GraphInvariantViolationException.class, () -> po.tryAddEdge(C, A));
        }
    }

    @Nested
    @DisplayName("reaches")
    class Reaches {
        @Test
        void isReflexiveAndTransitive() {
            var po = new PartialOrder<Location>();
            po.addEdge(A, B);
            po.addEdge(B, C);
            assertTrue(po.reaches(A, A));
            assertTrue(po.reaches(E, E));
            assertTrue(po.reaches(A, C));
            assertFalse(po.reaches(C, A));
            assertFalse(po.reaches(A, E));
        }
    }

    @Test
    void topologicalGenerations_followTheOrder() {
        var po = new PartialOrder<Location>();
        po.addEdge(NORTHSIDE, DOWNTOWN);
        po.addEdge(DOWNTOWN, MISKATONIC_U);
        po.addEdge(NORTHSIDE, MISKATONIC_U);
        assertEquals(List.of(Set.of(NORTHSIDE), Set.of(DOWNTOWN), Set.of(MISKATONIC_U)),
                po.topologicalGenerations());
    }

    @Test
    void randomInsertions_neverLeaveACycle() {
        var rnd = new Random(1234);
        var po = new PartialOrder<Integer>();
        int accepted = 0, rejected = 0;
        for (int i = 0; i < 500; i++) {
            int t = rnd.nextInt(20), h = rnd.nextInt(20);
            var before = po.snapshot();
            try {
                po.addEdge(t, h);
                accepted++;
            } catch (CycleException e) {
                rejected++;
                assertEquals(before, po.snapshot());
            }
            // throws IllegalStateException if a cycle slipped through
            assertDoesNotThrow(() -> { po.topologicalGenerations(); });
        }
        assertTrue(accepted > 0);
        assertTrue(rejected > 0);
    }
}
