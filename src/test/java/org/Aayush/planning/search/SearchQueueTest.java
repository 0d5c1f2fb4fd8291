package org.Aayush.planning.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Queue Tests")
class SearchQueueTest {

    @Nested
    @DisplayName("1. SearchState Ordering")
    class SearchStateTests {

        @Test
        @DisplayName("Lower cost is smaller")
        void testCostComparison() {
            SearchState cheap = new SearchState();
            cheap.set(1, 10.0d, 0);
            SearchState dear = new SearchState();
            dear.set(1, 20.0d, 0);

            assertTrue(cheap.compareTo(dear) < 0, "cost 10 should sort before cost 20");
            assertTrue(dear.compareTo(cheap) > 0);
        }

        @Test
        @DisplayName("Equal costs break ties by vertex id")
        void testVertexTieBreak() {
            SearchState low = new SearchState();
            low.set(1, 10.0d, 0);
            SearchState high = new SearchState();
            high.set(2, 10.0d, 0);

            assertTrue(low.compareTo(high) < 0, "lower vertex id settles first on exact ties");
            SearchState same = new SearchState();
            same.set(1, 10.0d, 5);
            assertEquals(0, low.compareTo(same), "predecessor does not affect ordering");
        }
    }

    @Nested
    @DisplayName("2. Heap And Pool")
    class QueueTests {

        @Test
        @DisplayName("Extracts in cost order")
        void testHeapOrdering() {
            SearchQueue queue = new SearchQueue(10, 10);
            queue.insert(1, 50.0d, 0);
            queue.insert(2, 10.0d, 0);
            queue.insert(3, 30.0d, 0);

            double[] expected = {10.0d, 30.0d, 50.0d};
            for (double cost : expected) {
                SearchState s = queue.extractMin();
                assertEquals(cost, s.cost, 0.0d);
                queue.recycle(s);
            }
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("Decrease-key keeps one entry with the best cost and predecessor")
        void testDecreaseKey() {
            SearchQueue queue = new SearchQueue(10, 10);
            queue.insert(5, 50.0d, 0);
            queue.insert(5, 30.0d, 1);
            queue.insert(5, 40.0d, 2);

            assertEquals(1, queue.size());
            SearchState s = queue.extractMin();
            assertEquals(30.0d, s.cost, 0.0d, "worse re-insert must be ignored");
            assertEquals(1, s.predecessor);
            queue.recycle(s);
        }

        @Test
        @DisplayName("Extract then re-insert keeps membership consistent")
        void testExtractReinsert() {
            SearchQueue queue = new SearchQueue(10, 10);
            queue.insert(1, 1.0d, -1);
            queue.insert(2, 2.0d, -1);
            queue.recycle(queue.extractMin());

            queue.insert(3, 3.0d, -1);
            queue.insert(1, 0.5d, -1);
            assertEquals(3, queue.size());

            int[] order = new int[3];
            for (int i = 0; i < 3; i++) {
                SearchState s = queue.extractMin();
                order[i] = s.vertexId;
                queue.recycle(s);
            }
            assertArrayEquals(new int[]{1, 2, 3}, order);
        }

        @Test
        @DisplayName("Validation")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new SearchQueue(-1, 10));
            assertThrows(IllegalArgumentException.class, () -> new SearchQueue(10, 0));
            SearchQueue queue = new SearchQueue(10, 10);
            assertThrows(IllegalArgumentException.class, () -> queue.insert(11, 0.0d, 0));
            assertThrows(EmptyQueueException.class, queue::extractMin);
        }

        @Test
        @DisplayName("Leaked states exhaust the pool; clear recovers it")
        void testPoolRecovery() {
            SearchQueue queue = new SearchQueue(10, 2);
            queue.insert(1, 0.0d, 0);
            queue.extractMin();
            queue.insert(2, 0.0d, 0);
            queue.extractMin();

            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> queue.insert(3, 0.0d, 0));
            assertTrue(ex.getMessage().contains("Pool exhausted"));

            queue.clear();
            assertDoesNotThrow(() -> {
                queue.insert(3, 3.0d, -1);
                queue.insert(4, 4.0d, -1);
            });
            assertEquals(2, queue.size());
            assertEquals(1.0d, queue.getPoolUtilization(), 1e-12);
        }

        @Test
        @DisplayName("Random workload drains in non-decreasing order")
        void testRandomWorkload() {
            Random random = new Random(11L);
            SearchQueue queue = new SearchQueue(500, 500);
            for (int i = 0; i < 2_000; i++) {
                queue.insert(random.nextInt(400), random.nextDouble() * 100.0d, i);
            }
            double previous = Double.NEGATIVE_INFINITY;
            while (!queue.isEmpty()) {
                SearchState s = queue.extractMin();
                assertTrue(s.cost >= previous, "heap order violated");
                previous = s.cost;
                queue.recycle(s);
            }
            assertTrue(queue.getPeakActiveStates() <= 500);
        }
    }
}
