package com.localbrowser.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordRef;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkQueueTest {

    private List<RecordRef> refs;

    @BeforeEach
    void setUp() {
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            records.add(Record.file(Path.of("item" + i + ".txt")));
        }
        RecordCollection collection = new RecordCollection("files");
        collection.reset(records);
        refs = collection.refs();
    }

    private List<RecordRef> drainInOrder(WorkQueue queue) {
        List<RecordRef> order = new ArrayList<>();
        Optional<RecordRef> next;
        while ((next = queue.dequeue()).isPresent()) {
            order.add(next.get());
        }
        return order;
    }

    @Test
    void testNormalSubmissionsAreFifo() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(1), false);
        queue.submit(refs.get(2), false);

        assertEquals(List.of(refs.get(0), refs.get(1), refs.get(2)), drainInOrder(queue));
    }

    @Test
    void testForcedSubmissionsJumpAheadInReverseOrder() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(1), false);
        queue.submit(refs.get(2), false);
        queue.submit(refs.get(3), true);
        queue.submit(refs.get(4), true);

        assertEquals(List.of(refs.get(4), refs.get(3), refs.get(0), refs.get(1), refs.get(2)), drainInOrder(queue));
    }

    @Test
    void testNormalSubmissionAfterForcedStaysBehindQueuedNormals() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(1), true);
        queue.submit(refs.get(2), false);

        assertEquals(List.of(refs.get(1), refs.get(0), refs.get(2)), drainInOrder(queue));
    }

    @Test
    void testSubmitIfAbsentDeduplicates() {
        WorkQueue queue = new WorkQueue("test");

        assertTrue(queue.submitIfAbsent(refs.get(0)));
        assertFalse(queue.submitIfAbsent(refs.get(0)));
        assertEquals(1, queue.size());

        queue.dequeue();
        assertFalse(queue.contains(refs.get(0)));
        assertTrue(queue.submitIfAbsent(refs.get(0)));
    }

    @Test
    void testForcedDuplicateKeepsContainsUntilLastCopyDequeued() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(0), true);

        assertEquals(2, queue.size());
        queue.dequeue();
        assertTrue(queue.contains(refs.get(0)));
        queue.dequeue();
        assertFalse(queue.contains(refs.get(0)));
    }

    @Test
    void testPromoteMovesQueuedRefToFrontWithoutDuplicating() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(1), false);
        queue.submit(refs.get(2), false);

        assertTrue(queue.promote(refs.get(2)));
        assertFalse(queue.promote(refs.get(2)));
        for (int i = 0; i < 50; i++) {
            queue.promote(refs.get(1));
            queue.promote(refs.get(2));
        }

        assertEquals(3, queue.size());
        assertEquals(List.of(refs.get(2), refs.get(1), refs.get(0)), drainInOrder(queue));
        assertFalse(queue.contains(refs.get(2)));
    }

    @Test
    void testPromoteAddsAbsentRefAtFront() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);

        queue.promote(refs.get(3));

        assertEquals(List.of(refs.get(3), refs.get(0)), drainInOrder(queue));
    }

    @Test
    void testDrainClearsEverything() {
        WorkQueue queue = new WorkQueue("test");
        queue.submit(refs.get(0), false);
        queue.submit(refs.get(1), true);

        assertEquals(2, queue.drain());
        assertEquals(0, queue.size());
        assertTrue(queue.dequeue().isEmpty());
        assertFalse(queue.contains(refs.get(1)));
    }
}
