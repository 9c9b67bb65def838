package com.localbrowser.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordCollectionTest {

    @Test
    void testResetSortsByPathAndIssuesLiveRefs() {
        RecordCollection collection = new RecordCollection("files");
        Record second = Record.file(Path.of("b.txt"));
        Record first = Record.file(Path.of("A.txt"));
        collection.reset(List.of(second, first));

        assertEquals(2, collection.size());
        assertSame(first, collection.get(0));
        List<RecordRef> refs = collection.refs();
        assertSame(first, refs.get(0).get());
        assertTrue(refs.get(1).isAlive());
    }

    @Test
    void testResetInvalidatesPreviousRefs() {
        RecordCollection collection = new RecordCollection("files");
        Record record = Record.file(Path.of("a.txt"));
        collection.reset(List.of(record));
        RecordRef ref = collection.refOf(record);

        collection.reset(List.of(Record.file(Path.of("b.txt"))));

        assertNull(ref.get());
        assertTrue(record.isDetached());
    }

    @Test
    void testReAddingSameRecordDoesNotReviveOldRef() {
        RecordCollection collection = new RecordCollection("files");
        Record record = Record.file(Path.of("a.txt"));
        collection.reset(List.of(record));
        RecordRef oldRef = collection.refOf(record);

        collection.discard();
        assertNull(oldRef.get());

        Record fresh = Record.file(Path.of("a.txt"));
        collection.reset(List.of(fresh));
        RecordRef newRef = collection.refOf(fresh);

        assertNull(oldRef.get());
        assertSame(fresh, newRef.get());
        assertNotEquals(oldRef, newRef);
    }

    @Test
    void testSortingKeepsRefsAlive() {
        RecordCollection collection = new RecordCollection("files");
        Record small = Record.file(Path.of("z.txt"));
        Record large = Record.file(Path.of("a.txt"));
        small.setSizeBytes(1);
        large.setSizeBytes(100);
        collection.reset(List.of(small, large));
        RecordRef ref = collection.refOf(small);

        collection.setComparator(Comparator.comparingLong(Record::getSizeBytes).reversed());

        assertSame(large, collection.get(0));
        assertSame(small, ref.get());
    }

    @Test
    void testRefsWithSameTargetAreEqual() {
        RecordCollection collection = new RecordCollection("files");
        Record record = Record.file(Path.of("a.txt"));
        collection.reset(List.of(record));

        RecordRef left = collection.refOf(record);
        RecordRef right = collection.refs().get(0);

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertNotEquals(left, record);
        assertNotEquals(left, null);
    }

    @Test
    void testRefsFromDifferentGenerationsAreNotEqual() {
        RecordCollection collection = new RecordCollection("files");
        Record record = Record.file(Path.of("a.txt"));
        collection.reset(List.of(record));
        RecordRef before = collection.refOf(record);

        collection.reset(List.of(record));

        assertNotEquals(before, collection.refOf(record));
    }

    @Test
    void testRefOfForeignRecordThrows() {
        RecordCollection collection = new RecordCollection("files");
        collection.reset(List.of(Record.file(Path.of("a.txt"))));

        assertThrows(IllegalArgumentException.class, () -> collection.refOf(Record.file(Path.of("other.txt"))));
    }

    @Test
    void testChildRefsFollowParentLiveness() {
        RecordCollection collection = new RecordCollection("folders");
        Record child = Record.folder(Path.of("root", "child"), List.of());
        Record group = Record.folder(Path.of("root"), List.of(child));
        collection.reset(List.of(group));
        RecordRef childRef = collection.refOf(group).child(child);

        assertSame(child, childRef.get());
        collection.discard();
        assertNull(childRef.get());
        assertTrue(child.isDetached());
    }

    @Test
    void testMarkFullyLoadedResetOnReload() {
        RecordCollection collection = new RecordCollection("files");
        collection.reset(List.of(Record.file(Path.of("a.txt"))));
        collection.markFullyLoaded();
        assertTrue(collection.isFullyLoaded());

        collection.reset(List.of(Record.file(Path.of("b.txt"))));
        assertFalse(collection.isFullyLoaded());
    }
}
