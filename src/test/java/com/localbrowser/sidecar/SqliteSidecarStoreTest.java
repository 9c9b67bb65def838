package com.localbrowser.sidecar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteSidecarStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testPutAndGet() {
        try (SqliteSidecarStore store = new SqliteSidecarStore(tempDir.resolve("sidecar.db"))) {
            store.put("/shots/a.exr", SidecarStore.DESCRIPTION, "first pass");

            assertEquals(Optional.of("first pass"), store.get("/shots/a.exr", SidecarStore.DESCRIPTION));
            assertEquals(Optional.empty(), store.get("/shots/a.exr", SidecarStore.NOTES));
            assertEquals(Optional.empty(), store.get("/shots/b.exr", SidecarStore.DESCRIPTION));
        }
    }

    @Test
    void testUpsertOverwritesValue() {
        try (SqliteSidecarStore store = new SqliteSidecarStore(tempDir.resolve("sidecar.db"))) {
            store.put("k", SidecarStore.FLAGS, "1");
            store.put("k", SidecarStore.FLAGS, "2");

            assertEquals(Optional.of("2"), store.get("k", SidecarStore.FLAGS));
        }
    }

    @Test
    void testKeysAreCaseAndSeparatorInsensitive() {
        try (SqliteSidecarStore store = new SqliteSidecarStore(tempDir.resolve("sidecar.db"))) {
            store.put("C:\\Shots\\A.EXR", SidecarStore.DESCRIPTION, "x");

            assertEquals(Optional.of("x"), store.get("c:/shots/a.exr", SidecarStore.DESCRIPTION));
        }
    }

    @Test
    void testValuesSurviveReopen() {
        Path dbPath = tempDir.resolve("nested").resolve("sidecar.db");
        try (SqliteSidecarStore store = new SqliteSidecarStore(dbPath)) {
            store.put("k", SidecarStore.ARCHIVED, "true");
        }
        assertTrue(Files.exists(dbPath));
        try (SqliteSidecarStore store = new SqliteSidecarStore(dbPath)) {
            assertEquals(Optional.of("true"), store.get("k", SidecarStore.ARCHIVED));
        }
    }

    @Test
    void testWalModeEnabled() {
        try (SqliteSidecarStore store = new SqliteSidecarStore(tempDir.resolve("sidecar.db"))) {
            assertEquals("wal", store.getJournalMode().toLowerCase());
        }
    }

    @Test
    void testReadAfterCloseThrowsSidecarReadException() {
        SqliteSidecarStore store = new SqliteSidecarStore(tempDir.resolve("sidecar.db"));
        store.close();

        assertThrows(SidecarReadException.class, () -> store.get("k", SidecarStore.DESCRIPTION));
    }
}
