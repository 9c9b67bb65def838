package com.localbrowser.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordFlags;
import com.localbrowser.record.RecordRef;
import com.localbrowser.thumbnail.ImageCache;
import com.localbrowser.thumbnail.ImageIoThumbnailGenerator;
import com.localbrowser.thumbnail.Placeholders;
import com.localbrowser.thumbnail.ThumbnailGenerationException;
import com.localbrowser.thumbnail.ThumbnailGenerator;
import com.localbrowser.thumbnail.ThumbnailTestImages;
import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ThumbnailWorkerTest {

    private static final int ROW_HEIGHT = 24;
    private static final Set<String> DECODABLE = Set.of("png", "jpg");

    @TempDir
    Path tempDir;

    private ImageCache imageCache;
    private final List<RecordRef> ready = new ArrayList<>();

    @BeforeEach
    void setUp() {
        imageCache = new ImageCache();
        ready.clear();
    }

    private ThumbnailWorker newWorker(ThumbnailGenerator generator, long maxSourceBytes) {
        ThumbnailWorker worker = new ThumbnailWorker(imageCache, generator, DECODABLE, maxSourceBytes, 64, 3, 1);
        worker.addItemReadyListener(ready::add);
        return worker;
    }

    private RecordRef prepare(Record record, boolean infoLoaded) {
        record.setRowHeight(ROW_HEIGHT);
        record.setPlaceholder(new Placeholders().imageFor(record.getExtension(), ROW_HEIGHT), Placeholders.THUMBNAIL_BACKGROUND);
        record.setThumbnailPath(tempDir.resolve("cache").resolve(record.getDisplayName() + ".thumb.png"));
        record.setInfoLoaded(infoLoaded);
        RecordCollection collection = new RecordCollection("files");
        collection.reset(List.of(record));
        return collection.refOf(record);
    }

    private static void run(ThumbnailWorker worker, RecordRef ref) {
        worker.queue().submit(ref, false);
        worker.activate();
    }

    @Test
    void testGeneratesAndLoadsThumbnail() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("photo.png"), 200, 100, Color.ORANGE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);

        run(newWorker(new ImageIoThumbnailGenerator(), Long.MAX_VALUE), ref);

        assertTrue(record.isThumbnailLoaded());
        assertTrue(Files.isRegularFile(record.getThumbnailPath()));
        assertEquals(ROW_HEIGHT, record.getThumbnail().getHeight());
        assertNotSame(record.getDefaultThumbnail(), record.getThumbnail());
        assertEquals(List.of(ref), ready);
    }

    @Test
    void testOversizedSourceNeverInvokesGenerator() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("huge.png"), 64, 64, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, 16), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertTrue(record.isThumbnailLoaded());
        assertSame(record.getDefaultThumbnail(), record.getThumbnail());
        assertEquals(Placeholders.THUMBNAIL_BACKGROUND, record.getThumbnailBackground());
        assertTrue(ready.isEmpty());
    }

    @Test
    void testGeneratorFailureFallsBackToPlaceholder() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("broken.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);
        when(generator.generate(any(), any(), anyInt())).thenThrow(new ThumbnailGenerationException("decoder error"));
        imageCache.get(source, ROW_HEIGHT, false);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        assertTrue(record.isThumbnailLoaded());
        assertSame(record.getDefaultThumbnail(), record.getThumbnail());
        assertEquals(0, imageCache.size());
    }

    @Test
    void testGeneratorReportingFailureFallsBackToPlaceholder() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("nowriter.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);

        run(newWorker(mock(ThumbnailGenerator.class), Long.MAX_VALUE), ref);

        assertTrue(record.isThumbnailLoaded());
        assertSame(record.getDefaultThumbnail(), record.getThumbnail());
    }

    @Test
    void testCachedThumbnailIsUsedWithoutGenerating() throws Exception {
        Record record = Record.file(tempDir.resolve("clip.mov"));
        RecordRef ref = prepare(record, true);
        ThumbnailTestImages.writePng(record.getThumbnailPath(), 48, 48, Color.GREEN);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertTrue(record.isThumbnailLoaded());
        assertEquals(ROW_HEIGHT, record.getThumbnail().getHeight());
        assertEquals(0, record.getThumbnailBackground().getRed());
        assertEquals(List.of(ref), ready);
    }

    @Test
    void testCorruptCachedThumbnailFallsBackToPlaceholder() throws Exception {
        Record record = Record.file(tempDir.resolve("clip.png"));
        RecordRef ref = prepare(record, true);
        Files.createDirectories(record.getThumbnailPath().getParent());
        Files.writeString(record.getThumbnailPath(), "corrupt");

        run(newWorker(mock(ThumbnailGenerator.class), Long.MAX_VALUE), ref);

        assertTrue(record.isThumbnailLoaded());
        assertSame(record.getDefaultThumbnail(), record.getThumbnail());
    }

    @Test
    void testNonDecodableExtensionIsLeftUnmarked() throws Exception {
        Path source = tempDir.resolve("notes.txt");
        Files.writeString(source, "text");
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertFalse(record.isThumbnailLoaded());
        assertTrue(ready.isEmpty());
    }

    @Test
    void testArchivedRecordIsSkipped() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("old.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        record.setFlags(record.getFlags() | RecordFlags.ARCHIVED);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertFalse(record.isThumbnailLoaded());
    }

    @Test
    void testGivesUpWhenInfoNeverLoads() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("wait.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, false);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertFalse(record.isThumbnailLoaded());
    }

    @Test
    void testAlreadyLoadedIsSkipped() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("done.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        record.setThumbnailLoaded(true);
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertTrue(ready.isEmpty());
    }

    @Test
    void testStaleRefIsIgnored() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("stale.png"), 8, 8, Color.BLUE);
        Record record = Record.file(source);
        RecordRef ref = prepare(record, true);
        ref.owner().discard();
        ThumbnailGenerator generator = mock(ThumbnailGenerator.class);

        run(newWorker(generator, Long.MAX_VALUE), ref);

        verify(generator, never()).generate(any(), any(), anyInt());
        assertFalse(record.isThumbnailLoaded());
        assertTrue(ready.isEmpty());
    }
}
