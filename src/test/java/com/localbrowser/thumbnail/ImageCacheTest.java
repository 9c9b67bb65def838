package com.localbrowser.thumbnail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void testDecodesScalesAndComputesBackground() throws Exception {
        Path image = ThumbnailTestImages.writePng(tempDir.resolve("red.png"), 200, 100, Color.RED);
        ImageCache cache = new ImageCache();

        DecodedImage decoded = cache.get(image, 50, false).orElseThrow();

        assertEquals(50, decoded.image().getHeight());
        assertEquals(100, decoded.image().getWidth());
        assertEquals(255, decoded.background().getRed());
        assertEquals(0, decoded.background().getGreen());
    }

    @Test
    void testMemoisesPerPathAndHeight() throws Exception {
        Path image = ThumbnailTestImages.writePng(tempDir.resolve("a.png"), 40, 40, Color.BLUE);
        ImageCache cache = new ImageCache();

        DecodedImage first = cache.get(image, 20, false).orElseThrow();
        assertSame(first, cache.get(image, 20, false).orElseThrow());
        assertNotSame(first, cache.get(image, 20, true).orElseThrow());
        cache.get(image, 10, false);
        assertEquals(2, cache.size());
    }

    @Test
    void testInvalidateDropsAllHeights() throws Exception {
        Path image = ThumbnailTestImages.writePng(tempDir.resolve("a.png"), 40, 40, Color.BLUE);
        Path other = ThumbnailTestImages.writePng(tempDir.resolve("b.png"), 40, 40, Color.BLUE);
        ImageCache cache = new ImageCache();
        cache.get(image, 10, false);
        cache.get(image, 20, false);
        cache.get(other, 10, false);

        cache.invalidate(image);

        assertEquals(1, cache.size());
    }

    @Test
    void testEvictsLeastRecentlyUsedBeyondCapacity() throws Exception {
        ImageCache cache = new ImageCache(3);
        Path first = ThumbnailTestImages.writePng(tempDir.resolve("0.png"), 8, 8, Color.GREEN);
        DecodedImage firstDecoded = cache.get(first, 8, false).orElseThrow();
        for (int i = 1; i < 10; i++) {
            Path image = ThumbnailTestImages.writePng(tempDir.resolve(i + ".png"), 8, 8, Color.GREEN);
            cache.get(image, 8, false);
            if (i == 1) {
                // 访问后 0.png 变为最近使用
                assertSame(firstDecoded, cache.get(first, 8, false).orElseThrow());
            }
            assertTrue(cache.size() <= 3);
        }

        assertEquals(3, cache.size());
        assertNotSame(firstDecoded, cache.get(first, 8, false).orElseThrow());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ImageCache(0));
    }

    @Test
    void testMissingOrCorruptFileIsEmpty() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.png");
        Files.writeString(corrupt, "not an image");
        ImageCache cache = new ImageCache();

        assertTrue(cache.get(tempDir.resolve("missing.png"), 10, false).isEmpty());
        assertTrue(cache.get(corrupt, 10, false).isEmpty());
    }
}
