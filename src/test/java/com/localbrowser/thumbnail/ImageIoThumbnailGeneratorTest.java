package com.localbrowser.thumbnail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageIoThumbnailGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateScalesLongestEdge() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("wide.png"), 400, 100, Color.GREEN);
        Path dest = tempDir.resolve("cache").resolve("thumb.png");

        assertTrue(new ImageIoThumbnailGenerator().generate(source, dest, 128));

        BufferedImage written = ImageIO.read(dest.toFile());
        assertEquals(128, written.getWidth());
        assertEquals(32, written.getHeight());
    }

    @Test
    void testSmallImageIsNotUpscaled() throws Exception {
        Path source = ThumbnailTestImages.writePng(tempDir.resolve("small.png"), 20, 10, Color.GREEN);
        Path dest = tempDir.resolve("thumb.png");

        new ImageIoThumbnailGenerator().generate(source, dest, 128);

        assertEquals(20, ImageIO.read(dest.toFile()).getWidth());
    }

    @Test
    void testUndecodableSourceThrows() throws Exception {
        Path source = tempDir.resolve("bad.png");
        Files.writeString(source, "garbage");

        assertThrows(ThumbnailGenerationException.class,
            () -> new ImageIoThumbnailGenerator().generate(source, tempDir.resolve("out.png"), 64));
    }
}
