package com.localbrowser.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BrowserConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        BrowserConfig config = BrowserConfig.defaults();

        assertEquals(Constants.INFO_INTERVAL_MS, config.getInfoIntervalMs());
        assertEquals(Constants.BACKGROUND_INFO_INTERVAL_MS, config.getBackgroundInfoIntervalMs());
        assertEquals(Constants.THUMBNAIL_INTERVAL_MS, config.getThumbnailIntervalMs());
        assertEquals(Constants.FOLDER_COUNT_INTERVAL_MS, config.getFolderCountIntervalMs());
        assertEquals(512, config.getThumbnailImageSize());
        assertEquals(2L * 1024 * 1024 * 1024, config.getMaxThumbnailSourceBytes());
        assertEquals(20, config.getInfoWaitAttempts());
        assertEquals(100, config.getInfoWaitPollMs());
        assertTrue(config.getDecodableExtensions().contains("png"));
        assertEquals(ZoneId.systemDefault(), config.zone());
    }

    @Test
    void testLoadMergesWithDefaults() throws Exception {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, """
            {
              "infoIntervalMs": 10,
              "thumbnailImageSize": 256,
              "decodableExtensions": ["PNG", "Jpg"],
              "zoneId": "UTC",
              "unknownField": true
            }
            """);

        BrowserConfig config = BrowserConfig.load(configFile);

        assertEquals(10, config.getInfoIntervalMs());
        assertEquals(256, config.getThumbnailImageSize());
        assertEquals(Set.of("png", "jpg"), config.getDecodableExtensions());
        assertEquals(ZoneId.of("UTC"), config.zone());
        assertEquals(Constants.THUMBNAIL_INTERVAL_MS, config.getThumbnailIntervalMs());
    }

    @Test
    void testLoadMissingFileThrows() {
        assertThrows(IllegalArgumentException.class, () -> BrowserConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testLoadMalformedFileThrows() throws Exception {
        Path configFile = tempDir.resolve("broken.json");
        Files.writeString(configFile, "{ not json");

        assertThrows(IllegalStateException.class, () -> BrowserConfig.load(configFile));
    }
}
