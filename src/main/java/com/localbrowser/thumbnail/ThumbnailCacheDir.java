package com.localbrowser.thumbnail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 缩略图缓存目录：每个内容键对应一个 PNG 文件。
 */
public final class ThumbnailCacheDir {
    private static final String THUMBNAIL_EXTENSION = ".png";

    private final Path root;

    public ThumbnailCacheDir(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * 内容键（大小写不敏感）到缓存文件的映射。
     */
    public Path thumbnailPath(String contentKey) {
        String normalizedKey = contentKey.replace('\\', '/').toLowerCase(Locale.ROOT);
        return root.resolve(sha1Hex(normalizedKey) + THUMBNAIL_EXTENSION);
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException noSuchAlgorithmException) {
            throw new IllegalStateException("当前 JDK 不支持 SHA-1", noSuchAlgorithmException);
        }
    }
}
