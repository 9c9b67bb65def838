package com.localbrowser.thumbnail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 默认的缩略图生成器：ImageIO 解码源文件，按最长边缩放后写出 PNG。
 */
public final class ImageIoThumbnailGenerator implements ThumbnailGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ImageIoThumbnailGenerator.class);

    @Override
    public boolean generate(Path source, Path dest, int targetSize) {
        BufferedImage sourceImage;
        try {
            sourceImage = ImageIO.read(source.toFile());
        } catch (IOException ioException) {
            throw new ThumbnailGenerationException("读取源图像失败: " + source, ioException);
        }
        if (sourceImage == null) {
            throw new ThumbnailGenerationException("不支持的图像格式: " + source);
        }

        BufferedImage thumbnail = ImageScaling.scaleToFit(sourceImage, targetSize);
        try {
            Path parent = dest.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(thumbnail, "png", dest.toFile())) {
                return false;
            }
        } catch (IOException ioException) {
            throw new ThumbnailGenerationException("写入缩略图失败: " + dest, ioException);
        }
        logger.debug("已生成缩略图: {} -> {}", source, dest);
        return true;
    }
}
