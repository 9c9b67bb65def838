package com.localbrowser.thumbnail;

import java.nio.file.Path;

/**
 * 从源文件生成缓存缩略图的外部协作者。
 */
public interface ThumbnailGenerator {

    /**
     * 生成缩略图并写入 {@code dest}。
     *
     * @param source 源文件（序列传入首帧）
     * @param dest 缩略图缓存路径
     * @param targetSize 最长边的目标像素
     * @return 写入成功返回 {@code true}
     * @throws ThumbnailGenerationException 解码或写入出错时抛出
     */
    boolean generate(Path source, Path dest, int targetSize);
}
