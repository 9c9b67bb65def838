package com.localbrowser.config;

import java.util.Set;

/**
 * 全局常量定义
 * 
 * 包含工作线程节拍、缩略图参数、文件夹计数参数与进度监控参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 线程节拍（毫秒） ====================
    /** 单条元数据加载线程的节拍 */
    public static final long INFO_INTERVAL_MS = 50;
    /** 后台全量元数据扫描的间隔 */
    public static final long BACKGROUND_INFO_INTERVAL_MS = 1500;
    /** 缩略图线程的节拍 */
    public static final long THUMBNAIL_INTERVAL_MS = 200;
    /** 文件夹计数线程的节拍 */
    public static final long FOLDER_COUNT_INTERVAL_MS = 250;
    /** 关闭线程时等待退出的上限 */
    public static final long SHUTDOWN_TIMEOUT_MS = 5_000;
    
    // ==================== 缩略图参数 ====================
    /** 生成缩略图的目标边长 */
    public static final int THUMBNAIL_IMAGE_SIZE = 512;
    /** 源文件大小上限（2GB），超过则拒绝生成 */
    public static final long MAX_THUMBNAIL_SOURCE_BYTES = 2L * 1024 * 1024 * 1024;
    /** 等待元数据加载完成的轮询次数 */
    public static final int INFO_WAIT_ATTEMPTS = 20;
    /** 每次轮询的间隔 */
    public static final long INFO_WAIT_POLL_MS = 100;
    /** 默认行高，决定缩略图解码高度 */
    public static final int ROW_HEIGHT = 54;
    /** ImageIO 可直接解码的扩展名 */
    public static final Set<String> DECODABLE_EXTENSIONS =
        Set.of("png", "jpg", "jpeg", "bmp", "gif", "tif", "tiff", "wbmp");
    /** 解码图像缓存的最大条目数，超出后淘汰最久未访问的条目 */
    public static final int IMAGE_CACHE_CAPACITY = 512;
    
    // ==================== 文件夹计数 ====================
    /** 文件夹条目计数上限，仅用于显示 */
    public static final int FOLDER_COUNT_LIMIT = 999;
    
    // ==================== 进度监控 ====================
    /** 进度刷新间隔 */
    public static final long PROGRESS_REFRESH_MS = 200;
    
    // ==================== 默认路径 ====================
    /** 侧车元数据库文件名 */
    public static final String SIDECAR_DB_NAME = "sidecar.db";
    /** 缩略图缓存目录名 */
    public static final String THUMBNAIL_CACHE_DIR_NAME = "thumbnails";
}
