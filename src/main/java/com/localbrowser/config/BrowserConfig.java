package com.localbrowser.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 浏览器运行时配置
 * 
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserConfig {
    private Path sidecarDbPath = Paths.get(".", Constants.SIDECAR_DB_NAME);
    private Path thumbnailCacheDir = Paths.get(".", Constants.THUMBNAIL_CACHE_DIR_NAME);
    private long infoIntervalMs = Constants.INFO_INTERVAL_MS;
    private long backgroundInfoIntervalMs = Constants.BACKGROUND_INFO_INTERVAL_MS;
    private long thumbnailIntervalMs = Constants.THUMBNAIL_INTERVAL_MS;
    private long folderCountIntervalMs = Constants.FOLDER_COUNT_INTERVAL_MS;
    private int thumbnailImageSize = Constants.THUMBNAIL_IMAGE_SIZE;
    private long maxThumbnailSourceBytes = Constants.MAX_THUMBNAIL_SOURCE_BYTES;
    private int infoWaitAttempts = Constants.INFO_WAIT_ATTEMPTS;
    private long infoWaitPollMs = Constants.INFO_WAIT_POLL_MS;
    private int rowHeight = Constants.ROW_HEIGHT;
    private Set<String> decodableExtensions = Constants.DECODABLE_EXTENSIONS;
    private long progressRefreshMs = Constants.PROGRESS_REFRESH_MS;
    private String zoneId = ZoneId.systemDefault().getId();
    
    public Path getSidecarDbPath() {
        return sidecarDbPath;
    }
    
    public void setSidecarDbPath(Path sidecarDbPath) {
        this.sidecarDbPath = sidecarDbPath;
    }
    
    public Path getThumbnailCacheDir() {
        return thumbnailCacheDir;
    }
    
    public void setThumbnailCacheDir(Path thumbnailCacheDir) {
        this.thumbnailCacheDir = thumbnailCacheDir;
    }
    
    public long getInfoIntervalMs() {
        return infoIntervalMs;
    }
    
    public void setInfoIntervalMs(long infoIntervalMs) {
        this.infoIntervalMs = infoIntervalMs;
    }
    
    public long getBackgroundInfoIntervalMs() {
        return backgroundInfoIntervalMs;
    }
    
    public void setBackgroundInfoIntervalMs(long backgroundInfoIntervalMs) {
        this.backgroundInfoIntervalMs = backgroundInfoIntervalMs;
    }
    
    public long getThumbnailIntervalMs() {
        return thumbnailIntervalMs;
    }
    
    public void setThumbnailIntervalMs(long thumbnailIntervalMs) {
        this.thumbnailIntervalMs = thumbnailIntervalMs;
    }
    
    public long getFolderCountIntervalMs() {
        return folderCountIntervalMs;
    }
    
    public void setFolderCountIntervalMs(long folderCountIntervalMs) {
        this.folderCountIntervalMs = folderCountIntervalMs;
    }
    
    public int getThumbnailImageSize() {
        return thumbnailImageSize;
    }
    
    public void setThumbnailImageSize(int thumbnailImageSize) {
        this.thumbnailImageSize = thumbnailImageSize;
    }
    
    public long getMaxThumbnailSourceBytes() {
        return maxThumbnailSourceBytes;
    }
    
    public void setMaxThumbnailSourceBytes(long maxThumbnailSourceBytes) {
        this.maxThumbnailSourceBytes = maxThumbnailSourceBytes;
    }
    
    public int getInfoWaitAttempts() {
        return infoWaitAttempts;
    }
    
    public void setInfoWaitAttempts(int infoWaitAttempts) {
        this.infoWaitAttempts = infoWaitAttempts;
    }
    
    public long getInfoWaitPollMs() {
        return infoWaitPollMs;
    }
    
    public void setInfoWaitPollMs(long infoWaitPollMs) {
        this.infoWaitPollMs = infoWaitPollMs;
    }
    
    public int getRowHeight() {
        return rowHeight;
    }
    
    public void setRowHeight(int rowHeight) {
        this.rowHeight = rowHeight;
    }
    
    public Set<String> getDecodableExtensions() {
        return decodableExtensions;
    }
    
    /**
     * 设置可解码扩展名，统一转为小写。
     */
    public void setDecodableExtensions(Set<String> decodableExtensions) {
        this.decodableExtensions = decodableExtensions.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
    
    public long getProgressRefreshMs() {
        return progressRefreshMs;
    }
    
    public void setProgressRefreshMs(long progressRefreshMs) {
        this.progressRefreshMs = progressRefreshMs;
    }
    
    public String getZoneId() {
        return zoneId;
    }
    
    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }
    
    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static BrowserConfig defaults() {
        return new BrowserConfig();
    }
    
    /**
     * 从JSON配置文件加载，文件中缺失的字段保留默认值。
     *
     * @param configFile 配置文件路径
     * @return 合并后的配置
     */
    public static BrowserConfig load(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("配置文件不存在: " + configFile);
        }
        try {
            return new ObjectMapper().readerForUpdating(defaults()).readValue(configFile.toFile());
        } catch (IOException ioException) {
            throw new IllegalStateException("读取配置文件失败: " + configFile, ioException);
        }
    }
}
