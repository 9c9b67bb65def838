package com.localbrowser.sidecar;

/**
 * 侧车存储读取失败。调用方记录日志后使用默认值继续。
 */
public class SidecarReadException extends RuntimeException {

    public SidecarReadException(String message) {
        super(message);
    }

    public SidecarReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
