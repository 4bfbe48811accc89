package com.bit.reputation.source;

/**
 * 链上/索引器数据源的传输或读取失败
 */
public class SourceException extends RuntimeException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
