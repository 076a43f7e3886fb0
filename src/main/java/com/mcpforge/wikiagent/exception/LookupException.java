package com.mcpforge.wikiagent.exception;

/**
 * 查询 Wikipedia 摘要失败。对外统一表现为 "lookup error"，reason 仅用于日志与测试区分。
 */
public class LookupException extends RuntimeException {

    public enum Reason {
        PAGE_NOT_FOUND,
        SUMMARY_UNAVAILABLE,
        TRANSPORT_FAILURE
    }

    private final Reason reason;

    public LookupException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LookupException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static LookupException pageNotFound(String message) {
        return new LookupException(Reason.PAGE_NOT_FOUND, message);
    }

    public static LookupException summaryUnavailable(String message) {
        return new LookupException(Reason.SUMMARY_UNAVAILABLE, message);
    }

    public static LookupException transportFailure(String message, Throwable cause) {
        return new LookupException(Reason.TRANSPORT_FAILURE, message, cause);
    }

    public Reason getReason() {
        return reason;
    }
}
