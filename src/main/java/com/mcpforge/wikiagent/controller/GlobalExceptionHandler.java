package com.mcpforge.wikiagent.controller;

import com.mcpforge.wikiagent.exception.LookupException;
import com.mcpforge.wikiagent.exception.TopicReadException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理：所有请求级错误都转为纯文本响应 + 状态码，不重试、不终止进程。
 * <ul>
 *   <li>405：/lookup 使用了非 POST 方法</li>
 *   <li>400：请求体读取失败（I/O 层面）</li>
 *   <li>500：词条不存在、无摘要或访问 Wikipedia 失败，正文为 "lookup error: ..."</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String METHOD_NOT_ALLOWED_MESSAGE = "POST required";
    static final String LOOKUP_ERROR_PREFIX = "lookup error: ";

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<String> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex,
                                                         HttpServletRequest request) {
        log.debug("{} {} rejected", ex.getMethod(), request.getRequestURI());
        String allowed = ex.getSupportedMethods() != null
                ? String.join(", ", ex.getSupportedMethods())
                : "POST";
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .header(HttpHeaders.ALLOW, allowed)
                .contentType(LookupController.TEXT_PLAIN_UTF8)
                .body(METHOD_NOT_ALLOWED_MESSAGE);
    }

    @ExceptionHandler(TopicReadException.class)
    public ResponseEntity<String> handleUnreadableBody(TopicReadException ex) {
        log.warn("Failed to read request body: {}",
                ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(LookupController.TEXT_PLAIN_UTF8)
                .body(ex.getMessage());
    }

    @ExceptionHandler(LookupException.class)
    public ResponseEntity<String> handleLookup(LookupException ex) {
        log.warn("Lookup failed ({}): {}", ex.getReason(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(LookupController.TEXT_PLAIN_UTF8)
                .body(LOOKUP_ERROR_PREFIX + ex.getMessage());
    }
}
