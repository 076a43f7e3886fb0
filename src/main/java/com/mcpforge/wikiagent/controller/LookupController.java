package com.mcpforge.wikiagent.controller;

import com.mcpforge.wikiagent.exception.TopicReadException;
import com.mcpforge.wikiagent.service.WikipediaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Wikipedia 摘要查询：POST 纯文本主题，返回词条导言纯文本。
 */
@RestController
@RequestMapping("/lookup")
@Tag(name = "Lookup", description = "Wikipedia 摘要查询")
public class LookupController {

    static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final WikipediaService wikipediaService;

    public LookupController(WikipediaService wikipediaService) {
        this.wikipediaService = wikipediaService;
    }

    /**
     * 请求体整体按 UTF-8 读作主题，不校验、不 trim；空请求体即空主题，交由提供方判定。
     */
    @PostMapping
    @Operation(summary = "查询摘要", description = "请求体为主题纯文本；成功返回摘要纯文本，失败返回 500 与 \"lookup error: ...\"",
            requestBody = @RequestBody(description = "主题，如 General relativity"))
    public ResponseEntity<String> lookup(HttpServletRequest request) {
        String topic;
        try {
            topic = StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TopicReadException(e);
        }
        String summary = wikipediaService.fetchSummary(topic);
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .body(summary);
    }

    /**
     * 非 POST 一律 405，不读取请求体；OPTIONS 与 HEAD 同样拒绝。
     */
    @RequestMapping(method = {RequestMethod.GET, RequestMethod.HEAD, RequestMethod.PUT,
            RequestMethod.PATCH, RequestMethod.DELETE, RequestMethod.OPTIONS})
    @Operation(hidden = true)
    public ResponseEntity<String> rejectNonPost(HttpServletRequest request) throws HttpRequestMethodNotSupportedException {
        throw new HttpRequestMethodNotSupportedException(request.getMethod(), List.of(RequestMethod.POST.name()));
    }
}
