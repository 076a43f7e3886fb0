package com.mcpforge.wikiagent.controller;

import com.mcpforge.wikiagent.model.dto.response.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Ops", description = "健康检查与版本信息")
public class HealthController {

    /**
     * 任意方法均返回 {"status":"ok"}。
     */
    @RequestMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "健康检查")
    public HealthResponse health() {
        return HealthResponse.ok();
    }
}
