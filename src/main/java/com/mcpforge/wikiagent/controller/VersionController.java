package com.mcpforge.wikiagent.controller;

import com.mcpforge.wikiagent.model.dto.response.VersionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Ops", description = "健康检查与版本信息")
public class VersionController {

    private final VersionResponse versionResponse;

    /**
     * 版本号来自 app.version：默认由 Maven 资源过滤写入项目版本，可用环境变量 APP_VERSION 覆盖。
     */
    public VersionController(@Value("${app.name:wikipedia-agent}") String name,
                             @Value("${app.version:dev}") String version) {
        this.versionResponse = VersionResponse.builder()
                .name(name)
                .version(version == null || version.isBlank() ? "dev" : version)
                .build();
    }

    @RequestMapping(value = "/version", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "服务名与版本")
    public VersionResponse version() {
        return versionResponse;
    }
}
