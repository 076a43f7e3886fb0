package com.mcpforge.wikiagent.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    public static final String STATUS_OK = "ok";

    private String status;

    public static HealthResponse ok() {
        return new HealthResponse(STATUS_OK);
    }
}
