package com.mcpforge.wikiagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class StartupBanner {

    private static final Logger log = LoggerFactory.getLogger(StartupBanner.class);

    private final String version;
    private final String address;
    private final String language;

    public StartupBanner(@Value("${app.version:dev}") String version,
                         @Value("${server.address:0.0.0.0}") String address,
                         @Value("${app.wikipedia.lang:en}") String language) {
        this.version = version;
        this.address = address;
        this.language = language;
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("Wikipedia Agent v{} listening on {}:{} (language {})",
                version, address, event.getWebServer().getPort(), language);
    }
}
