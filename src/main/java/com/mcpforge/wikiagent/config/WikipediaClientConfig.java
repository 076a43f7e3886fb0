package com.mcpforge.wikiagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpforge.wikiagent.provider.EncyclopediaProvider;
import com.mcpforge.wikiagent.provider.MediaWikiProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

/**
 * MediaWiki 客户端装配。请求头必须带 User-Agent，否则可能被 Wikipedia 限流。
 * 超时沿用 RestTemplate 底层默认值，不单独配置。
 */
@Configuration
public class WikipediaClientConfig {

    @Bean
    public RestTemplate wikipediaRestTemplate(RestTemplateBuilder builder,
                                              @Value("${app.wikipedia.user-agent}") String userAgent) {
        return builder
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    @Bean
    public EncyclopediaProvider encyclopediaProvider(RestTemplate wikipediaRestTemplate,
                                                     ObjectMapper objectMapper,
                                                     @Value("${app.wikipedia.api-url:https://{lang}.wikipedia.org/w/api.php}") String apiUrl,
                                                     @Value("${app.wikipedia.follow-redirects:false}") boolean followRedirects) {
        return new MediaWikiProvider(wikipediaRestTemplate, objectMapper, apiUrl, followRedirects);
    }
}
