package com.mcpforge.wikiagent.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpforge.wikiagent.exception.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * 基于 MediaWiki Action API（api.php, formatversion=2）的词条解析与摘要获取。
 * <ol>
 *   <li>resolvePage：prop=info|pageprops，判断词条是否存在、是否重定向、是否消歧义页</li>
 *   <li>getSummary：prop=extracts&amp;exintro&amp;explaintext，按 pageid 取导言纯文本</li>
 * </ol>
 * 每次调用只发一次请求，不重试、不缓存。
 */
public class MediaWikiProvider implements EncyclopediaProvider {

    private static final Logger log = LoggerFactory.getLogger(MediaWikiProvider.class);

    static final String DEFAULT_LANGUAGE = "en";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    /** 形如 https://{lang}.wikipedia.org/w/api.php */
    private final String apiUrl;
    private final boolean followRedirects;

    public MediaWikiProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                             String apiUrl, boolean followRedirects) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.followRedirects = followRedirects;
    }

    @Override
    public WikiPage resolvePage(String title, String language) {
        if (title == null || title.isBlank()) {
            throw LookupException.pageNotFound("a title must be specified");
        }
        String lang = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language.trim();

        URI uri = UriComponentsBuilder.fromUriString(apiUrl)
                .queryParam("action", "query")
                .queryParam("format", "json")
                .queryParam("formatversion", "2")
                .queryParam("prop", "info|pageprops")
                .queryParam("inprop", "url")
                .queryParam("ppprop", "disambiguation")
                .queryParam("redirects", "1")
                .queryParam("titles", "{title}")
                .encode()
                .buildAndExpand(Map.of("lang", lang, "title", title))
                .toUri();

        JsonNode query = fetchQuery(uri);
        JsonNode page = firstPage(query);
        if (page == null || page.has("missing") || page.has("invalid")) {
            throw LookupException.pageNotFound(quote(title) + " does not match any pages. Try another query!");
        }

        String resolvedTitle = page.path("title").asText(title);
        JsonNode redirects = query.path("redirects");
        if (!followRedirects && redirects.isArray() && !redirects.isEmpty()) {
            throw LookupException.pageNotFound(quote(title) + " resulted in a redirect to " + quote(resolvedTitle)
                    + "; enable app.wikipedia.follow-redirects to follow it");
        }
        if (page.path("pageprops").has("disambiguation")) {
            throw LookupException.summaryUnavailable(quote(resolvedTitle) + " may refer to several pages (disambiguation)");
        }

        return WikiPage.builder()
                .pageId(page.path("pageid").asLong())
                .title(resolvedTitle)
                .language(lang)
                .url(page.path("fullurl").asText(null))
                .build();
    }

    @Override
    public String getSummary(WikiPage page) {
        String lang = page.getLanguage() != null ? page.getLanguage() : DEFAULT_LANGUAGE;
        URI uri = UriComponentsBuilder.fromUriString(apiUrl)
                .queryParam("action", "query")
                .queryParam("format", "json")
                .queryParam("formatversion", "2")
                .queryParam("prop", "extracts")
                .queryParam("exintro", "1")
                .queryParam("explaintext", "1")
                .queryParam("pageids", "{pageId}")
                .encode()
                .buildAndExpand(Map.of("lang", lang, "pageId", page.getPageId()))
                .toUri();

        JsonNode extractPage = firstPage(fetchQuery(uri));
        String extract = extractPage != null ? extractPage.path("extract").asText("") : "";
        if (extract.isBlank()) {
            throw LookupException.summaryUnavailable("no summary available for " + quote(page.getTitle()));
        }
        return extract;
    }

    private JsonNode fetchQuery(URI uri) {
        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException e) {
            log.debug("MediaWiki request {} failed", uri, e);
            throw LookupException.transportFailure("request to " + uri.getHost() + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw LookupException.transportFailure("empty response from " + uri.getHost(), null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw LookupException.summaryUnavailable("malformed response from " + uri.getHost());
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode()) {
            String info = error.path("info").asText(error.path("code").asText("unknown error"));
            throw LookupException.transportFailure("MediaWiki API error: " + info, null);
        }
        return root.path("query");
    }

    private static JsonNode firstPage(JsonNode query) {
        JsonNode pages = query.path("pages");
        if (!pages.isArray() || pages.isEmpty()) {
            return null;
        }
        return pages.get(0);
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }
}
