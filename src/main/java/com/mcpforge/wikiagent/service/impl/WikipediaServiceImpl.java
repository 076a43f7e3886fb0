package com.mcpforge.wikiagent.service.impl;

import com.mcpforge.wikiagent.exception.LookupException;
import com.mcpforge.wikiagent.provider.EncyclopediaProvider;
import com.mcpforge.wikiagent.provider.WikiPage;
import com.mcpforge.wikiagent.service.WikipediaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 先解析词条页，再取导言摘要。语言取自 app.wikipedia.lang（默认 en）。
 */
@Service
public class WikipediaServiceImpl implements WikipediaService {

    private static final Logger log = LoggerFactory.getLogger(WikipediaServiceImpl.class);

    private final EncyclopediaProvider provider;
    private final String language;

    public WikipediaServiceImpl(EncyclopediaProvider provider,
                                @Value("${app.wikipedia.lang:en}") String language) {
        this.provider = provider;
        this.language = language;
    }

    @Override
    public String fetchSummary(String topic) {
        try {
            WikiPage page = provider.resolvePage(topic, language);
            String summary = provider.getSummary(page);
            log.debug("Resolved \"{}\" to {} [{}], summary {} chars",
                    topic, page.getTitle(), page.getLanguage(), summary.length());
            return summary;
        } catch (LookupException e) {
            log.debug("Lookup of \"{}\" ({}) failed: {} - {}", topic, language, e.getReason(), e.getMessage());
            throw e;
        }
    }
}
