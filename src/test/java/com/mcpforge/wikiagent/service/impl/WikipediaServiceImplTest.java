package com.mcpforge.wikiagent.service.impl;

import com.mcpforge.wikiagent.exception.LookupException;
import com.mcpforge.wikiagent.provider.EncyclopediaProvider;
import com.mcpforge.wikiagent.provider.WikiPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WikipediaServiceImplTest {

    private static final String SUMMARY = "General relativity, also known as the general theory of relativity, "
            + "is the geometric theory of gravitation published by Albert Einstein in 1915.";

    @Mock
    private EncyclopediaProvider provider;

    private WikipediaServiceImpl service;

    private final WikiPage page = WikiPage.builder()
            .pageId(12024L)
            .title("General relativity")
            .language("de")
            .build();

    @BeforeEach
    void setUp() {
        service = new WikipediaServiceImpl(provider, "de");
    }

    @Test
    void fetchSummary_shouldResolveWithConfiguredLanguageThenReturnExtract() {
        when(provider.resolvePage("General relativity", "de")).thenReturn(page);
        when(provider.getSummary(page)).thenReturn(SUMMARY);

        assertEquals(SUMMARY, service.fetchSummary("General relativity"));
    }

    @Test
    void fetchSummary_shouldPassTopicThroughUntouched() {
        when(provider.resolvePage("  spaced topic \n", "de")).thenReturn(page);
        when(provider.getSummary(page)).thenReturn(SUMMARY);

        service.fetchSummary("  spaced topic \n");

        verify(provider).resolvePage("  spaced topic \n", "de");
    }

    @Test
    void fetchSummary_shouldPropagateResolveFailureWithoutFetchingSummary() {
        LookupException notFound = LookupException.pageNotFound("\"Qwzxplk\" does not match any pages. Try another query!");
        when(provider.resolvePage("Qwzxplk", "de")).thenThrow(notFound);

        LookupException thrown = assertThrows(LookupException.class, () -> service.fetchSummary("Qwzxplk"));

        assertSame(notFound, thrown);
        verify(provider, never()).getSummary(any());
    }

    @Test
    void fetchSummary_shouldPropagateSummaryFailure() {
        when(provider.resolvePage("General relativity", "de")).thenReturn(page);
        when(provider.getSummary(page)).thenThrow(LookupException.summaryUnavailable("no summary available"));

        LookupException thrown = assertThrows(LookupException.class, () -> service.fetchSummary("General relativity"));

        assertEquals(LookupException.Reason.SUMMARY_UNAVAILABLE, thrown.getReason());
    }

    @Test
    void fetchSummary_shouldNotCacheRepeatedTopics() {
        when(provider.resolvePage("General relativity", "de")).thenReturn(page);
        when(provider.getSummary(page)).thenReturn(SUMMARY);

        service.fetchSummary("General relativity");
        service.fetchSummary("General relativity");

        verify(provider, times(2)).resolvePage("General relativity", "de");
        verify(provider, times(2)).getSummary(page);
    }
}
