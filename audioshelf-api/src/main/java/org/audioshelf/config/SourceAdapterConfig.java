package org.audioshelf.config;

import org.audioshelf.service.source.SourceCascade;
import org.audioshelf.service.source.catalog.CatalogClient;
import org.audioshelf.service.source.catalog.CatalogLookupAdapter;
import org.audioshelf.service.source.catalog.NoOpCatalogClient;
import org.audioshelf.service.source.heuristic.PatternHeuristicAdapter;
import org.audioshelf.service.source.llm.LanguageModelAdapter;
import org.audioshelf.service.source.llm.LanguageModelClient;
import org.audioshelf.service.source.llm.NoOpLanguageModelClient;
import org.audioshelf.service.source.search.NoOpWebSearchClient;
import org.audioshelf.service.source.search.WebSearchAdapter;
import org.audioshelf.service.source.search.WebSearchClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Vendor clients are supplied by whoever embeds the service; without one the matching adapter
 * proposes nothing.
 */
@Configuration
public class SourceAdapterConfig {

    @Bean
    @ConditionalOnMissingBean(CatalogClient.class)
    public CatalogClient catalogClient() {
        return new NoOpCatalogClient();
    }

    @Bean
    @ConditionalOnMissingBean(LanguageModelClient.class)
    public LanguageModelClient languageModelClient() {
        return new NoOpLanguageModelClient();
    }

    @Bean
    @ConditionalOnMissingBean(WebSearchClient.class)
    public WebSearchClient webSearchClient() {
        return new NoOpWebSearchClient();
    }

    @Bean
    public SourceCascade sourceCascade(CatalogLookupAdapter catalogLookupAdapter, LanguageModelAdapter languageModelAdapter,
                                       WebSearchAdapter webSearchAdapter, PatternHeuristicAdapter patternHeuristicAdapter) {
        return new SourceCascade(List.of(
                catalogLookupAdapter,
                languageModelAdapter,
                webSearchAdapter,
                patternHeuristicAdapter
        ));
    }
}
