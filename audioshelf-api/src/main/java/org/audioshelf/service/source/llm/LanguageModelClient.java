package org.audioshelf.service.source.llm;

import org.audioshelf.exception.SourceUnavailableException;

/**
 * Chat-completion style access to a language model. Provider, model and credentials are the
 * implementation's concern.
 */
public interface LanguageModelClient {

    boolean isAvailable();

    String complete(String systemPrompt, String userPrompt, double temperature, int maxTokens) throws SourceUnavailableException;
}
