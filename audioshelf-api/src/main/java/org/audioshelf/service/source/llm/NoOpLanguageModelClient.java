package org.audioshelf.service.source.llm;

public class NoOpLanguageModelClient implements LanguageModelClient {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        return "";
    }
}
