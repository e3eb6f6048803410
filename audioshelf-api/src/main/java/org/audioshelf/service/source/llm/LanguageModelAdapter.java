package org.audioshelf.service.source.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.source.SourceAdapter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asks a language model to read the folder layout like a librarian would. Low certainty by
 * construction; an unconfigured model simply yields nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LanguageModelAdapter implements SourceAdapter {

    static final String SYSTEM_PROMPT = """
            You are a librarian cataloguing audiobooks from their files alone.
            Work out the author, the series (if any), the position in that series and the book title.
            Keep pen names exactly as they appear; never substitute an author's legal name.
            Leave series and series_index null for standalone books.
            Answer with a single JSON object and nothing else:
            {"title": string, "author": string|null, "series": string|null, "series_index": integer|null}""";

    private static final List<String> REQUIRED_KEYS = List.of("title", "author", "series", "series_index");

    private final LanguageModelClient languageModelClient;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    @Override
    public Provenance provenance() {
        return Provenance.LANGUAGE_MODEL;
    }

    @Override
    public List<FieldProposal> propose(ProposalRequest request) throws SourceUnavailableException {
        if (!languageModelClient.isAvailable()) {
            return List.of();
        }
        AppProperties.LanguageModel settings = appProperties.getLanguageModel();
        String reply = languageModelClient.complete(SYSTEM_PROMPT, userPrompt(request), settings.getTemperature(), settings.getMaxTokens());
        return parseReply(reply, request);
    }

    String userPrompt(ProposalRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Folder structure:\n").append(request.getCandidate().describeStructure()).append("\n");
        if (!request.getRawTextHints().isEmpty()) {
            prompt.append("\nOther names seen:\n");
            request.getRawTextHints().forEach(h -> prompt.append("- ").append(h).append("\n"));
        }
        if (!request.getKnownFields().isEmpty()) {
            prompt.append("\nAlready known (keep unless clearly wrong):\n");
            for (Map.Entry<CanonicalField, String> known : request.getKnownFields().entrySet()) {
                prompt.append("- ").append(known.getKey().getKey()).append(": ").append(known.getValue()).append("\n");
            }
        }
        return prompt.toString();
    }

    /**
     * Takes the outermost JSON object out of the reply. Replies that are not JSON or lack any of
     * the expected keys are ignored.
     */
    List<FieldProposal> parseReply(String reply, ProposalRequest request) {
        if (reply == null) {
            return List.of();
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("Language model reply for {} contained no JSON object", request.getCandidate().getRelativePath());
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.warn("Language model reply for {} is not valid JSON: {}", request.getCandidate().getRelativePath(), e.getOriginalMessage());
            return List.of();
        }
        if (!root.isObject() || !REQUIRED_KEYS.stream().allMatch(root::has)) {
            log.warn("Language model reply for {} is missing required keys", request.getCandidate().getRelativePath());
            return List.of();
        }

        double confidence = appProperties.getLanguageModel().getConfidence();
        List<FieldProposal> proposals = new ArrayList<>();
        add(proposals, request, CanonicalField.TITLE, text(root.get("title")), confidence);
        add(proposals, request, CanonicalField.AUTHOR, text(root.get("author")), confidence);
        add(proposals, request, CanonicalField.SERIES, text(root.get("series")), confidence);
        add(proposals, request, CanonicalField.SERIES_INDEX, index(root.get("series_index")), confidence);
        return proposals;
    }

    private void add(List<FieldProposal> proposals, ProposalRequest request, CanonicalField field, String value, double confidence) {
        if (value != null && request.wants(field)) {
            proposals.add(new FieldProposal(field, value, confidence, Provenance.LANGUAGE_MODEL));
        }
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }

    private String index(JsonNode node) {
        String value = text(node);
        if (value == null) {
            return null;
        }
        try {
            double number = Double.parseDouble(value);
            if (number < 0 || number != Math.floor(number)) {
                return null;
            }
            return String.valueOf((int) number);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
