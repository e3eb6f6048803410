package org.audioshelf.service.source.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.source.SearchTerms;
import org.audioshelf.service.source.SourceAdapter;
import org.audioshelf.service.source.heuristic.NameParse;
import org.audioshelf.service.source.heuristic.NamePatterns;
import org.audioshelf.util.FileNameUtils;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Searches the web with the known hints and reads plausible title, author and series tokens off
 * the result titles and snippets. Values are voted across results; confidence never exceeds the
 * configured cap, which sits below the catalog's.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSearchAdapter implements SourceAdapter {

    private static final double MIN_TITLE_SIMILARITY = 0.5;

    // "The Way of Kings by Brandon Sanderson"
    private static final Pattern TITLE_BY_AUTHOR = Pattern.compile(
            "^(.+?)\\s+by\\s+(\\p{Lu}[\\p{L}.'\\-]*(?:\\s+\\p{Lu}[\\p{L}.'\\-]*){0,3})");

    // "... written by Brandon Sanderson ..." inside a snippet
    private static final Pattern AUTHOR_IN_TEXT = Pattern.compile(
            "\\bby\\s+(\\p{Lu}[\\p{L}.'\\-]*(?:\\s+\\p{Lu}[\\p{L}.'\\-]*){1,3})");

    // site names appended to result titles: " | Goodreads", " - Wikipedia"
    private static final Pattern SITE_SUFFIX = Pattern.compile("\\s+[|·»]\\s+.*$|\\s+[-–—]\\s+[\\p{L}.]+$");

    private final WebSearchClient webSearchClient;
    private final AppProperties appProperties;

    @Override
    public Provenance provenance() {
        return Provenance.WEB_SEARCH;
    }

    @Override
    public List<FieldProposal> propose(ProposalRequest request) throws SourceUnavailableException {
        if (!webSearchClient.isAvailable()) {
            return List.of();
        }
        String title = SearchTerms.title(request);
        if (StringUtils.isBlank(title)) {
            return List.of();
        }
        String query = buildQuery(title, request);
        List<WebSearchResult> results = webSearchClient.search(query, appProperties.getWebSearch().getMaxResults());
        if (results == null || results.isEmpty()) {
            log.debug("Web search: no results for '{}'", query);
            return List.of();
        }
        return vote(title, results, request);
    }

    String buildQuery(String title, ProposalRequest request) {
        List<String> terms = new ArrayList<>();
        terms.add(title);
        Optional.ofNullable(request.knownOrHint(CanonicalField.AUTHOR)).ifPresent(terms::add);
        Optional.ofNullable(request.knownOrHint(CanonicalField.SERIES)).ifPresent(terms::add);
        terms.add("audiobook");
        return String.join(" ", terms);
    }

    private List<FieldProposal> vote(String queryTitle, List<WebSearchResult> results, ProposalRequest request) {
        Map<CanonicalField, Map<String, Integer>> votes = new EnumMap<>(CanonicalField.class);
        Map<String, String> spelling = new LinkedHashMap<>();
        int relevant = 0;

        for (WebSearchResult result : results) {
            String resultTitle = SITE_SUFFIX.matcher(plainText(result.title())).replaceAll("").trim();
            String snippet = plainText(result.snippet());

            String parsedTitle = resultTitle;
            String author = null;
            Matcher byAuthor = TITLE_BY_AUTHOR.matcher(resultTitle);
            if (byAuthor.find()) {
                parsedTitle = byAuthor.group(1);
                author = byAuthor.group(2);
            } else {
                Matcher inText = AUTHOR_IN_TEXT.matcher(snippet);
                if (inText.find()) {
                    author = withoutSentencePeriod(inText.group(1));
                }
            }

            Optional<NameParse> seriesParse = NamePatterns.parse(parsedTitle).filter(NameParse::hasSeries);
            if (seriesParse.isPresent() && seriesParse.get().title() != null) {
                parsedTitle = seriesParse.get().title();
            }
            parsedTitle = FileNameUtils.cleanFragment(parsedTitle);
            if (FileNameUtils.calculateSimilarity(parsedTitle, queryTitle) < MIN_TITLE_SIMILARITY) {
                continue;
            }
            relevant++;

            count(votes, spelling, CanonicalField.TITLE, parsedTitle);
            count(votes, spelling, CanonicalField.AUTHOR, author);
            seriesParse.ifPresent(p -> {
                count(votes, spelling, CanonicalField.SERIES, p.series());
                count(votes, spelling, CanonicalField.SERIES_INDEX, p.index() == null ? null : String.valueOf(p.index()));
            });
        }

        if (relevant == 0) {
            log.debug("Web search: {} results, none about '{}'", results.size(), queryTitle);
            return List.of();
        }

        double cap = appProperties.getWebSearch().getMaxConfidence();
        List<FieldProposal> proposals = new ArrayList<>();
        for (Map.Entry<CanonicalField, Map<String, Integer>> entry : votes.entrySet()) {
            if (!request.wants(entry.getKey())) {
                continue;
            }
            Map.Entry<String, Integer> winner = null;
            for (Map.Entry<String, Integer> candidate : entry.getValue().entrySet()) {
                if (winner == null || candidate.getValue() > winner.getValue()) {
                    winner = candidate;
                }
            }
            if (winner != null) {
                double share = (double) winner.getValue() / relevant;
                double confidence = cap * (0.5 + 0.5 * share);
                proposals.add(new FieldProposal(entry.getKey(), spelling.get(winner.getKey()), confidence, Provenance.WEB_SEARCH));
            }
        }
        return proposals;
    }

    private void count(Map<CanonicalField, Map<String, Integer>> votes, Map<String, String> spelling, CanonicalField field, String value) {
        if (StringUtils.isBlank(value)) {
            return;
        }
        String key = field.getKey() + ":" + value.trim().toLowerCase(Locale.ROOT);
        spelling.putIfAbsent(key, value.trim());
        votes.computeIfAbsent(field, f -> new LinkedHashMap<>()).merge(key, 1, Integer::sum);
    }

    /**
     * Drops a sentence-ending period after a name; initials such as "J.R.R." keep theirs.
     */
    private String withoutSentencePeriod(String name) {
        int lastSpace = name.lastIndexOf(' ');
        String lastToken = name.substring(lastSpace + 1);
        if (lastToken.endsWith(".") && lastToken.length() > 2 && !lastToken.substring(0, lastToken.length() - 1).contains(".")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }

    private String plainText(String html) {
        return html == null ? "" : Jsoup.parse(html).text();
    }
}
