package org.audioshelf.service.source.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.WordUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.source.RequestThrottle;
import org.audioshelf.service.source.SearchTerms;
import org.audioshelf.service.source.SourceAdapter;
import org.audioshelf.util.FileNameUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Looks a candidate up in an online bibliographic catalog. A query with every known hint that
 * finds nothing is retried with fewer terms before the adapter gives up.
 */
@Slf4j
@Component
public class CatalogLookupAdapter implements SourceAdapter {

    private static final double AUTHOR_BONUS = 0.15;
    private static final double SERIES_BONUS = 0.05;
    private static final double AUTHOR_MATCH_THRESHOLD = 0.6;
    private static final long MAX_CACHED_QUERIES = 10_000;

    private static final Pattern SUBTITLE_PATTERN = Pattern.compile("\\s*(?::|\\s[-–—]\\s|[\\(\\[]).*$");
    private static final Pattern PUNCTUATION_PATTERN = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([:;,.!?])");

    private final CatalogClient catalogClient;
    private final AppProperties appProperties;
    private final RequestThrottle throttle;
    private final Cache<String, List<CatalogHit>> cache;

    public CatalogLookupAdapter(CatalogClient catalogClient, AppProperties appProperties) {
        this.catalogClient = catalogClient;
        this.appProperties = appProperties;
        AppProperties.Catalog catalog = appProperties.getCatalog();
        this.throttle = new RequestThrottle(catalog.getMinRequestInterval());
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(catalog.getCacheTtl())
                .maximumSize(MAX_CACHED_QUERIES)
                .build();
    }

    @Override
    public Provenance provenance() {
        return Provenance.CATALOG_API;
    }

    @Override
    public List<FieldProposal> propose(ProposalRequest request) throws SourceUnavailableException {
        if (!catalogClient.isAvailable()) {
            return List.of();
        }
        List<CatalogQuery> queries = narrowingQueries(request);
        if (queries.isEmpty()) {
            log.debug("Catalog: nothing to search with for {}", request.getCandidate().getRelativePath());
            return List.of();
        }

        for (CatalogQuery query : queries) {
            List<CatalogHit> hits = fetch(query);
            Optional<ScoredHit> best = bestMatch(query, hits);
            if (best.isPresent()) {
                log.info("Catalog: matched '{}' with {} (score {})", best.get().hit().getTitle(), query.describe(),
                        String.format(Locale.ROOT, "%.2f", best.get().score()));
                return toProposals(best.get(), request);
            }
            log.debug("Catalog: no match for {}, narrowing", query.describe());
        }
        log.info("Catalog: no match for '{}' after {} queries", queries.get(0).title(), queries.size());
        return List.of();
    }

    /**
     * Full hints, then without series, then without punctuation and subtitle, then title only.
     * Steps that would repeat an earlier query are skipped.
     */
    List<CatalogQuery> narrowingQueries(ProposalRequest request) {
        String title = SearchTerms.title(request);
        if (StringUtils.isBlank(title)) {
            return List.of();
        }
        String author = request.knownOrHint(CanonicalField.AUTHOR);
        String series = request.knownOrHint(CanonicalField.SERIES);
        String bareTitle = stripPunctuationAndSubtitle(title);

        Map<String, CatalogQuery> queries = new LinkedHashMap<>();
        List<CatalogQuery> steps = List.of(
                new CatalogQuery(title, author, series),
                new CatalogQuery(title, author, null),
                new CatalogQuery(bareTitle.isEmpty() ? title : bareTitle, author, null),
                new CatalogQuery(bareTitle.isEmpty() ? title : bareTitle, null, null)
        );
        steps.forEach(q -> queries.putIfAbsent(q.key(), q));
        return new ArrayList<>(queries.values());
    }

    String stripPunctuationAndSubtitle(String title) {
        String withoutSubtitle = SUBTITLE_PATTERN.matcher(title).replaceAll("");
        if (withoutSubtitle.isBlank()) {
            withoutSubtitle = title;
        }
        String withoutPunctuation = PUNCTUATION_PATTERN.matcher(withoutSubtitle).replaceAll(" ");
        return WHITESPACE_PATTERN.matcher(withoutPunctuation.trim()).replaceAll(" ");
    }

    private List<CatalogHit> fetch(CatalogQuery query) throws SourceUnavailableException {
        List<CatalogHit> cached = cache.getIfPresent(query.key());
        if (cached != null) {
            return cached;
        }
        List<CatalogHit> hits = new ArrayList<>();
        int maxPages = Math.max(1, appProperties.getCatalog().getMaxPages());
        for (int page = 0; page < maxPages; page++) {
            throttle.acquire();
            CatalogPage result = catalogClient.search(query, page);
            if (result == null) {
                break;
            }
            hits.addAll(result.hits());
            if (!result.hasMore()) {
                break;
            }
        }
        List<CatalogHit> immutable = List.copyOf(hits);
        cache.put(query.key(), immutable);
        return immutable;
    }

    private Optional<ScoredHit> bestMatch(CatalogQuery query, List<CatalogHit> hits) {
        double minSimilarity = appProperties.getCatalog().getMinSimilarity();
        ScoredHit best = null;
        for (CatalogHit hit : hits) {
            if (StringUtils.isBlank(hit.getTitle())) {
                continue;
            }
            double titleSimilarity = FileNameUtils.calculateSimilarity(comparable(query.title()), comparable(hit.getTitle()));
            if (titleSimilarity < minSimilarity) {
                continue;
            }
            double score = titleSimilarity;
            if (query.author() != null && hit.getAuthors().stream()
                    .anyMatch(a -> FileNameUtils.calculateSimilarity(comparable(a), comparable(query.author())) >= AUTHOR_MATCH_THRESHOLD)) {
                score += AUTHOR_BONUS;
            }
            if (query.series() != null && hit.getSeries() != null
                    && comparable(hit.getSeries()).equals(comparable(query.series()))) {
                score += SERIES_BONUS;
            }
            score = Math.min(1.0, score);
            if (best == null || score > best.score()) {
                best = new ScoredHit(hit, score);
            }
        }
        return Optional.ofNullable(best);
    }

    private List<FieldProposal> toProposals(ScoredHit scored, ProposalRequest request) {
        double confidence = appProperties.getCatalog().getMaxConfidence() * scored.score();
        CatalogHit hit = scored.hit();
        List<FieldProposal> proposals = new ArrayList<>();
        if (request.wants(CanonicalField.TITLE)) {
            add(proposals, CanonicalField.TITLE, normalizeTitle(hit.getTitle()), confidence);
        }
        if (request.wants(CanonicalField.AUTHOR) && !hit.getAuthors().isEmpty()) {
            add(proposals, CanonicalField.AUTHOR, normalizeAuthor(hit.getAuthors().get(0)), confidence);
        }
        if (request.wants(CanonicalField.SERIES) && hit.getSeries() != null) {
            add(proposals, CanonicalField.SERIES, normalizeTitle(hit.getSeries()), confidence);
        }
        if (request.wants(CanonicalField.SERIES_INDEX) && hit.getSeriesIndex() != null) {
            add(proposals, CanonicalField.SERIES_INDEX, String.valueOf(hit.getSeriesIndex()), confidence);
        }
        return proposals;
    }

    private void add(List<FieldProposal> proposals, CanonicalField field, String value, double confidence) {
        if (StringUtils.isNotBlank(value)) {
            proposals.add(new FieldProposal(field, value, confidence, Provenance.CATALOG_API));
        }
    }

    /**
     * Catalogs often return authors in one case only; mixed-case names are kept as given.
     */
    String normalizeAuthor(String author) {
        String trimmed = WHITESPACE_PATTERN.matcher(author.trim()).replaceAll(" ");
        if (trimmed.equals(trimmed.toUpperCase(Locale.ROOT)) || trimmed.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return WordUtils.capitalizeFully(trimmed, ' ', '.', '-', '\'');
        }
        return trimmed;
    }

    String normalizeTitle(String title) {
        String result = title.replace('‘', '\'').replace('’', '\'')
                .replace('“', '"').replace('”', '"');
        result = WHITESPACE_PATTERN.matcher(result.trim()).replaceAll(" ");
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        return StringUtils.stripEnd(result, " .,;:");
    }

    private String comparable(String text) {
        return stripPunctuationAndSubtitle(text).toLowerCase(Locale.ROOT);
    }

    private record ScoredHit(CatalogHit hit, double score) {
    }
}
