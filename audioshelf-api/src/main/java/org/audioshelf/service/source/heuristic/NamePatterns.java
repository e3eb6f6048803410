package org.audioshelf.service.source.heuristic;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.util.FileNameUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Positional patterns over file, folder and tag text. The patterns are structural only: an
 * optional single marker word is allowed before an ordinal, but its wording is never checked.
 */
@UtilityClass
public class NamePatterns {

    private static final String MARKER = "(?:[\\p{L}]+\\.?\\s*)?";
    private static final String ORDINAL = "#?(\\d{1,3})";
    private static final String SEPARATOR = "\\s*[-–—:._)]\\s*";

    // "The Way of Kings (The Stormlight Archive, Book 1)", "Mistborn [Era One #2]"
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile(
            "^(.*?)\\s*[\\(\\[]\\s*(.+?)(?:,\\s*|\\s+)" + MARKER + ORDINAL + "\\s*[\\)\\]]\\s*$");

    // "The Bladeborn Saga, Book 2", "The Bladeborn Saga, 2 - Ghost of the Shadowfort"
    private static final Pattern SERIES_COMMA = Pattern.compile(
            "^(.+?),\\s*" + MARKER + ORDINAL + "(?:" + SEPARATOR + "(.+))?$");

    // "Discworld #4", "Discworld #4: Mort"
    private static final Pattern SERIES_HASH = Pattern.compile(
            "^(.+?)\\s*#(\\d{1,3})(?:" + SEPARATOR + "(.+))?$");

    // "The Bladeborn Saga - Book 2", "The Bladeborn Saga - 2"
    private static final Pattern SERIES_DASH_ORDINAL = Pattern.compile(
            "^(.+?)\\s*[-–—]\\s*" + MARKER + "(\\d{1,3})$");

    // "Stormlight Archive 1 - The Way of Kings"; a single leading word is read as a marker instead
    private static final Pattern SERIES_ORDINAL_TITLE = Pattern.compile(
            "^(\\S+(?:\\s+\\S+)+?)\\s+" + ORDINAL + SEPARATOR + "(.+)$");

    // "Book 1 - The Song of the First Blade", "01. The Song of the First Blade", "3-An Echo of Titans"
    private static final Pattern LEADING_ORDINAL = Pattern.compile(
            "^" + MARKER + ORDINAL + SEPARATOR + "(.+)$");

    private static final List<Function<String, Optional<NameParse>>> PARSERS = List.of(
            text -> match(TRAILING_PARENTHETICAL, text).map(m -> parse(m.group(2), m.group(3), m.group(1))),
            text -> match(SERIES_COMMA, text).map(m -> parse(m.group(1), m.group(2), m.group(3))),
            text -> match(SERIES_HASH, text).map(m -> parse(m.group(1), m.group(2), m.group(3))),
            text -> match(SERIES_DASH_ORDINAL, text).map(m -> parse(m.group(1), m.group(2), null)),
            text -> match(SERIES_ORDINAL_TITLE, text).map(m -> parse(m.group(1), m.group(2), m.group(3))),
            text -> match(LEADING_ORDINAL, text).map(m -> parse(null, m.group(1), m.group(2)))
    );

    /**
     * First pattern that matches the normalized text, in order of specificity.
     */
    public Optional<NameParse> parse(String text) {
        String normalized = FileNameUtils.normalize(text);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Optional<NameParse>> parser : PARSERS) {
            Optional<NameParse> result = parser.apply(normalized);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Removes a trailing repetition of the series name from a title ("The Winds of War The
     * Bladeborn Saga" becomes "The Winds of War"). The title is returned unchanged when nothing
     * would remain.
     */
    public String stripSeriesSuffix(String title, String series) {
        if (StringUtils.isBlank(title) || StringUtils.isBlank(series)) {
            return title;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        String lowerSeries = FileNameUtils.cleanFragment(series).toLowerCase(Locale.ROOT);
        if (lowerTitle.endsWith(lowerSeries)) {
            String remainder = FileNameUtils.cleanFragment(title.substring(0, title.length() - lowerSeries.length()));
            if (!remainder.isEmpty()) {
                return remainder;
            }
        }
        return title;
    }

    private Optional<Matcher> match(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.matches() ? Optional.of(matcher) : Optional.empty();
    }

    private NameParse parse(String series, String index, String title) {
        String cleanSeries = blankToNull(FileNameUtils.cleanFragment(series));
        String cleanTitle = blankToNull(FileNameUtils.cleanFragment(title));
        return new NameParse(cleanSeries, Integer.valueOf(index), cleanTitle);
    }

    private String blankToNull(String value) {
        return StringUtils.isBlank(value) ? null : value;
    }
}
