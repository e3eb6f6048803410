package org.audioshelf.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.similarity.FuzzyScore;
import org.audioshelf.model.enums.MediaFileExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@UtilityClass
public class FileNameUtils {

    private static final Pattern FORMAT_INDICATOR_PATTERN = Pattern.compile(
            "[\\(\\[]\\s*(?:m4b|m4a|mp3|aac|flac|opus|ogg|unabridged|abridged)\\s*[\\)\\]]",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private static final Pattern UNDERSCORE_PATTERN = Pattern.compile("_");

    private static final Pattern EDGE_SEPARATORS_PATTERN = Pattern.compile("^[\\s\\-–—_:.,;]+|[\\s\\-–—_:.,;]+$");

    private static final Pattern TRAILING_ORDINAL_PATTERN = Pattern.compile("[\\s_\\-–—.#]*\\d{1,4}\\s*$");

    /**
     * File name without its extension. Only known media extensions are stripped, so dots inside
     * names ("Vol. 1", "U.S.A.") survive.
     */
    public String stem(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return "";
        }
        Optional<MediaFileExtension> extension = MediaFileExtension.fromFileName(fileName);
        if (extension.isPresent()) {
            return fileName.substring(0, fileName.length() - extension.get().getExtension().length() - 1);
        }
        return fileName;
    }

    public String stem(Path file) {
        return stem(file.getFileName().toString());
    }

    /**
     * Underscores to spaces, format indicators removed, whitespace collapsed. Case is kept.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String result = UNDERSCORE_PATTERN.matcher(text).replaceAll(" ");
        result = FORMAT_INDICATOR_PATTERN.matcher(result).replaceAll("");
        return WHITESPACE_PATTERN.matcher(result.trim()).replaceAll(" ");
    }

    public String groupingKey(String fileName) {
        return normalize(stem(fileName)).toLowerCase(Locale.ROOT);
    }

    /**
     * Trims separators and punctuation off both ends of a title fragment.
     */
    public String cleanFragment(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = EDGE_SEPARATORS_PATTERN.matcher(normalize(text)).replaceAll("");
        return WHITESPACE_PATTERN.matcher(cleaned).replaceAll(" ").trim();
    }

    public String stripTrailingOrdinal(String key) {
        String stripped = TRAILING_ORDINAL_PATTERN.matcher(key).replaceAll("");
        return stripped.isBlank() ? key : cleanFragment(stripped);
    }

    public double calculateSimilarity(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }
        String a = s1.toLowerCase(Locale.ROOT);
        String b = s2.toLowerCase(Locale.ROOT);
        FuzzyScore fuzzyScore = new FuzzyScore(Locale.ENGLISH);
        int score = Math.min(fuzzyScore.fuzzyScore(a, b), fuzzyScore.fuzzyScore(b, a));
        int maxScore = Math.max(
                fuzzyScore.fuzzyScore(a, a),
                fuzzyScore.fuzzyScore(b, b)
        );
        return maxScore > 0 ? (double) score / maxScore : 0;
    }

    /**
     * Longest common leading substring of all names, cut back so that it never ends inside a
     * token: a shared partial number ("Part 0" of "Part 01"/"Part 02") or a shared partial word
     * ("Ann" of "Annabel"/"Annie") is not counted as stem.
     */
    public String commonPrefix(List<String> names) {
        if (names == null || names.isEmpty()) {
            return "";
        }
        String prefix = names.get(0);
        for (String name : names.subList(1, names.size())) {
            prefix = StringUtils.getCommonPrefix(prefix.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
            if (prefix.isEmpty()) {
                return "";
            }
        }
        String original = names.get(0).substring(0, prefix.length());
        int cut = original.length();
        while (cut > 0 && Character.isDigit(original.charAt(cut - 1))) {
            cut--;
        }
        if (cut > 0 && Character.isLetter(original.charAt(cut - 1)) && continuesWithLetter(names, cut)) {
            while (cut > 0 && Character.isLetter(original.charAt(cut - 1))) {
                cut--;
            }
        }
        return original.substring(0, cut);
    }

    private boolean continuesWithLetter(List<String> names, int index) {
        return names.stream().anyMatch(n -> n.length() > index && Character.isLetter(n.charAt(index)));
    }

    public String folderName(Path dir) {
        Path name = dir == null ? null : dir.getFileName();
        return name == null ? "" : name.toString();
    }

    public String relativePath(Path root, Path path) {
        String relative = root.relativize(path).toString().replace("\\", "/");
        return relative.isEmpty() ? "." : relative;
    }

    public String extension(Path file) {
        return FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
    }

    public boolean isHidden(Path path) {
        String name = folderName(path);
        return name.startsWith(".");
    }
}
