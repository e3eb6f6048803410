package org.audioshelf.service.library;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.audioshelf.config.AppProperties;
import org.audioshelf.model.dto.DirectoryListing;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.util.FileNameUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides the folder pattern of a directory from the structure of its file names alone. No
 * marker words are assumed: a chapter run is a shared stem followed by a strictly increasing
 * token, and anything else is split into works by stem.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FolderClassifier {

    private static final double SCAN_ROOT_CONFIDENCE = 1.0;
    private static final double LONE_FILE_CONFIDENCE = 0.9;
    private static final double CLUSTERED_WORK_CONFIDENCE = 0.6;
    private static final double MULTI_BOOK_CONFIDENCE = 0.7;
    private static final double AUTHOR_FOLDER_CONFIDENCE = 0.6;
    private static final double FUZZY_CLUSTER_THRESHOLD = 0.8;

    private static final Pattern LEADING_TOKEN_PATTERN = Pattern.compile("^[\\s\\-–—_.#:,]*(\\d{1,4}|[\\p{L}]{1,4})(?![\\p{L}\\d])(.*)$");
    private static final Pattern DIGIT_GROUP_PATTERN = Pattern.compile("\\d+");

    private final AppProperties appProperties;

    /**
     * The scan root is classified like any other directory, except that a lone file there is
     * certain to be a book of its own and the root is never taken for an author folder.
     *
     * @return the classification, or empty for a directory that only contains other containers
     */
    public Optional<FolderClassification> classify(DirectoryListing listing, Map<Path, DirectoryListing> tree, boolean scanRoot) {
        List<Path> audio = listing.getAudioFiles();
        if (scanRoot && audio.size() == 1) {
            return Optional.of(new FolderClassification(FolderPattern.SINGLE_FILE, List.of(audio), SCAN_ROOT_CONFIDENCE));
        }
        if (!audio.isEmpty()) {
            return Optional.of(classifyAudioDirectory(listing));
        }
        return classifyContainer(listing, tree, scanRoot);
    }

    private FolderClassification classifyAudioDirectory(DirectoryListing listing) {
        List<Path> audio = listing.getAudioFiles();
        if (audio.size() == 1) {
            return new FolderClassification(FolderPattern.SINGLE_FILE, List.of(audio), LONE_FILE_CONFIDENCE);
        }

        List<String> stems = audio.stream().map(FileNameUtils::stem).toList();
        ChapterRun run = chapterRun(stems);
        if (run.matched()) {
            log.debug("{}: {} files form a chapter run (residual similarity {})",
                    listing.getDirectory(), audio.size(), String.format(Locale.ROOT, "%.2f", run.similarity()));
            return new FolderClassification(FolderPattern.CHAPTERED_FOLDER, List.of(audio),
                    Math.min(0.95, 0.6 + 0.3 * run.similarity()));
        }

        List<List<Path>> works = clusterByStem(audio);
        if (works.size() == 1) {
            return new FolderClassification(FolderPattern.CHAPTERED_FOLDER, works, CLUSTERED_WORK_CONFIDENCE);
        }
        log.debug("{}: {} distinct works among {} files", listing.getDirectory(), works.size(), audio.size());
        return new FolderClassification(FolderPattern.MULTI_BOOK_FOLDER, works, MULTI_BOOK_CONFIDENCE);
    }

    private Optional<FolderClassification> classifyContainer(DirectoryListing listing, Map<Path, DirectoryListing> tree, boolean scanRoot) {
        List<DirectoryListing> children = listing.getSubdirectories().stream()
                .map(tree::get)
                .filter(Objects::nonNull)
                .toList();
        if (children.isEmpty() || !children.stream().allMatch(DirectoryListing::hasAudio)) {
            return Optional.empty();
        }

        // "Disc 1", "Disc 2": one book split over numbered folders
        boolean leafChildren = children.stream().allMatch(c -> c.getSubdirectories().isEmpty());
        if (children.size() > 1 && leafChildren) {
            List<String> names = children.stream().map(c -> FileNameUtils.folderName(c.getDirectory())).toList();
            ChapterRun run = chapterRun(names);
            if (run.matched() && run.similarity() >= 0.999) {
                List<Path> all = children.stream().flatMap(c -> c.getAudioFiles().stream()).toList();
                return Optional.of(new FolderClassification(FolderPattern.CHAPTERED_FOLDER, List.of(all), LONE_FILE_CONFIDENCE));
            }
        }
        if (scanRoot) {
            return Optional.empty();
        }
        return Optional.of(FolderClassification.authorFolder(AUTHOR_FOLDER_CONFIDENCE));
    }

    /**
     * Shared stem, then a strictly increasing numeric or short alphabetic token, then residual
     * text that does not tell the members apart.
     */
    ChapterRun chapterRun(List<String> names) {
        if (names.size() < 2) {
            return ChapterRun.NONE;
        }
        List<String> normalized = names.stream().map(FileNameUtils::normalize).toList();
        String prefix = FileNameUtils.commonPrefix(normalized);

        List<String> tokens = new ArrayList<>();
        List<String> residuals = new ArrayList<>();
        for (String name : normalized) {
            Matcher matcher = LEADING_TOKEN_PATTERN.matcher(name.substring(prefix.length()));
            if (!matcher.matches()) {
                return ChapterRun.NONE;
            }
            tokens.add(matcher.group(1));
            residuals.add(FileNameUtils.cleanFragment(matcher.group(2)).toLowerCase(Locale.ROOT));
        }
        if (!strictlyIncreasing(tokens, !prefix.isBlank())) {
            return ChapterRun.NONE;
        }

        double total = 0;
        for (int i = 1; i < residuals.size(); i++) {
            String a = residuals.get(i - 1);
            String b = residuals.get(i);
            total += a.isEmpty() && b.isEmpty() ? 1.0 : FileNameUtils.calculateSimilarity(a, b);
        }
        double mean = total / (residuals.size() - 1);
        if (mean < appProperties.getGrouping().getDistinctTitleThreshold()) {
            return ChapterRun.NONE;
        }
        return new ChapterRun(true, mean);
    }

    /**
     * Alphabetic runs ("Part A", "Part B") only count behind a shared stem; bare short words
     * ("Dune", "Emma") are titles, not ordinals.
     */
    private boolean strictlyIncreasing(List<String> tokens, boolean sharedStem) {
        boolean numeric = tokens.stream().allMatch(t -> t.chars().allMatch(Character::isDigit));
        boolean alphabetic = sharedStem && tokens.stream().allMatch(t -> t.chars().allMatch(Character::isLetter));
        if (!numeric && !alphabetic) {
            return false;
        }
        for (int i = 1; i < tokens.size(); i++) {
            String previous = tokens.get(i - 1);
            String current = tokens.get(i);
            int cmp = numeric
                    ? Integer.compare(Integer.parseInt(previous), Integer.parseInt(current))
                    : previous.toLowerCase(Locale.ROOT).compareTo(current.toLowerCase(Locale.ROOT));
            if (cmp >= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Union-find over the files: two files belong to one work when their stems agree once a
     * trailing ordinal is removed, or are near-identical without carrying different numbers.
     */
    private List<List<Path>> clusterByStem(List<Path> files) {
        List<String> keys = files.stream()
                .map(f -> FileNameUtils.stripTrailingOrdinal(FileNameUtils.groupingKey(f.getFileName().toString())))
                .toList();

        int[] parent = new int[files.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < files.size(); i++) {
            for (int j = i + 1; j < files.size(); j++) {
                String key1 = keys.get(i);
                String key2 = keys.get(j);
                boolean sameWork = key1.equals(key2)
                        || (sameNumbers(key1, key2) && FileNameUtils.calculateSimilarity(key1, key2) >= FUZZY_CLUSTER_THRESHOLD);
                if (sameWork) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<Path>> clusters = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            clusters.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(files.get(i));
        }
        return new ArrayList<>(clusters.values());
    }

    private boolean sameNumbers(String key1, String key2) {
        return digitGroups(key1).equals(digitGroups(key2));
    }

    private List<Integer> digitGroups(String key) {
        List<Integer> groups = new ArrayList<>();
        Matcher matcher = DIGIT_GROUP_PATTERN.matcher(key);
        while (matcher.find()) {
            groups.add(Integer.parseInt(matcher.group().length() > 9 ? matcher.group().substring(0, 9) : matcher.group()));
        }
        return groups;
    }

    private int find(int[] parent, int i) {
        if (parent[i] != i) {
            parent[i] = find(parent, parent[i]);
        }
        return parent[i];
    }

    private void union(int[] parent, int i, int j) {
        int rootI = find(parent, i);
        int rootJ = find(parent, j);
        if (rootI != rootJ) {
            parent[rootJ] = rootI;
        }
    }

    record ChapterRun(boolean matched, double similarity) {
        static final ChapterRun NONE = new ChapterRun(false, 0);
    }
}
