package org.audioshelf.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private String libraryRoot;
    private String storeFile = "./audioshelf-entries.json";

    /**
     * Directory where cover art pulled out of audio containers is written, one file per entity.
     */
    private String coverDir = "./audioshelf-covers";

    private Grouping grouping = new Grouping();
    private Resolution resolution = new Resolution();
    private Catalog catalog = new Catalog();
    private LanguageModel languageModel = new LanguageModel();
    private WebSearch webSearch = new WebSearch();
    private Heuristic heuristic = new Heuristic();

    @Getter
    @Setter
    public static class Grouping {
        /**
         * Below this similarity two residual titles in one folder are treated as different works.
         * Tunable: the chapters-vs-books split is a best-effort guess that a human approves.
         */
        private double distinctTitleThreshold = 0.6;
        private double folderHintConfidence = 0.3;
    }

    @Getter
    @Setter
    public static class Resolution {
        private double confidenceThreshold = 0.5;
        private double metadataConfidence = 0.9;
        private Duration adapterTimeout = Duration.ofSeconds(20);
        private int parallelism = 4;
    }

    @Getter
    @Setter
    public static class Catalog {
        private int maxPages = 2;
        private double minSimilarity = 0.5;
        private double maxConfidence = 0.85;
        private Duration minRequestInterval = Duration.ofMillis(100);
        private Duration cacheTtl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class LanguageModel {
        private double confidence = 0.45;
        private double temperature = 0.1;
        private int maxTokens = 2048;
        private String model;
    }

    @Getter
    @Setter
    public static class WebSearch {
        private double maxConfidence = 0.6;
        private int maxResults = 10;
    }

    @Getter
    @Setter
    public static class Heuristic {
        private double confidence = 0.3;
    }
}
