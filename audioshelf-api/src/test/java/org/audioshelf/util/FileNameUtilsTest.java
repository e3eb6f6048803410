package org.audioshelf.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileNameUtilsTest {

    @Test
    void stem_shouldStripOnlyKnownExtensions() {
        assertThat(FileNameUtils.stem("Dune.m4b")).isEqualTo("Dune");
        assertThat(FileNameUtils.stem("cover.JPG")).isEqualTo("cover");
        assertThat(FileNameUtils.stem("Vol. 1 - Adventures.mp3")).isEqualTo("Vol. 1 - Adventures");
        assertThat(FileNameUtils.stem("U.S.A. History")).isEqualTo("U.S.A. History");
        assertThat(FileNameUtils.stem("notes.txt")).isEqualTo("notes.txt");
    }

    @Test
    void stem_shouldHandleNullAndEmpty() {
        assertThat(FileNameUtils.stem((String) null)).isEmpty();
        assertThat(FileNameUtils.stem("")).isEmpty();
    }

    @Test
    void normalize_shouldReplaceUnderscoresAndDropFormatIndicators() {
        assertThat(FileNameUtils.normalize("The_Hobbit (Unabridged)")).isEqualTo("The Hobbit");
        assertThat(FileNameUtils.normalize("Dune  [m4b]")).isEqualTo("Dune");
        assertThat(FileNameUtils.normalize("  Mixed   Spacing ")).isEqualTo("Mixed Spacing");
    }

    @Test
    void groupingKey_shouldBeCaseInsensitive() {
        assertThat(FileNameUtils.groupingKey("THE HOBBIT.mp3")).isEqualTo(FileNameUtils.groupingKey("the hobbit.m4b"));
    }

    @Test
    void stripTrailingOrdinal_shouldKeepNamesThatAreOnlyNumbers() {
        assertThat(FileNameUtils.stripTrailingOrdinal("dune part 02")).isEqualTo("dune part");
        assertThat(FileNameUtils.stripTrailingOrdinal("dune - 3")).isEqualTo("dune");
        assertThat(FileNameUtils.stripTrailingOrdinal("1984")).isEqualTo("1984");
    }

    @Test
    void cleanFragment_shouldTrimSeparators() {
        assertThat(FileNameUtils.cleanFragment(" - The Song of the First Blade ")).isEqualTo("The Song of the First Blade");
        assertThat(FileNameUtils.cleanFragment(null)).isEmpty();
    }

    @Test
    void commonPrefix_shouldNotEndInsideAToken() {
        assertThat(FileNameUtils.commonPrefix(List.of("Dune Part 01", "Dune Part 02"))).isEqualTo("Dune Part ");
        assertThat(FileNameUtils.commonPrefix(List.of("Part 10", "Part 11"))).isEqualTo("Part ");
        assertThat(FileNameUtils.commonPrefix(List.of("Annabel", "Annie"))).isEmpty();
        assertThat(FileNameUtils.commonPrefix(List.of("CD1", "CD2"))).isEqualTo("CD");
        assertThat(FileNameUtils.commonPrefix(List.of("01", "02"))).isEmpty();
        assertThat(FileNameUtils.commonPrefix(List.of())).isEmpty();
    }

    @Test
    void calculateSimilarity_shouldBeOneForEqualTextAndLowForDistinctTitles() {
        assertThat(FileNameUtils.calculateSimilarity("Dune", "dune")).isEqualTo(1.0);
        assertThat(FileNameUtils.calculateSimilarity("ghost of the shadowfort", "an echo of titans")).isLessThan(0.3);
        assertThat(FileNameUtils.calculateSimilarity("", "dune")).isZero();
    }

    @Test
    void relativePath_shouldUseForwardSlashesAndDotForRoot() {
        Path root = Path.of("/library");
        assertThat(FileNameUtils.relativePath(root, root)).isEqualTo(".");
        assertThat(FileNameUtils.relativePath(root, root.resolve("Author").resolve("Book.m4b"))).isEqualTo("Author/Book.m4b");
    }

    @Test
    void isHidden_shouldDetectDotPrefixedNames() {
        assertThat(FileNameUtils.isHidden(Path.of("/library/.trash"))).isTrue();
        assertThat(FileNameUtils.isHidden(Path.of("/library/Dune"))).isFalse();
    }
}
