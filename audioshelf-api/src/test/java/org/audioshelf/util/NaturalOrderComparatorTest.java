package org.audioshelf.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NaturalOrderComparatorTest {

    @Test
    void compare_shouldOrderEmbeddedNumbersByValue() {
        List<String> names = new ArrayList<>(List.of("Part 10.mp3", "Part 2.mp3", "Part 1.mp3", "part 3.mp3"));
        names.sort(NaturalOrderComparator.INSTANCE);
        assertThat(names).containsExactly("Part 1.mp3", "Part 2.mp3", "part 3.mp3", "Part 10.mp3");
    }

    @Test
    void compare_shouldTreatLeadingZerosAsSameValue() {
        List<String> names = new ArrayList<>(List.of("010.mp3", "9.mp3", "02.mp3"));
        names.sort(NaturalOrderComparator.INSTANCE);
        assertThat(names).containsExactly("02.mp3", "9.mp3", "010.mp3");
    }
}
