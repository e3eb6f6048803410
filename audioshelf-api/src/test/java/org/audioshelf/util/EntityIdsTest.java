package org.audioshelf.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityIdsTest {

    @Test
    void fromRelativePath_shouldBeStableAndShort() {
        String id = EntityIds.fromRelativePath("The Bladeborn Saga/Book 1.m4b");
        assertThat(id).hasSize(16).matches("[0-9a-f]+");
        assertThat(EntityIds.fromRelativePath("The Bladeborn Saga/Book 1.m4b")).isEqualTo(id);
        assertThat(EntityIds.fromRelativePath("The Bladeborn Saga/Book 2.m4b")).isNotEqualTo(id);
    }
}
