package com.example.scvl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

class SlugGeneratorTest {

    @Test
    @DisplayName("slugs have the configured length and use only the unambiguous alphabet")
    void generatesFromAlphabet() {
        SlugGenerator generator = new SlugGenerator(8);

        for (int i = 0; i < 500; i++) {
            String slug = generator.generate();
            assertThat(slug).hasSize(8);
            assertThat(slug.chars()).allMatch(c -> SlugGenerator.ALPHABET.indexOf(c) >= 0);
        }
        assertThat(SlugGenerator.ALPHABET).doesNotContain("0", "O", "o", "1", "l", "I");
    }

    @Test
    @DisplayName("concurrent generation produces distinct slugs")
    void concurrentGeneration() {
        SlugGenerator generator = new SlugGenerator(10);
        Set<String> slugs = ConcurrentHashMap.newKeySet();

        IntStream.range(0, 2000).parallel().forEach(i -> slugs.add(generator.generate()));

        assertThat(slugs).hasSize(2000);
    }

    @Test
    @DisplayName("out-of-range length is rejected")
    void rejectsBadLength() {
        assertThatThrownBy(() -> new SlugGenerator(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlugGenerator(17)).isInstanceOf(IllegalArgumentException.class);
    }
}
