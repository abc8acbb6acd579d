package com.iplicense.search.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.iplicense.search.query.EntityKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HighlightGeneratorTest {

    @Test
    void wrapsEveryOccurrenceAndKeepsOriginalCasing() {
        assertThat(HighlightGenerator.highlight("Logo and LOGO pack", "logo"))
            .isEqualTo("<mark>Logo</mark> and <mark>LOGO</mark> pack");
    }

    @Test
    void treatsQueryLiterally() {
        assertThat(HighlightGenerator.highlight("price (a+b) list", "(a+b)"))
            .isEqualTo("price <mark>(a+b)</mark> list");
        assertThat(HighlightGenerator.highlight("nothing here", ".*")).isNull();
    }

    @Test
    void omitsFieldsWithoutMatch() {
        Candidate candidate = new Candidate(EntityKind.PROJECTS, "p-1", "Summer Campaign", "Beach logo shoot",
            null, null, null, null, null, null);

        Map<String, String> highlights = HighlightGenerator.highlights(candidate, "logo");

        assertThat(highlights).containsOnlyKeys("description");
        assertThat(highlights.get("description")).isEqualTo("Beach <mark>logo</mark> shoot");
    }
}
