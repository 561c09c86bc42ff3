package com.stockbook.domain.journal;

import com.stockbook.domain.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JournalEntryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Test
    void contentIsRequiredAndBounded() {
        assertThatThrownBy(() -> JournalEntry.note(DAY, "   ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> JournalEntry.note(DAY, "x".repeat(10_001))).isInstanceOf(ValidationException.class);
        assertThat(JournalEntry.note(DAY, "x".repeat(10_000)).content()).hasSize(10_000);
    }

    @Test
    void tagsAreTrimmedAndDeduplicated() {
        JournalEntry e = new JournalEntry(1L, null, null, DAY, " Plan ", "Buy the dip",
                Arrays.asList(" swing ", "swing", "", null, "earnings"));
        assertThat(e.tags()).containsExactly("swing", "earnings");
        assertThat(e.title()).isEqualTo("Plan");
    }

    @Test
    void linkedIdsMustBePositive() {
        assertThatThrownBy(() -> new JournalEntry(0L, null, null, DAY, null, "text", null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void preview() {
        assertThat(JournalEntry.note(DAY, "abcdef").preview(3)).isEqualTo("abc...");
        assertThat(JournalEntry.note(DAY, "abc").preview(3)).isEqualTo("abc");
    }
}
