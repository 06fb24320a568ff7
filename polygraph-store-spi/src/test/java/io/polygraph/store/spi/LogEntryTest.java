package io.polygraph.store.spi;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogEntryTest {

    @Test
    void entryNeedsAtLeastOneMutation() {
        assertThatThrownBy(() -> new LogEntry(0, 0, List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LogEntry(-1, 0, List.of(Mutation.delete("k"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mutationsAreCopied() {
        List<Mutation> mutations = new ArrayList<>(List.of(Mutation.delete("a")));
        LogEntry entry = new LogEntry(0, 0, mutations);

        mutations.add(Mutation.delete("b"));

        assertThat(entry.mutations()).hasSize(1);
    }

    @Test
    void putRequiresValueAndDeleteDropsIt() {
        assertThatThrownBy(() -> Mutation.put("k", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Mutation(Mutation.Op.DELETE, "k", "x".getBytes(StandardCharsets.UTF_8)).value()).isNull();
    }

    @Test
    void reportIsCleanOnlyWithoutFindings() {
        assertThat(new ReconcileReport(List.of(), List.of(), List.of(), List.of(), List.of()).clean()).isTrue();
        assertThat(new ReconcileReport(List.of("rel_a_b_c"), List.of(), List.of(), List.of("rel_a_b_c"), List.of()).clean())
                .isFalse();
    }
}
