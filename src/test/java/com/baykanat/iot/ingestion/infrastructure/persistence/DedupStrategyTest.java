package com.baykanat.iot.ingestion.infrastructure.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DedupStrategyTest {

    @Test
    @DisplayName("none - plain insert without conflict clause")
    void none() {
        assertThat(DedupStrategy.none().isKeyed()).isFalse();
        assertThat(DedupStrategy.none().conflictClause()).isEmpty();
        assertThat(DedupStrategy.fromConflictKey(List.of())).isEqualTo(DedupStrategy.none());
    }

    @Test
    @DisplayName("keyed - ON CONFLICT on the given columns")
    void keyed() {
        DedupStrategy strategy = DedupStrategy.fromConflictKey(List.of("app_id", " msg_id"));

        assertThat(strategy.isKeyed()).isTrue();
        assertThat(strategy.conflictClause()).isEqualTo("ON CONFLICT (app_id, msg_id) DO NOTHING");
    }

    @Test
    @DisplayName("keyed - column names that are not SQL identifiers are refused")
    void rejectsInvalidColumns() {
        assertThatThrownBy(() -> DedupStrategy.keyed(List.of("app_id; DROP TABLE x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DedupStrategy.keyed(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
