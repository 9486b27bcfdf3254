package com.delta.digest.tracker.persistence;

import com.delta.digest.tracker.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JdbcKeyValueStoreTest {
    private static final Instant NOW = Instant.parse("2025-12-20T00:00:00Z");

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void setWithTtlStoresExpiry() {
        JdbcKeyValueStore store = new JdbcKeyValueStore(jdbc, new MutableClock(NOW));

        store.set("job:1", "{}", Duration.ofHours(24));

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(anyString(), params.capture());
        MapSqlParameterSource captured = (MapSqlParameterSource) params.getValue();
        assertThat(captured.getValue("expiresAt")).isEqualTo(Timestamp.from(NOW.plus(Duration.ofHours(24))));
        assertThat(captured.getValue("value")).isEqualTo("{}");
    }

    @Test
    void setWithoutTtlNeverExpires() {
        JdbcKeyValueStore store = new JdbcKeyValueStore(jdbc, new MutableClock(NOW));

        store.set("current_job", "1", null);

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(anyString(), params.capture());
        assertThat(((MapSqlParameterSource) params.getValue()).getValue("expiresAt")).isNull();
    }

    @Test
    void emptyWritesSkipTheDatabase() {
        JdbcKeyValueStore store = new JdbcKeyValueStore(jdbc, new MutableClock(NOW));

        assertThat(store.listPop("q", 0)).isEmpty();
        assertThat(store.setAdd("seen", List.of())).isZero();
        assertThat(store.delete(List.of())).isZero();
        store.hashSet("h", java.util.Map.of());

        verifyNoInteractions(jdbc);
    }

    @Test
    void globToLikeEscapesLikeWildcards() {
        assertThat(JdbcKeyValueStore.globToLike("job:*")).isEqualTo("job:%");
        assertThat(JdbcKeyValueStore.globToLike("a_b%c!*")).isEqualTo("a!_b!%c!!%");
    }
}
