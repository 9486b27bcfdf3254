package com.delta.digest.tracker.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Repository
@ConditionalOnProperty(prefix = "tracker.store", name = "backend", havingValue = "jdbc")
public class JdbcKeyValueStore implements KeyValueStore {
    private static final char LIKE_ESCAPE = '!';

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcKeyValueStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("now", Timestamp.from(clock.instant()));
        List<String> results = jdbc.query(
            """
                SELECT value
                FROM kv_entries
                WHERE entry_key = :key
                  AND (expires_at IS NULL OR expires_at > :now)
                """,
            params,
            (rs, rowNum) -> rs.getString("value")
        );
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("expiresAt", ttl == null ? null : Timestamp.from(now.plus(ttl)))
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                INSERT INTO kv_entries (entry_key, value, expires_at, updated_at)
                VALUES (:key, :value, :expiresAt, :now)
                ON CONFLICT (entry_key)
                DO UPDATE SET value = EXCLUDED.value,
                              expires_at = EXCLUDED.expires_at,
                              updated_at = EXCLUDED.updated_at
                """,
            params
        );
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        List<String> results = jdbc.query(
            """
                SELECT value
                FROM kv_hash_fields
                WHERE entry_key = :key
                  AND field = :field
                """,
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("field", field),
            (rs, rowNum) -> rs.getString("value")
        );
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    @Override
    public void hashSet(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return;
        }
        List<SqlParameterSource> batch = new ArrayList<>();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            batch.add(new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("field", entry.getKey())
                .addValue("value", entry.getValue()));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO kv_hash_fields (entry_key, field, value)
                VALUES (:key, :field, :value)
                ON CONFLICT (entry_key, field)
                DO UPDATE SET value = EXCLUDED.value
                """,
            batch.toArray(new SqlParameterSource[0])
        );
    }

    @Override
    public Map<String, String> hashGetAll(String key) {
        Map<String, String> out = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT field, value
                FROM kv_hash_fields
                WHERE entry_key = :key
                ORDER BY field
                """,
            new MapSqlParameterSource().addValue("key", key),
            rs -> {
                out.put(rs.getString("field"), rs.getString("value"));
            }
        );
        return out;
    }

    @Override
    public long listPush(String key, List<String> values) {
        if (values != null && !values.isEmpty()) {
            List<SqlParameterSource> batch = new ArrayList<>();
            for (String value : values) {
                batch.add(new MapSqlParameterSource()
                    .addValue("key", key)
                    .addValue("value", value));
            }
            jdbc.batchUpdate(
                """
                    INSERT INTO kv_list_entries (entry_key, value)
                    VALUES (:key, :value)
                    """,
                batch.toArray(new SqlParameterSource[0])
            );
        }
        return listLength(key);
    }

    @Override
    public List<String> listPop(String key, int count) {
        if (count <= 0) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("count", count);
        List<ListEntry> popped = new ArrayList<>(jdbc.query(
            """
                DELETE FROM kv_list_entries
                WHERE id IN (
                    SELECT id
                    FROM kv_list_entries
                    WHERE entry_key = :key
                    ORDER BY id ASC
                    LIMIT :count
                    FOR UPDATE SKIP LOCKED
                )
                RETURNING id, value
                """,
            params,
            (rs, rowNum) -> new ListEntry(rs.getLong("id"), rs.getString("value"))
        ));
        popped.sort(Comparator.comparingLong(ListEntry::id));
        List<String> out = new ArrayList<>(popped.size());
        for (ListEntry entry : popped) {
            out.add(entry.value());
        }
        return out;
    }

    @Override
    public long listLength(String key) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM kv_list_entries
                WHERE entry_key = :key
                """,
            new MapSqlParameterSource().addValue("key", key),
            Long.class
        );
        return count == null ? 0L : count;
    }

    @Override
    public long setAdd(String key, Collection<String> members) {
        if (members == null || members.isEmpty()) {
            return 0;
        }
        List<SqlParameterSource> batch = new ArrayList<>();
        for (String member : new LinkedHashSet<>(members)) {
            batch.add(new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("member", member));
        }
        int[] counts = jdbc.batchUpdate(
            """
                INSERT INTO kv_set_members (entry_key, member)
                VALUES (:key, :member)
                ON CONFLICT (entry_key, member) DO NOTHING
                """,
            batch.toArray(new SqlParameterSource[0])
        );
        long added = 0;
        for (int count : counts) {
            if (count > 0) {
                added += count;
            }
        }
        return added;
    }

    @Override
    public boolean setIsMember(String key, String member) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM kv_set_members
                WHERE entry_key = :key
                  AND member = :member
                """,
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("member", member),
            Long.class
        );
        return count != null && count > 0;
    }

    @Override
    public Set<String> setMembers(String key) {
        return new LinkedHashSet<>(jdbc.query(
            """
                SELECT member
                FROM kv_set_members
                WHERE entry_key = :key
                """,
            new MapSqlParameterSource().addValue("key", key),
            (rs, rowNum) -> rs.getString("member")
        ));
    }

    @Override
    public long setCardinality(String key) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM kv_set_members
                WHERE entry_key = :key
                """,
            new MapSqlParameterSource().addValue("key", key),
            Long.class
        );
        return count == null ? 0L : count;
    }

    @Override
    public Set<String> keysMatching(String pattern) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("pattern", globToLike(pattern))
            .addValue("now", Timestamp.from(clock.instant()));
        return new TreeSet<>(jdbc.query(
            """
                SELECT entry_key FROM kv_entries
                WHERE entry_key LIKE :pattern ESCAPE '!'
                  AND (expires_at IS NULL OR expires_at > :now)
                UNION
                SELECT entry_key FROM kv_hash_fields WHERE entry_key LIKE :pattern ESCAPE '!'
                UNION
                SELECT entry_key FROM kv_list_entries WHERE entry_key LIKE :pattern ESCAPE '!'
                UNION
                SELECT entry_key FROM kv_set_members WHERE entry_key LIKE :pattern ESCAPE '!'
                """,
            params,
            (rs, rowNum) -> rs.getString("entry_key")
        ));
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("keys", new ArrayList<>(new LinkedHashSet<>(keys)));
        Set<String> deleted = new TreeSet<>();
        deleted.addAll(jdbc.query(
            "DELETE FROM kv_entries WHERE entry_key IN (:keys) RETURNING entry_key",
            params,
            (rs, rowNum) -> rs.getString("entry_key")
        ));
        deleted.addAll(jdbc.query(
            "DELETE FROM kv_hash_fields WHERE entry_key IN (:keys) RETURNING entry_key",
            params,
            (rs, rowNum) -> rs.getString("entry_key")
        ));
        deleted.addAll(jdbc.query(
            "DELETE FROM kv_list_entries WHERE entry_key IN (:keys) RETURNING entry_key",
            params,
            (rs, rowNum) -> rs.getString("entry_key")
        ));
        deleted.addAll(jdbc.query(
            "DELETE FROM kv_set_members WHERE entry_key IN (:keys) RETURNING entry_key",
            params,
            (rs, rowNum) -> rs.getString("entry_key")
        ));
        return deleted.size();
    }

    public int purgeExpired() {
        return jdbc.update(
            """
                DELETE FROM kv_entries
                WHERE expires_at IS NOT NULL
                  AND expires_at <= :now
                """,
            new MapSqlParameterSource().addValue("now", Timestamp.from(clock.instant()))
        );
    }

    static String globToLike(String glob) {
        StringBuilder out = new StringBuilder();
        for (char c : (glob == null ? "" : glob).toCharArray()) {
            if (c == '*') {
                out.append('%');
            } else if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                out.append(LIKE_ESCAPE).append(c);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private record ListEntry(long id, String value) {}
}
