package com.ivamare.eventsourcing.outbox.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.fixtures.TestEvents;
import com.ivamare.eventsourcing.model.OutboxRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcOutboxStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcOutboxStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcOutboxStore(jdbcTemplate, new ObjectMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldInsertOneRowPerEventWithContext() {
        UUID id = UUID.randomUUID();

        store.append(Map.of("user", "alice"), TestEvents.increments(id, 1, 2));

        ArgumentCaptor<List<Object[]>> captor = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(contains("INSERT INTO eventsourcing.outbox"), captor.capture());
        List<Object[]> rows = captor.getValue();
        assertEquals(2, rows.size());
        assertEquals(id, rows.get(0)[0]);
        assertEquals(2, rows.get(1)[1]);
        assertEquals("{\"user\":\"alice\"}", rows.get(0)[7]);
        assertEquals(Timestamp.from(Instant.EPOCH), rows.get(0)[8]);
    }

    @Test
    void shouldSkipEmptyAppend() {
        store.append(Map.of(), List.of());

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMapDueRecords() throws Exception {
        UUID id = UUID.randomUUID();
        Instant now = TestEvents.NOW;
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("event_type")).thenReturn("Created");
        when(rs.getString("aggregate_type")).thenReturn("Counter");
        when(rs.getObject("aggregate_id", UUID.class)).thenReturn(id);
        when(rs.getInt("version")).thenReturn(1);
        when(rs.getTimestamp("timestamp")).thenReturn(Timestamp.from(now));
        when(rs.getBytes("data")).thenReturn(new byte[0]);
        when(rs.getString("metadata")).thenReturn("{}");
        when(rs.getString("context")).thenReturn("{\"user\":\"alice\"}");
        when(rs.getLong("id")).thenReturn(42L);
        when(rs.getInt("attempts")).thenReturn(2);
        when(rs.getTimestamp("next_attempt_at")).thenReturn(Timestamp.from(now));
        when(rs.getString("last_error")).thenReturn("boom");

        Timestamp ts = Timestamp.from(now);
        when(jdbcTemplate.query(contains("NOT EXISTS"), any(RowMapper.class), eq(ts), eq(ts), eq(10)))
            .thenAnswer(inv -> List.of(((RowMapper<OutboxRecord>) inv.getArgument(1)).mapRow(rs, 0)));

        List<OutboxRecord> records = store.pendingDue(now, 10);

        assertEquals(1, records.size());
        OutboxRecord record = records.get(0);
        assertEquals(42L, record.id());
        assertEquals(2, record.attempts());
        assertEquals("alice", record.context().get("user"));
        assertEquals("boom", record.lastError());
        assertEquals(id, record.event().aggregateId());
    }

    @Test
    void shouldDeleteDeliveredAndUpdateFailed() {
        Instant next = TestEvents.NOW.plusSeconds(2);

        store.markDelivered(7L);
        store.markFailed(8L, 3, next, "boom");

        verify(jdbcTemplate).update(contains("DELETE FROM eventsourcing.outbox"), eq(7L));
        verify(jdbcTemplate).update(contains("UPDATE eventsourcing.outbox"),
            eq(3), eq(Timestamp.from(next)), eq("boom"), eq(8L));
    }

    @Test
    void shouldCountRows() {
        when(jdbcTemplate.queryForObject(contains("COUNT(*)"), eq(Long.class))).thenReturn(5L);

        assertEquals(5L, store.count());
    }
}
