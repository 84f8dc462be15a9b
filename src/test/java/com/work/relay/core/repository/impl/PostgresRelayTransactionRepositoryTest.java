package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.DuplicateAuthorizationException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.repository.entity.RelayTransactionEntity;
import com.work.relay.core.repository.mapper.RelayTransactionMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class PostgresRelayTransactionRepositoryTest {

    private static RelayTransaction pending() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        RelayTransaction tx = new RelayTransaction();
        tx.setProfileAddress("0x00000000000000000000000000000000000000a1");
        tx.setCallNonce("5");
        tx.setSignature("0xsig");
        tx.setCallData("0xabcd");
        tx.setChannelId(0);
        tx.setStatus(RelayTxStatus.PENDING);
        tx.setSignerAddress("0x00000000000000000000000000000000000000d1");
        tx.setRelayerNonce(4L);
        tx.setRelayerAddress("0x00000000000000000000000000000000000000aa");
        tx.setEstimatedGas(21_000L);
        tx.setGasUsed(0L);
        tx.setSettledHash("0xhash");
        tx.setPayerQuotaId(1L);
        tx.setKeyManager("0x00000000000000000000000000000000000000c1");
        tx.setGasPrice("1000000000");
        tx.setHandedOffAt(now);
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        return tx;
    }

    @Test
    public void insert_backfills_generated_id() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        when(mapper.insert(any(RelayTransactionEntity.class))).thenAnswer(inv -> {
            RelayTransactionEntity e = inv.getArgument(0);
            e.setId(42L);
            return 1;
        });
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        RelayTransaction saved = repo.insert(pending());

        assertEquals(42L, saved.getId().longValue());
    }

    @Test
    public void unique_violation_becomes_duplicate_authorization() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        when(mapper.insert(any(RelayTransactionEntity.class)))
                .thenThrow(new DuplicateKeyException("uk_relay_authorization"));
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        assertThrows(DuplicateAuthorizationException.class, () -> repo.insert(pending()));
    }

    @Test
    public void maps_entity_back_to_model() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        RelayTransactionEntity e = new RelayTransactionEntity();
        e.setId(9L);
        e.setProfileAddress("0x00000000000000000000000000000000000000a1");
        e.setStatus("CONFIRMED");
        e.setRelayerNonce(3L);
        e.setPayerQuotaId(1L);
        e.setPayerDelegationId(2L);
        e.setGasUsed(19_000L);
        when(mapper.selectByTxId(9L)).thenReturn(e);
        when(mapper.selectByTxId(10L)).thenReturn(null);
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        RelayTransaction tx = repo.findById(9L);

        assertEquals(RelayTxStatus.CONFIRMED, tx.getStatus());
        assertEquals(2L, tx.getPayer().getDelegationId().longValue());
        assertEquals(19_000L, tx.getGasUsed().longValue());
        assertNull(repo.findById(10L));
    }

    @Test
    public void status_update_only_touches_pending_rows() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        Instant now = Instant.now();
        when(mapper.updateStatusFromPending(7L, "FAILED", 0L, now)).thenReturn(0);
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        assertEquals(0, repo.updateStatus(7L, RelayTxStatus.FAILED, 0L, now));
        verify(mapper).updateStatusFromPending(eq(7L), eq("FAILED"), eq(0L), eq(now));
    }

    @Test
    public void pending_listing_has_a_floor_of_one() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        when(mapper.selectPending(1)).thenReturn(Collections.emptyList());
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        List<RelayTransaction> pending = repo.listPending(0);

        assertEquals(0, pending.size());
        verify(mapper).selectPending(1);
    }

    @Test
    public void insert_persists_hand_off_material() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        repo.insert(pending());

        ArgumentCaptor<RelayTransactionEntity> entity = ArgumentCaptor.forClass(RelayTransactionEntity.class);
        verify(mapper).insert(entity.capture());
        assertEquals("0x00000000000000000000000000000000000000c1", entity.getValue().getKeyManager());
        assertEquals("1000000000", entity.getValue().getGasPrice());
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), entity.getValue().getHandedOffAt());
        assertNull(entity.getValue().getBroadcastAt());
    }

    @Test
    public void undispatched_listing_maps_rows_with_a_floor_of_one() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        Instant before = Instant.parse("2024-05-01T00:01:00Z");
        RelayTransactionEntity e = new RelayTransactionEntity();
        e.setId(5L);
        e.setStatus("PENDING");
        e.setKeyManager("0x00000000000000000000000000000000000000c1");
        e.setGasPrice("7");
        e.setHandedOffAt(Instant.parse("2024-05-01T00:00:00Z"));
        when(mapper.selectUndispatched(before, 1)).thenReturn(Collections.singletonList(e));
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        List<RelayTransaction> rows = repo.listUndispatched(before, 0);

        assertEquals(1, rows.size());
        assertEquals("7", rows.get(0).getGasPrice());
        assertEquals("0x00000000000000000000000000000000000000c1", rows.get(0).getKeyManager());
        assertNull(rows.get(0).getBroadcastAt());
    }

    @Test
    public void hand_off_and_broadcast_marks_delegate_to_guarded_updates() {
        RelayTransactionMapper mapper = mock(RelayTransactionMapper.class);
        Instant now = Instant.parse("2024-05-01T00:02:00Z");
        when(mapper.updateHandedOff(3L, now)).thenReturn(0);
        when(mapper.updateBroadcast(3L, now)).thenReturn(1);
        PostgresRelayTransactionRepository repo = new PostgresRelayTransactionRepository(mapper);

        assertEquals(0, repo.markHandedOff(3L, now));
        assertEquals(1, repo.markBroadcast(3L, now));
    }
}
