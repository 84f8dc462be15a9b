package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.repository.entity.DelegationEntity;
import com.work.relay.core.repository.mapper.DelegationMapper;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class PostgresDelegationRepositoryTest {

    private static final String APPROVER = "0x00000000000000000000000000000000000000b1";
    private static final String APPROVED = "0x00000000000000000000000000000000000000a1";

    private static DelegationEntity entity(long id, long allowance, long used) {
        DelegationEntity e = new DelegationEntity();
        e.setId(id);
        e.setApproverAddress(APPROVER);
        e.setApprovedAddress(APPROVED);
        e.setMonthlyAllowance(allowance);
        e.setUsed(used);
        e.setCreatedAt(Instant.now());
        e.setUpdatedAt(Instant.now());
        return e;
    }

    @Test
    public void upsert_reads_back_the_pair() {
        DelegationMapper mapper = mock(DelegationMapper.class);
        when(mapper.selectByPair(APPROVER, APPROVED)).thenReturn(entity(4, 300_000, 1_000));
        PostgresDelegationRepository repo = new PostgresDelegationRepository(mapper);

        Delegation d = repo.upsert(APPROVER, APPROVED, 300_000);

        assertEquals(4L, d.getId());
        assertEquals(300_000, d.getMonthlyAllowance());
        assertEquals(1_000, d.getUsed());
        InOrder inOrder = inOrder(mapper);
        inOrder.verify(mapper).upsert(eq(APPROVER), eq(APPROVED), eq(300_000L), any(Instant.class));
        inOrder.verify(mapper).selectByPair(APPROVER, APPROVED);
    }

    @Test
    public void negative_allowance_never_reaches_mapper() {
        DelegationMapper mapper = mock(DelegationMapper.class);
        PostgresDelegationRepository repo = new PostgresDelegationRepository(mapper);

        assertThrows(IllegalArgumentException.class, () -> repo.upsert(APPROVER, APPROVED, -1));
        verifyNoInteractions(mapper);
    }

    @Test
    public void lock_granted_to_uses_row_locking_query() {
        DelegationMapper mapper = mock(DelegationMapper.class);
        when(mapper.lockByApproved(APPROVED)).thenReturn(Arrays.asList(entity(1, 10, 0), entity(2, 20, 5)));
        PostgresDelegationRepository repo = new PostgresDelegationRepository(mapper);

        List<Delegation> locked = repo.lockGrantedTo(APPROVED);

        assertEquals(2, locked.size());
        assertEquals(1L, locked.get(0).getId());
        verify(mapper, never()).selectByApproved(anyString());
    }

    @Test
    public void delete_reports_whether_a_row_existed() {
        DelegationMapper mapper = mock(DelegationMapper.class);
        when(mapper.deleteByPair(APPROVER, APPROVED)).thenReturn(1, 0);
        PostgresDelegationRepository repo = new PostgresDelegationRepository(mapper);

        assertTrue(repo.delete(APPROVER, APPROVED));
        assertFalse(repo.delete(APPROVER, APPROVED));
    }

    @Test
    public void guarded_update_rejecting_debit_is_quota_exceeded() {
        DelegationMapper mapper = mock(DelegationMapper.class);
        when(mapper.addUsed(eq(7L), anyLong(), any(Instant.class))).thenReturn(0);
        PostgresDelegationRepository repo = new PostgresDelegationRepository(mapper);

        assertThrows(QuotaExceededException.class, () -> repo.addDelegationUsed(7L, 10));
    }
}
