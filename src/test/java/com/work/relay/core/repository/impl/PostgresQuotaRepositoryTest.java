package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Quota;
import com.work.relay.core.repository.entity.QuotaEntity;
import com.work.relay.core.repository.mapper.QuotaMapper;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class PostgresQuotaRepositoryTest {

    private static final String PROFILE = "0x00000000000000000000000000000000000000a1";

    private static QuotaEntity entity(long id, long allowance, long used) {
        QuotaEntity e = new QuotaEntity();
        e.setId(id);
        e.setProfileAddress(PROFILE);
        e.setMonthlyAllowance(allowance);
        e.setUsed(used);
        e.setCreatedAt(Instant.now());
        e.setUpdatedAt(Instant.now());
        return e;
    }

    @Test
    public void ensure_registers_profile_before_quota() {
        QuotaMapper mapper = mock(QuotaMapper.class);
        when(mapper.selectByProfile(PROFILE)).thenReturn(entity(1, 650_000, 0));
        PostgresQuotaRepository repo = new PostgresQuotaRepository(mapper);

        Quota quota = repo.ensureQuota(PROFILE, 650_000);

        assertEquals(650_000, quota.getMonthlyAllowance());
        InOrder inOrder = inOrder(mapper);
        inOrder.verify(mapper).insertProfileIfAbsent(eq(PROFILE), any(Instant.class));
        inOrder.verify(mapper).insertQuotaIfAbsent(eq(PROFILE), eq(650_000L), any(Instant.class));
        inOrder.verify(mapper).selectByProfile(PROFILE);
    }

    @Test
    public void guarded_update_rejecting_debit_is_quota_exceeded() {
        QuotaMapper mapper = mock(QuotaMapper.class);
        when(mapper.addUsed(eq(1L), anyLong(), any(Instant.class))).thenReturn(0);
        PostgresQuotaRepository repo = new PostgresQuotaRepository(mapper);

        assertThrows(QuotaExceededException.class, () -> repo.addUsed(1L, 10));
    }

    @Test
    public void empty_profile_batch_skips_query() {
        QuotaMapper mapper = mock(QuotaMapper.class);
        PostgresQuotaRepository repo = new PostgresQuotaRepository(mapper);

        assertTrue(repo.findByProfiles(Collections.emptyList()).isEmpty());
        verifyNoInteractions(mapper);
    }
}
