package com.work.relay.core.service;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.model.PayerRef;
import com.work.relay.core.model.Quota;
import com.work.relay.core.support.InMemoryRelayStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class QuotaResolverTest {

    private static final String PROFILE = "0x00000000000000000000000000000000000000a1";
    private static final String APPROVER = "0x00000000000000000000000000000000000000b1";
    private static final String APPROVER_2 = "0x00000000000000000000000000000000000000b2";

    private InMemoryRelayStore store;
    private QuotaResolver resolver;

    @BeforeEach
    public void setUp() {
        store = new InMemoryRelayStore();
        resolver = new QuotaResolver(store, store, RelayConfig.defaultConfig());
    }

    @Test
    public void own_quota_pays_when_it_has_headroom() {
        store.putQuota(PROFILE, 100, 90);

        PayerRef payer = resolver.resolvePayer(PROFILE, 5);
        resolver.debit(payer, 5);

        assertEquals(PayerRef.Kind.OWN_QUOTA, payer.getKind());
        assertNull(payer.getDelegationId());
        assertEquals(95, store.findByProfile(PROFILE).getUsed());
    }

    @Test
    public void own_quota_may_be_filled_exactly() {
        store.putQuota(PROFILE, 100, 95);

        PayerRef payer = resolver.resolvePayer(PROFILE, 5);

        assertEquals(PayerRef.Kind.OWN_QUOTA, payer.getKind());
    }

    @Test
    public void delegation_pays_when_own_quota_is_exhausted() {
        store.putQuota(PROFILE, 100, 100);
        store.putQuota(APPROVER, 200, 190);
        Delegation d = store.upsert(APPROVER, PROFILE, 50);
        store.setDelegationUsed(d.getId(), 10);

        PayerRef payer = resolver.resolvePayer(PROFILE, 5);
        resolver.debit(payer, 5);

        assertEquals(PayerRef.Kind.DELEGATION, payer.getKind());
        assertEquals(d.getId(), payer.getDelegationId().longValue());
        assertEquals(APPROVER, payer.getPayerAddress());
        assertEquals(15, store.findGrantedTo(PROFILE).get(0).getUsed());
        assertEquals(195, store.findByProfile(APPROVER).getUsed());
        assertEquals(100, store.findByProfile(PROFILE).getUsed());
    }

    @Test
    public void no_delegations_means_quota_exceeded() {
        store.putQuota(PROFILE, 100, 98);

        assertThrows(QuotaExceededException.class, () -> resolver.resolvePayer(PROFILE, 5));
    }

    @Test
    public void delegation_that_would_be_filled_exactly_is_skipped() {
        store.putQuota(PROFILE, 100, 100);
        store.putQuota(APPROVER, 1000, 0);
        Delegation d = store.upsert(APPROVER, PROFILE, 50);
        store.setDelegationUsed(d.getId(), 45);

        assertThrows(QuotaExceededException.class, () -> resolver.resolvePayer(PROFILE, 5));
    }

    @Test
    public void exhausted_approver_falls_through_to_next_delegation_by_id() {
        store.putQuota(PROFILE, 100, 100);
        store.putQuota(APPROVER, 200, 198);
        store.putQuota(APPROVER_2, 200, 0);
        store.upsert(APPROVER, PROFILE, 50);
        Delegation second = store.upsert(APPROVER_2, PROFILE, 50);

        PayerRef payer = resolver.resolvePayer(PROFILE, 5);

        assertEquals(second.getId(), payer.getDelegationId().longValue());
        assertEquals(APPROVER_2, payer.getPayerAddress());
    }

    @Test
    public void unseen_profile_gets_default_quota_lazily() {
        PayerRef payer = resolver.resolvePayer(PROFILE, 21_000);

        Quota created = store.findByProfile(PROFILE);
        assertEquals(650_000, created.getMonthlyAllowance());
        assertEquals(0, created.getUsed());
        assertEquals(created.getId(), payer.getQuotaId());
    }
}
