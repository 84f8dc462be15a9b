package com.work.relay.core.service;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.UnauthorizedException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.support.InMemoryRelayStore;
import com.work.relay.core.support.RelayMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class DelegationServiceTest {

    private static final String APPROVER = "0x00000000000000000000000000000000000000b1";
    private static final String APPROVED = "0x00000000000000000000000000000000000000b2";
    private static final String SIG = "0x" + "33".repeat(65);

    private InMemoryRelayStore store;
    private AuthorizationService authorizationService;
    private DelegationService service;

    @BeforeEach
    public void setUp() {
        store = new InMemoryRelayStore();
        authorizationService = mock(AuthorizationService.class);
        when(authorizationService.verifyAttestation(anyString(), anyLong(), anyString(), any(byte[].class)))
                .thenReturn("0x00000000000000000000000000000000000000d1");
        service = new DelegationService(store, store, authorizationService, RelayConfig.defaultConfig());
    }

    @Test
    public void grant_creates_profiles_and_delegation() {
        Delegation d = service.grant(APPROVER, APPROVED, 50_000, 1_000L, SIG);

        assertEquals(APPROVER, d.getApproverAddress());
        assertEquals(APPROVED, d.getApprovedAddress());
        assertEquals(50_000, d.getMonthlyAllowance());
        assertEquals(0, d.getUsed());
        assertNotNull(store.findByProfile(APPROVER));
        assertNotNull(store.findByProfile(APPROVED));

        ArgumentCaptor<byte[]> digest = ArgumentCaptor.forClass(byte[].class);
        verify(authorizationService).verifyAttestation(eq(APPROVER), eq(1_000L), eq(SIG), digest.capture());
        assertArrayEquals(RelayMessages.delegationAttestationDigest(APPROVER, APPROVED, 50_000, 1_000L),
                digest.getValue());
    }

    @Test
    public void regrant_updates_allowance_and_keeps_usage() {
        Delegation first = service.grant(APPROVER, APPROVED, 50_000, 1_000L, SIG);
        store.setDelegationUsed(first.getId(), 700);

        Delegation second = service.grant(APPROVER, APPROVED, 80_000, 2_000L, SIG);

        assertEquals(first.getId(), second.getId());
        assertEquals(80_000, second.getMonthlyAllowance());
        assertEquals(700, second.getUsed());
        assertEquals(1, service.listGrantedTo(APPROVED).size());
    }

    @Test
    public void addresses_are_normalised() {
        service.grant(APPROVER.toUpperCase().replace("0X", "0x"), APPROVED, 10, 1_000L, SIG);

        List<Delegation> granted = service.listGrantedBy(APPROVER);
        assertEquals(1, granted.size());
        assertEquals(APPROVER, granted.get(0).getApproverAddress());
    }

    @Test
    public void self_delegation_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> service.grant(APPROVER, APPROVER, 10, 1_000L, SIG));
        verifyNoInteractions(authorizationService);
    }

    @Test
    public void negative_allowance_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> service.grant(APPROVER, APPROVED, -1, 1_000L, SIG));
    }

    @Test
    public void failed_attestation_leaves_index_untouched() {
        when(authorizationService.verifyAttestation(anyString(), anyLong(), anyString(), any(byte[].class)))
                .thenThrow(new UnauthorizedException("not a signer"));

        assertThrows(UnauthorizedException.class, () -> service.grant(APPROVER, APPROVED, 10, 1_000L, SIG));
        assertTrue(service.listGrantedTo(APPROVED).isEmpty());
    }

    @Test
    public void revoke_signs_zero_allowance_and_reports_absence() {
        service.grant(APPROVER, APPROVED, 10, 1_000L, SIG);

        assertTrue(service.revoke(APPROVER, APPROVED, 2_000L, SIG));
        assertFalse(service.revoke(APPROVER, APPROVED, 3_000L, SIG));
        assertTrue(service.listGrantedTo(APPROVED).isEmpty());

        ArgumentCaptor<byte[]> digest = ArgumentCaptor.forClass(byte[].class);
        verify(authorizationService).verifyAttestation(eq(APPROVER), eq(2_000L), eq(SIG), digest.capture());
        assertArrayEquals(RelayMessages.delegationAttestationDigest(APPROVER, APPROVED, 0L, 2_000L), digest.getValue());
    }
}
