package com.work.relay.core.service;

import com.work.relay.app.chain.web3j.Web3jSignatureVerifier;
import com.work.relay.core.chain.PermissionChecker;
import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.RelayErrorCode;
import com.work.relay.core.exception.SignatureInvalidException;
import com.work.relay.core.exception.UnauthorizedException;
import com.work.relay.core.support.RelayMessages;
import com.work.relay.core.support.TestSigners;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AuthorizationServiceTest {

    private static final String PROFILE = "0x00000000000000000000000000000000000000a1";
    private static final String KEY_MANAGER = "0x00000000000000000000000000000000000000c1";
    private static final long NOW = 1_700_000_000_000L;

    private final String alice = TestSigners.address(TestSigners.ALICE);
    private PermissionChecker permissionChecker;
    private AuthorizationService service;

    @BeforeEach
    public void setUp() {
        permissionChecker = mock(PermissionChecker.class);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        service = new AuthorizationService(new Web3jSignatureVerifier(), permissionChecker,
                RelayConfig.defaultConfig(), clock);
    }

    @Test
    public void relay_call_signed_by_permitted_signer_is_authorized() {
        when(permissionChecker.hasPermission(eq(PROFILE), eq(alice))).thenReturn(true);
        BigInteger nonce = BigInteger.valueOf(5);
        String sig = TestSigners.sign(RelayMessages.relayCallDigest(4201L, KEY_MANAGER, nonce, "0xabcd"), TestSigners.ALICE);

        String signer = service.authorizeRelayCall(PROFILE, KEY_MANAGER, nonce, "0xabcd", sig);

        assertEquals(alice, signer);
    }

    @Test
    public void signer_without_permission_is_unauthorized() {
        when(permissionChecker.hasPermission(anyString(), anyString())).thenReturn(false);
        BigInteger nonce = BigInteger.ONE;
        String sig = TestSigners.sign(RelayMessages.relayCallDigest(4201L, KEY_MANAGER, nonce, "0xabcd"), TestSigners.BOB);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> service.authorizeRelayCall(PROFILE, KEY_MANAGER, nonce, "0xabcd", sig));
        assertEquals(RelayErrorCode.UNAUTHORIZED, e.getCode());
    }

    @Test
    public void signature_over_different_payload_recovers_another_signer() {
        when(permissionChecker.hasPermission(eq(PROFILE), eq(alice))).thenReturn(true);
        BigInteger nonce = BigInteger.ONE;
        String sig = TestSigners.sign(RelayMessages.relayCallDigest(4201L, KEY_MANAGER, nonce, "0xabcd"), TestSigners.ALICE);

        assertThrows(UnauthorizedException.class,
                () -> service.authorizeRelayCall(PROFILE, KEY_MANAGER, nonce, "0xabce", sig));
    }

    @Test
    public void malformed_signature_is_rejected() {
        assertThrows(SignatureInvalidException.class,
                () -> service.authorizeRelayCall(PROFILE, KEY_MANAGER, BigInteger.ONE, "0xabcd", "0x1234"));
        verify(permissionChecker, never()).hasPermission(anyString(), anyString());
    }

    @Test
    public void stale_timestamp_is_rejected_even_with_valid_signature() {
        when(permissionChecker.hasPermission(anyString(), anyString())).thenReturn(true);
        long ts = NOW - 6_000;
        byte[] digest = RelayMessages.quotaAttestationDigest(PROFILE, ts);
        String sig = TestSigners.sign(digest, TestSigners.ALICE);

        assertThrows(IllegalArgumentException.class, () -> service.verifyAttestation(PROFILE, ts, sig, digest));
        verify(permissionChecker, never()).hasPermission(anyString(), anyString());
    }

    @Test
    public void timestamp_from_the_future_is_rejected() {
        long ts = NOW + 6_000;
        byte[] digest = RelayMessages.quotaAttestationDigest(PROFILE, ts);
        String sig = TestSigners.sign(digest, TestSigners.ALICE);

        assertThrows(IllegalArgumentException.class, () -> service.verifyAttestation(PROFILE, ts, sig, digest));
    }

    @Test
    public void fresh_attestation_returns_signer() {
        when(permissionChecker.hasPermission(eq(PROFILE), eq(alice))).thenReturn(true);
        long ts = NOW - 4_000;
        byte[] digest = RelayMessages.quotaAttestationDigest(PROFILE, ts);
        String sig = TestSigners.sign(digest, TestSigners.ALICE);

        assertEquals(alice, service.verifyAttestation(PROFILE, ts, sig, digest));
    }
}
