package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.IdentityException;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.rpc.ChainRpc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.example.aurawatch.TestKeys.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdentityResolver.
 * Tests keystore name matching and the fail-closed node confirmation.
 */
@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final String KEY_B = "bb".repeat(32);
    private static final String KEY_C = "cc".repeat(32);

    @Mock
    private KeystoreDirectory keystore;

    @Mock
    private ChainRpc chainRpc;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        MonitorConfig config = new MonitorConfig();
        config.setKeystorePath("/data/keystore");
        resolver = new IdentityResolver(config, keystore, chainRpc);
    }

    @Test
    void testResolvesSingleAuraKey() {
        ValidatorIdentity identity = resolver.resolve(List.of(
            "61757261" + KEY_B,
            "6772616e" + KEY_C,   // gran
            "README"
        ));

        assertEquals(B, identity.getKey());
        assertEquals("aura", identity.getKeyType());
    }

    @Test
    void testNormalizesCaseAndPrefix() {
        ValidatorIdentity identity = resolver.resolve(List.of(" 0x61757261" + KEY_B.toUpperCase() + " "));

        assertEquals(B, identity.getKey());
    }

    @Test
    void testDuplicatesOfSameKeyAreOneMatch() {
        ValidatorIdentity identity = resolver.resolve(List.of(
            "61757261" + KEY_B,
            "0x61757261" + KEY_B
        ));

        assertEquals(B, identity.getKey());
    }

    @Test
    void testNoKeyFound() {
        IdentityException e = assertThrows(IdentityException.class,
            () -> resolver.resolve(List.of("6772616e" + KEY_B, "61757261" + "bb".repeat(31))));

        assertEquals(ErrorCode.NO_KEY_FOUND, e.getErrorCode());
        assertTrue(e.getMessage().contains("no key found"));
    }

    @Test
    void testAmbiguousIdentity() {
        IdentityException e = assertThrows(IdentityException.class,
            () -> resolver.resolve(List.of("61757261" + KEY_B, "61757261" + KEY_C)));

        assertEquals(ErrorCode.AMBIGUOUS_IDENTITY, e.getErrorCode());
        assertTrue(e.getMessage().contains("ambiguous identity"));
        assertEquals(3, e.getExitCode());
    }

    @Test
    void testNonHexSuffixIgnored() {
        assertThrows(IdentityException.class,
            () -> resolver.resolve(List.of("61757261" + "zz".repeat(32))));
    }

    @Test
    void testResolveReadsKeystore() {
        when(keystore.listFileNames()).thenReturn(List.of("61757261" + KEY_C));

        assertEquals(C, resolver.resolve().getKey());
    }

    @Test
    void testConfirmPassesWhenNodeHoldsKey() {
        when(chainRpc.hasKey("0x" + KEY_B, "aura")).thenReturn(true);

        assertDoesNotThrow(() -> resolver.confirm(identity(B)));
    }

    @Test
    void testConfirmFailsClosed() {
        when(chainRpc.hasKey(anyString(), anyString())).thenReturn(false);

        IdentityException e = assertThrows(IdentityException.class, () -> resolver.confirm(identity(B)));
        assertEquals(ErrorCode.KEY_NOT_ON_NODE, e.getErrorCode());
    }
}
