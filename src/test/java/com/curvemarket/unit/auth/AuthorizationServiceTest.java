package com.curvemarket.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.curvemarket.auth.AuthorizationService;
import com.curvemarket.auth.Eip712Domain;
import com.curvemarket.auth.MarketMessages;
import com.curvemarket.auth.SignatureVerifier;
import com.curvemarket.auth.TypedMessage;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.UnauthorizedException;
import com.curvemarket.state.MarketStateStore;
import com.curvemarket.support.MarketHarness;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationServiceTest {

    private static final String AUTHORITY = "0x2c7536e3605d9c16a7a3d7b1898e529396a65c23";
    private static final String TRADER = "0x00000000000000000000000000000000000a11ce";
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String TRADER_SIG = "0xtrader";
    private static final String AUTHORITY_SIG = "0xauthority";

    @Mock
    private SignatureVerifier signatureVerifier;

    private MarketStateStore store;
    private AuthorizationService authorizationService;

    @BeforeEach
    void setUp() {
        store = new MarketStateStore();
        store.initialize(MarketHarness.defaultParameters(), AUTHORITY);
        authorizationService = new AuthorizationService(signatureVerifier, store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TypedMessage message() {
        return MarketMessages.closePosition(TRADER, OutcomeSide.YES, BigInteger.ZERO, NOW.getEpochSecond());
    }

    @Test
    void domainBindsChainAndMarket() {
        Eip712Domain domain = authorizationService.domain();

        assertThat(domain.chainId()).isEqualTo(1L);
        assertThat(domain.verifyingContract()).isEqualTo(MarketHarness.MARKET_ADDRESS);
        assertThat(domain.name()).isEqualTo(Eip712Domain.NAME);
    }

    // ==============================
    // DUAL SIGNATURES
    // ==============================

    @Nested
    @DisplayName("Dual signatures")
    class DualSignatures {

        @Test
        @DisplayName("Both signatures valid: accepted and the initiator nonce advances")
        void acceptsAndAdvancesNonce() {
            when(signatureVerifier.verify(any(), any(), eq(TRADER_SIG), eq(TRADER))).thenReturn(true);
            when(signatureVerifier.verify(any(), any(), eq(AUTHORITY_SIG), eq(AUTHORITY))).thenReturn(true);

            authorizationService.authorizeDual(TRADER, NOW.getEpochSecond(), message(), TRADER_SIG, AUTHORITY_SIG);

            assertThat(authorizationService.nonceOf(TRADER)).isEqualTo(BigInteger.ONE);
            assertThat(authorizationService.nonceOf(AUTHORITY)).isZero();
        }

        @Test
        @DisplayName("A deadline in the past is rejected before any signature is checked")
        void rejectsExpiredDeadline() {
            assertThatThrownBy(() -> authorizationService.authorizeDual(
                            TRADER, NOW.getEpochSecond() - 1, message(), TRADER_SIG, AUTHORITY_SIG))
                    .isInstanceOf(GuardViolationException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.SIGNATURE_EXPIRED);

            verifyNoInteractions(signatureVerifier);
            assertThat(authorizationService.nonceOf(TRADER)).isZero();
        }

        @Test
        void rejectsBadInitiatorSignature() {
            when(signatureVerifier.verify(any(), any(), eq(TRADER_SIG), eq(TRADER))).thenReturn(false);

            assertThatThrownBy(() -> authorizationService.authorizeDual(
                            TRADER, NOW.getEpochSecond(), message(), TRADER_SIG, AUTHORITY_SIG))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_SIGNATURE);

            assertThat(authorizationService.nonceOf(TRADER)).isZero();
        }

        @Test
        void rejectsMissingAuthorityCountersignature() {
            when(signatureVerifier.verify(any(), any(), eq(TRADER_SIG), eq(TRADER))).thenReturn(true);
            when(signatureVerifier.verify(any(), any(), eq(AUTHORITY_SIG), eq(AUTHORITY))).thenReturn(false);

            assertThatThrownBy(() -> authorizationService.authorizeDual(
                            TRADER, NOW.getEpochSecond(), message(), TRADER_SIG, AUTHORITY_SIG))
                    .isInstanceOf(UnauthorizedException.class)
                    .hasMessageContaining("authority");
        }
    }

    // ==============================
    // AUTHORITY ONLY
    // ==============================

    @Nested
    @DisplayName("Authority-only signatures")
    class AuthorityOnly {

        @Test
        @DisplayName("Only the authority signature is checked, and the named initiator's nonce advances")
        void checksAuthorityOnly() {
            when(signatureVerifier.verify(any(), any(), eq(AUTHORITY_SIG), eq(AUTHORITY))).thenReturn(true);

            authorizationService.authorizeByAuthority(TRADER, NOW.getEpochSecond(), message(), AUTHORITY_SIG);

            verify(signatureVerifier, times(1)).verify(any(), any(), any(), any());
            verify(signatureVerifier, never()).verify(any(), any(), any(), eq(TRADER));
            assertThat(authorizationService.nonceOf(TRADER)).isEqualTo(BigInteger.ONE);
        }

        @Test
        void authorityCheckIgnoresCase() {
            authorizationService.requireAuthority(AUTHORITY.toUpperCase().replace("0X", "0x"));
        }

        @Test
        void nonAuthorityIsRejected() {
            assertThatThrownBy(() -> authorizationService.requireAuthority(TRADER))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.UNAUTHORIZED);
            assertThatThrownBy(() -> authorizationService.requireAuthority(null))
                    .isInstanceOf(UnauthorizedException.class);
        }
    }
}
