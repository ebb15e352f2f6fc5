package com.curvemarket.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.curvemarket.api.MarketEnvelopeAdvice;
import com.curvemarket.api.MarketEnvelopes;
import com.curvemarket.api.controller.MarketController;
import com.curvemarket.curve.CurveQuote;
import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.enums.UserTier;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketSnapshot;
import com.curvemarket.engine.MarketEngine;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GlobalExceptionHandler;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.settlement.ClaimResult;
import com.curvemarket.support.MarketHarness;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the MarketController.
 */
@ExtendWith(MockitoExtension.class)
class MarketControllerTest {

    private static final String ALICE = "0x00000000000000000000000000000000000a11ce";
    private static final String KEEPER = "0x000000000000000000000000000000000000bee5";

    private MockMvc mockMvc;

    @Mock
    private MarketEngine marketEngine;

    @BeforeEach
    void setUp() {
        MarketEnvelopes envelopes = new MarketEnvelopes(
                marketEngine, MarketHarness.defaultParameters(), Clock.fixed(MarketHarness.START, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(new MarketController(marketEngine))
                .setControllerAdvice(new MarketEnvelopeAdvice(envelopes), new GlobalExceptionHandler(envelopes))
                .build();
    }

    private static LeveragedPosition position(boolean active) {
        return LeveragedPosition.builder()
                .trader(ALICE)
                .side(OutcomeSide.YES)
                .collateral(BigInteger.valueOf(1_000))
                .loanAmount(BigInteger.valueOf(4_000))
                .shares(BigInteger.valueOf(9_090))
                .entryPrice(BigInteger.valueOf(550))
                .leverage(5)
                .openedAt(Instant.parse("2025-03-01T00:00:00Z"))
                .active(active)
                .build();
    }

    @Test
    @DisplayName("GET /api/market returns the snapshot in the response envelope")
    void getSnapshot() throws Exception {
        MarketSnapshot snapshot = new MarketSnapshot(
                MarketPhase.PHASE2_ACTIVE, 1, KEEPER,
                BigInteger.valueOf(316), BigInteger.valueOf(50), BigInteger.valueOf(50), true,
                BigInteger.valueOf(50), BigInteger.valueOf(100), BigInteger.valueOf(100), BigInteger.valueOf(5_000),
                BigInteger.valueOf(500), BigInteger.valueOf(500),
                BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO,
                null, BigInteger.ZERO, BigInteger.ZERO, null);
        when(marketEngine.snapshot()).thenReturn(snapshot);
        when(marketEngine.currentPhase()).thenReturn(Optional.of(MarketPhase.PHASE2_ACTIVE));

        mockMvc.perform(get("/api/market"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.marketId").value("DEFAULT-MARKET"))
                .andExpect(jsonPath("$.phase").value("PHASE2_ACTIVE"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.data.phase").value("PHASE2_ACTIVE"))
                .andExpect(jsonPath("$.data.migrated").value(true))
                .andExpect(jsonPath("$.data.authority").value(KEEPER))
                .andExpect(jsonPath("$.data.priceYes").value(500));
    }

    @Test
    @DisplayName("GET /api/market/prices returns both side prices")
    void getPrices() throws Exception {
        when(marketEngine.priceOf(OutcomeSide.YES)).thenReturn(BigInteger.valueOf(605));
        when(marketEngine.priceOf(OutcomeSide.NO)).thenReturn(BigInteger.valueOf(395));

        mockMvc.perform(get("/api/market/prices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.yes").value(605))
                .andExpect(jsonPath("$.data.no").value(395));
    }

    @Test
    @DisplayName("GET /api/market/quote/buy returns the curve quote")
    void quoteBuy() throws Exception {
        when(marketEngine.quoteBuy(BigInteger.valueOf(1_000))).thenReturn(new CurveQuote(
                BigInteger.valueOf(1_000), BigInteger.valueOf(1_000), BigInteger.valueOf(200), BigInteger.ONE,
                false, false));

        mockMvc.perform(get("/api/market/quote/buy").param("shares", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rawCost").value(200))
                .andExpect(jsonPath("$.data.fee").value(1))
                .andExpect(jsonPath("$.data.capped").value(false));
    }

    // ==============================
    // POSITIONS
    // ==============================

    @Test
    @DisplayName("GET /api/market/positions/{trader}/{side} includes the health factor of an active position")
    void getActivePosition() throws Exception {
        when(marketEngine.position(ALICE, OutcomeSide.YES)).thenReturn(Optional.of(position(true)));
        when(marketEngine.healthFactor(ALICE, OutcomeSide.YES)).thenReturn(BigInteger.valueOf(11_458));

        mockMvc.perform(get("/api/market/positions/{trader}/{side}", ALICE, "YES"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trader").value(ALICE))
                .andExpect(jsonPath("$.data.loanAmount").value(4_000))
                .andExpect(jsonPath("$.data.active").value(true))
                .andExpect(jsonPath("$.data.healthFactor").value(11_458));
    }

    @Test
    void closedPositionHasNoHealthFactor() throws Exception {
        when(marketEngine.position(ALICE, OutcomeSide.YES)).thenReturn(Optional.of(position(false)));

        mockMvc.perform(get("/api/market/positions/{trader}/{side}", ALICE, "YES"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.active").value(false))
                .andExpect(jsonPath("$.data.healthFactor").doesNotExist());

        verify(marketEngine, never()).healthFactor(any(), any());
    }

    @Test
    @DisplayName("Unknown positions return 404")
    void unknownPosition() throws Exception {
        when(marketEngine.position(ALICE, OutcomeSide.NO)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/market/positions/{trader}/{side}", ALICE, "NO"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.marketId").value("DEFAULT-MARKET"))
                .andExpect(jsonPath("$.phase").doesNotExist())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.category").value("REQUEST"));
    }

    @Test
    void invalidSideIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/market/positions/{trader}/{side}", ALICE, "MAYBE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("POST /api/market/positions/open forwards the signed request and returns the position")
    void openPosition() throws Exception {
        when(marketEngine.openPosition(any(), any(), any(), anyInt(), any(), anyLong(), any(), any()))
                .thenReturn(position(true));
        when(marketEngine.healthFactor(ALICE, OutcomeSide.YES)).thenReturn(BigInteger.valueOf(11_458));
        String body = """
                {
                  "trader": "%s",
                  "side": "YES",
                  "collateral": 1000,
                  "leverage": 5,
                  "minShares": 0,
                  "deadline": 1740794400,
                  "traderSignature": "0xaa",
                  "authoritySignature": "0xbb"
                }
                """.formatted(ALICE);

        mockMvc.perform(post("/api/market/positions/open")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.leverage").value(5))
                .andExpect(jsonPath("$.data.healthFactor").value(11_458));

        verify(marketEngine).openPosition(ALICE, OutcomeSide.YES, BigInteger.valueOf(1_000), 5, BigInteger.ZERO,
                1740794400L, "0xaa", "0xbb");
    }

    // ==============================
    // SIGNED OPERATIONS
    // ==============================

    @Test
    @DisplayName("POST /api/market/buy passes both signatures to the engine")
    void buyShares() throws Exception {
        when(marketEngine.buyShares(any(), any(), any(), anyLong(), any(), any())).thenReturn(new CurveQuote(
                BigInteger.valueOf(1_000), BigInteger.valueOf(1_000), BigInteger.valueOf(200), BigInteger.ONE,
                false, false));
        String body = """
                {
                  "buyer": "%s",
                  "side": "NO",
                  "shareAmount": 1000,
                  "deadline": 1740794400,
                  "buyerSignature": "0xaa",
                  "authoritySignature": "0xbb"
                }
                """.formatted(ALICE);

        mockMvc.perform(post("/api/market/buy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.shares").value(1_000));

        verify(marketEngine).buyShares(ALICE, OutcomeSide.NO, BigInteger.valueOf(1_000), 1740794400L, "0xaa", "0xbb");
    }

    @Test
    @DisplayName("A purchase without signatures fails validation before reaching the engine")
    void buySharesRequiresSignatures() throws Exception {
        String body = """
                { "buyer": "%s", "side": "YES", "shareAmount": 1000, "deadline": 1740794400 }
                """.formatted(ALICE);

        mockMvc.perform(post("/api/market/buy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.buyerSignature").exists());

        verify(marketEngine, never()).buyShares(any(), any(), any(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("Liquidating a healthy position maps to 422 with the engine's error code")
    void liquidateHealthyPosition() throws Exception {
        when(marketEngine.liquidate(KEEPER, ALICE, OutcomeSide.YES))
                .thenThrow(new GuardViolationException(ErrorCode.POSITION_HEALTHY, "position is healthy"));
        String body = """
                { "keeper": "%s", "trader": "%s", "side": "YES" }
                """.formatted(KEEPER, ALICE);

        mockMvc.perform(post("/api/market/liquidations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("POSITION_HEALTHY"))
                .andExpect(jsonPath("$.error.category").value("GUARD"))
                .andExpect(jsonPath("$.error.path").value("/api/market/liquidations"));
    }

    @Test
    void bulkLiquidationLengthMismatch() throws Exception {
        when(marketEngine.bulkLiquidate(any(), any(), any(), anyLong(), any()))
                .thenThrow(new ValidationException(ErrorCode.ARRAY_LENGTH_MISMATCH, "2 traders but 1 sides"));
        String body = """
                {
                  "keeper": "%s",
                  "traders": ["%s", "%s"],
                  "sides": ["YES"],
                  "deadline": 1740794400,
                  "authoritySignature": "0xbb"
                }
                """.formatted(KEEPER, ALICE, KEEPER);

        mockMvc.perform(post("/api/market/liquidations/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("ARRAY_LENGTH_MISMATCH"));

        verify(marketEngine).bulkLiquidate(KEEPER, List.of(ALICE, KEEPER), List.of(OutcomeSide.YES), 1740794400L, "0xbb");
    }

    @Test
    @DisplayName("POST /api/market/claims returns the payout")
    void claim() throws Exception {
        when(marketEngine.claimWinnings(ALICE, ClaimKind.LEVERAGED_POSITION, UserTier.EARLY, 1740794400L, "0xbb"))
                .thenReturn(new ClaimResult(ALICE, ClaimKind.LEVERAGED_POSITION, BigInteger.valueOf(295_750),
                        BigInteger.valueOf(750)));
        String body = """
                {
                  "user": "%s",
                  "claimKind": "LEVERAGED_POSITION",
                  "tier": "EARLY",
                  "deadline": 1740794400,
                  "authoritySignature": "0xbb"
                }
                """.formatted(ALICE);

        mockMvc.perform(post("/api/market/claims")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payout").value(295_750))
                .andExpect(jsonPath("$.data.bonus").value(750));
    }

    @Test
    void getNonce() throws Exception {
        when(marketEngine.nonceOf(ALICE)).thenReturn(BigInteger.valueOf(3));

        mockMvc.perform(get("/api/market/nonces/{address}", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.address").value(ALICE))
                .andExpect(jsonPath("$.data.nonce").value(3));
    }
}
