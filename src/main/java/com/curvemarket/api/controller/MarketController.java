package com.curvemarket.api.controller;

import com.curvemarket.api.dto.request.BulkLiquidateRequest;
import com.curvemarket.api.dto.request.BuySharesRequest;
import com.curvemarket.api.dto.request.ClaimRequest;
import com.curvemarket.api.dto.request.ClosePositionRequest;
import com.curvemarket.api.dto.request.LiquidateRequest;
import com.curvemarket.api.dto.request.OpenPositionRequest;
import com.curvemarket.api.dto.response.PositionResponse;
import com.curvemarket.curve.CurveQuote;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketSnapshot;
import com.curvemarket.engine.MarketEngine;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.LifecycleException;
import com.curvemarket.position.BulkLiquidationResult;
import com.curvemarket.position.LeveragePreview;
import com.curvemarket.position.LiquidationSettlement;
import com.curvemarket.position.PositionSettlement;
import com.curvemarket.settlement.ClaimResult;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for traders and keepers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market -- market snapshot</li>
 *   <li>GET /api/market/prices -- current YES/NO prices</li>
 *   <li>GET /api/market/quote/buy -- bonding-curve quote</li>
 *   <li>GET /api/market/quote/leverage -- leveraged position preview</li>
 *   <li>GET /api/market/positions/{trader}/{side} -- position with health factor</li>
 *   <li>GET /api/market/nonces/{address} -- next signature nonce</li>
 *   <li>POST /api/market/buy, /positions/open, /positions/close -- signed trader operations</li>
 *   <li>POST /api/market/liquidations, /liquidations/bulk -- keeper operations</li>
 *   <li>POST /api/market/claims -- settlement claims</li>
 * </ul>
 * Resolution, sweeps and authority rotation are operator actions and are not exposed here.
 */
@RestController
@RequestMapping("/api/market")
public class MarketController {

    private final MarketEngine marketEngine;

    public MarketController(MarketEngine marketEngine) {
        this.marketEngine = marketEngine;
    }

    @GetMapping
    public ResponseEntity<MarketSnapshot> getSnapshot() {
        return ResponseEntity.ok(marketEngine.snapshot());
    }

    @GetMapping("/prices")
    public ResponseEntity<Map<String, Object>> getPrices() {
        Map<String, Object> prices = new LinkedHashMap<>();
        prices.put("yes", marketEngine.priceOf(OutcomeSide.YES));
        prices.put("no", marketEngine.priceOf(OutcomeSide.NO));
        return ResponseEntity.ok(prices);
    }

    @GetMapping("/quote/buy")
    public ResponseEntity<CurveQuote> quoteBuy(@RequestParam BigInteger shares) {
        return ResponseEntity.ok(marketEngine.quoteBuy(shares));
    }

    @GetMapping("/quote/leverage")
    public ResponseEntity<LeveragePreview> quoteLeverage(
            @RequestParam OutcomeSide side, @RequestParam BigInteger collateral, @RequestParam int leverage) {
        return ResponseEntity.ok(marketEngine.previewLeverage(side, collateral, leverage));
    }

    @GetMapping("/positions/{trader}/{side}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable String trader, @PathVariable OutcomeSide side) {
        LeveragedPosition position = marketEngine
                .position(trader, side)
                .orElseThrow(() -> new LifecycleException(
                        ErrorCode.NOT_FOUND, "No " + side + " position recorded for " + trader));
        BigInteger healthFactor = position.isActive() ? marketEngine.healthFactor(trader, side) : null;
        return ResponseEntity.ok(PositionResponse.of(position, healthFactor));
    }

    @GetMapping("/nonces/{address}")
    public ResponseEntity<Map<String, Object>> getNonce(@PathVariable String address) {
        Map<String, Object> nonce = new LinkedHashMap<>();
        nonce.put("address", address);
        nonce.put("nonce", marketEngine.nonceOf(address));
        return ResponseEntity.ok(nonce);
    }

    @PostMapping("/buy")
    public ResponseEntity<CurveQuote> buyShares(@Valid @RequestBody BuySharesRequest request) {
        return ResponseEntity.ok(marketEngine.buyShares(
                request.getBuyer(),
                request.getSide(),
                request.getShareAmount(),
                request.getDeadline(),
                request.getBuyerSignature(),
                request.getAuthoritySignature()));
    }

    @PostMapping("/positions/open")
    public ResponseEntity<PositionResponse> openPosition(@Valid @RequestBody OpenPositionRequest request) {
        LeveragedPosition position = marketEngine.openPosition(
                request.getTrader(),
                request.getSide(),
                request.getCollateral(),
                request.getLeverage(),
                request.getMinShares(),
                request.getDeadline(),
                request.getTraderSignature(),
                request.getAuthoritySignature());
        return ResponseEntity.ok(
                PositionResponse.of(position, marketEngine.healthFactor(position.getTrader(), position.getSide())));
    }

    @PostMapping("/positions/close")
    public ResponseEntity<PositionSettlement> closePosition(@Valid @RequestBody ClosePositionRequest request) {
        return ResponseEntity.ok(marketEngine.closePosition(
                request.getTrader(),
                request.getSide(),
                request.getDeadline(),
                request.getTraderSignature(),
                request.getAuthoritySignature()));
    }

    @PostMapping("/liquidations")
    public ResponseEntity<LiquidationSettlement> liquidate(@Valid @RequestBody LiquidateRequest request) {
        return ResponseEntity.ok(marketEngine.liquidate(request.getKeeper(), request.getTrader(), request.getSide()));
    }

    @PostMapping("/liquidations/bulk")
    public ResponseEntity<BulkLiquidationResult> bulkLiquidate(@Valid @RequestBody BulkLiquidateRequest request) {
        return ResponseEntity.ok(marketEngine.bulkLiquidate(
                request.getKeeper(),
                request.getTraders(),
                request.getSides(),
                request.getDeadline(),
                request.getAuthoritySignature()));
    }

    @PostMapping("/claims")
    public ResponseEntity<ClaimResult> claim(@Valid @RequestBody ClaimRequest request) {
        return ResponseEntity.ok(marketEngine.claimWinnings(
                request.getUser(),
                request.getClaimKind(),
                request.getTier(),
                request.getDeadline(),
                request.getAuthoritySignature()));
    }
}
