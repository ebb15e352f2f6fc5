package com.curvemarket.observability;

import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.engine.MarketEngine;
import com.curvemarket.event.ClaimEvent;
import com.curvemarket.event.ClaimEventType;
import com.curvemarket.event.CurveBuyEvent;
import com.curvemarket.event.MigrationEvent;
import com.curvemarket.event.PositionEvent;
import com.curvemarket.math.MarketMath;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the market.
 * <ul>
 *   <li><b>curve.buys</b> (counter): committed bonding-curve purchases</li>
 *   <li><b>market.migrations</b> (counter): 0 or 1</li>
 *   <li><b>positions.opened / positions.closed / positions.liquidated</b> (counters)</li>
 *   <li><b>settlement.claims</b> (counter, tagged {@code type=claimed|swept})</li>
 *   <li><b>amm.price</b> (gauge, tagged {@code side}): current price as a fraction of 1</li>
 *   <li><b>amm.open.interest</b> (gauge, tagged {@code side}): open interest in whole shares</li>
 * </ul>
 * Events only arrive for committed operations, so rejected calls are never counted.
 */
@Service
public class MarketMetricsService {

    private final Counter curveBuysCounter;
    private final Counter migrationsCounter;
    private final Counter positionsOpenedCounter;
    private final Counter positionsClosedCounter;
    private final Counter positionsLiquidatedCounter;
    private final Counter claimsCounter;
    private final Counter sweepsCounter;

    public MarketMetricsService(MeterRegistry meterRegistry, MarketEngine marketEngine) {
        this.curveBuysCounter = Counter.builder("curve.buys")
                .description("Committed bonding-curve purchases")
                .register(meterRegistry);
        this.migrationsCounter = Counter.builder("market.migrations")
                .description("Migrations from the bonding curve to the AMM")
                .register(meterRegistry);
        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Leveraged positions opened")
                .register(meterRegistry);
        this.positionsClosedCounter = Counter.builder("positions.closed")
                .description("Leveraged positions closed by their owner")
                .register(meterRegistry);
        this.positionsLiquidatedCounter = Counter.builder("positions.liquidated")
                .description("Leveraged positions liquidated by keepers")
                .register(meterRegistry);
        this.claimsCounter = Counter.builder("settlement.claims")
                .tag("type", "claimed")
                .description("Settlement claims paid")
                .register(meterRegistry);
        this.sweepsCounter = Counter.builder("settlement.claims")
                .tag("type", "swept")
                .description("Settlement claims paid")
                .register(meterRegistry);

        for (OutcomeSide side : OutcomeSide.values()) {
            String tag = side.name().toLowerCase(Locale.ROOT);
            Gauge.builder("amm.price", marketEngine, engine -> fromWad(engine.priceOf(side)))
                    .tag("side", tag)
                    .description("Current AMM price")
                    .register(meterRegistry);
            Gauge.builder("amm.open.interest", marketEngine, engine -> fromWad(engine.openInterestOf(side)))
                    .tag("side", tag)
                    .description("Shares held by active leveraged positions")
                    .register(meterRegistry);
        }
    }

    @EventListener
    public void onCurveBuy(CurveBuyEvent event) {
        curveBuysCounter.increment();
    }

    @EventListener
    public void onMigration(MigrationEvent event) {
        migrationsCounter.increment();
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        switch (event.getEventType()) {
            case OPENED -> positionsOpenedCounter.increment();
            case CLOSED -> positionsClosedCounter.increment();
            case LIQUIDATED -> positionsLiquidatedCounter.increment();
            default -> {
                // leverage activation is covered by OPENED
            }
        }
    }

    @EventListener
    public void onClaim(ClaimEvent event) {
        if (event.getEventType() == ClaimEventType.SWEPT) {
            sweepsCounter.increment();
        } else {
            claimsCounter.increment();
        }
    }

    private static double fromWad(BigInteger value) {
        return new BigDecimal(value).divide(new BigDecimal(MarketMath.WAD)).doubleValue();
    }
}
