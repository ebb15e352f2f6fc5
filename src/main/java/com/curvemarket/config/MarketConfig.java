package com.curvemarket.config;

import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.simulator.SimulatedSettlementBank;
import com.curvemarket.token.NonTransferableOutcomeToken;
import com.curvemarket.token.OutcomeTokens;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the market's {@link MarketParameters}, its outcome tokens, the clock and, unless
 * disabled, the in-process settlement simulator.
 *
 * <p>Defaults below match {@link MarketParameters}'s own defaults, so an empty
 * {@code curvemarket.*} section yields the standard market. Parameters are validated when the
 * engine is initialized, which fails startup on a bad value.
 *
 * <p>Properties prefix: {@code curvemarket.*}
 */
@Configuration
public class MarketConfig {

    @Bean
    public MarketParameters marketParameters(
            @Value("${curvemarket.market.parameters-version:1}") int version,
            @Value("${curvemarket.market.id:DEFAULT-MARKET}") String marketId,
            @Value("${curvemarket.market.address}") String marketAddress,
            @Value("${curvemarket.market.chain-id:1}") long chainId,
            @Value("${curvemarket.curve.slope:1000000000000}") BigInteger curveSlope,
            @Value("${curvemarket.curve.scale:1000000000000000000}") BigInteger curveScale,
            @Value("${curvemarket.curve.migration-threshold:50000000000}") BigInteger migrationThreshold,
            @Value("${curvemarket.curve.dust-tolerance:1000000000000}") BigInteger dustTolerance,
            @Value("${curvemarket.curve.fee-bps:50}") int curveFeeBps,
            @Value("${curvemarket.amm.price-ceiling:990000000000000000}") BigInteger priceCeiling,
            @Value("${curvemarket.leverage.max:5}") int maxLeverage,
            @Value("${curvemarket.leverage.min-collateral:10000000}") BigInteger minCollateral,
            @Value("${curvemarket.leverage.borrow-rate-bps:500}") int borrowRateBps,
            @Value("${curvemarket.leverage.liquidation-threshold-bps:12000}") int liquidationThresholdBps,
            @Value("${curvemarket.leverage.liquidation-fee-bps:500}") int liquidationFeeBps,
            @Value("${curvemarket.leverage.keeper-reward-bps:500}") int keeperRewardBps,
            @Value("${curvemarket.settlement.bonus-yield-bps:200}") int bonusYieldBps,
            @Value("${curvemarket.settlement.tier-standard-bps:10000}") int tierStandardBps,
            @Value("${curvemarket.settlement.tier-early-bps:15000}") int tierEarlyBps,
            @Value("${curvemarket.settlement.tier-fan-token-bps:20000}") int tierFanTokenBps,
            @Value("${curvemarket.settlement.cooling-off-days:30}") long coolingOffDays) {
        return MarketParameters.builder()
                .version(version)
                .marketId(marketId)
                .marketAddress(marketAddress)
                .chainId(chainId)
                .curveSlope(curveSlope)
                .curveScale(curveScale)
                .migrationThreshold(migrationThreshold)
                .dustTolerance(dustTolerance)
                .curveFeeBps(curveFeeBps)
                .priceCeiling(priceCeiling)
                .maxLeverage(maxLeverage)
                .minCollateral(minCollateral)
                .borrowRateBps(borrowRateBps)
                .liquidationThresholdBps(liquidationThresholdBps)
                .liquidationFeeBps(liquidationFeeBps)
                .keeperRewardBps(keeperRewardBps)
                .bonusYieldBps(bonusYieldBps)
                .tierStandardBps(tierStandardBps)
                .tierEarlyBps(tierEarlyBps)
                .tierFanTokenBps(tierFanTokenBps)
                .coolingOff(Duration.ofDays(coolingOffDays))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OutcomeTokens outcomeTokens() {
        return new OutcomeTokens(new NonTransferableOutcomeToken("YES"), new NonTransferableOutcomeToken("NO"));
    }

    @Bean
    @ConditionalOnProperty(name = "curvemarket.simulator.enabled", havingValue = "true", matchIfMissing = true)
    public SimulatedSettlementBank simulatedSettlementBank(
            @Value("${curvemarket.market.address}") String marketAddress,
            @Value("${curvemarket.simulator.lending-deposits:1000000000000}") BigInteger lendingDeposits,
            @Value("${curvemarket.simulator.insurance-balance:100000000000}") BigInteger insuranceBalance,
            @Value("${curvemarket.simulator.max-utilisation-bps:8000}") int maxUtilisationBps) {
        return new SimulatedSettlementBank(marketAddress, lendingDeposits, insuranceBalance, maxUtilisationBps);
    }
}
