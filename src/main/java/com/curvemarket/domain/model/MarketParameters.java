package com.curvemarket.domain.model;

import com.curvemarket.domain.enums.UserTier;
import java.math.BigInteger;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Versioned economic parameters of one market, fixed at initialization.
 *
 * <p>Amounts follow the unit convention of {@link com.curvemarket.math.MarketMath}:
 * the curve parameters and dust tolerance are in accounting units, the threshold,
 * collateral floor and loan figures in external units. Rates are basis points.
 */
@Value
@Builder(toBuilder = true)
public class MarketParameters {

    /** Bumped whenever the meaning of a field changes; recorded on initialization. */
    @Builder.Default
    int version = 1;

    @Builder.Default
    String marketId = "DEFAULT-MARKET";

    /** Identity of this market: signature domain and vault account. */
    String marketAddress;

    @Builder.Default
    long chainId = 1L;

    /** Curve slope K in {@code price = K * supply / SCALE}. */
    @Builder.Default
    BigInteger curveSlope = BigInteger.TEN.pow(12);

    @Builder.Default
    BigInteger curveScale = BigInteger.TEN.pow(18);

    /** Curve capital, in external units, at which the market migrates. */
    @Builder.Default
    BigInteger migrationThreshold = BigInteger.valueOf(50_000_000_000L);

    /** Residual curve gap, in accounting units, that a capped purchase may absorb. */
    @Builder.Default
    BigInteger dustTolerance = BigInteger.TEN.pow(12);

    @Builder.Default
    int curveFeeBps = 50;

    @Builder.Default
    int maxLeverage = 5;

    @Builder.Default
    BigInteger minCollateral = BigInteger.valueOf(10_000_000L);

    /** Ceiling applied to a side price before the complementary reserve is rebalanced. */
    @Builder.Default
    BigInteger priceCeiling = new BigInteger("990000000000000000");

    @Builder.Default
    int borrowRateBps = 500;

    @Builder.Default
    int liquidationThresholdBps = 12_000;

    @Builder.Default
    int liquidationFeeBps = 500;

    @Builder.Default
    int keeperRewardBps = 500;

    @Builder.Default
    int bonusYieldBps = 200;

    @Builder.Default
    int tierStandardBps = 10_000;

    @Builder.Default
    int tierEarlyBps = 15_000;

    @Builder.Default
    int tierFanTokenBps = 20_000;

    @Builder.Default
    Duration coolingOff = Duration.ofDays(30);

    public int tierMultiplierBps(UserTier tier) {
        return switch (tier) {
            case STANDARD -> tierStandardBps;
            case EARLY -> tierEarlyBps;
            case FAN_TOKEN -> tierFanTokenBps;
        };
    }

    /** Threshold expressed in accounting units, the unit curve capital is tracked in. */
    public BigInteger migrationThresholdAccounting() {
        return migrationThreshold.multiply(BigInteger.TEN.pow(12));
    }

    public void validate() {
        if (marketAddress == null || !marketAddress.matches("0x[0-9a-fA-F]{40}")) {
            throw invalid("marketAddress must be a 0x-prefixed 20-byte hex address");
        }
        requirePositive(curveSlope, "curveSlope");
        requirePositive(curveScale, "curveScale");
        requirePositive(migrationThreshold, "migrationThreshold");
        requirePositive(minCollateral, "minCollateral");
        if (dustTolerance.signum() < 0 || dustTolerance.compareTo(BigInteger.TEN.pow(12)) > 0) {
            throw invalid("dustTolerance must be between 0 and one external unit increment (1e12)");
        }
        if (maxLeverage < 1) {
            throw invalid("maxLeverage must be at least 1");
        }
        if (priceCeiling.signum() <= 0 || priceCeiling.compareTo(BigInteger.TEN.pow(18)) >= 0) {
            throw invalid("priceCeiling must be strictly between 0 and 1e18");
        }
        if (liquidationFeeBps + keeperRewardBps > 10_000) {
            throw invalid("liquidationFeeBps + keeperRewardBps exceeds 10000");
        }
        if (curveFeeBps < 0 || borrowRateBps < 0 || bonusYieldBps < 0 || liquidationThresholdBps <= 0) {
            throw invalid("basis point parameters must not be negative");
        }
        if (coolingOff == null || coolingOff.isNegative()) {
            throw invalid("coolingOff must be a non-negative duration");
        }
    }

    private static void requirePositive(BigInteger value, String name) {
        if (value == null || value.signum() <= 0) {
            throw invalid(name + " must be positive");
        }
    }

    private static IllegalArgumentException invalid(String message) {
        return new IllegalArgumentException("Invalid market parameters: " + message);
    }
}
