package com.curvemarket.math;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic shared by the curve, the AMM, the position ledger and settlement.
 *
 * <p>Every quantity is an unsigned {@link BigInteger}. Two unit systems coexist:
 * <ul>
 *   <li><b>accounting units</b> carry 18 decimals (shares, AMM reserves, curve capital)</li>
 *   <li><b>external units</b> carry 6 decimals (collateral, loans, payouts)</li>
 * </ul>
 * Conversion between them multiplies or divides by {@link #DECIMAL_MULTIPLIER}. Prices and
 * the settlement price are WAD-scaled, where {@link #WAD} represents 1.0.
 *
 * <p>Division floors unless a method says otherwise. The constant-product helpers round the
 * reserve that stays in the pool up, so the amount paid out is never larger than the exact
 * real-valued result.
 */
public final class MarketMath {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final int BPS = 10_000;
    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(BPS);
    public static final BigInteger DECIMAL_MULTIPLIER = BigInteger.TEN.pow(12);
    public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);

    /** Health factor reported for a position that owes nothing. */
    public static final BigInteger MAX_HEALTH_FACTOR = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final BigInteger TWO = BigInteger.TWO;

    private MarketMath() {}

    // ---- Unit conversion ----

    public static BigInteger toAccounting(BigInteger external) {
        return external.multiply(DECIMAL_MULTIPLIER);
    }

    public static BigInteger toExternal(BigInteger accounting) {
        return accounting.divide(DECIMAL_MULTIPLIER);
    }

    // ---- Generic helpers ----

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        return a.multiply(b).divide(denominator);
    }

    public static BigInteger ceilDiv(BigInteger numerator, BigInteger denominator) {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    public static BigInteger bps(BigInteger amount, int basisPoints) {
        return amount.multiply(BigInteger.valueOf(basisPoints)).divide(BPS_DENOMINATOR);
    }

    /** Floor square root. */
    public static BigInteger sqrt(BigInteger value) {
        if (value.signum() < 0) {
            throw new ArithmeticException("Square root of negative value " + value);
        }
        return value.sqrt();
    }

    public static BigInteger positiveOrZero(BigInteger value) {
        return value.signum() > 0 ? value : BigInteger.ZERO;
    }

    // ---- Bonding curve ----

    /** Marginal price at {@code supply}: {@code slope * supply / scale}. */
    public static BigInteger curveSpotPrice(BigInteger slope, BigInteger scale, BigInteger supply) {
        return slope.multiply(supply).divide(scale);
    }

    /**
     * Integral of the linear curve between two supplies:
     * {@code slope * (end^2 - start^2) / (2 * scale^2)}.
     */
    public static BigInteger curveCost(BigInteger slope, BigInteger scale, BigInteger start, BigInteger end) {
        if (end.compareTo(start) < 0) {
            throw new ArithmeticException("Curve end " + end + " is below start " + start);
        }
        BigInteger area = end.multiply(end).subtract(start.multiply(start));
        return slope.multiply(area).divide(TWO.multiply(scale).multiply(scale));
    }

    /**
     * Largest share amount whose curve cost from {@code start} does not exceed {@code capital}.
     * Inverts {@link #curveCost} with a floor square root, so the result never overshoots.
     */
    public static BigInteger curveSharesForCapital(
            BigInteger slope, BigInteger scale, BigInteger start, BigInteger capital) {
        BigInteger extraArea = TWO.multiply(capital).multiply(scale).multiply(scale).divide(slope);
        BigInteger end = sqrt(start.multiply(start).add(extraArea));
        return positiveOrZero(end.subtract(start));
    }

    // ---- Constant product ----

    /** Reserves after a trade plus the amount the trader receives. */
    public record ConstantProductResult(BigInteger reserveStable, BigInteger reserveSide, BigInteger amountOut) {}

    /** Stable in, outcome shares out, against the pair product {@code reserveStable * reserveSide}. */
    public static ConstantProductResult buyShares(BigInteger reserveStable, BigInteger reserveSide, BigInteger stableIn) {
        BigInteger product = reserveStable.multiply(reserveSide);
        BigInteger newStable = reserveStable.add(stableIn);
        BigInteger newSide = ceilDiv(product, newStable);
        return new ConstantProductResult(newStable, newSide, positiveOrZero(reserveSide.subtract(newSide)));
    }

    /** Outcome shares in, stable out, against the pair product {@code reserveStable * reserveSide}. */
    public static ConstantProductResult sellShares(BigInteger reserveStable, BigInteger reserveSide, BigInteger sharesIn) {
        BigInteger product = reserveStable.multiply(reserveSide);
        BigInteger newSide = reserveSide.add(sharesIn);
        BigInteger newStable = ceilDiv(product, newSide);
        return new ConstantProductResult(newStable, newSide, positiveOrZero(reserveStable.subtract(newStable)));
    }

    /** WAD-scaled price of one outcome share; zero while the side has no reserve. */
    public static BigInteger price(BigInteger reserveStable, BigInteger reserveSide) {
        if (reserveSide.signum() == 0) {
            return BigInteger.ZERO;
        }
        return reserveStable.multiply(WAD).divide(reserveSide);
    }

    // ---- Lending ----

    /** Simple annual interest: {@code principal * rateBps * elapsed / (BPS * year)}. */
    public static BigInteger simpleInterest(BigInteger principal, int annualRateBps, long elapsedSeconds) {
        if (elapsedSeconds <= 0 || principal.signum() == 0) {
            return BigInteger.ZERO;
        }
        return principal
                .multiply(BigInteger.valueOf(annualRateBps))
                .multiply(BigInteger.valueOf(elapsedSeconds))
                .divide(BPS_DENOMINATOR.multiply(SECONDS_PER_YEAR));
    }

    /**
     * Health factor in basis points: {@code value * BPS / (debt * thresholdBps / BPS)}.
     * Below {@link #BPS} the position may be liquidated.
     */
    public static BigInteger healthFactor(BigInteger value, BigInteger debt, int liquidationThresholdBps) {
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        BigInteger required = bps(debt, liquidationThresholdBps);
        if (required.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        return value.multiply(BPS_DENOMINATOR).divide(required);
    }
}
