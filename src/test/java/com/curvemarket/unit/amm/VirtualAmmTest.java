package com.curvemarket.unit.amm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.curvemarket.amm.AmmTrade;
import com.curvemarket.amm.VirtualAmm;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.math.MarketMath;
import com.curvemarket.state.MarketStateStore;
import com.curvemarket.support.MarketHarness;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VirtualAmmTest {

    private static final BigInteger CAPITAL = new BigInteger("50000000000000000000000");
    private static final BigInteger HALF = new BigInteger("500000000000000000");
    private static final BigInteger CEILING = new BigInteger("990000000000000000");
    private static final BigInteger FLOOR = new BigInteger("10000000000000000");
    private static final BigInteger SELL_FLOOR = new BigInteger("50000000000000000");

    private MarketStateStore store;
    private VirtualAmm amm;

    @BeforeEach
    void setUp() {
        store = new MarketStateStore();
        store.initialize(MarketHarness.defaultParameters(), "0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
        amm = new VirtualAmm(store);
        amm.seed(CAPITAL);
    }

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    @Test
    @DisplayName("Seeding puts twice the capital on each side, so both prices start at 0.5")
    void seedStartsBalanced() {
        MarketState state = store.state();

        assertThat(state.getReserveStable()).isEqualTo(CAPITAL);
        assertThat(state.getReserveYes()).isEqualTo(big("100000000000000000000000"));
        assertThat(state.getReserveNo()).isEqualTo(big("100000000000000000000000"));
        assertThat(state.getInvariantK()).isEqualTo(CAPITAL.multiply(big("100000000000000000000000")));
        assertThat(amm.priceOf(OutcomeSide.YES)).isEqualTo(HALF);
        assertThat(amm.priceOf(OutcomeSide.NO)).isEqualTo(HALF);
    }

    // ==============================
    // BUYING
    // ==============================

    @Nested
    @DisplayName("Buying")
    class Buying {

        @Test
        @DisplayName("Buying YES with 5000 stable returns shares and lifts YES above 0.5")
        void buyMovesPrice() {
            AmmTrade trade = amm.buy(OutcomeSide.YES, big("5000000000000000000000"));

            assertThat(trade.amountOut()).isEqualTo(big("9090909090909090909090"));
            assertThat(trade.priceYes()).isEqualTo(big("604999999999999999"));
            assertThat(trade.priceNo()).isEqualTo(big("395000000000000001"));
            assertThat(trade.clamped()).isFalse();
            assertThat(store.state().getReserveNo()).isEqualTo(big("139240506329113923698125"));
        }

        @Test
        @DisplayName("Prices of both sides sum to one after a rebalance")
        void pricesSumToOne() {
            amm.buy(OutcomeSide.NO, big("1234000000000000000000"));

            BigInteger sum = amm.priceOf(OutcomeSide.YES).add(amm.priceOf(OutcomeSide.NO));

            assertThat(sum).isBetween(MarketMath.WAD.subtract(BigInteger.TWO), MarketMath.WAD.add(BigInteger.TWO));
        }

        @Test
        @DisplayName("Preview matches the shares an actual buy returns")
        void previewMatchesBuy() {
            BigInteger preview = amm.previewBuy(OutcomeSide.NO, big("777000000000000000000"));

            AmmTrade trade = amm.buy(OutcomeSide.NO, big("777000000000000000000"));

            assertThat(trade.amountOut()).isEqualTo(preview);
        }

        @Test
        @DisplayName("Past the ceiling the traded reserve keeps its trade value and the other side is priced off the ceiling")
        void clampsAtCeiling() {
            AmmTrade trade = amm.buy(OutcomeSide.YES, big("1000000000000000000000000"));

            assertThat(trade.clamped()).isTrue();
            assertThat(trade.amountOut()).isEqualTo(big("95238095238095238095238"));
            assertThat(store.state().getReserveYes()).isEqualTo(big("4761904761904761904762"));
            assertThat(trade.priceYes()).isEqualTo(big("220499999999999999999"));
            assertThat(trade.priceNo()).isEqualTo(MarketMath.WAD.subtract(CEILING));
        }

        @Test
        @DisplayName("A second-side trade prices against the live product of its pair")
        void secondSideTradeUsesLivePairProduct() {
            amm.buy(OutcomeSide.YES, big("5000000000000000000000"));
            BigInteger stableBefore = store.state().getReserveStable();
            BigInteger noBefore = store.state().getReserveNo();

            AmmTrade trade = amm.buy(OutcomeSide.NO, big("1000000000000000000000"));

            assertThat(trade.amountOut()).isEqualTo(big("2486437613019891494609"));
            assertThat(trade.amountOut()).isEqualTo(noBefore.subtract(MarketMath.ceilDiv(
                    stableBefore.multiply(noBefore), stableBefore.add(big("1000000000000000000000")))));
            assertThat(trade.priceYes()).isEqualTo(big("590505785123966942"));
            assertThat(trade.priceNo()).isEqualTo(big("409494214876033058"));
        }

        @Test
        void rejectsZeroStable() {
            assertThatThrownBy(() -> amm.buy(OutcomeSide.YES, BigInteger.ZERO))
                    .isInstanceOf(ValidationException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.ZERO_AMOUNT);
        }
    }

    // ==============================
    // SELLING
    // ==============================

    @Nested
    @DisplayName("Selling")
    class Selling {

        @Test
        @DisplayName("Selling back bought shares returns slightly less stable than was paid")
        void roundTripLosesRounding() {
            AmmTrade bought = amm.buy(OutcomeSide.YES, big("5000000000000000000000"));

            AmmTrade sold = amm.sell(OutcomeSide.YES, bought.amountOut());

            assertThat(sold.amountOut()).isEqualTo(big("4999999999999999999999"));
            assertThat(store.state().getReserveYes()).isEqualTo(big("100000000000000000000000"));
        }

        @Test
        @DisplayName("Selling back shares bought past the ceiling returns the stable paid, less rounding")
        void roundTripThroughCeiling() {
            BigInteger paid = big("1000000000000000000000000");
            AmmTrade bought = amm.buy(OutcomeSide.YES, paid);

            AmmTrade sold = amm.sell(OutcomeSide.YES, bought.amountOut());

            assertThat(bought.clamped()).isTrue();
            assertThat(sold.amountOut()).isEqualTo(paid.subtract(BigInteger.ONE));
            assertThat(store.state().getReserveYes()).isEqualTo(big("100000000000000000000000"));
            assertThat(sold.clamped()).isFalse();
        }

        @Test
        @DisplayName("A sale worth less than one unit of stable is rejected")
        void rejectsDustSale() {
            assertThatThrownBy(() -> amm.sell(OutcomeSide.NO, BigInteger.ONE))
                    .isInstanceOf(ValidationException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.ZERO_STABLE_OUT);
        }

        @Test
        void rejectsZeroShares() {
            assertThatThrownBy(() -> amm.sell(OutcomeSide.NO, BigInteger.ZERO))
                    .isInstanceOf(ValidationException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.ZERO_AMOUNT);
        }
    }

    // ==============================
    // CEILING BOUNDARY
    // ==============================

    @Nested
    @DisplayName("Ceiling boundary")
    class CeilingBoundary {

        @Test
        @DisplayName("In a seeded walk of large trades prices sum to one except while clamped")
        void randomWalkKeepsPricesBounded() {
            Random random = new Random(42L);
            Map<OutcomeSide, BigInteger> held = new EnumMap<>(OutcomeSide.class);
            held.put(OutcomeSide.YES, BigInteger.ZERO);
            held.put(OutcomeSide.NO, BigInteger.ZERO);

            for (int step = 0; step < 200; step++) {
                OutcomeSide side = random.nextBoolean() ? OutcomeSide.YES : OutcomeSide.NO;
                BigInteger holding = held.get(side);
                AmmTrade trade;
                if (random.nextInt(3) == 0
                        && holding.compareTo(MarketMath.WAD) > 0
                        && amm.priceOf(side).compareTo(SELL_FLOOR) >= 0) {
                    BigInteger sharesIn = holding.divide(BigInteger.TWO)
                            .min(store.state().reserveOf(side).divide(BigInteger.TEN));
                    trade = amm.sell(side, sharesIn);
                    held.put(side, holding.subtract(sharesIn));
                } else {
                    BigInteger stableIn = MarketMath.WAD.multiply(BigInteger.valueOf(1 + random.nextInt(20_000)));
                    trade = amm.buy(side, stableIn);
                    held.put(side, holding.add(trade.amountOut()));
                }

                BigInteger traded = side == OutcomeSide.YES ? trade.priceYes() : trade.priceNo();
                BigInteger other = side == OutcomeSide.YES ? trade.priceNo() : trade.priceYes();
                if (trade.clamped()) {
                    assertThat(traded).isGreaterThan(CEILING);
                    assertThat(other).isBetween(FLOOR, FLOOR.add(BigInteger.ONE));
                } else {
                    assertThat(traded).isLessThanOrEqualTo(CEILING);
                    assertThat(traded.add(other))
                            .isBetween(MarketMath.WAD.subtract(BigInteger.TWO), MarketMath.WAD.add(BigInteger.TWO));
                }
                assertThat(store.state().getReserveStable()).isGreaterThan(MarketMath.WAD);
            }
        }

        @Test
        @DisplayName("Repeated buys past the ceiling keep returning shares and leave the other side at the floor price")
        void repeatedBuysPastCeiling() {
            for (int i = 0; i < 5; i++) {
                AmmTrade trade = amm.buy(OutcomeSide.NO, big("1000000000000000000000000"));

                assertThat(trade.clamped()).isTrue();
                assertThat(trade.amountOut()).isPositive();
                assertThat(trade.priceNo()).isGreaterThan(CEILING);
                assertThat(trade.priceYes()).isEqualTo(FLOOR);
            }
        }
    }
}
