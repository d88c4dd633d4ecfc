package market.torch.sdk.curve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.Random;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.U64Math;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TorchCurveTest {

  private static final long ONE_SOL = 1_000_000_000L;

  private static final ReserveSnapshot LAUNCH =
      ReserveSnapshot.of(30_000_000_000L, 1_073_000_000_000_000L, 0, 0);

  private final TorchCurve curve = TorchCurve.standard();

  // ── buy ───────────────────────────────────────────────────────────────

  @Nested
  @DisplayName("calculateTokensOut()")
  class Buy {

    @Test
    @DisplayName("1 SOL into a fresh curve")
    void oneSolAtLaunch() {
      final BuyResult result = curve.calculateTokensOut(ONE_SOL, LAUNCH);

      assertThat(result.protocolFee()).isEqualTo(big(10_000_000));
      assertThat(result.treasuryFee()).isEqualTo(big(10_000_000));
      assertThat(result.solAfterFees()).isEqualTo(big(980_000_000));
      assertThat(result.treasuryRateBps()).isEqualTo(2_000);
      assertThat(result.solToTreasurySplit()).isEqualTo(big(196_000_000));
      assertThat(result.solToCurve()).isEqualTo(big(784_000_000));
      assertThat(result.solToTreasury()).isEqualTo(big(206_000_000));
      // 1_073_000_000_000_000 * 784_000_000 / 30_784_000_000
      assertThat(result.tokensOut()).isEqualTo(big(27_326_923_076_923L));
      assertThat(result.tokensToUser()).isEqualTo(big(24_594_230_769_230L));
      assertThat(result.tokensToCommunity()).isEqualTo(big(2_732_692_307_693L));
    }

    @Test
    @DisplayName("fully progressed curve pays the minimum treasury rate")
    void fullProgress() {
      final ReserveSnapshot full =
          ReserveSnapshot.of(30_000_000_000L, 1_073_000_000_000_000L, 200_000_000_000L, 0);

      final BuyResult result = curve.calculateTokensOut(ONE_SOL, full);

      assertThat(result.treasuryRateBps()).isEqualTo(500);
      assertThat(result.solToTreasurySplit()).isEqualTo(big(49_000_000));
      assertThat(result.solToCurve()).isEqualTo(big(931_000_000));
      assertThat(result.tokensOut()).isEqualTo(big(32_296_498_658_303L));
    }

    @Test
    @DisplayName("per-mint target replaces the 200 SOL default")
    void perMintTarget() {
      final ReserveSnapshot halfway =
          ReserveSnapshot.of(30_000_000_000L, 1_073_000_000_000_000L, 50_000_000_000L, 0);
      final FeeConfig fees = FeeConfig.withBondingTarget(big(100_000_000_000L));

      final BuyResult result = curve.calculateTokensOut(big(ONE_SOL), halfway, fees);

      assertThat(result.treasuryRateBps()).isEqualTo(1_250);
      assertThat(result.solToCurve()).isEqualTo(big(857_500_000));
      assertThat(result.tokensOut()).isEqualTo(big(29_817_629_425_585L));
    }

    @Test
    @DisplayName("zero SOL buys nothing and charges nothing")
    void zeroAmount() {
      final BuyResult result = curve.calculateTokensOut(0, LAUNCH);

      assertThat(result.tokensOut()).isZero();
      assertThat(result.tokensToUser()).isZero();
      assertThat(result.tokensToCommunity()).isZero();
      assertThat(result.protocolFee()).isZero();
      assertThat(result.treasuryFee()).isZero();
      assertThat(result.solToCurve()).isZero();
      assertThat(result.solToTreasury()).isZero();
    }

    @Test
    @DisplayName("fees truncate toward zero on dust amounts")
    void dustTruncation() {
      final BuyResult result = curve.calculateTokensOut(12_345, LAUNCH);

      assertThat(result.protocolFee()).isEqualTo(big(123));
      assertThat(result.solToTreasurySplit()).isEqualTo(big(2_419));
      assertThat(result.solToCurve()).isEqualTo(big(9_680));
      assertThat(result.tokensOut()).isEqualTo(big(346_221_221));
      assertThat(result.tokensToCommunity()).isEqualTo(big(34_622_123));
    }

    @Test
    @DisplayName("token and SOL splits always add back up")
    void splitsAreComplete() {
      final Random random = new Random(42);
      for (int i = 0; i < 2_000; i++) {
        final ReserveSnapshot reserves = randomReserves(random);
        final FeeConfig fees =
            new FeeConfig(
                random.nextInt(501),
                random.nextInt(501),
                big(random.nextInt(3) * 100_000_000_000L));
        final BigInteger sol = big(Math.floorMod(random.nextLong(), 500 * ONE_SOL));

        final BuyResult result = curve.calculateTokensOut(sol, reserves, fees);

        assertThat(result.tokensToUser().add(result.tokensToCommunity()))
            .isEqualTo(result.tokensOut());
        assertThat(
                result.protocolFee()
                    .add(result.treasuryFee())
                    .add(result.solToCurve())
                    .add(result.solToTreasurySplit()))
            .isEqualTo(sol);
        assertThat(result.solToTreasury())
            .isEqualTo(result.treasuryFee().add(result.solToTreasurySplit()));
      }
    }

    @Test
    @DisplayName("larger buys never deliver fewer tokens to the user")
    void userTokensNonDecreasing() {
      final ReserveSnapshot reserves =
          ReserveSnapshot.of(42_000_000_000L, 800_000_000_000_000L, 12_000_000_000L, 0);
      BigInteger previous = BigInteger.ZERO;
      for (long sol = 0; sol <= 50 * ONE_SOL; sol += 7_777_777L) {
        final BigInteger toUser = curve.calculateTokensOut(sol, reserves).tokensToUser();
        assertThat(toUser).isGreaterThanOrEqualTo(previous);
        previous = toUser;
      }
    }
  }

  // ── treasury rate ─────────────────────────────────────────────────────

  @Nested
  @DisplayName("treasuryRateBps()")
  class TreasuryRate {

    @Test
    @DisplayName("decays linearly between 2000 and 500")
    void linearDecay() {
      assertThat(curve.treasuryRateBps(BigInteger.ZERO, BigInteger.ZERO)).isEqualTo(2_000);
      assertThat(curve.treasuryRateBps(big(100_000_000_000L), BigInteger.ZERO)).isEqualTo(1_250);
      assertThat(curve.treasuryRateBps(big(200_000_000_000L), BigInteger.ZERO)).isEqualTo(500);
    }

    @Test
    @DisplayName("over-funded curves stay on the floor")
    void overFundedClampsToFloor() {
      assertThat(curve.treasuryRateBps(big(5_000_000_000_000L), BigInteger.ZERO)).isEqualTo(500);
      assertThat(curve.treasuryRateBps(U64Math.U64_MAX, big(1))).isEqualTo(500);
    }

    @Test
    @DisplayName("stays within [500, 2000] for any non-negative reserve")
    void withinBounds() {
      final Random random = new Random(11);
      for (int i = 0; i < 2_000; i++) {
        final BigInteger realSol = new BigInteger(64, random);
        final BigInteger target = big(1 + Math.floorMod(random.nextLong(), 1_000 * ONE_SOL));
        assertThat(curve.treasuryRateBps(realSol, target)).isBetween(500, 2_000);
      }
    }

    @Test
    @DisplayName("only the floor is clamped; the ceiling holds because decay is never negative")
    void noCeilingClamp() {
      // A narrower band shows the raw formula: max - realSol * (max - min) / target, floored at min.
      final TorchCurve narrow =
          new TorchCurve(new CurveParameters(3_000, 0, big(1_000), 9_000));

      assertThat(narrow.treasuryRateBps(BigInteger.ZERO, BigInteger.ZERO)).isEqualTo(3_000);
      assertThat(narrow.treasuryRateBps(big(1), BigInteger.ZERO)).isEqualTo(2_997);
      assertThat(narrow.treasuryRateBps(big(999), BigInteger.ZERO)).isEqualTo(3);
      assertThat(narrow.treasuryRateBps(big(2_000), BigInteger.ZERO)).isZero();
    }
  }

  // ── sell ──────────────────────────────────────────────────────────────

  @Nested
  @DisplayName("calculateSolOut()")
  class Sell {

    @Test
    @DisplayName("inverse constant product with no fee")
    void noFee() {
      final SellResult result = curve.calculateSolOut(1_000_000_000_000L, LAUNCH);

      // 30_000_000_000 * 1_000_000_000_000 / 1_074_000_000_000_000
      assertThat(result.solOut()).isEqualTo(big(27_932_960));
      assertThat(result.solToUser()).isEqualTo(result.solOut());
    }

    @Test
    @DisplayName("real reserves do not affect the sell price")
    void dependsOnlyOnVirtualReserves() {
      final ReserveSnapshot funded =
          ReserveSnapshot.of(30_000_000_000L, 1_073_000_000_000_000L, 150_000_000_000L, 9L);

      assertThat(curve.calculateSolOut(123_456_789L, funded))
          .isEqualTo(curve.calculateSolOut(123_456_789L, LAUNCH));
    }

    @Test
    @DisplayName("strictly increasing once steps exceed one lamport of value")
    void increasing() {
      BigInteger previous = BigInteger.valueOf(-1);
      for (long tokens = 0; tokens <= 100_000_000_000_000L; tokens += 1_000_000_000_000L) {
        final BigInteger sol = curve.calculateSolOut(tokens, LAUNCH).solOut();
        assertThat(sol).isGreaterThan(previous);
        previous = sol;
      }
    }

    @Test
    @DisplayName("never decreasing at base unit granularity")
    void nonDecreasingPerUnit() {
      BigInteger previous = BigInteger.ZERO;
      for (long tokens = 0; tokens < 200_000; tokens++) {
        final BigInteger sol = curve.calculateSolOut(tokens, LAUNCH).solOut();
        assertThat(sol).isGreaterThanOrEqualTo(previous);
        previous = sol;
      }
    }
  }

  // ── failures ──────────────────────────────────────────────────────────

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    void zeroVirtualReserves() {
      final ReserveSnapshot empty = ReserveSnapshot.of(0, 1_000, 0, 0);

      assertReason(() -> curve.calculateTokensOut(ONE_SOL, empty), Reason.INVALID_RESERVES);
      assertReason(() -> curve.calculateSolOut(1_000, empty), Reason.INVALID_RESERVES);
      assertReason(
          () -> curve.calculateSolOut(1_000, ReserveSnapshot.of(1_000, 0, 0, 0)),
          Reason.INVALID_RESERVES);
    }

    @Test
    void amountsBeyondU64() {
      final BigInteger tooLarge = U64Math.U64_MAX.add(BigInteger.ONE);

      assertReason(
          () -> curve.calculateTokensOut(tooLarge, LAUNCH, FeeConfig.DEFAULT),
          Reason.ARITHMETIC_OVERFLOW);
      assertReason(() -> curve.calculateSolOut(tooLarge, LAUNCH), Reason.ARITHMETIC_OVERFLOW);
      assertReason(
          () -> new ReserveSnapshot(tooLarge, BigInteger.ONE, BigInteger.ZERO, BigInteger.ZERO),
          Reason.ARITHMETIC_OVERFLOW);
    }

    @Test
    void feesAboveTheWholeAmount() {
      final FeeConfig greedy = new FeeConfig(6_000, 6_000, BigInteger.ZERO);

      assertReason(
          () -> curve.calculateTokensOut(big(ONE_SOL), LAUNCH, greedy), Reason.ARITHMETIC_OVERFLOW);
    }

    @Test
    void basisPointsOutOfRange() {
      assertReason(() -> new FeeConfig(10_001, 0, BigInteger.ZERO), Reason.INVALID_ARGUMENT);
      assertReason(() -> new FeeConfig(0, -1, BigInteger.ZERO), Reason.INVALID_ARGUMENT);
    }

    @Test
    void nonPositiveDefaultTarget() {
      assertReason(
          () -> new CurveParameters(2_000, 500, BigInteger.ZERO, 9_000), Reason.INVALID_TARGET);
    }

    @Test
    void negativeInputs() {
      assertReason(
          () -> curve.calculateSolOut(BigInteger.valueOf(-5), LAUNCH), Reason.INVALID_ARGUMENT);
    }
  }

  private static void assertReason(Runnable call, Reason reason) {
    assertThatThrownBy(call::run)
        .isInstanceOf(TorchSdkException.class)
        .extracting(e -> ((TorchSdkException) e).getReason())
        .isEqualTo(reason);
  }

  private static ReserveSnapshot randomReserves(Random random) {
    return ReserveSnapshot.of(
        1 + Math.floorMod(random.nextLong(), 500 * ONE_SOL),
        1 + Math.floorMod(random.nextLong(), 1_073_000_000_000_000L),
        Math.floorMod(random.nextLong(), 400 * ONE_SOL),
        Math.floorMod(random.nextLong(), 1_000_000_000_000_000L));
  }

  private static BigInteger big(long value) {
    return BigInteger.valueOf(value);
  }
}
