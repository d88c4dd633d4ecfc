package market.torch.sdk.curve;

import static market.torch.sdk.U64Math.applyBps;
import static market.torch.sdk.U64Math.checkedAdd;
import static market.torch.sdk.U64Math.checkedMul;
import static market.torch.sdk.U64Math.checkedSub;
import static market.torch.sdk.U64Math.mulDiv;

import java.math.BigInteger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.U64Math;

/**
 * Constant product pricing, step for step as the program settles it. Every division truncates and
 * the order of operations is fixed; reordering them shifts results by a few base units, which is
 * enough to fail a slippage check on chain.
 */
@Slf4j
@Getter
public class TorchCurve {

  private static final TorchCurve STANDARD = new TorchCurve(CurveParameters.DEFAULT);

  private final CurveParameters parameters;

  public TorchCurve(CurveParameters parameters) {
    this.parameters = parameters;
  }

  public static TorchCurve standard() {
    return STANDARD;
  }

  public BigInteger resolveTarget(BigInteger bondingTarget) {
    final BigInteger target =
        bondingTarget == null || bondingTarget.signum() == 0
            ? parameters.defaultBondingTarget()
            : bondingTarget;
    if (target.signum() <= 0) {
      throw new TorchSdkException(
          Reason.INVALID_TARGET, "bonding target must be positive: " + target);
    }
    return target;
  }

  /**
   * Treasury share of post-fee SOL. Only the floor is clamped: {@code realSolReserves} past the
   * target still yields the minimum, while the ceiling is never applied.
   */
  public int treasuryRateBps(BigInteger realSolReserves, BigInteger bondingTarget) {
    U64Math.requireU64("realSolReserves", realSolReserves);
    final BigInteger target = resolveTarget(bondingTarget);
    final int max = parameters.maxTreasuryRateBps();
    final int min = parameters.minTreasuryRateBps();
    final BigInteger decay =
        checkedMul(realSolReserves, BigInteger.valueOf(max - min)).divide(target);
    final BigInteger rate = BigInteger.valueOf(max).subtract(decay);
    return rate.max(BigInteger.valueOf(min)).intValueExact();
  }

  public BuyResult calculateTokensOut(long solAmount, ReserveSnapshot reserves) {
    return calculateTokensOut(BigInteger.valueOf(solAmount), reserves, FeeConfig.DEFAULT);
  }

  public BuyResult calculateTokensOut(
      BigInteger solAmount, ReserveSnapshot reserves, FeeConfig fees) {
    U64Math.requireU64("solAmount", solAmount);
    requirePositiveVirtualReserves(reserves);

    final BigInteger protocolFee = applyBps(solAmount, fees.protocolFeeBps());
    final BigInteger treasuryFee = applyBps(solAmount, fees.treasuryFeeBps());
    final BigInteger solAfterFees = checkedSub(checkedSub(solAmount, protocolFee), treasuryFee);

    final int rateBps = treasuryRateBps(reserves.realSol(), fees.bondingTarget());
    final BigInteger solToTreasurySplit = applyBps(solAfterFees, rateBps);
    final BigInteger solToCurve = checkedSub(solAfterFees, solToTreasurySplit);
    final BigInteger solToTreasury = U64Math.toU64(checkedAdd(treasuryFee, solToTreasurySplit));

    final BigInteger tokensOut =
        mulDiv(
            reserves.virtualToken(), solToCurve, checkedAdd(reserves.virtualSol(), solToCurve));
    final BigInteger tokensToUser = applyBps(tokensOut, parameters.userShareBps());
    final BigInteger tokensToCommunity = checkedSub(tokensOut, tokensToUser);

    final BuyResult result =
        new BuyResult(
            tokensOut,
            tokensToUser,
            tokensToCommunity,
            protocolFee,
            treasuryFee,
            solAfterFees,
            solToTreasurySplit,
            solToCurve,
            solToTreasury,
            rateBps);
    log.debug("buy solAmount:{} reserves:{} -> {}", solAmount, reserves, result);
    return result;
  }

  /** Inverse constant product. No fee is taken on sells; the user receives all of it. */
  public SellResult calculateSolOut(BigInteger tokenAmount, ReserveSnapshot reserves) {
    U64Math.requireU64("tokenAmount", tokenAmount);
    requirePositiveVirtualReserves(reserves);
    final BigInteger solOut =
        mulDiv(
            reserves.virtualSol(),
            tokenAmount,
            checkedAdd(reserves.virtualToken(), tokenAmount));
    log.debug("sell tokenAmount:{} reserves:{} -> solOut:{}", tokenAmount, reserves, solOut);
    return new SellResult(solOut, solOut);
  }

  public SellResult calculateSolOut(long tokenAmount, ReserveSnapshot reserves) {
    return calculateSolOut(BigInteger.valueOf(tokenAmount), reserves);
  }

  private static void requirePositiveVirtualReserves(ReserveSnapshot reserves) {
    if (reserves.virtualSol().signum() == 0 || reserves.virtualToken().signum() == 0) {
      log.debug("rejecting empty virtual reserves: {}", reserves);
      throw new TorchSdkException(
          Reason.INVALID_RESERVES,
          "virtual reserves must be positive, got sol="
              + reserves.virtualSol()
              + " token="
              + reserves.virtualToken());
    }
  }
}
