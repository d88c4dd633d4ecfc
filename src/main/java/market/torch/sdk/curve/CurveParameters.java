package market.torch.sdk.curve;

import java.math.BigInteger;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.U64Math;

/**
 * Program constants the buy path depends on. The treasury takes {@code maxTreasuryRateBps} of the
 * post-fee SOL at zero progress, decaying linearly to {@code minTreasuryRateBps} at the target.
 */
public record CurveParameters(
    int maxTreasuryRateBps,
    int minTreasuryRateBps,
    BigInteger defaultBondingTarget,
    int userShareBps) {

  /** 200 SOL. */
  public static final BigInteger DEFAULT_BONDING_TARGET = BigInteger.valueOf(200_000_000_000L);

  public static final BigInteger TOTAL_SUPPLY = BigInteger.valueOf(1_000_000_000_000_000L);

  /** 2% of supply. */
  public static final BigInteger MAX_WALLET_TOKENS = BigInteger.valueOf(20_000_000_000_000L);

  public static final BigInteger INITIAL_VIRTUAL_SOL = BigInteger.valueOf(30_000_000_000L);

  public static final BigInteger INITIAL_VIRTUAL_TOKENS = BigInteger.valueOf(107_300_000_000_000L);

  /** 0.001 SOL. */
  public static final BigInteger MIN_SOL_AMOUNT = BigInteger.valueOf(1_000_000L);

  public static final int COMMUNITY_SHARE_BPS = 1_000;

  public static final CurveParameters DEFAULT =
      new CurveParameters(2_000, 500, DEFAULT_BONDING_TARGET, 10_000 - COMMUNITY_SHARE_BPS);

  public CurveParameters {
    U64Math.requireBps("maxTreasuryRateBps", maxTreasuryRateBps);
    U64Math.requireBps("minTreasuryRateBps", minTreasuryRateBps);
    U64Math.requireBps("userShareBps", userShareBps);
    if (minTreasuryRateBps > maxTreasuryRateBps) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT,
          "min treasury rate " + minTreasuryRateBps + " above max " + maxTreasuryRateBps);
    }
    if (defaultBondingTarget == null || defaultBondingTarget.signum() <= 0) {
      throw new TorchSdkException(
          Reason.INVALID_TARGET,
          "default bonding target must be positive: " + defaultBondingTarget);
    }
    U64Math.requireU64("defaultBondingTarget", defaultBondingTarget);
  }
}
