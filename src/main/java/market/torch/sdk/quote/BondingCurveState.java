package market.torch.sdk.quote;

import java.math.BigInteger;
import market.torch.sdk.U64Math;
import market.torch.sdk.curve.ReserveSnapshot;

/**
 * The subset of a decoded bonding curve account that quoting reads.
 *
 * @param voteVaultBalance community tokens held by the treasury while bonding
 * @param bondingTarget per-token graduation target, {@code 0} for the protocol default
 */
public record BondingCurveState(
    ReserveSnapshot reserves,
    BigInteger voteVaultBalance,
    BigInteger bondingTarget,
    boolean bondingComplete,
    boolean migrated) {

  public BondingCurveState {
    U64Math.requireU64("voteVaultBalance", voteVaultBalance);
    U64Math.requireU64("bondingTarget", bondingTarget);
  }

  public static BondingCurveState bonding(ReserveSnapshot reserves, BigInteger bondingTarget) {
    return new BondingCurveState(reserves, BigInteger.ZERO, bondingTarget, false, false);
  }

  public TokenStatus status() {
    if (migrated) {
      return TokenStatus.MIGRATED;
    }
    return bondingComplete ? TokenStatus.COMPLETE : TokenStatus.BONDING;
  }
}
