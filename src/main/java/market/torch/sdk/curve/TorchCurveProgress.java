package market.torch.sdk.curve;

import java.math.BigInteger;
import market.torch.sdk.TorchFormat;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;

/**
 * Display-only price and progress figures. Settlement never uses these; see {@link TorchCurve}.
 */
public final class TorchCurveProgress {

  /** 200 SOL, fixed regardless of a curve's own target. */
  public static final BigInteger PROGRESS_TARGET_LAMPORTS = BigInteger.valueOf(200_000_000_000L);

  private TorchCurveProgress() {}

  /** Lamports per token base unit. */
  public static double price(BigInteger virtualSolReserves, BigInteger virtualTokenReserves) {
    if (virtualTokenReserves.signum() == 0) {
      throw new TorchSdkException(Reason.INVALID_RESERVES, "virtual token reserves are zero");
    }
    return virtualSolReserves.doubleValue() / virtualTokenReserves.doubleValue();
  }

  public static double price(ReserveSnapshot reserves) {
    return price(reserves.virtualSol(), reserves.virtualToken());
  }

  /** SOL per whole token, the figure shown to users. */
  public static double priceInSol(ReserveSnapshot reserves) {
    return price(reserves) * TorchFormat.TOKEN_MULTIPLIER / TorchFormat.LAMPORTS_PER_SOL;
  }

  /**
   * Percentage of the fixed 200 SOL target raised. Curves configured with a different target are
   * misreported; {@link #bondingProgress(BigInteger, BigInteger)} takes the curve's own target.
   */
  public static double bondingProgress(BigInteger realSolReserves) {
    return bondingProgress(realSolReserves, PROGRESS_TARGET_LAMPORTS);
  }

  public static double bondingProgress(BigInteger realSolReserves, BigInteger target) {
    if (target.signum() <= 0) {
      throw new TorchSdkException(
          Reason.INVALID_TARGET, "progress target must be positive: " + target);
    }
    if (realSolReserves.compareTo(target) >= 0) {
      return 100;
    }
    return realSolReserves.doubleValue() / target.doubleValue() * 100;
  }
}
