package market.torch.sdk.curve;

import java.math.BigInteger;
import market.torch.sdk.U64Math;

/**
 * Bonding curve reserves as last read from chain, in lamports and token base units. Read only;
 * nothing in the SDK mutates a snapshot.
 */
public record ReserveSnapshot(
    BigInteger virtualSol, BigInteger virtualToken, BigInteger realSol, BigInteger realToken) {

  public ReserveSnapshot {
    U64Math.requireU64("virtualSol", virtualSol);
    U64Math.requireU64("virtualToken", virtualToken);
    U64Math.requireU64("realSol", realSol);
    U64Math.requireU64("realToken", realToken);
  }

  public static ReserveSnapshot of(
      long virtualSol, long virtualToken, long realSol, long realToken) {
    return new ReserveSnapshot(
        BigInteger.valueOf(virtualSol),
        BigInteger.valueOf(virtualToken),
        BigInteger.valueOf(realSol),
        BigInteger.valueOf(realToken));
  }

  /** Reserves of a freshly launched curve. */
  public static ReserveSnapshot initial() {
    return new ReserveSnapshot(
        CurveParameters.INITIAL_VIRTUAL_SOL,
        CurveParameters.INITIAL_VIRTUAL_TOKENS,
        BigInteger.ZERO,
        BigInteger.ZERO);
  }
}
