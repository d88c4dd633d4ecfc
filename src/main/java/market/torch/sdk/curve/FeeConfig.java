package market.torch.sdk.curve;

import java.math.BigInteger;
import market.torch.sdk.U64Math;

/**
 * Per-buy fee settings.
 *
 * @param protocolFeeBps protocol fee, split 75/25 between protocol treasury and dev wallet on chain
 * @param treasuryFeeBps flat fee to the token's own treasury
 * @param bondingTarget graduation target in lamports; {@code 0} means the protocol default
 */
public record FeeConfig(int protocolFeeBps, int treasuryFeeBps, BigInteger bondingTarget) {

  public static final int DEFAULT_PROTOCOL_FEE_BPS = 100;

  public static final int DEFAULT_TREASURY_FEE_BPS = 100;

  public static final FeeConfig DEFAULT =
      new FeeConfig(DEFAULT_PROTOCOL_FEE_BPS, DEFAULT_TREASURY_FEE_BPS, BigInteger.ZERO);

  public FeeConfig {
    U64Math.requireBps("protocolFeeBps", protocolFeeBps);
    U64Math.requireBps("treasuryFeeBps", treasuryFeeBps);
    U64Math.requireU64("bondingTarget", bondingTarget);
  }

  public static FeeConfig withBondingTarget(BigInteger bondingTarget) {
    return new FeeConfig(DEFAULT_PROTOCOL_FEE_BPS, DEFAULT_TREASURY_FEE_BPS, bondingTarget);
  }
}
