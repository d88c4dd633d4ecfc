package market.torch.sdk.quote;

import java.math.BigInteger;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.U64Math;

/** Minimum-output bounds passed to buy and sell instructions. */
public final class Slippage {

  public static final int DEFAULT_SLIPPAGE_BPS = 100;

  public static final int MIN_SLIPPAGE_BPS = 10;

  public static final int MAX_SLIPPAGE_BPS = 1_000;

  private Slippage() {}

  public static BigInteger minimumOut(BigInteger expected, int slippageBps) {
    if (slippageBps < MIN_SLIPPAGE_BPS || slippageBps > MAX_SLIPPAGE_BPS) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT,
          "slippage_bps must be between 10 (0.1%) and 1000 (10%), got " + slippageBps);
    }
    U64Math.requireU64("expected", expected);
    return U64Math.applyBps(expected, 10_000 - slippageBps);
  }

  public static BigInteger minimumOut(BigInteger expected) {
    return minimumOut(expected, DEFAULT_SLIPPAGE_BPS);
  }
}
