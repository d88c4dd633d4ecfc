package market.torch.sdk.client;

import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.accounts.PublicKey;

/**
 * Two mints in the order Raydium stores them: {@code token0} is the one whose bytes compare
 * lower, most significant byte first.
 *
 * @param firstIsToken0 whether the first argument given to {@link #order} became {@code token0}
 */
@Slf4j
public record TokenPair(PublicKey token0, PublicKey token1, boolean firstIsToken0) {

  public static TokenPair order(PublicKey tokenA, PublicKey tokenB) {
    final int cmp = tokenA.compareTo(tokenB);
    if (cmp == 0) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT, "cannot pair a mint with itself: " + tokenA);
    }
    final TokenPair pair =
        cmp < 0 ? new TokenPair(tokenA, tokenB, true) : new TokenPair(tokenB, tokenA, false);
    log.trace("ordered pair token0:{} token1:{}", pair.token0, pair.token1);
    return pair;
  }
}
