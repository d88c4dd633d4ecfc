package market.torch.sdk.curve;

import java.math.BigInteger;

/** Sells carry no fee, so {@code solToUser} always equals {@code solOut}. */
public record SellResult(BigInteger solOut, BigInteger solToUser) {}
