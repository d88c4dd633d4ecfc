package market.torch.sdk.curve;

import java.math.BigInteger;

/**
 * Everything the program computes for a buy. {@code tokensToUser + tokensToCommunity ==
 * tokensOut} and {@code protocolFee + treasuryFee + solToTreasurySplit + solToCurve ==} the SOL
 * paid in.
 *
 * @param solToTreasury flat treasury fee plus the progress dependent split
 * @param treasuryRateBps the decayed rate applied to the post-fee SOL
 */
public record BuyResult(
    BigInteger tokensOut,
    BigInteger tokensToUser,
    BigInteger tokensToCommunity,
    BigInteger protocolFee,
    BigInteger treasuryFee,
    BigInteger solAfterFees,
    BigInteger solToTreasurySplit,
    BigInteger solToCurve,
    BigInteger solToTreasury,
    int treasuryRateBps) {}
