package market.torch.sdk.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;

/**
 * @param tokensToTreasury the community share routed to the token treasury
 * @param pricePerTokenSol pre-trade price, SOL per whole token
 * @param minOutputTokens {@code tokensToUser} less 1%, the default slippage bound
 */
public record BuyQuote(
    @JsonProperty("input_sol") BigInteger inputSol,
    @JsonProperty("output_tokens") BigInteger outputTokens,
    @JsonProperty("tokens_to_user") BigInteger tokensToUser,
    @JsonProperty("tokens_to_treasury") BigInteger tokensToTreasury,
    @JsonProperty("protocol_fee_sol") BigInteger protocolFeeSol,
    @JsonProperty("price_per_token_sol") double pricePerTokenSol,
    @JsonProperty("price_impact_percent") double priceImpactPercent,
    @JsonProperty("min_output_tokens") BigInteger minOutputTokens) {}
