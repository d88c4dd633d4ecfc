package market.torch.sdk.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;

public record SellQuote(
    @JsonProperty("input_tokens") BigInteger inputTokens,
    @JsonProperty("output_sol") BigInteger outputSol,
    @JsonProperty("protocol_fee_sol") BigInteger protocolFeeSol,
    @JsonProperty("price_per_token_sol") double pricePerTokenSol,
    @JsonProperty("price_impact_percent") double priceImpactPercent,
    @JsonProperty("min_output_sol") BigInteger minOutputSol) {}
