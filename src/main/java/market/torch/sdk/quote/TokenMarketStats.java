package market.torch.sdk.quote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display figures for a token, all in whole SOL and whole tokens.
 *
 * @param progressPercent against the fixed 200 SOL target
 * @param solTarget the curve's own resolved target, which may differ from the one progress uses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenMarketStats(
    @JsonProperty("status") TokenStatus status,
    @JsonProperty("price_sol") double priceSol,
    @JsonProperty("price_usd") Double priceUsd,
    @JsonProperty("market_cap_sol") double marketCapSol,
    @JsonProperty("market_cap_usd") Double marketCapUsd,
    @JsonProperty("progress_percent") double progressPercent,
    @JsonProperty("sol_raised") double solRaised,
    @JsonProperty("sol_target") double solTarget,
    @JsonProperty("total_supply") double totalSupply,
    @JsonProperty("circulating_supply") double circulatingSupply,
    @JsonProperty("tokens_in_curve") double tokensInCurve,
    @JsonProperty("tokens_in_vote_vault") double tokensInVoteVault) {}
