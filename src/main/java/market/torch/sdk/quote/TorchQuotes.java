package market.torch.sdk.quote;

import java.math.BigInteger;
import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchFormat;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import market.torch.sdk.curve.BuyResult;
import market.torch.sdk.curve.CurveParameters;
import market.torch.sdk.curve.FeeConfig;
import market.torch.sdk.curve.ReserveSnapshot;
import market.torch.sdk.curve.SellResult;
import market.torch.sdk.curve.TorchCurve;
import market.torch.sdk.curve.TorchCurveProgress;

/** Quotes against a curve state the caller has already fetched. */
@Slf4j
public class TorchQuotes {

  private static final TorchQuotes STANDARD = new TorchQuotes(TorchCurve.standard());

  private final TorchCurve curve;

  public TorchQuotes(TorchCurve curve) {
    this.curve = curve;
  }

  public static TorchQuotes standard() {
    return STANDARD;
  }

  public BuyQuote buyQuote(BondingCurveState state, BigInteger amountSol) {
    requireBonding(state);
    final ReserveSnapshot reserves = state.reserves();
    final BuyResult result =
        curve.calculateTokensOut(
            amountSol, reserves, FeeConfig.withBondingTarget(state.bondingTarget()));

    final double priceBefore = TorchCurveProgress.price(reserves);
    final double priceAfter =
        TorchCurveProgress.price(
            reserves.virtualSol().add(result.solToCurve()),
            reserves.virtualToken().subtract(result.tokensOut()));
    final double priceImpact = (priceAfter - priceBefore) / priceBefore * 100;

    final BuyQuote quote =
        new BuyQuote(
            amountSol,
            result.tokensOut(),
            result.tokensToUser(),
            result.tokensToCommunity(),
            result.protocolFee(),
            toSolPerToken(priceBefore),
            priceImpact,
            Slippage.minimumOut(result.tokensToUser()));
    log.debug("buyQuote:{}", quote);
    return quote;
  }

  public BuyQuote buyQuote(BondingCurveState state, long amountSol) {
    return buyQuote(state, BigInteger.valueOf(amountSol));
  }

  public SellQuote sellQuote(BondingCurveState state, BigInteger amountTokens) {
    requireBonding(state);
    final ReserveSnapshot reserves = state.reserves();
    final SellResult result = curve.calculateSolOut(amountTokens, reserves);

    final double priceBefore = TorchCurveProgress.price(reserves);
    final double priceAfter =
        TorchCurveProgress.price(
            reserves.virtualSol().subtract(result.solOut()),
            reserves.virtualToken().add(amountTokens));
    final double priceImpact = (priceBefore - priceAfter) / priceBefore * 100;

    final SellQuote quote =
        new SellQuote(
            amountTokens,
            result.solToUser(),
            BigInteger.ZERO,
            toSolPerToken(priceBefore),
            priceImpact,
            Slippage.minimumOut(result.solToUser()));
    log.debug("sellQuote:{}", quote);
    return quote;
  }

  public SellQuote sellQuote(BondingCurveState state, long amountTokens) {
    return sellQuote(state, BigInteger.valueOf(amountTokens));
  }

  /**
   * @param solPriceUsd optional; USD figures are left out when {@code null}
   */
  public TokenMarketStats marketStats(BondingCurveState state, Double solPriceUsd) {
    final ReserveSnapshot reserves = state.reserves();
    final double priceSol = TorchCurveProgress.priceInSol(reserves);
    final BigInteger circulating =
        CurveParameters.TOTAL_SUPPLY
            .subtract(reserves.realToken())
            .subtract(state.voteVaultBalance());
    final double marketCapSol = priceSol * circulating.doubleValue() / TorchFormat.TOKEN_MULTIPLIER;

    return new TokenMarketStats(
        state.status(),
        priceSol,
        solPriceUsd == null ? null : priceSol * solPriceUsd,
        marketCapSol,
        solPriceUsd == null ? null : marketCapSol * solPriceUsd,
        TorchCurveProgress.bondingProgress(reserves.realSol()),
        lamportsToSol(reserves.realSol()),
        lamportsToSol(curve.resolveTarget(state.bondingTarget())),
        toWholeTokens(CurveParameters.TOTAL_SUPPLY),
        toWholeTokens(circulating),
        toWholeTokens(reserves.realToken()),
        toWholeTokens(state.voteVaultBalance()));
  }

  private static void requireBonding(BondingCurveState state) {
    if (state.bondingComplete()) {
      throw new TorchSdkException(Reason.CURVE_COMPLETE, "Bonding curve complete, trade on DEX");
    }
  }

  private static double toSolPerToken(double lamportsPerBaseUnit) {
    return lamportsPerBaseUnit * TorchFormat.TOKEN_MULTIPLIER / TorchFormat.LAMPORTS_PER_SOL;
  }

  private static double lamportsToSol(BigInteger lamports) {
    return lamports.doubleValue() / TorchFormat.LAMPORTS_PER_SOL;
  }

  private static double toWholeTokens(BigInteger baseUnits) {
    return baseUnits.doubleValue() / TorchFormat.TOKEN_MULTIPLIER;
  }
}
