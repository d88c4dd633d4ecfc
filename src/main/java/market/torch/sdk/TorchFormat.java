package market.torch.sdk;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/** Display helpers for lamport and token amounts. Never used for settlement. */
public final class TorchFormat {

  public static final long LAMPORTS_PER_SOL = 1_000_000_000L;

  public static final int LAMPORT_DIGITS = 9;

  public static final int TOKEN_DECIMALS = 6;

  public static final long TOKEN_MULTIPLIER = 1_000_000L;

  private TorchFormat() {}

  public static String formatSol(BigInteger lamports) {
    final DecimalFormat format =
        new DecimalFormat("#,##0.00##", DecimalFormatSymbols.getInstance(Locale.US));
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format.format(new BigDecimal(lamports).movePointLeft(LAMPORT_DIGITS));
  }

  public static String formatSol(long lamports) {
    return formatSol(BigInteger.valueOf(lamports));
  }

  public static String formatTokens(BigInteger amount) {
    final double value = amount.doubleValue() / TOKEN_MULTIPLIER;
    if (value >= 1_000_000_000) {
      return fixed2(value / 1_000_000_000) + "B";
    }
    if (value >= 1_000_000) {
      return fixed2(value / 1_000_000) + "M";
    }
    if (value >= 1_000) {
      return fixed2(value / 1_000) + "K";
    }
    return fixed2(value);
  }

  public static String formatTokens(long amount) {
    return formatTokens(BigInteger.valueOf(amount));
  }

  /** {@code 0.1234 -> "12.34%"} */
  public static String formatPercent(double ratio) {
    return fixed2(ratio * 100) + "%";
  }

  public static String shortenAddress(String address, int chars) {
    if (address.length() <= chars * 2) {
      return address;
    }
    return address.substring(0, chars) + "..." + address.substring(address.length() - chars);
  }

  public static String shortenAddress(String address) {
    return shortenAddress(address, 4);
  }

  private static String fixed2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
