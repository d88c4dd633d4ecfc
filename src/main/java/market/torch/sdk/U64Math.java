package market.torch.sdk;

import java.math.BigInteger;
import market.torch.sdk.TorchSdkException.Reason;

/**
 * Checked integer arithmetic with the widths the on-chain program uses: amounts are u64,
 * products are carried in u128 and narrowed back to u64 before they are returned.
 */
public final class U64Math {

  public static final BigInteger U64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  public static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

  public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

  private U64Math() {}

  public static BigInteger requireU64(String field, BigInteger value) {
    if (value == null) {
      throw new TorchSdkException(Reason.INVALID_ARGUMENT, field + " is required");
    }
    if (value.signum() < 0) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT, field + " must not be negative: " + value);
    }
    if (value.compareTo(U64_MAX) > 0) {
      throw new TorchSdkException(Reason.ARITHMETIC_OVERFLOW, field + " exceeds u64: " + value);
    }
    return value;
  }

  public static BigInteger checkedMul(BigInteger a, BigInteger b) {
    final BigInteger product = a.multiply(b);
    if (product.compareTo(U128_MAX) > 0) {
      throw new TorchSdkException(Reason.ARITHMETIC_OVERFLOW, a + " * " + b + " exceeds u128");
    }
    return product;
  }

  public static BigInteger checkedAdd(BigInteger a, BigInteger b) {
    final BigInteger sum = a.add(b);
    if (sum.compareTo(U128_MAX) > 0) {
      throw new TorchSdkException(Reason.ARITHMETIC_OVERFLOW, a + " + " + b + " exceeds u128");
    }
    return sum;
  }

  public static BigInteger checkedSub(BigInteger a, BigInteger b) {
    final BigInteger difference = a.subtract(b);
    if (difference.signum() < 0) {
      throw new TorchSdkException(Reason.ARITHMETIC_OVERFLOW, a + " - " + b + " underflows");
    }
    return difference;
  }

  /** {@code a * b / denominator}, truncated. The divisor must be non-zero. */
  public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
    return toU64(checkedMul(a, b).divide(denominator));
  }

  public static BigInteger applyBps(BigInteger amount, int bps) {
    return mulDiv(amount, BigInteger.valueOf(bps), BPS_DENOMINATOR);
  }

  public static BigInteger toU64(BigInteger value) {
    if (value.compareTo(U64_MAX) > 0) {
      throw new TorchSdkException(Reason.ARITHMETIC_OVERFLOW, value + " does not fit in u64");
    }
    return value;
  }

  public static int requireBps(String field, int bps) {
    if (bps < 0 || bps > 10_000) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT, field + " must be within [0, 10000] bps, got " + bps);
    }
    return bps;
  }
}
