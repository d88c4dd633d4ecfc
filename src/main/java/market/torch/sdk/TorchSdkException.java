package market.torch.sdk;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
public class TorchSdkException extends RuntimeException {

  private final Reason reason;

  public TorchSdkException(Reason reason, String message) {
    super("[" + reason.getCode() + "] " + message);
    this.reason = reason;
  }

  public TorchSdkException(Reason reason, String message, Throwable cause) {
    super("[" + reason.getCode() + "] " + message, cause);
    this.reason = reason;
  }

  @AllArgsConstructor
  @Getter
  public enum Reason {
    INVALID_RESERVES("InvalidReserves"),
    INVALID_TARGET("InvalidTarget"),
    ARITHMETIC_OVERFLOW("ArithmeticOverflow"),
    DERIVATION_EXHAUSTED("DerivationExhausted"),
    INVALID_ARGUMENT("InvalidArgument"),
    CURVE_COMPLETE("CurveComplete");

    private final String code;
  }
}
