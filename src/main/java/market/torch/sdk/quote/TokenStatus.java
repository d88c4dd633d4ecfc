package market.torch.sdk.quote;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TokenStatus {
  BONDING("bonding"),
  COMPLETE("complete"),
  MIGRATED("migrated");

  @JsonValue private final String value;
}
