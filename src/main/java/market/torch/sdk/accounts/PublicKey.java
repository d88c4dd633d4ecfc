package market.torch.sdk.accounts;

import java.util.Arrays;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/**
 * A 32 byte Solana account address. Instances are immutable; ordering is the raw byte order,
 * most significant byte first, with each byte compared unsigned.
 */
public final class PublicKey implements Comparable<PublicKey> {

  public static final int PUBLIC_KEY_LENGTH = 32;

  private final byte[] key;

  private PublicKey(byte[] key) {
    this.key = key;
  }

  public static PublicKey createPubKey(byte[] key) {
    if (key == null || key.length != PUBLIC_KEY_LENGTH) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT,
          "public key must be " + PUBLIC_KEY_LENGTH + " bytes, got "
              + (key == null ? "null" : key.length));
    }
    return new PublicKey(key.clone());
  }

  public static PublicKey fromBase58Encoded(String base58) {
    final byte[] decoded;
    try {
      decoded = Base58.decode(base58);
    } catch (AddressFormatException e) {
      throw new TorchSdkException(Reason.INVALID_ARGUMENT, "invalid base58 key: " + base58, e);
    }
    return createPubKey(decoded);
  }

  public byte[] toByteArray() {
    return key.clone();
  }

  public String toBase58() {
    return Base58.encode(key);
  }

  @Override
  public int compareTo(PublicKey other) {
    return Arrays.compareUnsigned(key, other.key);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof PublicKey other && Arrays.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(key);
  }

  @Override
  public String toString() {
    return toBase58();
  }
}
