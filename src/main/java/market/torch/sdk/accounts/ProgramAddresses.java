package market.torch.sdk.accounts;

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;
import net.i2p.crypto.eddsa.math.Curve;
import net.i2p.crypto.eddsa.math.GroupElement;
import net.i2p.crypto.eddsa.spec.EdDSANamedCurveTable;

/**
 * Program derived address search, reproducing the runtime's rules: {@code sha256(seeds || bump ||
 * program || "ProgramDerivedAddress")} must not decode to an ed25519 point, and bumps are tried
 * from 255 down to 1.
 */
@Slf4j
public final class ProgramAddresses {

  public static final int MAX_SEEDS = 16;

  public static final int MAX_SEED_LENGTH = 32;

  private static final byte[] PDA_MARKER = "ProgramDerivedAddress".getBytes(US_ASCII);

  private static final Curve ED25519 =
      EdDSANamedCurveTable.getByName(EdDSANamedCurveTable.ED_25519).getCurve();

  private ProgramAddresses() {}

  public static ProgramDerivedAddress findProgramAddress(
      final List<byte[]> seeds, final PublicKey program) {
    if (seeds.size() >= MAX_SEEDS) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT,
          "at most " + (MAX_SEEDS - 1) + " seeds leave room for the bump, got " + seeds.size());
    }
    final List<byte[]> withBump = new ArrayList<>(seeds.size() + 1);
    withBump.addAll(seeds);
    withBump.add(null);
    for (int bump = 255; bump > 0; bump--) {
      withBump.set(seeds.size(), new byte[] {(byte) bump});
      final Optional<PublicKey> address = createProgramAddress(withBump, program);
      if (address.isPresent()) {
        log.trace("program:{} address:{} bump:{}", program, address.get(), bump);
        return new ProgramDerivedAddress(address.get(), bump);
      }
    }
    throw new TorchSdkException(
        Reason.DERIVATION_EXHAUSTED, "no off-curve bump found for program " + program);
  }

  /** Returns empty when the seeds hash onto the curve and so cannot be used. */
  public static Optional<PublicKey> createProgramAddress(
      final List<byte[]> seeds, final PublicKey program) {
    if (seeds.size() > MAX_SEEDS) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT, "at most " + MAX_SEEDS + " seeds, got " + seeds.size());
    }
    final MessageDigest sha256 = sha256();
    for (final byte[] seed : seeds) {
      if (seed.length > MAX_SEED_LENGTH) {
        throw new TorchSdkException(
            Reason.INVALID_ARGUMENT,
            "seed length " + seed.length + " exceeds " + MAX_SEED_LENGTH + " bytes");
      }
      sha256.update(seed);
    }
    sha256.update(program.toByteArray());
    sha256.update(PDA_MARKER);
    final byte[] hash = sha256.digest();
    if (isOnCurve(hash)) {
      return Optional.empty();
    }
    return Optional.of(PublicKey.createPubKey(hash));
  }

  /** Whether the 32 byte compressed encoding decompresses to a point on ed25519. */
  public static boolean isOnCurve(final byte[] encoded) {
    try {
      new GroupElement(ED25519, encoded);
      return true;
    } catch (IllegalArgumentException notAPoint) {
      return false;
    }
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
