package market.torch.sdk.accounts;

/**
 * An address derived from a program id and seeds, with the bump seed that moved it off the
 * ed25519 curve.
 */
public record ProgramDerivedAddress(PublicKey publicKey, int bump) {}
