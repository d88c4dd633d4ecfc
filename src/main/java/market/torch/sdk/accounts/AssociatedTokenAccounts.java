package market.torch.sdk.accounts;

import java.util.List;
import market.torch.sdk.TorchSdkException;
import market.torch.sdk.TorchSdkException.Reason;

/** Associated token account addresses: seeds {@code [owner, token program, mint]}. */
public final class AssociatedTokenAccounts {

  private AssociatedTokenAccounts() {}

  public static ProgramDerivedAddress findATA(
      PublicKey owner, PublicKey mint, PublicKey tokenProgram, boolean allowOwnerOffCurve) {
    if (!allowOwnerOffCurve && !ProgramAddresses.isOnCurve(owner.toByteArray())) {
      throw new TorchSdkException(
          Reason.INVALID_ARGUMENT, "token owner " + owner + " is off curve");
    }
    return ProgramAddresses.findProgramAddress(
        List.of(owner.toByteArray(), tokenProgram.toByteArray(), mint.toByteArray()),
        SolanaAccounts.ASSOCIATED_TOKEN_ACCOUNT_PROGRAM);
  }

  /** Wallet-owned account under the classic SPL token program. */
  public static PublicKey associatedToken(PublicKey owner, PublicKey mint) {
    return findATA(owner, mint, SolanaAccounts.TOKEN_PROGRAM, false).publicKey();
  }

  /** Token-2022 account whose owner may itself be a program derived address. */
  public static PublicKey token2022Account(PublicKey owner, PublicKey mint) {
    return findATA(owner, mint, SolanaAccounts.TOKEN_2022_PROGRAM, true).publicKey();
  }
}
