package market.torch.sdk.client;

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchConfig;
import market.torch.sdk.accounts.AssociatedTokenAccounts;
import market.torch.sdk.accounts.ProgramAddresses;
import market.torch.sdk.accounts.ProgramDerivedAddress;
import market.torch.sdk.accounts.PublicKey;
import market.torch.sdk.accounts.SolanaAccounts;

/**
 * Accounts owned by the Torch Market program. Seeds are always the tag first, then the keys in
 * the order the program declares them; swapping two keys yields a different, valid looking
 * address.
 */
@Slf4j
@Getter
public class TorchPDAs {

  private static final TorchPDAs MAIN_NET = new TorchPDAs(TorchProgram.TORCH);

  private final PublicKey program;

  public TorchPDAs(PublicKey program) {
    this.program = program;
  }

  public TorchPDAs(TorchConfig config) {
    this(config.programId());
  }

  public static TorchPDAs mainNet() {
    return MAIN_NET;
  }

  public ProgramDerivedAddress globalConfigPDA() {
    return derive(TorchProgram.GLOBAL_CONFIG_SEED);
  }

  public ProgramDerivedAddress bondingCurvePDA(PublicKey mint) {
    return derive(TorchProgram.BONDING_CURVE_SEED, mint);
  }

  public ProgramDerivedAddress userPositionPDA(PublicKey bondingCurve, PublicKey user) {
    return derive(TorchProgram.USER_POSITION_SEED, bondingCurve, user);
  }

  public ProgramDerivedAddress voteRecordPDA(PublicKey bondingCurve, PublicKey voter) {
    return derive(TorchProgram.VOTE_SEED, bondingCurve, voter);
  }

  public ProgramDerivedAddress tokenTreasuryPDA(PublicKey mint) {
    return derive(TorchProgram.TREASURY_SEED, mint);
  }

  /**
   * The treasury's Token-2022 account, which holds the community (vote vault) tokens while the
   * curve is bonding. Derived by the associated token account program, not by Torch.
   */
  public PublicKey treasuryTokenAccount(PublicKey mint, PublicKey treasury) {
    return AssociatedTokenAccounts.findATA(treasury, mint, SolanaAccounts.TOKEN_2022_PROGRAM, true)
        .publicKey();
  }

  /** The bonding curve's own Token-2022 account holding the unsold supply. */
  public PublicKey bondingCurveTokenAccount(PublicKey mint, PublicKey bondingCurve) {
    return AssociatedTokenAccounts.findATA(
            bondingCurve, mint, SolanaAccounts.TOKEN_2022_PROGRAM, true)
        .publicKey();
  }

  public ProgramDerivedAddress protocolTreasuryPDA() {
    return derive(TorchProgram.PROTOCOL_TREASURY_SEED);
  }

  public ProgramDerivedAddress userStatsPDA(PublicKey user) {
    return derive(TorchProgram.USER_STATS_SEED, user);
  }

  /** Stars are per token: user first, then mint. */
  public ProgramDerivedAddress starRecordPDA(PublicKey user, PublicKey mint) {
    return derive(TorchProgram.STAR_RECORD_SEED, user, mint);
  }

  /** Loans are keyed mint first, then borrower, the reverse of star records. */
  public ProgramDerivedAddress loanPositionPDA(PublicKey mint, PublicKey borrower) {
    return derive(TorchProgram.LOAN_SEED, mint, borrower);
  }

  public ProgramDerivedAddress collateralVaultPDA(PublicKey mint) {
    return derive(TorchProgram.COLLATERAL_VAULT_SEED, mint);
  }

  public ProgramDerivedAddress torchVaultPDA(PublicKey creator) {
    return derive(TorchProgram.TORCH_VAULT_SEED, creator);
  }

  public ProgramDerivedAddress vaultWalletLinkPDA(PublicKey wallet) {
    return derive(TorchProgram.VAULT_WALLET_LINK_SEED, wallet);
  }

  private ProgramDerivedAddress derive(String tag, PublicKey... keys) {
    final List<byte[]> seeds = new ArrayList<>(keys.length + 1);
    seeds.add(tag.getBytes(US_ASCII));
    for (PublicKey key : keys) {
      seeds.add(key.toByteArray());
    }
    final ProgramDerivedAddress pda = ProgramAddresses.findProgramAddress(seeds, program);
    log.debug("{} PDA: {} bump:{}", tag, pda.publicKey(), pda.bump());
    return pda;
  }
}
