package market.torch.sdk.client;

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.TorchConfig;
import market.torch.sdk.accounts.ProgramAddresses;
import market.torch.sdk.accounts.ProgramDerivedAddress;
import market.torch.sdk.accounts.PublicKey;

/** Raydium CPMM pool accounts. These belong to the CPMM program, not to Torch. */
@Slf4j
@Getter
public class RaydiumPDAs {

  private static final RaydiumPDAs MAIN_NET = new RaydiumPDAs(TorchConfig.MAIN_NET);

  private final PublicKey program;

  private final PublicKey ammConfig;

  private final PublicKey createPoolFee;

  private final PublicKey quoteMint;

  public RaydiumPDAs(TorchConfig config) {
    this.program = config.cpmmProgram();
    this.ammConfig = config.ammConfig();
    this.createPoolFee = config.createPoolFee();
    this.quoteMint = config.quoteMint();
  }

  public static RaydiumPDAs mainNet() {
    return MAIN_NET;
  }

  public ProgramDerivedAddress authorityPDA() {
    return ProgramAddresses.findProgramAddress(
        List.of(RaydiumProgram.AUTHORITY_SEED.getBytes(US_ASCII)), program);
  }

  /** {@code token0} and {@code token1} must already be in {@link TokenPair} order. */
  public ProgramDerivedAddress poolStatePDA(
      PublicKey ammConfig, PublicKey token0Mint, PublicKey token1Mint) {
    return ProgramAddresses.findProgramAddress(
        List.of(
            RaydiumProgram.POOL_SEED.getBytes(US_ASCII),
            ammConfig.toByteArray(),
            token0Mint.toByteArray(),
            token1Mint.toByteArray()),
        program);
  }

  public ProgramDerivedAddress lpMintPDA(PublicKey poolState) {
    return ProgramAddresses.findProgramAddress(
        List.of(RaydiumProgram.POOL_LP_MINT_SEED.getBytes(US_ASCII), poolState.toByteArray()),
        program);
  }

  public ProgramDerivedAddress vaultPDA(PublicKey poolState, PublicKey tokenMint) {
    return ProgramAddresses.findProgramAddress(
        List.of(
            RaydiumProgram.POOL_VAULT_SEED.getBytes(US_ASCII),
            poolState.toByteArray(),
            tokenMint.toByteArray()),
        program);
  }

  public ProgramDerivedAddress observationPDA(PublicKey poolState) {
    return ProgramAddresses.findProgramAddress(
        List.of(RaydiumProgram.OBSERVATION_SEED.getBytes(US_ASCII), poolState.toByteArray()),
        program);
  }

  /**
   * Accounts for the pool pairing {@code tokenMint} with the quote mint. Pure derivation; whether
   * the pool exists is not checked.
   */
  public RaydiumMigrationAccounts migrationAccounts(PublicKey tokenMint) {
    final TokenPair pair = TokenPair.order(quoteMint, tokenMint);
    final PublicKey poolState = poolStatePDA(ammConfig, pair.token0(), pair.token1()).publicKey();
    final RaydiumMigrationAccounts accounts =
        new RaydiumMigrationAccounts(
            pair.token0(),
            pair.token1(),
            pair.firstIsToken0(),
            authorityPDA().publicKey(),
            poolState,
            lpMintPDA(poolState).publicKey(),
            vaultPDA(poolState, pair.token0()).publicKey(),
            vaultPDA(poolState, pair.token1()).publicKey(),
            observationPDA(poolState).publicKey(),
            ammConfig,
            createPoolFee);
    log.debug("migrationAccounts mint:{} -> {}", tokenMint, accounts);
    return accounts;
  }
}
