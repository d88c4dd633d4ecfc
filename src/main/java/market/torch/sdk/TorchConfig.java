package market.torch.sdk;

import lombok.extern.slf4j.Slf4j;
import market.torch.sdk.accounts.PublicKey;
import market.torch.sdk.accounts.SolanaAccounts;
import market.torch.sdk.client.RaydiumProgram;
import market.torch.sdk.client.TorchProgram;

/**
 * The externally fixed addresses the SDK derives against.
 *
 * @param programId the Torch Market program
 * @param cpmmProgram the Raydium CPMM program owning the pool accounts
 * @param ammConfig CPMM fee tier config, supplied verbatim
 * @param createPoolFee CPMM pool-creation fee receiver, supplied verbatim
 * @param quoteMint the mint every migrated pool pairs against
 */
@Slf4j
public record TorchConfig(
    PublicKey programId,
    PublicKey cpmmProgram,
    PublicKey ammConfig,
    PublicKey createPoolFee,
    PublicKey quoteMint) {

  public static final String PROGRAM_ID_PROPERTY = "torch.programId";
  public static final String CPMM_PROGRAM_PROPERTY = "torch.raydium.cpmmProgram";
  public static final String AMM_CONFIG_PROPERTY = "torch.raydium.ammConfig";
  public static final String CREATE_POOL_FEE_PROPERTY = "torch.raydium.createPoolFee";

  public static final TorchConfig MAIN_NET =
      new TorchConfig(
          TorchProgram.TORCH,
          RaydiumProgram.CPMM,
          RaydiumProgram.AMM_CONFIG,
          RaydiumProgram.CREATE_POOL_FEE,
          SolanaAccounts.WRAPPED_SOL_MINT);

  /** {@link #MAIN_NET}, with any address overridden by its JVM system property. */
  public static TorchConfig fromSystemProperties() {
    final TorchConfig config =
        new TorchConfig(
            property(PROGRAM_ID_PROPERTY, MAIN_NET.programId),
            property(CPMM_PROGRAM_PROPERTY, MAIN_NET.cpmmProgram),
            property(AMM_CONFIG_PROPERTY, MAIN_NET.ammConfig),
            property(CREATE_POOL_FEE_PROPERTY, MAIN_NET.createPoolFee),
            MAIN_NET.quoteMint);
    log.debug("TorchConfig:{}", config);
    return config;
  }

  private static PublicKey property(String name, PublicKey fallback) {
    final String value = System.getProperty(name);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    log.info("{} overridden: {}", name, value);
    return PublicKey.fromBase58Encoded(value.trim());
  }
}
