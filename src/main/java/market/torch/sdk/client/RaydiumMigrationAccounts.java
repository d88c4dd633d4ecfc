package market.torch.sdk.client;

import market.torch.sdk.accounts.PublicKey;

/** Every CPMM account a migration touches, for one token paired with the quote mint. */
public record RaydiumMigrationAccounts(
    PublicKey token0,
    PublicKey token1,
    boolean isQuoteToken0,
    PublicKey authority,
    PublicKey poolState,
    PublicKey lpMint,
    PublicKey token0Vault,
    PublicKey token1Vault,
    PublicKey observationState,
    PublicKey ammConfig,
    PublicKey createPoolFee) {}
