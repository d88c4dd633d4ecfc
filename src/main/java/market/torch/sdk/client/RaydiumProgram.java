package market.torch.sdk.client;

import market.torch.sdk.accounts.PublicKey;

/** Raydium CPMM, the pool a completed curve migrates into. Addresses match on every cluster. */
public interface RaydiumProgram {

  PublicKey CPMM = PublicKey.fromBase58Encoded("CPMMoo8L3F4NbTegBCKVNunggL7H1ZpdTHKxQB5qKP1C");

  /** 0.25% fee tier. */
  PublicKey AMM_CONFIG =
      PublicKey.fromBase58Encoded("D4FPEruKEHrG5TenZ2mpDGEfu1iUvTiqBxvpU8HLBvC2");

  PublicKey CREATE_POOL_FEE =
      PublicKey.fromBase58Encoded("DNXgeM9EiiaAbaWvwjHj9fQQLAX5ZsfHyvmYUNRAdNC8");

  String AUTHORITY_SEED = "vault_and_lp_mint_auth_seed";
  String POOL_SEED = "pool";
  String POOL_LP_MINT_SEED = "pool_lp_mint";
  String POOL_VAULT_SEED = "pool_vault";
  String OBSERVATION_SEED = "observation";
}
