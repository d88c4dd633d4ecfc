package market.torch.sdk.client;

import market.torch.sdk.accounts.PublicKey;

public interface TorchProgram {

  /** Same id on mainnet and devnet. */
  PublicKey TORCH = PublicKey.fromBase58Encoded("8hbUkonssSEEtkqzwM7ZcZrD9evacM92TcWSooVF4BeT");

  // Seed tags; each one must match the program byte for byte.
  String GLOBAL_CONFIG_SEED = "global_config";
  String BONDING_CURVE_SEED = "bonding_curve";
  String TREASURY_SEED = "treasury";
  String USER_POSITION_SEED = "user_position";
  String VOTE_SEED = "vote";
  String PROTOCOL_TREASURY_SEED = "protocol_treasury_v11";
  String USER_STATS_SEED = "user_stats";
  String STAR_RECORD_SEED = "star_record";
  String LOAN_SEED = "loan";
  String COLLATERAL_VAULT_SEED = "collateral_vault";
  String TORCH_VAULT_SEED = "torch_vault";
  String VAULT_WALLET_LINK_SEED = "vault_wallet";
}
