package market.torch.sdk.accounts;

public interface SolanaAccounts {

  PublicKey SYSTEM_PROGRAM = PublicKey.fromBase58Encoded("11111111111111111111111111111111");

  PublicKey TOKEN_PROGRAM =
      PublicKey.fromBase58Encoded("TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA");

  PublicKey TOKEN_2022_PROGRAM =
      PublicKey.fromBase58Encoded("TokenzQdBNbLqP5VEhdkAS6EPFLC1PHnBqCXEpPxuEb");

  PublicKey ASSOCIATED_TOKEN_ACCOUNT_PROGRAM =
      PublicKey.fromBase58Encoded("ATokenGPvbdGVxr1b2hvZbsiqW5xWH25efTNsLJA8knL");

  PublicKey MEMO_PROGRAM =
      PublicKey.fromBase58Encoded("MemoSq4gqABAXKb96qnH8TysNcWxMyWCqXgDLGmfcHr");

  /** Wrapped SOL, identical on every cluster. */
  PublicKey WRAPPED_SOL_MINT =
      PublicKey.fromBase58Encoded("So11111111111111111111111111111111111111112");
}
