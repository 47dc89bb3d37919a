package com.example.scheduler.crypto;

/** Symmetric encryption for GitHub personal access tokens stored in notification_schedules. */
public interface TokenCipher {

  String encrypt(String plaintext);

  /**
   * @throws TokenDecryptionException if the token is malformed, signed with another key or
   *     otherwise cannot be decrypted
   */
  String decrypt(String token);
}
