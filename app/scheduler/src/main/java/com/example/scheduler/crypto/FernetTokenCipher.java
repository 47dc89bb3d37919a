/*
 * Where: scheduler crypto
 * What: Fernet (AES-128-CBC + HMAC-SHA256, url-safe base64) encryption of personal access tokens
 * Why: tokens are written by the web API with a Fernet key and must be readable here with the same key
 */
package com.example.scheduler.crypto;

import com.example.scheduler.config.EncryptionProperties;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class FernetTokenCipher implements TokenCipher {

  private static final byte VERSION = (byte) 0x80;
  private static final int KEY_BYTES = 32;
  private static final int HALF_KEY_BYTES = 16;
  private static final int TIMESTAMP_BYTES = 8;
  private static final int IV_BYTES = 16;
  private static final int HMAC_BYTES = 32;
  private static final int BLOCK_BYTES = 16;
  private static final int HEADER_BYTES = 1 + TIMESTAMP_BYTES + IV_BYTES;
  private static final SecureRandom RNG = new SecureRandom();

  private final SecretKeySpec signingKey;
  private final SecretKeySpec encryptionKey;
  private final Clock clock;

  public FernetTokenCipher(EncryptionProperties properties, Clock clock) {
    final byte[] key = decodeKey(properties.encryptionKey());
    this.signingKey = new SecretKeySpec(Arrays.copyOfRange(key, 0, HALF_KEY_BYTES), "HmacSHA256");
    this.encryptionKey =
        new SecretKeySpec(Arrays.copyOfRange(key, HALF_KEY_BYTES, KEY_BYTES), "AES");
    this.clock = clock;
  }

  @Override
  public String encrypt(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext is required");
    }
    final byte[] iv = new byte[IV_BYTES];
    RNG.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      final ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + ciphertext.length + HMAC_BYTES);
      buffer.put(VERSION).putLong(clock.instant().getEpochSecond()).put(iv).put(ciphertext);
      buffer.put(sign(buffer.array(), buffer.position()));
      return Base64.getUrlEncoder().encodeToString(buffer.array());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("token encryption failed", ex);
    }
  }

  @Override
  public String decrypt(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenDecryptionException("token is empty");
    }
    final byte[] data;
    try {
      data = Base64.getUrlDecoder().decode(token.trim());
    } catch (IllegalArgumentException ex) {
      throw new TokenDecryptionException("token is not url-safe base64", ex);
    }
    if (data.length < HEADER_BYTES + BLOCK_BYTES + HMAC_BYTES || data[0] != VERSION) {
      throw new TokenDecryptionException("token format is invalid");
    }
    final int macOffset = data.length - HMAC_BYTES;
    if ((macOffset - HEADER_BYTES) % BLOCK_BYTES != 0) {
      throw new TokenDecryptionException("token ciphertext length is invalid");
    }
    try {
      final byte[] expected = sign(data, macOffset);
      final byte[] actual = Arrays.copyOfRange(data, macOffset, data.length);
      if (!MessageDigest.isEqual(expected, actual)) {
        throw new TokenDecryptionException("token signature does not match");
      }
      final Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(
          Cipher.DECRYPT_MODE,
          encryptionKey,
          new IvParameterSpec(data, 1 + TIMESTAMP_BYTES, IV_BYTES));
      final byte[] plaintext = cipher.doFinal(data, HEADER_BYTES, macOffset - HEADER_BYTES);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException ex) {
      throw new TokenDecryptionException("token decryption failed", ex);
    }
  }

  private byte[] sign(byte[] data, int length) throws GeneralSecurityException {
    final Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(signingKey);
    mac.update(data, 0, length);
    return mac.doFinal();
  }

  private static byte[] decodeKey(String encodedKey) {
    final byte[] key;
    try {
      key = Base64.getUrlDecoder().decode(encodedKey.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("security.encryption-key is not url-safe base64", ex);
    }
    if (key.length != KEY_BYTES) {
      throw new IllegalStateException(
          "security.encryption-key must decode to 32 bytes but was " + key.length);
    }
    return key;
  }
}
