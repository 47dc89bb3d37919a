package com.example.scheduler.crypto;

public class TokenDecryptionException extends RuntimeException {

  public TokenDecryptionException(String message) {
    super(message);
  }

  public TokenDecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
