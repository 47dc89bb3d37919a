package com.example.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Key shared with the web API for decrypting stored personal access tokens. */
@ConfigurationProperties(prefix = "security")
@Validated
public record EncryptionProperties(@NotBlank String encryptionKey) {

  @Override
  public String toString() {
    return "EncryptionProperties[encryptionKey=***]";
  }
}
