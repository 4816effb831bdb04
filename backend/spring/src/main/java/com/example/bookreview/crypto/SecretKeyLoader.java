package com.example.bookreview.crypto;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

public class SecretKeyLoader {
  public static final String ALGORITHM = "HmacSHA256";
  private static final int MIN_BYTES = 32;

  private SecretKeyLoader() {}

  /** HS256 needs a key of at least 256 bits. */
  public static SecretKey fromSecret(String secret) {
    if (secret == null) {
      throw new IllegalStateException("auth.jwt-secret is not set");
    }
    byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < MIN_BYTES) {
      throw new IllegalStateException("auth.jwt-secret must be at least " + MIN_BYTES + " bytes, got " + bytes.length);
    }
    return new SecretKeySpec(bytes, ALGORITHM);
  }
}
