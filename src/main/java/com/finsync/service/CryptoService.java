package com.finsync.service;

import com.finsync.config.CryptoProperties;
import com.finsync.exception.CredentialException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Service;

/**
 * Credential vault for stored aggregator credentials. Ciphertext format is
 * {@code base64(iv):base64(ciphertext+tag)} under AES/GCM.
 */
@Service
public class CryptoService {
  private static final int GCM_TAG_LENGTH = 128;
  private static final int IV_LENGTH = 12;

  private final SecretKey key;
  private final SecureRandom secureRandom = new SecureRandom();

  public CryptoService(CryptoProperties properties) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("finsync.crypto.secret is required");
    }
    byte[] keyBytes = Base64.getDecoder().decode(properties.secret().trim());
    if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
      throw new IllegalStateException("finsync.crypto.secret must decode to a 128, 192 or 256 bit key");
    }
    this.key = new SecretKeySpec(keyBytes, "AES");
  }

  public String encrypt(String plaintext) {
    if (plaintext == null) {
      throw new CredentialException("Cannot encrypt an empty credential", null);
    }
    try {
      byte[] iv = new byte[IV_LENGTH];
      secureRandom.nextBytes(iv);
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(encrypted);
    } catch (GeneralSecurityException ex) {
      throw new CredentialException("Failed to encrypt credential", ex);
    }
  }

  public String decrypt(String ciphertext) {
    if (ciphertext == null || ciphertext.isBlank()) {
      throw new CredentialException("Failed to decrypt access token: no stored credential", null);
    }
    String[] parts = ciphertext.split(":", 2);
    if (parts.length != 2) {
      throw new CredentialException("Failed to decrypt access token: malformed ciphertext", null);
    }
    try {
      byte[] iv = Base64.getDecoder().decode(parts[0]);
      byte[] encrypted = Base64.getDecoder().decode(parts[1]);
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] decrypted = cipher.doFinal(encrypted);
      return new String(decrypted, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new CredentialException("Failed to decrypt access token: " + ex.getClass().getSimpleName(), ex);
    }
  }
}
