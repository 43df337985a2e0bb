package tech.yump.tenancy.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import tech.yump.tenancy.core.TenantConfigurationException;

/**
 * AES-256-GCM encryption of tenant connection secrets at rest.
 *
 * <p>Encrypted secrets are stored as {@code base64(iv):base64(authTag):base64(ciphertext)}
 * with a 16-byte IV and a 16-byte authentication tag.
 */
@Slf4j
public class CredentialCipher {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String AES = "AES";
  static final int KEY_LENGTH_BYTE = 32;
  static final int IV_LENGTH_BYTE = 16;
  static final int TAG_LENGTH_BYTE = 16;
  private static final String SEPARATOR = ":";

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final byte[] masterKey;

  /**
   * @param masterKeyHex the 64-character hex master key from configuration
   * @throws TenantConfigurationException if the key is blank, not hex, or not 32 bytes
   */
  public CredentialCipher(String masterKeyHex) {
    this.masterKey = parseKey(masterKeyHex);
  }

  public String encrypt(String plaintext) {
    return encrypt(plaintext, masterKey);
  }

  public String decrypt(String encoded) {
    return decrypt(encoded, masterKey);
  }

  /**
   * Decodes a hex master key into raw key bytes.
   *
   * @throws TenantConfigurationException if the key is missing or malformed
   */
  public static byte[] parseKey(String hexKey) {
    if (hexKey == null || hexKey.isBlank()) {
      throw new TenantConfigurationException("Master encryption key is not configured.");
    }
    String trimmed = hexKey.trim();
    if (trimmed.length() != KEY_LENGTH_BYTE * 2) {
      throw new TenantConfigurationException(
              "Master encryption key must be " + (KEY_LENGTH_BYTE * 2) + " hex characters, got " + trimmed.length() + ".");
    }
    try {
      return Hex.decode(trimmed);
    } catch (DecoderException e) {
      throw new TenantConfigurationException("Master encryption key is not valid hex.", e);
    }
  }

  /**
   * Encrypts a secret with a fresh random IV, so two calls on the same input never
   * produce the same string.
   *
   * @param plaintext the secret to encrypt. Cannot be null.
   * @param key       the 32-byte AES key
   * @return the encoded {@code iv:authTag:ciphertext} string
   * @throws TenantConfigurationException if the key is not 32 bytes
   */
  public static String encrypt(String plaintext, byte[] key) {
    requireValidKey(key);
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext cannot be null.");
    }

    byte[] iv = new byte[IV_LENGTH_BYTE];
    SECURE_RANDOM.nextBytes(iv);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, AES), new GCMParameterSpec(TAG_LENGTH_BYTE * 8, iv));
      // JCE appends the tag to the ciphertext
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      int ciphertextLength = sealed.length - TAG_LENGTH_BYTE;
      byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ciphertextLength);
      byte[] authTag = Arrays.copyOfRange(sealed, ciphertextLength, sealed.length);
      log.trace("Encrypted secret, ciphertext length: {} bytes.", ciphertext.length);

      Base64.Encoder encoder = Base64.getEncoder();
      return encoder.encodeToString(iv) + SEPARATOR
              + encoder.encodeToString(authTag) + SEPARATOR
              + encoder.encodeToString(ciphertext);
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Failed to encrypt secret.", e);
    }
  }

  /**
   * Decrypts and authenticates an encoded secret.
   *
   * @param encoded the {@code iv:authTag:ciphertext} string
   * @param key     the 32-byte AES key
   * @return the plaintext, only if the authentication tag verifies
   * @throws DecryptionException if the format is invalid or authentication fails
   * @throws TenantConfigurationException if the key is not 32 bytes
   */
  public static String decrypt(String encoded, byte[] key) {
    requireValidKey(key);
    if (encoded == null) {
      throw new DecryptionException("Invalid encrypted secret: value is null.");
    }

    String[] segments = encoded.split(SEPARATOR, -1);
    if (segments.length != 3) {
      throw new DecryptionException(
              "Invalid encrypted secret format: expected 3 segments, got " + segments.length + ".");
    }

    byte[] iv = decodeSegment(segments[0], "iv");
    byte[] authTag = decodeSegment(segments[1], "auth tag");
    byte[] ciphertext = decodeSegment(segments[2], "ciphertext");

    if (iv.length != IV_LENGTH_BYTE) {
      throw new DecryptionException("Invalid IV length: expected " + IV_LENGTH_BYTE + " bytes, got " + iv.length + ".");
    }
    if (authTag.length != TAG_LENGTH_BYTE) {
      throw new DecryptionException(
              "Invalid auth tag length: expected " + TAG_LENGTH_BYTE + " bytes, got " + authTag.length + ".");
    }

    byte[] sealed = new byte[ciphertext.length + authTag.length];
    System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
    System.arraycopy(authTag, 0, sealed, ciphertext.length, authTag.length);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, AES), new GCMParameterSpec(TAG_LENGTH_BYTE * 8, iv));
      byte[] plaintext = cipher.doFinal(sealed);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (AEADBadTagException e) {
      log.error("Decryption failed due to invalid authentication tag (potential tampering or wrong key).");
      throw new DecryptionException("Decryption failed: invalid authentication tag. Secret may be corrupt or tampered with.", e);
    } catch (GeneralSecurityException e) {
      log.error("Decryption failed due to cryptographic error: {}", e.getMessage(), e);
      throw new DecryptionException("Failed to decrypt secret.", e);
    }
  }

  private static byte[] decodeSegment(String segment, String name) {
    try {
      return Base64.getDecoder().decode(segment);
    } catch (IllegalArgumentException e) {
      throw new DecryptionException("Invalid encrypted secret format: " + name + " is not valid base64.", e);
    }
  }

  private static void requireValidKey(byte[] key) {
    if (key == null || key.length != KEY_LENGTH_BYTE) {
      throw new TenantConfigurationException(
              "Encryption key must be exactly " + KEY_LENGTH_BYTE + " bytes for AES-256.");
    }
  }
}
