package hookrelay.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * HMAC-SHA256 signing of webhook bodies, and generation of signing secrets.
 *
 * <p>Signatures have the form {@code sha256=<lowercase hex>} and are computed over
 * the exact body bytes sent on the wire. Receivers recompute the same value with
 * their copy of the secret.
 */
public final class WebhookSignatures {
  public static final String PREFIX = "sha256=";
  public static final String SECRET_PREFIX = "whsec_";

  private static final String ALGORITHM = "HmacSHA256";
  private static final int SECRET_BYTES = 32;
  private static final HexFormat HEX = HexFormat.of();
  private static final SecureRandom RANDOM = new SecureRandom();

  private WebhookSignatures() {}

  /**
   * Signs a body.
   *
   * @param payload body bytes
   * @param secret  the webhook's signing secret
   * @return {@code sha256=} followed by 64 hex characters
   */
  public static String sign(byte[] payload, String secret) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    return PREFIX + HEX.formatHex(hmac(payload, secret));
  }

  public static String sign(String payload, String secret) {
    Objects.requireNonNull(payload, "payload");
    return sign(payload.getBytes(StandardCharsets.UTF_8), secret);
  }

  /**
   * Checks a signature in constant time.
   *
   * @param payload   body bytes as received
   * @param secret    the signing secret
   * @param signature the received header value; {@code null} never verifies
   * @return {@code true} if the signature matches
   */
  public static boolean verify(byte[] payload, String secret, String signature) {
    if (payload == null || secret == null || signature == null) {
      return false;
    }
    byte[] expected = sign(payload, secret).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = signature.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, actual);
  }

  public static boolean verify(String payload, String secret, String signature) {
    if (payload == null) {
      return false;
    }
    return verify(payload.getBytes(StandardCharsets.UTF_8), secret, signature);
  }

  /**
   * Generates a new secret: {@code whsec_} followed by 32 random bytes in hex.
   *
   * @return a 70-character secret
   */
  public static String generateSecret() {
    byte[] bytes = new byte[SECRET_BYTES];
    RANDOM.nextBytes(bytes);
    return SECRET_PREFIX + HEX.formatHex(bytes);
  }

  private static byte[] hmac(byte[] payload, String secret) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(payload);
    } catch (GeneralSecurityException e) {
      // HmacSHA256 is mandatory on every JRE
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
