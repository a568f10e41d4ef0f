package com.infound.creatorportal.server.auth;

/**
 * Outcome of decoding an access token: either the verified claims or the reason it was rejected.
 * <p>
 * Malformed, forged and expired tokens are ordinary input for the codec, so they are reported
 * through this type instead of exceptions.
 *
 * @param claims  the verified claims, null when invalid
 * @param failure why the token was rejected, null when valid
 * @param message diagnostic detail for logs, null when valid
 */
public record DecodeResult(TokenClaims claims, Failure failure, String message) {

  /**
   * Why a token failed to decode.
   */
  public enum Failure {
    /** Not a parseable token. */
    MALFORMED,
    /** Signature does not match, or an unexpected algorithm was used. */
    BAD_SIGNATURE,
    /** Signature is fine but {@code exp} has passed. */
    EXPIRED,
    /** {@code sub}, {@code jti} or {@code exp} is absent. */
    MISSING_CLAIMS,
    /** A verified claim has the wrong value, e.g. a foreign issuer. */
    INVALID_CLAIM
  }

  /**
   * Successful decode.
   *
   * @param claims the verified claims
   * @return the result
   */
  public static DecodeResult valid(TokenClaims claims) {
    return new DecodeResult(claims, null, null);
  }

  /**
   * Failed decode.
   *
   * @param failure the reason
   * @param message diagnostic detail
   * @return the result
   */
  public static DecodeResult invalid(Failure failure, String message) {
    return new DecodeResult(null, failure, message);
  }

  public boolean isValid() {
    return failure == null;
  }
}
