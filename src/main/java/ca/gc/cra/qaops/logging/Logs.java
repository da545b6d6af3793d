package ca.gc.cra.qaops.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Log hygiene helpers. Alarm titles and forwarded e-mails can be long; log lines carry a bounded prefix.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget without splitting a code point.
   *
   * @param value text to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes kept; must be positive
   * @return the value itself when short enough, else its prefix followed by {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String suffix = "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + suffix;
    } catch (CharacterCodingException ex) {
      // IGNORE actions make this unreachable in practice; fall back to lossy decoding.
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + suffix;
    }
  }
}
