/*
 * どこで: MessageQueue データアクセス
 * 何を: ペイロード文字列と BYTEA 列の相互変換を行う
 * なぜ: NUL 文字を含む文字列も欠落なく保存するため
 */
package com.example.messagequeue.repository;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 codec for the payload column. Any well-formed string round-trips, including {@code \0}.
 * Strings holding an unpaired surrogate have no UTF-8 form and are rejected.
 */
public final class PayloadCodec {

  private PayloadCodec() {}

  /**
   * @return UTF-8 bytes, or {@code null} for a {@code null} payload
   * @throws IllegalArgumentException when the payload contains an unpaired surrogate
   */
  public static byte[] encode(String payload) {
    if (payload == null) {
      return null;
    }
    final CharsetEncoder encoder =
        StandardCharsets.UTF_8
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      final ByteBuffer buffer = encoder.encode(CharBuffer.wrap(payload));
      final byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    } catch (CharacterCodingException ex) {
      throw new IllegalArgumentException("payload is not valid UTF-16 text", ex);
    }
  }

  public static String decode(byte[] bytes) {
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }
}
