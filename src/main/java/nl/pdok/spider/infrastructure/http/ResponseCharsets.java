package nl.pdok.spider.infrastructure.http;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes response bodies with the charset the server or the document declares.
 *
 * <p>Order: the {@code charset} parameter of {@code Content-Type}, a byte order mark, the {@code encoding} of an
 * XML declaration, then UTF-8. Unknown charset names fall through to the next source.</p>
 */
final class ResponseCharsets {
  private static final Pattern CONTENT_TYPE_CHARSET =
      Pattern.compile(";\\s*charset\\s*=\\s*\"?([^\";\\s]+)\"?", Pattern.CASE_INSENSITIVE);
  private static final Pattern XML_DECLARATION_ENCODING =
      Pattern.compile("^<\\?xml[^>]*?\\sencoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']");
  private static final int DECLARATION_BYTES = 200;

  private ResponseCharsets() {
    // Utility
  }

  static String decode(byte[] body, Optional<String> contentType) {
    if (body == null || body.length == 0) {
      return "";
    }
    Optional<Charset> declared = contentType.flatMap(ResponseCharsets::fromContentType);
    if (declared.isPresent()) {
      return new String(body, declared.get());
    }
    if (startsWith(body, 0xEF, 0xBB, 0xBF)) {
      return new String(body, 3, body.length - 3, StandardCharsets.UTF_8);
    }
    if (startsWith(body, 0xFE, 0xFF)) {
      return new String(body, 2, body.length - 2, StandardCharsets.UTF_16BE);
    }
    if (startsWith(body, 0xFF, 0xFE)) {
      return new String(body, 2, body.length - 2, StandardCharsets.UTF_16LE);
    }
    Charset charset = fromXmlDeclaration(body).orElse(StandardCharsets.UTF_8);
    return new String(body, charset);
  }

  static Optional<Charset> fromContentType(String contentType) {
    Matcher matcher = CONTENT_TYPE_CHARSET.matcher(contentType);
    return matcher.find() ? lookup(matcher.group(1)) : Optional.empty();
  }

  static Optional<Charset> fromXmlDeclaration(byte[] body) {
    // The declaration itself is ASCII in every encoding it may name.
    String head = new String(body, 0, Math.min(body.length, DECLARATION_BYTES), StandardCharsets.US_ASCII);
    Matcher matcher = XML_DECLARATION_ENCODING.matcher(head);
    return matcher.find() ? lookup(matcher.group(1)) : Optional.empty();
  }

  private static Optional<Charset> lookup(String name) {
    try {
      return Optional.of(Charset.forName(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      return Optional.empty();
    }
  }

  private static boolean startsWith(byte[] body, int... prefix) {
    if (body.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if ((body[i] & 0xFF) != prefix[i]) {
        return false;
      }
    }
    return true;
  }
}
