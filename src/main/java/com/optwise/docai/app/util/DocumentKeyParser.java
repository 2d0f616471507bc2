package com.optwise.docai.app.util;

import com.optwise.docai.app.exception.InvalidDocumentKeyException;
import com.optwise.docai.app.model.DocumentRef;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Derives owner and document ids from an upload key.
 *
 * <p>Uploads are stored as {@code userId/documentId/fileName}; the file name may itself contain
 * slashes.
 */
public final class DocumentKeyParser {

  private DocumentKeyParser() {}

  public static DocumentRef parse(String bucket, String key) {
    return parse(bucket, key, "");
  }

  /**
   * Like {@link #parse(String, String)} for keys stored under a common prefix such as {@code
   * uploads/}; the prefix is ignored when deriving ids but kept in {@link DocumentRef#getKey()}.
   */
  public static DocumentRef parse(String bucket, String key, String prefix) {
    if (key == null) throw new InvalidDocumentKeyException(null);
    String relative =
        prefix != null && !prefix.isEmpty() && key.startsWith(prefix)
            ? key.substring(prefix.length())
            : key;
    String[] parts = relative.split("/", 3);
    if (parts.length < 3 || parts[0].isBlank() || parts[1].isBlank() || parts[2].isBlank()) {
      throw new InvalidDocumentKeyException(key);
    }
    return DocumentRef.builder()
        .bucket(bucket)
        .key(key)
        .userId(parts[0])
        .documentId(parts[1])
        .fileName(parts[2])
        .build();
  }

  /** S3 event notifications carry form-encoded keys ({@code +} for spaces, {@code %2F}...). */
  public static String decodeEventKey(String key) {
    return key == null ? null : URLDecoder.decode(key, StandardCharsets.UTF_8);
  }
}
