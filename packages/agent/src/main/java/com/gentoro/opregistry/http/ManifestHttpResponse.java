package com.gentoro.opregistry.http;

/**
 * Fully read manifest response.
 *
 * @param status HTTP status code
 * @param contentType raw {@code Content-Type} header, or {@code null}
 * @param etag raw {@code ETag} header, or {@code null}
 * @param body response body, empty when there was none
 */
public record ManifestHttpResponse(int status, String contentType, String etag, String body) {
  public static final int NOT_MODIFIED = 304;

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }

  public boolean isNotModified() {
    return status == NOT_MODIFIED;
  }
}
