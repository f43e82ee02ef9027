package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.exception.ConfigException;
import com.gentoro.opregistry.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import okhttp3.HttpUrl;

/**
 * Where the manifest of a service/schema pair is published:
 * {@code <base>/<sha512-hex(serviceId)>/<schemaHash>}.
 */
public final class ManifestLocation {
  private ManifestLocation() {}

  public static String hashServiceId(String serviceId) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-512");
      return HexFormat.of().formatHex(digest.digest(serviceId.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-512 is not available in this JVM", e);
    }
  }

  public static String manifestUrl(String baseUrl, String hashedServiceId, String schemaHash) {
    HttpUrl base = HttpUrl.parse(baseUrl);
    if (base == null) {
      throw new ConfigException("Invalid manifest base URL: " + baseUrl);
    }
    HttpUrl.Builder url = base.newBuilder();
    // drop the empty segment left by a trailing slash
    if (base.pathSegments().size() > 0
        && base.pathSegments().get(base.pathSegments().size() - 1).isEmpty()) {
      url.removePathSegment(base.pathSegments().size() - 1);
    }
    return url.addPathSegment(hashedServiceId).addPathSegment(schemaHash).build().toString();
  }
}
