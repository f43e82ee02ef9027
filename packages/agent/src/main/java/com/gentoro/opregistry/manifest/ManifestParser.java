package com.gentoro.opregistry.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.opregistry.exception.ManifestFormatException;
import com.gentoro.opregistry.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a manifest JSON body into an {@link OperationManifest}.
 *
 * <p>The body is read as a tree first so that a wrong shape (for instance {@code operations} being
 * an object) surfaces as {@link ManifestFormatException} rather than a Jackson binding error.
 */
public class ManifestParser {
  private final ObjectMapper mapper;

  public ManifestParser() {
    this(JacksonUtility.getJsonMapper());
  }

  public ManifestParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public OperationManifest parse(String body) {
    JsonNode root;
    try {
      root = mapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      throw new ManifestFormatException("Invalid manifest format.", e);
    }
    if (root == null || !root.isObject()) {
      throw new ManifestFormatException("Invalid manifest format.");
    }

    JsonNode version = root.get("version");
    JsonNode operations = root.get("operations");
    if (version == null
        || !version.isIntegralNumber()
        || !version.canConvertToInt()
        || version.intValue() != OperationManifest.SUPPORTED_VERSION
        || operations == null
        || !operations.isArray()) {
      throw new ManifestFormatException("Invalid manifest format.");
    }

    List<ManifestEntry> entries = new ArrayList<>(operations.size());
    for (JsonNode op : operations) {
      if (!op.isObject()) {
        throw new ManifestFormatException("Invalid manifest format.");
      }
      entries.add(new ManifestEntry(text(op, "signature"), text(op, "document")));
    }
    return new OperationManifest(version.intValue(), entries);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isTextual() ? null : value.asText();
  }
}
