package com.gentoro.opregistry.exception;

/** The manifest payload does not have the expected shape. The cache is left untouched. */
public class ManifestFormatException extends OperationRegistryException {
  public ManifestFormatException(String message) {
    super(RegistryErrorCode.INVALID_MANIFEST, message);
  }

  public ManifestFormatException(String message, Throwable cause) {
    super(RegistryErrorCode.INVALID_MANIFEST, message, cause);
  }
}
