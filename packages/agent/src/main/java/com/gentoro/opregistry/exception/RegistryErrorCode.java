package com.gentoro.opregistry.exception;

/**
 * Stable error codes for the operation registry. Codes are suitable for logs and the actuator
 * status payload; choose the one closest to where the failure originated.
 */
public enum RegistryErrorCode {
  UNKNOWN,
  FAILED_PRECONDITION,
  CONFIGURATION_ERROR,
  NETWORK_ERROR,
  INVALID_MANIFEST,
}
