package com.gentoro.opregistry.agent;

/** Whether a manifest check is currently running. */
public enum CheckState {
  IDLE,
  CHECKING
}
