package com.example.resilientsecrets.core.model;

/**
 * Lifecycle state of a version.
 *
 * <p>Legal transitions are {@code ENABLED <-> DISABLED} and {@code ENABLED|DISABLED -> DESTROYED}.
 * {@link #DESTROYED} is terminal.
 */
public enum VersionState {
  ENABLED,
  DISABLED,
  DESTROYED;

  /**
   * Whether moving from this state to {@code target} is a legal transition. Same-state transitions
   * are not legal.
   *
   * @param target requested state
   * @return true if the transition is allowed
   */
  public boolean canTransitionTo(final VersionState target) {
    return switch (this) {
      case ENABLED -> target == DISABLED || target == DESTROYED;
      case DISABLED -> target == ENABLED || target == DESTROYED;
      case DESTROYED -> false;
    };
  }
}
