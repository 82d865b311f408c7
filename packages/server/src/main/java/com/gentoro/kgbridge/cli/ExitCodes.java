package com.gentoro.kgbridge.cli;

/** Process exit codes of the command line. */
public final class ExitCodes {
  private ExitCodes() {}

  public static final int OK = 0;

  /** Store unreachable, credentials rejected, or store misconfigured. */
  public static final int STORE_UNAVAILABLE = 1;

  /** Malformed export, inconsistent tensor shapes, or invalid arguments. */
  public static final int INVALID_INPUT = 2;
}
