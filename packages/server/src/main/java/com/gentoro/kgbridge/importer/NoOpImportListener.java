package com.gentoro.kgbridge.importer;

/** Listener used when nobody watches the import (tests, server-side callers). */
public class NoOpImportListener implements ImportListener {
  @Override
  public void beginPhase(String phase, long total) {}

  @Override
  public void entityWritten(String phase, String description) {}

  @Override
  public void entityFailed(String phase, EntityFailure failure) {}

  @Override
  public void endPhase(String phase, long succeeded, long attempted) {}
}
