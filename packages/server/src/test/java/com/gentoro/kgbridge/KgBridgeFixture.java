package com.gentoro.kgbridge;

import com.gentoro.kgbridge.store.GraphStore;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;

/** Context backed by an in-memory configuration and, by default, the in-memory store. */
public class KgBridgeFixture extends KgBridge {
  private final Configuration cfg;
  private GraphStore lastStore;

  public KgBridgeFixture(String... args) {
    this(Map.of(), args);
  }

  public KgBridgeFixture(Map<String, ?> settings, String... args) {
    this(new StartupParameters(args), settings);
  }

  public KgBridgeFixture(StartupParameters parameters, Map<String, ?> settings) {
    super(parameters);
    this.cfg = new BaseConfiguration();
    cfg.setProperty("graph.store.driver", "in-memory");
    cfg.setProperty("import.identity.property", "_export_id");
    cfg.setProperty("import.properties.coerce-objects", true);
    settings.forEach(cfg::setProperty);
  }

  @Override
  public Configuration configuration() {
    return cfg;
  }

  @Override
  protected void configure(Map<String, ?> overrides) {
    overrides.forEach(cfg::setProperty);
  }

  @Override
  public GraphStore graphStore() {
    lastStore = super.graphStore();
    return lastStore;
  }

  /** The store handed out last, still readable after {@link #shutdown()}. */
  public GraphStore lastStore() {
    return lastStore;
  }
}
