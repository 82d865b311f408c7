package com.gentoro.kgbridge;

import com.gentoro.kgbridge.cli.CliText;
import com.gentoro.kgbridge.cli.ExitCodes;
import com.gentoro.kgbridge.cli.HeteroGraphCommand;
import com.gentoro.kgbridge.cli.ImportCommand;
import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.exception.StoreConnectionException;
import com.gentoro.kgbridge.importer.GraphImportService;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.utility.StdoutUtility;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

public class KgBridgeApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(KgBridgeApp.class);

  private final PrintStream out;
  private final Function<StartupParameters, KgBridge> contextFactory;

  public KgBridgeApp(PrintStream out) {
    this(out, KgBridge::new);
  }

  KgBridgeApp(PrintStream out, Function<StartupParameters, KgBridge> contextFactory) {
    this.out = out;
    this.contextFactory = contextFactory;
  }

  public static void main(String[] args) {
    int code;
    try {
      code = new KgBridgeApp(System.out).run(args);
    } catch (Exception e) {
      log.error("Application failed", e);
      code = ExitCodes.STORE_UNAVAILABLE;
    }
    if (code != ExitCodes.OK) {
      System.exit(code);
    }
  }

  /** Dispatch on the startup parameters and return the process exit code. */
  public int run(String[] args) {
    StartupParameters params;
    try {
      params = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      StdoutUtility.printError(out, e.getMessage(), null);
      out.println(CliText.USAGE);
      return ExitCodes.INVALID_INPUT;
    }

    if (params.isFlagSet("guide")) {
      out.println(CliText.guide());
      return ExitCodes.OK;
    }
    if (params.isFlagSet("queries")) {
      out.println(CliText.sampleQueries());
      return ExitCodes.OK;
    }
    if ("help".equals(params.mode())) {
      out.println(CliText.USAGE);
      return ExitCodes.OK;
    }

    KgBridge kgBridge = contextFactory.apply(params);
    try {
      kgBridge.initialize();
      switch (params.mode()) {
        case "server":
          return serve(kgBridge);
        case "hetero":
          return withExportFile(params)
              .map(f -> new HeteroGraphCommand(out).run(f))
              .orElse(ExitCodes.OK);
        default:
          return withExportFile(params)
              .map(
                  f ->
                      new ImportCommand(kgBridge, out)
                          .run(
                              f,
                              new GraphImportService.Options(
                                  params.isFlagSet("clear"), params.isFlagSet("use-script"))))
              .orElse(ExitCodes.OK);
      }
    } finally {
      kgBridge.shutdown();
    }
  }

  /** The export file, or usage plus an error line when none was given. */
  private Optional<Path> withExportFile(StartupParameters params) {
    Optional<String> file = params.exportFile();
    if (file.isEmpty()) {
      out.println(CliText.USAGE);
      out.println();
      StdoutUtility.printError(out, "Please provide an export file to load", null);
      out.println("   Run with --guide for setup instructions");
    }
    return file.map(Path::of);
  }

  private int serve(KgBridge kgBridge) {
    try {
      kgBridge.graphStore();
    } catch (StoreConnectionException | ConfigException e) {
      StdoutUtility.printError(out, "Failed to connect to the graph store: " + e.getMessage(), null);
      out.println();
      out.println(CliText.TROUBLESHOOTING);
      return ExitCodes.STORE_UNAVAILABLE;
    }
    kgBridge.startServer();
    log.info("Graph tool server running; press Ctrl+C to stop");
    kgBridge.waitShutdownSignal();
    return ExitCodes.OK;
  }
}
