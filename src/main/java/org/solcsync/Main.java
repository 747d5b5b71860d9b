/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync;

import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.conf.Configuration;
import org.solcsync.conf.ConfigurationException;
import org.solcsync.conf.Key;
import org.solcsync.downloader.Downloader;
import org.solcsync.source.ListingUnavailableException;
import org.solcsync.source.VersionSource;
import org.solcsync.source.VersionSources;
import org.solcsync.store.ExistenceChecker;
import org.solcsync.store.ObjectStore;
import org.solcsync.store.ObjectStores;
import org.solcsync.sync.ShutdownHook;
import org.solcsync.sync.SummaryWriter;
import org.solcsync.sync.SyncManager;
import org.solcsync.sync.SyncSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

/**
 * Main class for synchronizing solc compiler binaries to the destination
 * store.
 * <br>
 * Run with {@code --help} in order to read the usage information, i.e.
 * <br>
 * <code>java -jar solc-sync.jar --help</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  /** Every artifact was uploaded or already present. */
  public static final int EXIT_SUCCESS = 0;

  /** At least one artifact failed. */
  public static final int EXIT_TRANSFER_FAILED = 1;

  /** Nothing was transferred because of a configuration or listing error. */
  public static final int EXIT_FATAL = 2;

  private static final String USAGE = "Usage:\njava -jar solc-sync.jar "
      + "[path/to/" + Configuration.DEFAULTS + "] [--limit N] [--workers N] "
      + "[--bucket NAME] [--local-dir PATH]";

  /**
   * At most one configuration file argument, plus option flags.
   * See class description {@link Main}.
   */
  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Run a complete synchronization and return the process exit status.
   */
  static int run(String[] args) {
    Configuration conf;
    try {
      conf = Configuration.withDefaults();
      Path confPath = parseArguments(args, conf);
      if (null != confPath) {
        if (!Files.exists(confPath) || confPath.toFile().length() < 1L) {
          writeDefaultConfig(confPath);
          return EXIT_FATAL;
        }
        Configuration fileConf = Configuration.withDefaults();
        fileConf.loadConfiguration(confPath);
        /* Flags take precedence over the configuration file. */
        parseArguments(args, fileConf);
        conf = fileConf;
      }
      conf.check();
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return EXIT_FATAL;
    }
    try {
      return sync(conf);
    } catch (ConfigurationException ce) {
      log.error("Invalid configuration: {}", ce.getMessage(), ce);
      return EXIT_FATAL;
    }
  }

  private static int sync(Configuration conf) throws ConfigurationException {
    Downloader downloader = Downloader.fromConfiguration(conf);
    VersionSource source = VersionSources.fromConfiguration(conf, downloader);
    try (ObjectStore store = ObjectStores.fromConfiguration(conf)) {
      Instant started = Instant.now();
      List<CompilerArtifact> artifacts;
      try {
        artifacts = source.listArtifacts();
      } catch (ListingUnavailableException e) {
        log.error("Sync failed, no artifacts could be listed: {}",
            e.getMessage(), e);
        return EXIT_FATAL;
      }
      if (artifacts.isEmpty()) {
        log.warn("No compiler artifacts found in {}.", source.describe());
      }
      SyncManager syncManager = new SyncManager(store,
          new ExistenceChecker(store, conf.getBool(Key.RequireHashFile)),
          downloader, conf.getString(Key.BinaryName),
          conf.getInt(Key.Workers));
      Runtime.getRuntime().addShutdownHook(new ShutdownHook(syncManager,
          conf.getLong(Key.ShutdownGraceWaitMinutes)));
      SyncSummary summary = syncManager.sync(artifacts);
      if (conf.has(Key.SummaryPath)) {
        try {
          new SummaryWriter().write(conf.getPath(Key.SummaryPath), summary,
              source.describe(), store.describe(), started, Instant.now());
        } catch (IOException e) {
          log.warn("Cannot write run summary to {}.",
              conf.getProperty(Key.SummaryPath.name()), e);
        }
      }
      return summary.isSuccess() ? EXIT_SUCCESS : EXIT_TRANSFER_FAILED;
    }
  }

  /**
   * Apply option flags to the given configuration and return the
   * configuration file argument, if any.
   *
   * @param args Command-line arguments.
   * @param conf Configuration to update.
   * @return Path of the configuration file, or {@code null} if none is given.
   * @throws ConfigurationException Thrown if the arguments are invalid or help
   *     was requested.
   */
  static Path parseArguments(String[] args, Configuration conf)
      throws ConfigurationException {
    Path confPath = null;
    if (null == args) {
      return null;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      Key key;
      switch (arg) {
        case "-h":
        case "--help":
          throw new ConfigurationException("Synchronizes solc compiler "
              + "binaries to the configured destination store.");
        case "--limit":
          key = Key.Limit;
          break;
        case "--workers":
          key = Key.Workers;
          break;
        case "--bucket":
          key = Key.Bucket;
          break;
        case "--local-dir":
          key = Key.LocalDir;
          break;
        default:
          if (arg.startsWith("-")) {
            throw new ConfigurationException("Unknown option " + arg + ".");
          }
          if (null != confPath) {
            throw new ConfigurationException("solc-sync takes at most one "
                + "configuration file argument.");
          }
          confPath = Paths.get(arg);
          continue;
      }
      if (i + 1 >= args.length) {
        throw new ConfigurationException("Option " + arg
            + " requires a value.");
      }
      conf.setProperty(key.name(), args[++i]);
    }
    return confPath;
  }

  private static void printUsage(String msg) {
    System.out.println(msg + "\n" + USAGE);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream defaults = Main.class.getClassLoader()
        .getResourceAsStream(Configuration.DEFAULTS)) {
      Files.copy(defaults, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. Wrote the default "
          + "configuration to " + confPath + ". Review the destination "
          + "settings and run again.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
