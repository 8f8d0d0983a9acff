package rootwatch;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.Manifest;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;

import rootwatch.Rootwatch.RunCommand;
import rootwatch.Rootwatch.VersionCommand;

@Cli(name = "rootwatch", description = "watches directories and reaps the ones nobody is using", commands = {
  RunCommand.class,
  VersionCommand.class }, defaultCommand = Help.class)
public class Rootwatch {

  private static final Logger log = LoggerFactory.getLogger(Rootwatch.class);

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(Rootwatch.class);
    cli.parse(args).run();
  }

  @Command(name = "version")
  public static class VersionCommand implements Runnable {
    @Override
    public void run() {
      System.out.println("Current Version: " + getVersion());
    }
  }

  @Command(name = "run", description = "watches the given roots and logs them as they are reaped")
  public static class RunCommand implements Runnable {
    @Option(name = { "-c", "--config" }, description = "daemon config file, e.g. /etc/rootwatch.json")
    public String configFile;

    @Option(name = { "-r", "--root" }, description = "directory to watch, may be repeated")
    public List<String> roots = new ArrayList<>();

    @Option(name = { "--exit-when-idle" }, description = "exit once every root has been reaped")
    public boolean exitWhenIdle;

    @Option(name = { "--enable-log-file" }, description = "enables logging debug statements to rootwatch.log")
    public boolean enableLogFile;

    @Option(name = { "--trace" }, description = "enables trace logging to the console")
    public boolean trace;

    @Override
    public void run() {
      if (enableLogFile) {
        LoggingConfig.enableLogFile("rootwatch.log");
      }
      if (trace) {
        LoggingConfig.initWithTracing();
      }
      DaemonConfig config;
      try {
        config = configFile == null ? DaemonConfig.defaults() : DaemonConfig.load(Paths.get(configFile));
      } catch (Exception e) {
        log.error("Could not load " + configFile, e);
        System.exit(-1);
        return;
      }
      try (WatchService service = WatchService.create(config)) {
        service.start();
        for (String root : roots) {
          Path path = Paths.get(root);
          try {
            service.watch(path);
          } catch (RootwatchException e) {
            log.error(e.getMessage());
          }
        }
        List<Path> lastSeen = service.watchList();
        while (!(exitWhenIdle && lastSeen.isEmpty())) {
          Thread.sleep(config.getReapSweepInterval().toMillis());
          List<Path> current = service.watchList();
          if (!current.equals(lastSeen)) {
            log.info("Watching {} roots: {}", current.size(), StringUtils.join(current, ", "));
            lastSeen = current;
          }
        }
        log.info("No roots left, {} reaped", service.getReapCount());
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
  }

  public static String getVersion() {
    String version = null;
    URL url = Rootwatch.class.getResource("/META-INF/MANIFEST.MF");
    try {
      if (url != null) {
        try (InputStream in = url.openStream()) {
          Manifest m = new Manifest(in);
          version = m.getMainAttributes().getValue("Rootwatch-Version");
        }
      }
    } catch (Exception e) {
      log.error("Error loading manifest", e);
    }
    return StringUtils.defaultIfEmpty(version, "unspecified");
  }

}
