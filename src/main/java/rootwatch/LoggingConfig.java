package rootwatch;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;

/**
 * Initializes a minimal/readable logback config.
 */
public class LoggingConfig {

  private static final String pattern = "%date{YYYY-MM-dd HH:mm:ss} %-5level [%thread] %msg%n";
  private static volatile boolean started = false;

  public synchronized static void init() {
    if (started) {
      return;
    }
    started = true;

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setContext(context);
    console.setEncoder(newEncoder(context));
    console.start();

    Logger root = getRootLogger();
    root.detachAndStopAllAppenders();
    root.addAppender(console);
    root.setLevel(Level.INFO);

    getLogger("rootwatch").setLevel(Level.INFO);
  }

  public synchronized static void initWithTracing() {
    init();
    getLogger("rootwatch").setLevel(Level.TRACE);
  }

  public synchronized static void enableLogFile(String fileName) {
    init();

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    FileAppender<ILoggingEvent> file = new FileAppender<>();
    file.setContext(context);
    file.setAppend(true);
    file.setFile(fileName);
    file.setEncoder(newEncoder(context));
    file.start();
    getRootLogger().addAppender(file);
    getLogger("rootwatch").setLevel(Level.DEBUG);
  }

  private static PatternLayoutEncoder newEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(pattern);
    encoder.start();
    return encoder;
  }

  private static Logger getRootLogger() {
    return getLogger(Logger.ROOT_LOGGER_NAME);
  }

  private static Logger getLogger(String name) {
    return (Logger) LoggerFactory.getLogger(name);
  }

}
