package org.netpreserve.forumminer;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.forumminer.config.JobConfig;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ForumMiner {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ForumMiner.class);

    public static void main(String[] args) throws Exception {
        Path configFile = Path.of("config.yaml");
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--log-file" -> startLogFile(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: forumminer [options]");
                    System.out.println("Options:");
                    System.out.println("  -c, --config FILE        YAML config merged over the defaults (default: config.yaml)");
                    System.out.println("      --dump-config        Print the effective config and exit");
                    System.out.println("  -h, --help");
                    System.out.println("      --log-file FILE      Also write the log to FILE");
                    System.exit(0);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        var mapper = yamlMapper();
        JobConfig config = loadConfig(mapper, configFile);
        if (dumpConfig) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        var crawl = new Crawl(config);
        Thread main = Thread.currentThread();
        var shutdownHook = new Thread(() -> {
            if (crawl.phase() != Crawl.Phase.DONE) {
                log.warn("Interrupted during {}, progress so far is saved", crawl.phase());
                main.interrupt();
            }
            crawl.close();
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            CrawlSummary summary = crawl.run();
            System.out.printf("Threads: %d discovered, %d queued, %d succeeded, %d failed%n", summary.discovered(),
                    summary.queued(), summary.succeeded(), summary.failed());
            System.out.printf("Posts: %d new, %d edited%n", summary.postsNew(), summary.postsEdited());
            System.out.printf("Assets: %d downloaded, %d unchanged, %d failed%n", summary.assetsDownloaded(),
                    summary.assetsSkipped(), summary.assetsFailed());
            summary.failureReasons().forEach((reason, count) -> System.out.printf("  %s: %d%n", reason, count));
        } catch (CrawlException e) {
            log.error("Crawl aborted: {}", e.getMessage(), e);
            System.exit(2);
        } catch (InterruptedException e) {
            log.warn("Crawl interrupted");
        } finally {
            crawl.close();
        }
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the built-in defaults and deep-merges the given file over them, if it exists.
     */
    static JobConfig loadConfig(ObjectMapper mapper, Path configFile) throws IOException {
        JsonNode configTree;
        try (var stream = JobConfig.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("Missing built-in config/defaults.yaml");
            configTree = mapper.readTree(stream);
        }
        if (configFile != null && Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{0} %msg %kvp%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
