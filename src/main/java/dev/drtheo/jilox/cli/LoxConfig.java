package dev.drtheo.jilox.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Command line settings, read from HOCON. Precedence, highest first:
 * <ol>
 *     <li>JVM system properties ({@code -Djilox.repl.prompt=...})</li>
 *     <li>{@code jilox.conf} in the working directory</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class LoxConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LoxConfig.class);

    public static final String CONFIG_FILE_NAME = "jilox.conf";
    private static final String ROOT = "jilox";

    private final Config config;

    private LoxConfig(Config config) {
        this.config = config.getConfig(ROOT);
    }

    public static LoxConfig load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    public static LoxConfig load(File file) {
        Config fileConfig;

        if (file.isFile()) {
            LOG.debug("Loading configuration from {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            fileConfig = ConfigFactory.empty();
        }

        return of(ConfigFactory.systemProperties().withFallback(fileConfig));
    }

    /**
     * @param overrides settings layered on top of the classpath defaults
     */
    public static LoxConfig of(Config overrides) {
        Config defaults = ConfigFactory.parseResources(LoxConfig.class.getClassLoader(), "reference.conf");
        return new LoxConfig(overrides.withFallback(defaults).resolve());
    }

    public static LoxConfig defaults() {
        return of(ConfigFactory.empty());
    }

    public String getPrompt() {
        return config.getString("repl.prompt");
    }

    public String getBanner() {
        return config.getString("repl.banner");
    }

    public boolean isPrintAst() {
        return config.getBoolean("repl.print-ast");
    }

    public int getUsageExitCode() {
        return config.getInt("exit-codes.usage");
    }

    public int getDataErrorExitCode() {
        return config.getInt("exit-codes.data-error");
    }

    public int getSoftwareErrorExitCode() {
        return config.getInt("exit-codes.software-error");
    }

    public int getIoErrorExitCode() {
        return config.getInt("exit-codes.io-error");
    }
}
