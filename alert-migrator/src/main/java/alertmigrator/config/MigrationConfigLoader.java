package alertmigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migration.properties} on the classpath</li>
 *   <li>{@code migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration. Use the
 * {@code migration.} prefix for property names (e.g., {@code -Dmigration.rule.group.mode=RULE_TITLE}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.interval.base} - scheduler granularity in seconds</li>
 *   <li>{@code migration.title.max.length} - maximum rule title length</li>
 *   <li>{@code migration.title.case.insensitive} - true if titles compare ignoring case</li>
 *   <li>{@code migration.uid.max.length} - maximum rule UID length</li>
 *   <li>{@code migration.uid.length} - length of generated rule UIDs</li>
 *   <li>{@code migration.rule.group.mode} - DASHBOARD_PANEL or RULE_TITLE</li>
 *   <li>{@code migration.rule.group.max.length} - maximum rule group name length</li>
 *   <li>{@code migration.dedup.max.attempts} - candidate names tried before giving up</li>
 *   <li>{@code migration.silence.duration.days} - lifetime of compatibility silences</li>
 *   <li>{@code migration.org.parallelism} - organizations migrated concurrently</li>
 *   <li>{@code migration.timeout.run} - run timeout in seconds, 0 to disable</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (migration.properties or migration.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("migration.properties");
        if (is != null) {
            return loadProperties(is, "migration.properties");
        }

        is = getResource("migration.yml");
        if (is != null) {
            return loadYaml(is, "migration.yml");
        }

        throw new MigrationConfigException(
                "Config file required: migration.properties or migration.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new MigrationConfigException("Failed to parse " + source, e);
        }
        if (root == null) {
            return MigrationConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getLong(props, "migration.interval.base").ifPresent(v -> apply("interval.base", v, b::baseIntervalSeconds));
        getInt(props, "migration.title.max.length").ifPresent(v -> apply("title.max.length", v, b::maxTitleLength));
        getBoolean(props, "migration.title.case.insensitive").ifPresent(b::caseInsensitiveTitles);
        getInt(props, "migration.uid.max.length").ifPresent(v -> apply("uid.max.length", v, b::maxUidLength));
        getInt(props, "migration.uid.length").ifPresent(v -> apply("uid.length", v, b::uidLength));
        getInt(props, "migration.rule.group.max.length").ifPresent(v -> apply("rule.group.max.length", v, b::maxRuleGroupLength));
        getInt(props, "migration.dedup.max.attempts").ifPresent(v -> apply("dedup.max.attempts", v, b::dedupMaxAttempts));
        getLong(props, "migration.silence.duration.days").ifPresent(v -> apply("silence.duration.days", v, b::silenceDurationDays));
        getInt(props, "migration.org.parallelism").ifPresent(v -> apply("org.parallelism", v, b::orgParallelism));
        getLong(props, "migration.timeout.run").ifPresent(b::runTimeoutSeconds);

        getString(props, "migration.rule.group.mode").ifPresent(v -> {
            try {
                b.ruleGroupMode(RuleGroupMode.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid rule.group.mode: {}", v);
            }
        });

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static <T> void apply(String key, T value, Consumer<T> setter) {
        try {
            setter.accept(value);
        } catch (MigrationConfigException e) {
            log.warn("Invalid {}: {} ({})", key, value, e.getMessage());
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
