package alertmigrator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.interval.base=30
                migration.title.max.length=100
                migration.title.case.insensitive=false
                migration.uid.max.length=20
                migration.uid.length=12
                migration.rule.group.mode=RULE_TITLE
                migration.dedup.max.attempts=5
                migration.silence.duration.days=30
                migration.org.parallelism=4
                migration.timeout.run=600
                migration.alert.level=ERROR
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(30, c.baseIntervalSeconds());
        assertEquals(100, c.maxTitleLength());
        assertFalse(c.caseInsensitiveTitles());
        assertEquals(20, c.maxUidLength());
        assertEquals(12, c.uidLength());
        assertEquals(RuleGroupMode.RULE_TITLE, c.ruleGroupMode());
        assertEquals(5, c.dedupMaxAttempts());
        assertEquals(Duration.ofDays(30), c.silenceDuration());
        assertEquals(4, c.orgParallelism());
        assertEquals(Duration.ofSeconds(600), c.runTimeout());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                migration:
                  interval:
                    base: 60
                  title:
                    max:
                      length: 150
                  rule:
                    group:
                      mode: rule_title
                      max:
                        length: 50
                  org:
                    parallelism: 2
                  timeout:
                    run: 30
                  alert:
                    level: DEBUG
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(60, c.baseIntervalSeconds());
        assertEquals(150, c.maxTitleLength());
        assertEquals(RuleGroupMode.RULE_TITLE, c.ruleGroupMode());
        assertEquals(50, c.maxRuleGroupLength());
        assertEquals(2, c.orgParallelism());
        assertEquals(Duration.ofSeconds(30), c.runTimeout());
        assertTrue(c.hasRunTimeout());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void emptyYamlGivesDefaults() throws IOException {
        Path f = tempDir.resolve("empty.yaml");
        Files.writeString(f, "");

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertSame(MigrationConfig.DEFAULTS, c);
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.rule.group.mode=INVALID
                migration.alert.level=INVALID
                migration.interval.base=not-a-number
                migration.title.max.length=0
                migration.org.parallelism=-3
                migration.title.case.insensitive=maybe
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(RuleGroupMode.DASHBOARD_PANEL, c.ruleGroupMode());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(10, c.baseIntervalSeconds());
        assertEquals(MigrationConfig.DEFAULT_MAX_TITLE_LENGTH, c.maxTitleLength());
        assertEquals(1, c.orgParallelism());
        assertTrue(c.caseInsensitiveTitles());
    }

    @Test
    void uidLengthIsClampedToMaximum() {
        Properties props = new Properties();
        props.setProperty("migration.uid.max.length", "8");
        props.setProperty("migration.uid.length", "14");

        MigrationConfig c = MigrationConfigLoader.parse(props);

        assertEquals(8, c.uidLength());
    }

    @Test
    void malformedYamlThrows() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "migration: [unclosed");

        assertThrows(MigrationConfigException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }
}
