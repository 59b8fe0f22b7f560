package io.kitchensync.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kitchensync.core.config.model.KitchenSyncConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {
    @TempDir
    Path tempDir;

    private final ConfigService service = new ConfigService();

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws Exception {
        KitchenSyncConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config).isEqualTo(KitchenSyncConfig.defaults());
        assertThat(config.scheduler().tickSeconds()).isEqualTo(60);
        assertThat(config.executor().pollSeconds()).isEqualTo(15);
        assertThat(config.gateway().port()).isEqualTo(8787);
    }

    @Test
    void shouldMergePartialFileOverDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {"tickSeconds": 30},
              "tool": {"binaryPath": "/opt/calendarsync"},
              "somethingElse": true
            }
            """);

        KitchenSyncConfig config = service.load(configPath);

        assertThat(config.scheduler().tickSeconds()).isEqualTo(30);
        assertThat(config.scheduler().enabled()).isTrue();
        assertThat(config.scheduler().timezone()).isEqualTo("UTC");
        assertThat(config.tool().binaryPath()).isEqualTo("/opt/calendarsync");
        assertThat(config.storage()).isEqualTo(KitchenSyncConfig.defaults().storage());
    }

    @Test
    void shouldCreateFileOnInitAndKeepExistingValues() throws Exception {
        Path configPath = tempDir.resolve("nested/config.json");

        assertThat(service.init(configPath, false)).isTrue();
        Files.writeString(configPath, "{\"gateway\": {\"port\": 9000}}");
        assertThat(service.init(configPath, false)).isFalse();

        assertThat(service.load(configPath).gateway().port()).isEqualTo(9000);
        assertThat(Files.readString(configPath)).contains("\"databasePath\"");

        service.init(configPath, true);
        assertThat(service.load(configPath).gateway().port()).isEqualTo(8787);
    }

    @Test
    void shouldRoundTripSavedConfig() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        KitchenSyncConfig config = KitchenSyncConfig.defaults();

        service.save(configPath, config);

        assertThat(service.load(configPath)).isEqualTo(config);
        assertThat(Files.readString(configPath)).contains("\"tickSeconds\" : 60");
    }

    @Test
    void shouldKeepDefaultsForNullValuesAndBlankFile() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"storage\": null, \"executor\": {\"pollSeconds\": null, \"runTimeoutSeconds\": 600}}");

        KitchenSyncConfig config = service.load(configPath);

        assertThat(config.storage()).isEqualTo(KitchenSyncConfig.defaults().storage());
        assertThat(config.executor().pollSeconds()).isEqualTo(15);
        assertThat(config.executor().runTimeoutSeconds()).isEqualTo(600);

        Files.writeString(configPath, "  \n");
        assertThat(service.load(configPath)).isEqualTo(KitchenSyncConfig.defaults());
    }

    @Test
    void shouldRejectMalformedSettingsFile() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"scheduler\": {\"tickSeconds\": ");

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(configPath.toString());

        Files.writeString(configPath, "[1, 2]");
        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void shouldExpandHomeAndFallBackForBlankPaths() {
        Path fallback = tempDir.resolve("fallback");

        assertThat(ConfigPaths.resolve("~/data/kitchensync.db", fallback))
            .isEqualTo(Path.of(System.getProperty("user.home"), "data/kitchensync.db"));
        assertThat(ConfigPaths.resolve("  ", fallback)).isEqualTo(fallback);
        assertThat(ConfigPaths.resolve("/var/lib/ks.db", fallback)).isEqualTo(Path.of("/var/lib/ks.db"));
        assertThat(ConfigPaths.scratchRoot("")).isEqualTo(Path.of(System.getProperty("java.io.tmpdir")));
    }
}
