package com.prettyprinter.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationLoaderTest {
    private static final Path CONFIG_DIR = Path.of("src/test/resources/config");

    @TempDir
    Path tempDir;

    @Test
    void loadDefaultConfig_matchesBuiltInDefaults() {
        FormattingConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.toMap()).isEqualTo(FormattingConfig.defaults().toMap());
        assertThat(config.getTabWidth()).isEqualTo(8);
        assertThat(config.isUseTabs()).isTrue();
        assertThat(config.getMaxNewlines()).isEqualTo(3);
        assertThat(config.isHtml()).isFalse();
    }

    @Test
    void loadConfig_readsBothSections() {
        FormattingConfig config = ConfigurationLoader.loadConfig(CONFIG_DIR.resolve("custom-config.yml"));

        assertThat(config.getTabWidth()).isEqualTo(4);
        assertThat(config.isUseTabs()).isFalse();
        assertThat(config.isRespectNewlines()).isFalse();
        assertThat(config.getMaxNewlines()).isEqualTo(2);
        assertThat(config.isPrintComments()).isFalse();
        assertThat(config.isOptionalSemicolons()).isTrue();
        assertThat(config.isHtml()).isTrue();
        assertThat(config.isExperimentalDef()).isTrue();
        assertThat(config.isDebug()).isFalse();
    }

    @Test
    void loadConfig_replacesInvalidValuesWithDefaults() {
        FormattingConfig config = ConfigurationLoader.loadConfig(CONFIG_DIR.resolve("out-of-range-config.yml"));

        assertThat(config.getTabWidth()).isEqualTo(FormattingConfig.DEFAULT_TAB_WIDTH);
        assertThat(config.getMaxNewlines()).isEqualTo(FormattingConfig.DEFAULT_MAX_NEWLINES);
        assertThat(config.isUseTabs()).isTrue();
        assertThat(config.isExperimentalDef()).isTrue();
    }

    @Test
    void loadConfig_fallsBackForMissingFile() {
        FormattingConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("missing.yml"));

        assertThat(config.toMap()).isEqualTo(FormattingConfig.defaults().toMap());
        assertThat(ConfigurationLoader.loadConfig(null).toMap()).isEqualTo(FormattingConfig.defaults().toMap());
    }

    @Test
    void loadConfig_fallsBackForMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "layout: [unclosed\n");

        assertThat(ConfigurationLoader.loadConfig(file).toMap()).isEqualTo(FormattingConfig.defaults().toMap());
    }

    @Test
    void saveConfig_writesLoadableYaml() throws IOException {
        FormattingConfig config = FormattingConfig.builder()
                .tabWidth(2)
                .useTabs(false)
                .debug(true)
                .build();
        Path file = tempDir.resolve("nested/.prettyprinter.yml");

        ConfigurationLoader.saveConfig(config, file);

        assertThat(Files.readString(file)).contains("layout:", "formatting:", "tabWidth: 2");
        assertThat(ConfigurationLoader.loadConfig(file).toMap()).isEqualTo(config.toMap());
    }

    @Test
    void createConfigFromMap_ignoresMistypedSections() {
        FormattingConfig config = ConfigurationLoader._createConfigFromMap(Map.of("layout", "tabs please"));

        assertThat(config.toMap()).isEqualTo(FormattingConfig.defaults().toMap());
    }

    @Test
    void builder_rejectsNonPositiveWidths() {
        assertThatThrownBy(() -> FormattingConfig.builder().tabWidth(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormattingConfig.builder().maxNewlines(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withHtml_keepsOtherValues() {
        FormattingConfig config = FormattingConfig.builder().tabWidth(3).build();
        FormattingConfig html = config.withHtml(true);

        assertThat(html.isHtml()).isTrue();
        assertThat(html.getTabWidth()).isEqualTo(3);
        assertThat(config.withHtml(false)).isSameAs(config);
    }
}
