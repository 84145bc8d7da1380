package de.mirkosertic.filevault.config;

import de.mirkosertic.filevault.cli.BuildInfoVersionProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Unfiltered placeholders fall back to the development defaults")
    void unfilteredPlaceholders() {
        assertThat(BuildInfo.filteredOrDefault("${project.version}", "dev")).isEqualTo("dev");
        assertThat(BuildInfo.filteredOrDefault("${maven.build.timestamp}", "unknown")).isEqualTo("unknown");
        assertThat(BuildInfo.filteredOrDefault(null, "dev")).isEqualTo("dev");
        assertThat(BuildInfo.filteredOrDefault("  ", "dev")).isEqualTo("dev");
    }

    @Test
    @DisplayName("Filtered values are taken as they are")
    void filteredValues() {
        assertThat(BuildInfo.filteredOrDefault("0.1.0-SNAPSHOT", "dev")).isEqualTo("0.1.0-SNAPSHOT");
        assertThat(BuildInfo.filteredOrDefault("2026-01-31T12:00:00Z", "unknown")).isEqualTo("2026-01-31T12:00:00Z");
    }

    @Test
    @DisplayName("--version prints the FileVault banner line")
    void versionBanner() {
        // Given
        final String expected = "FileVault " + BuildInfo.getVersion() + " (built " + BuildInfo.getBuildTimestamp() + ")";

        // When
        final String[] lines = new BuildInfoVersionProvider().getVersion();

        // Then
        assertThat(lines).containsExactly(expected);
        assertThat(BuildInfo.describe()).isEqualTo(expected);
        assertThat(BuildInfo.getVersion()).as("placeholder never leaks").doesNotStartWith("${");
        assertThat(BuildInfo.getBuildTimestamp()).as("placeholder never leaks").doesNotStartWith("${");
    }
}
