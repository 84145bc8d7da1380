package de.mirkosertic.filevault.indexsync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SyncMode Tests")
class SyncModeTest {

    @ParameterizedTest
    @ValueSource(strings = {"full", "FULL", " Full "})
    @DisplayName("Parsing ignores case and surrounding whitespace")
    void parseIsLenient(final String value) throws IndexSyncException {
        assertThat(SyncMode.parse(value)).isEqualTo(SyncMode.FULL);
    }

    @Test
    @DisplayName("Unknown and null modes are rejected with the allowed values")
    void parseRejectsUnknown() {
        assertThatThrownBy(() -> SyncMode.parse("repair"))
                .isInstanceOf(IndexSyncException.class)
                .hasMessageContaining("audit, sync, clean, full");
        assertThatThrownBy(() -> SyncMode.parse(null))
                .isInstanceOf(IndexSyncException.class);
    }

    @Test
    @DisplayName("Only the deleting modes require force")
    void forceRequirement() {
        assertThat(SyncMode.AUDIT.requiresForce()).isFalse();
        assertThat(SyncMode.SYNC.requiresForce()).isFalse();
        assertThat(SyncMode.CLEAN.requiresForce()).isTrue();
        assertThat(SyncMode.FULL.requiresForce()).isTrue();
    }

    @Test
    @DisplayName("Mode capabilities")
    void capabilities() {
        assertThat(SyncMode.AUDIT.createsMissing() || SyncMode.AUDIT.updatesStale()
                || SyncMode.AUDIT.deletesOrphans()).as("audit changes nothing").isFalse();
        assertThat(SyncMode.SYNC.createsMissing()).isTrue();
        assertThat(SyncMode.SYNC.deletesOrphans()).isFalse();
        assertThat(SyncMode.CLEAN.createsMissing()).isFalse();
        assertThat(SyncMode.CLEAN.deletesOrphans()).isTrue();
        assertThat(SyncMode.FULL.createsMissing() && SyncMode.FULL.updatesStale()
                && SyncMode.FULL.deletesOrphans()).isTrue();
    }

    @Test
    @DisplayName("SyncRequest.checkForce only passes confirmed destructive requests")
    void requestForceGate() throws IndexSyncException {
        SyncRequest.of("sync", null, false, false).checkForce();
        SyncRequest.of("clean", 1L, false, true).checkForce();

        assertThatThrownBy(() -> SyncRequest.of("clean", 1L, true, false).checkForce())
                .isInstanceOf(IndexSyncException.class)
                .extracting(e -> ((IndexSyncException) e).getCode())
                .isEqualTo(SyncErrorCode.FORCE_REQUIRED);
    }

    @Test
    @DisplayName("Scope descriptions")
    void describeScope() throws IndexSyncException {
        assertThat(SyncRequest.audit().describeScope()).isEqualTo("all users");
        assertThat(SyncRequest.of("audit", 3L, false, false).describeScope()).isEqualTo("user 3");
        assertThat(new SyncRequest(SyncMode.AUDIT, null, true, false, false).describeScope()).isEqualTo("all organizations");
    }
}
