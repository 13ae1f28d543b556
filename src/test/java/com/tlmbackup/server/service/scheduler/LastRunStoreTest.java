package com.tlmbackup.server.service.scheduler;

import com.tlmbackup.server.model.config.BackupSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.tlmbackup.server.BackupTestUtil.T0;
import static com.tlmbackup.server.BackupTestUtil.settings;
import static org.junit.jupiter.api.Assertions.*;

class LastRunStoreTest {

    @TempDir
    Path tempDir;

    private BackupSettings settingsWithStateFile(Path stateFile) {
        BackupSettings backupSettings = settings(this.tempDir);
        backupSettings.getScheduler().setStateFile(stateFile == null ? null : stateFile.toString());
        return backupSettings;
    }

    @Test
    void lastRunSurvivesRestart() {
        Path stateFile = this.tempDir.resolve("state/last-runs.json");
        LastRunStore lastRunStore = new LastRunStore(settingsWithStateFile(stateFile));

        lastRunStore.save("nightly", T0);

        assertTrue(Files.isRegularFile(stateFile));
        assertFalse(Files.exists(stateFile.resolveSibling("last-runs.json.tmp")));
        LastRunStore reloaded = new LastRunStore(settingsWithStateFile(stateFile));
        assertEquals(T0, reloaded.get("nightly"));
        assertNull(reloaded.get("hourly"));
    }

    @Test
    void olderStartNeverReplacesNewer() {
        LastRunStore lastRunStore = new LastRunStore(settingsWithStateFile(null));

        lastRunStore.save("nightly", T0);
        lastRunStore.save("nightly", T0.minusSeconds(60));

        assertEquals(T0, lastRunStore.get("nightly"));
        lastRunStore.save("nightly", T0.plusSeconds(60));
        assertEquals(T0.plusSeconds(60), lastRunStore.get("nightly"));
    }

    @Test
    void corruptStateFileIsIgnored() throws IOException {
        Path stateFile = Files.writeString(this.tempDir.resolve("last-runs.json"), "{not json");

        LastRunStore lastRunStore = new LastRunStore(settingsWithStateFile(stateFile));

        assertNull(lastRunStore.get("nightly"));
        // 下一次保存覆盖损坏的文件
        lastRunStore.save("nightly", T0);
        assertEquals(T0, new LastRunStore(settingsWithStateFile(stateFile)).get("nightly"));
    }
}
