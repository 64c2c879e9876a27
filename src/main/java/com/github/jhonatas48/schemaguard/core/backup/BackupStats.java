package com.github.jhonatas48.schemaguard.core.backup;

import java.time.Instant;

public record BackupStats(int count, long totalSizeBytes, Instant oldestBackup, Instant newestBackup) {
}
