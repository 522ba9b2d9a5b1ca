package de.bsommerfeld.canary.backup;

import de.bsommerfeld.canary.core.util.HashUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A backup file on disk. The checksum is computed on demand since hashing a
 * large bundle is far more expensive than listing it.
 */
public record BackupArtifact(Path file, long sizeBytes, BackupType type, Instant modifiedAt) {

    public static BackupArtifact of(Path file) throws IOException {
        return new BackupArtifact(
                file.toAbsolutePath().normalize(),
                Files.size(file),
                BackupType.infer(file),
                Files.getLastModifiedTime(file).toInstant());
    }

    public String checksum() throws IOException {
        return HashUtil.sha256(file);
    }

    /** Whole days since the last modification. */
    public long ageDays(Clock clock) {
        return Duration.between(modifiedAt, clock.instant()).toDays();
    }

    public String fileName() {
        return file.getFileName().toString();
    }
}
