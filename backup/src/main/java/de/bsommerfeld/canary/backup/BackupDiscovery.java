package de.bsommerfeld.canary.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists backup files of a directory (non-recursive), newest first. Checksum
 * sidecars, temporary files and safety backups never match because their
 * names do not end in a backup extension.
 */
public final class BackupDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(BackupDiscovery.class);

    private BackupDiscovery() {
    }

    public static List<BackupArtifact> discover(Path directory, Collection<String> extensions) throws IOException {
        List<String> suffixes = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toList());

        List<Path> matches;
        try (Stream<Path> stream = Files.list(directory)) {
            matches = stream.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                        return suffixes.stream().anyMatch(name::endsWith);
                    })
                    .collect(Collectors.toList());
        }

        List<BackupArtifact> artifacts = new ArrayList<>();
        for (Path file : matches) {
            artifacts.add(BackupArtifact.of(file));
        }
        artifacts.sort(Comparator.comparing(BackupArtifact::modifiedAt).reversed()
                .thenComparing(BackupArtifact::fileName));
        LOG.debug("[BACKUP] Found {} backups in {}", artifacts.size(), directory);
        return artifacts;
    }
}
