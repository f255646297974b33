package in.tradefuse.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a registry in Prometheus text format to a file for the node-exporter textfile collector.
 *
 * The file is replaced atomically so a scrape never sees a partial write.
 */
public final class MetricsTextfileWriter {
    private static final Logger log = LoggerFactory.getLogger(MetricsTextfileWriter.class);

    private final CollectorRegistry registry;
    private final Path target;

    public MetricsTextfileWriter(CollectorRegistry registry, Path target) {
        this.registry = registry;
        this.target = target;
    }

    /**
     * Export the registry. Failures are logged; metrics export never fails a unit of work.
     *
     * @return true if the file was written
     */
    public boolean write() {
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                TextFormat.write004(writer, registry.metricFamilySamples());
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[METRICS] Exported metrics to {}", target);
            return true;
        } catch (IOException e) {
            log.warn("[METRICS] Failed to export metrics to {}: {}", target, e.getMessage());
            return false;
        }
    }
}
