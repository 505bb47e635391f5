package com.phillippitts.imageoptimizer.service.transport;

import com.phillippitts.imageoptimizer.config.properties.BatchProperties;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.exception.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link BatchTransport} backed by a memory-mapped temp file.
 *
 * <p>Each call creates a new file named
 * {@code <prefix>-<epochMillis>-<nanoTime>-<random>.dat} with {@code CREATE_NEW}, so a name
 * collision fails instead of two executions sharing a file. The payload is copied into a
 * {@code READ_WRITE} mapping and forced to the storage device before the handle is returned.
 *
 * <p>There is no sequential-access advice in the JDK mapping API; the sidecar reads the file
 * front to back and the OS read-ahead covers it.
 */
@Component
public class MemoryMappedTransport implements BatchTransport {

    private static final Logger LOG = LogManager.getLogger(MemoryMappedTransport.class);

    private final Path directory;
    private final String filePrefix;

    @Autowired
    public MemoryMappedTransport(BatchProperties properties) {
        this(Path.of(properties.tempDir()), properties.filePrefix());
    }

    MemoryMappedTransport(Path directory, String filePrefix) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.filePrefix = Objects.requireNonNull(filePrefix, "filePrefix");
    }

    @Override
    public TransportHandle prepare(List<ImageTask> batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }

        byte[] payload = BatchSerializer.serialize(batch);
        Path file = directory.resolve(nextFileName());
        FileChannel channel = null;
        boolean created = false;
        try {
            channel = FileChannel.open(file,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
            created = true;
            // Mapping past the end grows the file to the payload size
            MappedByteBuffer mapping = channel.map(FileChannel.MapMode.READ_WRITE, 0, payload.length);
            mapping.put(payload);
            mapping.force();
            LOG.debug("Prepared batch file {} ({} tasks, {} bytes)", file, batch.size(), payload.length);
            return new TransportHandle(file, payload.length, channel, mapping);
        } catch (IOException | RuntimeException e) {
            cleanupPartial(file, channel, created);
            throw new TransportException("Failed to prepare memory-mapped batch file", file.toString(), e);
        }
    }

    String nextFileName() {
        return filePrefix
                + "-" + System.currentTimeMillis()
                + "-" + System.nanoTime()
                + "-" + Integer.toHexString(ThreadLocalRandom.current().nextInt())
                + ".dat";
    }

    private static void cleanupPartial(Path file, FileChannel channel, boolean created) {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warn("Failed to close partial batch file {}: {}", file, e.toString());
            }
        }
        if (created) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warn("Failed to delete partial batch file {}: {}", file, e.toString());
            }
        }
    }
}
