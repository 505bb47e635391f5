package com.phillippitts.imageoptimizer.service.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the backing file and mapped region of exactly one batch execution.
 *
 * <p>Must be closed only after the sidecar reading it has exited. Closing is idempotent and never
 * throws: cleanup failures are logged and the temp directory eventually reclaims the file.
 */
public final class TransportHandle implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TransportHandle.class);

    private final Path path;
    private final long size;
    private final FileChannel channel;
    private volatile MappedByteBuffer mapping;
    private final AtomicBoolean released = new AtomicBoolean(false);

    TransportHandle(Path path, long size, FileChannel channel, MappedByteBuffer mapping) {
        this.path = path;
        this.size = size;
        this.channel = channel;
        this.mapping = mapping;
    }

    /**
     * Absolute path of the backing file, passed to the sidecar as its data argument.
     */
    public Path path() {
        return path.toAbsolutePath();
    }

    /**
     * Payload size in bytes.
     */
    public long size() {
        return size;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Drops the mapping, closes the channel and deletes the backing file.
     */
    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        // The JDK has no public unmap; the region is freed once the buffer becomes unreachable.
        mapping = null;
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close batch file channel {}: {}", path, e.toString());
        }
        try {
            Files.deleteIfExists(path);
            LOG.debug("Released batch file {}", path);
        } catch (IOException e) {
            LOG.warn("Failed to delete batch file {}: {}", path, e.toString());
        }
    }
}
