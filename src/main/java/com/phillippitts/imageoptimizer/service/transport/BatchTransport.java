package com.phillippitts.imageoptimizer.service.transport;

import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.exception.TransportException;

import java.util.List;

/**
 * Hands a serialized batch to the sidecar through a file it can open by path.
 */
public interface BatchTransport {

    /**
     * Serializes {@code batch} and writes it to a fresh backing file. The payload is fully
     * written and flushed before this method returns.
     *
     * @param batch non-empty batch
     * @return handle owning the backing file; close it once the sidecar has exited
     * @throws TransportException if the file cannot be prepared (any partial file is removed)
     */
    TransportHandle prepare(List<ImageTask> batch);
}
