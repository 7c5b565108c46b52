package com.drawsync.servicebackend.coordinator;

import java.util.List;

/**
 * Elements taken out of a room's buffer for one durable write. {@code generation} is the
 * buffer generation at drain time; a clear moves the buffer to a new generation.
 */
public record FlushBatch(Long roomId, long generation, List<DrawingElement> elements) {
}
