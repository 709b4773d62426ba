package ca.gc.cra.frametap.application.flow;

/**
 * Delivery statistics for one reporting interval.
 *
 * @param received messages received from the transport, including ones later dropped
 * @param dropped messages discarded by decoding or routing
 * @param elapsedSeconds length of the interval
 * @param inFps {@code (received - dropped) / elapsedSeconds}
 * @param averageDelaySeconds mean of {@code now - frame_time} over delivered messages; 0 when none arrived
 * @since 0.1.0
 */
public record StatsSnapshot(
    long received, long dropped, double elapsedSeconds, double inFps, double averageDelaySeconds) {}
