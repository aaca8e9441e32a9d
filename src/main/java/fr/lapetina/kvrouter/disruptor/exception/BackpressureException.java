package fr.lapetina.kvrouter.disruptor.exception;

/**
 * Thrown by {@code submit} when the routing pipeline cannot take another request.
 *
 * A full ring buffer is transient and worth retrying; a stopped pipeline is not.
 */
public final class BackpressureException extends RuntimeException {

    public enum Reason {
        RING_BUFFER_FULL,
        PIPELINE_STOPPED
    }

    private final Reason reason;
    private final long remainingCapacity;

    public BackpressureException(Reason reason, long remainingCapacity) {
        super(describe(reason, remainingCapacity));
        this.reason = reason;
        this.remainingCapacity = remainingCapacity;
    }

    public static BackpressureException ringBufferFull(long remainingCapacity) {
        return new BackpressureException(Reason.RING_BUFFER_FULL, remainingCapacity);
    }

    public static BackpressureException pipelineStopped() {
        return new BackpressureException(Reason.PIPELINE_STOPPED, 0);
    }

    public Reason getReason() {
        return reason;
    }

    public long getRemainingCapacity() {
        return remainingCapacity;
    }

    public boolean isRetryable() {
        return reason == Reason.RING_BUFFER_FULL;
    }

    private static String describe(Reason reason, long remainingCapacity) {
        return switch (reason) {
            case RING_BUFFER_FULL -> "Routing pipeline saturated, remaining capacity: " + remainingCapacity;
            case PIPELINE_STOPPED -> "Routing pipeline is not running";
        };
    }
}
