package tech.compendium.messagerouter.metrics;

/**
 * Point-in-time counts for one consumed queue.
 */
public record QueueStats(
    String name,
    long totalMessages,
    long totalConsumed,
    long totalFailed,
    long totalRequeued,
    long totalDeadLettered,
    long totalDuplicates,
    long pendingMessages,
    long unackedMessages
) {

    public static QueueStats empty(String name) {
        return new QueueStats(name, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Share of settled handler runs that succeeded; 1.0 before anything was handled.
     */
    public double successRate() {
        long settled = totalConsumed + totalFailed;
        return settled == 0 ? 1.0 : (double) totalConsumed / settled;
    }
}
