package in.tradewell.worker;

/**
 * Marker for the argument bundle handed to a worker at spawn time.
 */
public interface WorkerArgs {
}
