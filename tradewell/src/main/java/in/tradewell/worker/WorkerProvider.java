package in.tradewell.worker;

/**
 * Worker implementations plugged in through {@link java.util.ServiceLoader}.
 *
 * Register an implementation in
 * {@code META-INF/services/in.tradewell.worker.WorkerProvider}. Each method
 * runs the whole life of one worker and returns when that worker is done;
 * implementations must return promptly once the running thread is interrupted.
 */
public interface WorkerProvider {

    void runProducer(ProducerArgs args, WorkerContext context) throws Exception;

    void runConsumer(ConsumerArgs args, WorkerContext context) throws Exception;

    void runScanner(ScannerArgs args, WorkerContext context) throws Exception;
}
