package in.tradewell.worker;

/**
 * The three kinds of worker in a session topology.
 */
public enum WorkerRole {
    PRODUCER(ProducerArgs.class),
    CONSUMER(ConsumerArgs.class),
    SCANNER(ScannerArgs.class);

    private final Class<? extends WorkerArgs> argsType;

    WorkerRole(Class<? extends WorkerArgs> argsType) {
        this.argsType = argsType;
    }

    public Class<? extends WorkerArgs> argsType() {
        return argsType;
    }

    /**
     * Run the provider method matching this role.
     */
    public void run(WorkerProvider provider, WorkerArgs args, WorkerContext context) throws Exception {
        switch (this) {
            case PRODUCER -> provider.runProducer((ProducerArgs) args, context);
            case CONSUMER -> provider.runConsumer((ConsumerArgs) args, context);
            case SCANNER -> provider.runScanner((ScannerArgs) args, context);
        }
    }

    public String label() {
        return name().toLowerCase();
    }
}
