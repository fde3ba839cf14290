package in.tradewell.worker;

import in.tradewell.infrastructure.ipc.MessageQueue;
import in.tradewell.infrastructure.ipc.QueueFactory;
import in.tradewell.infrastructure.ipc.QueueRef;

/**
 * What a running worker gets besides its arguments: its name and a way to
 * open the queues referenced by those arguments.
 */
public record WorkerContext(String workerName, QueueFactory queues) {

    public MessageQueue open(QueueRef ref) {
        return queues.open(ref);
    }
}
