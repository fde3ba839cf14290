package in.tradewell.service.session;

import in.tradewell.infrastructure.process.WorkerHandle;
import in.tradewell.infrastructure.process.WorkerLauncher;
import in.tradewell.worker.WorkerRole;
import in.tradewell.worker.WorkerSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

class FakeWorkerLauncher implements WorkerLauncher {

    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final List<WorkerSpec> specs = new ArrayList<>();
    final Map<String, FakeWorkerHandle> handles = new LinkedHashMap<>();
    private final boolean exitOnStart;
    private String failOn;

    FakeWorkerLauncher(boolean exitOnStart) {
        this.exitOnStart = exitOnStart;
    }

    void failOnSpawn(String workerName) {
        this.failOn = workerName;
    }

    @Override
    public WorkerHandle spawn(WorkerSpec spec) {
        if (spec.name().equals(failOn)) {
            throw new IllegalStateException("cannot spawn " + spec.name());
        }
        specs.add(spec);
        events.add("spawn:" + spec.name());
        FakeWorkerHandle handle = new FakeWorkerHandle(spec.name(), events, exitOnStart);
        handles.put(spec.name(), handle);
        return handle;
    }

    FakeWorkerHandle handle(String name) {
        return handles.get(name);
    }

    WorkerSpec spec(String name) {
        return specs.stream().filter(s -> s.name().equals(name)).findFirst().orElseThrow();
    }

    List<WorkerSpec> specsOf(WorkerRole role) {
        return specs.stream().filter(s -> s.role() == role).collect(Collectors.toList());
    }

    List<String> eventsStartingWith(String prefix) {
        synchronized (events) {
            return events.stream().filter(e -> e.startsWith(prefix)).collect(Collectors.toList());
        }
    }
}
