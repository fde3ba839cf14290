package in.tradewell.worker;

import in.tradewell.domain.session.SessionRunId;

import java.util.Objects;

/**
 * Everything needed to spawn one worker: entry point (the role) and arguments.
 */
public record WorkerSpec(SessionRunId runId, String name, WorkerRole role, WorkerArgs args) {

    public WorkerSpec {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(args, "args");
        if (!role.argsType().isInstance(args)) {
            throw new IllegalArgumentException(
                "Worker " + name + " of role " + role + " needs " + role.argsType().getSimpleName()
                    + ", got " + args.getClass().getSimpleName());
        }
    }
}
