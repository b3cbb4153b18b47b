package me.bechberger.mcpprobe.process;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe set of server processes that have been started and not yet stopped.
 */
public class ProcessRegistry {

    private final Set<ServerProcess> active = ConcurrentHashMap.newKeySet();

    void register(@NotNull ServerProcess process) {
        active.add(process);
    }

    void unregister(@NotNull ServerProcess process) {
        active.remove(process);
    }

    public List<ServerProcess> activeProcesses() {
        return List.copyOf(active);
    }

    public int size() {
        return active.size();
    }

    public boolean isEmpty() {
        return active.isEmpty();
    }
}
