package fr.lapetina.inference.sweep.orchestrator;

import fr.lapetina.inference.sweep.exception.ProcessStartException;
import fr.lapetina.inference.sweep.infrastructure.process.FakeProcessHandle;
import fr.lapetina.inference.sweep.infrastructure.process.LaunchSpec;
import fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessHandle;
import fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessLauncher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Launcher that starts nothing. Handles are picked by the prefix of the output file name.
 */
final class FakeLauncher implements RemoteProcessLauncher {

    private final List<LaunchSpec> launched = new CopyOnWriteArrayList<>();
    private final Map<String, FakeProcessHandle> handles = new LinkedHashMap<>();
    private final Map<String, Supplier<FakeProcessHandle>> behaviours = new LinkedHashMap<>();
    private volatile String failingPrefix;

    FakeLauncher with(String outputPrefix, Supplier<FakeProcessHandle> behaviour) {
        behaviours.put(outputPrefix, behaviour);
        return this;
    }

    FakeLauncher failingOn(String outputPrefix) {
        this.failingPrefix = outputPrefix;
        return this;
    }

    @Override
    public synchronized RemoteProcessHandle start(LaunchSpec spec) {
        launched.add(spec);
        String fileName = spec.outputFile().getFileName().toString();
        if (failingPrefix != null && fileName.startsWith(failingPrefix)) {
            throw new ProcessStartException(spec.node(), "srun: error: Unable to create step", null);
        }

        FakeProcessHandle handle = behaviours.entrySet().stream()
                .filter(e -> fileName.startsWith(e.getKey()))
                .map(e -> e.getValue().get())
                .findFirst()
                .orElseGet(FakeProcessHandle::running);
        handles.put(fileName, handle);
        return handle;
    }

    List<LaunchSpec> launched() {
        return launched;
    }

    List<String> launchedFiles() {
        return launched.stream().map(s -> s.outputFile().getFileName().toString()).toList();
    }

    synchronized FakeProcessHandle handle(String outputPrefix) {
        return handles.entrySet().stream()
                .filter(e -> e.getKey().startsWith(outputPrefix))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No process launched for " + outputPrefix));
    }

    synchronized List<FakeProcessHandle> handles() {
        return List.copyOf(handles.values());
    }
}
