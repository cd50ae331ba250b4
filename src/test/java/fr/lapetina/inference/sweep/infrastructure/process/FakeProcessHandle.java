package fr.lapetina.inference.sweep.infrastructure.process;

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable process handle counting the signals it receives.
 */
public final class FakeProcessHandle implements RemoteProcessHandle {

    private volatile boolean alive = true;
    private volatile int exitCode;
    private volatile boolean ignoreTerminate;
    private volatile RuntimeException signalFailure;

    private final AtomicInteger terminateCalls = new AtomicInteger();
    private final AtomicInteger killCalls = new AtomicInteger();

    public static FakeProcessHandle running() {
        return new FakeProcessHandle();
    }

    public static FakeProcessHandle exited(int exitCode) {
        FakeProcessHandle handle = new FakeProcessHandle();
        handle.exit(exitCode);
        return handle;
    }

    /**
     * Survives the graceful signal, only a kill stops it.
     */
    public FakeProcessHandle ignoringTerminate() {
        this.ignoreTerminate = true;
        return this;
    }

    /**
     * Every signal throws.
     */
    public FakeProcessHandle failingSignals(RuntimeException failure) {
        this.signalFailure = failure;
        return this;
    }

    public void exit(int code) {
        this.exitCode = code;
        this.alive = false;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public OptionalInt exitCode() {
        return alive ? OptionalInt.empty() : OptionalInt.of(exitCode);
    }

    @Override
    public void terminate() {
        terminateCalls.incrementAndGet();
        if (signalFailure != null) {
            throw signalFailure;
        }
        if (!ignoreTerminate) {
            exit(143);
        }
    }

    @Override
    public void kill() {
        killCalls.incrementAndGet();
        if (signalFailure != null) {
            throw signalFailure;
        }
        exit(137);
    }

    public int terminateCalls() {
        return terminateCalls.get();
    }

    public int killCalls() {
        return killCalls.get();
    }

    public int signalCount() {
        return terminateCalls.get() + killCalls.get();
    }
}
