package fr.lapetina.inference.sweep.domain.model;

import java.util.Locale;

/**
 * Serving role of a worker.
 *
 * PREFILL: processes prompts and hands KV cache over to decode workers
 * DECODE: generates tokens from transferred KV cache
 * AGG: aggregated worker doing both phases on its own
 */
public enum WorkerMode {
    PREFILL("prefill"),
    DECODE("decode"),
    AGG("agg");

    private final String label;

    WorkerMode(String label) {
        this.label = label;
    }

    /**
     * Lower-case name used in process names, log files and CLI flags.
     */
    public String label() {
        return label;
    }

    public static WorkerMode fromLabel(String label) {
        for (WorkerMode mode : values()) {
            if (mode.label.equals(label.toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown worker mode: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
