package fr.lapetina.inference.sweep;

import fr.lapetina.inference.sweep.exception.SweepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Main entry point for the sweep orchestrator.
 *
 * <pre>
 * SweepApplication &lt;config.yaml&gt; [--dry-run]
 * </pre>
 *
 * Exits with 0 on success and 1 on failure. SIGINT and SIGTERM stop every launched process before
 * the JVM exits.
 */
public class SweepApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SweepApplication.class);

    static final String DRY_RUN_FLAG = "--dry-run";

    private final SweepFactory factory;
    private final boolean dryRun;

    public SweepApplication(String configPath, boolean dryRun) {
        log.info("Starting sweep orchestrator: config={}, dryRun={}", configPath, dryRun);
        this.factory = SweepFactory.create(configPath, dryRun);
        this.dryRun = dryRun;
    }

    SweepApplication(SweepFactory factory, boolean dryRun) {
        this.factory = factory;
        this.dryRun = dryRun;
    }

    /**
     * Runs the sweep, or only logs its plan in dry-run mode.
     *
     * @return process exit code
     */
    public int run() {
        if (dryRun) {
            factory.getOrchestrator().dryRun();
            return 0;
        }
        return factory.getOrchestrator().run();
    }

    public SweepFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.isEmpty() || arguments.get(0).startsWith("--")) {
            log.error("Usage: SweepApplication <config.yaml> [{}]", DRY_RUN_FLAG);
            System.exit(2);
            return;
        }

        int exitCode;
        try (SweepApplication app = new SweepApplication(arguments.get(0), arguments.contains(DRY_RUN_FLAG))) {
            exitCode = app.run();
        } catch (SweepException e) {
            log.error("Fatal error: type={}, error={}", e.getErrorType(), e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            log.error("Fatal error", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
