package fr.lapetina.inference.sweep.infrastructure.process;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to start a process on a machine.
 *
 * @param node            target machine
 * @param command         program and arguments
 * @param outputFile      file receiving stdout and stderr
 * @param environment     variables added to the inherited environment
 * @param containerImage  container image, null to run on the host
 * @param containerMounts host path to container path
 */
public record LaunchSpec(
        String node,
        List<String> command,
        Path outputFile,
        Map<String, String> environment,
        String containerImage,
        Map<Path, Path> containerMounts
) {
    public LaunchSpec {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(outputFile, "outputFile is required");
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        containerMounts = Collections.unmodifiableMap(new LinkedHashMap<>(containerMounts));
    }
}
