package org.neuralchilli.plexor.executor.container;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A single-container pod to run one task attempt.
 */
public record PodSpec(
        String name,
        String namespace,
        String image,
        List<String> command,
        Map<String, String> env,
        Map<String, String> labels,
        long activeDeadlineSeconds
) {

    public static final int MAX_NAME_LENGTH = 63;
    private static final Pattern DNS_1123_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");

    public PodSpec {
        if (name == null || name.length() > MAX_NAME_LENGTH || !DNS_1123_LABEL.matcher(name).matches()) {
            throw new IllegalArgumentException("Pod name is not a valid DNS-1123 label: " + name);
        }
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("Pod image cannot be null or empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Pod command cannot be null or empty");
        }
        if (activeDeadlineSeconds <= 0) {
            throw new IllegalArgumentException("Active deadline must be > 0");
        }
        command = List.copyOf(command);
        env = env != null ? Map.copyOf(env) : Map.of();
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public static boolean isValidName(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && DNS_1123_LABEL.matcher(name).matches();
    }
}
