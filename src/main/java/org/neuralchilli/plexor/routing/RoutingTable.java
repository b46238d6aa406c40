package org.neuralchilli.plexor.routing;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static queue-to-executor table. Exact rules beat prefix rules, a longer
 * prefix beats a shorter one, and the default executor catches the rest.
 */
public final class RoutingTable {

    private final List<RoutingRule> rules;
    private final Map<String, String> exact;
    private final List<RoutingRule> prefixes;
    private final String defaultExecutor;

    public RoutingTable(List<RoutingRule> rules, String defaultExecutor) {
        this.rules = rules != null ? List.copyOf(rules) : List.of();
        this.defaultExecutor = defaultExecutor != null && !defaultExecutor.isBlank() ? defaultExecutor : null;

        Map<String, String> exactRules = new HashMap<>();
        for (RoutingRule rule : this.rules) {
            if (rule.isPrefix()) {
                continue;
            }
            String previous = exactRules.putIfAbsent(rule.queuePattern(), rule.executor());
            if (previous != null && !previous.equals(rule.executor())) {
                throw new IllegalArgumentException(
                        "Queue " + rule.queuePattern() + " is routed to both " + previous + " and " + rule.executor());
            }
        }
        this.exact = Map.copyOf(exactRules);
        this.prefixes = this.rules.stream()
                .filter(RoutingRule::isPrefix)
                .sorted(Comparator.comparingInt((RoutingRule r) -> r.prefix().length()).reversed())
                .toList();
    }

    public static RoutingTable empty() {
        return new RoutingTable(List.of(), null);
    }

    /**
     * Resolve the executor name for a queue
     */
    public Optional<String> resolve(String queue) {
        String direct = exact.get(queue);
        if (direct != null) {
            return Optional.of(direct);
        }
        for (RoutingRule rule : prefixes) {
            if (rule.matches(queue)) {
                return Optional.of(rule.executor());
            }
        }
        return Optional.ofNullable(defaultExecutor);
    }

    public List<RoutingRule> rules() {
        return rules;
    }

    public Optional<String> defaultExecutor() {
        return Optional.ofNullable(defaultExecutor);
    }

    @Override
    public String toString() {
        return "RoutingTable[rules=" + rules + ", default=" + defaultExecutor + "]";
    }
}
