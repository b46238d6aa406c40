package org.neuralchilli.plexor.routing;

import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.FakeExecutorAdapter;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskQueueRouterTest {

    private final FakeExecutorAdapter celery = new FakeExecutorAdapter("celery");
    private final FakeExecutorAdapter k8s = new FakeExecutorAdapter("k8s", ExecutorType.CONTAINER);
    private final ExecutorRegistry registry = new ExecutorRegistry(List.of(celery, k8s));

    @Test
    void shouldRouteQueuesToAdapters() {
        TaskQueueRouter router = new TaskQueueRouter(
                new RoutingTable(List.of(new RoutingRule("gpu-*", "k8s")), "celery"), registry);

        assertThat(router.route("gpu-small")).isSameAs(k8s);
        assertThat(router.route("default")).isSameAs(celery);
        assertThat(router.canRoute("anything")).isTrue();
    }

    @Test
    void shouldFailForUnroutableQueue() {
        TaskQueueRouter router = new TaskQueueRouter(
                new RoutingTable(List.of(new RoutingRule("etl", "celery")), null), registry);

        assertThat(router.canRoute("reports")).isFalse();
        assertThatThrownBy(() -> router.route("reports"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("reports");
    }

    @Test
    void shouldRejectRulesNamingUnknownExecutors() {
        assertThatThrownBy(() -> new TaskQueueRouter(
                new RoutingTable(List.of(new RoutingRule("etl", "airflow")), null), registry))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("airflow");

        assertThatThrownBy(() -> new TaskQueueRouter(new RoutingTable(List.of(), "nomad"), registry))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nomad");
    }

    @Test
    void shouldRejectDuplicateExecutorNames() {
        assertThatThrownBy(() -> new ExecutorRegistry(List.of(celery, new FakeExecutorAdapter("celery"))))
                .isInstanceOf(ConfigurationException.class);
    }
}
