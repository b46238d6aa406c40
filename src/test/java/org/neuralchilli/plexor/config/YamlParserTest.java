package org.neuralchilli.plexor.config;

import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.routing.ExecutorTopology;
import org.neuralchilli.plexor.routing.ExecutorType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlParserTest {

    private final YamlParser parser = new YamlParser();

    @Test
    void shouldParseWorkflow() {
        String yaml = """
                name: nightly
                description: Nightly batch
                params:
                  region: eu
                  limit: 10
                env:
                  HOME_DIR: /data
                tasks:
                  - name: extract
                    command: python
                    args: [extract.py, "${params.region}"]
                    queue: etl
                    retries: 2
                    retry_delay: 30s
                    timeout: 5m
                  - name: train
                    command: train.sh
                    queue: gpu-large
                    image: trainer:1.2
                    timeout: 2h
                    env:
                      EPOCHS: 3
                    depends_on: [extract]
                """;

        Workflow workflow = parser.parseWorkflow(yaml);

        assertThat(workflow.name()).isEqualTo("nightly");
        assertThat(workflow.params()).containsEntry("region", "eu").containsEntry("limit", 10);
        assertThat(workflow.env()).containsEntry("HOME_DIR", "/data");

        TaskDefinition extract = workflow.task("extract").orElseThrow();
        assertThat(extract.args()).containsExactly("extract.py", "${params.region}");
        assertThat(extract.retries()).isEqualTo(2);
        assertThat(extract.retryDelaySeconds()).isEqualTo(30);
        assertThat(extract.timeoutSeconds()).isEqualTo(300);

        TaskDefinition train = workflow.task("train").orElseThrow();
        assertThat(train.image()).isEqualTo("trainer:1.2");
        assertThat(train.timeoutSeconds()).isEqualTo(7200);
        assertThat(train.env()).containsEntry("EPOCHS", "3");
        assertThat(train.dependsOn()).containsExactly("extract");
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> parser.parseWorkflow("""
                name: broken
                tasks:
                  - name: a
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("command");

        assertThatThrownBy(() -> parser.parseWorkflow("name: empty\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one task");
    }

    @Test
    void shouldRejectBadDuration() {
        assertThatThrownBy(() -> parser.parseWorkflow("""
                name: bad
                tasks:
                  - name: a
                    command: echo
                    timeout: soon
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout");
    }

    @Test
    void shouldParseTopology() {
        String yaml = """
                executors:
                  - name: celery
                    type: queue
                    options:
                      workers: 4
                  - name: k8s
                    type: container
                    options:
                      max-pods: 20
                      default-image: alpine:3.20
                routing:
                  default: celery
                  rules:
                    - queue: gpu-*
                      executor: k8s
                """;

        ExecutorTopology topology = parser.parseTopology(yaml);

        assertThat(topology.executors()).hasSize(2);
        assertThat(topology.executors().get(0).type()).isEqualTo(ExecutorType.QUEUE);
        assertThat(topology.executors().get(0).intOption("workers", 1)).isEqualTo(4);
        assertThat(topology.executors().get(1).stringOption("default-image", null)).isEqualTo("alpine:3.20");
        assertThat(topology.routing().resolve("gpu-small")).contains("k8s");
        assertThat(topology.routing().resolve("etl")).contains("celery");
    }

    @Test
    void shouldRejectUnknownExecutorType() {
        assertThatThrownBy(() -> parser.parseTopology("""
                executors:
                  - name: x
                    type: lambda
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lambda");
    }
}
