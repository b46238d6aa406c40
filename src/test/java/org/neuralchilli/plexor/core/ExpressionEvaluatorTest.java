package org.neuralchilli.plexor.core;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.domain.TaskAttemptId;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class ExpressionEvaluatorTest {

    @Inject
    ExpressionEvaluator evaluator;

    @Test
    void shouldReturnNonExpressionAsIs() {
        assertThat(evaluator.evaluate("hello world", ExpressionContext.empty())).isEqualTo("hello world");
        assertThat(evaluator.evaluate(null, ExpressionContext.empty())).isNull();
    }

    @Test
    void shouldEvaluateParams() {
        ExpressionContext ctx = ExpressionContext.withParams(Map.of("region", "us", "batch", 50));

        assertThat(evaluator.evaluate("${params.region}", ctx)).isEqualTo("us");
        assertThat(evaluator.evaluate("${params.batch * 2}", ctx)).isEqualTo("100");
    }

    @Test
    void shouldInterpolateAroundExpressions() {
        ExpressionContext ctx = ExpressionContext.withParams(Map.of("region", "eu"));

        assertThat(evaluator.evaluate("s3://bucket/${params.region}/data.csv", ctx))
                .isEqualTo("s3://bucket/eu/data.csv");
    }

    @Test
    void shouldExposeRunIdentity() {
        UUID runId = UUID.randomUUID();
        ExpressionContext ctx = ExpressionContext.forAttempt(
                "nightly", new TaskAttemptId(runId, "load", 2), Map.of(), Map.of("HOME_DIR", "/data"));

        assertThat(evaluator.evaluate("${run.workflow}/${run.task}#${run.attempt}", ctx)).isEqualTo("nightly/load#2");
        assertThat(evaluator.evaluate("${run.id}", ctx)).isEqualTo(runId.toString());
        assertThat(evaluator.evaluate("${env.HOME_DIR}/out", ctx)).isEqualTo("/data/out");
    }

    @Test
    void shouldRenderMissingValuesAsEmpty() {
        assertThat(evaluator.evaluate("[${params.missing}]", ExpressionContext.empty())).isEqualTo("[]");
    }

    @Test
    void shouldRenderListsAndMaps() {
        ExpressionContext ctx = ExpressionContext.withParams(Map.of("n", 3));

        assertThat(evaluator.evaluateList(List.of("--count", "${params.n}"), ctx)).containsExactly("--count", "3");
        assertThat(evaluator.evaluateMap(Map.of("COUNT", "${params.n + 1}"), ctx)).containsEntry("COUNT", "4");
    }

    @Test
    void shouldWrapEvaluationErrors() {
        assertThatThrownBy(() -> evaluator.evaluate("${this is not valid}", ExpressionContext.empty()))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("Failed to evaluate expression");
        assertThatThrownBy(() -> evaluator.evaluate("x ${ {a} y", ExpressionContext.empty()))
                .isInstanceOf(ExpressionException.class)
                .hasMessageStartingWith("Unclosed expression");
    }

    @Test
    void shouldValidateWithoutEvaluating() {
        assertThat(evaluator.isValid("plain")).isTrue();
        assertThat(evaluator.isValid("${params.a} and ${date.today()}")).isTrue();
        assertThat(evaluator.getValidationError("${params.a")).isNull();
        assertThat(evaluator.getValidationError("x ${params.a} ${this is not valid}")).isNotNull();
        assertThat(evaluator.getValidationError("${ {a} ")).startsWith("Unclosed expression");
    }

    @Test
    void shouldCallDateFunctions() {
        Clock clock = Clock.fixed(Instant.parse("2025-02-27T12:00:00Z"), ZoneOffset.UTC);
        ExpressionEvaluator fixed = new ExpressionEvaluator(new DateFunctions(clock));

        assertThat(fixed.evaluate("${date.today()}", ExpressionContext.empty())).isEqualTo("2025-02-27");
        assertThat(fixed.evaluate("${date.add(date.today(), 3, 'days')}", ExpressionContext.empty()))
                .isEqualTo("2025-03-02");
        assertThat(fixed.evaluate("${date.format('2025-01-05', 'yyyyMMdd')}", ExpressionContext.empty()))
                .isEqualTo("20250105");
        assertThat(fixed.evaluate("${date.daysBetween('2025-01-01', '2025-01-31')}", ExpressionContext.empty()))
                .isEqualTo("30");
    }
}
