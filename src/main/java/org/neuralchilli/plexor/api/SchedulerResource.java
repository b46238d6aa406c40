package org.neuralchilli.plexor.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.routing.ExecutorRegistry;

import java.util.List;

@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class SchedulerResource {

    @Inject
    ExecutorRegistry executorRegistry;

    @Inject
    SchedulerMetrics metrics;

    @GET
    @Path("/executors")
    public List<ExecutorResponse> executors() {
        return executorRegistry.all().stream()
                .map(ExecutorResponse::from)
                .toList();
    }

    @GET
    @Path("/metrics")
    public SchedulerMetrics.MetricsReport metrics() {
        return metrics.getReport();
    }
}
