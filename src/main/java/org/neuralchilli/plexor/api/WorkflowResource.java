package org.neuralchilli.plexor.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.service.WorkflowService;

import java.net.URI;
import java.util.Comparator;
import java.util.List;

@Path("/api/workflows")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WorkflowResource {

    @Inject
    WorkflowService workflowService;

    @GET
    public List<WorkflowResponse> list() {
        return workflowService.workflows().stream()
                .sorted(Comparator.comparing(workflow -> workflow.name()))
                .map(WorkflowResponse::from)
                .toList();
    }

    @GET
    @Path("/{name}")
    public WorkflowResponse get(@PathParam("name") String name) {
        return WorkflowResponse.from(workflowService.getWorkflow(name));
    }

    @POST
    @Path("/{name}/runs")
    public Response trigger(@PathParam("name") String name, TriggerRequest request) {
        TriggerRequest body = request != null ? request : new TriggerRequest(null, null);
        String triggeredBy = body.triggeredBy() != null ? body.triggeredBy() : "api";

        WorkflowRun run = workflowService.trigger(name, body.params(), triggeredBy);
        return Response.created(URI.create("/api/runs/" + run.id()))
                .entity(RunResponse.from(run))
                .build();
    }
}
