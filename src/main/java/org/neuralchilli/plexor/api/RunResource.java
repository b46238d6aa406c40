package org.neuralchilli.plexor.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.neuralchilli.plexor.service.WorkflowService;

import java.util.List;
import java.util.UUID;

@Path("/api/runs")
@Produces(MediaType.APPLICATION_JSON)
public class RunResource {

    @Inject
    WorkflowService workflowService;

    /**
     * Runs that are still running or paused
     */
    @GET
    public List<RunResponse> active() {
        return workflowService.activeRuns().stream()
                .map(RunResponse::from)
                .toList();
    }

    @GET
    @Path("/{id}")
    public RunDetailResponse get(@PathParam("id") UUID id) {
        RunResponse run = RunResponse.from(workflowService.getRun(id));
        List<TaskResponse> tasks = workflowService.tasksOf(id).stream()
                .map(TaskResponse::from)
                .toList();
        return new RunDetailResponse(run, tasks);
    }

    @GET
    @Path("/{id}/tasks/{task}/attempts")
    public List<TaskResponse> attempts(@PathParam("id") UUID id, @PathParam("task") String task) {
        return workflowService.attemptHistory(id, task).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @POST
    @Path("/{id}/cancel")
    public RunResponse cancel(@PathParam("id") UUID id) {
        workflowService.cancelRun(id);
        return RunResponse.from(workflowService.getRun(id));
    }

    @POST
    @Path("/{id}/pause")
    public RunResponse pause(@PathParam("id") UUID id) {
        return RunResponse.from(workflowService.pauseRun(id));
    }

    @POST
    @Path("/{id}/resume")
    public RunResponse resume(@PathParam("id") UUID id) {
        return RunResponse.from(workflowService.resumeRun(id));
    }

    @POST
    @Path("/{id}/tasks/{task}/cancel")
    public TaskResponse cancelTask(@PathParam("id") UUID id, @PathParam("task") String task) {
        return TaskResponse.from(workflowService.cancelTask(id, task));
    }
}
