package pl.faktulove.ocr.statusservice.resources;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import pl.faktulove.ocr.exceptions.FieldValidationException;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.statusservice.dto.QueueStatisticsResponse;
import pl.faktulove.ocr.statusservice.dto.TaskStatusResponse;
import pl.faktulove.ocr.statusservice.services.StatusService;
import pl.faktulove.ocr.taskqueue.services.TaskCommandService;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@JBossLog
@Tag(name = "ocr-tasks")
@Path("/ocr/tasks")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TaskStatusResource {

    @Inject
    StatusService statusService;

    @Inject
    TaskCommandService taskCommandService;

    @Inject
    UserContext userContext;

    @GET
    @Operation(summary = "Get the status of several tasks at once")
    public List<TaskStatusResponse> bulk(@QueryParam("ids") String ids) {
        String caller = userContext.currentCaller();
        log.infof("GET /ocr/tasks?ids=%s by user %s", ids, caller);
        if (ids == null || ids.isBlank()) {
            throw new FieldValidationException(Map.of("ids", "At least one task id is required"));
        }
        List<String> taskIds = Arrays.stream(ids.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        return statusService.getStatuses(taskIds, caller);
    }

    @GET
    @Path("/statistics")
    @Operation(summary = "Queue depth and task counts per state")
    public QueueStatisticsResponse statistics() {
        log.infof("GET /ocr/tasks/statistics by user %s", userContext.currentCaller());
        return statusService.getStatistics();
    }

    @GET
    @Path("/{taskId}")
    @Operation(summary = "Get state, progress and ETA of a task")
    public TaskStatusResponse status(@PathParam("taskId") String taskId) {
        String caller = userContext.currentCaller();
        log.debugf("GET /ocr/tasks/%s by user %s", taskId, caller);
        return statusService.getStatus(taskId, caller);
    }

    @DELETE
    @Path("/{taskId}")
    @Operation(summary = "Cancel a pending or running task")
    public TaskStatusResponse cancel(@PathParam("taskId") String taskId) {
        String caller = userContext.currentCaller();
        log.infof("DELETE /ocr/tasks/%s by user %s", taskId, caller);
        taskCommandService.cancel(taskId, caller);
        return statusService.getStatus(taskId, caller);
    }
}
