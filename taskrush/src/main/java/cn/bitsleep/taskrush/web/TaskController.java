package cn.bitsleep.taskrush.web;

import cn.bitsleep.taskrush.domain.Task;
import cn.bitsleep.taskrush.service.FieldPatch;
import cn.bitsleep.taskrush.service.NewTask;
import cn.bitsleep.taskrush.service.TaskPatch;
import cn.bitsleep.taskrush.service.TaskService;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService service;
    private final ZoneId deadlineZone;

    public TaskController(TaskService service, @Value("${taskrush.urgency.deadline-zone:UTC}") String deadlineZone) {
        this.service = service;
        this.deadlineZone = ZoneId.of(deadlineZone);
    }

    private String owner(Authentication authentication) {
        if (authentication == null || authentication.getName() == null || authentication.getName().isBlank()) {
            throw new AuthenticationCredentialsNotFoundException("Authentication required");
        }
        return authentication.getName();
    }

    @GetMapping
    public List<TaskView> list(Authentication authentication) {
        return service.list(owner(authentication)).stream().map(this::view).toList();
    }

    @PostMapping
    public ResponseEntity<TaskView> create(Authentication authentication, @RequestBody CreateTask req) {
        Task task = service.create(owner(authentication), req.toNewTask());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(task));
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public TaskView update(Authentication authentication,
                           @PathVariable String id,
                           @RequestBody UpdateTask req) {
        return view(service.update(owner(authentication), id, req.toPatch()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(Authentication authentication, @PathVariable String id) {
        service.delete(owner(authentication), id);
        return ResponseEntity.ok(Map.of("id", id));
    }

    private TaskView view(Task task) {
        return TaskView.from(task, deadlineZone);
    }

    @Data
    public static class CreateTask {
        public String title;
        public String priority;
        public Double estimateHrs;
        public String deadline;
        public String notes;
        public Boolean important;
        public String status;

        NewTask toNewTask() {
            return NewTask.builder()
                    .title(title)
                    .priority(priority)
                    .estimateHrs(estimateHrs)
                    .deadline(deadline)
                    .notes(notes)
                    .important(important)
                    .status(status)
                    .build();
        }
    }

    /**
     * Jackson only calls a setter for keys present in the body, explicit nulls included,
     * so untouched fields stay {@link FieldPatch#absent()}.
     */
    public static class UpdateTask {
        private FieldPatch<String> title = FieldPatch.absent();
        private FieldPatch<String> priority = FieldPatch.absent();
        private FieldPatch<Double> estimateHrs = FieldPatch.absent();
        private FieldPatch<String> deadline = FieldPatch.absent();
        private FieldPatch<String> notes = FieldPatch.absent();
        private FieldPatch<Boolean> important = FieldPatch.absent();
        private FieldPatch<String> status = FieldPatch.absent();

        public void setTitle(String title) { this.title = FieldPatch.of(title); }
        public void setPriority(String priority) { this.priority = FieldPatch.of(priority); }
        public void setEstimateHrs(Double estimateHrs) { this.estimateHrs = FieldPatch.of(estimateHrs); }
        public void setDeadline(String deadline) { this.deadline = FieldPatch.of(deadline); }
        public void setNotes(String notes) { this.notes = FieldPatch.of(notes); }
        public void setImportant(Boolean important) { this.important = FieldPatch.of(important); }
        public void setStatus(String status) { this.status = FieldPatch.of(status); }

        TaskPatch toPatch() {
            return TaskPatch.builder()
                    .title(title)
                    .priority(priority)
                    .estimateHrs(estimateHrs)
                    .deadline(deadline)
                    .notes(notes)
                    .important(important)
                    .status(status)
                    .build();
        }
    }
}
