package cn.bitsleep.taskrush.service;

import cn.bitsleep.taskrush.domain.Priority;
import cn.bitsleep.taskrush.domain.Task;
import cn.bitsleep.taskrush.domain.TaskStatus;
import cn.bitsleep.taskrush.repo.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository repo;
    private final TaskFieldValidator validator;
    private final UrgencyCalculator urgency;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Task> list(String owner) {
        return repo.findByOwnerOrderByCreatedAtDescIdDesc(owner);
    }

    @Transactional
    public Task create(String owner, NewTask fields) {
        String title = validator.title(fields.getTitle());
        Priority priority = validator.priority(fields.getPriority());
        double estimateHrs = validator.estimateHrs(fields.getEstimateHrs());
        Instant deadline = validator.deadline(fields.getDeadline());
        TaskStatus status = validator.statusOrDefault(fields.getStatus());

        Instant now = clock.instant();
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .owner(owner)
                .title(title)
                .priority(priority)
                .estimateHrs(estimateHrs)
                .deadline(deadline)
                .notes(fields.getNotes() == null ? "" : fields.getNotes())
                .important(Boolean.TRUE.equals(fields.getImportant()))
                .status(status)
                .urgencyScore(urgency.computeUrgency(priority, deadline, now))
                .createdAt(now)
                .build();
        Task saved = repo.save(task);
        log.info("Created task {} for owner {} (urgency {})", saved.getId(), owner, saved.getUrgencyScore());
        return saved;
    }

    @Transactional
    public Task update(String owner, String taskId, TaskPatch patch) {
        Task task = loadOwned(owner, taskId);

        // validate every supplied field before touching the entity
        FieldPatch<String> title = patch.getTitle().map(validator::title);
        FieldPatch<Priority> priority = patch.getPriority().map(validator::priority);
        FieldPatch<Double> estimateHrs = patch.getEstimateHrs().map(validator::estimateHrs);
        FieldPatch<Instant> deadline = patch.getDeadline().map(validator::deadline);
        FieldPatch<TaskStatus> status = patch.getStatus().map(validator::status);
        FieldPatch<String> notes = patch.getNotes().map(n -> n == null ? "" : n);
        FieldPatch<Boolean> important = patch.getImportant().map(Boolean.TRUE::equals);

        title.ifPresent(task::setTitle);
        priority.ifPresent(task::setPriority);
        estimateHrs.ifPresent(task::setEstimateHrs);
        deadline.ifPresent(task::setDeadline);
        status.ifPresent(task::setStatus);
        notes.ifPresent(task::setNotes);
        important.ifPresent(task::setImportant);

        // always recomputed: the deadline draws nearer even when nothing scored changed
        task.setUrgencyScore(urgency.computeUrgency(task.getPriority(), task.getDeadline(), clock.instant()));
        Task saved = repo.save(task);
        log.info("Updated task {} for owner {} (urgency {})", taskId, owner, saved.getUrgencyScore());
        return saved;
    }

    @Transactional
    public void delete(String owner, String taskId) {
        Task task = loadOwned(owner, taskId);
        repo.delete(task);
        log.info("Deleted task {} for owner {}", taskId, owner);
    }

    private Task loadOwned(String owner, String taskId) {
        Task task = repo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (!task.isOwnedBy(owner)) {
            log.warn("Owner {} denied access to task {}", owner, taskId);
            throw new ForbiddenException(taskId);
        }
        return task;
    }
}
