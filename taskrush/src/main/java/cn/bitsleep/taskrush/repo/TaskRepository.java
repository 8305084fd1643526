package cn.bitsleep.taskrush.repo;

import cn.bitsleep.taskrush.domain.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskRepository extends JpaRepository<Task, String> {

    // newest first; id breaks ties between tasks created in the same instant
    List<Task> findByOwnerOrderByCreatedAtDescIdDesc(String owner);
}
