package cn.bitsleep.taskrush;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskRushApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskRushApplication.class, args);
    }

}
