package com.example.taskhub.scheduler.task;

import java.util.List;

/**
 * Static table of task definitions handed to the registry at startup.
 */
public interface TaskDefinitionProvider {

    List<TaskDescriptor> taskDefinitions();
}
