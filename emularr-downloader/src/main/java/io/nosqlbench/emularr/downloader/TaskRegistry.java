package io.nosqlbench.emularr.downloader;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/// The set of known download tasks, keyed by task id.
///
/// One registry is created by the caller and handed to the {@link TransferController}; any
/// number of readers may query it concurrently.
public class TaskRegistry {

    private final Map<String, DownloadTask> tasks = new ConcurrentHashMap<>();

    void register(DownloadTask task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalStateException("Task " + task.id() + " is already registered");
        }
    }

    DownloadTask get(String id) {
        return id == null ? null : tasks.get(id);
    }

    boolean remove(String id, DownloadTask task) {
        return tasks.remove(id, task);
    }

    Collection<DownloadTask> tasks() {
        return tasks.values();
    }

    /// @param id a task id
    /// @return a snapshot of the task, or null if no such task is registered
    public TaskSnapshot snapshot(String id) {
        DownloadTask task = get(id);
        return task == null ? null : task.snapshot();
    }

    /// @return snapshots of all tasks, oldest first
    public List<TaskSnapshot> snapshots() {
        return tasks.values().stream()
            .map(DownloadTask::snapshot)
            .sorted(Comparator.comparing(TaskSnapshot::createdAt).thenComparing(TaskSnapshot::id))
            .collect(Collectors.toList());
    }

    /// @return ids of tasks that are downloading or paused
    public Set<String> activeIds() {
        return tasks.values().stream()
            .filter(t -> t.status().isActive())
            .map(DownloadTask::id)
            .collect(Collectors.toSet());
    }

    /// @param id a task id
    /// @return true if the task is registered
    public boolean contains(String id) {
        return id != null && tasks.containsKey(id);
    }

    /// @return the number of registered tasks
    public int size() {
        return tasks.size();
    }
}
