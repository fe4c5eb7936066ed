/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.querygate.tasks;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.querygate.concurrent.TaskExecutorPool;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Schedules {@link PeriodicTask}s on a {@link TaskExecutorPool}. Runs of one task never overlap: the next run is
 * scheduled only once the previous one has completed its promise.
 */
public class PeriodicTaskExecutor
{
    private static final Logger LOGGER = LoggerFactory.getLogger(PeriodicTaskExecutor.class);

    private final Map<String, Long> timerIds = new ConcurrentHashMap<>();
    private final Map<String, Future<Void>> activeRuns = new ConcurrentHashMap<>();
    private final Set<String> unscheduled = ConcurrentHashMap.newKeySet();
    private final TaskExecutorPool pool;

    public PeriodicTaskExecutor(TaskExecutorPool pool)
    {
        this.pool = pool;
    }

    /**
     * Schedules the {@code task} iff it has not been scheduled yet
     *
     * @param task the task to execute
     */
    public void schedule(PeriodicTask task)
    {
        String key = key(task);
        if (timerIds.containsKey(key))
        {
            LOGGER.debug("Task is already scheduled. task='{}'", key);
            return;
        }
        unscheduled.remove(key);
        scheduleNext(task, task.initialDelay().to(TimeUnit.MILLISECONDS), 0);
    }

    /**
     * Stops further runs of {@code task} and closes it once an active run, if any, completes
     *
     * @param task the task to unschedule
     * @return a future completed when the task is closed
     */
    public Future<Void> unschedule(PeriodicTask task)
    {
        String key = key(task);
        Long timerId = timerIds.remove(key);
        if (timerId == null)
        {
            return Future.failedFuture("No such PeriodicTask: " + key);
        }

        LOGGER.debug("Unscheduling task. task='{}' timerId={}", key, timerId);
        unscheduled.add(key);
        pool.cancelTimer(timerId);
        Promise<Void> closed = Promise.promise();
        activeRuns.getOrDefault(key, Future.succeededFuture())
                  .onComplete(ignored -> {
                      task.close();
                      closed.complete();
                  });
        return closed.future();
    }

    public void close()
    {
        timerIds.values().forEach(pool::cancelTimer);
        timerIds.clear();
    }

    private void scheduleNext(PeriodicTask task, long delayMillis, long execCount)
    {
        String key = key(task);
        if (unscheduled.contains(key))
        {
            return;
        }
        LOGGER.debug("Scheduling task in {} milliseconds. task='{}' execCount={}", delayMillis, key, execCount);
        // vert.x timers need a delay of at least one millisecond
        long timerId = pool.setTimer(Math.max(1, delayMillis), id -> executeAndScheduleNext(task, execCount));
        timerIds.put(key, timerId);
    }

    private void executeAndScheduleNext(PeriodicTask task, long execCount)
    {
        String key = key(task);
        Promise<Void> runPromise = Promise.promise();
        activeRuns.put(key, runPromise.future());
        pool.runBlocking(() -> executeInternal(task, runPromise, execCount))
            .onFailure(runPromise::tryFail);

        runPromise.future().onComplete(result -> {
            activeRuns.remove(key);
            if (result.failed())
            {
                LOGGER.warn("Periodic task run failed. task='{}' execCount={}", key, execCount, result.cause());
            }
            scheduleNext(task, task.delay().to(TimeUnit.MILLISECONDS), execCount + 1);
        });
    }

    private void executeInternal(PeriodicTask task, Promise<Void> promise, long execCount)
    {
        if (task.shouldSkip())
        {
            LOGGER.trace("Skip executing task. task='{}' execCount={}", task.name(), execCount);
            promise.tryComplete();
            return;
        }

        try
        {
            LOGGER.debug("Executing task. task='{}' execCount={}", task.name(), execCount);
            task.execute(promise);
        }
        catch (Throwable throwable)
        {
            promise.tryFail(throwable);
        }
    }

    private static String key(PeriodicTask task)
    {
        return task.getClass().getCanonicalName() + task.name();
    }

    @VisibleForTesting
    Map<String, Long> timerIds()
    {
        return timerIds;
    }
}
