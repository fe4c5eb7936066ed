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

import io.vertx.core.Promise;
import org.querygate.common.utils.DurationSpec;

/**
 * Background work run repeatedly by the {@link PeriodicTaskExecutor}. A run starts only after the previous run
 * has completed its promise, so runs of the same task never overlap.
 */
public interface PeriodicTask
{
    /**
     * Runs the task once. The promise must be completed, successfully or not, or no further run is scheduled.
     *
     * @param promise completed when the run ends
     */
    void execute(Promise<Void> promise);

    /**
     * @return pause between the end of one run and the start of the next
     */
    DurationSpec delay();

    /**
     * @return pause before the first run; the regular {@link #delay()} unless overridden
     */
    default DurationSpec initialDelay()
    {
        return delay();
    }

    /**
     * Checked before every run. A skipped run still reschedules the next one.
     *
     * @return {@code true} to skip the upcoming run
     */
    default boolean shouldSkip()
    {
        return false;
    }

    /**
     * Releases whatever the task holds. Called once the task is unscheduled and its last run has finished.
     */
    default void close()
    {
    }

    /**
     * @return the name used in logs and to tell scheduled tasks apart
     */
    default String name()
    {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
