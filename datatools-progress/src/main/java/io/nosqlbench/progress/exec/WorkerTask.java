/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.exec;

import io.nosqlbench.progress.WorkerHandle;

/**
 * A unit of work that reports its own progress through the handle it is given.
 */
@FunctionalInterface
public interface WorkerTask {

    /**
     * @param handle the progress handle of the worker running this task
     * @throws Exception if the work fails; the worker's bar is cancelled
     */
    void run(WorkerHandle handle) throws Exception;
}
