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

/**
 * Messages and the channel abstraction that carry progress updates from producers to a
 * coordinator's single consumer loop.
 *
 * <p>{@link io.nosqlbench.progress.eventing.UpdateMessage} is the closed instruction set,
 * {@link io.nosqlbench.progress.eventing.WorkerMessage} tags it with a worker id, and
 * {@link io.nosqlbench.progress.eventing.UpdateChannel} is the ordered multi-producer,
 * single-consumer transport between them.
 */
package io.nosqlbench.progress.eventing;
