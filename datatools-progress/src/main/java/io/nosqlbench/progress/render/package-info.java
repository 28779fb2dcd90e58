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
 * The bundled {@link io.nosqlbench.progress.ProgressTracker} implementations and the renderers
 * that build them.
 *
 * <ul>
 *   <li>{@link io.nosqlbench.progress.render.AnsiProgressRenderer} - bars redrawn in place on a
 *       terminal, colored with JLine attributed strings</li>
 *   <li>{@link io.nosqlbench.progress.render.LoggingProgressRenderer} - progress milestones
 *       through Log4j, for headless runs</li>
 *   <li>{@link io.nosqlbench.progress.render.SilentProgressRenderer} - counting only</li>
 * </ul>
 *
 * <p>{@link io.nosqlbench.progress.render.ProgressRenderers#fromSystemProperty()} picks one from
 * the {@code nb.progress.display} system property.
 */
package io.nosqlbench.progress.render;
