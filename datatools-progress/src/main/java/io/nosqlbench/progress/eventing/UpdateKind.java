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

package io.nosqlbench.progress.eventing;

/**
 * The closed set of operations a producer can request on a progress bar.
 *
 * <p>Every consumer loop switches over all of these values. Adding a value here means
 * revisiting each of those switches.
 *
 * @see UpdateMessage
 */
public enum UpdateKind {
    /** Advance the bar by one unit. */
    NEXT,
    /** Set the bar's count to an absolute value, clamped to its total by the consumer. */
    SET_VALUE,
    /** Drive the bar to its total and stop. */
    FINISH,
    /** Stop the bar where it is. */
    CANCEL,
    /** Change the bar's description or color without touching its count. */
    RESTYLE
}
