package io.warehousetwin.engine.scenario;

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

/// Thrown when a scenario runner cannot put its baseline configuration back
/// after a what-if run. The runner is no longer trustworthy once this happens.
public class ScenarioRestorationException extends RuntimeException {

    public ScenarioRestorationException(String message) {
        super(message);
    }
}
