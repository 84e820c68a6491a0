package io.nosqlbench.regimes.config;

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

/// Thrown when a [DetectorConfig] is built with parameters the engine cannot use.
public class InvalidConfigurationException extends IllegalArgumentException {

    private final String parameter;

    public InvalidConfigurationException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    /// @return the name of the offending parameter
    public String getParameter() {
        return parameter;
    }
}
