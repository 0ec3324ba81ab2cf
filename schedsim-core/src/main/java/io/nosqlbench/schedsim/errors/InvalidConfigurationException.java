package io.nosqlbench.schedsim.errors;

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

/// Raised when a workload or scheduler configuration is rejected before any
/// simulation step runs. Nothing is partially constructed when this is thrown.
public class InvalidConfigurationException extends IllegalArgumentException {

    /// @param message description of the rejected input
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /// @param message description of the rejected input
    /// @param cause the underlying failure
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
