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

/// A nice value outside of the supported range was supplied.
public class NiceOutOfRangeException extends InvalidConfigurationException {

    private final int nice;

    /// @param nice the rejected value
    /// @param min the smallest supported nice value
    /// @param max the largest supported nice value
    public NiceOutOfRangeException(int nice, int min, int max) {
        super("nice value " + nice + " is outside of the supported range [" + min + ", " + max + "]");
        this.nice = nice;
    }

    /// @return the rejected nice value
    public int getNice() {
        return nice;
    }
}
