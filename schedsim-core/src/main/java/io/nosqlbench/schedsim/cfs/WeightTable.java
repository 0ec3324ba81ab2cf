package io.nosqlbench.schedsim.cfs;

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

import io.nosqlbench.schedsim.errors.NiceOutOfRangeException;

/// Maps a nice value to its CFS load weight.
///
/// The table is the classic kernel one: nice 0 maps to [#NICE_0_WEIGHT], and each
/// step of nice changes the weight by roughly 1.25x, so that a process one nice
/// level lower gets about 10% more CPU than its neighbour. The values are strictly
/// decreasing across the whole range.
///
/// The table is a constant; instances are never needed.
public final class WeightTable {

    /// The most favorable nice value.
    public static final int MIN_NICE = -20;

    /// The least favorable nice value.
    public static final int MAX_NICE = 19;

    /// Weight of a nice 0 process, the unit in which virtual runtime is accounted.
    public static final int NICE_0_WEIGHT = 1024;

    private static final int[] WEIGHTS = {
        /* -20 */ 88761, 71755, 56483, 46273, 36291,
        /* -15 */ 29154, 23254, 18705, 14949, 11916,
        /* -10 */  9548,  7620,  6100,  4904,  3906,
        /*  -5 */  3121,  2501,  1991,  1586,  1277,
        /*   0 */  1024,   820,   655,   526,   423,
        /*   5 */   335,   272,   215,   172,   137,
        /*  10 */   110,    87,    70,    56,    45,
        /*  15 */    36,    29,    23,    18,    15,
    };

    private WeightTable() {
    }

    /// Looks up the scheduling weight of a nice value.
    ///
    /// @param nice a value in [MIN_NICE, MAX_NICE]
    /// @return the positive weight for that nice value
    /// @throws NiceOutOfRangeException if nice is outside of the supported range
    public static int weightOf(int nice) {
        if (!isValidNice(nice)) {
            throw new NiceOutOfRangeException(nice, MIN_NICE, MAX_NICE);
        }
        return WEIGHTS[nice - MIN_NICE];
    }

    /// @param nice the value to check
    /// @return true if nice is within [MIN_NICE, MAX_NICE]
    public static boolean isValidNice(int nice) {
        return nice >= MIN_NICE && nice <= MAX_NICE;
    }
}
