/*
 * Copyright 2022 Jim Carroll
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

package ai.kognition.distcal.calibration;

import java.util.Arrays;

public enum FitMode {
    /**
     * Fit every measurement's displacement from its corrected position.
     */
    DIRECT("direct"),
    /**
     * Fit the change in displacement between every pair of exposures of the same point.
     * Constant terms can't be recovered this way and are left at zero.
     */
    DIFFERENTIAL("differential");

    public final String tag;

    private FitMode(final String tag) {
        this.tag = tag;
    }

    public static FitMode fromTag(final String tag) {
        if(tag != null) {
            for(final FitMode m: values()) {
                if(m.tag.equalsIgnoreCase(tag.trim()))
                    return m;
            }
        }
        throw new IllegalArgumentException("Unknown fit mode \"" + tag + "\". Must be one of " + Arrays.toString(values()));
    }
}
