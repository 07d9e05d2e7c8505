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

package ai.kognition.distcal.image.geometry;

/**
 * The layout of the points in a calibration pattern.
 */
public enum GridPattern {
    HEX("hex");

    public final String tag;

    private GridPattern(final String tag) {
        this.tag = tag;
    }

    public static GridPattern fromTag(final String tag) {
        for(final GridPattern p: values()) {
            if(p.tag.equalsIgnoreCase(tag.trim()))
                return p;
        }
        throw new GeometryException("Unknown grid pattern \"" + tag + "\"");
    }
}
