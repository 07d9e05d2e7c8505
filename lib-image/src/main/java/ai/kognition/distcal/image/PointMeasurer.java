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

package ai.kognition.distcal.image;

import ai.kognition.distcal.image.geometry.Vector2;

/**
 * Measures the calibration point expected at {@code point} in the given exposure. Implementations
 * must be safe to call concurrently on the same exposure.
 */
@FunctionalInterface
public interface PointMeasurer {

    /**
     * @throws MeasurementException if there's nothing measurable at {@code point}.
     */
    public Centroid measure(Exposure exposure, Vector2 point);

}
