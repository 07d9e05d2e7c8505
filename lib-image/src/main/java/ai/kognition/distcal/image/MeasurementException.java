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

/**
 * Thrown when a point can't be measured, either because the window around it contains
 * no pixels inside the image or because the window contains no positive flux.
 */
public class MeasurementException extends RuntimeException {
    private static final long serialVersionUID = 4217309960411376250L;

    public MeasurementException() {}

    public MeasurementException(final String msg) {
        super(msg);
    }

    public MeasurementException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
