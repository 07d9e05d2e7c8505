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

/**
 * Thrown when coefficients handed to a {@link DistortionBasis} don't fit it: the wrong number of
 * them, or a row that isn't an {@code (x, y)} pair.
 */
public class PreconditionException extends RuntimeException {
    private static final long serialVersionUID = 7351938455096417726L;

    public PreconditionException() {}

    public PreconditionException(final String msg) {
        super(msg);
    }

    public PreconditionException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
