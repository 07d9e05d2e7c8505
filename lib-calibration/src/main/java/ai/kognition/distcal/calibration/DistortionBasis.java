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

import java.util.List;

import ai.kognition.distcal.image.geometry.Vector2;

/**
 * <p>
 * A family of {@code M} scalar functions of image position together with one 2D coefficient per
 * function. The modeled distortion at a position is
 * </p>
 *
 * <pre>
 * eval(pos) = sum over i of coefficient(i) * sample(pos, i)
 * </pre>
 *
 * <p>
 * Coefficients start at zero, have a fixed count for the life of the instance and are only
 * ever replaced as a whole.
 * </p>
 */
public interface DistortionBasis {

    /**
     * The structural kind of a basis function, independent of the coefficients.
     */
    public static enum Term {
        /**
         * Depends on position.
         */
        VARYING,
        /**
         * Has the same non-zero value everywhere. A uniform translation.
         */
        CONSTANT,
        /**
         * Is zero everywhere so its coefficient can't be measured.
         */
        ZERO
    }

    /**
     * The number of basis functions, {@code M}.
     */
    public int size();

    /**
     * The value of basis function {@code index} at {@code pos}.
     *
     * @throws IndexOutOfBoundsException if {@code index} isn't in {@code [0, size())}
     */
    public double sample(Vector2 pos, int index);

    public Term term(int index);

    public List<Vector2> getCoefficients();

    /**
     * @throws PreconditionException if {@code coefficients.size() != size()}
     */
    public void setCoefficients(List<Vector2> coefficients);

    /**
     * The coefficients as an {@code M x 2} array.
     */
    public double[][] saveCoefficients();

    /**
     * @throws PreconditionException if there aren't exactly {@code size()} rows or any row isn't a
     *     pair.
     */
    public void loadCoefficients(double[][] coefficients);

    public default Vector2 eval(final Vector2 pos) {
        final List<Vector2> coeffs = getCoefficients();
        double x = 0.0;
        double y = 0.0;
        for(int i = 0; i < coeffs.size(); i++) {
            final Vector2 c = coeffs.get(i);
            final double s = sample(pos, i);
            x += c.x * s;
            y += c.y * s;
        }
        return new Vector2(x, y);
    }
}
