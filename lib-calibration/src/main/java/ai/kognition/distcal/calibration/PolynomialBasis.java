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

import ai.kognition.distcal.image.geometry.Vector2;

/**
 * <p>
 * Bivariate monomials {@code x^k * y^(n - k)} for every total degree {@code 1 <= n <= degree} and
 * {@code 0 <= k <= n}. The constant term is left out, giving {@code (degree+1)(degree+2)/2 - 1}
 * functions ordered by {@code n} then {@code k}.
 * </p>
 *
 * <p>
 * Positions are normalized to roughly {@code [-1, 1]} about the center of the extent before
 * evaluating:
 * </p>
 *
 * <pre>
 * x' = (x - width / 2) / (width / 2)
 * y' = (y - height / 2) / (height / 2)
 * </pre>
 */
public class PolynomialBasis extends AbstractDistortionBasis {
    private final int degree;
    private final double halfWidth;
    private final double halfHeight;

    public PolynomialBasis(final int degree, final int width, final int height) {
        super(width, height, size(checkDegree(degree)));
        this.degree = degree;
        this.halfWidth = width / 2.0;
        this.halfHeight = height / 2.0;
    }

    public int degree() {
        return degree;
    }

    /**
     * The number of functions for a polynomial basis of the given degree.
     */
    public static int size(final int degree) {
        return (((degree + 1) * (degree + 2)) / 2) - 1;
    }

    @Override
    public int size() {
        return size(degree);
    }

    @Override
    public Term term(final int index) {
        checkIndex(index);
        return Term.VARYING;
    }

    @Override
    public double sample(final Vector2 pos, final int index) {
        checkIndex(index);
        final int t = index + 1;
        final int n = totalDegree(t);
        final int k = t - ((n * (n + 1)) / 2);
        final double x = (pos.x - halfWidth) / halfWidth;
        final double y = (pos.y - halfHeight) / halfHeight;
        return Math.pow(x, k) * Math.pow(y, n - k);
    }

    /**
     * The largest {@code n} with {@code n(n+1)/2 <= t}.
     */
    static int totalDegree(final int t) {
        int n = (int)Math.floor((-1.0 + Math.sqrt(1.0 + (8.0 * t))) / 2.0);
        // sqrt can land a hair on the wrong side of a perfect square
        while(((n * (n + 1)) / 2) > t)
            n--;
        while((((n + 1) * (n + 2)) / 2) <= t)
            n++;
        return n;
    }

    private static int checkDegree(final int degree) {
        if(degree < 1)
            throw new IllegalArgumentException("The degree of a " + PolynomialBasis.class.getSimpleName() + " must be at least 1. You passed " + degree);
        if(degree > 1000)
            throw new IllegalArgumentException("The degree of a " + PolynomialBasis.class.getSimpleName() + " can't exceed 1000. You passed " + degree);
        return degree;
    }

    @Override
    public String toString() {
        return "PolynomialBasis [degree=" + degree + ", width=" + width + ", height=" + height + "]";
    }
}
