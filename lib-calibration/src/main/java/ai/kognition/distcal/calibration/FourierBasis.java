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
 * Separable products of cosines and sines over the extent. With {@code F} the maximum frequency
 * there are {@code 4 F^2} functions. For {@code index}, with {@code p = index / 4}:
 * </p>
 *
 * <pre>
 * fx = PI * ((p / F) mod F)
 * fy = PI * (p mod F)
 * x' = x / width, y' = y / height
 *
 * index mod 4 == 0 : cos(fx x') * cos(fy y')
 * index mod 4 == 1 : cos(fx x') * sin(fy y')
 * index mod 4 == 2 : sin(fx x') * cos(fy y')
 * index mod 4 == 3 : sin(fx x') * sin(fy y')
 * </pre>
 *
 * <p>
 * Any function with a zero frequency sine factor is identically zero and is reported as
 * {@link Term#ZERO}. The zero frequency cosine product is {@link Term#CONSTANT}.
 * </p>
 */
public class FourierBasis extends AbstractDistortionBasis {
    private final int maxFrequency;

    public FourierBasis(final int maxFrequency, final int width, final int height) {
        super(width, height, size(checkFrequency(maxFrequency)));
        this.maxFrequency = maxFrequency;
    }

    public int maxFrequency() {
        return maxFrequency;
    }

    public static int size(final int maxFrequency) {
        return 4 * maxFrequency * maxFrequency;
    }

    @Override
    public int size() {
        return size(maxFrequency);
    }

    private int xFrequency(final int index) {
        return ((index / 4) / maxFrequency) % maxFrequency;
    }

    private int yFrequency(final int index) {
        return (index / 4) % maxFrequency;
    }

    @Override
    public Term term(final int index) {
        checkIndex(index);
        final boolean xzero = xFrequency(index) == 0;
        final boolean yzero = yFrequency(index) == 0;
        switch(index % 4) {
            case 0:
                return (xzero && yzero) ? Term.CONSTANT : Term.VARYING;
            case 1:
                return yzero ? Term.ZERO : Term.VARYING;
            case 2:
                return xzero ? Term.ZERO : Term.VARYING;
            default:
                return (xzero || yzero) ? Term.ZERO : Term.VARYING;
        }
    }

    @Override
    public double sample(final Vector2 pos, final int index) {
        checkIndex(index);
        final double ax = Math.PI * xFrequency(index) * (pos.x / width);
        final double ay = Math.PI * yFrequency(index) * (pos.y / height);
        switch(index % 4) {
            case 0:
                return Math.cos(ax) * Math.cos(ay);
            case 1:
                return Math.cos(ax) * Math.sin(ay);
            case 2:
                return Math.sin(ax) * Math.cos(ay);
            default:
                return Math.sin(ax) * Math.sin(ay);
        }
    }

    private static int checkFrequency(final int maxFrequency) {
        if(maxFrequency < 1)
            throw new IllegalArgumentException("The maximum frequency of a " + FourierBasis.class.getSimpleName() + " must be at least 1. You passed " + maxFrequency);
        if(maxFrequency > 1000)
            throw new IllegalArgumentException("The maximum frequency of a " + FourierBasis.class.getSimpleName() + " can't exceed 1000. You passed " + maxFrequency);
        return maxFrequency;
    }

    @Override
    public String toString() {
        return "FourierBasis [maxFrequency=" + maxFrequency + ", width=" + width + ", height=" + height + "]";
    }
}
