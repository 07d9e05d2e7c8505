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

/**
 * The basis families that can be fit, selected by name in the configuration ({@code basis.kind}).
 */
public enum BasisKind {
    /**
     * {@code param} is the maximum total degree.
     */
    POLYNOMIAL("polynomial") {
        @Override
        public DistortionBasis create(final int param, final int width, final int height) {
            return new PolynomialBasis(param, width, height);
        }
    },
    /**
     * {@code param} is the maximum frequency.
     */
    FOURIER("fourier") {
        @Override
        public DistortionBasis create(final int param, final int width, final int height) {
            return new FourierBasis(param, width, height);
        }
    };

    public final String tag;

    private BasisKind(final String tag) {
        this.tag = tag;
    }

    /**
     * A new basis of this kind with all coefficients zero.
     */
    public abstract DistortionBasis create(int param, int width, int height);

    public static BasisKind fromTag(final String tag) {
        if(tag != null) {
            for(final BasisKind k: values()) {
                if(k.tag.equalsIgnoreCase(tag.trim()))
                    return k;
            }
        }
        throw new IllegalArgumentException("Unknown basis kind \"" + tag + "\". Must be one of " + Arrays.toString(values()));
    }
}
