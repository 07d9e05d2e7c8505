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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ai.kognition.distcal.image.geometry.Vector2;

/**
 * Coefficient storage and the image extent shared by the basis implementations.
 */
public abstract class AbstractDistortionBasis implements DistortionBasis {
    protected final int width;
    protected final int height;
    private List<Vector2> coefficients;

    protected AbstractDistortionBasis(final int width, final int height, final int size) {
        if(width <= 0 || height <= 0)
            throw new IllegalArgumentException("The extent of a " + getClass().getSimpleName() + " must be positive. You passed " + width + " x " + height);
        this.width = width;
        this.height = height;
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(size, Vector2.ZERO)));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    protected void checkIndex(final int index) {
        if(index < 0 || index >= size())
            throw new IndexOutOfBoundsException("Basis function " + index + " doesn't exist in " + this + " which has " + size());
    }

    @Override
    public List<Vector2> getCoefficients() {
        return coefficients;
    }

    @Override
    public void setCoefficients(final List<Vector2> coefficients) {
        if(coefficients == null)
            throw new NullPointerException("Cannot set null coefficients on " + this);
        if(coefficients.size() != size())
            throw new PreconditionException("Expected " + size() + " coefficients for " + this + " but got " + coefficients.size());
        for(final Vector2 c: coefficients) {
            if(c == null)
                throw new PreconditionException("Cannot set a null coefficient on " + this);
        }
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(coefficients));
    }

    @Override
    public double[][] saveCoefficients() {
        final double[][] ret = new double[coefficients.size()][];
        for(int i = 0; i < ret.length; i++) {
            final Vector2 c = coefficients.get(i);
            ret[i] = new double[] {c.x,c.y};
        }
        return ret;
    }

    @Override
    public void loadCoefficients(final double[][] saved) {
        if(saved == null)
            throw new NullPointerException("Cannot load null coefficients into " + this);
        if(saved.length != size())
            throw new PreconditionException("Expected " + size() + " coefficients for " + this + " but got " + saved.length);
        final List<Vector2> coeffs = new ArrayList<>(saved.length);
        for(int i = 0; i < saved.length; i++) {
            if(saved[i] == null || saved[i].length != 2)
                throw new PreconditionException("Coefficient " + i + " must be an (x, y) pair but has "
                    + (saved[i] == null ? "no" : Integer.toString(saved[i].length)) + " elements");
            coeffs.add(new Vector2(saved[i][0], saved[i][1]));
        }
        this.coefficients = Collections.unmodifiableList(coeffs);
    }
}
