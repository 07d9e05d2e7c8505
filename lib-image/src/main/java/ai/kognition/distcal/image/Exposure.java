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

import java.util.Arrays;

import ai.kognition.distcal.image.geometry.Vector2;

/**
 * <p>
 * One exposure of the calibration pattern: a single channel image held as a flat, row-major
 * {@code double} buffer together with its shape and the known translation (the shift) the pattern
 * was moved by for this exposure.
 * </p>
 *
 * <p>
 * The pixel buffer is NOT copied. Nothing in this library writes to it, and callers must not
 * modify it while a calibration run is reading it.
 * </p>
 */
public class Exposure {
    private final double[] pixels;
    private final int rows;
    private final int cols;
    private final Vector2 shift;

    public Exposure(final double[] pixels, final int rows, final int cols, final Vector2 shift) {
        if(pixels == null)
            throw new NullPointerException("Cannot pass a null pixel buffer to an " + Exposure.class.getSimpleName());
        if(shift == null)
            throw new NullPointerException("Cannot pass a null shift to an " + Exposure.class.getSimpleName());
        if(rows <= 0 || cols <= 0)
            throw new IllegalArgumentException("An " + Exposure.class.getSimpleName() + " must have a positive shape. You passed " + rows + " x " + cols);
        if((long)rows * cols != pixels.length)
            throw new IllegalArgumentException(
                "The pixel buffer for a " + rows + " x " + cols + " " + Exposure.class.getSimpleName() + " must have " + ((long)rows * cols)
                    + " elements but has " + pixels.length);

        this.pixels = pixels;
        this.rows = rows;
        this.cols = cols;
        this.shift = shift;
    }

    public Exposure(final double[] pixels, final int rows, final int cols) {
        this(pixels, rows, cols, Vector2.ZERO);
    }

    /**
     * The height of the image.
     */
    public int rows() {
        return rows;
    }

    /**
     * The width of the image.
     */
    public int cols() {
        return cols;
    }

    public Vector2 shift() {
        return shift;
    }

    public double get(final int row, final int col) {
        return pixels[(row * cols) + col];
    }

    public double[] copyPixels() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    @Override
    public String toString() {
        return String.format("Exposure[ %d x %d, xshift %.4f, yshift %.4f ]", rows, cols, shift.x, shift.y);
    }
}
