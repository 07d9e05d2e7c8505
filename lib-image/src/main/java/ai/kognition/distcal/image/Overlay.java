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

import java.util.HashSet;
import java.util.Set;

import ai.kognition.distcal.image.geometry.Grid;
import ai.kognition.distcal.image.geometry.Vector2;

/**
 * Draws the centroiding windows of a grid onto a copy of an exposure so the alignment of
 * the nominal grid with the imaged pattern can be checked by eye.
 */
public class Overlay {
    public static final int NTHETA = 1000;

    /**
     * Returns a copy of {@code exposure} with {@code value} added to every pixel on a circle of
     * {@code radius} around each grid point (shifted by the exposure's shift). Each pixel is
     * touched at most once per circle. The exposure passed in is not modified.
     */
    public static Exposure circles(final Exposure exposure, final Grid grid, final double radius, final double value) {
        final int rows = exposure.rows();
        final int cols = exposure.cols();
        final double[] data = exposure.copyPixels();

        final Set<Integer> circle = new HashSet<>();
        for(final Vector2 point: grid.enumerate(cols, rows)) {
            final Vector2 center = point.add(exposure.shift());
            circle.clear();
            for(int i = 0; i < NTHETA; i++) {
                final double theta = (2.0 * Math.PI * i) / NTHETA;
                final double x = Math.floor(center.x + (Math.cos(theta) * radius));
                final double y = Math.floor(center.y + (Math.sin(theta) * radius));
                if(x >= 0 && x < cols && y >= 0 && y < rows)
                    circle.add(((int)y * cols) + (int)x);
            }
            for(final int index: circle)
                data[index] += value;
        }

        return new Exposure(data, rows, cols, exposure.shift());
    }
}
