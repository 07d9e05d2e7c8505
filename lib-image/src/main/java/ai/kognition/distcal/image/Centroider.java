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
 * <p>
 * Computes the flux weighted center of gravity of the pixels in a circular window.
 * </p>
 *
 * <p>
 * The window is anchored on the pixel containing the requested point, that is
 * {@code (floor(x), floor(y))}. Every pixel at an integer offset {@code (dx, dy)} from the
 * anchor with {@code dx*dx + dy*dy <= radius*radius} is included unless it falls outside of
 * the image. Then:
 * </p>
 *
 * <pre>
 * flux = sum(v)
 * cog  = ( sum(col * v) / flux, sum(row * v) / flux )
 * </pre>
 */
public class Centroider implements PointMeasurer {
    private final int radius;

    public Centroider(final int radius) {
        if(radius < 0)
            throw new IllegalArgumentException("The radius of a " + Centroider.class.getSimpleName() + " can't be negative. You passed " + radius);
        this.radius = radius;
    }

    public int radius() {
        return radius;
    }

    /**
     * @throws MeasurementException if the window contains no pixels from the image or the
     *     summed flux isn't strictly positive.
     */
    public Centroid centroid(final Exposure exposure, final Vector2 point) {
        if(!point.isFinite())
            throw new IllegalArgumentException("Cannot centroid around the non-finite point " + point);

        final int rows = exposure.rows();
        final int cols = exposure.cols();
        final double xc = Math.floor(point.x);
        final double yc = Math.floor(point.y);
        final long rad2 = (long)radius * radius;

        // only the part of the window that overlaps the image is visited
        final long xlo = (long)Math.max(xc - radius, 0.0);
        final long xhi = (long)Math.min(xc + radius, cols - 1.0);
        final long ylo = (long)Math.max(yc - radius, 0.0);
        final long yhi = (long)Math.min(yc + radius, rows - 1.0);

        double sumx = 0.0;
        double sumy = 0.0;
        double flux = 0.0;
        int count = 0;
        for(long px = xlo; px <= xhi; px++) {
            final long dx = px - (long)xc;
            for(long py = ylo; py <= yhi; py++) {
                final long dy = py - (long)yc;
                if((dx * dx) + (dy * dy) > rad2)
                    continue;

                final double val = exposure.get((int)py, (int)px);
                sumx += px * val;
                sumy += py * val;
                flux += val;
                count++;
            }
        }

        if(count == 0)
            throw new MeasurementException("The window of radius " + radius + " around " + point + " contains no pixels of the " + exposure);
        if(!(flux > 0.0))
            throw new MeasurementException("The window of radius " + radius + " around " + point + " has a non-positive flux of " + flux);

        return new Centroid(new Vector2(sumx / flux, sumy / flux), flux, point);
    }

    @Override
    public Centroid measure(final Exposure exposure, final Vector2 point) {
        return centroid(exposure, point);
    }
}
