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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

import ai.kognition.distcal.image.geometry.Vector2;

public class CentroiderTest {

    private static Exposure blank(final int rows, final int cols) {
        return new Exposure(new double[rows * cols], rows, cols);
    }

    private static Exposure withSources(final int rows, final int cols, final double[]... xyv) {
        final double[] data = new double[rows * cols];
        for(final double[] s: xyv)
            data[((int)s[1] * cols) + (int)s[0]] += s[2];
        return new Exposure(data, rows, cols);
    }

    @Test
    public void testSinglePointSourceIsExact() {
        final Exposure exposure = withSources(64, 48, new double[] {17, 33, 1.0});

        for(int r = 0; r <= 6; r++) {
            final Centroid c = new Centroider(r).centroid(exposure, new Vector2(17, 33));
            assertEquals(17.0, c.cog.x, 0.0);
            assertEquals(33.0, c.cog.y, 0.0);
            assertEquals(1.0, c.flux, 0.0);
            assertEquals(new Vector2(17, 33), c.getPos());
        }
    }

    @Test
    public void testWindowIsAnchoredOnContainingPixel() {
        final Exposure exposure = withSources(32, 32, new double[] {10, 12, 5.0});

        // (10.9, 12.7) is inside pixel (10, 12) so a zero radius window still sees the source
        final Centroid c = new Centroider(0).centroid(exposure, new Vector2(10.9, 12.7));
        assertEquals(new Vector2(10.0, 12.0), c.cog);
        assertEquals(5.0, c.flux, 0.0);
        assertEquals(new Vector2(10.9, 12.7), c.getPos());
    }

    @Test
    public void testWindowIsCircular() {
        // (3, 3) from the center is outside a radius 4 circle (18 > 16) but (4, 0) is on it
        final Exposure exposure = withSources(32, 32, new double[] {13, 13, 100.0}, new double[] {14, 10, 2.0}, new double[] {10, 10, 1.0});

        final Centroid c = new Centroider(4).centroid(exposure, new Vector2(10, 10));
        assertEquals(3.0, c.flux, 0.0);
        assertEquals((14.0 * 2.0 + 10.0) / 3.0, c.cog.x, 1e-12);
        assertEquals(10.0, c.cog.y, 1e-12);
    }

    @Test
    public void testFluxWeightedMean() {
        final Exposure exposure = withSources(20, 20, new double[] {8, 9, 1.0}, new double[] {11, 9, 3.0}, new double[] {10, 12, 4.0});

        final Centroid c = new Centroider(5).centroid(exposure, new Vector2(10, 10));
        assertEquals(8.0, c.flux, 1e-12);
        assertEquals((8.0 * 1.0 + 11.0 * 3.0 + 10.0 * 4.0) / 8.0, c.cog.x, 1e-12);
        assertEquals((9.0 * 1.0 + 9.0 * 3.0 + 12.0 * 4.0) / 8.0, c.cog.y, 1e-12);
    }

    @Test
    public void testFluxIsAdditiveOverDisjointWindows() {
        final Exposure exposure = withSources(64, 64, new double[] {20, 30, 7.0}, new double[] {21, 31, 1.0}, new double[] {40, 30, 3.0},
            new double[] {39, 28, 2.5});

        final Centroid left = new Centroider(4).centroid(exposure, new Vector2(20, 30));
        final Centroid right = new Centroider(4).centroid(exposure, new Vector2(40, 30));
        // one window covering both of the smaller ones and nothing else that's lit
        final Centroid both = new Centroider(15).centroid(exposure, new Vector2(30, 30));

        assertEquals(8.0, left.flux, 1e-12);
        assertEquals(5.5, right.flux, 1e-12);
        assertEquals(left.flux + right.flux, both.flux, 1e-12);
        assertEquals((left.cog.x * left.flux + right.cog.x * right.flux) / both.flux, both.cog.x, 1e-12);
        assertEquals((left.cog.y * left.flux + right.cog.y * right.flux) / both.flux, both.cog.y, 1e-12);
    }

    @Test
    public void testClippedAtImageEdge() {
        final Exposure exposure = withSources(16, 16, new double[] {0, 0, 2.0}, new double[] {1, 0, 2.0}, new double[] {15, 15, 9.0});

        final Centroid c = new Centroider(3).centroid(exposure, new Vector2(0.2, 0.2));
        assertEquals(4.0, c.flux, 0.0);
        assertEquals(new Vector2(0.5, 0.0), c.cog);

        final Centroid corner = new Centroider(2).centroid(exposure, new Vector2(16.5, 16.5));
        assertEquals(9.0, corner.flux, 0.0);
        assertEquals(new Vector2(15.0, 15.0), corner.cog);
    }

    @Test
    public void testZeroFluxIsAnError() {
        final Exposure exposure = blank(16, 16);
        assertThrows(MeasurementException.class, () -> new Centroider(3).centroid(exposure, new Vector2(8, 8)));
    }

    @Test
    public void testNegativeAndNaNFluxAreErrors() {
        final Exposure negative = withSources(16, 16, new double[] {8, 8, -1.0});
        assertThrows(MeasurementException.class, () -> new Centroider(3).centroid(negative, new Vector2(8, 8)));

        final Exposure nan = withSources(16, 16, new double[] {8, 8, 1.0}, new double[] {9, 8, Double.NaN});
        assertThrows(MeasurementException.class, () -> new Centroider(3).centroid(nan, new Vector2(8, 8)));
    }

    @Test
    public void testEmptyWindowIsAnError() {
        final Exposure exposure = withSources(16, 16, new double[] {8, 8, 1.0});
        assertThrows(MeasurementException.class, () -> new Centroider(3).centroid(exposure, new Vector2(-10, 8)));
        assertThrows(MeasurementException.class, () -> new Centroider(3).centroid(exposure, new Vector2(8, 100)));
    }

    @Test
    public void testBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Centroider(-1));
        assertThrows(IllegalArgumentException.class, () -> new Centroider(2).centroid(blank(4, 4), new Vector2(Double.NaN, 1)));
    }

    @Test(timeout = 10000L)
    public void testHugeRadiusCoversTheImage() {
        final Exposure exposure = withSources(20, 30, new double[] {0, 0, 1.0}, new double[] {29, 19, 3.0});

        final Centroid c = new Centroider(Integer.MAX_VALUE).centroid(exposure, new Vector2(10.0, 10.0));
        assertEquals(4.0, c.flux, 0.0);
        assertEquals((29.0 * 3.0) / 4.0, c.cog.x, 1.0E-12);
        assertEquals((19.0 * 3.0) / 4.0, c.cog.y, 1.0E-12);

        // still clipped when the center is far outside of the image
        final Centroid far = new Centroider(Integer.MAX_VALUE).centroid(exposure, new Vector2(-1.0E9, 5.0E8));
        assertEquals(4.0, far.flux, 0.0);
        assertThrows(MeasurementException.class, () -> new Centroider(Integer.MAX_VALUE).centroid(exposure, new Vector2(-1.0E300, 0.0)));
    }

    @Test
    public void testMeasureIsCentroid() {
        final Exposure exposure = withSources(16, 16, new double[] {5, 6, 3.0});
        final PointMeasurer measurer = new Centroider(2);

        final Centroid c = measurer.measure(exposure, new Vector2(5, 6));
        assertEquals(new Vector2(5, 6), c.cog);
        assertSame(c.getPos(), c.getPos());
        assertEquals(Vector2.ZERO, c.displacement());
    }
}
