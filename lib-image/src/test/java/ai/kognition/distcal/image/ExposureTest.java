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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.distcal.image.geometry.Vector2;

public class ExposureTest {

    @Test
    public void testRowMajorAccess() {
        final double[] data = new double[3 * 4];
        for(int i = 0; i < data.length; i++)
            data[i] = i;
        final Exposure exposure = new Exposure(data, 3, 4, new Vector2(1.0, -2.0));

        assertEquals(3, exposure.rows());
        assertEquals(4, exposure.cols());
        assertEquals(6.0, exposure.get(1, 2), 0.0);
        assertEquals(11.0, exposure.get(2, 3), 0.0);
        assertEquals(new Vector2(1.0, -2.0), exposure.shift());
        assertEquals(Vector2.ZERO, new Exposure(data, 4, 3).shift());
    }

    @Test
    public void testToString() {
        final Exposure moved = new Exposure(new double[] {1, 2, 3, 4}, 2, 2, new Vector2(5.0, 5.0));
        assertTrue(moved.toString().contains("xshift 5.0000"));
    }

    @Test
    public void testShapeMustMatchBuffer() {
        assertThrows(IllegalArgumentException.class, () -> new Exposure(new double[5], 2, 3));
        assertThrows(IllegalArgumentException.class, () -> new Exposure(new double[0], 0, 3));
        assertThrows(NullPointerException.class, () -> new Exposure(null, 2, 3));
        assertThrows(NullPointerException.class, () -> new Exposure(new double[6], 2, 3, null));
    }
}
