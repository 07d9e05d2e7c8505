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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import ai.kognition.distcal.calibration.DistortionBasis.Term;
import ai.kognition.distcal.image.geometry.Vector2;

public class PolynomialBasisTest {

    @Test
    public void testSize() {
        assertEquals(2, new PolynomialBasis(1, 10, 10).size());
        assertEquals(5, new PolynomialBasis(2, 10, 10).size());
        assertEquals(9, new PolynomialBasis(3, 10, 10).size());
        assertEquals(14, new PolynomialBasis(4, 10, 10).size());
        assertEquals(9, new PolynomialBasis(3, 10, 10).getCoefficients().size());
    }

    @Test
    public void testMonomialOrder() {
        final PolynomialBasis basis = new PolynomialBasis(3, 200, 100);
        // normalizes to x' = 0.5, y' = -0.5
        final Vector2 pos = new Vector2(150.0, 25.0);
        final double[] expected = {
            -0.5, // y
            0.5, // x
            0.25, // y^2
            -0.25, // x y
            0.25, // x^2
            -0.125, // y^3
            0.125, // x y^2
            -0.125, // x^2 y
            0.125 // x^3
        };
        for(int i = 0; i < expected.length; i++)
            assertEquals("index " + i, expected[i], basis.sample(pos, i), 1.0E-15);
    }

    @Test
    public void testCenterIsZero() {
        final PolynomialBasis basis = new PolynomialBasis(4, 64, 48);
        for(int i = 0; i < basis.size(); i++) {
            assertEquals(0.0, basis.sample(new Vector2(32.0, 24.0), i), 0.0);
            assertEquals(Term.VARYING, basis.term(i));
        }
    }

    @Test
    public void testTotalDegree() {
        for(int t = 1; t < 200000; t++) {
            final int n = PolynomialBasis.totalDegree(t);
            assertTrue((n * (n + 1)) / 2 <= t);
            assertTrue(((n + 1) * (n + 2)) / 2 > t);
        }
    }

    @Test
    public void testEval() {
        final PolynomialBasis basis = new PolynomialBasis(1, 100, 100);
        basis.setCoefficients(Arrays.asList(new Vector2(1.0, 2.0), new Vector2(-3.0, 0.5)));

        // x' = 0.2, y' = -0.4
        final Vector2 v = basis.eval(new Vector2(60.0, 30.0));
        assertEquals((1.0 * -0.4) + (-3.0 * 0.2), v.x, 1.0E-14);
        assertEquals((2.0 * -0.4) + (0.5 * 0.2), v.y, 1.0E-14);

        assertEquals(Vector2.ZERO, new PolynomialBasis(3, 100, 100).eval(new Vector2(3.0, 90.0)));
    }

    @Test
    public void testCoefficientRoundTrip() {
        final PolynomialBasis basis = new PolynomialBasis(2, 100, 80);
        final List<Vector2> coeffs = new ArrayList<>();
        for(int i = 0; i < basis.size(); i++)
            coeffs.add(new Vector2(i * 0.1, -i * 1.0E-3));
        basis.setCoefficients(coeffs);

        final double[][] saved = basis.saveCoefficients();
        assertEquals(5, saved.length);
        assertArrayEquals(new double[] {coeffs.get(4).x,coeffs.get(4).y}, saved[4], 0.0);

        final PolynomialBasis other = new PolynomialBasis(2, 100, 80);
        other.loadCoefficients(saved);
        assertEquals(coeffs, other.getCoefficients());
        assertEquals(basis.eval(new Vector2(17.0, 61.0)), other.eval(new Vector2(17.0, 61.0)));
    }

    @Test
    public void testCoefficientPreconditions() {
        final PolynomialBasis basis = new PolynomialBasis(2, 100, 80);
        assertThrows(PreconditionException.class, () -> basis.loadCoefficients(new double[4][2]));
        assertThrows(PreconditionException.class, () -> basis.loadCoefficients(new double[][] {{0,0},{0,0},{0,0,0},{0,0},{0,0}}));
        assertThrows(PreconditionException.class, () -> basis.setCoefficients(Arrays.asList(Vector2.ZERO)));
        assertThrows(UnsupportedOperationException.class, () -> basis.getCoefficients().set(0, Vector2.ZERO));

        // nothing was changed by the failed loads
        for(final Vector2 c: basis.getCoefficients())
            assertEquals(Vector2.ZERO, c);
    }

    @Test
    public void testBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PolynomialBasis(0, 100, 100));
        assertThrows(IllegalArgumentException.class, () -> new PolynomialBasis(2, 0, 100));
        final PolynomialBasis basis = new PolynomialBasis(2, 100, 100);
        assertThrows(IndexOutOfBoundsException.class, () -> basis.sample(Vector2.ZERO, -1));
        assertThrows(IndexOutOfBoundsException.class, () -> basis.sample(Vector2.ZERO, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> basis.term(5));
    }
}
