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

package ai.kognition.distcal.nr;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import Jama.Matrix;
import Jama.QRDecomposition;

/**
 * <p>
 * Solves the linear least squares problem {@code min |F C - B|^2} where {@code F} is the N x M
 * design matrix and {@code B} is N x K (one column per right hand side).
 * </p>
 *
 * <p>
 * The reciprocal condition number (smallest over largest singular value) of the M x M Gram matrix
 * {@code F' F} of the normal equations is checked first and the solve is refused with a
 * {@link LinalgException} when it is at or below the tolerance (or {@code M} machine epsilons,
 * whichever is larger). The accepted problem is then solved with a Householder QR decomposition of
 * {@code F} itself, so the error in the coefficients grows with {@code 1 / sqrt(rcond)} rather than
 * {@code 1 / rcond}. A degenerate problem never produces a result.
 * </p>
 *
 * <p>
 * For example, fitting {@code y = m x + b} through three points:
 * </p>
 *
 * <pre>
 * <code>
 * final double[][] f = {{0, 1},{1, 1},{2, 1}};
 * final double[][] b = {{1},{3},{5}};
 * final double[][] mb = new NormalEquations().solve(f, b).coefficients; // {{2},{1}}
 * </code>
 * </pre>
 */
public class NormalEquations {
    private static final Logger LOGGER = LoggerFactory.getLogger(NormalEquations.class);

    public static final double DEFAULT_TOLERANCE = 1.0e-15;

    private final double tolerance;

    public NormalEquations(final double tolerance) {
        if(!(tolerance >= 0.0) || tolerance >= 1.0)
            throw new IllegalArgumentException("The reciprocal condition tolerance must be in [0, 1). You passed " + tolerance);
        this.tolerance = tolerance;
    }

    public NormalEquations() {
        this(DEFAULT_TOLERANCE);
    }

    public double tolerance() {
        return tolerance;
    }

    public static class Solution {
        /**
         * M x K, one row per unknown.
         */
        public final double[][] coefficients;

        /**
         * Reciprocal condition number of the Gram matrix that was solved.
         */
        public final double rcond;

        private Solution(final double[][] coefficients, final double rcond) {
            this.coefficients = coefficients;
            this.rcond = rcond;
        }

        @Override
        public String toString() {
            return "[ rcond: " + rcond + ", coefficients: " + Arrays.deepToString(coefficients) + "]";
        }
    }

    public static Solution solve(final double[][] design, final double[][] rhs, final double tolerance) throws LinalgException {
        return new NormalEquations(tolerance).solve(design, rhs);
    }

    /**
     * @param design
     *     the N x M design matrix, one row per equation.
     * @param rhs
     *     the N x K right hand sides.
     *
     * @throws LinalgException
     *     if there are fewer equations than unknowns or the Gram matrix is singular or
     *     ill-conditioned.
     */
    public Solution solve(final double[][] design, final double[][] rhs) throws LinalgException {
        if(design == null || rhs == null)
            throw new NullPointerException("Cannot pass a null design matrix or right hand side to " + NormalEquations.class.getSimpleName());
        if(design.length != rhs.length)
            throw new IllegalArgumentException("The design matrix has " + design.length + " rows but the right hand side has " + rhs.length);

        final int n = design.length;
        if(n == 0)
            throw new LinalgException("Cannot solve a least squares problem with no equations.");
        final int m = design[0].length;
        final int k = rhs[0].length;
        if(m == 0 || k == 0)
            throw new IllegalArgumentException("The design matrix (" + n + " x " + m + ") and right hand side (" + n + " x " + k + ") can't be empty.");
        for(int i = 0; i < n; i++) {
            if(design[i].length != m || rhs[i].length != k)
                throw new IllegalArgumentException("Row " + i + " of the design matrix or right hand side has the wrong number of columns.");
        }

        if(n < m)
            throw new LinalgException("The least squares problem is underdetermined: " + n + " equations for " + m + " unknowns.");

        final double[][] gram = new double[m][m];
        for(int r = 0; r < n; r++) {
            final double[] row = design[r];
            for(int i = 0; i < m; i++) {
                final double fi = row[i];
                for(int j = i; j < m; j++)
                    gram[i][j] += fi * row[j];
            }
        }
        for(int i = 0; i < m; i++) {
            for(int j = 0; j < i; j++)
                gram[i][j] = gram[j][i];
        }

        final Matrix g = new Matrix(gram);
        final double rcond = reciprocalCondition(g);
        final double limit = Math.max(tolerance, m * Math.ulp(1.0));
        LOGGER.debug("Gram matrix is {} x {} with a reciprocal condition number of {}", m, m, rcond);
        if(!(rcond > limit))
            throw new LinalgException("The Gram matrix of the design is singular or ill-conditioned (reciprocal condition number " + rcond
                + " is not above " + limit + ")");

        final QRDecomposition qr = new Matrix(design).qr();
        if(!qr.isFullRank())
            throw new LinalgException("The design matrix isn't of full column rank.");

        final double[][] solved = qr.solve(new Matrix(rhs)).getArray();
        for(final double[] row: solved) {
            for(final double v: row) {
                if(!Double.isFinite(v))
                    throw new LinalgException("The least squares solution contains the non-finite value " + v);
            }
        }
        return new Solution(solved, rcond);
    }

    private static double reciprocalCondition(final Matrix gram) {
        for(final double[] row: gram.getArray()) {
            for(final double v: row) {
                if(!Double.isFinite(v))
                    return Double.NaN;
            }
        }
        final double[] s = gram.svd().getSingularValues();
        final double max = s[0];
        final double min = s[s.length - 1];
        return max > 0.0 ? min / max : 0.0;
    }
}
