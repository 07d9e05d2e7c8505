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
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.distcal.calibration.DistortionBasis.Term;
import ai.kognition.distcal.image.Centroid;
import ai.kognition.distcal.image.geometry.Vector2;
import ai.kognition.distcal.nr.LinalgException;
import ai.kognition.distcal.nr.NormalEquations;

/**
 * <p>
 * Fits the coefficients of a {@link DistortionBasis} to measured displacements by linear least squares.
 * </p>
 *
 * <p>
 * Only the basis functions that can be observed take part in the solve. Functions that are
 * identically zero (and, for the differential fit, constant functions) are left out of the
 * design matrix and their coefficients are set to zero.
 * </p>
 */
public class LeastSquaresFitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LeastSquaresFitter.class);

    private final NormalEquations solver;

    public LeastSquaresFitter(final double tolerance) {
        this.solver = new NormalEquations(tolerance);
    }

    public LeastSquaresFitter() {
        this(NormalEquations.DEFAULT_TOLERANCE);
    }

    public double tolerance() {
        return solver.tolerance();
    }

    /**
     * Solve for the coefficients that best map each measurement's {@code pos} onto its
     * {@code cog}, that is minimize the sum over measurements of
     * {@code |cog - pos - eval(pos)|^2}. The coefficients are written into {@code basis}
     * which is returned.
     *
     * @throws LinalgException if there are fewer measurements than observable basis functions or
     *     the measurement positions can't distinguish between the basis functions.
     */
    public <T extends DistortionBasis> T solve(final T basis, final List<Centroid> measurements) throws LinalgException {
        if(basis == null || measurements == null)
            throw new NullPointerException("Cannot fit a null basis or null measurements");

        final int[] active = active(basis, false);
        final int n = measurements.size();
        if(n == 0)
            throw new LinalgException("Cannot fit " + basis + " without any measurements.");
        if(n < active.length)
            throw new LinalgException("Cannot fit the " + active.length + " observable functions of " + basis + " with only " + n + " measurements.");

        final double[][] f = new double[n][active.length];
        final double[][] b = new double[n][];
        for(int r = 0; r < n; r++) {
            final Centroid c = measurements.get(r);
            final Vector2 pos = c.getPos();
            final Vector2 d = c.displacement();
            b[r] = new double[] {d.x,d.y};
            for(int i = 0; i < active.length; i++)
                f[r][i] = basis.sample(pos, active[i]);
        }

        return assign(basis, active, solver.solve(f, b));
    }

    /**
     * <p>
     * Solve using only the differences between exposures of the same point. Each element of
     * {@code perPoint} holds one point's measurements, one per exposure. For every pair of
     * exposures {@code j < k} of a point the equation is
     * </p>
     *
     * <pre>
     * (cog_k - cog_j) - (pos_k - pos_j) = sum over i of coefficient(i) * (sample(pos_k, i) - sample(pos_j, i))
     * </pre>
     *
     * <p>
     * Because only differences are used any error common to all exposures of a point (such as an
     * error in the position of that pinhole in the mask) drops out.
     * </p>
     *
     * @throws LinalgException if there are fewer exposure pairs than observable basis functions or
     *     the pairs can't distinguish between the basis functions.
     */
    public <T extends DistortionBasis> T solveDifferential(final T basis, final List<List<Centroid>> perPoint) throws LinalgException {
        if(basis == null || perPoint == null)
            throw new NullPointerException("Cannot fit a null basis or null measurements");

        final int[] active = active(basis, true);
        final List<double[]> f = new ArrayList<>();
        final List<double[]> b = new ArrayList<>();
        for(final List<Centroid> point: perPoint) {
            final int count = point.size();
            final double[][] samples = new double[count][active.length];
            for(int e = 0; e < count; e++) {
                final Vector2 pos = point.get(e).getPos();
                for(int i = 0; i < active.length; i++)
                    samples[e][i] = basis.sample(pos, active[i]);
            }

            for(int j = 0; j < count; j++) {
                for(int k = j + 1; k < count; k++) {
                    final Vector2 dd = point.get(k).displacement().subtract(point.get(j).displacement());
                    b.add(new double[] {dd.x,dd.y});
                    final double[] row = new double[active.length];
                    for(int i = 0; i < active.length; i++)
                        row[i] = samples[k][i] - samples[j][i];
                    f.add(row);
                }
            }
        }

        if(f.isEmpty())
            throw new LinalgException("Cannot fit " + basis + " differentially without at least one point measured in two exposures.");
        if(f.size() < active.length)
            throw new LinalgException(
                "Cannot fit the " + active.length + " observable functions of " + basis + " with only " + f.size() + " exposure pairs.");

        return assign(basis, active, solver.solve(f.toArray(new double[0][]), b.toArray(new double[0][])));
    }

    private static int[] active(final DistortionBasis basis, final boolean differential) {
        final int size = basis.size();
        final int[] ret = new int[size];
        int count = 0;
        for(int i = 0; i < size; i++) {
            final Term t = basis.term(i);
            if(t == Term.ZERO || (differential && t == Term.CONSTANT))
                continue;
            ret[count++] = i;
        }
        if(count == 0)
            throw new LinalgException(basis + " has no basis functions that can be fit" + (differential ? " differentially." : "."));
        return Arrays.copyOf(ret, count);
    }

    private static <T extends DistortionBasis> T assign(final T basis, final int[] active, final NormalEquations.Solution solution) {
        final List<Vector2> coeffs = new ArrayList<>(basis.size());
        for(int i = 0; i < basis.size(); i++)
            coeffs.add(Vector2.ZERO);
        for(int i = 0; i < active.length; i++)
            coeffs.set(active[i], new Vector2(solution.coefficients[i][0], solution.coefficients[i][1]));
        basis.setCoefficients(coeffs);
        LOGGER.debug("Fit {} of the {} functions of {} (reciprocal condition number {})", active.length, basis.size(), basis, solution.rcond);
        return basis;
    }
}
