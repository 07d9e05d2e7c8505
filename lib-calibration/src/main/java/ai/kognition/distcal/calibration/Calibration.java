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

import java.util.List;

import ai.kognition.distcal.image.Centroid;
import ai.kognition.distcal.image.Centroider;
import ai.kognition.distcal.image.Exposure;
import ai.kognition.distcal.image.Overlay;
import ai.kognition.distcal.image.geometry.Grid;
import ai.kognition.distcal.image.geometry.Vector2;

/**
 * <p>
 * Static entry points for calibrating with the default components.
 * </p>
 *
 * <pre>
 * <code>
 * final Grid grid = new HexGrid(100.0, 0.0);
 * final List&lt;Centroid&gt; measurements = Calibration.measure(exposures, grid, 10, 10000.0);
 * final DistortionBasis basis = Calibration.fit(BasisKind.POLYNOMIAL, 3, 4096, 4096, measurements);
 * final Vector2 distortion = Calibration.evaluate(basis, new Vector2(100.0, 2000.0));
 * </code>
 * </pre>
 */
public class Calibration {

    private Calibration() {}

    public static List<Vector2> enumerateGrid(final Grid grid, final int width, final int height) {
        return grid.enumerate(width, height);
    }

    public static Centroid centroid(final Exposure exposure, final Vector2 point, final int radius) {
        return new Centroider(radius).centroid(exposure, point);
    }

    /**
     * Measure and correct every point of {@code grid} in every exposure using all available
     * processors. The result is point major.
     */
    public static List<Centroid> measure(final List<Exposure> exposures, final Grid grid, final int radius, final double fluxThreshold) {
        return new CalibrationPipeline(new Centroider(radius), fluxThreshold, 0).measure(exposures, grid);
    }

    public static DistortionBasis fit(final BasisKind kind, final int param, final int width, final int height, final List<Centroid> measurements) {
        return new LeastSquaresFitter().solve(kind.create(param, width, height), measurements);
    }

    /**
     * Run the whole calibration as described by {@code config}. The basis covers the extent of the
     * first exposure.
     */
    public static DistortionBasis calibrate(final CalibrationConfig config, final List<Exposure> exposures) {
        if(exposures.isEmpty())
            throw new IllegalArgumentException("Cannot calibrate without any exposures.");
        final Exposure first = exposures.get(0);
        final DistortionBasis basis = config.basisKind.create(config.basisParam, first.cols(), first.rows());
        return new CalibrationPipeline(config).fit(exposures, config.grid, basis, config.fitMode, new LeastSquaresFitter(config.tolerance));
    }

    /**
     * A copy of {@code exposure} with a circle drawn around where each grid point should be, for
     * checking by eye that the grid lines up with the pinholes.
     */
    public static Exposure overlay(final Exposure exposure, final Grid grid, final double radius, final double value) {
        return Overlay.circles(exposure, grid, radius, value);
    }

    public static Vector2 evaluate(final DistortionBasis basis, final Vector2 position) {
        return basis.eval(position);
    }

    public static double[][] exportCoefficients(final DistortionBasis basis) {
        return basis.saveCoefficients();
    }

    public static void importCoefficients(final DistortionBasis basis, final double[][] coefficients) {
        basis.loadCoefficients(coefficients);
    }
}
