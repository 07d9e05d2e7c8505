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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.distcal.image.Centroid;
import ai.kognition.distcal.image.Centroider;
import ai.kognition.distcal.image.Exposure;
import ai.kognition.distcal.image.MeasurementException;
import ai.kognition.distcal.image.PointMeasurer;
import ai.kognition.distcal.image.geometry.Grid;
import ai.kognition.distcal.image.geometry.Vector2;
import ai.kognition.distcal.util.Timer;

/**
 * <p>
 * Turns a set of exposures of the calibration mask into centroid measurements and fits a
 * {@link DistortionBasis} to them.
 * </p>
 *
 * <ol>
 * <li>The nominal points are enumerated once, against the extent of the first exposure.</li>
 * <li>Each point is measured in every exposure at {@code point + shift}. Points are measured in
 * parallel, the exposures of one point in order.</li>
 * <li>A point is kept only if every one of its measurements succeeded with a flux strictly above
 * the threshold.</li>
 * <li>The position of each kept point is re-estimated as the mean over the exposures of
 * {@code cog - shift} and every measurement's {@code pos} is set to that plus its exposure's
 * shift.</li>
 * <li>The measurements are fit, either directly or differentially.</li>
 * </ol>
 *
 * <p>
 * Measurements come back point major (all of the exposures of the first kept point, then the
 * next) in the order the grid enumerates the points. If any measurement fails with anything other
 * than a {@link MeasurementException} the remaining work is cancelled and the failure is rethrown.
 * </p>
 */
public class CalibrationPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalibrationPipeline.class);
    private static final AtomicLong sequence = new AtomicLong(0);

    private final PointMeasurer measurer;
    private final double fluxThreshold;
    private final int threads;

    /**
     * @param threads
     *     the number of worker threads. 0 means one per available processor.
     */
    public CalibrationPipeline(final PointMeasurer measurer, final double fluxThreshold, final int threads) {
        if(measurer == null)
            throw new NullPointerException("Cannot pass a null " + PointMeasurer.class.getSimpleName() + " to a " + CalibrationPipeline.class.getSimpleName());
        if(Double.isNaN(fluxThreshold))
            throw new IllegalArgumentException("The flux threshold can't be NaN.");
        if(threads < 0)
            throw new IllegalArgumentException("The thread count can't be negative. You passed " + threads);
        this.measurer = measurer;
        this.fluxThreshold = fluxThreshold;
        this.threads = threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
    }

    public CalibrationPipeline(final CalibrationConfig config) {
        this(new Centroider(config.radius), config.fluxThreshold, config.threads);
    }

    public double fluxThreshold() {
        return fluxThreshold;
    }

    public int threads() {
        return threads;
    }

    /**
     * The measurements grouped by point. Each element has one {@link Centroid} per exposure,
     * in exposure order, with its {@code pos} already corrected.
     */
    public List<List<Centroid>> measurePerPoint(final List<Exposure> exposures, final Grid grid) {
        if(exposures == null || grid == null)
            throw new NullPointerException("Cannot measure null exposures or a null grid");
        if(exposures.isEmpty()) {
            LOGGER.warn("No exposures were supplied so there is nothing to measure.");
            return new ArrayList<>();
        }

        final Exposure first = exposures.get(0);
        final Timer timer = Timer.started();
        final List<Vector2> points = grid.enumerate(first.cols(), first.rows());
        LOGGER.debug("Enumerated {} points of {} on {} x {} in {} seconds", points.size(), grid, first.cols(), first.rows(), timer.stop());

        timer.start();
        final List<List<Centroid>> raw = measureAll(points, exposures);
        LOGGER.debug("Centroided {} points in {} exposures in {} seconds", points.size(), exposures.size(), timer.stop());

        final List<List<Centroid>> ret = new ArrayList<>(raw.size());
        for(final List<Centroid> point: raw) {
            if(point != null) {
                correct(point, exposures);
                ret.add(point);
            }
        }

        LOGGER.info("Kept {} of {} grid points across {} exposures ({} measurements)", ret.size(), points.size(), exposures.size(),
            ret.size() * exposures.size());
        return ret;
    }

    /**
     * The measurements flattened point major.
     *
     * @see #measurePerPoint(List, Grid)
     */
    public List<Centroid> measure(final List<Exposure> exposures, final Grid grid) {
        return flatten(measurePerPoint(exposures, grid));
    }

    /**
     * Measure the exposures and fit {@code basis} to the result.
     *
     * @throws ai.kognition.distcal.nr.LinalgException if the measurements can't determine the
     *     coefficients.
     */
    public <T extends DistortionBasis> T fit(final List<Exposure> exposures, final Grid grid, final T basis, final FitMode mode,
        final LeastSquaresFitter fitter) {
        final List<List<Centroid>> perPoint = measurePerPoint(exposures, grid);
        final Timer timer = Timer.started();
        final T ret;
        switch(mode) {
            case DIFFERENTIAL:
                ret = fitter.solveDifferential(basis, perPoint);
                break;
            case DIRECT:
            default:
                ret = fitter.solve(basis, flatten(perPoint));
                break;
        }
        LOGGER.info("Fit {} ({}) to {} points in {} seconds", basis, mode, perPoint.size(), timer.stop());
        return ret;
    }

    private List<List<Centroid>> measureAll(final List<Vector2> points, final List<Exposure> exposures) {
        final int numPoints = points.size();
        final List<List<Centroid>> results = new ArrayList<>(Collections.nCopies(numPoints, (List<Centroid>)null));
        if(numPoints == 0)
            return results;

        final long runId = sequence.getAndIncrement();
        final ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, numPoints), r -> {
            final Thread t = new Thread(r, "distcal-centroid-" + runId);
            t.setDaemon(true);
            return t;
        });
        try {
            final ExecutorCompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
            for(int i = 0; i < numPoints; i++) {
                final int index = i;
                completion.submit(() -> {
                    results.set(index, measurePoint(index, points.get(index), exposures));
                    return index;
                });
            }

            for(int i = 0; i < numPoints; i++) {
                final Future<Integer> done = completion.take();
                try {
                    done.get();
                } catch(final ExecutionException ee) {
                    final Throwable cause = ee.getCause();
                    if(cause instanceof RuntimeException)
                        throw (RuntimeException)cause;
                    if(cause instanceof Error)
                        throw (Error)cause;
                    throw new IllegalStateException("Measuring a calibration point failed", cause);
                }
            }
        } catch(final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while measuring calibration points", ie);
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /**
     * @return the point's measurements, or null if it was filtered out.
     */
    private List<Centroid> measurePoint(final int index, final Vector2 point, final List<Exposure> exposures) {
        final List<Centroid> ret = new ArrayList<>(exposures.size());
        for(int e = 0; e < exposures.size(); e++) {
            final Exposure exposure = exposures.get(e);
            final Centroid c;
            try {
                c = measurer.measure(exposure, point.add(exposure.shift()));
            } catch(final MeasurementException me) {
                LOGGER.trace("Dropping point {} at {}: exposure {} couldn't be measured: {}", index, point, e, me.getMessage());
                return null;
            }
            if(!(c.flux > fluxThreshold)) {
                LOGGER.trace("Dropping point {} at {}: flux {} in exposure {} isn't above {}", index, point, c.flux, e, fluxThreshold);
                return null;
            }
            ret.add(c);
        }
        return ret;
    }

    private static void correct(final List<Centroid> point, final List<Exposure> exposures) {
        double x = 0.0;
        double y = 0.0;
        for(int e = 0; e < point.size(); e++) {
            final Vector2 v = point.get(e).cog.subtract(exposures.get(e).shift());
            x += v.x;
            y += v.y;
        }
        final Vector2 consensus = new Vector2(x / point.size(), y / point.size());
        for(int e = 0; e < point.size(); e++)
            point.get(e).setPos(consensus.add(exposures.get(e).shift()));
    }

    private static List<Centroid> flatten(final List<List<Centroid>> perPoint) {
        final List<Centroid> ret = new ArrayList<>();
        for(final List<Centroid> point: perPoint)
            ret.addAll(point);
        return ret;
    }
}
