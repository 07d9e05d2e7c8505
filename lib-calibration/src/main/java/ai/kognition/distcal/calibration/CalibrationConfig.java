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

import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.distcal.image.geometry.Grid;
import ai.kognition.distcal.util.PropertiesUtils;

/**
 * <p>
 * Everything a calibration run needs other than the exposures. Loaded from {@link Properties} laid
 * over the defaults in the classpath resource {@value #DEFAULTS_RESOURCE}:
 * </p>
 *
 * <pre>
 * grid.pattern=hex
 * grid.pitch=100.0
 * grid.rotation=0.0
 * grid.offset.x=0.0
 * grid.offset.y=0.0
 * centroid.radius=10
 * centroid.fluxThreshold=10000.0
 * basis.kind=polynomial
 * basis.param=3
 * fit.mode=direct
 * fit.tolerance=1e-15
 * pipeline.threads=0
 * </pre>
 */
public class CalibrationConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalibrationConfig.class);

    public static final String DEFAULTS_RESOURCE = "distcal-defaults.properties";

    public final Grid grid;
    public final int radius;
    public final double fluxThreshold;
    public final BasisKind basisKind;
    public final int basisParam;
    public final FitMode fitMode;
    public final double tolerance;
    public final int threads;

    public CalibrationConfig(final Grid grid, final int radius, final double fluxThreshold, final BasisKind basisKind, final int basisParam,
        final FitMode fitMode, final double tolerance, final int threads) {
        if(grid == null || basisKind == null || fitMode == null)
            throw new NullPointerException("Cannot pass a null grid, basis kind or fit mode to a " + CalibrationConfig.class.getSimpleName());
        if(radius < 0)
            throw new IllegalArgumentException("The centroid radius can't be negative. You passed " + radius);
        if(Double.isNaN(fluxThreshold))
            throw new IllegalArgumentException("The flux threshold can't be NaN.");
        if(basisParam < 1)
            throw new IllegalArgumentException("The basis parameter must be at least 1. You passed " + basisParam);
        if(!(tolerance >= 0.0) || tolerance >= 1.0)
            throw new IllegalArgumentException("The fit tolerance must be in [0, 1). You passed " + tolerance);
        if(threads < 0)
            throw new IllegalArgumentException("The thread count can't be negative. You passed " + threads);

        this.grid = grid;
        this.radius = radius;
        this.fluxThreshold = fluxThreshold;
        this.basisKind = basisKind;
        this.basisParam = basisParam;
        this.fitMode = fitMode;
        this.tolerance = tolerance;
        this.threads = threads;
    }

    /**
     * The defaults with {@code overrides} laid over them.
     *
     * @throws IOException if the defaults can't be read.
     * @throws IllegalArgumentException if a value is missing or malformed. The message names the key.
     */
    public static CalibrationConfig load(final Properties overrides) throws IOException {
        final Properties props = PropertiesUtils.overlay(PropertiesUtils.loadResource(DEFAULTS_RESOURCE), overrides);
        final CalibrationConfig ret = new CalibrationConfig(
            Grid.fromProperties(PropertiesUtils.getSection(props, "grid", true)),
            PropertiesUtils.getInt(props, "centroid.radius"),
            PropertiesUtils.getDouble(props, "centroid.fluxThreshold"),
            BasisKind.fromTag(PropertiesUtils.getRequired(props, "basis.kind")),
            PropertiesUtils.getInt(props, "basis.param"),
            FitMode.fromTag(PropertiesUtils.getRequired(props, "fit.mode")),
            PropertiesUtils.getDouble(props, "fit.tolerance"),
            PropertiesUtils.getInt(props, "pipeline.threads"));
        LOGGER.debug("Loaded {}", ret);
        return ret;
    }

    public static CalibrationConfig load() throws IOException {
        return load(new Properties());
    }

    /**
     * Load the properties file at {@code fname} over the defaults.
     */
    public static CalibrationConfig load(final String fname) throws IOException {
        return load(PropertiesUtils.loadProps(new Properties(), fname));
    }

    @Override
    public String toString() {
        return "CalibrationConfig [grid=" + grid + ", radius=" + radius + ", fluxThreshold=" + fluxThreshold + ", basisKind=" + basisKind
            + ", basisParam=" + basisParam + ", fitMode=" + fitMode + ", tolerance=" + tolerance + ", threads=" + threads + "]";
    }
}
