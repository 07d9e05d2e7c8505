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

package ai.kognition.distcal.image.geometry;

import java.util.List;
import java.util.Properties;

import ai.kognition.distcal.util.PropertiesUtils;

/**
 * A parametric pattern of calibration points (the pinholes of a calibration mask).
 *
 * <p>
 * Implementations are immutable. The order of the points returned from {@link #enumerate(int, int)}
 * is part of the contract: for the same parameters and extent the same points come back in the same
 * order. Measurements taken from different exposures are paired up purely by their position in that
 * list, so an implementation must never reorder its output.
 * </p>
 */
public interface Grid {

    public GridPattern pattern();

    /**
     * Distance between neighboring points in pixels.
     */
    public double pitch();

    /**
     * Rotation of the pattern, in radians, about the center of the extent.
     */
    public double rotation();

    /**
     * Translation of the pattern, in pixels, from the center of the extent.
     */
    public Vector2 offset();

    /**
     * Every point of the pattern that falls inside {@code [0, width) x [0, height)}.
     *
     * @throws GeometryException if the extent isn't positive or the pattern is too dense to enumerate.
     */
    public List<Vector2> enumerate(int width, int height);

    /**
     * A new grid whose points are this grid's points translated by {@code delta}.
     */
    public Grid translate(Vector2 delta);

    /**
     * Build a grid from a properties section (the {@code grid.} prefix already removed):
     *
     * <pre>
     * pattern=hex
     * pitch=100.0
     * rotation=0.0
     * offset.x=0.0
     * offset.y=0.0
     * </pre>
     *
     * Only {@code pitch} is required.
     */
    public static Grid fromProperties(final Properties gridSection) {
        final GridPattern pattern = GridPattern.fromTag(gridSection.getProperty("pattern", GridPattern.HEX.tag));
        final double pitch = PropertiesUtils.getDouble(gridSection, "pitch");
        final double rotation = gridSection.containsKey("rotation") ? PropertiesUtils.getDouble(gridSection, "rotation") : 0.0;
        final double ox = gridSection.containsKey("offset.x") ? PropertiesUtils.getDouble(gridSection, "offset.x") : 0.0;
        final double oy = gridSection.containsKey("offset.y") ? PropertiesUtils.getDouble(gridSection, "offset.y") : 0.0;

        switch(pattern) {
            case HEX:
                return new HexGrid(pitch, rotation, new Vector2(ox, oy));
            default:
                throw new GeometryException("No grid implementation for the pattern " + pattern);
        }
    }
}
