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
 * One measured calibration point: the flux weighted center of gravity ({@code cog}) of
 * the pixels around a point, the total flux in that window and the nominal position
 * ({@code pos}) the measurement is associated with.
 *
 * <p>
 * {@code pos} starts out as the point that was measured and is rewritten by the calibration
 * pipeline once the positions from all of the exposures are known.
 * </p>
 */
public class Centroid {
    public final Vector2 cog;
    public final double flux;
    private Vector2 pos;

    public Centroid(final Vector2 cog, final double flux, final Vector2 pos) {
        this.cog = cog;
        this.flux = flux;
        this.pos = pos;
    }

    public Vector2 getPos() {
        return pos;
    }

    public void setPos(final Vector2 pos) {
        if(pos == null)
            throw new NullPointerException("Cannot set a null position on a " + Centroid.class.getSimpleName());
        this.pos = pos;
    }

    /**
     * Measured minus nominal position.
     */
    public Vector2 displacement() {
        return cog.subtract(pos);
    }

    @Override
    public String toString() {
        return "Centroid [cog=" + cog + ", flux=" + flux + ", pos=" + pos + "]";
    }
}
