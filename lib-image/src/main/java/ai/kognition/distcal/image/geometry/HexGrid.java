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

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 * A hexagonal lattice of points. Lattice index {@code (i, j)} is placed by scaling the
 * square lattice by the pitch, shearing it into a hexagonal one
 * ({@code (x, y) -> (x + y/2, y * sqrt(3)/2)}), rotating, applying the offset and finally
 * moving the origin to the center of the extent, {@code (width/2 - 0.5, height/2 - 0.5)}
 * with integer halves.
 * </p>
 *
 * <p>
 * Enumeration walks {@code i} ascending in the outer loop and {@code j} ascending in
 * the inner loop and keeps the points inside the extent. Only the range of indices that
 * can possibly land inside the extent is visited. That range is found by mapping the
 * corners of the extent back into index space.
 * </p>
 */
public class HexGrid implements Grid {
    public static final long MAX_CANDIDATES = 1L << 26;

    private static final double SQRT3 = Math.sqrt(3.0);

    private final double pitch;
    private final double rotation;
    private final Vector2 offset;

    public HexGrid(final double pitch, final double rotation, final Vector2 offset) {
        if(offset == null)
            throw new NullPointerException("Cannot pass a null offset to a " + HexGrid.class.getSimpleName());
        if(!Double.isFinite(pitch) || pitch <= 0.0)
            throw new GeometryException("The pitch of a " + HexGrid.class.getSimpleName() + " must be finite and positive. You passed " + pitch);
        if(!Double.isFinite(rotation))
            throw new GeometryException("The rotation of a " + HexGrid.class.getSimpleName() + " must be finite. You passed " + rotation);
        if(!offset.isFinite())
            throw new GeometryException("The offset of a " + HexGrid.class.getSimpleName() + " must be finite. You passed " + offset);

        this.pitch = pitch;
        this.rotation = rotation;
        this.offset = offset;
    }

    public HexGrid(final double pitch, final double rotation) {
        this(pitch, rotation, Vector2.ZERO);
    }

    @Override
    public GridPattern pattern() {
        return GridPattern.HEX;
    }

    @Override
    public double pitch() {
        return pitch;
    }

    @Override
    public double rotation() {
        return rotation;
    }

    @Override
    public Vector2 offset() {
        return offset;
    }

    @Override
    public HexGrid translate(final Vector2 delta) {
        return new HexGrid(pitch, rotation, offset.add(delta));
    }

    @Override
    public List<Vector2> enumerate(final int width, final int height) {
        if(width <= 0 || height <= 0)
            throw new GeometryException("Cannot enumerate grid points over a " + width + " x " + height + " extent.");

        final double centerX = (width / 2) - 0.5;
        final double centerY = (height / 2) - 0.5;
        final double cos = Math.cos(rotation);
        final double sin = Math.sin(rotation);

        // map the extent's corners back into (fractional) lattice indices to bound the search
        double iMin = Double.POSITIVE_INFINITY;
        double iMax = Double.NEGATIVE_INFINITY;
        double jMin = Double.POSITIVE_INFINITY;
        double jMax = Double.NEGATIVE_INFINITY;
        for(final double[] corner: new double[][] {{0,0},{width,0},{0,height},{width,height}}) {
            final double qx = corner[0] - centerX - offset.x;
            final double qy = corner[1] - centerY - offset.y;
            // undo the rotation
            final double hx = (qx * cos) + (qy * sin);
            final double hy = (-qx * sin) + (qy * cos);
            // undo the shear
            final double v = (hy * 2.0) / SQRT3;
            final double u = hx - (0.5 * v);

            iMin = Math.min(iMin, u / pitch);
            iMax = Math.max(iMax, u / pitch);
            jMin = Math.min(jMin, v / pitch);
            jMax = Math.max(jMax, v / pitch);
        }

        final double spanI = Math.ceil(iMax) - Math.floor(iMin) + 3.0;
        final double spanJ = Math.ceil(jMax) - Math.floor(jMin) + 3.0;
        if(spanI * spanJ > MAX_CANDIDATES)
            throw new GeometryException("A pitch of " + pitch + " over a " + width + " x " + height + " extent requires visiting "
                + (long)(spanI * spanJ) + " lattice points which is more than the limit of " + MAX_CANDIDATES);

        final long i0 = (long)Math.floor(iMin) - 1;
        final long i1 = (long)Math.ceil(iMax) + 1;
        final long j0 = (long)Math.floor(jMin) - 1;
        final long j1 = (long)Math.ceil(jMax) + 1;

        final List<Vector2> ret = new ArrayList<>();
        for(long i = i0; i <= i1; i++) {
            for(long j = j0; j <= j1; j++) {
                final Vector2 p = place(i, j, cos, sin, centerX, centerY);
                if(p.x >= 0.0 && p.x < width && p.y >= 0.0 && p.y < height)
                    ret.add(p);
            }
        }
        return ret;
    }

    private Vector2 place(final long i, final long j, final double cos, final double sin, final double centerX, final double centerY) {
        // square lattice in pixel units
        final double sx = i * pitch;
        final double sy = j * pitch;
        // sheared into a hex lattice
        final double hx = sx + (0.5 * sy);
        final double hy = sy * SQRT3 / 2.0;
        // rotated, offset and moved to the center of the extent
        final double x = (hx * cos) - (hy * sin) + offset.x;
        final double y = (hx * sin) + (hy * cos) + offset.y;
        return new Vector2(x + centerX, y + centerY);
    }

    @Override
    public String toString() {
        return "HexGrid[ pitch=" + pitch + ", rotation=" + rotation + ", offset=" + offset + " ]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp;
        temp = Double.doubleToLongBits(pitch);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(rotation);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        result = prime * result + offset.hashCode();
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final HexGrid other = (HexGrid)obj;
        if(Double.doubleToLongBits(pitch) != Double.doubleToLongBits(other.pitch)) return false;
        if(Double.doubleToLongBits(rotation) != Double.doubleToLongBits(other.rotation)) return false;
        return offset.equals(other.offset);
    }
}
