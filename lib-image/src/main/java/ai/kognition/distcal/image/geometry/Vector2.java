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

/**
 * An immutable position or displacement in image pixel units. {@code x} runs along
 * the columns and {@code y} along the rows of an image.
 */
public final class Vector2 {
    public static final Vector2 ZERO = new Vector2(0.0, 0.0);

    public final double x;
    public final double y;

    public Vector2(final double x, final double y) {
        this.x = x;
        this.y = y;
    }

    public Vector2 add(final Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    /**
     * This will return a vector that's translated such that if the vector passed in
     * is the same as {@code this} then the result will be [0, 0].
     *
     * It basically results in [ this - toOrigin ];
     */
    public Vector2 subtract(final Vector2 toOrigin) {
        return new Vector2(x - toOrigin.x, y - toOrigin.y);
    }

    public Vector2 multiply(final double scalar) {
        return new Vector2(x * scalar, y * scalar);
    }

    public double magnitudeSquared() {
        return (x * x) + (y * y);
    }

    public double magnitude() {
        return Math.sqrt(magnitudeSquared());
    }

    public double distance(final Vector2 other) {
        return subtract(other).magnitude();
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override
    public String toString() {
        return "Vector2[ x=" + x + ", y=" + y + " ]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp;
        temp = Double.doubleToLongBits(x);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(y);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Vector2 other = (Vector2)obj;
        if(Double.doubleToLongBits(x) != Double.doubleToLongBits(other.x)) return false;
        if(Double.doubleToLongBits(y) != Double.doubleToLongBits(other.y)) return false;
        return true;
    }
}
