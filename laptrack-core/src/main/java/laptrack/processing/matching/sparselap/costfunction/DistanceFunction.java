/* 
 * Copyright (C) 2026 LAPTrack developers
 *
 * This File is part of LAPTrack
 *
 * LAPTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LAPTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LAPTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package laptrack.processing.matching.sparselap.costfunction;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Per-coordinate transform of the displacement used to compute linking costs.
 * The cost between two positions is the sum over coordinates of the transformed absolute displacement.
 */
public enum DistanceFunction {
    SQUARE("square", d -> d * d),
    ABSOLUTE("absolute", Math::abs);

    final String name;
    final DoubleUnaryOperator transform;

    DistanceFunction(String name, DoubleUnaryOperator transform) {
        this.name = name;
        this.transform = transform;
    }

    public String getName() {
        return name;
    }

    public double apply(double displacement) {
        return transform.applyAsDouble(Math.abs(displacement));
    }

    /**
     *
     * @param source position
     * @param target position
     * @return sum over coordinates of the transformed displacement
     */
    public double cost(double[] source, double[] target) {
        double cost = 0;
        for (int i = 0; i<source.length; ++i) cost += apply(target[i] - source[i]);
        return cost;
    }

    /**
     * @param maxDistance gating distance
     * @return the maximal admissible cost for a displacement of norm {@code maxDistance}
     */
    public double threshold(double maxDistance) {
        return apply(maxDistance);
    }

    public static DistanceFunction getDistanceFunction(String name) {
        return Arrays.stream(values()).filter(f -> f.name.equalsIgnoreCase(name)).findAny().orElseThrow(() -> new IllegalArgumentException("Unknown distance function: "+name+". Available: "+Arrays.toString(Arrays.stream(values()).map(DistanceFunction::getName).toArray())));
    }

    @Override
    public String toString() {
        return name;
    }
}
