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
package laptrack.processing.matching.sparselap.costmatrix;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import laptrack.processing.matching.sparselap.costfunction.DistanceFunction;
import laptrack.processing.matching.sparselap.costfunction.PositionCostFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds the cost matrix between the detections of two time points. A link is admissible if its cost does not exceed the cost of a displacement of norm {@code maxDistance}.
 */
public class FrameCostMatrixBuilder {
    public static final Logger logger = LoggerFactory.getLogger(FrameCostMatrixBuilder.class);

    /**
     *
     * @param from source positions (possibly predicted)
     * @param to target positions
     * @param maxDistance gating distance
     * @param distanceFunction per-coordinate transform of the displacement
     * @param alternativeCostFactor cost of birth and death relative to the gating cost
     * @return linking cost matrix. Sources and targets are in the same order as {@code from} and {@code to}
     */
    public static LinkingCostMatrix<double[], double[]> build(double[][] from, double[][] to, double maxDistance, DistanceFunction distanceFunction, double alternativeCostFactor) {
        if (!(maxDistance>0)) throw new IllegalArgumentException("Gating distance should be positive. Got: "+maxDistance);
        List<double[]> sources = Arrays.asList(from);
        List<double[]> targets = Arrays.asList(to);
        PositionCostFunction costFunction = new PositionCostFunction(distanceFunction);
        double threshold = distanceFunction.threshold(maxDistance);
        List<Integer> sIdx = new ArrayList<>();
        List<Integer> tIdx = new ArrayList<>();
        List<Double> costs = new ArrayList<>();
        for (int i = 0; i<from.length; ++i) {
            for (int j = 0; j<to.length; ++j) {
                if (from[i].length!=to[j].length) throw new IllegalArgumentException("Source and target positions should have the same dimensionality");
                double c = costFunction.linkingCost(from[i], to[j]);
                if (c<=threshold) {
                    sIdx.add(i);
                    tIdx.add(j);
                    costs.add(c);
                }
            }
        }
        if (costs.isEmpty()) return LinkingCostMatrix.empty(sources, targets);
        logger.trace("frame cost matrix: {} sources, {} targets, {} admissible links", from.length, to.length, costs.size());
        return new LinkingCostMatrix<>(sources, targets, Ints.toArray(sIdx), Ints.toArray(tIdx), Doubles.toArray(costs), alternativeCostFactor * threshold);
    }
}
