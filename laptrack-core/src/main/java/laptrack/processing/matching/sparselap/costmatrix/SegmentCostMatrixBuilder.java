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
import laptrack.data_structure.Segment;
import laptrack.processing.matching.sparselap.costfunction.DistanceFunction;
import laptrack.processing.matching.sparselap.costfunction.IntensityPenaltyCostFunction;
import laptrack.processing.matching.sparselap.costfunction.PositionCostFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the cost matrix between segment endpoints, for gap closing and optionally merging and splitting.
 * <ul>
 *     <li>Sources are segment ends, followed by the non-end points when merging and splitting are allowed</li>
 *     <li>Targets are segment starts, followed by the non-start points when merging and splitting are allowed</li>
 * </ul>
 * A link over a time gap dt is admissible if its positional cost does not exceed the cost of a displacement of norm {@code maxDisp * dt}.
 * Admissible costs are then multiplied by an intensity penalty.
 * Inspired by TrackMate's JaqamanSegmentCostMatrixCreator: https://github.com/fiji/TrackMate
 */
public class SegmentCostMatrixBuilder {
    public static final Logger logger = LoggerFactory.getLogger(SegmentCostMatrixBuilder.class);
    double maxDisp = 0.1;
    int windowGap = 10;
    boolean gapCloseOnly = true;
    DistanceFunction distanceFunction = DistanceFunction.SQUARE;
    double intensityPenalty = 1;
    double alternativeCostFactor = 1.05;

    public SegmentCostMatrixBuilder setMaxDisp(double maxDisp) {
        if (!(maxDisp>0)) throw new IllegalArgumentException("max displacement should be positive");
        this.maxDisp = maxDisp;
        return this;
    }

    public SegmentCostMatrixBuilder setWindowGap(int windowGap) {
        if (windowGap<1) throw new IllegalArgumentException("window gap should be >=1");
        this.windowGap = windowGap;
        return this;
    }

    public SegmentCostMatrixBuilder setGapCloseOnly(boolean gapCloseOnly) {
        this.gapCloseOnly = gapCloseOnly;
        return this;
    }

    public SegmentCostMatrixBuilder setDistanceFunction(DistanceFunction distanceFunction) {
        this.distanceFunction = distanceFunction;
        return this;
    }

    public SegmentCostMatrixBuilder setIntensityPenalty(double intensityPenalty) {
        this.intensityPenalty = intensityPenalty;
        return this;
    }

    public SegmentCostMatrixBuilder setAlternativeCostFactor(double alternativeCostFactor) {
        this.alternativeCostFactor = alternativeCostFactor;
        return this;
    }

    /**
     *
     * @param segments non-empty segments
     * @param intensities intensity of each detection of each segment, in the same order as {@code segments}. If null, intensity penalty is not applied
     * @return cost matrix whose sources and targets are {@link SegmentPoint}s
     */
    public LinkingCostMatrix<SegmentPoint, SegmentPoint> build(List<Segment> segments, double[][] intensities) {
        if (intensities!=null && intensities.length!=segments.size()) throw new IllegalArgumentException("one intensity array per segment is expected");
        List<SegmentPoint> sources = new ArrayList<>();
        List<SegmentPoint> targets = new ArrayList<>();
        for (int s = 0; s<segments.size(); ++s) {
            Segment seg = segments.get(s);
            if (seg.isEmpty()) throw new IllegalArgumentException("Empty segment: "+seg);
            sources.add(new SegmentPoint(s, seg, seg.size()-1));
            targets.add(new SegmentPoint(s, seg, 0));
        }
        if (!gapCloseOnly) {
            for (int s = 0; s<segments.size(); ++s) {
                Segment seg = segments.get(s);
                for (int i = 0; i<seg.size()-1; ++i) sources.add(new SegmentPoint(s, seg, i));
                for (int i = 1; i<seg.size(); ++i) targets.add(new SegmentPoint(s, seg, i));
            }
        }
        PositionCostFunction costFunction = new PositionCostFunction(distanceFunction);
        IntensityPenaltyCostFunction penalty = new IntensityPenaltyCostFunction(intensities==null ? 0 : intensityPenalty);
        List<Integer> sIdx = new ArrayList<>();
        List<Integer> tIdx = new ArrayList<>();
        List<Double> costs = new ArrayList<>();
        int[] count = new int[SegmentLinkType.values().length];
        for (int i = 0; i<sources.size(); ++i) {
            SegmentPoint source = sources.get(i);
            double[] sourcePos = source.getDetection().getPosition();
            int te = source.getTime();
            for (int j = 0; j<targets.size(); ++j) {
                SegmentPoint target = targets.get(j);
                if (source.segmentIdx == target.segmentIdx) continue;
                if (!source.isEnd() && !target.isStart()) continue; // middle to middle
                SegmentLinkType type = SegmentLinkType.of(source, target);
                int dt = target.getTime() - te;
                if (type.equals(SegmentLinkType.GAP_CLOSING)) {
                    if (dt<1 || dt>windowGap) continue;
                } else if (dt!=1) continue;
                double cost = costFunction.linkingCost(sourcePos, target.getDetection().getPosition());
                if (cost>distanceFunction.threshold(maxDisp * dt)) continue;
                if (intensities!=null) cost = penalty.linkingCost(cost, intensities[source.segmentIdx][source.pointIdx], intensities[target.segmentIdx][target.pointIdx]);
                sIdx.add(i);
                tIdx.add(j);
                costs.add(cost);
                ++count[type.ordinal()];
            }
        }
        logger.debug("segment cost matrix: {} segments, {} sources, {} targets, gap-closing links: {}, merge links: {}, split links: {}", segments.size(), sources.size(), targets.size(), count[0], count[1], count[2]);
        if (costs.isEmpty()) return LinkingCostMatrix.empty(sources, targets);
        double maxCost = costs.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
        return new LinkingCostMatrix<>(sources, targets, Ints.toArray(sIdx), Ints.toArray(tIdx), Doubles.toArray(costs), alternativeCostFactor * maxCost);
    }
}
