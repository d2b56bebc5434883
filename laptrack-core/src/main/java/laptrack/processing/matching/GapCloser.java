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
package laptrack.processing.matching;

import laptrack.configuration.TrackerParameters;
import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.LabelGenerator;
import laptrack.data_structure.Segment;
import laptrack.processing.matching.sparselap.costmatrix.LinkingCostMatrix;
import laptrack.processing.matching.sparselap.costmatrix.SegmentCostMatrixBuilder;
import laptrack.processing.matching.sparselap.costmatrix.SegmentLinkType;
import laptrack.processing.matching.sparselap.costmatrix.SegmentPoint;
import laptrack.processing.matching.sparselap.linker.AssignmentSolver;
import laptrack.processing.matching.sparselap.linker.InfeasibleAssignmentException;
import laptrack.processing.matching.sparselap.linker.JaqamanLinker;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Joins segments separated by a gap of at most {@link TrackerParameters#getWindowGap()} time points.
 * Stitched segments form chains that take the lowest label of their members. Segments stitched to nothing receive a new label.
 * Merge and split links are reported, but do not modify labels as a detection carries a single label.
 */
public class GapCloser {
    public static final Logger logger = LoggerFactory.getLogger(GapCloser.class);
    final TrackerParameters parameters;
    final LabelGenerator labelGenerator;
    final AssignmentSolver solver;

    public GapCloser(TrackerParameters parameters, LabelGenerator labelGenerator, AssignmentSolver solver) {
        this.parameters = parameters;
        this.labelGenerator = labelGenerator;
        this.solver = solver;
    }

    /**
     * Relabels the primary label column of {@code table}
     * @param table detection table
     * @return label mapping, chosen links and cost matrix
     */
    public GapClosingResult close(DetectionTable table) {
        List<Segment> segments = table.segments().collect(Collectors.toList());
        labelGenerator.reserveUpTo(table.maxLabel());
        double[][] intensities;
        if (table.hasIntensity()) intensities = segments.stream().map(s -> s.intensities(1)).toArray(double[][]::new);
        else intensities = segments.stream().map(s -> { double[] res = new double[s.size()]; Arrays.fill(res, 1); return res; }).toArray(double[][]::new);
        LinkingCostMatrix<SegmentPoint, SegmentPoint> costMatrix = new SegmentCostMatrixBuilder()
                .setMaxDisp(parameters.getMaxDisp())
                .setWindowGap(parameters.getWindowGap())
                .setGapCloseOnly(parameters.isGapCloseOnly())
                .setDistanceFunction(parameters.getDistanceFunction())
                .setIntensityPenalty(parameters.getIntensityPenalty())
                .setAlternativeCostFactor(parameters.getAlternativeCostFactor())
                .build(segments, intensities);
        JaqamanLinker<SegmentPoint, SegmentPoint> linker = new JaqamanLinker<>(costMatrix, solver);
        Map<Integer, Integer> mapping = new HashMap<>();
        try {
            linker.process();
        } catch (InfeasibleAssignmentException e) {
            logger.warn("Gap closing assignment failed on {} segments: {}. All segments receive new labels", segments.size(), e.getMessage());
            for (Segment s : segments) mapping.put(s.getLabel(), labelGenerator.next());
            table.relabel(mapping);
            return new GapClosingResult(costMatrix, mapping, Collections.emptyList(), true);
        }
        List<SegmentPoint> sources = costMatrix.getSources();
        List<SegmentPoint> targets = costMatrix.getTargets();
        int[] sourceToTarget = linker.getSourceToTarget();
        double[] linkCosts = linker.getLinkCosts();
        Graph<Integer, DefaultEdge> stitches = new SimpleGraph<>(DefaultEdge.class);
        for (int s = 0; s<segments.size(); ++s) stitches.addVertex(s);
        List<SegmentLink> links = new ArrayList<>();
        for (int i = 0; i<sources.size(); ++i) {
            int j = sourceToTarget[i];
            if (j<0 || j>=targets.size()) continue; // dummy
            SegmentPoint source = sources.get(i);
            SegmentPoint target = targets.get(j);
            SegmentLinkType type = SegmentLinkType.of(source, target);
            links.add(new SegmentLink(type, source.getSegment().getLabel(), source.getTime(), target.getSegment().getLabel(), target.getTime(), linkCosts[i]));
            if (SegmentLinkType.GAP_CLOSING.equals(type)) stitches.addEdge(source.getSegmentIdx(), target.getSegmentIdx());
        }
        // chains in order of their lowest segment index so that new labels are allocated deterministically
        List<Set<Integer>> chains = new ArrayList<>(new ConnectivityInspector<>(stitches).connectedSets());
        chains.sort(Comparator.comparingInt(c -> Collections.min(c)));
        int stitched = 0;
        for (Set<Integer> chain : chains) {
            if (chain.size()==1) {
                mapping.put(segments.get(chain.iterator().next()).getLabel(), labelGenerator.next());
            } else {
                int label = chain.stream().mapToInt(s -> segments.get(s).getLabel()).min().getAsInt();
                for (int s : chain) mapping.put(segments.get(s).getLabel(), label);
                stitched += chain.size();
            }
        }
        table.relabel(mapping);
        GapClosingResult res = new GapClosingResult(costMatrix, mapping, links, false);
        logger.debug("{} ({} segments stitched)", res, stitched);
        return res;
    }
}
