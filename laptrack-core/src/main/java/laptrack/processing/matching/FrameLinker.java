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
import laptrack.processing.matching.sparselap.costmatrix.FrameCostMatrixBuilder;
import laptrack.processing.matching.sparselap.costmatrix.LinkingCostMatrix;
import laptrack.processing.matching.sparselap.linker.AssignmentSolver;
import laptrack.processing.matching.sparselap.linker.InfeasibleAssignmentException;
import laptrack.processing.matching.sparselap.linker.JaqamanLinker;
import laptrack.processing.prediction.PositionPredictor;
import laptrack.processing.prediction.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Links the detections of two consecutive time points by solving a linear assignment problem with birth and death alternatives.
 * A detection at t1 linked to a detection at t0 inherits its working label, other detections at t1 receive a new label.
 */
public class FrameLinker {
    public static final Logger logger = LoggerFactory.getLogger(FrameLinker.class);
    final TrackerParameters parameters;
    final LabelGenerator labelGenerator;
    final AssignmentSolver solver;
    final PositionPredictor predictor;

    /**
     *
     * @param parameters tracking parameters
     * @param labelGenerator generator of the session
     * @param solver assignment solver
     * @param predictor position predictor, used when prediction is requested. Can be null
     */
    public FrameLinker(TrackerParameters parameters, LabelGenerator labelGenerator, AssignmentSolver solver, PositionPredictor predictor) {
        this.parameters = parameters;
        this.labelGenerator = labelGenerator;
        this.solver = solver;
        this.predictor = predictor;
    }

    /**
     * Writes the working labels of the detections at {@code t1}
     * @param table detection table, with working labels committed up to {@code t0}
     * @param t0 source time point
     * @param t1 target time point, greater than {@code t0}
     * @param predict whether source positions are replaced by their predicted positions at {@code t1}
     * @return summary of the step
     */
    public LinkingStep link(DetectionTable table, int t0, int t1, boolean predict) {
        if (t1<=t0) throw new IllegalArgumentException("Target time "+t1+" should be after source time "+t0);
        int[] from = table.indicesAt(t0);
        int[] to = table.indicesAt(t1);
        double[][] fromPos;
        if (predict && predictor!=null) {
            Prediction[] pred = predictor.predict(table, t0, t1);
            fromPos = Arrays.stream(pred).map(p -> truncate(p.getPosition())).toArray(double[][]::new);
        } else fromPos = Arrays.stream(from).mapToObj(i -> truncate(table.get(i).getPosition())).toArray(double[][]::new);
        double[][] toPos = Arrays.stream(to).mapToObj(i -> truncate(table.get(i).getPosition())).toArray(double[][]::new);
        double maxDistance = parameters.getMaxDisp() * (t1 - t0);
        LinkingCostMatrix<double[], double[]> costMatrix = FrameCostMatrixBuilder.build(fromPos, toPos, maxDistance, parameters.getDistanceFunction(), parameters.getAlternativeCostFactor());
        int[] newLabels = new int[to.length];
        JaqamanLinker<double[], double[]> linker = new JaqamanLinker<>(costMatrix, solver);
        try {
            linker.process();
        } catch (InfeasibleAssignmentException e) {
            logger.warn("Assignment failed between time {} and {} ({} -> {} detections): {}. All detections at time {} start new tracks", t0, t1, from.length, to.length, e.getMessage(), t1);
            for (int j = 0; j<to.length; ++j) newLabels[j] = labelGenerator.next();
            table.commitWorkingLabels(to, newLabels);
            return new LinkingStep(t0, t1, 0, to.length, from.length, true, costMatrix);
        }
        int[] targetToSource = linker.getTargetToSource();
        int links = 0;
        for (int j = 0; j<to.length; ++j) {
            int s = targetToSource[j];
            if (s>=0) {
                newLabels[j] = table.getWorkingLabel(from[s]);
                ++links;
            } else newLabels[j] = labelGenerator.next();
        }
        table.commitWorkingLabels(to, newLabels);
        LinkingStep step = new LinkingStep(t0, t1, links, to.length - links, from.length - links, false, costMatrix);
        logger.debug("{}", step);
        return step;
    }

    private double[] truncate(double[] position) {
        int nDims = parameters.getNDims();
        return position.length > nDims ? Arrays.copyOf(position, nDims) : position;
    }
}
