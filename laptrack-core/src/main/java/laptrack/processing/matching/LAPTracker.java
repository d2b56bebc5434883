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
import laptrack.core.ProgressCallback;
import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.LabelGenerator;
import laptrack.data_structure.Segment;
import laptrack.processing.matching.sparselap.linker.AssignmentSolver;
import laptrack.processing.matching.sparselap.linker.SparseLAPSolver;
import laptrack.processing.prediction.GaussianProcessRegressor;
import laptrack.processing.prediction.PositionPredictor;
import laptrack.processing.prediction.TrajectoryPredictor;
import laptrack.ui.logger.ProgressLogger;
import laptrack.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Tracking session over a {@link DetectionTable}: frame-to-frame linking followed by gap closing.
 * The session owns the label generator, so that labels allocated by successive passes never collide.
 */
public class LAPTracker {
    public static final Logger logger = LoggerFactory.getLogger(LAPTracker.class);
    final DetectionTable table;
    final TrackerParameters parameters;
    final LabelGenerator labelGenerator;
    AssignmentSolver solver = new SparseLAPSolver();
    PositionPredictor predictor;
    ProgressLogger progressLogger;
    final List<int[]> degradedTimePairs = new ArrayList<>();

    /**
     *
     * @param table detection table, relabeled in place
     * @param parameters tracking parameters
     * @throws IllegalArgumentException if the parameters request more coordinates than the table has, or if predictor options are invalid
     */
    public LAPTracker(DetectionTable table, TrackerParameters parameters) {
        if (parameters.getNDims()>table.getDimensions()) throw new IllegalArgumentException("Parameters use "+parameters.getNDims()+" coordinates but detections have "+table.getDimensions());
        this.table = table;
        this.parameters = parameters;
        this.labelGenerator = LabelGenerator.above(table);
        this.predictor = new TrajectoryPredictor(new GaussianProcessRegressor(parameters.getPredictorOptions()), parameters.getSigma());
    }

    public LAPTracker setAssignmentSolver(AssignmentSolver solver) {
        this.solver = solver;
        return this;
    }

    public LAPTracker setPositionPredictor(PositionPredictor predictor) {
        this.predictor = predictor;
        return this;
    }

    public LAPTracker setProgressLogger(ProgressLogger progressLogger) {
        this.progressLogger = progressLogger;
        return this;
    }

    public DetectionTable getTable() {
        return table;
    }

    public TrackerParameters getParameters() {
        return parameters;
    }

    public LabelGenerator getLabelGenerator() {
        return labelGenerator;
    }

    public List<LinkingStep> getTrack() {
        return getTrack(parameters.isPredict());
    }

    /**
     * Links each pair of consecutive time points, in increasing time order, then promotes the working labels to primary labels
     * @param predict whether source positions are predicted from their trajectory
     * @return one step per pair of consecutive time points
     */
    public List<LinkingStep> getTrack(boolean predict) {
        logger.info("Get track (predict={}) on {}", predict, table);
        long t0 = System.currentTimeMillis();
        table.resetWorkingLabels();
        labelGenerator.reserveUpTo(table.maxLabel());
        degradedTimePairs.clear();
        int[] times = table.times();
        ProgressCallback pcb = progressLogger==null ? ProgressCallback.none() : ProgressCallback.get(progressLogger, Math.max(1, times.length-1));
        pcb.setRunning(true);
        FrameLinker linker = new FrameLinker(parameters, labelGenerator, solver, predictor);
        List<LinkingStep> steps = new ArrayList<>(Math.max(0, times.length-1));
        for (int i = 0; i<times.length-1; ++i) {
            LinkingStep step = linker.link(table, times[i], times[i+1], predict);
            if (step.isDegraded()) degradedTimePairs.add(new int[]{times[i], times[i+1]});
            steps.add(step);
            pcb.incrementProgress();
        }
        table.promoteWorkingLabels();
        pcb.setRunning(false);
        if (!degradedTimePairs.isEmpty()) logger.warn("{} degraded linking steps: {}", degradedTimePairs.size(), Utils.toStringList(degradedTimePairs, p -> p[0]+"->"+p[1]));
        logger.info("Get track done: {} time points, {} tracks in {}ms", times.length, table.labels().length, System.currentTimeMillis()-t0);
        return steps;
    }

    /**
     * Runs gap closing over the whole table
     * @return label mapping, chosen links and cost matrix
     */
    public GapClosingResult closeMergeSplit() {
        logger.info("Close gaps (window={}, gap close only={}) on {}", parameters.getWindowGap(), parameters.isGapCloseOnly(), table);
        long t0 = System.currentTimeMillis();
        GapClosingResult res = new GapCloser(parameters, labelGenerator, solver).close(table);
        logger.info("Close gaps done: {} tracks in {}ms", table.labels().length, System.currentTimeMillis()-t0);
        return res;
    }

    /**
     * Reverses the time axis of the table. Calling it twice restores the original time points.
     */
    public void reverseTrack() {
        table.reverseTime();
    }

    /**
     * Removes tracks with less than {@link TrackerParameters#getMinLength()} detections
     * @return number of removed detections
     */
    public int removeShorts() {
        return removeShorts(parameters.getMinLength());
    }

    public int removeShorts(int minLength) {
        int removed = table.removeShorts(minLength);
        if (removed>0) logger.info("Removed {} detections belonging to tracks shorter than {}", removed, minLength);
        return removed;
    }

    public Segment getSegment(int label) {
        return table.getSegment(label);
    }

    public Stream<Segment> segments() {
        return table.segments();
    }

    public int[] times() {
        return table.times();
    }

    public int[] labels() {
        return table.labels();
    }

    /**
     * @return pairs of time points for which the assignment failed during the last call to {@link #getTrack(boolean)}
     */
    public List<int[]> getDegradedTimePairs() {
        return Collections.unmodifiableList(degradedTimePairs);
    }
}
