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
package laptrack.processing.prediction;

import com.google.common.collect.ListMultimap;
import laptrack.data_structure.DetectionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Predicts positions from the trajectory committed so far: all detections that carry the same working label up to the current time point.
 * Each coordinate is regressed independently against time. Detections with a too short history keep their last known position, with a zero variance.
 */
public class TrajectoryPredictor implements PositionPredictor {
    public static final Logger logger = LoggerFactory.getLogger(TrajectoryPredictor.class);
    /**
     * minimal number of detections of a trajectory to perform a regression
     */
    public static final int MIN_HISTORY = 3;
    final Regressor regressor;
    final double sigma;

    public TrajectoryPredictor(Regressor regressor, double sigma) {
        if (!(sigma>0)) throw new IllegalArgumentException("sigma should be positive");
        this.regressor = regressor;
        this.sigma = sigma;
    }

    @Override
    public Prediction[] predict(DetectionTable table, int t0, int t1) {
        int[] indices = table.indicesAt(t0);
        Prediction[] res = new Prediction[indices.length];
        // the two first time points can not have a long enough history
        if (table.timeIndexOf(t0)<2) {
            for (int i = 0; i<indices.length; ++i) res[i] = Prediction.fallback(table.get(indices[i]).getPosition());
            return res;
        }
        ListMultimap<Integer, Integer> history = table.workingLabelHistory(t0);
        int predicted = 0;
        for (int i = 0; i<indices.length; ++i) {
            List<Integer> traj = history.get(table.getWorkingLabel(indices[i]));
            res[i] = predict(table, traj, t0, t1);
            if (res[i]==null) res[i] = Prediction.fallback(table.get(indices[i]).getPosition());
            else if (!res[i].isFallback()) ++predicted;
        }
        logger.debug("prediction {}->{}: {}/{} positions regressed", t0, t1, predicted, indices.length);
        return res;
    }

    /**
     *
     * @param table detection table
     * @param trajectory arena indices sorted by time
     * @return prediction at {@code t1}, or null if {@code trajectory} is empty
     */
    protected Prediction predict(DetectionTable table, List<Integer> trajectory, int t0, int t1) {
        if (trajectory.isEmpty()) return null;
        double[] last = table.get(trajectory.get(trajectory.size()-1)).getPosition();
        if (trajectory.size()<MIN_HISTORY || table.get(trajectory.get(trajectory.size()-1)).getTime()!=t0) return Prediction.fallback(last);
        double[] times = trajectory.stream().mapToDouble(i -> table.get(i).getTime()).toArray();
        double[] position = new double[last.length];
        double[] variance = new double[last.length];
        for (int d = 0; d<last.length; ++d) {
            final int dim = d;
            double[] values = trajectory.stream().mapToDouble(i -> table.get(i).getCoordinate(dim)).toArray();
            try {
                Estimate e = regressor.predict(times, values, t1, sigma);
                position[d] = e.value;
                variance[d] = e.variance;
            } catch (RegressionException e) {
                logger.debug("regression failed for trajectory of {} detections ending at {}: {}", trajectory.size(), t0, e.getMessage());
                return Prediction.fallback(last);
            }
        }
        return new Prediction(position, variance, false);
    }
}
