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

import laptrack.data_structure.DetectionTable;

/**
 * Estimates where the detections of a time point will be at a later time point
 */
public interface PositionPredictor {
    /**
     *
     * @param table detections, with working labels committed up to {@code t0}
     * @param t0 time of the detections to predict
     * @param t1 time at which positions are predicted
     * @return one prediction per detection at {@code t0}, in the order of {@link DetectionTable#indicesAt(int)}
     */
    Prediction[] predict(DetectionTable table, int t0, int t1);
}
