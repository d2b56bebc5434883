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

import laptrack.utils.Utils;

/**
 * Predicted position of a detection, with per-coordinate variance. Fallback predictions carry the last known position and zero variance.
 */
public class Prediction {
    final double[] position;
    final double[] variance;
    final boolean fallback;

    public Prediction(double[] position, double[] variance, boolean fallback) {
        if (position.length!=variance.length) throw new IllegalArgumentException("position and variance should have same length");
        this.position = position;
        this.variance = variance;
        this.fallback = fallback;
    }

    public static Prediction fallback(double[] lastPosition) {
        return new Prediction(lastPosition, new double[lastPosition.length], true);
    }

    public double[] getPosition() {
        return position;
    }

    public double[] getVariance() {
        return variance;
    }

    /**
     * @return true if the position was not obtained by regression
     */
    public boolean isFallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return (fallback ? "Fallback" : "Prediction")+Utils.toStringArray(position)+" var="+Utils.toStringArray(variance);
    }
}
