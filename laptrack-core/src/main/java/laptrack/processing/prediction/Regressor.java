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

/**
 * One-dimensional regression of a time series
 */
public interface Regressor {
    /**
     *
     * @param times sample times, distinct
     * @param values sample values
     * @param queryTime time at which the series is estimated
     * @param sigma noise scale: the relative noise of a sample of value v is (sigma / (|v| + sigma))^2
     * @return estimate at {@code queryTime}
     * @throws RegressionException if the regression is numerically impossible with these samples
     */
    Estimate predict(double[] times, double[] values, double queryTime, double sigma) throws RegressionException;
}
