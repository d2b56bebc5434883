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
package laptrack.data_structure;

import java.util.Arrays;

/**
 * A single localized object at one time point, as produced by an upstream detector.
 * Immutable: relabeling happens in the label columns of {@link DetectionTable}, never here.
 */
public class Detection {
    final int time;
    final int label;
    final double[] position;
    final double intensity;

    public Detection(int time, int label, double[] position) {
        this(time, label, position, Double.NaN);
    }

    /**
     *
     * @param time time point
     * @param label per-frame label given by the detector
     * @param position 2 or 3 coordinates (x, y[, z])
     * @param intensity intensity or {@link Double#NaN} if the detector does not provide one
     */
    public Detection(int time, int label, double[] position, double intensity) {
        if (position==null || position.length<2 || position.length>3) throw new IllegalArgumentException("Position should have 2 or 3 coordinates");
        this.time = time;
        this.label = label;
        this.position = Arrays.copyOf(position, position.length);
        this.intensity = intensity;
    }

    public int getTime() {
        return time;
    }

    public int getLabel() {
        return label;
    }

    public int getDimensions() {
        return position.length;
    }

    public double getCoordinate(int dim) {
        return position[dim];
    }

    public double[] getPosition() {
        return Arrays.copyOf(position, position.length);
    }

    public boolean hasIntensity() {
        return !Double.isNaN(intensity);
    }

    public double getIntensity() {
        return intensity;
    }

    /**
     * @return a copy of this detection located at {@code newTime}
     */
    public Detection duplicateAtTime(int newTime) {
        return new Detection(newTime, label, position, intensity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Detection other = (Detection) o;
        return time == other.time && label == other.label
                && Double.compare(intensity, other.intensity) == 0
                && Arrays.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + time;
        hash = 29 * hash + label;
        hash = 29 * hash + Double.hashCode(intensity);
        hash = 29 * hash + Arrays.hashCode(position);
        return hash;
    }

    @Override
    public String toString() {
        return "T:"+time+"-L:"+label+Arrays.toString(position)+(hasIntensity()?"-I:"+intensity:"");
    }
}
