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
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * View over the detections of a {@link DetectionTable} that share one label, ordered by time.
 * Only valid as long as the indices of the table are stable.
 */
public class Segment {
    final DetectionTable table;
    final int label;
    final int[] indices;

    Segment(DetectionTable table, int label, int[] indices) {
        this.table = table;
        this.label = label;
        this.indices = indices;
    }

    public int getLabel() {
        return label;
    }

    public int size() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length==0;
    }

    public Detection get(int i) {
        return table.get(indices[i]);
    }

    public Detection first() {
        return get(0);
    }

    public Detection last() {
        return get(indices.length-1);
    }

    public int getFirstTime() {
        return first().getTime();
    }

    public int getLastTime() {
        return last().getTime();
    }

    public Stream<Detection> detections() {
        return Arrays.stream(indices).mapToObj(table::get);
    }

    public int[] times() {
        return Arrays.stream(indices).map(i -> table.get(i).getTime()).toArray();
    }

    public double[] coordinates(int dim) {
        return Arrays.stream(indices).mapToDouble(i -> table.get(i).getCoordinate(dim)).toArray();
    }

    /**
     *
     * @param placeholder value returned for detections without intensity
     * @return intensity of each detection
     */
    public double[] intensities(double placeholder) {
        return Arrays.stream(indices).mapToDouble(i -> {
            Detection d = table.get(i);
            return d.hasIntensity() ? d.getIntensity() : placeholder;
        }).toArray();
    }

    /**
     *
     * @param time time point
     * @return position of the detection at {@code time} within this segment, or -1
     */
    public int indexOfTime(int time) {
        return IntStream.range(0, indices.length).filter(i -> table.get(indices[i]).getTime()==time).findFirst().orElse(-1);
    }

    @Override
    public String toString() {
        if (isEmpty()) return "Segment:"+label+"[]";
        return "Segment:"+label+"["+getFirstTime()+"->"+getLastTime()+"] n="+size();
    }
}
