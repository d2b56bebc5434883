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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import laptrack.utils.HashMapGetCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * In-memory store of all detections of a tracking session.
 * Detections are kept in an arena sorted by time then by raw label, and addressed by their index in this arena.
 * Two parallel label columns are maintained: the primary label column (initially the raw labels of the detector) and a working column written by the linking steps, later promoted to the primary column.
 * Indices are stable as long as the set of detections and their times are not modified (i.e. until {@link #addAll(Collection)}, {@link #removeShorts(int)} or {@link #reverseTime()} is called)
 */
public class DetectionTable {
    public static final Logger logger = LoggerFactory.getLogger(DetectionTable.class);
    final int dimensions;
    Detection[] detections = new Detection[0];
    int[] labels = new int[0];
    int[] workingLabels = new int[0];
    // time index: detections at times[i] are located in range [timeStart[i], timeStart[i+1])
    int[] times = new int[0];
    int[] timeStart = new int[]{0};

    public DetectionTable(int dimensions) {
        if (dimensions!=2 && dimensions!=3) throw new IllegalArgumentException("Only 2D or 3D detections are supported");
        this.dimensions = dimensions;
    }

    public DetectionTable(int dimensions, Collection<Detection> detections) {
        this(dimensions);
        addAll(detections);
    }

    /**
     * Adds detections to the table. Primary and working labels of new detections are set to their raw label.
     * @param toAdd detections
     * @throws IllegalArgumentException if a detection has the wrong dimensionality or if a (time, raw label) pair is already present
     */
    public void addAll(Collection<Detection> toAdd) {
        Set<Long> keys = Arrays.stream(detections).map(DetectionTable::key).collect(Collectors.toSet());
        List<Row> rows = new ArrayList<>(detections.length + toAdd.size());
        for (int i = 0; i<detections.length; ++i) rows.add(new Row(detections[i], labels[i], workingLabels[i]));
        for (Detection d : toAdd) {
            if (d.getDimensions()!=dimensions) throw new IllegalArgumentException("Detection "+d+" has "+d.getDimensions()+" coordinates, table has "+dimensions);
            if (!keys.add(key(d))) throw new IllegalArgumentException("Duplicate detection for time: "+d.getTime()+" and label: "+d.getLabel());
            rows.add(new Row(d, d.getLabel(), d.getLabel()));
        }
        setRows(rows);
    }

    private static long key(Detection d) {
        return ((long)d.getTime() << 32) | (d.getLabel() & 0xffffffffL);
    }

    private void setRows(List<Row> rows) {
        rows.sort(Comparator.comparingInt((Row r) -> r.detection.getTime()).thenComparingInt(r -> r.detection.getLabel()));
        int n = rows.size();
        detections = new Detection[n];
        labels = new int[n];
        workingLabels = new int[n];
        for (int i = 0; i<n; ++i) {
            Row r = rows.get(i);
            detections[i] = r.detection;
            labels[i] = r.label;
            workingLabels[i] = r.workingLabel;
        }
        // build time index
        List<Integer> t = new ArrayList<>();
        List<Integer> start = new ArrayList<>();
        for (int i = 0; i<n; ++i) {
            if (i==0 || detections[i].getTime()!=detections[i-1].getTime()) {
                t.add(detections[i].getTime());
                start.add(i);
            }
        }
        start.add(n);
        times = t.stream().mapToInt(Integer::intValue).toArray();
        timeStart = start.stream().mapToInt(Integer::intValue).toArray();
    }

    public int getDimensions() {
        return dimensions;
    }

    public int size() {
        return detections.length;
    }

    public boolean isEmpty() {
        return detections.length==0;
    }

    public Detection get(int idx) {
        return detections[idx];
    }

    public List<Detection> getDetections() {
        return Collections.unmodifiableList(Arrays.asList(detections));
    }

    public int getLabel(int idx) {
        return labels[idx];
    }

    public int getWorkingLabel(int idx) {
        return workingLabels[idx];
    }

    /**
     * Writes labels in the working column in a single step
     * @param indices arena indices
     * @param newLabels labels, in the same order as {@code indices}
     */
    public void commitWorkingLabels(int[] indices, int[] newLabels) {
        if (indices.length!=newLabels.length) throw new IllegalArgumentException("indices and labels should have same length");
        for (int i = 0; i<indices.length; ++i) workingLabels[indices[i]] = newLabels[i];
    }

    /**
     * Copies the primary label column into the working column
     */
    public void resetWorkingLabels() {
        workingLabels = Arrays.copyOf(labels, labels.length);
    }

    /**
     * Working labels become the primary labels
     */
    public void promoteWorkingLabels() {
        labels = Arrays.copyOf(workingLabels, workingLabels.length);
    }

    /**
     * Applies {@code mapping} to the primary label column, and copies the result in the working column. Labels absent from the mapping are unchanged.
     * @param mapping old label to new label
     */
    public void relabel(Map<Integer, Integer> mapping) {
        for (int i = 0; i<labels.length; ++i) {
            Integer newLabel = mapping.get(labels[i]);
            if (newLabel!=null) labels[i] = newLabel;
        }
        resetWorkingLabels();
    }

    /**
     *
     * @return maximal label among primary and working label columns, -1 if the table is empty
     */
    public int maxLabel() {
        int max = -1;
        for (int i = 0; i<labels.length; ++i) {
            if (labels[i]>max) max = labels[i];
            if (workingLabels[i]>max) max = workingLabels[i];
        }
        return max;
    }

    /**
     *
     * @return ordered unique time points
     */
    public int[] times() {
        return Arrays.copyOf(times, times.length);
    }

    /**
     *
     * @param time time point
     * @return index of {@code time} among sorted time points, or a negative value if absent
     */
    public int timeIndexOf(int time) {
        return Arrays.binarySearch(times, time);
    }

    /**
     *
     * @param time time point
     * @return arena indices of the detections at {@code time}, sorted by raw label. Empty if absent
     */
    public int[] indicesAt(int time) {
        int ti = timeIndexOf(time);
        if (ti<0) return new int[0];
        return IntStream.range(timeStart[ti], timeStart[ti+1]).toArray();
    }

    /**
     *
     * @return true if all detections of a non-empty table carry an intensity
     */
    public boolean hasIntensity() {
        return detections.length>0 && Arrays.stream(detections).allMatch(Detection::hasIntensity);
    }

    /**
     *
     * @return sorted unique primary labels
     */
    public int[] labels() {
        return Arrays.stream(labels).distinct().sorted().toArray();
    }

    /**
     *
     * @param label primary label
     * @return detections carrying {@code label}, ordered by time. Empty segment if no detection carries this label
     */
    public Segment getSegment(int label) {
        int[] idx = IntStream.range(0, labels.length).filter(i -> labels[i]==label).toArray();
        return new Segment(this, label, idx);
    }

    /**
     * All segments for the current primary labels, in ascending label order. Computed from the state of the table at the time of the call.
     * @return stream of segments
     */
    public Stream<Segment> segments() {
        HashMapGetCreate<Integer, List<Integer>> byLabel = new HashMapGetCreate<>(new HashMapGetCreate.ListFactory<>());
        for (int i = 0; i<labels.length; ++i) byLabel.getAndCreateIfNecessary(labels[i]).add(i);
        return byLabel.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new Segment(this, e.getKey(), e.getValue().stream().mapToInt(Integer::intValue).toArray()));
    }

    /**
     * Groups detections located at or before {@code maxTime} by working label
     * @param maxTime inclusive upper bound of time
     * @return map working label to arena indices, each list sorted by time
     */
    public ListMultimap<Integer, Integer> workingLabelHistory(int maxTime) {
        ListMultimap<Integer, Integer> res = ArrayListMultimap.create();
        for (int i = 0; i<detections.length && detections[i].getTime()<=maxTime; ++i) res.put(workingLabels[i], i);
        return res;
    }

    /**
     * Removes all segments that have less than {@code minLength} detections
     * @param minLength minimal number of detections of kept segments
     * @return number of removed detections
     */
    public int removeShorts(int minLength) {
        Map<Integer, Long> count = Arrays.stream(labels).boxed().collect(Collectors.groupingBy(l -> l, Collectors.counting()));
        List<Row> rows = new ArrayList<>(detections.length);
        for (int i = 0; i<detections.length; ++i) {
            if (count.get(labels[i])>=minLength) rows.add(new Row(detections[i], labels[i], workingLabels[i]));
        }
        int removed = detections.length - rows.size();
        if (removed>0) {
            setRows(rows);
            logger.debug("removed {} detections from tracks shorter than {}", removed, minLength);
        }
        return removed;
    }

    /**
     * Reverses the time axis: each time t becomes (maxTime + minTime - t), so that applying this transformation twice restores the original times. Labels follow their detections.
     */
    public void reverseTime() {
        if (detections.length==0) return;
        int sum = times[0] + times[times.length-1];
        List<Row> rows = new ArrayList<>(detections.length);
        for (int i = 0; i<detections.length; ++i) rows.add(new Row(detections[i].duplicateAtTime(sum - detections[i].getTime()), labels[i], workingLabels[i]));
        setRows(rows);
    }

    @Override
    public String toString() {
        return "DetectionTable: "+detections.length+" detections, "+times.length+" time points, "+labels().length+" labels";
    }

    private static class Row {
        final Detection detection;
        final int label, workingLabel;
        Row(Detection detection, int label, int workingLabel) {
            this.detection = detection;
            this.label = label;
            this.workingLabel = workingLabel;
        }
    }
}
