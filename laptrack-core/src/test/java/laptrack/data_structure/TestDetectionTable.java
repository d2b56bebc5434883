package laptrack.data_structure;

import org.junit.Test;

import java.util.*;
import java.util.stream.Collectors;

import static laptrack.test_utils.TestUtils.d;
import static laptrack.test_utils.TestUtils.table2D;
import static org.junit.Assert.*;

public class TestDetectionTable {

    @Test
    public void testSortingAndTimeIndex() {
        DetectionTable table = table2D(d(2, 1, 0, 0), d(0, 5, 1, 1), d(0, 2, 2, 2), d(2, 0, 3, 3));
        assertArrayEquals("times", new int[]{0, 2}, table.times());
        assertEquals("first label at t=0", 2, table.get(table.indicesAt(0)[0]).getLabel());
        assertEquals("second label at t=0", 5, table.get(table.indicesAt(0)[1]).getLabel());
        assertEquals("no detection at t=1", 0, table.indicesAt(1).length);
        assertEquals("time index", 1, table.timeIndexOf(2));
        assertTrue("absent time", table.timeIndexOf(1)<0);
        assertEquals("max label", 5, table.maxLabel());
        assertEquals("empty table max label", -1, new DetectionTable(3).maxLabel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateTimeLabel() {
        table2D(d(0, 1, 0, 0), d(0, 1, 1, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDimensionMismatch() {
        new DetectionTable(3, Collections.singletonList(d(0, 1, 0, 0)));
    }

    @Test
    public void testSegments() {
        DetectionTable table = table2D(d(0, 3, 0, 0), d(1, 3, 1, 0), d(0, 1, 5, 5), d(2, 3, 2, 0));
        Segment s = table.getSegment(3);
        assertEquals("segment size", 3, s.size());
        assertArrayEquals("segment times", new int[]{0, 1, 2}, s.times());
        assertArrayEquals("segment x", new double[]{0, 1, 2}, s.coordinates(0), 0);
        assertEquals("index of time", 1, s.indexOfTime(1));
        assertTrue("absent label gives empty segment", table.getSegment(42).isEmpty());
        List<Integer> labels = table.segments().map(Segment::getLabel).collect(Collectors.toList());
        assertEquals("segments in label order", Arrays.asList(1, 3), labels);
        assertArrayEquals("placeholder intensities", new double[]{1, 1, 1}, s.intensities(1), 0);
    }

    @Test
    public void testWorkingLabels() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 1, 1, 0), d(1, 2, 2, 0));
        int[] idx = table.indicesAt(1);
        table.commitWorkingLabels(idx, new int[]{7, 8});
        assertEquals("primary label unchanged", 1, table.getLabel(idx[0]));
        assertEquals("working label", 7, table.getWorkingLabel(idx[0]));
        assertEquals("max label includes working labels", 8, table.maxLabel());
        assertEquals("history of label 1 at t=0", 1, table.workingLabelHistory(0).get(1).size());
        assertEquals("history of label 1 at t=1", 1, table.workingLabelHistory(1).get(1).size());
        assertEquals("history of label 7 at t=1", 1, table.workingLabelHistory(1).get(7).size());
        table.promoteWorkingLabels();
        assertArrayEquals("promoted labels", new int[]{1, 7, 8}, table.labels());
        table.resetWorkingLabels();
        assertEquals("reset working label", 7, table.getWorkingLabel(idx[0]));
    }

    @Test
    public void testRelabel() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 2, 1, 0), d(1, 3, 2, 0));
        Map<Integer, Integer> mapping = new HashMap<>();
        mapping.put(2, 1);
        mapping.put(1, 10);
        table.relabel(mapping);
        assertArrayEquals("relabeled", new int[]{1, 3, 10}, table.labels());
        assertEquals("working column follows", 10, table.getWorkingLabel(table.indicesAt(0)[0]));
    }

    @Test
    public void testRemoveShorts() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 1, 1, 0), d(2, 1, 2, 0), d(0, 2, 5, 5), d(1, 2, 6, 5), d(2, 3, 9, 9));
        List<Detection> kept = table.getSegment(1).detections().collect(Collectors.toList());
        int removed = table.removeShorts(3);
        assertEquals("removed count", 3, removed);
        assertEquals("remaining size", 3, table.size());
        assertArrayEquals("remaining labels", new int[]{1}, table.labels());
        assertEquals("remaining detections unchanged", kept, table.getSegment(1).detections().collect(Collectors.toList()));
        assertEquals("nothing more to remove", 0, table.removeShorts(3));
    }

    @Test
    public void testReverseTimeTwice() {
        DetectionTable table = table2D(d(3, 1, 0, 0), d(4, 1, 1, 0), d(7, 2, 5, 5), d(7, 1, 2, 0));
        List<Detection> before = new ArrayList<>(table.getDetections());
        int[] labelsBefore = table.labels();
        table.reverseTime();
        assertArrayEquals("reversed times", new int[]{3, 6, 7}, table.times());
        assertEquals("label follows detection", 1, table.getLabel(table.indicesAt(3)[0]));
        table.reverseTime();
        assertEquals("detections restored", before, table.getDetections());
        assertArrayEquals("labels restored", labelsBefore, table.labels());
    }

    @Test
    public void testIntensity() {
        assertFalse("no intensity", table2D(d(0, 1, 0, 0)).hasIntensity());
        assertTrue("intensity", table2D(new Detection(0, 1, new double[]{0, 0}, 3)).hasIntensity());
        assertFalse("empty table", new DetectionTable(2).hasIntensity());
    }
}
