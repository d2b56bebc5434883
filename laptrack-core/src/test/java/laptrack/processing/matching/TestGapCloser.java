package laptrack.processing.matching;

import laptrack.configuration.TrackerParameters;
import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.LabelGenerator;
import laptrack.processing.matching.sparselap.costmatrix.SegmentLinkType;
import laptrack.processing.matching.sparselap.linker.InfeasibleAssignmentException;
import laptrack.processing.matching.sparselap.linker.SparseLAPSolver;
import org.junit.Test;

import static laptrack.test_utils.TestUtils.d;
import static laptrack.test_utils.TestUtils.table2D;
import static org.junit.Assert.*;

public class TestGapCloser {

    /**
     * label 1 at t=0..2, label 2 at t=5..7 continuing label 1, label 3 far away at t=0..7
     */
    private static DetectionTable gapTable() {
        return table2D(
                d(0, 1, 0, 0), d(1, 1, 0.1, 0), d(2, 1, 0.2, 0),
                d(5, 2, 0.5, 0), d(6, 2, 0.6, 0), d(7, 2, 0.7, 0),
                d(0, 3, 50, 50), d(7, 3, 50, 50));
    }

    @Test
    public void testGapClosing() {
        DetectionTable table = gapTable();
        int size = table.size();
        LabelGenerator gen = LabelGenerator.above(table);
        GapClosingResult res = new GapCloser(new TrackerParameters().setMaxDisp(1).setNDims(2), gen, new SparseLAPSolver()).close(table);
        assertEquals("no detection removed", size, table.size());
        assertEquals("chain takes lowest label", 6, table.getSegment(1).size());
        assertEquals("label 2 disappears", 0, table.getSegment(2).size());
        int l3 = res.getLabelMapping().get(3);
        assertTrue("unstitched segment receives a new label", l3>3);
        assertEquals("label 3 segment", 2, table.getSegment(l3).size());
        assertEquals("one gap-closing link", 1, res.getLinks(SegmentLinkType.GAP_CLOSING).size());
        assertFalse("not degraded", res.isDegraded());
        assertEquals("working column follows", 1, table.getWorkingLabel(table.indicesAt(7)[0]));
    }

    @Test
    public void testWindowGap() {
        DetectionTable table = gapTable();
        GapClosingResult res = new GapCloser(new TrackerParameters().setMaxDisp(1).setNDims(2).setWindowGap(2), LabelGenerator.above(table), new SparseLAPSolver()).close(table);
        assertEquals("no gap-closing link beyond window", 0, res.getLinks(SegmentLinkType.GAP_CLOSING).size());
        assertEquals("three tracks", 3, table.labels().length);
        for (int l : table.labels()) assertTrue("all labels are new", l>3);
    }

    @Test
    public void testIntensityPreventsLink() {
        // end of label 1 and start of label 2 are close, but intensities differ a lot; label 3 starts a bit further with the same intensity
        DetectionTable table = table2D(
                d(0, 1, 0, 0, 10), d(1, 1, 0, 0, 10),
                d(3, 2, 0.3, 0, 1000), d(4, 2, 0.3, 0, 1000),
                d(3, 3, 0.5, 0, 10), d(4, 3, 0.5, 0, 10));
        TrackerParameters p = new TrackerParameters().setMaxDisp(1).setNDims(2).setIntensityPenalty(1);
        new GapCloser(p, LabelGenerator.above(table), new SparseLAPSolver()).close(table);
        assertEquals("label 1 continues with same intensity segment", 1, table.getLabel(table.indicesAt(3)[1]));
        assertNotEquals("high intensity segment not stitched", 1, table.getLabel(table.indicesAt(3)[0]));
    }

    @Test
    public void testMergeSplitReported() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 1, 0, 0), d(2, 1, 0, 0), d(0, 2, 0.2, 0), d(2, 3, 0.3, 0));
        TrackerParameters p = new TrackerParameters().setMaxDisp(1).setNDims(2).setGapCloseOnly(false).setWindowGap(1);
        GapClosingResult res = new GapCloser(p, LabelGenerator.above(table), new SparseLAPSolver()).close(table);
        assertEquals("merge reported", 1, res.getLinks(SegmentLinkType.MERGE).size());
        assertEquals("split reported", 1, res.getLinks(SegmentLinkType.SPLIT).size());
        assertEquals("labels are not merged", 3, table.labels().length);
        assertEquals("merge source label", 2, res.getLinks(SegmentLinkType.MERGE).get(0).getSourceLabel());
        assertEquals("merge target label", 1, res.getLinks(SegmentLinkType.MERGE).get(0).getTargetLabel());
        assertEquals("merge from the end of label 2", 0, res.getLinks(SegmentLinkType.MERGE).get(0).getSourceTime());
        assertEquals("merge into the middle of label 1", 1, res.getLinks(SegmentLinkType.MERGE).get(0).getTargetTime());
        assertEquals("split target label", 3, res.getLinks(SegmentLinkType.SPLIT).get(0).getTargetLabel());
        assertEquals("split to the start of label 3", 2, res.getLinks(SegmentLinkType.SPLIT).get(0).getTargetTime());
    }

    @Test
    public void testInfeasibleFallback() {
        DetectionTable table = gapTable();
        GapClosingResult res = new GapCloser(new TrackerParameters().setMaxDisp(1).setNDims(2), LabelGenerator.above(table), costs -> { throw new InfeasibleAssignmentException("test", 0); }).close(table);
        assertTrue("degraded", res.isDegraded());
        assertEquals("segments kept apart", 3, table.labels().length);
        for (int l : table.labels()) assertTrue("all labels are new", l>3);
    }
}
