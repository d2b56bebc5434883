package laptrack.processing.matching.sparselap.costmatrix;

import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.Segment;
import laptrack.processing.matching.sparselap.costfunction.DistanceFunction;
import laptrack.processing.matching.sparselap.costfunction.IntensityPenaltyCostFunction;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static laptrack.test_utils.TestUtils.d;
import static laptrack.test_utils.TestUtils.table2D;
import static org.junit.Assert.*;

public class TestSegmentCostMatrixBuilder {

    @Test
    public void testGapClosingWindow() {
        // segment 1 ends at t=1, segment 2 starts at t=4, segment 3 starts at t=9
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 1, 0.1, 0), d(4, 2, 0.4, 0), d(5, 2, 0.5, 0), d(9, 3, 0.9, 0));
        List<Segment> segments = table.segments().collect(Collectors.toList());
        LinkingCostMatrix<SegmentPoint, SegmentPoint> cm = new SegmentCostMatrixBuilder().setMaxDisp(1).setWindowGap(3).build(segments, null);
        assertEquals("sources are segment ends", 3, cm.getSources().size());
        assertEquals("targets are segment starts", 3, cm.getTargets().size());
        assertEquals("links within window only", 1, cm.getLinkCount());
        assertEquals("link source", 1, cm.getSources().get(cm.getLinkSource(0)).getSegment().getLabel());
        assertEquals("link target", 2, cm.getTargets().get(cm.getLinkTarget(0)).getSegment().getLabel());
        assertEquals("square distance", 0.09, cm.getLinkCost(0), 1e-9);
        assertEquals("alternative cost", 1.05 * 0.09, cm.getAlternativeCost(), 1e-9);

        cm = new SegmentCostMatrixBuilder().setMaxDisp(1).setWindowGap(5).build(segments, null);
        assertEquals("larger window", 2, cm.getLinkCount());
    }

    @Test
    public void testGating() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(2, 2, 3, 0));
        List<Segment> segments = table.segments().collect(Collectors.toList());
        assertEquals("gap of 2 allows displacement of 2", 0, new SegmentCostMatrixBuilder().setMaxDisp(1).build(segments, null).getLinkCount());
        assertEquals("gap of 2 allows displacement of 4", 1, new SegmentCostMatrixBuilder().setMaxDisp(2).build(segments, null).getLinkCount());
        assertEquals("absolute distance", 3, new SegmentCostMatrixBuilder().setMaxDisp(2).setDistanceFunction(DistanceFunction.ABSOLUTE).build(segments, null).getLinkCost(0), 1e-9);
    }

    @Test
    public void testMergeSplit() {
        // segment 1: t=0..2 ; segment 2 ends at t=0 next to segment 1 (merge at t=1) ; segment 3 starts at t=2 next to segment 1 (split from t=1)
        DetectionTable table = table2D(d(0, 1, 0, 0), d(1, 1, 0, 0), d(2, 1, 0, 0), d(0, 2, 0.2, 0), d(2, 3, 0.3, 0));
        List<Segment> segments = table.segments().collect(Collectors.toList());
        LinkingCostMatrix<SegmentPoint, SegmentPoint> gapOnly = new SegmentCostMatrixBuilder().setMaxDisp(1).setGapCloseOnly(true).build(segments, null);
        for (int l = 0; l<gapOnly.getLinkCount(); ++l) assertEquals("gap closing only", SegmentLinkType.GAP_CLOSING, SegmentLinkType.of(gapOnly.getSources().get(gapOnly.getLinkSource(l)), gapOnly.getTargets().get(gapOnly.getLinkTarget(l))));
        LinkingCostMatrix<SegmentPoint, SegmentPoint> cm = new SegmentCostMatrixBuilder().setMaxDisp(1).setGapCloseOnly(false).build(segments, null);
        int merge = 0, split = 0;
        for (int l = 0; l<cm.getLinkCount(); ++l) {
            SegmentPoint s = cm.getSources().get(cm.getLinkSource(l));
            SegmentPoint t = cm.getTargets().get(cm.getLinkTarget(l));
            assertNotEquals("no link within a segment", s.getSegmentIdx(), t.getSegmentIdx());
            SegmentLinkType type = SegmentLinkType.of(s, t);
            if (SegmentLinkType.MERGE.equals(type)) {
                ++merge;
                assertEquals("merge source", 2, s.getSegment().getLabel());
                assertEquals("merge target time", 1, t.getTime());
            } else if (SegmentLinkType.SPLIT.equals(type)) {
                ++split;
                assertEquals("split target", 3, t.getSegment().getLabel());
                assertEquals("split source time", 1, s.getTime());
            }
        }
        assertEquals("merge links", 1, merge);
        assertEquals("split links", 1, split);
    }

    @Test
    public void testIntensityPenalty() {
        DetectionTable table = table2D(d(0, 1, 0, 0), d(2, 2, 0.5, 0));
        List<Segment> segments = table.segments().collect(Collectors.toList());
        double[][] intensities = new double[][]{{10}, {30}};
        LinkingCostMatrix<SegmentPoint, SegmentPoint> cm = new SegmentCostMatrixBuilder().setMaxDisp(1).setIntensityPenalty(1).build(segments, intensities);
        // relative difference 20/20 = 1 -> penalty (1 + 1.5)^2
        assertEquals("penalized cost", 0.25 * 6.25, cm.getLinkCost(0), 1e-9);
        assertEquals("same intensity: no penalty", 1, new IntensityPenaltyCostFunction(1).penalty(5, 5), 0);
        assertEquals("zero weight: no penalty", 1, new IntensityPenaltyCostFunction(0).penalty(5, 50), 0);
    }
}
