package laptrack.processing.matching;

import laptrack.configuration.TrackerParameters;
import laptrack.data_structure.Detection;
import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.LabelGenerator;
import laptrack.processing.matching.sparselap.linker.AssignmentSolver;
import laptrack.processing.matching.sparselap.linker.InfeasibleAssignmentException;
import laptrack.processing.matching.sparselap.linker.SparseLAPSolver;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static laptrack.test_utils.TestUtils.d;
import static laptrack.test_utils.TestUtils.table2D;
import static org.junit.Assert.*;

public class TestFrameLinker {
    static final int A = 0, B = 1;

    private static FrameLinker linker(double maxDisp, LabelGenerator gen, AssignmentSolver solver) {
        return new FrameLinker(new TrackerParameters().setMaxDisp(maxDisp).setNDims(2), gen, solver, null);
    }

    @Test
    public void testNearestNeighbors() {
        DetectionTable table = table2D(d(0, A, 0, 0), d(0, B, 10, 10), d(1, 0, 0.1, 0.1), d(1, 1, 10.2, 9.9));
        LabelGenerator gen = LabelGenerator.above(table);
        LinkingStep step = linker(1, gen, new SparseLAPSolver()).link(table, 0, 1, false);
        int[] t1 = table.indicesAt(1);
        assertEquals("first point links to A", A, table.getWorkingLabel(t1[0]));
        assertEquals("second point links to B", B, table.getWorkingLabel(t1[1]));
        assertEquals("no births", 0, step.getBirthCount());
        assertEquals("links", 2, step.getLinkCount());
        assertFalse("not degraded", step.isDegraded());
        assertEquals("no label allocated", 2, gen.peek());
    }

    @Test
    public void testCrossedLabels() {
        // raw labels at t=1 are in the opposite order of the correspondence
        DetectionTable table = table2D(d(0, A, 0, 0), d(0, B, 10, 10), d(1, 0, 10.2, 9.9), d(1, 1, 0.1, 0.1));
        linker(1, LabelGenerator.above(table), new SparseLAPSolver()).link(table, 0, 1, false);
        int[] t1 = table.indicesAt(1);
        assertEquals("first point links to B", B, table.getWorkingLabel(t1[0]));
        assertEquals("second point links to A", A, table.getWorkingLabel(t1[1]));
    }

    @Test
    public void testBirthBeyondGate() {
        DetectionTable table = table2D(d(0, A, 0, 0), d(1, 0, 5, 5));
        LinkingStep step = linker(0.1, LabelGenerator.above(table), new SparseLAPSolver()).link(table, 0, 1, false);
        int label = table.getWorkingLabel(table.indicesAt(1)[0]);
        assertTrue("new label strictly greater than A", label>A);
        assertEquals("birth", 1, step.getBirthCount());
        assertEquals("death", 1, step.getDeathCount());
    }

    @Test
    public void testGateScalesWithTimeGap() {
        // displacement of 1.5 over 2 time units with max_disp = 1
        DetectionTable table = table2D(d(0, 5, 0, 0), d(2, 0, 1.5, 0));
        linker(1, LabelGenerator.above(table), new SparseLAPSolver()).link(table, 0, 2, false);
        assertEquals("linked", 5, table.getWorkingLabel(table.indicesAt(2)[0]));
    }

    @Test
    public void testRecoversPermutation() {
        Random r = new Random(3);
        int n = 20;
        List<Integer> perm = new ArrayList<>();
        for (int i = 0; i<n; ++i) perm.add(i);
        Collections.shuffle(perm, r);
        List<Detection> dets = new ArrayList<>();
        for (int i = 0; i<n; ++i) {
            dets.add(d(0, i, 10 * i, 0));
            // detection i at t=1 is a small displacement of detection perm(i) at t=0
            dets.add(d(1, i, 10 * perm.get(i) + r.nextDouble() * 0.5, r.nextDouble() * 0.5));
        }
        DetectionTable table = new DetectionTable(2, dets);
        linker(1, LabelGenerator.above(table), new SparseLAPSolver()).link(table, 0, 1, false);
        int[] t1 = table.indicesAt(1);
        for (int i = 0; i<n; ++i) assertEquals("correspondence of "+i, (int)perm.get(i), table.getWorkingLabel(t1[i]));
    }

    /**
     * one detection at t=0 and two candidates at t=1: candidate 0 is closer in x and y but far in z, candidate 1 is on the same z plane
     */
    private static DetectionTable table3D() {
        return new DetectionTable(3, Arrays.asList(
                new Detection(0, A, new double[]{0, 0, 0}),
                new Detection(1, 0, new double[]{0.1, 0, 0.95}),
                new Detection(1, 1, new double[]{0.3, 0, 0})));
    }

    @Test
    public void testThreeDimensions() {
        DetectionTable table = table3D();
        FrameLinker linker = new FrameLinker(new TrackerParameters().setMaxDisp(1).setNDims(3), LabelGenerator.above(table), new SparseLAPSolver(), null);
        LinkingStep step = linker.link(table, 0, 1, false);
        int[] t1 = table.indicesAt(1);
        assertEquals("candidate on the same plane linked", A, table.getWorkingLabel(t1[1]));
        assertNotEquals("candidate far in z starts a track", A, table.getWorkingLabel(t1[0]));
        assertEquals("one birth", 1, step.getBirthCount());
    }

    @Test
    public void testTwoDimensionsIgnoreZ() {
        DetectionTable table = table3D();
        FrameLinker linker = new FrameLinker(new TrackerParameters().setMaxDisp(1).setNDims(2), LabelGenerator.above(table), new SparseLAPSolver(), null);
        linker.link(table, 0, 1, false);
        int[] t1 = table.indicesAt(1);
        assertEquals("candidate closest in x and y linked", A, table.getWorkingLabel(t1[0]));
        assertNotEquals("other candidate starts a track", A, table.getWorkingLabel(t1[1]));
    }

    @Test
    public void testInfeasibleFallback() {
        DetectionTable table = table2D(d(0, A, 0, 0), d(0, B, 10, 10), d(1, 0, 0.1, 0.1), d(1, 1, 10.2, 9.9));
        AssignmentSolver failing = costs -> { throw new InfeasibleAssignmentException("test", 0); };
        LinkingStep step = linker(1, LabelGenerator.above(table), failing).link(table, 0, 1, false);
        assertTrue("degraded", step.isDegraded());
        int[] t1 = table.indicesAt(1);
        int l0 = table.getWorkingLabel(t1[0]);
        int l1 = table.getWorkingLabel(t1[1]);
        assertTrue("all detections receive new labels", l0>B && l1>B);
        assertNotEquals("new labels are distinct", l0, l1);
        assertEquals("t0 labels unchanged", A, table.getWorkingLabel(table.indicesAt(0)[0]));
    }
}
