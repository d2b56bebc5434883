package laptrack.processing.matching.sparselap.linker;

import laptrack.processing.matching.sparselap.costmatrix.LinkingCostMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Solves the linking problem described by a {@link LinkingCostMatrix} and reads back which source is linked to which target.
 * Adapted from TrackMate's JaqamanLinker: https://github.com/fiji/TrackMate
 * @param <S> type of sources
 * @param <T> type of targets
 */
public class JaqamanLinker<S, T> {
    public static final Logger logger = LoggerFactory.getLogger(JaqamanLinker.class);
    private final LinkingCostMatrix<S, T> costMatrix;
    private final AssignmentSolver solver;
    private int[] sourceToTarget;
    private int[] targetToSource;
    private double[] linkCosts;

    public JaqamanLinker(LinkingCostMatrix<S, T> costMatrix, AssignmentSolver solver) {
        this.costMatrix = costMatrix;
        this.solver = solver;
    }

    /**
     * Runs the assignment
     * @throws InfeasibleAssignmentException if the solver finds no perfect matching
     */
    public void process() throws InfeasibleAssignmentException {
        final int n = costMatrix.getSources().size();
        final int m = costMatrix.getTargets().size();
        sourceToTarget = new int[n];
        targetToSource = new int[m];
        linkCosts = new double[n];
        Arrays.fill(sourceToTarget, -1);
        Arrays.fill(targetToSource, -1);
        Arrays.fill(linkCosts, Double.NaN);
        if (n==0 || m==0 || costMatrix.getLinkCount()==0) return;
        SparseCostMatrix scm = costMatrix.toSparse();
        Assignment a = solver.solve(scm);
        for (int i = 0; i<n; ++i) {
            int j = a.getCol(i);
            if (j>=0 && j<m) {
                sourceToTarget[i] = j;
                targetToSource[j] = i;
                linkCosts[i] = scm.get(i, j, Double.NaN);
            }
        }
        if (logger.isTraceEnabled()) logger.trace("linked {} sources to {} targets: {} links, total cost: {}", n, m, Arrays.stream(sourceToTarget).filter(j -> j>=0).count(), a.getCost());
    }

    /**
     * @return for each source, index of the linked target or -1 (death)
     */
    public int[] getSourceToTarget() {
        return sourceToTarget;
    }

    /**
     * @return for each target, index of the linked source or -1 (birth)
     */
    public int[] getTargetToSource() {
        return targetToSource;
    }

    /**
     * @return for each source, cost of its link or NaN if unlinked
     */
    public double[] getLinkCosts() {
        return linkCosts;
    }
}
