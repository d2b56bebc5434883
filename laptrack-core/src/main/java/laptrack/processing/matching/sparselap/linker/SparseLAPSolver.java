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
package laptrack.processing.matching.sparselap.linker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Minimum-cost perfect matching on a sparse square cost matrix, by successive shortest augmenting paths.
 * Each augmentation runs a Dijkstra search on reduced costs {@code c(i,j) - u(i) - v(j)}, which stay non-negative thanks to the row and column potentials.
 * Only stored entries are visited, so that the complexity depends on the number of admissible links rather than on the square of the matrix size.
 */
public class SparseLAPSolver implements AssignmentSolver {
    public static final Logger logger = LoggerFactory.getLogger(SparseLAPSolver.class);

    @Override
    public Assignment solve(SparseCostMatrix costs) throws InfeasibleAssignmentException {
        if (!costs.isSquare()) throw new IllegalArgumentException("Cost matrix should be square. Got: "+costs.getNRows()+"x"+costs.getNCols());
        final int n = costs.getNRows();
        final double[] u = new double[n];
        final double[] v = new double[n];
        final int[] rowToCol = new int[n];
        final int[] colToRow = new int[n];
        Arrays.fill(rowToCol, -1);
        Arrays.fill(colToRow, -1);
        final double[] dist = new double[n];
        final int[] pred = new int[n];
        final boolean[] done = new boolean[n];
        final List<Integer> finalized = new ArrayList<>();
        final PriorityQueue<Node> heap = new PriorityQueue<>();
        long t0 = System.currentTimeMillis();
        for (int r0 = 0; r0<n; ++r0) {
            Arrays.fill(dist, Double.POSITIVE_INFINITY);
            Arrays.fill(pred, -1);
            Arrays.fill(done, false);
            finalized.clear();
            heap.clear();
            relax(costs, r0, 0, u, v, dist, pred, done, heap);
            int freeCol = -1;
            double D = 0;
            while (freeCol<0) {
                Node node = heap.poll();
                if (node==null) throw new InfeasibleAssignmentException("No augmenting path from row "+r0+": the admissible entries do not allow a perfect matching", r0);
                if (done[node.col] || node.dist>dist[node.col]) continue; // stale entry
                done[node.col] = true;
                finalized.add(node.col);
                D = node.dist;
                int i = colToRow[node.col];
                if (i<0) freeCol = node.col;
                else relax(costs, i, D, u, v, dist, pred, done, heap);
            }
            // potentials update keeps reduced costs non-negative and matched entries tight
            u[r0] += D;
            for (int j : finalized) {
                double delta = D - dist[j];
                if (delta==0) continue;
                v[j] -= delta;
                int i = colToRow[j];
                if (i>=0) u[i] += delta;
            }
            // augment along the path
            int j = freeCol;
            while (j>=0) {
                int i = pred[j];
                int prev = rowToCol[i];
                rowToCol[i] = j;
                colToRow[j] = i;
                j = i==r0 ? -1 : prev;
            }
        }
        double total = costs.totalCost(rowToCol);
        if (logger.isTraceEnabled()) logger.trace("LAP solved: size: {} non-zero: {} cost: {} in {}ms", n, costs.getNonZeroCount(), total, System.currentTimeMillis()-t0);
        return new Assignment(rowToCol, colToRow, total);
    }

    private static void relax(SparseCostMatrix costs, int row, double rowDist, double[] u, double[] v, double[] dist, int[] pred, boolean[] done, PriorityQueue<Node> heap) {
        for (int k = costs.rowStart(row); k<costs.rowEnd(row); ++k) {
            int j = costs.column(k);
            if (done[j]) continue;
            double d = rowDist + Math.max(0, costs.cost(k) - u[row] - v[j]);
            if (d<dist[j]) {
                dist[j] = d;
                pred[j] = row;
                heap.add(new Node(j, d));
            }
        }
    }

    private static class Node implements Comparable<Node> {
        final int col;
        final double dist;
        Node(int col, double dist) {
            this.col = col;
            this.dist = dist;
        }
        @Override
        public int compareTo(Node o) {
            int c = Double.compare(dist, o.dist);
            return c!=0 ? c : Integer.compare(col, o.col);
        }
    }
}
