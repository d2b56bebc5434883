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

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Cost matrix in compressed-row form, following the layout of TrackMate's SparseCostMatrix: https://github.com/fiji/TrackMate
 * Only admissible entries are stored. Absent entries have an infinite cost.
 */
public class SparseCostMatrix {
    /**
     * non-zero costs, row after row
     */
    final double[] cc;
    /**
     * column index of each cost
     */
    final int[] kk;
    /**
     * number of entries of each row
     */
    final int[] number;
    /**
     * start of each row in {@link #cc} and {@link #kk}
     */
    final int[] start;
    final int nRows;
    final int nCols;

    /**
     *
     * @param cc costs, row after row
     * @param kk column index of each cost, strictly increasing within a row
     * @param number number of entries of each row
     * @param nCols number of columns
     * @throws IllegalArgumentException if the arrays are inconsistent or a cost is negative or not finite
     */
    public SparseCostMatrix(double[] cc, int[] kk, int[] number, int nCols) {
        if (cc.length!=kk.length) throw new IllegalArgumentException("Cost and column index arrays should have the same length. Got "+cc.length+" and "+kk.length);
        this.cc = cc;
        this.kk = kk;
        this.number = number;
        this.nRows = number.length;
        this.nCols = nCols;
        this.start = new int[nRows+1];
        for (int i = 0; i<nRows; ++i) start[i+1] = start[i] + number[i];
        if (start[nRows]!=cc.length) throw new IllegalArgumentException("Row counts sum to "+start[nRows]+" but "+cc.length+" costs were given");
        for (int i = 0; i<nRows; ++i) {
            for (int k = start[i]; k<start[i+1]; ++k) {
                if (kk[k]<0 || kk[k]>=nCols) throw new IllegalArgumentException("Column index out of bounds at row "+i+": "+kk[k]);
                if (k>start[i] && kk[k]<=kk[k-1]) throw new IllegalArgumentException("Column indices should be strictly increasing within row "+i);
                if (!(cc[k]>=0) || Double.isInfinite(cc[k])) throw new IllegalArgumentException("Invalid cost at row "+i+" column "+kk[k]+": "+cc[k]);
            }
        }
    }

    /**
     * Builds a sparse matrix from (row, column, cost) triplets given in any order
     * @param rows row indices
     * @param cols column indices
     * @param costs costs
     * @param nRows number of rows
     * @param nCols number of columns
     * @return sparse cost matrix
     * @throws IllegalArgumentException if an entry is given twice
     */
    public static SparseCostMatrix fromTriplets(int[] rows, int[] cols, double[] costs, int nRows, int nCols) {
        if (rows.length!=cols.length || rows.length!=costs.length) throw new IllegalArgumentException("rows, cols and costs should have same length");
        Integer[] order = IntStream.range(0, rows.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingInt((Integer i) -> rows[i]).thenComparingInt(i -> cols[i]));
        double[] cc = new double[costs.length];
        int[] kk = new int[costs.length];
        int[] number = new int[nRows];
        for (int k = 0; k<order.length; ++k) {
            int i = order[k];
            if (rows[i]<0 || rows[i]>=nRows) throw new IllegalArgumentException("Row index out of bounds: "+rows[i]);
            if (k>0 && rows[order[k-1]]==rows[i] && cols[order[k-1]]==cols[i]) throw new IllegalArgumentException("Duplicate entry: "+rows[i]+", "+cols[i]);
            cc[k] = costs[i];
            kk[k] = cols[i];
            ++number[rows[i]];
        }
        return new SparseCostMatrix(cc, kk, number, nCols);
    }

    public int getNRows() {
        return nRows;
    }

    public int getNCols() {
        return nCols;
    }

    public int getNonZeroCount() {
        return cc.length;
    }

    public boolean isSquare() {
        return nRows==nCols;
    }

    public int rowStart(int row) {
        return start[row];
    }

    public int rowEnd(int row) {
        return start[row+1];
    }

    public int column(int k) {
        return kk[k];
    }

    public double cost(int k) {
        return cc[k];
    }

    /**
     *
     * @param row row
     * @param col column
     * @param defaultValue value returned if the entry is absent
     * @return cost of entry (row, col)
     */
    public double get(int row, int col, double defaultValue) {
        int k = Arrays.binarySearch(kk, start[row], start[row+1], col);
        return k>=0 ? cc[k] : defaultValue;
    }

    /**
     *
     * @param rowToCol assignment
     * @return total cost of the assignment, infinite if an assigned entry is absent
     */
    public double totalCost(int[] rowToCol) {
        double sum = 0;
        for (int i = 0; i<rowToCol.length; ++i) {
            if (rowToCol[i]>=0) sum += get(i, rowToCol[i], Double.POSITIVE_INFINITY);
        }
        return sum;
    }

    @Override
    public String toString() {
        return "SparseCostMatrix: "+nRows+"x"+nCols+" non-zero: "+cc.length;
    }
}
