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

/**
 * Result of a linear assignment: each row is assigned to one column and conversely
 */
public class Assignment {
    final int[] rowToCol;
    final int[] colToRow;
    final double cost;

    public Assignment(int[] rowToCol, int[] colToRow, double cost) {
        this.rowToCol = rowToCol;
        this.colToRow = colToRow;
        this.cost = cost;
    }

    public int[] getRowToCol() {
        return Arrays.copyOf(rowToCol, rowToCol.length);
    }

    public int[] getColToRow() {
        return Arrays.copyOf(colToRow, colToRow.length);
    }

    public int getCol(int row) {
        return rowToCol[row];
    }

    public int getRow(int col) {
        return colToRow[col];
    }

    public double getCost() {
        return cost;
    }
}
