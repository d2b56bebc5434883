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

/**
 * Solver of the linear assignment problem on a sparse square cost matrix
 */
public interface AssignmentSolver {
    /**
     *
     * @param costs square sparse cost matrix with non-negative costs
     * @return a minimum-cost perfect matching
     * @throws InfeasibleAssignmentException if the admissible entries do not allow a perfect matching
     */
    Assignment solve(SparseCostMatrix costs) throws InfeasibleAssignmentException;
}
