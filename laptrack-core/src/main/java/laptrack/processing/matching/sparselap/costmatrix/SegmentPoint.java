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
package laptrack.processing.matching.sparselap.costmatrix;

import laptrack.data_structure.Detection;
import laptrack.data_structure.Segment;

/**
 * A detection of a segment, addressed by the index of the segment in the list given to {@link SegmentCostMatrixBuilder} and its position in the segment
 */
public class SegmentPoint {
    final int segmentIdx;
    final int pointIdx;
    final Segment segment;

    public SegmentPoint(int segmentIdx, Segment segment, int pointIdx) {
        this.segmentIdx = segmentIdx;
        this.segment = segment;
        this.pointIdx = pointIdx;
    }

    public int getSegmentIdx() {
        return segmentIdx;
    }

    public Segment getSegment() {
        return segment;
    }

    public Detection getDetection() {
        return segment.get(pointIdx);
    }

    public int getTime() {
        return getDetection().getTime();
    }

    public boolean isStart() {
        return pointIdx==0;
    }

    public boolean isEnd() {
        return pointIdx==segment.size()-1;
    }

    @Override
    public String toString() {
        return "S"+segmentIdx+"["+pointIdx+"]@"+getTime();
    }
}
