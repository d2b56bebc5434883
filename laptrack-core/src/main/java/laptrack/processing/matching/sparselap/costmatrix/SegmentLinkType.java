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

/**
 * Kind of link between two segments
 */
public enum SegmentLinkType {
    /**
     * end of a segment to the start of a later segment
     */
    GAP_CLOSING,
    /**
     * end of a segment to a non-start point of another segment at the next time point
     */
    MERGE,
    /**
     * non-end point of a segment to the start of another segment at the next time point
     */
    SPLIT;

    public static SegmentLinkType of(SegmentPoint source, SegmentPoint target) {
        if (source.isEnd() && target.isStart()) return GAP_CLOSING;
        if (source.isEnd()) return MERGE;
        if (target.isStart()) return SPLIT;
        throw new IllegalArgumentException("No link type between "+source+" and "+target);
    }
}
