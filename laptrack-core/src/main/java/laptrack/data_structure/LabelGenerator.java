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
package laptrack.data_structure;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Allocates labels for new tracks. Labels are strictly increasing for the whole session, so that two births never share a label.
 */
public class LabelGenerator {
    private final AtomicInteger next;

    /**
     *
     * @param first first label that will be allocated
     */
    public LabelGenerator(int first) {
        this.next = new AtomicInteger(first);
    }

    /**
     *
     * @param table table
     * @return a generator allocating labels strictly greater than all labels of {@code table}
     */
    public static LabelGenerator above(DetectionTable table) {
        return new LabelGenerator(table.maxLabel()+1);
    }

    public int next() {
        return next.getAndIncrement();
    }

    /**
     * Ensures next allocated labels are strictly greater than {@code label}
     * @param label label already in use
     */
    public void reserveUpTo(int label) {
        next.accumulateAndGet(label+1, Math::max);
    }

    public int peek() {
        return next.get();
    }
}
