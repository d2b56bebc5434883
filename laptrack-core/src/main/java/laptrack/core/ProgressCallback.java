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
package laptrack.core;

import laptrack.ui.logger.ProgressLogger;

/**
 * Converts a number of completed tasks into a percentage reported to a {@link ProgressLogger}
 */
public interface ProgressCallback {
    void setTaskNumber(int number);
    void incrementProgress();
    void setRunning(boolean running);

    static ProgressCallback get(ProgressLogger ui, int taskNumber) {
        ProgressCallback pcb = get(ui);
        pcb.setTaskNumber(taskNumber);
        return pcb;
    }
    static ProgressCallback get(ProgressLogger ui) {
        ProgressCallback pcb = new ProgressCallback(){
            double taskCounter = 0;
            double taskNumber = 0;
            int lastProgress = -1;

            @Override
            public void setRunning(boolean running) {
                ui.setRunning(running);
            }

            @Override
            public void setTaskNumber(int number) {
                taskNumber = number;
                taskCounter = 0;
                lastProgress = -1;
            }

            @Override
            public synchronized void incrementProgress() {
                taskCounter++;
                if (taskNumber >0) {
                    int p = (int)(100 * (taskCounter / taskNumber));
                    if (p!=lastProgress) {
                        lastProgress = p;
                        ui.setProgress(p);
                    }
                }
            }
        };
        return pcb;
    }

    /**
     * @return a callback that reports nothing
     */
    static ProgressCallback none() {
        return new ProgressCallback() {
            @Override public void setTaskNumber(int number) { }
            @Override public void incrementProgress() { }
            @Override public void setRunning(boolean running) { }
        };
    }
}
