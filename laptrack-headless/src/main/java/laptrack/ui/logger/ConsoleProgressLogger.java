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
package laptrack.ui.logger;

/**
 * Prints messages and progress to the standard output
 */
public class ConsoleProgressLogger implements ProgressLogger {
    boolean running;

    @Override
    public void setProgress(int i) {
        if (running) System.out.println("Progress: "+i+"%");
    }

    @Override
    public void setMessage(String message) {
        System.out.println(message);
    }

    @Override
    public void setRunning(boolean running) {
        this.running = running;
    }
}
