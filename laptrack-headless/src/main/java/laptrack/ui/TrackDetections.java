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
package laptrack.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import laptrack.configuration.TrackerParameters;
import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.DetectionTableIO;
import laptrack.processing.matching.GapClosingResult;
import laptrack.processing.matching.LAPTracker;
import laptrack.ui.logger.ConsoleProgressLogger;
import laptrack.ui.logger.ProgressLogger;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks the detections of a CSV file and writes the relabeled table.
 * Usage: {@code TrackDetections <detections.csv> <output.csv> [parameters.json] [--reverse]}
 */
public class TrackDetections {
    public static final org.slf4j.Logger logger = LoggerFactory.getLogger(TrackDetections.class);
    public static final String REVERSE = "--reverse";
    public static final String USAGE = "Usage: TrackDetections <detections.csv> <output.csv> [parameters.json] ["+REVERSE+"]";

    public static final int EXIT_OK = 0, EXIT_FAILURE = 1, EXIT_USAGE = 2;

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        System.exit(execute(args, new ConsoleProgressLogger()));
    }

    /**
     * Parses command line arguments and runs {@link #run(Path, Path, Path, boolean, ProgressLogger)}
     * @param args command line arguments
     * @param ui progress receiver
     * @return exit status: {@link #EXIT_OK}, {@link #EXIT_USAGE} if arguments are invalid, {@link #EXIT_FAILURE} if tracking failed
     */
    public static int execute(String[] args, ProgressLogger ui) {
        boolean reverse = false;
        List<String> positional = new ArrayList<>();
        for (String a : args) {
            if (REVERSE.equals(a)) reverse = true;
            else positional.add(a);
        }
        if (positional.size()<2) {
            ui.setMessage("Missing argument. "+USAGE);
            return EXIT_USAGE;
        } else if (positional.size()>3) {
            ui.setMessage("Too many arguments. "+USAGE);
            return EXIT_USAGE;
        }
        try {
            run(Paths.get(positional.get(0)), Paths.get(positional.get(1)), positional.size()==3 ? Paths.get(positional.get(2)) : null, reverse, ui);
            return EXIT_OK;
        } catch (IOException | ParseException | IllegalArgumentException e) {
            ui.setMessage("Error: "+e.getMessage());
            logger.error("tracking failed", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Reads detections, links them frame to frame, closes gaps, removes short tracks and writes the result
     * @param input detection CSV file
     * @param output destination CSV file
     * @param parameterFile JSON parameter file, null for default parameters
     * @param reverse link in reverse time order. Original time points are restored before writing
     * @param ui progress receiver
     * @return the tracked table
     */
    public static DetectionTable run(Path input, Path output, Path parameterFile, boolean reverse, ProgressLogger ui) throws IOException, ParseException {
        TrackerParameters parameters = parameterFile==null ? new TrackerParameters() : TrackerParameters.fromJSON(new String(Files.readAllBytes(parameterFile), StandardCharsets.UTF_8));
        DetectionTable table = DetectionTableIO.read(input);
        ui.setMessage("Read "+table+" from: "+input);
        if (table.getDimensions()<parameters.getNDims()) parameters.setNDims(table.getDimensions());
        ui.setMessage("Parameters: "+parameters);
        LAPTracker tracker = new LAPTracker(table, parameters).setProgressLogger(ui);
        if (reverse) tracker.reverseTrack();
        tracker.getTrack();
        GapClosingResult gc = tracker.closeMergeSplit();
        ui.setMessage(gc.toString());
        if (reverse) tracker.reverseTrack();
        if (parameters.getMinLength()>0) tracker.removeShorts();
        if (!tracker.getDegradedTimePairs().isEmpty()) ui.setMessage("Warning: "+tracker.getDegradedTimePairs().size()+" linking steps were degraded");
        DetectionTableIO.write(table, output);
        ui.setMessage("Wrote "+tracker.labels().length+" tracks to: "+output);
        return table;
    }
}
