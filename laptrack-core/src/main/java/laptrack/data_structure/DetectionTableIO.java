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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes detection tables as comma-separated values with header {@code t,label,x,y[,z][,I]}.
 * When writing, the label column holds the primary labels of the table.
 */
public class DetectionTableIO {
    public static final Logger logger = LoggerFactory.getLogger(DetectionTableIO.class);
    public static final String SEPARATOR = ",";
    public static final String TIME = "t", LABEL = "label", X = "x", Y = "y", Z = "z", INTENSITY = "I";

    /**
     *
     * @param path CSV file
     * @return table with one detection per line
     * @throws IOException if the file cannot be read, or if the header or a line is malformed. The message gives the line number
     */
    public static DetectionTable read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header==null) throw new IOException(path+": empty file, header expected");
            List<String> columns = Arrays.asList(header.trim().split(SEPARATOR));
            boolean is3D = columns.contains(Z);
            boolean hasIntensity = columns.contains(INTENSITY);
            List<String> expected = new ArrayList<>(Arrays.asList(TIME, LABEL, X, Y));
            if (is3D) expected.add(Z);
            if (hasIntensity) expected.add(INTENSITY);
            if (!expected.equals(columns)) throw new IOException(path+" line 1: invalid header: "+header+" expected: "+String.join(SEPARATOR, expected));
            int dims = is3D ? 3 : 2;
            List<Detection> detections = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                ++lineNumber;
                if (line.trim().isEmpty()) continue;
                String[] values = line.trim().split(SEPARATOR);
                if (values.length!=expected.size()) throw new IOException(path+" line "+lineNumber+": expected "+expected.size()+" values, found "+values.length);
                try {
                    int t = Integer.parseInt(values[0].trim());
                    int label = Integer.parseInt(values[1].trim());
                    double[] position = new double[dims];
                    for (int d = 0; d<dims; ++d) position[d] = Double.parseDouble(values[2+d].trim());
                    double intensity = hasIntensity ? Double.parseDouble(values[2+dims].trim()) : Double.NaN;
                    detections.add(new Detection(t, label, position, intensity));
                } catch (NumberFormatException e) {
                    throw new IOException(path+" line "+lineNumber+": invalid number: "+e.getMessage(), e);
                }
            }
            try {
                DetectionTable table = new DetectionTable(dims, detections);
                logger.debug("read {} from {}", table, path);
                return table;
            } catch (IllegalArgumentException e) {
                throw new IOException(path+": "+e.getMessage(), e);
            }
        }
    }

    /**
     * Writes the table sorted by time then raw label. Intensity is written if all detections have one.
     * @param table detections
     * @param path destination file, parent directories are created
     * @throws IOException if the file cannot be written
     */
    public static void write(DetectionTable table, Path path) throws IOException {
        if (path.getParent()!=null) Files.createDirectories(path.getParent());
        boolean is3D = table.getDimensions()==3;
        boolean hasIntensity = table.hasIntensity();
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            List<String> header = new ArrayList<>(Arrays.asList(TIME, LABEL, X, Y));
            if (is3D) header.add(Z);
            if (hasIntensity) header.add(INTENSITY);
            writer.write(String.join(SEPARATOR, header));
            for (int i = 0; i<table.size(); ++i) {
                Detection d = table.get(i);
                StringBuilder sb = new StringBuilder();
                sb.append(d.getTime()).append(SEPARATOR).append(table.getLabel(i));
                for (int k = 0; k<d.getDimensions(); ++k) sb.append(SEPARATOR).append(d.getCoordinate(k));
                if (hasIntensity) sb.append(SEPARATOR).append(d.getIntensity());
                writer.newLine();
                writer.write(sb.toString());
            }
        }
        logger.debug("wrote {} to {}", table, path);
    }
}
