package laptrack.ui;

import laptrack.data_structure.DetectionTable;
import laptrack.data_structure.DetectionTableIO;
import laptrack.ui.logger.ProgressLogger;
import org.json.simple.parser.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class TestTrackDetections {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    static final ProgressLogger SILENT = new ProgressLogger() {
        @Override public void setProgress(int i) { }
        @Override public void setMessage(String message) { }
        @Override public void setRunning(boolean running) { }
    };

    private Path input() throws IOException {
        // two objects over 6 frames, the second one is missing at t=2; a spurious detection at t=5
        List<String> lines = new ArrayList<>();
        lines.add("t,label,x,y");
        for (int t = 0; t<6; ++t) {
            lines.add(t+",0,"+(0.1 * t)+",0");
            if (t!=2) lines.add(t+",1,10,"+(0.1 * t));
        }
        lines.add("5,2,50,50");
        Path p = testFolder.getRoot().toPath().resolve("detections.csv");
        Files.write(p, lines, StandardCharsets.UTF_8);
        return p;
    }

    private Path parameters() throws IOException {
        Path p = testFolder.getRoot().toPath().resolve("parameters.json");
        Files.write(p, Arrays.asList("{\"max_disp\": 1, \"window_gap\": 3, \"min_length\": 2}"), StandardCharsets.UTF_8);
        return p;
    }

    @Test
    public void testRun() throws IOException, ParseException {
        Path output = testFolder.getRoot().toPath().resolve("out").resolve("tracks.csv");
        TrackDetections.run(input(), output, parameters(), false, SILENT);
        DetectionTable res = DetectionTableIO.read(output);
        assertEquals("short track removed", 11, res.size());
        assertEquals("two tracks", 2, res.labels().length);
    }

    @Test
    public void testRunReverse() throws IOException, ParseException {
        Path output = testFolder.getRoot().toPath().resolve("tracks_rev.csv");
        TrackDetections.run(input(), output, parameters(), true, SILENT);
        DetectionTable res = DetectionTableIO.read(output);
        assertArrayEquals("original time points", new int[]{0, 1, 2, 3, 4, 5}, res.times());
        assertEquals("two tracks", 2, res.labels().length);
    }

    @Test
    public void testExitStatus() throws IOException {
        Path output = testFolder.getRoot().toPath().resolve("tracks_cli.csv");
        assertEquals("success", TrackDetections.EXIT_OK, TrackDetections.execute(new String[]{input().toString(), output.toString(), parameters().toString(), TrackDetections.REVERSE}, SILENT));
        assertTrue("output written", Files.exists(output));
    }

    @Test
    public void testExitStatusUsage() {
        assertEquals("missing output", TrackDetections.EXIT_USAGE, TrackDetections.execute(new String[]{"detections.csv"}, SILENT));
        assertEquals("too many arguments", TrackDetections.EXIT_USAGE, TrackDetections.execute(new String[]{"a", "b", "c", "d"}, SILENT));
    }

    @Test
    public void testExitStatusFailure() throws IOException {
        Path missing = testFolder.getRoot().toPath().resolve("missing.csv");
        Path output = testFolder.getRoot().toPath().resolve("never.csv");
        assertEquals("missing input", TrackDetections.EXIT_FAILURE, TrackDetections.execute(new String[]{missing.toString(), output.toString()}, SILENT));
        Path badParameters = testFolder.getRoot().toPath().resolve("bad.json");
        Files.write(badParameters, Arrays.asList("{\"max_disp\": "), StandardCharsets.UTF_8);
        assertEquals("unparsable parameters", TrackDetections.EXIT_FAILURE, TrackDetections.execute(new String[]{input().toString(), output.toString(), badParameters.toString()}, SILENT));
        assertFalse("nothing written", Files.exists(output));
    }

    @Test
    public void testDefaultParameters() throws IOException, ParseException {
        Path output = testFolder.getRoot().toPath().resolve("tracks_default.csv");
        DetectionTable res = TrackDetections.run(input(), output, null, false, SILENT);
        assertEquals("nothing removed", 12, res.size());
        assertTrue("output written", Files.exists(output));
    }
}
