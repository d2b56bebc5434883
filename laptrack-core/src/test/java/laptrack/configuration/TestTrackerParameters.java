package laptrack.configuration;

import laptrack.processing.matching.sparselap.costfunction.DistanceFunction;
import org.json.simple.parser.ParseException;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TestTrackerParameters {

    @Test
    public void testDefaults() {
        TrackerParameters p = new TrackerParameters();
        assertEquals("max_disp", 0.1, p.getMaxDisp(), 0);
        assertEquals("window_gap", 10, p.getWindowGap());
        assertEquals("sigma", 1, p.getSigma(), 0);
        assertEquals("ndims", 3, p.getNDims());
        assertFalse("predict", p.isPredict());
        assertEquals("distance function", DistanceFunction.SQUARE, p.getDistanceFunction());
        assertEquals("alternative cost factor", 1.05, p.getAlternativeCostFactor(), 0);
        assertTrue("gap close only", p.isGapCloseOnly());
        assertEquals("min length", 0, p.getMinLength());
    }

    @Test
    public void testFromMap() {
        Map<String, Object> map = new HashMap<>();
        map.put(TrackerParameters.KEY_MAX_DISP, 2);
        map.put(TrackerParameters.KEY_NDIMS, 2);
        map.put(TrackerParameters.KEY_DISTANCE_FUNCTION, "absolute");
        TrackerParameters p = new TrackerParameters(map);
        assertEquals("max_disp", 2, p.getMaxDisp(), 0);
        assertEquals("ndims", 2, p.getNDims());
        assertEquals("distance function", DistanceFunction.ABSOLUTE, p.getDistanceFunction());
        assertEquals("unspecified key keeps default", 10, p.getWindowGap());
    }

    @Test
    public void testUnknownKeys() {
        Map<String, Object> map = new HashMap<>();
        map.put("max_displacement", 1);
        map.put("gp_theta0", 0.2);
        try {
            new TrackerParameters(map);
            fail("unknown keys should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue("first key listed", e.getMessage().contains("max_displacement"));
            assertTrue("second key listed", e.getMessage().contains("gp_theta0"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongType() {
        Map<String, Object> map = new HashMap<>();
        map.put(TrackerParameters.KEY_PREDICT, "yes");
        new TrackerParameters(map);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRange() {
        new TrackerParameters().setNDims(4);
    }

    @Test
    public void testJSON() throws ParseException {
        TrackerParameters p = TrackerParameters.fromJSON("{\"max_disp\": 0.5, \"window_gap\": 3, \"predict\": true, \"predictor_options\": {\"regr\": \"linear\", \"theta0\": 0.2}}");
        assertEquals("max_disp", 0.5, p.getMaxDisp(), 0);
        assertEquals("window_gap", 3, p.getWindowGap());
        assertTrue("predict", p.isPredict());
        assertEquals("predictor option", "linear", p.getPredictorOptions().get("regr"));
        TrackerParameters dup = p.duplicate();
        assertEquals("duplicate", p.toJSONEntry(), dup.toJSONEntry());
    }
}
