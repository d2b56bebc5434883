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
package laptrack.configuration;

import laptrack.processing.matching.sparselap.costfunction.DistanceFunction;
import laptrack.utils.JSONSerializable;
import laptrack.utils.JSONUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static laptrack.utils.SettingsUtils.checkMapKeys;
import static laptrack.utils.SettingsUtils.checkOptionalParameter;

/**
 * Parameters of a tracking session. The set of keys is closed: any unknown key is rejected at construction.
 */
public class TrackerParameters implements JSONSerializable {
    public static final Logger logger = LoggerFactory.getLogger(TrackerParameters.class);
    public static final String KEY_MAX_DISP = "max_disp";
    public static final String KEY_WINDOW_GAP = "window_gap";
    public static final String KEY_SIGMA = "sigma";
    public static final String KEY_NDIMS = "ndims";
    public static final String KEY_PREDICT = "predict";
    public static final String KEY_PREDICTOR_OPTIONS = "predictor_options";
    public static final String KEY_DISTANCE_FUNCTION = "distance_function";
    public static final String KEY_ALTERNATIVE_COST_FACTOR = "alternative_cost_factor";
    public static final String KEY_GAP_CLOSE_ONLY = "gap_close_only";
    public static final String KEY_INTENSITY_PENALTY = "intensity_penalty";
    public static final String KEY_MIN_LENGTH = "min_length";
    public static final List<String> KEYS = Collections.unmodifiableList(Arrays.asList(KEY_MAX_DISP, KEY_WINDOW_GAP, KEY_SIGMA, KEY_NDIMS, KEY_PREDICT, KEY_PREDICTOR_OPTIONS, KEY_DISTANCE_FUNCTION, KEY_ALTERNATIVE_COST_FACTOR, KEY_GAP_CLOSE_ONLY, KEY_INTENSITY_PENALTY, KEY_MIN_LENGTH));

    double maxDisp = 0.1;
    int windowGap = 10;
    double sigma = 1.;
    int ndims = 3;
    boolean predict = false;
    Map<String, Object> predictorOptions = new HashMap<>();
    DistanceFunction distanceFunction = DistanceFunction.SQUARE;
    double alternativeCostFactor = 1.05;
    boolean gapCloseOnly = true;
    double intensityPenalty = 1.;
    int minLength = 0;

    /**
     * Parameters with default values
     */
    public TrackerParameters() { }

    /**
     *
     * @param params values of the parameters, missing keys take their default value
     * @throws IllegalArgumentException if a key is unknown or a value has a wrong type or is out of range
     */
    public TrackerParameters(Map<String, ?> params) {
        setValues(params);
    }

    public static TrackerParameters fromJSON(String json) throws ParseException {
        TrackerParameters res = new TrackerParameters();
        res.initFromJSONEntry(JSONUtils.parse(json));
        return res;
    }

    protected void setValues(Map<String, ?> params) {
        StringBuilder errors = new StringBuilder();
        boolean ok = checkMapKeys(params, null, KEYS, errors);
        ok = ok & checkOptionalParameter(params, KEY_MAX_DISP, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_WINDOW_GAP, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_SIGMA, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_NDIMS, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_PREDICT, Boolean.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_PREDICTOR_OPTIONS, Map.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_DISTANCE_FUNCTION, String.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_ALTERNATIVE_COST_FACTOR, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_GAP_CLOSE_ONLY, Boolean.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_INTENSITY_PENALTY, Number.class, errors);
        ok = ok & checkOptionalParameter(params, KEY_MIN_LENGTH, Number.class, errors);
        if (!ok) throw new IllegalArgumentException("Invalid tracker parameters:\n"+errors);
        if (params.containsKey(KEY_MAX_DISP)) setMaxDisp(((Number)params.get(KEY_MAX_DISP)).doubleValue());
        if (params.containsKey(KEY_WINDOW_GAP)) setWindowGap(((Number)params.get(KEY_WINDOW_GAP)).intValue());
        if (params.containsKey(KEY_SIGMA)) setSigma(((Number)params.get(KEY_SIGMA)).doubleValue());
        if (params.containsKey(KEY_NDIMS)) setNDims(((Number)params.get(KEY_NDIMS)).intValue());
        if (params.containsKey(KEY_PREDICT)) setPredict((Boolean)params.get(KEY_PREDICT));
        if (params.containsKey(KEY_PREDICTOR_OPTIONS)) setPredictorOptions((Map<String, Object>)params.get(KEY_PREDICTOR_OPTIONS));
        if (params.containsKey(KEY_DISTANCE_FUNCTION)) setDistanceFunction(DistanceFunction.getDistanceFunction((String)params.get(KEY_DISTANCE_FUNCTION)));
        if (params.containsKey(KEY_ALTERNATIVE_COST_FACTOR)) setAlternativeCostFactor(((Number)params.get(KEY_ALTERNATIVE_COST_FACTOR)).doubleValue());
        if (params.containsKey(KEY_GAP_CLOSE_ONLY)) setGapCloseOnly((Boolean)params.get(KEY_GAP_CLOSE_ONLY));
        if (params.containsKey(KEY_INTENSITY_PENALTY)) setIntensityPenalty(((Number)params.get(KEY_INTENSITY_PENALTY)).doubleValue());
        if (params.containsKey(KEY_MIN_LENGTH)) setMinLength(((Number)params.get(KEY_MIN_LENGTH)).intValue());
    }

    /**
     * @return maximal displacement per time unit, used for gating
     */
    public double getMaxDisp() {
        return maxDisp;
    }

    public TrackerParameters setMaxDisp(double maxDisp) {
        if (!(maxDisp>0) || Double.isInfinite(maxDisp)) throw new IllegalArgumentException(KEY_MAX_DISP+" should be a finite positive number");
        this.maxDisp = maxDisp;
        return this;
    }

    /**
     * @return maximal time gap bridged by gap closing
     */
    public int getWindowGap() {
        return windowGap;
    }

    public TrackerParameters setWindowGap(int windowGap) {
        if (windowGap<1) throw new IllegalArgumentException(KEY_WINDOW_GAP+" should be >=1");
        this.windowGap = windowGap;
        return this;
    }

    /**
     * @return noise scale of the position predictor
     */
    public double getSigma() {
        return sigma;
    }

    public TrackerParameters setSigma(double sigma) {
        if (!(sigma>0)) throw new IllegalArgumentException(KEY_SIGMA+" should be positive");
        this.sigma = sigma;
        return this;
    }

    public int getNDims() {
        return ndims;
    }

    public TrackerParameters setNDims(int ndims) {
        if (ndims!=2 && ndims!=3) throw new IllegalArgumentException(KEY_NDIMS+" should be 2 or 3");
        this.ndims = ndims;
        return this;
    }

    public boolean isPredict() {
        return predict;
    }

    public TrackerParameters setPredict(boolean predict) {
        this.predict = predict;
        return this;
    }

    /**
     * @return options forwarded to the regressor of the position predictor
     */
    public Map<String, Object> getPredictorOptions() {
        return Collections.unmodifiableMap(predictorOptions);
    }

    public TrackerParameters setPredictorOptions(Map<String, Object> predictorOptions) {
        this.predictorOptions = new HashMap<>(predictorOptions);
        return this;
    }

    public DistanceFunction getDistanceFunction() {
        return distanceFunction;
    }

    public TrackerParameters setDistanceFunction(DistanceFunction distanceFunction) {
        this.distanceFunction = Objects.requireNonNull(distanceFunction);
        return this;
    }

    /**
     * @return cost of birth and death alternatives, relative to the gating cost
     */
    public double getAlternativeCostFactor() {
        return alternativeCostFactor;
    }

    public TrackerParameters setAlternativeCostFactor(double alternativeCostFactor) {
        if (!(alternativeCostFactor>=1)) throw new IllegalArgumentException(KEY_ALTERNATIVE_COST_FACTOR+" should be >=1");
        this.alternativeCostFactor = alternativeCostFactor;
        return this;
    }

    public boolean isGapCloseOnly() {
        return gapCloseOnly;
    }

    public TrackerParameters setGapCloseOnly(boolean gapCloseOnly) {
        this.gapCloseOnly = gapCloseOnly;
        return this;
    }

    public double getIntensityPenalty() {
        return intensityPenalty;
    }

    public TrackerParameters setIntensityPenalty(double intensityPenalty) {
        if (!(intensityPenalty>=0)) throw new IllegalArgumentException(KEY_INTENSITY_PENALTY+" should be >=0");
        this.intensityPenalty = intensityPenalty;
        return this;
    }

    public int getMinLength() {
        return minLength;
    }

    public TrackerParameters setMinLength(int minLength) {
        if (minLength<0) throw new IllegalArgumentException(KEY_MIN_LENGTH+" should be >=0");
        this.minLength = minLength;
        return this;
    }

    public TrackerParameters duplicate() {
        TrackerParameters res = new TrackerParameters();
        res.initFromJSONEntry(toJSONEntry());
        return res;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put(KEY_MAX_DISP, maxDisp);
        res.put(KEY_WINDOW_GAP, windowGap);
        res.put(KEY_SIGMA, sigma);
        res.put(KEY_NDIMS, ndims);
        res.put(KEY_PREDICT, predict);
        res.put(KEY_PREDICTOR_OPTIONS, JSONUtils.toJSONObject(predictorOptions));
        res.put(KEY_DISTANCE_FUNCTION, distanceFunction.getName());
        res.put(KEY_ALTERNATIVE_COST_FACTOR, alternativeCostFactor);
        res.put(KEY_GAP_CLOSE_ONLY, gapCloseOnly);
        res.put(KEY_INTENSITY_PENALTY, intensityPenalty);
        res.put(KEY_MIN_LENGTH, minLength);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Tracker parameters should be a JSON object");
        setValues((Map<String, ?>)jsonEntry);
    }

    @Override
    public String toString() {
        return JSONUtils.serialize(this);
    }
}
