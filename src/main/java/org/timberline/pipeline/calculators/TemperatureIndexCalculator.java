package org.timberline.pipeline.calculators;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.timberline.pipeline.api.calculator.CalculationError;
import org.timberline.pipeline.api.calculator.CalculationException;
import org.timberline.pipeline.api.calculator.CalculationResult;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridVariable;
import org.timberline.pipeline.api.reference.ReferenceSurface;

import com.typesafe.config.Config;

/**
 * Yearly temperature indices from daily minimum and maximum temperature in degrees Celsius.
 * <p>
 * Supported indices:
 * <ul>
 *   <li>{@code tg_mean}: mean daily temperature, {@code (tmax + tmin) / 2}</li>
 *   <li>{@code frost_days}: days with {@code tmin} below the frost threshold</li>
 *   <li>{@code summer_days}: days with {@code tmax} above the summer threshold</li>
 *   <li>{@code tx90p}: percentage of days with {@code tmax} above the day-of-year
 *       {@code tx90p_threshold} reference surface</li>
 *   <li>{@code tn10p}: percentage of days with {@code tmin} below the day-of-year
 *       {@code tn10p_threshold} reference surface</li>
 * </ul>
 * The output has one time step per calendar year, stamped with January 1st. Missing input
 * values are skipped; a cell without any valid day yields NaN.
 * <p>
 * Options: {@code indices}, {@code tmaxVariable}, {@code tminVariable},
 * {@code frostThreshold}, {@code summerThreshold}.
 */
public class TemperatureIndexCalculator implements ICalculator {

    public static final String TG_MEAN = "tg_mean";
    public static final String FROST_DAYS = "frost_days";
    public static final String SUMMER_DAYS = "summer_days";
    public static final String TX90P = "tx90p";
    public static final String TN10P = "tn10p";

    public static final String TX90P_THRESHOLD = "tx90p_threshold";
    public static final String TN10P_THRESHOLD = "tn10p_threshold";

    private static final List<String> ALL_INDICES = List.of(TG_MEAN, FROST_DAYS, SUMMER_DAYS, TX90P, TN10P);

    private final List<String> indices;
    private final String tmaxVariable;
    private final String tminVariable;
    private final float frostThreshold;
    private final float summerThreshold;

    public TemperatureIndexCalculator(Config options) {
        this.indices = options.hasPath("indices") ? List.copyOf(options.getStringList("indices")) : ALL_INDICES;
        for (String index : indices) {
            if (!ALL_INDICES.contains(index)) {
                throw new IllegalArgumentException("Unknown temperature index '" + index + "', supported: " + ALL_INDICES);
            }
        }
        this.tmaxVariable = options.hasPath("tmaxVariable") ? options.getString("tmaxVariable") : "tmax";
        this.tminVariable = options.hasPath("tminVariable") ? options.getString("tminVariable") : "tmin";
        this.frostThreshold = options.hasPath("frostThreshold") ? (float) options.getDouble("frostThreshold") : 0f;
        this.summerThreshold = options.hasPath("summerThreshold") ? (float) options.getDouble("summerThreshold") : 25f;
    }

    @Override
    public String name() {
        return "temperature";
    }

    @Override
    public Set<String> requiredReferences() {
        Set<String> references = new LinkedHashSet<>();
        if (indices.contains(TX90P)) {
            references.add(TX90P_THRESHOLD);
        }
        if (indices.contains(TN10P)) {
            references.add(TN10P_THRESHOLD);
        }
        return references;
    }

    @Override
    public Map<String, String> globalAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("indices", String.join(",", indices));
        attributes.put("frost_threshold", Float.toString(frostThreshold));
        attributes.put("summer_threshold", Float.toString(summerThreshold));
        return attributes;
    }

    @Override
    public CalculationResult compute(GridDataset input, Map<String, ReferenceSurface> references)
            throws CalculationException {
        long[] time = input.time();
        if (time.length == 0) {
            throw new CalculationException("Input has no time steps");
        }
        YearAxis years = YearAxis.of(time);
        GridVariable tmax = input.variable(tmaxVariable);
        GridVariable tmin = input.variable(tminVariable);
        int nLat = input.extent().latCount();
        int nLon = input.extent().lonCount();

        Map<String, GridVariable> results = new LinkedHashMap<>();
        List<CalculationError> errors = new ArrayList<>();
        for (String index : indices) {
            try {
                GridVariable result = switch (index) {
                    case TG_MEAN -> meanTemperature(years, require(tmax, tmaxVariable), require(tmin, tminVariable), nLat, nLon);
                    case FROST_DAYS -> countDays(FROST_DAYS, years, require(tmin, tminVariable), nLat, nLon,
                        value -> value < frostThreshold, "Number of frost days");
                    case SUMMER_DAYS -> countDays(SUMMER_DAYS, years, require(tmax, tmaxVariable), nLat, nLon,
                        value -> value > summerThreshold, "Number of summer days");
                    case TX90P -> percentile(TX90P, years, require(tmax, tmaxVariable),
                        requireReference(references, TX90P_THRESHOLD), time, nLat, nLon, true,
                        "Percentage of days with maximum temperature above the 90th percentile");
                    default -> percentile(TN10P, years, require(tmin, tminVariable),
                        requireReference(references, TN10P_THRESHOLD), time, nLat, nLon, false,
                        "Percentage of days with minimum temperature below the 10th percentile");
                };
                results.put(index, result);
            } catch (CalculationException | RuntimeException e) {
                errors.add(new CalculationError(index, e));
            }
        }
        return new CalculationResult(years.stamps(), results, errors);
    }

    private static GridVariable require(GridVariable variable, String name) throws CalculationException {
        if (variable == null) {
            throw new CalculationException("Input variable '" + name + "' is missing");
        }
        return variable;
    }

    private static ReferenceSurface requireReference(Map<String, ReferenceSurface> references, String name)
            throws CalculationException {
        ReferenceSurface surface = references.get(name);
        if (surface == null) {
            throw new CalculationException("Reference surface '" + name + "' is missing");
        }
        return surface;
    }

    private GridVariable meanTemperature(YearAxis years, GridVariable tmax, GridVariable tmin, int nLat, int nLon) {
        float[] out = new float[years.size() * nLat * nLon];
        for (int y = 0; y < years.size(); y++) {
            for (int la = 0; la < nLat; la++) {
                for (int lo = 0; lo < nLon; lo++) {
                    double sum = 0;
                    int valid = 0;
                    for (int t : years.steps(y)) {
                        float high = tmax.get(t, la, lo);
                        float low = tmin.get(t, la, lo);
                        if (!Float.isNaN(high) && !Float.isNaN(low)) {
                            sum += (high + low) / 2.0;
                            valid++;
                        }
                    }
                    out[(y * nLat + la) * nLon + lo] = valid == 0 ? Float.NaN : (float) (sum / valid);
                }
            }
        }
        return new GridVariable(TG_MEAN, years.size(), nLat, nLon, out,
            attributes("degC", "Mean daily mean temperature"));
    }

    private interface DayTest {
        boolean matches(float value);
    }

    private GridVariable countDays(String name, YearAxis years, GridVariable source, int nLat, int nLon,
                                   DayTest test, String longName) {
        float[] out = new float[years.size() * nLat * nLon];
        for (int y = 0; y < years.size(); y++) {
            for (int la = 0; la < nLat; la++) {
                for (int lo = 0; lo < nLon; lo++) {
                    int count = 0;
                    int valid = 0;
                    for (int t : years.steps(y)) {
                        float value = source.get(t, la, lo);
                        if (!Float.isNaN(value)) {
                            valid++;
                            if (test.matches(value)) {
                                count++;
                            }
                        }
                    }
                    out[(y * nLat + la) * nLon + lo] = valid == 0 ? Float.NaN : count;
                }
            }
        }
        return new GridVariable(name, years.size(), nLat, nLon, out, attributes("days", longName));
    }

    private GridVariable percentile(String name, YearAxis years, GridVariable source, ReferenceSurface threshold,
                                    long[] time, int nLat, int nLon, boolean above, String longName) {
        if (threshold.latCount() != nLat || threshold.lonCount() != nLon) {
            throw new IllegalArgumentException("Reference surface '" + threshold.name() + "' covers "
                + threshold.latCount() + "x" + threshold.lonCount() + ", input covers " + nLat + "x" + nLon);
        }
        float[] out = new float[years.size() * nLat * nLon];
        for (int y = 0; y < years.size(); y++) {
            for (int la = 0; la < nLat; la++) {
                for (int lo = 0; lo < nLon; lo++) {
                    int count = 0;
                    int valid = 0;
                    for (int t : years.steps(y)) {
                        float value = source.get(t, la, lo);
                        float limit = threshold.forDayOfYear(dayOfYearIndex(time[t]), la, lo);
                        if (Float.isNaN(value) || Float.isNaN(limit)) {
                            continue;
                        }
                        valid++;
                        if (above ? value > limit : value < limit) {
                            count++;
                        }
                    }
                    out[(y * nLat + la) * nLon + lo] = valid == 0 ? Float.NaN : 100f * count / valid;
                }
            }
        }
        return new GridVariable(name, years.size(), nLat, nLon, out, attributes("%", longName));
    }

    static int dayOfYearIndex(long epochDay) {
        return LocalDate.ofEpochDay(epochDay).getDayOfYear() - 1;
    }

    private static Map<String, String> attributes(String units, String longName) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(GridVariable.ATTR_UNITS, units);
        attributes.put(GridVariable.ATTR_LONG_NAME, longName);
        return attributes;
    }

    /**
     * Groups daily time steps by calendar year.
     */
    private static final class YearAxis {

        private final long[] stamps;
        private final List<int[]> steps;

        private YearAxis(long[] stamps, List<int[]> steps) {
            this.stamps = stamps;
            this.steps = steps;
        }

        static YearAxis of(long[] time) {
            Map<Integer, List<Integer>> byYear = new TreeMap<>();
            for (int t = 0; t < time.length; t++) {
                byYear.computeIfAbsent(LocalDate.ofEpochDay(time[t]).getYear(), key -> new ArrayList<>()).add(t);
            }
            long[] stamps = new long[byYear.size()];
            List<int[]> steps = new ArrayList<>(byYear.size());
            int i = 0;
            for (Map.Entry<Integer, List<Integer>> entry : byYear.entrySet()) {
                stamps[i++] = LocalDate.of(entry.getKey(), 1, 1).toEpochDay();
                steps.add(entry.getValue().stream().mapToInt(Integer::intValue).toArray());
            }
            return new YearAxis(stamps, steps);
        }

        int size() {
            return stamps.length;
        }

        long[] stamps() {
            return stamps.clone();
        }

        int[] steps(int year) {
            return steps.get(year);
        }
    }
}
