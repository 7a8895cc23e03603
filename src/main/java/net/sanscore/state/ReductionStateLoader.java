/*-
 * #%L
 * SANS-Core: numeric reduction of small-angle scattering data.
 * %%
 * Copyright (C) 2024 - 2026 SANS-Core developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package net.sanscore.state;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import net.sanscore.SANSUtils;
import net.sanscore.data.BinningParams;

/**
 * Builds a {@link ReductionState} from key/value properties. Keys missing from
 * the supplied properties fall back to the {@code sans-defaults.properties}
 * resource and then to the defaults of the configured {@link Instrument}.
 * <p>
 * Lists are comma separated; intervals are written {@code start:stop}.
 * </p>
 * <table>
 * <caption>Recognized keys</caption>
 * <tr><td>{@value #KEY_INSTRUMENT}</td><td>instrument name (LOQ, SANS2D, ...)</td></tr>
 * <tr><td>{@value #KEY_LAB_SPECTRA}, {@value #KEY_HAB_SPECTRA}</td><td>spectrum ranges of the banks, {@code first:last}</td></tr>
 * <tr><td>{@value #KEY_PIXEL_WIDTH}, {@value #KEY_PIXEL_HEIGHT}, {@value #KEY_L1}</td><td>geometry, in metres</td></tr>
 * <tr><td>{@value #KEY_CENTRE_LAB}, {@value #KEY_CENTRE_HAB}</td><td>beam centre, {@code x,y}</td></tr>
 * <tr><td>{@value #KEY_TOF_BINNING}, {@value #KEY_Q_BINNING}</td><td>{@code min,step,max}</td></tr>
 * <tr><td>{@value #KEY_WAVELENGTH_MIN}, {@value #KEY_WAVELENGTH_MAX}, {@value #KEY_WAVELENGTH_STEP}</td><td>wavelength binning</td></tr>
 * <tr><td>{@value #KEY_WAVELENGTH_RANGES}</td><td>wavelength sub-ranges</td></tr>
 * <tr><td>{@value #KEY_MASK_SPECTRA}, {@value #KEY_MASK_TIME}</td><td>masked spectra (numbers or ranges), masked TOF windows</td></tr>
 * <tr><td>{@value #KEY_RADIUS_MIN}, {@value #KEY_RADIUS_MAX}</td><td>radius limits, in metres</td></tr>
 * <tr><td>{@value #KEY_INCIDENT_MONITOR}, {@value #KEY_BACKGROUND}, {@code monitor.background.N}, {@value #KEY_PROMPT_PEAK}, {@value #KEY_MONITOR_SCALE}</td><td>normalization</td></tr>
 * <tr><td>{@value #KEY_TRANSMISSION_MONITOR}, {@value #KEY_TRANSMISSION_FIT}, {@value #KEY_TRANSMISSION_FIT_RANGE}, {@value #KEY_TRANSMISSION_FIT_ORDER}, {@value #KEY_WIDE_ANGLE}</td><td>transmission</td></tr>
 * <tr><td>{@value #KEY_ABSOLUTE_SCALE}, {@value #KEY_SAMPLE_SHAPE}, {@value #KEY_SAMPLE_WIDTH}, {@value #KEY_SAMPLE_HEIGHT}, {@value #KEY_SAMPLE_THICKNESS}</td><td>scaling (sample dimensions in mm)</td></tr>
 * <tr><td>{@value #KEY_MERGE_FIT}, {@value #KEY_MERGE_SCALE}, {@value #KEY_MERGE_SHIFT}, {@value #KEY_MERGE_FIT_RANGE}, {@value #KEY_MERGE_RANGE}</td><td>bank merge</td></tr>
 * <tr><td>{@value #KEY_MODE}, {@value #KEY_TIME_SLICES}, {@value #KEY_SCALE_BY_CHARGE}, {@value #KEY_COMPATIBILITY}</td><td>reduction</td></tr>
 * </table>
 *
 * @author SANS-Core developers
 */
public class ReductionStateLoader {

	public static final String KEY_INSTRUMENT = "instrument";
	public static final String KEY_LAB_SPECTRA = "lab.spectra";
	public static final String KEY_HAB_SPECTRA = "hab.spectra";
	public static final String KEY_PIXEL_WIDTH = "pixel.width";
	public static final String KEY_PIXEL_HEIGHT = "pixel.height";
	public static final String KEY_L1 = "l1";
	public static final String KEY_CENTRE_LAB = "beam.centre.lab";
	public static final String KEY_CENTRE_HAB = "beam.centre.hab";
	public static final String KEY_TOF_BINNING = "tof.binning";
	public static final String KEY_WAVELENGTH_MIN = "wavelength.min";
	public static final String KEY_WAVELENGTH_MAX = "wavelength.max";
	public static final String KEY_WAVELENGTH_STEP = "wavelength.step";
	public static final String KEY_WAVELENGTH_RANGES = "wavelength.ranges";
	public static final String KEY_Q_BINNING = "q.binning";
	public static final String KEY_Q_LOG = "q.binning.log";
	public static final String KEY_MASK_SPECTRA = "mask.spectra";
	public static final String KEY_MASK_TIME = "mask.time";
	public static final String KEY_RADIUS_MIN = "mask.radius.min";
	public static final String KEY_RADIUS_MAX = "mask.radius.max";
	public static final String KEY_INCIDENT_MONITOR = "monitor.incident";
	public static final String KEY_BACKGROUND = "monitor.background";
	public static final String KEY_PROMPT_PEAK = "monitor.prompt.peak";
	public static final String KEY_MONITOR_SCALE = "monitor.scale";
	public static final String KEY_TRANSMISSION_MONITOR = "transmission.monitor";
	public static final String KEY_TRANSMISSION_FIT = "transmission.fit";
	public static final String KEY_TRANSMISSION_FIT_RANGE = "transmission.fit.range";
	public static final String KEY_TRANSMISSION_FIT_ORDER = "transmission.fit.order";
	public static final String KEY_WIDE_ANGLE = "transmission.wide.angle";
	public static final String KEY_ABSOLUTE_SCALE = "scale.absolute";
	public static final String KEY_SAMPLE_SHAPE = "sample.shape";
	public static final String KEY_SAMPLE_WIDTH = "sample.width";
	public static final String KEY_SAMPLE_HEIGHT = "sample.height";
	public static final String KEY_SAMPLE_THICKNESS = "sample.thickness";
	public static final String KEY_MERGE_FIT = "merge.fit";
	public static final String KEY_MERGE_SCALE = "merge.scale";
	public static final String KEY_MERGE_SHIFT = "merge.shift";
	public static final String KEY_MERGE_FIT_RANGE = "merge.fit.range";
	public static final String KEY_MERGE_RANGE = "merge.range";
	public static final String KEY_MODE = "reduction.mode";
	public static final String KEY_TIME_SLICES = "time.slices";
	public static final String KEY_SCALE_BY_CHARGE = "time.slices.scale.by.charge";
	public static final String KEY_COMPATIBILITY = "compatibility.mode";

	private static final String DEFAULTS_RESOURCE = "/sans-defaults.properties";

	private final Properties props;

	private ReductionStateLoader(final Properties props) {
		this.props = props;
	}

	/**
	 * Builds a state from the given properties.
	 *
	 * @throws ConfigurationException if a value is malformed or the resulting
	 *                                state is inconsistent
	 */
	public static ReductionState load(final Properties properties) {
		final Properties merged = new Properties(defaults());
		merged.putAll(properties);
		return new ReductionStateLoader(merged).build();
	}

	/**
	 * Reads a properties file (UTF-8) and builds a state from it.
	 *
	 * @throws IOException if the file cannot be read
	 */
	public static ReductionState load(final Path path) throws IOException {
		final Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		SANSUtils.log("Loading reduction settings from " + path);
		return load(properties);
	}

	/** Returns the bundled fallback properties. */
	public static Properties defaults() {
		final Properties defaults = new Properties();
		try (InputStream is = ReductionStateLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is != null) defaults.load(is);
		} catch (final IOException ex) {
			SANSUtils.error("Could not read " + DEFAULTS_RESOURCE, ex);
		}
		return defaults;
	}

	private ReductionState build() {
		final Instrument instrument = Instrument.fromString(get(KEY_INSTRUMENT));
		final InstrumentGeometry geometry = geometry(instrument);

		final Map<DetectorComponent, BeamCentre> centres = new EnumMap<>(DetectorComponent.class);
		putCentre(centres, DetectorComponent.LAB, KEY_CENTRE_LAB);
		putCentre(centres, DetectorComponent.HAB, KEY_CENTRE_HAB);

		final WavelengthRange lambda = instrument.defaultWavelengthRange();
		final BinningParams wavelengthBinning = BinningParams.linear(getDouble(KEY_WAVELENGTH_MIN, lambda.min()),
				getDouble(KEY_WAVELENGTH_STEP, 0.125), getDouble(KEY_WAVELENGTH_MAX, lambda.max()));
		final List<WavelengthRange> ranges = new ArrayList<>();
		for (final double[] r : intervals(KEY_WAVELENGTH_RANGES))
			ranges.add(new WavelengthRange(r[0], r[1]));
		final double[] q = triple(KEY_Q_BINNING);
		final BinningParams qBinning = (getBoolean(KEY_Q_LOG, false)) ? BinningParams.logarithmic(q[0], q[1], q[2])
				: BinningParams.linear(q[0], q[1], q[2]);
		final double[] tof = triple(KEY_TOF_BINNING);

		final List<TimeSlice> slices = new ArrayList<>();
		for (final double[] r : intervals(KEY_TIME_SLICES))
			slices.add(new TimeSlice(r[0], r[1]));

		return new ReductionState(geometry, centres, BinningParams.linear(tof[0], tof[1], tof[2]), wavelengthBinning,
				ranges, qBinning, masking(), normalization(instrument), transmission(instrument), scale(),
				AdjustmentSettings.NONE, merge(), enumValue(ReductionMode.class, KEY_MODE), slices,
				getBoolean(KEY_COMPATIBILITY, false), getBoolean(KEY_SCALE_BY_CHARGE, false));
	}

	private InstrumentGeometry geometry(final Instrument instrument) {
		final Map<DetectorComponent, SpectrumRange> components = new EnumMap<>(DetectorComponent.class);
		components.put(DetectorComponent.LAB, spectrumRange(require(KEY_LAB_SPECTRA)));
		if (has(KEY_HAB_SPECTRA)) components.put(DetectorComponent.HAB, spectrumRange(get(KEY_HAB_SPECTRA)));
		return new InstrumentGeometry(instrument, components, getDouble(KEY_PIXEL_WIDTH, Double.NaN),
				getDouble(KEY_PIXEL_HEIGHT, Double.NaN), parseDouble(KEY_L1, require(KEY_L1)));
	}

	private void putCentre(final Map<DetectorComponent, BeamCentre> centres, final DetectorComponent c,
			final String key) {
		if (!has(key)) return;
		final double[] xy = doubles(key);
		if (xy.length != 2) throw new ConfigurationException(key + " expects 'x,y' but got: " + get(key));
		centres.put(c, new BeamCentre(xy[0], xy[1]));
	}

	private MaskingRules masking() {
		final Set<Integer> spectra = new HashSet<>();
		if (has(KEY_MASK_SPECTRA)) {
			for (final String token : StringUtils.split(get(KEY_MASK_SPECTRA), ',')) {
				final SpectrumRange range = spectrumRange(token);
				for (int s = range.first(); s <= range.last(); s++)
					spectra.add(s);
			}
		}
		final List<TofWindow> windows = new ArrayList<>();
		for (final double[] w : intervals(KEY_MASK_TIME))
			windows.add(new TofWindow(w[0], w[1]));
		return new MaskingRules(new MaskSpec(spectra, null, windows), null, getDouble(KEY_RADIUS_MIN, 0d),
				getDouble(KEY_RADIUS_MAX, 0d));
	}

	private NormalizationSettings normalization(final Instrument instrument) {
		final Map<Integer, TofWindow> perMonitor = new TreeMap<>();
		for (final String key : props.stringPropertyNames()) {
			if (!key.startsWith(KEY_BACKGROUND + ".")) continue;
			final String suffix = key.substring(KEY_BACKGROUND.length() + 1);
			if (!NumberUtils.isDigits(suffix))
				throw new ConfigurationException("Unrecognized monitor background key: " + key);
			perMonitor.put(Integer.parseInt(suffix), window(key));
		}
		final TofWindow global = window(KEY_BACKGROUND);
		final boolean configured = global != null || !perMonitor.isEmpty();
		final BackgroundWindow background = (configured) ? BackgroundWindow.of(global, perMonitor)
				: instrument.defaultBackground();
		final TofWindow promptPeak = (has(KEY_PROMPT_PEAK)) ? window(KEY_PROMPT_PEAK) : instrument.defaultPromptPeak();
		return new NormalizationSettings(getInt(KEY_INCIDENT_MONITOR, instrument.incidentMonitor()), background,
				promptPeak, getDouble(KEY_MONITOR_SCALE, 1d));
	}

	private TransmissionSettings transmission(final Instrument instrument) {
		final double[] range = optionalInterval(KEY_TRANSMISSION_FIT_RANGE);
		return new TransmissionSettings(getInt(KEY_INCIDENT_MONITOR, instrument.incidentMonitor()),
				getInt(KEY_TRANSMISSION_MONITOR, instrument.transmissionMonitor()),
				enumValue(TransmissionSettings.FitMethod.class, KEY_TRANSMISSION_FIT),
				(range == null) ? null : new WavelengthRange(range[0], range[1]),
				getInt(KEY_TRANSMISSION_FIT_ORDER, 2), getBoolean(KEY_WIDE_ANGLE, false));
	}

	private ScaleSettings scale() {
		SampleGeometry sample = null;
		if (has(KEY_SAMPLE_SHAPE)) {
			final double w = parseDouble(KEY_SAMPLE_WIDTH, require(KEY_SAMPLE_WIDTH));
			sample = switch (enumName(KEY_SAMPLE_SHAPE)) {
				case "CYLINDER" -> new SampleGeometry.Cylinder(w, parseDouble(KEY_SAMPLE_HEIGHT, require(KEY_SAMPLE_HEIGHT)));
				case "FLAT_PLATE" -> new SampleGeometry.FlatPlate(w, parseDouble(KEY_SAMPLE_HEIGHT, require(KEY_SAMPLE_HEIGHT)),
						parseDouble(KEY_SAMPLE_THICKNESS, require(KEY_SAMPLE_THICKNESS)));
				case "DISC" -> new SampleGeometry.Disc(w, parseDouble(KEY_SAMPLE_THICKNESS, require(KEY_SAMPLE_THICKNESS)));
				default -> throw new ConfigurationException("Unknown sample shape: " + get(KEY_SAMPLE_SHAPE));
			};
		}
		return new ScaleSettings(getDouble(KEY_ABSOLUTE_SCALE, 1d), sample);
	}

	private MergeSettings merge() {
		final FitPolicy policy = enumValue(FitPolicy.class, KEY_MERGE_FIT);
		MergeSettings settings = MergeSettings.of(policy, getDouble(KEY_MERGE_SCALE, 1d), getDouble(KEY_MERGE_SHIFT, 0d));
		final double[] fit = optionalInterval(KEY_MERGE_FIT_RANGE);
		if (fit != null) settings = settings.withFitRange(fit[0], fit[1]);
		final double[] range = optionalInterval(KEY_MERGE_RANGE);
		if (range != null) settings = settings.withMergeRange(range[0], range[1]);
		return settings;
	}

	/* Parsing helpers */

	private boolean has(final String key) {
		return StringUtils.isNotBlank(props.getProperty(key));
	}

	private String get(final String key) {
		return StringUtils.trimToNull(props.getProperty(key));
	}

	private String require(final String key) {
		final String value = get(key);
		if (value == null) throw new ConfigurationException("Missing required setting: " + key);
		return value;
	}

	private String enumName(final String key) {
		return require(key).toUpperCase().replace('-', '_').replace(' ', '_');
	}

	private <E extends Enum<E>> E enumValue(final Class<E> type, final String key) {
		final E value = EnumUtils.getEnum(type, enumName(key));
		if (value == null)
			throw new ConfigurationException(key + " must be one of " + EnumUtils.getEnumList(type) + ": " + get(key));
		return value;
	}

	private boolean getBoolean(final String key, final boolean def) {
		return (has(key)) ? Boolean.parseBoolean(get(key)) : def;
	}

	private int getInt(final String key, final int def) {
		if (!has(key)) return def;
		if (!NumberUtils.isParsable(get(key)))
			throw new ConfigurationException(key + " is not a number: " + get(key));
		return Integer.parseInt(get(key));
	}

	private double getDouble(final String key, final double def) {
		return (has(key)) ? parseDouble(key, get(key)) : def;
	}

	private static double parseDouble(final String key, final String value) {
		final String v = StringUtils.trim(value);
		if (!NumberUtils.isCreatable(v))
			throw new ConfigurationException(key + " is not a number: " + value);
		return Double.parseDouble(v);
	}

	private double[] doubles(final String key) {
		final String[] tokens = StringUtils.split(get(key), ',');
		final double[] values = new double[tokens.length];
		for (int i = 0; i < tokens.length; i++)
			values[i] = parseDouble(key, tokens[i]);
		return values;
	}

	private double[] triple(final String key) {
		final double[] values = doubles(key);
		if (values.length != 3) throw new ConfigurationException(key + " expects 'min,step,max' but got: " + get(key));
		return values;
	}

	private List<double[]> intervals(final String key) {
		final List<double[]> list = new ArrayList<>();
		if (!has(key)) return list;
		for (final String token : StringUtils.split(get(key), ','))
			list.add(interval(key, token));
		return list;
	}

	private double[] optionalInterval(final String key) {
		return (has(key)) ? interval(key, get(key)) : null;
	}

	private TofWindow window(final String key) {
		if (!has(key)) return null;
		final double[] w = interval(key, get(key));
		return TofWindow.of(w[0], w[1]);
	}

	private static double[] interval(final String key, final String token) {
		final String[] bounds = StringUtils.splitPreserveAllTokens(token, ':');
		if (bounds.length != 2 || StringUtils.isAnyBlank(bounds))
			throw new ConfigurationException(key + " expects 'start:stop' but got: " + token);
		return new double[] { parseDouble(key, bounds[0]), parseDouble(key, bounds[1]) };
	}

	private static SpectrumRange spectrumRange(final String token) {
		final String[] bounds = StringUtils.split(token, ':');
		try {
			final int first = Integer.parseInt(bounds[0].trim());
			final int last = (bounds.length > 1) ? Integer.parseInt(bounds[1].trim()) : first;
			return new SpectrumRange(first, last);
		} catch (final NumberFormatException | ArrayIndexOutOfBoundsException ex) {
			throw new ConfigurationException("Invalid spectrum range: " + token, ex);
		}
	}
}
