/*
 * zorbage-ndata: code for reading neutron detector files into zorbage structures and reducing them to contrast
 *
 * Copyright (C) 2023 Barry DeZonia
 * 
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * 
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * 
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package nom.bdezonia.ndata.mieze;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.ndata.CascadeLoader;
import nom.bdezonia.ndata.MetadataValue;

/**
 * A batch of single file reductions, in order, and the header parameters
 * collected from them.
 * <p>
 * Instances are not safe for use from several threads.
 *
 * @author Barry DeZonia
 */
public final class ReductionStructure {

	private static final Logger logger = LoggerFactory.getLogger(ReductionStructure.class);

	public static final String ECHO_TIME_ALIAS = "tau_M";

	private static final double ABSOLUTE_TOLERANCE = 1e-8;

	private static final double RELATIVE_TOLERANCE = 1e-5;

	private final List<Reduction> reductions;

	private final String echoTimeKey;

	private ReductionStructure(List<Reduction> reductions, String echoTimeKey) {

		this.reductions = List.copyOf(reductions);
		this.echoTimeKey = Objects.requireNonNull(echoTimeKey, "echoTimeKey");
	}

	public static ReductionStructure of(List<Reduction> reductions, String echoTimeKey) {

		return new ReductionStructure(reductions, echoTimeKey);
	}

	/**
	 * Reduces each file in turn with the same job.
	 *
	 * @param loader
	 * @param fileNumbers
	 * @param job
	 * @return
	 * @throws IOException
	 */
	public static ReductionStructure fromReductions(CascadeLoader loader, List<Integer> fileNumbers, ReductionJob job)
			throws IOException
	{
		List<Reduction> reductions = new ArrayList<>();

		for (int fileNumber : fileNumbers) {

			reductions.add(Reduction.run(loader, fileNumber, job));

			logger.info("reduced file {} ({} of {})", fileNumber, reductions.size(), fileNumbers.size());
		}

		return new ReductionStructure(reductions, loader.settings().echoTimeKey());
	}

	public List<Reduction> reductions() {

		return reductions;
	}

	public String echoTimeKey() {

		return echoTimeKey;
	}

	/**
	 * Collects header parameters from every run. The echo time is always
	 * collected, as {@value #ECHO_TIME_ALIAS}. Each key is looked up in all
	 * sections of a run's header; values that are not floats are recorded
	 * as 0. A parameter whose values all lie close to the first one is
	 * reported as a single scalar.
	 *
	 * @param paramKeys Header key to alias.
	 * @return
	 */
	public ReductionSummary analyze(Map<String, String> paramKeys) {

		Map<String, String> keys = new LinkedHashMap<>();

		keys.put(echoTimeKey, ECHO_TIME_ALIAS);

		keys.putAll(paramKeys);

		Map<String, ParameterColumn> columns = new LinkedHashMap<>();

		for (Map.Entry<String, String> e : keys.entrySet()) {

			String key = e.getKey();

			String alias = e.getValue();

			List<Double> values = new ArrayList<>();

			for (Reduction r : reductions) {

				Optional<MetadataValue> found = r.metadata().find(key);

				if (found.isPresent() && found.get().isFloat()) {

					values.add(found.get().asDouble());
				}
				else {

					logger.warn("file {} has no float value for '{}' ({}), recording 0", r.fileNumber(), key,
							found.map(MetadataValue::toString).orElse("missing"));

					values.add(0.0);
				}
			}

			if (!values.isEmpty() && allClose(values))
				columns.put(alias, new ParameterColumn(alias, key, List.of(values.get(0)), true));
			else
				columns.put(alias, new ParameterColumn(alias, key, values, false));
		}

		List<Integer> fileNumbers = new ArrayList<>();

		List<ReductionJobResult> results = new ArrayList<>();

		for (Reduction r : reductions) {

			fileNumbers.add(r.fileNumber());

			results.add(r.result());
		}

		return new ReductionSummary(fileNumbers, results, columns);
	}

	static boolean allClose(List<Double> values) {

		double first = values.get(0);

		for (double v : values) {

			if (!(Math.abs(v - first) <= ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(first)))
				return false;
		}

		return true;
	}
}
