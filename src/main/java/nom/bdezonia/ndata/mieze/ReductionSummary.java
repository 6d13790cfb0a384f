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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The collated outcome of a batch of reductions: one contrast per run and
 * the requested header parameters, keyed by alias.
 *
 * @author Barry DeZonia
 */
public final class ReductionSummary {

	private final List<Integer> fileNumbers;

	private final List<ReductionJobResult> results;

	private final Map<String, ParameterColumn> parameters;

	ReductionSummary(List<Integer> fileNumbers, List<ReductionJobResult> results, Map<String, ParameterColumn> parameters) {

		this.fileNumbers = List.copyOf(fileNumbers);
		this.results = List.copyOf(results);
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
	}

	public List<Integer> fileNumbers() {

		return fileNumbers;
	}

	public List<ReductionJobResult> results() {

		return results;
	}

	public int runCount() {

		return results.size();
	}

	public Map<String, ParameterColumn> parameters() {

		return parameters;
	}

	public ParameterColumn parameter(String alias) {

		ParameterColumn column = parameters.get(alias);

		if (column == null)
			throw new IllegalArgumentException("no parameter '" + alias + "' in " + parameters.keySet());

		return column;
	}

	public List<Double> contrasts() {

		List<Double> list = new ArrayList<>();

		for (ReductionJobResult r : results) {

			list.add(r.contrast());
		}

		return list;
	}

	public List<Double> contrastErrors() {

		List<Double> list = new ArrayList<>();

		for (ReductionJobResult r : results) {

			list.add(r.contrastErr());
		}

		return list;
	}
}
