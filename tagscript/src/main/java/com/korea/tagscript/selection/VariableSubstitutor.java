/*
 * Copyright (c) 2016-2017 the original author or authors.
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

package com.korea.tagscript.selection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces {@code %variable} placeholders in a message line.
 * <p>
 * After each {@code %} the longest known variable name is replaced with its value. Known names are the built-in
 * {@link #BUILTIN_NAMES} plus every key of the supplied variables. Unknown names, and known names without a value, are
 * left as they are. {@code %dummy} is reserved: it is never replaced, and a line containing it is silenced.
 * 메시지의 %변수를 치환한다. %dummy는 치환하지 않으며, 포함된 줄은 출력하지 않는다.
 */
public class VariableSubstitutor {

	public static final char MARKER = '%';

	public static final String DUMMY = "dummy";

	public static final List<String> BUILTIN_NAMES = Collections.unmodifiableList(Arrays.asList("name", "name2", "partner"));

	/**
	 * Returns whether the line is a silencing line, i.e. contains {@code %dummy}.
	 *
	 * @param line the line, before substitution
	 * @return whether the line is silenced
	 */
	public boolean isSilenced(String line) {
		return line.contains(MARKER + DUMMY);
	}

	/**
	 * Substitutes the variables in a line.
	 *
	 * @param line the line
	 * @param vars the variable values, may be {@code null}
	 * @return the substituted line
	 */
	public String substitute(String line, Map<String, String> vars) {
		if (line.indexOf(MARKER) < 0) {
			return line;
		}

		List<String> names = knownNames(vars);
		StringBuilder sb = new StringBuilder(line.length());
		int i = 0;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c != MARKER) {
				sb.append(c);
				i++;
				continue;
			}

			if (line.startsWith(DUMMY, i + 1)) {
				sb.append(MARKER).append(DUMMY);
				i += 1 + DUMMY.length();
				continue;
			}

			String match = null;
			for (String name : names) {
				if (line.startsWith(name, i + 1)) {
					match = name;
					break;
				}
			}
			String value = match != null && vars != null ? vars.get(match) : null;
			if (value == null) {
				sb.append(c);
				i++;
			} else {
				sb.append(value);
				i += 1 + match.length();
			}
		}
		return sb.toString();
	}

	/**
	 * Returns the built-in and supplied names, longest first.
	 */
	private List<String> knownNames(Map<String, String> vars) {
		Set<String> names = new LinkedHashSet<>(BUILTIN_NAMES);
		if (vars != null) {
			for (String name : vars.keySet()) {
				if (name != null && !name.isEmpty() && !name.equals(DUMMY)) {
					names.add(name);
				}
			}
		}
		List<String> sorted = new ArrayList<>(names);
		Collections.sort(sorted, byLengthReverse());
		return sorted;
	}

	private Comparator<String> byLengthReverse() {
		return new Comparator<String>() {

			@Override
			public int compare(String o1, String o2) {
				return o2.length() - o1.length();
			}
		};
	}
}
