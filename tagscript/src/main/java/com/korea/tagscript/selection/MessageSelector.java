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

import com.korea.tagscript.ast.Node;
import com.korea.tagscript.util.StringUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static java.util.Objects.requireNonNull;

/**
 * Selects a message for a character from an action group.
 * <p>
 * The lookup starts at the tag of the {@link Mood} and then descends one tag per axis of the {@link StateVector} that
 * is set, in the axis order. Every node reached on the way that has non-blank text replaces the best match found so
 * far, so the most specific match wins and less specific ones serve as fallbacks. One line of the best match is then
 * picked at random and its variables are substituted.
 * 상태 벡터의 축 순서대로 태그 경로를 확장하면서 가장 구체적인 메시지를 찾는다.
 */
public class MessageSelector {

	private static Logger logger = LoggerFactory.getLogger(MessageSelector.class);

	private final Random random;
	private final VariableSubstitutor substitutor = new VariableSubstitutor();

	public MessageSelector() {
		this(new Random());
	}

	/**
	 * Creates a new {@link MessageSelector}.
	 *
	 * @param random the random source used to pick a line among the candidates
	 */
	public MessageSelector(Random random) {
		this.random = requireNonNull(random, "'random' must not be null");
	}

	/**
	 * Returns the tag paths looked up for the given mood and state, from the least to the most specific.
	 *
	 * @param mood  the mood
	 * @param state the state
	 * @return the tag paths
	 */
	public List<List<String>> keyPaths(Mood mood, StateVector state) {
		requireNonNull(mood, "'mood' must not be null");
		if (state == null) {
			state = StateVector.empty();
		}

		List<List<String>> paths = new ArrayList<>();
		List<String> path = new ArrayList<>();
		path.add(mood.getTag());
		paths.add(Collections.unmodifiableList(new ArrayList<>(path)));
		for (String tag : state.getTags()) {
			path.add(tag);
			paths.add(Collections.unmodifiableList(new ArrayList<>(path)));
		}
		return paths;
	}

	/**
	 * Returns the candidate lines of the most specific node along the key paths that has non-blank text.
	 *
	 * @param root  the action group to search
	 * @param mood  the mood
	 * @param state the state
	 * @return the candidate lines, empty if no node matched
	 */
	public List<String> findCandidates(Node root, Mood mood, StateVector state) {
		requireNonNull(root, "'root' must not be null");

		List<String> best = Collections.emptyList();
		for (List<String> path : keyPaths(mood, state)) {
			Node node = root.resolve(path);
			if (node == null) {
				logger.trace("No tag at {}", path);
				continue;
			}
			List<String> lines = candidateLines(node);
			if (lines.isEmpty()) {
				// A tag may exist only to hold children.
				logger.trace("No text at {}", path);
				continue;
			}
			logger.debug("Found {} candidate(s) at {}", lines.size(), path);
			best = lines;
		}
		return best;
	}

	/**
	 * Selects a message.
	 *
	 * @param root  the action group to search
	 * @param mood  the mood
	 * @param state the state
	 * @param vars  the variable values, may be {@code null}
	 * @return the message, or {@code null} if nothing matched or the chosen line is silenced
	 */
	public String select(Node root, Mood mood, StateVector state, Map<String, String> vars) {
		List<String> candidates = findCandidates(root, mood, state);
		if (candidates.isEmpty()) {
			logger.debug("No message for mood {} and {}", mood, state);
			return null;
		}

		String line = candidates.get(random.nextInt(candidates.size()));
		if (substitutor.isSilenced(line)) {
			logger.debug("Silenced: {}", line);
			return null;
		}
		return substitutor.substitute(line, vars);
	}

	/**
	 * Splits the text of a node into its non-blank lines.
	 */
	private List<String> candidateLines(Node node) {
		if (!node.hasText()) {
			return Collections.emptyList();
		}
		List<String> lines = new ArrayList<>();
		for (String line : StringUtils.splitLines(node.getText())) {
			if (!StringUtils.isBlank(line)) {
				lines.add(line.trim());
			}
		}
		return lines;
	}
}
