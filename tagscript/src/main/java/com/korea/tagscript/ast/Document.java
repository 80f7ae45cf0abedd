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

package com.korea.tagscript.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Represents the root of a parsed TagScript source: the action groups in source order, plus the comments that are not
 * attached to any group.
 * 파싱된 소스의 루트. 액션 그룹들과 어떤 그룹에도 속하지 않은 주석을 담는다.
 */
public class Document {

	private Map<String, Node> groups = new LinkedHashMap<>();
	private List<String> comments = new ArrayList<>();

	/**
	 * Returns a read-only view of the action groups, in insertion order.
	 *
	 * @return the action groups
	 */
	public Map<String, Node> getGroups() {
		return Collections.unmodifiableMap(groups);
	}

	public Node getGroup(String name) {
		return groups.get(name);
	}

	public boolean hasGroup(String name) {
		return groups.containsKey(name);
	}

	/**
	 * Adds an action group. Replacing an existing group keeps its position.
	 *
	 * @param name  the group name
	 * @param group the group node
	 * @return the replaced group, or {@code null}
	 */
	public Node putGroup(String name, Node group) {
		requireNonNull(name, "'name' must not be null");
		requireNonNull(group, "'group' must not be null");
		return groups.put(name, group);
	}

	public Node removeGroup(String name) {
		return groups.remove(name);
	}

	public List<String> getComments() {
		return comments;
	}

	public void addComment(String comment) {
		comments.add(comment);
	}

	public void addComments(List<String> comments) {
		this.comments.addAll(comments);
	}

	/**
	 * Returns whether this document has neither groups nor comments.
	 *
	 * @return whether this document is empty
	 */
	public boolean isEmpty() {
		return groups.isEmpty() && comments.isEmpty();
	}

	public Document copy() {
		Document copy = new Document();
		copy.comments.addAll(this.comments);
		for (Map.Entry<String, Node> entry : this.groups.entrySet()) {
			copy.groups.put(entry.getKey(), entry.getValue().copy());
		}
		return copy;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Document that = (Document) o;
		if (!comments.equals(that.comments)) {
			return false;
		}
		return new ArrayList<>(groups.entrySet()).equals(new ArrayList<>(that.groups.entrySet()));
	}

	@Override
	public int hashCode() {
		int result = groups.hashCode();
		result = 31 * result + comments.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "Document{" +
				"groups=" + groups +
				", comments=" + comments +
				'}';
	}
}
