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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Represents a single action group or tag.
 * <p>
 * A node holds three independent parts: its text (the content lines, newline-joined), the comments attached to it and
 * its named child tags. Children keep the order in which they were added.
 * 하나의 액션 그룹 혹은 태그를 표현한다. 텍스트, 주석, 자식 태그를 동시에 가질 수 있다.
 */
public class Node {

	private String text;
	private List<String> comments = new ArrayList<>();
	private Map<String, Node> children = new LinkedHashMap<>();

	/**
	 * Returns the text, or {@code null} if this node has no text. An empty string is a valid text.
	 *
	 * @return the text
	 */
	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}

	public boolean hasText() {
		return text != null;
	}

	/**
	 * Appends a content line to the text, separated from the existing text by a line break.
	 *
	 * @param line the content line
	 */
	public void appendText(String line) {
		if (text == null) {
			text = line;
		} else {
			text = text + "\n" + line;
		}
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
	 * Returns a read-only view of the child tags, in insertion order.
	 *
	 * @return the children
	 */
	public Map<String, Node> getChildren() {
		return Collections.unmodifiableMap(children);
	}

	public Node getChild(String name) {
		return children.get(name);
	}

	public boolean hasChild(String name) {
		return children.containsKey(name);
	}

	/**
	 * Adds a child tag. Replacing an existing child keeps its position.
	 *
	 * @param name  the tag name
	 * @param child the child node
	 * @return the replaced child, or {@code null}
	 */
	public Node putChild(String name, Node child) {
		requireNonNull(name, "'name' must not be null");
		requireNonNull(child, "'child' must not be null");
		return children.put(name, child);
	}

	public Node removeChild(String name) {
		return children.remove(name);
	}

	/**
	 * Returns whether this node has no child tags.
	 *
	 * @return whether this node is a leaf
	 */
	public boolean isLeaf() {
		return children.isEmpty();
	}

	/**
	 * Walks down the tree through the given tag names.
	 *
	 * @param path the tag names
	 * @return the node reached, or {@code null} if a tag along the way does not exist
	 */
	public Node resolve(List<String> path) {
		Node current = this;
		for (String name : path) {
			current = current.children.get(name);
			if (current == null) {
				return null;
			}
		}
		return current;
	}

	public Node resolve(String... path) {
		return resolve(Arrays.asList(path));
	}

	/**
	 * Returns a deep copy of this node.
	 *
	 * @return the copy
	 */
	public Node copy() {
		Node copy = new Node();
		copy.text = this.text;
		copy.comments.addAll(this.comments);
		for (Map.Entry<String, Node> entry : this.children.entrySet()) {
			copy.children.put(entry.getKey(), entry.getValue().copy());
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
		Node that = (Node) o;
		if (text != null ? !text.equals(that.text) : that.text != null) {
			return false;
		}
		if (!comments.equals(that.comments)) {
			return false;
		}
		// Sibling order matters for the written form, so compare it too.
		return new ArrayList<>(children.entrySet()).equals(new ArrayList<>(that.children.entrySet()));
	}

	@Override
	public int hashCode() {
		int result = text != null ? text.hashCode() : 0;
		result = 31 * result + comments.hashCode();
		result = 31 * result + children.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "Node{" +
				"text=" + (text != null ? "'" + text + "'" : null) +
				", comments=" + comments +
				", children=" + children +
				'}';
	}
}
