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

package com.korea.tagscript.merge;

import com.korea.tagscript.ast.Document;
import com.korea.tagscript.ast.Node;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Deep merges two documents, the first one taking precedence.
 * <p>
 * Groups and tags present in both documents are merged recursively; those present in only one are copied. A node's
 * text comes from the first document when it has text, otherwise from the second; its comments likewise. The result
 * lists the first document's entries in order, followed by the entries only the second one has. Neither input is
 * modified.
 * 두 문서를 병합한다. 충돌 시 첫 번째 문서가 우선한다.
 */
public class DocumentMerger {

	private DocumentMerger() {
	}

	/**
	 * Merges two documents.
	 *
	 * @param first  the document whose values win on conflicts
	 * @param second the document that fills in what {@code first} lacks
	 * @return the merged document
	 */
	public static Document merge(Document first, Document second) {
		requireNonNull(first, "'first' must not be null");
		requireNonNull(second, "'second' must not be null");

		Document merged = first.copy();
		if (merged.getComments().isEmpty()) {
			merged.addComments(second.getComments());
		}
		for (Map.Entry<String, Node> entry : second.getGroups().entrySet()) {
			Node existing = merged.getGroup(entry.getKey());
			if (existing == null) {
				merged.putGroup(entry.getKey(), entry.getValue().copy());
			} else {
				mergeInto(existing, entry.getValue());
			}
		}
		return merged;
	}

	/**
	 * Merges two nodes.
	 *
	 * @param first  the node whose values win on conflicts
	 * @param second the node that fills in what {@code first} lacks
	 * @return the merged node
	 */
	public static Node merge(Node first, Node second) {
		requireNonNull(first, "'first' must not be null");
		requireNonNull(second, "'second' must not be null");

		Node merged = first.copy();
		mergeInto(merged, second);
		return merged;
	}

	/**
	 * Lays a document over a base document, the overlay taking precedence.
	 * 기존 문서의 순서를 유지하면서 새 문서의 내용을 덮어쓴다.
	 * <p>
	 * The result keeps the base's entries in their order and appends the entries only the overlay has. Text and
	 * non-empty comment lists of the overlay replace those of the base. Document comments of the overlay are appended
	 * to the base's, skipping the ones it already has. Neither input is modified.
	 *
	 * @param base    the document loaded so far
	 * @param overlay the document whose values win on conflicts
	 * @return the combined document
	 */
	public static Document overlay(Document base, Document overlay) {
		requireNonNull(base, "'base' must not be null");
		requireNonNull(overlay, "'overlay' must not be null");

		Document combined = base.copy();
		for (String comment : overlay.getComments()) {
			if (!combined.getComments().contains(comment)) {
				combined.addComment(comment);
			}
		}
		for (Map.Entry<String, Node> entry : overlay.getGroups().entrySet()) {
			Node existing = combined.getGroup(entry.getKey());
			if (existing == null) {
				combined.putGroup(entry.getKey(), entry.getValue().copy());
			} else {
				overlayInto(existing, entry.getValue());
			}
		}
		return combined;
	}

	private static void overlayInto(Node target, Node other) {
		if (other.hasText()) {
			target.setText(other.getText());
		}
		if (!other.getComments().isEmpty()) {
			target.getComments().clear();
			target.addComments(other.getComments());
		}
		for (Map.Entry<String, Node> entry : other.getChildren().entrySet()) {
			Node existing = target.getChild(entry.getKey());
			if (existing == null) {
				target.putChild(entry.getKey(), entry.getValue().copy());
			} else {
				overlayInto(existing, entry.getValue());
			}
		}
	}

	private static void mergeInto(Node target, Node other) {
		if (!target.hasText() && other.hasText()) {
			target.setText(other.getText());
		}
		if (target.getComments().isEmpty()) {
			target.addComments(other.getComments());
		}
		for (Map.Entry<String, Node> entry : other.getChildren().entrySet()) {
			Node existing = target.getChild(entry.getKey());
			if (existing == null) {
				target.putChild(entry.getKey(), entry.getValue().copy());
			} else {
				mergeInto(existing, entry.getValue());
			}
		}
	}
}
