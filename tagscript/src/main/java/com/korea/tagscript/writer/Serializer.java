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

package com.korea.tagscript.writer;

import com.korea.tagscript.ast.Document;
import com.korea.tagscript.ast.Node;
import com.korea.tagscript.parser.Lexer;
import com.korea.tagscript.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.korea.tagscript.regexp.Regexp.RE_ACTION;
import static com.korea.tagscript.regexp.Regexp.RE_NAME;
import static com.korea.tagscript.regexp.Regexp.RE_TAG;

/**
 * Writes a {@link Document} as TagScript source code.
 * <p>
 * The output is the inverse of the {@link com.korea.tagscript.parser.Parser}: parsing it again yields a document equal
 * to the one written. Comments are written right before the opening line of their element, text lines one level deeper
 * than it, then the child tags in insertion order. Comments that belong to the document itself are written after the
 * last action group, as otherwise they would attach to the first group when read back.
 * 문서를 소스 코드 형태로 출력한다. 출력 결과를 다시 파싱하면 같은 문서가 된다.
 */
public class Serializer {

	/**
	 * The default indentation: one tab per nesting level.
	 */
	public static final String DEFAULT_INDENT = "\t";

	private final String indent;

	public Serializer() {
		this(DEFAULT_INDENT);
	}

	/**
	 * Creates a new {@link Serializer}.
	 *
	 * @param indent the indentation per nesting level, must consist of whitespace only
	 */
	public Serializer(String indent) {
		if (indent == null) {
			indent = DEFAULT_INDENT;
		}
		if (!indent.trim().isEmpty()) {
			throw new IllegalArgumentException("'indent' must consist of whitespace only");
		}
		this.indent = indent;
	}

	/**
	 * Serializes the document.
	 *
	 * @param document the document
	 * @return the source code, ending with a line break unless empty
	 * @throws EncodingException if the document contains a name or line that cannot be written
	 */
	public String serialize(Document document) throws EncodingException {
		StringBuilder sb = new StringBuilder();

		boolean first = true;
		for (Map.Entry<String, Node> entry : document.getGroups().entrySet()) {
			List<String> path = new ArrayList<>();
			path.add(entry.getKey());
			checkName(entry.getKey(), path);

			if (!first) {
				sb.append('\n');
			}
			first = false;

			Node group = entry.getValue();
			writeComments(sb, group.getComments(), "", path);
			sb.append('[').append(entry.getKey()).append("]\n");
			writeContent(sb, group, 1, path);
			sb.append("[/").append(entry.getKey()).append("]\n");
		}

		if (!document.getComments().isEmpty()) {
			if (!first) {
				sb.append('\n');
			}
			writeComments(sb, document.getComments(), "", new ArrayList<String>());
		}

		return sb.toString();
	}

	private void writeContent(StringBuilder sb, Node node, int depth, List<String> path) {
		String prefix = StringUtils.repeat(indent, depth);

		if (node.hasText()) {
			for (String line : node.getText().split("\n", -1)) {
				if (StringUtils.isBlank(line)) {
					continue;
				}
				String escaped = StringUtils.escape(line, Lexer.COMMENT_CHAR);
				if (RE_ACTION.matcher(escaped).matches() || RE_TAG.matcher(escaped).matches()) {
					throw new EncodingException("Text line '" + line + "' would be read back as a tag", pathOf(path));
				}
				sb.append(prefix).append(escaped).append('\n');
			}
		}

		for (Map.Entry<String, Node> entry : node.getChildren().entrySet()) {
			path.add(entry.getKey());
			checkName(entry.getKey(), path);

			Node child = entry.getValue();
			writeComments(sb, child.getComments(), prefix, path);
			sb.append(prefix).append('<').append(entry.getKey()).append(">\n");
			writeContent(sb, child, depth + 1, path);
			sb.append(prefix).append("</").append(entry.getKey()).append(">\n");

			path.remove(path.size() - 1);
		}
	}

	private void writeComments(StringBuilder sb, List<String> comments, String prefix, List<String> path) {
		for (String comment : comments) {
			if (comment.indexOf('\n') >= 0 || comment.indexOf('\r') >= 0) {
				throw new EncodingException("Comment '" + comment + "' spans more than one line", pathOf(path));
			}
			sb.append(prefix).append(Lexer.COMMENT_CHAR);
			if (!comment.isEmpty()) {
				sb.append(' ').append(comment);
			}
			sb.append('\n');
		}
	}

	private void checkName(String name, List<String> path) {
		if (!RE_NAME.matcher(name).matches()) {
			throw new EncodingException("Invalid tag name '" + name + "'", pathOf(path));
		}
	}

	private String pathOf(List<String> path) {
		return StringUtils.join(path, "/");
	}
}
