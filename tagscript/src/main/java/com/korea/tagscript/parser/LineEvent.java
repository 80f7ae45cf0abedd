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

package com.korea.tagscript.parser;

import lombok.Getter;

/**
 * A classified line of TagScript source code, as produced by the {@link Lexer}.
 */
@Getter
public class LineEvent {

	private final LineType type;
	private final int lineNumber;

	/**
	 * The tag name for tag and action lines, {@code null} otherwise.
	 */
	private final String name;

	/**
	 * The content of a text line or the text of a comment line, {@code null} otherwise.
	 */
	private final String value;

	/**
	 * The trailing inline comment of a text, tag or action line, or {@code null}.
	 */
	private final String inlineComment;

	private LineEvent(LineType type, int lineNumber, String name, String value, String inlineComment) {
		this.type = type;
		this.lineNumber = lineNumber;
		this.name = name;
		this.value = value;
		this.inlineComment = inlineComment;
	}

	public static LineEvent blank(int lineNumber) {
		return new LineEvent(LineType.BLANK, lineNumber, null, null, null);
	}

	public static LineEvent comment(int lineNumber, String text) {
		return new LineEvent(LineType.COMMENT, lineNumber, null, text, null);
	}

	public static LineEvent text(int lineNumber, String content, String inlineComment) {
		return new LineEvent(LineType.TEXT, lineNumber, null, content, inlineComment);
	}

	public static LineEvent tag(LineType type, int lineNumber, String name, String inlineComment) {
		return new LineEvent(type, lineNumber, name, null, inlineComment);
	}

	/**
	 * Returns how the tag of this line is written, e.g. {@code </adult>} or {@code [WantFood]}.
	 *
	 * @return the written tag, or {@code null} for lines without a tag
	 */
	public String getRawTag() {
		switch (type) {
			case ACTION_OPEN:
				return "[" + name + "]";
			case ACTION_CLOSE:
				return "[/" + name + "]";
			case TAG_OPEN:
				return "<" + name + ">";
			case TAG_CLOSE:
				return "</" + name + ">";
			default:
				return null;
		}
	}

	@Override
	public String toString() {
		return "LineEvent{" +
				"type=" + type +
				", lineNumber=" + lineNumber +
				", name='" + name + '\'' +
				", value='" + value + '\'' +
				", inlineComment='" + inlineComment + '\'' +
				'}';
	}
}
