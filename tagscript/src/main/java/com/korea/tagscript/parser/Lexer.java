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

import com.korea.tagscript.util.StringUtils;

import java.util.regex.Matcher;

import static com.korea.tagscript.regexp.Regexp.RE_ACTION;
import static com.korea.tagscript.regexp.Regexp.RE_TAG;

/**
 * Classifies single lines of TagScript source code.
 * <p>
 * Every line maps to exactly one {@link LineEvent}; lines that look like a tag but are not well-formed fall through to
 * {@link LineType#TEXT}. A {@code #} that is not the first non-whitespace character starts an inline comment, unless
 * it is escaped as {@code \#}.
 * 소스 코드 한 줄을 분류한다. 분류에 실패하는 줄은 없으며, 애매한 줄은 텍스트로 취급한다.
 */
public class Lexer {

	public static final char COMMENT_CHAR = '#';

	/**
	 * Classifies a line.
	 *
	 * @param line       the physical line, without its line break
	 * @param lineNumber the 1-based line number
	 * @return the line event
	 */
	public LineEvent classify(String line, int lineNumber) {
		if (StringUtils.isBlank(line)) {
			return LineEvent.blank(lineNumber);
		}

		String trimmed = line.trim();
		if (trimmed.charAt(0) == COMMENT_CHAR) {
			return LineEvent.comment(lineNumber, commentText(trimmed.substring(1)));
		}

		// Split off the inline comment before looking for tags, so "[Group] # note" is still a tag line.
		String code = line;
		String inlineComment = null;
		int hash = StringUtils.indexOfUnescaped(line, COMMENT_CHAR);
		if (hash >= 0) {
			code = line.substring(0, hash);
			inlineComment = commentText(line.substring(hash + 1));
		}

		Matcher matcher = RE_ACTION.matcher(code);
		if (matcher.matches()) {
			LineType type = matcher.group(1).isEmpty() ? LineType.ACTION_OPEN : LineType.ACTION_CLOSE;
			return LineEvent.tag(type, lineNumber, matcher.group(2), inlineComment);
		}
		matcher = RE_TAG.matcher(code);
		if (matcher.matches()) {
			LineType type = matcher.group(1).isEmpty() ? LineType.TAG_OPEN : LineType.TAG_CLOSE;
			return LineEvent.tag(type, lineNumber, matcher.group(2), inlineComment);
		}

		return LineEvent.text(lineNumber, StringUtils.unescape(code.trim(), COMMENT_CHAR), inlineComment);
	}

	/**
	 * Drops the single space that conventionally follows the {@code #}, and any trailing whitespace.
	 *
	 * @param raw the text after the {@code #}
	 * @return the comment text
	 */
	private String commentText(String raw) {
		String text = raw.startsWith(" ") ? raw.substring(1) : raw;
		return StringUtils.trimTrailing(text);
	}
}
