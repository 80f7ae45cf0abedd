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

package com.korea.tagscript.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Miscellaneous {@link String} utility methods.
 */
public class StringUtils {

	private StringUtils() {
	}

	/**
	 * Splits the given text into lines. Accepts {@code \n}, {@code \r\n} and {@code \r} line breaks.
	 * 줄바꿈 문자 종류에 관계없이 줄 단위로 자른다.
	 *
	 * @param text the text
	 * @return the lines, an empty array for an empty text
	 */
	public static String[] splitLines(String text) {
		if (text == null || text.isEmpty()) {
			return new String[0];
		}
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				lines.add(text.substring(start, i));
				if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
					i++;
				}
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines.toArray(new String[0]);
	}

	/**
	 * Returns whether the given text is {@code null} or consists of whitespace only.
	 *
	 * @param text the text
	 * @return whether the text is blank
	 */
	public static boolean isBlank(String text) {
		return text == null || text.trim().isEmpty();
	}

	/**
	 * Removes trailing whitespace, using the same definition of whitespace as {@link String#trim()}.
	 *
	 * @param text the text
	 * @return the text without trailing whitespace
	 */
	public static String trimTrailing(String text) {
		int end = text.length();
		while (end > 0 && text.charAt(end - 1) <= ' ') {
			end--;
		}
		return text.substring(0, end);
	}

	/**
	 * Concatenates {@code text} {@code count} times.
	 *
	 * @param text  the text
	 * @param count the number of copies
	 * @return the repeated text, empty if {@code count} is not positive
	 */
	public static String repeat(String text, int count) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < count; i++) {
			sb.append(text);
		}
		return sb.toString();
	}

	/**
	 * Returns the index of the first occurrence of {@code c} that is not preceded by a backslash.
	 *
	 * @param text the text
	 * @param c    the character to look for
	 * @return the index, or {@code -1}
	 */
	public static int indexOfUnescaped(String text, char c) {
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == c && (i == 0 || text.charAt(i - 1) != '\\')) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Escapes every occurrence of {@code c} with a backslash.
	 *
	 * @param text the text
	 * @param c    the character to escape
	 * @return the escaped text
	 */
	public static String escape(String text, char c) {
		return text.replace(String.valueOf(c), "\\" + c);
	}

	/**
	 * Reverses {@link #escape(String, char)}.
	 *
	 * @param text the text
	 * @param c    the escaped character
	 * @return the unescaped text
	 */
	public static String unescape(String text, char c) {
		return text.replace("\\" + c, String.valueOf(c));
	}

	/**
	 * Joins the given items with a separator.
	 *
	 * @param items     the items
	 * @param separator the separator
	 * @return the joined string
	 */
	public static String join(Iterable<String> items, String separator) {
		StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (String item : items) {
			if (!first) {
				sb.append(separator);
			}
			sb.append(item);
			first = false;
		}
		return sb.toString();
	}
}
