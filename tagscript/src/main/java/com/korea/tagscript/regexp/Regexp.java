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

package com.korea.tagscript.regexp;

import java.util.regex.Pattern;

/**
 * Precompiled regular expressions shared by the parser and the writer.
 * 파서와 라이터가 공통으로 사용하는 정규식 모음.
 */
public class Regexp {

	/**
	 * The characters a tag or action group name may consist of.
	 */
	public static final String NAME = "[A-Za-z0-9_.-]+";

	public static final Pattern RE_NAME = Pattern.compile("^" + NAME + "$");
	public static final Pattern RE_ACTION = Pattern.compile("^\\s*\\[(/?)(" + NAME + ")\\]\\s*$");
	public static final Pattern RE_TAG = Pattern.compile("^\\s*<(/?)(" + NAME + ")>\\s*$");

	private Regexp() {
	}
}
