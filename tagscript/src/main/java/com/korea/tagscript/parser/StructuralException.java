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
 * Thrown when open and close tags do not pair up: a close tag that does not match the innermost open tag, a close tag
 * with nothing open, an element left open at the end of the input, or an element opened where it is not allowed.
 * 여는 태그와 닫는 태그의 짝이 맞지 않을 때 발생한다.
 */
@Getter
public class StructuralException extends ParserException {

	private static final long serialVersionUID = 4526998811706420352L;

	/**
	 * The 1-based line number of the offending line.
	 */
	private final int lineNumber;

	/**
	 * The name of the offending tag or action group.
	 */
	private final String tagName;

	public StructuralException(String message, int lineNumber, String tagName) {
		super(message);
		this.lineNumber = lineNumber;
		this.tagName = tagName;
	}
}
