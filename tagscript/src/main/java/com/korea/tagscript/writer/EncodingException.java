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

import com.korea.tagscript.TagScriptException;

import lombok.Getter;

/**
 * Thrown when a {@link com.korea.tagscript.ast.Document} cannot be written as TagScript source, e.g. because a tag name
 * contains characters outside {@code [A-Za-z0-9_.-]}.
 */
@Getter
public class EncodingException extends TagScriptException {

	private static final long serialVersionUID = -7815190472212230953L;

	/**
	 * The slash separated path to the offending node, e.g. {@code WantFood/normal/adult}.
	 */
	private final String path;

	public EncodingException(String message, String path) {
		super(message + " at '" + path + "'");
		this.path = path;
	}
}
