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

/**
 * User-configurable properties of the {@link Parser}.
 */
public class ParserConfig {

	private boolean strict;

	protected ParserConfig() {
	}

	/**
	 * Returns whether strict mode is enabled. In strict mode duplicate sibling tags and text outside any action group
	 * are errors instead of warnings.
	 * strict 모드에서는 중복된 형제 태그와 액션 그룹 밖의 텍스트를 오류로 처리한다.
	 *
	 * @return whether strict mode is enabled
	 */
	public boolean isStrict() {
		return strict;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		ParserConfig that = (ParserConfig) o;
		return strict == that.strict;
	}

	@Override
	public int hashCode() {
		return (strict ? 1 : 0);
	}

	@Override
	public String toString() {
		return "ParserConfig{" +
				"strict=" + strict +
				'}';
	}

	/**
	 * Creates a basic {@link ParserConfig} with all the defaults (lenient mode).
	 *
	 * @return the config
	 */
	public static ParserConfig basic() {
		return newBuilder().build();
	}

	/**
	 * Creates a new {@link Builder}.
	 *
	 * @return the builder
	 */
	public static Builder newBuilder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ParserConfig}.
	 */
	public static final class Builder {

		private boolean strict;

		private Builder() {
		}

		/**
		 * Sets whether strict mode is enabled.
		 *
		 * @param strict whether strict mode is enabled
		 * @return this builder
		 */
		public Builder strict(boolean strict) {
			this.strict = strict;
			return this;
		}

		/**
		 * Builds the config.
		 *
		 * @return the config
		 */
		public ParserConfig build() {
			ParserConfig config = new ParserConfig();
			config.strict = this.strict;
			return config;
		}
	}
}
