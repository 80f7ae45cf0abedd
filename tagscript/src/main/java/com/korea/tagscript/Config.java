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

package com.korea.tagscript;

import com.korea.tagscript.writer.Serializer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

/**
 * User-configurable properties of the {@link TagScript} interpreter.
 * 빌더 패턴으로 Config 인스턴스를 생성한다.
 */
public class Config {

	/**
	 * The default indentation of written documents: one tab per nesting level.
	 */
	public static final String DEFAULT_INDENT = Serializer.DEFAULT_INDENT;

	/**
	 * The default charset for reading and writing files.
	 */
	public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

	/**
	 * The default file extensions picked up when loading a directory.
	 */
	public static final String[] DEFAULT_FILE_EXTENSIONS = new String[] {".txt"};

	private boolean strict;
	private String indent = DEFAULT_INDENT;
	private Charset charset = DEFAULT_CHARSET;
	private String[] fileExtensions = DEFAULT_FILE_EXTENSIONS;
	private Random random;

	protected Config() {
	}

	/**
	 * Returns whether strict parsing is enabled.
	 * 엄격한 구문 검사 사용 여부를 반환.
	 *
	 * @return whether strict parsing is enabled
	 */
	public boolean isStrict() {
		return strict;
	}

	/**
	 * Returns the indentation per nesting level of written documents.
	 *
	 * @return the indentation
	 */
	public String getIndent() {
		return indent;
	}

	/**
	 * Returns the charset for reading and writing files.
	 *
	 * @return the charset
	 */
	public Charset getCharset() {
		return charset;
	}

	/**
	 * Returns the file extensions picked up when loading a directory.
	 *
	 * @return the file extensions
	 */
	public String[] getFileExtensions() {
		return fileExtensions.clone();
	}

	/**
	 * Returns the random source for message selection, or {@code null} to use a new {@link Random}.
	 * 메시지 선택에 사용할 난수 생성기. 테스트에서는 고정된 시드를 주입한다.
	 *
	 * @return the random source
	 */
	public Random getRandom() {
		return random;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Config that = (Config) o;
		if (strict != that.strict) {
			return false;
		}
		if (indent != null ? !indent.equals(that.indent) : that.indent != null) {
			return false;
		}
		if (charset != null ? !charset.equals(that.charset) : that.charset != null) {
			return false;
		}
		if (!Arrays.equals(fileExtensions, that.fileExtensions)) {
			return false;
		}
		return random != null ? random.equals(that.random) : that.random == null;
	}

	@Override
	public int hashCode() {
		int result = (strict ? 1 : 0);
		result = 31 * result + (indent != null ? indent.hashCode() : 0);
		result = 31 * result + (charset != null ? charset.hashCode() : 0);
		result = 31 * result + Arrays.hashCode(fileExtensions);
		result = 31 * result + (random != null ? random.hashCode() : 0);
		return result;
	}

	@Override
	public String toString() {
		return "Config{" +
				"strict=" + strict +
				", indent='" + indent + '\'' +
				", charset=" + charset +
				", fileExtensions=" + Arrays.toString(fileExtensions) +
				", random=" + random +
				'}';
	}

	/**
	 * Converts this {@link Config} instance to a {@link Builder}.
	 *
	 * @return the builder
	 */
	public Builder toBuilder() {
		return newBuilder()
				.strict(this.strict)
				.indent(this.indent)
				.charset(this.charset)
				.fileExtensions(this.fileExtensions)
				.random(this.random);
	}

	/**
	 * Creates a basic {@link Config} with all the defaults (lenient parsing).
	 *
	 * @return the config
	 */
	public static Config basic() {
		return Builder.basic().build();
	}

	/**
	 * Creates a {@link Config} with strict parsing enabled.
	 *
	 * @return the config
	 */
	public static Config strict() {
		return Builder.strict().build();
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
	 * Builder for {@link Config}.
	 */
	public static final class Builder {

		private boolean strict;
		private String indent = DEFAULT_INDENT;
		private Charset charset = DEFAULT_CHARSET;
		private String[] fileExtensions = DEFAULT_FILE_EXTENSIONS;
		private Random random;

		private Builder() {
		}

		/**
		 * Sets whether strict parsing is enabled.
		 *
		 * @param strict whether strict parsing is enabled
		 * @return this builder
		 */
		public Builder strict(boolean strict) {
			this.strict = strict;
			return this;
		}

		/**
		 * Sets the indentation per nesting level of written documents.
		 *
		 * @param indent the indentation
		 * @return this builder
		 */
		public Builder indent(String indent) {
			this.indent = indent;
			return this;
		}

		/**
		 * Sets the charset for reading and writing files.
		 *
		 * @param charset the charset
		 * @return this builder
		 */
		public Builder charset(Charset charset) {
			this.charset = charset;
			return this;
		}

		/**
		 * Sets the file extensions picked up when loading a directory.
		 *
		 * @param fileExtensions the file extensions, e.g. {@code ".txt"}, the defaults if none are given
		 * @return this builder
		 */
		public Builder fileExtensions(String... fileExtensions) {
			if (fileExtensions == null || fileExtensions.length == 0) {
				this.fileExtensions = DEFAULT_FILE_EXTENSIONS;
			} else {
				this.fileExtensions = fileExtensions.clone();
			}
			return this;
		}

		/**
		 * Sets the random source for message selection.
		 *
		 * @param random the random source
		 * @return this builder
		 */
		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		/**
		 * Builds the config.
		 *
		 * @return the config
		 */
		public Config build() {
			Config config = new Config();
			config.strict = this.strict;
			config.indent = this.indent;
			config.charset = this.charset;
			config.fileExtensions = this.fileExtensions;
			config.random = this.random;
			return config;
		}

		/**
		 * Creates a basic {@link Config.Builder} with all the defaults.
		 *
		 * @return the builder
		 */
		public static Builder basic() {
			return new Builder();
		}

		/**
		 * Creates a {@link Config.Builder} with strict parsing enabled.
		 *
		 * @return the builder
		 */
		public static Builder strict() {
			return basic().strict(true);
		}
	}
}
