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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigTest {

	@Test
	@DisplayName("Should use the defaults for a basic config")
	void basicDefaults() {
		Config config = Config.basic();

		assertThat(config.isStrict()).isFalse();
		assertThat(config.getIndent()).isEqualTo(Config.DEFAULT_INDENT);
		assertThat(config.getCharset()).isEqualTo(StandardCharsets.UTF_8);
		assertThat(config.getFileExtensions()).containsExactly(".txt");
		assertThat(Config.strict().isStrict()).isTrue();
	}

	@Test
	@DisplayName("Should fall back to the default file extensions and copy the given ones")
	void fileExtensions() {
		assertThat(Config.newBuilder().fileExtensions().build().getFileExtensions()).containsExactly(".txt");
		assertThat(Config.newBuilder().fileExtensions((String[]) null).build().getFileExtensions()).containsExactly(".txt");

		String[] extensions = {".msg"};
		Config config = Config.newBuilder().fileExtensions(extensions).build();
		extensions[0] = ".changed";
		config.getFileExtensions()[0] = ".changed";

		assertThat(config.getFileExtensions()).containsExactly(".msg");
	}

	@Test
	@DisplayName("Should copy every setting through the builder")
	void copiesThroughBuilder() {
		Config config = Config.newBuilder()
				.strict(true)
				.indent("  ")
				.fileExtensions(".txt", ".msg")
				.build();

		assertThat(config.toBuilder().build()).isEqualTo(config);
		assertThat(config.toBuilder().strict(false).build()).isNotEqualTo(config);
	}
}
