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
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TagScriptBootApplicationTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Should copy the input directory into the output directory")
	void runsDirectoryMerge() throws Exception {
		Path input = Files.createDirectories(tempDir.resolve("input"));
		Files.write(input.resolve("sleep.txt"), "[Sleep]\n<normal>\nおやすみ\n</normal>\n[/Sleep]\n".getBytes(StandardCharsets.UTF_8));
		Path output = tempDir.resolve("output");

		TagScriptBootApplication application = newApplication(input.toString(), output.toString());
		application.run();

		assertThat(output.resolve("sleep.txt")).exists();
	}

	@Test
	@DisplayName("Should do nothing without directories")
	void skipsWithoutDirectories() throws Exception {
		Path output = tempDir.resolve("output");

		newApplication("", output.toString()).run();
		newApplication(tempDir.resolve("missing").toString(), output.toString()).run();

		assertThat(output).doesNotExist();
	}

	private static TagScriptBootApplication newApplication(String inputDir, String outputDir) {
		TagScriptBootApplication application = new TagScriptBootApplication();
		ReflectionTestUtils.setField(application, "tagScriptVersion", "test");
		ReflectionTestUtils.setField(application, "inputDir", inputDir);
		ReflectionTestUtils.setField(application, "outputDir", outputDir);
		return application;
	}
}
