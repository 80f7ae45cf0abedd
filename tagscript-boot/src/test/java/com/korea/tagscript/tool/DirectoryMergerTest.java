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

package com.korea.tagscript.tool;

import com.korea.tagscript.Config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryMergerTest {

	@TempDir
	Path tempDir;

	private Path inputDir;
	private Path outputDir;

	private final DirectoryMerger merger = new DirectoryMerger();

	@BeforeEach
	void setUp() throws IOException {
		inputDir = Files.createDirectories(tempDir.resolve("input"));
		outputDir = Files.createDirectories(tempDir.resolve("output"));
	}

	@Test
	@DisplayName("Should copy new files, merge existing ones and ignore other files")
	void copiesAndMerges() throws IOException {
		write(inputDir.resolve("copy_me.txt"), "[Copy]\n<val>1</val>\n[/Copy]");
		write(inputDir.resolve("ignore_me.dat"), "some data");
		write(inputDir.resolve("subdir/merge_me.txt"), "# Input File\n[Merge]\n<input>\nyes\n</input>\n[/Merge]");
		write(outputDir.resolve("subdir/merge_me.txt"), "# Original Output\n[Merge]\n<output>\nyes\n</output>\n[/Merge]");

		MergeSummary summary = merger.process(inputDir, outputDir);

		assertThat(read(outputDir.resolve("copy_me.txt"))).isEqualTo("[Copy]\n<val>1</val>\n[/Copy]");
		assertThat(outputDir.resolve("ignore_me.dat")).doesNotExist();

		String merged = read(outputDir.resolve("subdir/merge_me.txt"));
		assertThat(merged)
				.contains("<input>")
				.contains("<output>")
				.contains("# Input File")
				.doesNotContain("# Original Output");

		assertThat(summary.getCopied()).containsExactly(Paths.get("copy_me.txt"));
		assertThat(summary.getMerged()).containsExactly(Paths.get("subdir", "merge_me.txt"));
		assertThat(summary.hasFailures()).isFalse();
	}

	@Test
	@DisplayName("Should let the input file win on conflicting text")
	void inputWins() throws IOException {
		write(inputDir.resolve("a.txt"), "[A]\n<normal>\nfrom input\n</normal>\n[/A]");
		write(outputDir.resolve("a.txt"), "[A]\n<normal>\nfrom output\n</normal>\n<rude>\nkept\n</rude>\n[/A]\n[B]\n[/B]");

		merger.process(inputDir, outputDir);

		String merged = read(outputDir.resolve("a.txt"));
		assertThat(merged).contains("from input").doesNotContain("from output").contains("kept").contains("[B]");
	}

	@Test
	@DisplayName("Should keep the output file's group order and not repeat comments on a second run")
	void mergesRepeatedly() throws IOException {
		write(inputDir.resolve("a.txt"), "[B]\n<normal>\nnew\n</normal>\n[/B]\n[C]\n[/C]\n# footer");
		write(outputDir.resolve("a.txt"), "[A]\n[/A]\n[B]\n<normal>\nold\n</normal>\n[/B]\n# footer");

		merger.process(inputDir, outputDir);
		String once = read(outputDir.resolve("a.txt"));
		merger.process(inputDir, outputDir);

		assertThat(once).isEqualTo("[A]\n[/A]\n\n[B]\n\t<normal>\n\t\tnew\n\t</normal>\n[/B]\n\n[C]\n[/C]\n\n# footer\n");
		assertThat(read(outputDir.resolve("a.txt"))).isEqualTo(once);
	}

	@Test
	@DisplayName("Should pick up files by the configured extensions, the defaults if none are given")
	void usesConfiguredExtensions() throws IOException {
		write(inputDir.resolve("a.txt"), "[A]\n[/A]");
		write(inputDir.resolve("b.msg"), "[B]\n[/B]");

		MergeSummary defaults = new DirectoryMerger(Config.newBuilder().fileExtensions().build()).process(inputDir, outputDir);
		MergeSummary custom = new DirectoryMerger(Config.newBuilder().fileExtensions(".msg").build()).process(inputDir, tempDir.resolve("custom"));

		assertThat(defaults.getCopied()).containsExactly(Paths.get("a.txt"));
		assertThat(custom.getCopied()).containsExactly(Paths.get("b.msg"));
	}

	@Test
	@DisplayName("Should count a broken file as failed and carry on")
	void carriesOnAfterFailure() throws IOException {
		write(inputDir.resolve("a_broken.txt"), "[A]\n<open>\n[/A]");
		write(outputDir.resolve("a_broken.txt"), "[A]\n[/A]");
		write(inputDir.resolve("b_fine.txt"), "[B]\n[/B]");

		MergeSummary summary = merger.process(inputDir, outputDir);

		assertThat(summary.getFailed()).containsExactly(Paths.get("a_broken.txt"));
		assertThat(summary.getCopied()).containsExactly(Paths.get("b_fine.txt"));
		assertThat(read(outputDir.resolve("a_broken.txt"))).isEqualTo("[A]\n[/A]");
	}

	@Test
	@DisplayName("Should create the output directory when it does not exist")
	void createsOutputDirectory() throws IOException {
		write(inputDir.resolve("deep/er/a.txt"), "[A]\n[/A]");
		Path missing = tempDir.resolve("fresh");

		merger.process(inputDir, missing);

		assertThat(missing.resolve("deep/er/a.txt")).exists();
	}

	@Test
	@DisplayName("Should reject a missing input directory")
	void rejectsMissingInput() {
		assertThatThrownBy(() -> merger.process(tempDir.resolve("nope"), outputDir))
				.hasMessageContaining("not found");
	}

	private static void write(Path path, String content) throws IOException {
		Files.createDirectories(path.getParent());
		Files.write(path, content.getBytes(StandardCharsets.UTF_8));
	}

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}
}
