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
import com.korea.tagscript.TagScript;
import com.korea.tagscript.TagScriptException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Copies TagScript files from an input directory into an output directory, merging them with the files already there.
 * <p>
 * Every file below the input directory with one of the configured extensions is handled on its own: if the output
 * directory has no file at the same relative path it is copied as is, otherwise both files are parsed, merged with the
 * input file taking precedence, and the result replaces the output file. Other files are ignored. A file that fails to
 * parse or write is logged and counted, and the run goes on with the next one.
 * 입력 디렉토리의 파일을 출력 디렉토리로 복사하거나, 이미 있으면 입력 파일 우선으로 병합한다.
 */
public class DirectoryMerger {

	private static Logger logger = LoggerFactory.getLogger(DirectoryMerger.class);

	private final Config config;

	public DirectoryMerger() {
		this(null);
	}

	/**
	 * Creates a new {@link DirectoryMerger}.
	 *
	 * @param config the config used to read and write the files
	 */
	public DirectoryMerger(Config config) {
		if (config == null) {
			config = Config.basic();
		}
		this.config = config;
	}

	/**
	 * Copies and merges the files of {@code inputDir} into {@code outputDir}.
	 *
	 * @param inputDir  the input directory
	 * @param outputDir the output directory, created if missing
	 * @return the summary of the run
	 * @throws TagScriptException if the input directory cannot be listed
	 */
	public MergeSummary process(Path inputDir, Path outputDir) throws TagScriptException {
		requireNonNull(inputDir, "'inputDir' must not be null");
		requireNonNull(outputDir, "'outputDir' must not be null");

		if (!Files.isDirectory(inputDir)) {
			throw new TagScriptException("Input directory '" + inputDir + "' not found");
		}

		MergeSummary summary = new MergeSummary();
		for (Path source : listFiles(inputDir)) {
			Path relative = inputDir.relativize(source);
			Path target = outputDir.resolve(relative);
			try {
				if (Files.exists(target)) {
					logger.info("Merging '{}' into '{}'", source, target);
					merge(source, target);
					summary.addMerged(relative);
				} else {
					logger.info("Copying '{}' to '{}'", source, target);
					copy(source, target);
					summary.addCopied(relative);
				}
			} catch (TagScriptException | IOException e) {
				logger.error("Error processing file '{}': {}", source, e.getMessage(), e);
				summary.addFailed(relative);
			}
		}

		logger.info("Processed {} file(s): {}", summary.getTotal(), summary);
		return summary;
	}

	private List<Path> listFiles(Path inputDir) {
		try (Stream<Path> paths = Files.walk(inputDir)) {
			List<Path> files = paths
					.filter(Files::isRegularFile)
					.filter(this::hasExtension)
					.collect(Collectors.toCollection(ArrayList::new));
			Collections.sort(files);
			return files;
		} catch (IOException | UncheckedIOException e) {
			throw new TagScriptException("Error listing directory '" + inputDir + "'", e);
		}
	}

	private boolean hasExtension(Path path) {
		String name = path.getFileName().toString();
		for (String ext : config.getFileExtensions()) {
			if (name.endsWith(ext)) {
				return true;
			}
		}
		return false;
	}

	private void copy(Path source, Path target) throws IOException {
		createParentDirectories(target);
		Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
	}

	private void merge(Path source, Path target) throws TagScriptException {
		// Later loads win, so the input file goes last.
		TagScript tagScript = new TagScript(config);
		tagScript.loadFile(target.toFile());
		tagScript.loadFile(source.toFile());
		tagScript.write(target.toFile());
	}

	private void createParentDirectories(Path target) throws IOException {
		Path parent = target.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}
}
