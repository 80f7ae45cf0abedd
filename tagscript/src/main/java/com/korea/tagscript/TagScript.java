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

import com.korea.tagscript.ast.Document;
import com.korea.tagscript.ast.Node;
import com.korea.tagscript.merge.DocumentMerger;
import com.korea.tagscript.parser.Parser;
import com.korea.tagscript.parser.ParserConfig;
import com.korea.tagscript.parser.ParserException;
import com.korea.tagscript.selection.MessageSelector;
import com.korea.tagscript.selection.Mood;
import com.korea.tagscript.selection.StateVector;
import com.korea.tagscript.util.StringUtils;
import com.korea.tagscript.writer.EncodingException;
import com.korea.tagscript.writer.Serializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FilenameFilter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static java.util.Objects.requireNonNull;

/**
 * Loads, writes and queries TagScript documents.
 * <p>
 * Usage:
 * <p>
 * <pre>
 * <code>
 * TagScript script = new TagScript();
 *
 * // Load a directory full of message files, or a single file.
 * script.loadDirectory("./messages");
 * script.loadFile("./messages/reimu.txt");
 *
 * // Set variables used by every message.
 * script.setVariable("name", "Reimu");
 *
 * // Get a message.
 * StateVector state = StateVector.newBuilder().age(Age.ADULT).damage(true).build();
 * String message = script.reply("WantFood", Mood.NORMAL, state);
 * </code>
 * </pre>
 * Everything loaded is merged into one {@link Document}; content loaded later wins over content loaded earlier, while
 * groups keep the order in which they were first loaded.
 * 불러온 문서는 하나로 병합되며, 나중에 불러온 내용이 우선한다.
 */
public class TagScript {

	private static Logger logger = LoggerFactory.getLogger(TagScript.class);

	private Charset charset;
	private String[] fileExtensions;

	private Parser parser;
	private Serializer serializer;
	private MessageSelector selector;

	private Document document;                          // everything loaded so far
	private Map<String, String> vars;                   // variables for every message

	/*------------------*/
	/*-- Constructors --*/
	/*------------------*/

	/**
	 * Creates a new {@link TagScript} with the default settings.
	 */
	public TagScript() {
		this(null);
	}

	/**
	 * Creates a new {@link TagScript} with the given {@link Config}.
	 *
	 * @param config the config
	 */
	public TagScript(Config config) {
		if (config == null) {
			config = Config.basic();
		}

		this.charset = config.getCharset();
		if (this.charset == null) {
			this.charset = Config.DEFAULT_CHARSET;
			logger.debug("No charset config: using default {}", Config.DEFAULT_CHARSET);
		}

		this.fileExtensions = config.getFileExtensions();

		Random random = config.getRandom();
		if (random == null) {
			random = new Random();
			logger.debug("No random config: using a new Random");
		}

		this.parser = new Parser(ParserConfig.newBuilder()
				.strict(config.isStrict())
				.build());
		this.serializer = new Serializer(config.getIndent());
		this.selector = new MessageSelector(random);

		this.document = new Document();
		this.vars = new HashMap<>();
	}

	/*---------------------*/
	/*-- Loading Methods --*/
	/*---------------------*/

	/**
	 * Loads a single document from disk.
	 *
	 * @param file the file
	 * @throws TagScriptException in case of a loading error
	 * @throws ParserException    in case of a parsing error
	 */
	public void loadFile(File file) throws TagScriptException, ParserException {
		requireNonNull(file, "'file' must not be null");
		logger.debug("Loading TagScript file: {}", file);

		if (!file.exists()) {
			throw new TagScriptException("File '" + file + "' not found");
		} else if (!file.isFile()) {
			throw new TagScriptException("File '" + file + "' is not a regular file");
		} else if (!file.canRead()) {
			throw new TagScriptException("File '" + file + "' cannot be read");
		}

		List<String> code;
		try {
			code = Files.readAllLines(file.toPath(), charset);
		} catch (IOException e) {
			throw new TagScriptException("Error reading file '" + file + "'", e);
		}

		load(file.toString(), code.toArray(new String[0]));
	}

	/**
	 * Loads a single document from disk.
	 *
	 * @param path the path to the file
	 * @throws TagScriptException in case of a loading error
	 * @throws ParserException    in case of a parsing error
	 */
	public void loadFile(String path) throws TagScriptException, ParserException {
		requireNonNull(path, "'path' must not be null");
		loadFile(new File(path));
	}

	/**
	 * Loads every document in a directory, in file name order. Subdirectories are not searched.
	 * 디렉토리 안의 문서를 파일 이름 순으로 모두 읽는다.
	 *
	 * @param directory  the directory
	 * @param extensions the file extensions to pick up, the configured ones if none are given
	 * @throws TagScriptException in case of a loading error
	 * @throws ParserException    in case of a parsing error
	 */
	public void loadDirectory(File directory, String... extensions) throws TagScriptException, ParserException {
		requireNonNull(directory, "'directory' must not be null");
		logger.debug("Loading TagScript files from directory: {}", directory);

		if (extensions.length == 0) {
			extensions = this.fileExtensions;
		}
		final String[] exts = extensions;

		if (!directory.exists()) {
			throw new TagScriptException("Directory '" + directory + "' not found");
		} else if (!directory.isDirectory()) {
			throw new TagScriptException("Directory '" + directory + "' is not a directory");
		}

		File[] files = directory.listFiles(new FilenameFilter() {

			@Override
			public boolean accept(File dir, String name) {
				for (String ext : exts) {
					if (name.endsWith(ext)) {
						return true;
					}
				}
				return false;
			}
		});
		if (files == null) {
			throw new TagScriptException("Directory '" + directory + "' cannot be read");
		}

		if (files.length == 0) {
			logger.warn("No files found in directory: {}", directory);
		}

		Arrays.sort(files);
		for (File file : files) {
			loadFile(file);
		}
	}

	/**
	 * Loads every document in a directory.
	 *
	 * @param path       the path to the directory
	 * @param extensions the file extensions to pick up, the configured ones if none are given
	 * @throws TagScriptException in case of a loading error
	 * @throws ParserException    in case of a parsing error
	 */
	public void loadDirectory(String path, String... extensions) throws TagScriptException, ParserException {
		requireNonNull(path, "'path' must not be null");
		loadDirectory(new File(path), extensions);
	}

	/**
	 * Loads TagScript source code from a text buffer.
	 *
	 * @param code the source code
	 * @throws ParserException in case of a parsing error
	 */
	public void stream(String code) throws ParserException {
		requireNonNull(code, "'code' must not be null");
		stream(StringUtils.splitLines(code));
	}

	/**
	 * Loads TagScript source code from a {@link String} array, one line per item.
	 *
	 * @param code the lines of source code
	 * @throws ParserException in case of a parsing error
	 */
	public void stream(String[] code) throws ParserException {
		load("stream()", code);
	}

	private void load(String filename, String[] code) throws ParserException {
		Document loaded = this.parser.parse(filename, code);
		this.document = DocumentMerger.overlay(this.document, loaded);
		logger.debug("Loaded {} action group(s) from {}", loaded.getGroups().size(), filename);
	}

	/*---------------------*/
	/*-- Writing Methods --*/
	/*---------------------*/

	/**
	 * Returns the loaded document as TagScript source code.
	 *
	 * @return the source code
	 * @throws EncodingException if the document cannot be written
	 */
	public String serialize() throws EncodingException {
		return serializer.serialize(document);
	}

	/**
	 * Writes the loaded document to disk, replacing the file if it exists.
	 *
	 * @param file the file
	 * @throws TagScriptException in case of a writing error
	 * @throws EncodingException  if the document cannot be written
	 */
	public void write(File file) throws TagScriptException, EncodingException {
		requireNonNull(file, "'file' must not be null");
		logger.debug("Writing TagScript file: {}", file);

		String code = serialize();
		try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), charset)) {
			writer.write(code);
		} catch (IOException e) {
			throw new TagScriptException("Error writing file '" + file + "'", e);
		}
	}

	/**
	 * Writes the loaded document to disk.
	 *
	 * @param path the path to the file
	 * @throws TagScriptException in case of a writing error
	 * @throws EncodingException  if the document cannot be written
	 */
	public void write(String path) throws TagScriptException, EncodingException {
		requireNonNull(path, "'path' must not be null");
		write(new File(path));
	}

	public Document getDocument() {
		return document;
	}

	/**
	 * Replaces the loaded document, e.g. with one built in code.
	 *
	 * @param document the document
	 */
	public void setDocument(Document document) {
		this.document = requireNonNull(document, "'document' must not be null");
	}

	/*-----------------------*/
	/*-- Variable Methods --*/
	/*-----------------------*/

	/**
	 * Sets a variable used by every message. Set the value to {@code null} to delete it.
	 *
	 * @param name  the name of the variable, without the {@code %}
	 * @param value the value
	 */
	public void setVariable(String name, String value) {
		requireNonNull(name, "'name' must not be null");
		if (value == null) {
			vars.remove(name);
		} else {
			vars.put(name, value);
		}
	}

	public String getVariable(String name) {
		requireNonNull(name, "'name' must not be null");
		return vars.get(name);
	}

	public Map<String, String> getVariables() {
		return Collections.unmodifiableMap(vars);
	}

	/*--------------------*/
	/*-- Reply Methods --*/
	/*--------------------*/

	/**
	 * Returns a message from an action group.
	 *
	 * @param group the name of the action group, e.g. {@code WantFood}
	 * @param mood  the mood
	 * @param state the state
	 * @return the message, or {@code null} if there is none
	 */
	public String reply(String group, Mood mood, StateVector state) {
		return reply(group, mood, state, null);
	}

	/**
	 * Returns a message from an action group.
	 *
	 * @param group the name of the action group, e.g. {@code WantFood}
	 * @param mood  the mood
	 * @param state the state
	 * @param vars  variables for this message only, overriding the ones set with {@link #setVariable(String, String)}
	 * @return the message, or {@code null} if there is none
	 */
	public String reply(String group, Mood mood, StateVector state, Map<String, String> vars) {
		requireNonNull(group, "'group' must not be null");
		logger.debug("Asked for a message from [{}] with mood {} and {}", group, mood, state);

		Node root = document.getGroup(group);
		if (root == null) {
			logger.debug("No action group [{}]", group);
			return null;
		}

		Map<String, String> values = new HashMap<>(this.vars);
		if (vars != null) {
			values.putAll(vars);
		}

		String reply = selector.select(root, mood, state, values);
		logger.debug("Reply: {}", reply);
		return reply;
	}
}
