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

import com.korea.tagscript.ast.Document;
import com.korea.tagscript.ast.Node;
import com.korea.tagscript.util.StringUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parser for TagScript source code.
 * <p>
 * Builds a {@link Document} from the classified lines with an explicit stack of open elements. Comment lines are
 * buffered until the next action group or tag opens and then attach to it; comments still buffered when an element
 * closes attach to that element, and whatever is left at the end of the input belongs to the document itself.
 * 명시적인 스택으로 문서 트리를 구성한다. 주석은 다음에 열리는 태그에 붙는다.
 */
public class Parser {

	private static Logger logger = LoggerFactory.getLogger(Parser.class);

	private static final String BYTE_ORDER_MARK = "\uFEFF";

	private final Lexer lexer = new Lexer();
	private boolean strict;

	/**
	 * Creates a new {@link Parser} with a default {@link ParserConfig}.
	 */
	public Parser() {
		this(null);
	}

	/**
	 * Creates a new {@link Parser} with the given {@link ParserConfig}.
	 *
	 * @param config the config
	 */
	public Parser(ParserConfig config) {
		if (config == null) {
			config = ParserConfig.basic();
		}
		this.strict = config.isStrict();
	}

	/**
	 * Parses TagScript source code held in a single string.
	 *
	 * @param code the source code
	 * @return the document
	 * @throws ParserException in case of a parsing error
	 */
	public Document parse(String code) throws ParserException {
		return parse("stream()", StringUtils.splitLines(code));
	}

	/**
	 * Parses TagScript source code.
	 * 소스 코드를 파싱해서 {@link Document}를 반환한다.
	 * <p>
	 * In case of mismatched or unterminated elements a {@link StructuralException} will be thrown. A leading UTF-8 byte
	 * order mark is skipped.
	 *
	 * @param filename the arbitrary name for the source code being parsed
	 * @param code     the lines of source code
	 * @return the document
	 * @throws ParserException in case of a parsing error
	 */
	public Document parse(String filename, String[] code) throws ParserException {

		logger.debug("Parsing {}", filename);

		if (code.length > 0 && code[0].startsWith(BYTE_ORDER_MARK)) {
			code = code.clone();
			code[0] = code[0].substring(BYTE_ORDER_MARK.length());
		}

		if (logger.isTraceEnabled()) {
			for (String line : code) {
				logger.trace("{}", line);
			}
		}

		long startTime = System.currentTimeMillis();

		Document document = new Document();
		Deque<Frame> stack = new ArrayDeque<>();
		List<String> pendingComments = new ArrayList<>();

		for (int lp = 0; lp < code.length; lp++) {
			int lineno = lp + 1;
			LineEvent event = lexer.classify(code[lp], lineno);

			switch (event.getType()) {

				case BLANK: {
					// Blank lines neither flush nor reset the pending comments.
					break;
				}
				case COMMENT: {
					logger.debug("\tComment: {}", event.getValue());
					pendingComments.add(event.getValue());
					break;
				}
				case ACTION_OPEN:
				case TAG_OPEN: {
					Frame parent = stack.peek();
					if (event.getType() == LineType.ACTION_OPEN && parent != null) {
						throw new StructuralException(String.format("Action group '%s' on line %d of %s must not be nested inside '%s'",
								event.getRawTag(), lineno, filename, parent.getRawTag()), lineno, event.getName());
					}
					if (event.getType() == LineType.TAG_OPEN && parent == null) {
						throw new StructuralException(String.format("Tag '%s' on line %d of %s must be inside an action group",
								event.getRawTag(), lineno, filename), lineno, event.getName());
					}

					logger.debug("\tOpen {}", event.getRawTag());

					Node node = new Node();
					node.addComments(pendingComments);
					pendingComments.clear();
					if (event.getInlineComment() != null) {
						node.addComment(event.getInlineComment());
					}

					boolean duplicate = parent == null ? document.hasGroup(event.getName()) : parent.node.hasChild(event.getName());
					if (duplicate) {
						String message = String.format("Duplicate '%s' on line %d of %s", event.getRawTag(), lineno, filename);
						if (strict) {
							throw new StructuralException(message, lineno, event.getName());
						}
						logger.warn("{}; the last one wins", message);
					}

					// Register with the parent right away so siblings keep their source order.
					if (parent == null) {
						document.putGroup(event.getName(), node);
					} else {
						parent.node.putChild(event.getName(), node);
					}
					stack.push(new Frame(event.getName(), event.getType(), node, lineno));
					break;
				}
				case ACTION_CLOSE:
				case TAG_CLOSE: {
					Frame top = stack.peek();
					if (top == null) {
						throw new StructuralException(String.format("Closing tag '%s' on line %d of %s has no matching opening tag",
								event.getRawTag(), lineno, filename), lineno, event.getName());
					}
					LineType expected = event.getType() == LineType.ACTION_CLOSE ? LineType.ACTION_OPEN : LineType.TAG_OPEN;
					if (top.type != expected || !top.name.equals(event.getName())) {
						throw new StructuralException(String.format("Mismatched closing tag '%s' on line %d of %s, expected the closing tag of '%s'",
								event.getRawTag(), lineno, filename, top.getRawTag()), lineno, event.getName());
					}

					logger.debug("\tClose {}", event.getRawTag());

					// Comments left inside the block trail the element being closed.
					top.node.addComments(pendingComments);
					pendingComments.clear();
					if (event.getInlineComment() != null) {
						top.node.addComment(event.getInlineComment());
					}
					stack.pop();
					break;
				}
				case TEXT: {
					Frame top = stack.peek();
					if (top == null) {
						String message = String.format("Text outside of any action group on line %d of %s", lineno, filename);
						if (strict) {
							throw new ParserException(message);
						}
						logger.warn("{}; ignoring it", message);
						break;
					}

					logger.debug("\tText: {}", event.getValue());
					top.node.appendText(event.getValue());
					if (event.getInlineComment() != null) {
						top.node.addComment(event.getInlineComment());
					}
					break;
				}
				default:
					logger.warn("Unknown line type '{}' found at {} line {}", event.getType(), filename, lineno);
			}
		}

		if (!stack.isEmpty()) {
			Frame unclosed = stack.peek();
			throw new StructuralException(String.format("Unclosed tag '%s' opened on line %d of %s",
					unclosed.getRawTag(), unclosed.lineNumber, filename), unclosed.lineNumber, unclosed.name);
		}

		if (!pendingComments.isEmpty()) {
			document.addComments(pendingComments);
		}

		if (logger.isDebugEnabled()) {
			long elapsedTime = System.currentTimeMillis() - startTime;
			logger.debug("Parsing {} completed in {} ms", filename, elapsedTime);
		}

		return document;
	}

	/**
	 * An element that has been opened but not yet closed.
	 */
	private static class Frame {

		private final String name;
		private final LineType type;
		private final Node node;
		private final int lineNumber;

		Frame(String name, LineType type, Node node, int lineNumber) {
			this.name = name;
			this.type = type;
			this.node = node;
			this.lineNumber = lineNumber;
		}

		String getRawTag() {
			return type == LineType.ACTION_OPEN ? "[" + name + "]" : "<" + name + ">";
		}
	}
}
