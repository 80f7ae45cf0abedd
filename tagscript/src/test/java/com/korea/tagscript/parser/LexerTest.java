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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LexerTest {

	private final Lexer lexer = new Lexer();

	@Test
	@DisplayName("Should classify action group lines")
	void classifiesActionLines() {
		LineEvent open = lexer.classify("[WantFood]", 1);
		LineEvent close = lexer.classify("  [/WantFood]  ", 2);

		assertThat(open.getType()).isEqualTo(LineType.ACTION_OPEN);
		assertThat(open.getName()).isEqualTo("WantFood");
		assertThat(open.getLineNumber()).isEqualTo(1);
		assertThat(close.getType()).isEqualTo(LineType.ACTION_CLOSE);
		assertThat(close.getName()).isEqualTo("WantFood");
	}

	@Test
	@DisplayName("Should classify standard tag lines with the allowed name characters")
	void classifiesTagLines() {
		LineEvent open = lexer.classify("\t\t<my-tag_1.x>", 3);
		LineEvent close = lexer.classify("\t\t</my-tag_1.x>", 4);

		assertThat(open.getType()).isEqualTo(LineType.TAG_OPEN);
		assertThat(open.getName()).isEqualTo("my-tag_1.x");
		assertThat(close.getType()).isEqualTo(LineType.TAG_CLOSE);
		assertThat(close.getRawTag()).isEqualTo("</my-tag_1.x>");
	}

	@Test
	@DisplayName("Should classify whole-line comments without the conventional leading space")
	void classifiesComments() {
		LineEvent event = lexer.classify("   #  two spaces  ", 1);

		assertThat(event.getType()).isEqualTo(LineType.COMMENT);
		assertThat(event.getValue()).isEqualTo(" two spaces");
	}

	@Test
	@DisplayName("Should treat a line with a comment marker first as a comment even if it contains a tag")
	void commentedOutTagIsComment() {
		LineEvent event = lexer.classify("# <normal>", 1);

		assertThat(event.getType()).isEqualTo(LineType.COMMENT);
		assertThat(event.getValue()).isEqualTo("<normal>");
	}

	@Test
	@DisplayName("Should classify empty and whitespace-only lines as blank")
	void classifiesBlankLines() {
		assertThat(lexer.classify("", 1).getType()).isEqualTo(LineType.BLANK);
		assertThat(lexer.classify(" \t ", 2).getType()).isEqualTo(LineType.BLANK);
	}

	@Test
	@DisplayName("Should split an inline comment off a text line")
	void splitsInlineComment() {
		LineEvent event = lexer.classify("mode a  # note", 1);

		assertThat(event.getType()).isEqualTo(LineType.TEXT);
		assertThat(event.getValue()).isEqualTo("mode a");
		assertThat(event.getInlineComment()).isEqualTo("note");
	}

	@Test
	@DisplayName("Should still recognise a tag line that carries an inline comment")
	void tagWithInlineComment() {
		LineEvent event = lexer.classify("[Action] # This is an inline comment", 1);

		assertThat(event.getType()).isEqualTo(LineType.ACTION_OPEN);
		assertThat(event.getName()).isEqualTo("Action");
		assertThat(event.getInlineComment()).isEqualTo("This is an inline comment");
	}

	@Test
	@DisplayName("Should keep an escaped comment marker as text")
	void escapedMarkerIsText() {
		LineEvent event = lexer.classify("rank \\#1 yukkuri", 1);

		assertThat(event.getType()).isEqualTo(LineType.TEXT);
		assertThat(event.getValue()).isEqualTo("rank #1 yukkuri");
		assertThat(event.getInlineComment()).isNull();
	}

	@Test
	@DisplayName("Should fall back to text for malformed brackets")
	void malformedBracketsAreText() {
		assertThat(lexer.classify("[Unclosed", 1).getType()).isEqualTo(LineType.TEXT);
		assertThat(lexer.classify("<two words>", 2).getType()).isEqualTo(LineType.TEXT);
		assertThat(lexer.classify("<a><b>", 3).getType()).isEqualTo(LineType.TEXT);
		assertThat(lexer.classify("[a] trailing", 4).getType()).isEqualTo(LineType.TEXT);
	}

	@Test
	@DisplayName("Should trim text content")
	void trimsText() {
		LineEvent event = lexer.classify("\t\t  ゆっくりしていってね！  ", 7);

		assertThat(event.getType()).isEqualTo(LineType.TEXT);
		assertThat(event.getValue()).isEqualTo("ゆっくりしていってね！");
		assertThat(event.getInlineComment()).isNull();
		assertThat(event.getLineNumber()).isEqualTo(7);
	}
}
