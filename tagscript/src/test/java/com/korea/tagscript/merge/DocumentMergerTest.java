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

package com.korea.tagscript.merge;

import com.korea.tagscript.ast.Document;
import com.korea.tagscript.ast.Node;
import com.korea.tagscript.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentMergerTest {

	private final Parser parser = new Parser();

	@Test
	@DisplayName("Should copy groups that only one document has")
	void mergesDisjointGroups() {
		Document merged = DocumentMerger.merge(parser.parse("[A]\n[/A]"), parser.parse("[B]\n[/B]"));

		assertThat(merged.getGroups().keySet()).containsExactly("A", "B");
	}

	@Test
	@DisplayName("Should keep the text of the first document on conflicts")
	void firstTextWins() {
		Document merged = DocumentMerger.merge(
				parser.parse("[A]\n<t>\nfirst\n</t>\n[/A]"),
				parser.parse("[A]\n<t>\nsecond\n</t>\n<u>\nonly second\n</u>\n[/A]"));

		assertThat(merged.getGroup("A").resolve("t").getText()).isEqualTo("first");
		assertThat(merged.getGroup("A").resolve("u").getText()).isEqualTo("only second");
		assertThat(merged.getGroup("A").getChildren().keySet()).containsExactly("t", "u");
	}

	@Test
	@DisplayName("Should fill in text and comments the first document lacks")
	void fillsMissingValues() {
		Document merged = DocumentMerger.merge(
				parser.parse("[A]\n<t>\n<c>\n</c>\n</t>\n[/A]"),
				parser.parse("[A]\n# from second\n<t>\nsecond\n</t>\n[/A]"));

		Node t = merged.getGroup("A").resolve("t");
		assertThat(t.getText()).isEqualTo("second");
		assertThat(t.getComments()).containsExactly("from second");
		assertThat(t.hasChild("c")).isTrue();
	}

	@Test
	@DisplayName("Should keep the comments of the first document when it has any")
	void firstCommentsWin() {
		Document merged = DocumentMerger.merge(parser.parse("# mine\n[A]\n[/A]\n# footer"), parser.parse("# theirs\n[A]\n[/A]\n# other"));

		assertThat(merged.getGroup("A").getComments()).containsExactly("mine");
		assertThat(merged.getComments()).containsExactly("footer");
	}

	@Test
	@DisplayName("Should keep the base order and let the overlay win")
	void overlayKeepsBaseOrder() {
		Document base = parser.parse("# a\n[A]\n<t>\nold\n</t>\n<u>\nkept\n</u>\n[/A]\n[B]\n[/B]\n# footer");
		Document overlay = parser.parse("[C]\n[/C]\n# b\n[A]\n<v>\nadded\n</v>\n<t>\nnew\n</t>\n[/A]\n# footer\n# other");

		Document combined = DocumentMerger.overlay(base, overlay);

		assertThat(combined.getGroups().keySet()).containsExactly("A", "B", "C");
		Node a = combined.getGroup("A");
		assertThat(a.getComments()).containsExactly("b");
		assertThat(a.getChildren().keySet()).containsExactly("t", "u", "v");
		assertThat(a.resolve("t").getText()).isEqualTo("new");
		assertThat(a.resolve("u").getText()).isEqualTo("kept");
		assertThat(combined.getComments()).containsExactly("footer", "other");
	}

	@Test
	@DisplayName("Should keep base values the overlay does not have")
	void overlayKeepsMissingValues() {
		Document base = parser.parse("[A]\n# note\n<t>\ntext\n</t>\n[/A]");
		Document overlay = parser.parse("[A]\n<t>\n</t>\n[/A]");

		Document combined = DocumentMerger.overlay(base, overlay);

		assertThat(combined).isEqualTo(base);
		assertThat(base.getGroup("A").resolve("t").getComments()).containsExactly("note");
		assertThat(overlay.getGroup("A").resolve("t").getComments()).isEmpty();
	}

	@Test
	@DisplayName("Should not modify its inputs")
	void leavesInputsUntouched() {
		Document first = parser.parse("[A]\n<t>\n</t>\n[/A]");
		Document second = parser.parse("[A]\n<t>\nx\n</t>\n[/A]\n[B]\n[/B]");
		Document firstCopy = first.copy();
		Document secondCopy = second.copy();

		Document merged = DocumentMerger.merge(first, second);
		merged.getGroup("B").setText("changed");

		assertThat(first).isEqualTo(firstCopy);
		assertThat(second).isEqualTo(secondCopy);
	}

	@Test
	@DisplayName("Should merge with an empty document")
	void mergesWithEmpty() {
		Document document = parser.parse("# c\n[A]\n<t>\nx\n</t>\n[/A]");

		assertThat(DocumentMerger.merge(document, new Document())).isEqualTo(document);
		assertThat(DocumentMerger.merge(new Document(), document)).isEqualTo(document);
	}
}
