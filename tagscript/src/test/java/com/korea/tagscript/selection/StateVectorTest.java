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

package com.korea.tagscript.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StateVectorTest {

	@Test
	@DisplayName("Should list the tags of the set axes in axis order")
	void listsTagsInOrder() {
		StateVector state = StateVector.newBuilder()
				.intelligence(Intelligence.WISE)
				.rank(Rank.UNSLAVE)
				.pants(true)
				.lovePlayer(LovePlayer.DISLIKE)
				.footbake(true)
				.age(Age.BABY)
				.build();

		assertThat(state.getTags()).containsExactly("baby", "footbake", "pants", "dislikeplayer", "unslave", "wise");
	}

	@Test
	@DisplayName("Should leave out neutral values")
	void skipsNeutralValues() {
		StateVector state = StateVector.newBuilder()
				.lovePlayer(LovePlayer.NEITHER)
				.rank(Rank.NEITHER)
				.intelligence(Intelligence.NEITHER)
				.build();

		assertThat(state.getTags()).isEmpty();
		assertThat(StateVector.empty().getTags()).isEmpty();
	}

	@Test
	@DisplayName("Should copy all axes through the builder")
	void copiesThroughBuilder() {
		StateVector state = StateVector.newBuilder().age(Age.ADULT).damage(true).build();

		StateVector copy = state.toBuilder().build();

		assertThat(copy).isEqualTo(state);
		assertThat(copy.hashCode()).isEqualTo(state.hashCode());
		assertThat(state.toBuilder().damage(false).build()).isNotEqualTo(state);
	}
}
