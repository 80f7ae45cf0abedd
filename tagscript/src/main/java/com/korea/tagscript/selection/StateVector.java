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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The state of a character that decides which messages apply to it.
 * <p>
 * Every axis is optional: an unset axis ({@code null}, {@code false} or {@code NEITHER}) contributes no tag.
 * 캐릭터 상태 벡터. 각 축은 선택 사항이며, 설정되지 않은 축은 태그를 만들지 않는다.
 */
public class StateVector {

	private static final StateVector EMPTY = newBuilder().build();

	private Age age;
	private boolean damage;
	private boolean footbake;
	private boolean pants;
	private LovePlayer lovePlayer;
	private Rank rank;
	private Intelligence intelligence;

	protected StateVector() {
	}

	public Age getAge() {
		return age;
	}

	public boolean isDamage() {
		return damage;
	}

	public boolean isFootbake() {
		return footbake;
	}

	public boolean isPants() {
		return pants;
	}

	public LovePlayer getLovePlayer() {
		return lovePlayer;
	}

	public Rank getRank() {
		return rank;
	}

	public Intelligence getIntelligence() {
		return intelligence;
	}

	/**
	 * Returns the tag names of the axes that are set, in the fixed order age, damage, footbake, pants, loveplayer,
	 * rank, intelligence.
	 *
	 * @return the tag names
	 */
	public List<String> getTags() {
		List<String> tags = new ArrayList<>();
		if (age != null) {
			tags.add(age.getTag());
		}
		if (damage) {
			tags.add("damage");
		}
		if (footbake) {
			tags.add("footbake");
		}
		if (pants) {
			tags.add("pants");
		}
		addTag(tags, lovePlayer != null ? lovePlayer.getTag() : null);
		addTag(tags, rank != null ? rank.getTag() : null);
		addTag(tags, intelligence != null ? intelligence.getTag() : null);
		return Collections.unmodifiableList(tags);
	}

	private static void addTag(List<String> tags, String tag) {
		if (tag != null) {
			tags.add(tag);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		StateVector that = (StateVector) o;
		if (damage != that.damage) {
			return false;
		}
		if (footbake != that.footbake) {
			return false;
		}
		if (pants != that.pants) {
			return false;
		}
		if (age != that.age) {
			return false;
		}
		if (lovePlayer != that.lovePlayer) {
			return false;
		}
		if (rank != that.rank) {
			return false;
		}
		return intelligence == that.intelligence;
	}

	@Override
	public int hashCode() {
		int result = (age != null ? age.hashCode() : 0);
		result = 31 * result + (damage ? 1 : 0);
		result = 31 * result + (footbake ? 1 : 0);
		result = 31 * result + (pants ? 1 : 0);
		result = 31 * result + (lovePlayer != null ? lovePlayer.hashCode() : 0);
		result = 31 * result + (rank != null ? rank.hashCode() : 0);
		result = 31 * result + (intelligence != null ? intelligence.hashCode() : 0);
		return result;
	}

	@Override
	public String toString() {
		return "StateVector{" +
				"age=" + age +
				", damage=" + damage +
				", footbake=" + footbake +
				", pants=" + pants +
				", lovePlayer=" + lovePlayer +
				", rank=" + rank +
				", intelligence=" + intelligence +
				'}';
	}

	/**
	 * Converts this {@link StateVector} instance to a {@link Builder}.
	 *
	 * @return the builder
	 */
	public Builder toBuilder() {
		return newBuilder()
				.age(this.age)
				.damage(this.damage)
				.footbake(this.footbake)
				.pants(this.pants)
				.lovePlayer(this.lovePlayer)
				.rank(this.rank)
				.intelligence(this.intelligence);
	}

	/**
	 * Returns a {@link StateVector} with no axis set.
	 *
	 * @return the empty state vector
	 */
	public static StateVector empty() {
		return EMPTY;
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
	 * Builder for {@link StateVector}.
	 */
	public static final class Builder {

		private Age age;
		private boolean damage;
		private boolean footbake;
		private boolean pants;
		private LovePlayer lovePlayer;
		private Rank rank;
		private Intelligence intelligence;

		private Builder() {
		}

		public Builder age(Age age) {
			this.age = age;
			return this;
		}

		public Builder damage(boolean damage) {
			this.damage = damage;
			return this;
		}

		public Builder footbake(boolean footbake) {
			this.footbake = footbake;
			return this;
		}

		public Builder pants(boolean pants) {
			this.pants = pants;
			return this;
		}

		public Builder lovePlayer(LovePlayer lovePlayer) {
			this.lovePlayer = lovePlayer;
			return this;
		}

		public Builder rank(Rank rank) {
			this.rank = rank;
			return this;
		}

		public Builder intelligence(Intelligence intelligence) {
			this.intelligence = intelligence;
			return this;
		}

		/**
		 * Builds the state vector.
		 *
		 * @return the state vector
		 */
		public StateVector build() {
			StateVector state = new StateVector();
			state.age = this.age;
			state.damage = this.damage;
			state.footbake = this.footbake;
			state.pants = this.pants;
			state.lovePlayer = this.lovePlayer;
			state.rank = this.rank;
			state.intelligence = this.intelligence;
			return state;
		}
	}
}
