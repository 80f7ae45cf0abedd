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

import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The outcome of a {@link DirectoryMerger} run. Paths are relative to the input directory.
 * 디렉토리 병합 결과. 경로는 입력 디렉토리 기준의 상대 경로.
 */
@Getter
public class MergeSummary {

	private final List<Path> copied = new ArrayList<>();
	private final List<Path> merged = new ArrayList<>();
	private final List<Path> failed = new ArrayList<>();

	void addCopied(Path path) {
		copied.add(path);
	}

	void addMerged(Path path) {
		merged.add(path);
	}

	void addFailed(Path path) {
		failed.add(path);
	}

	public int getTotal() {
		return copied.size() + merged.size() + failed.size();
	}

	public boolean hasFailures() {
		return !failed.isEmpty();
	}

	@Override
	public String toString() {
		return "MergeSummary{" +
				"copied=" + copied.size() +
				", merged=" + merged.size() +
				", failed=" + failed.size() +
				'}';
	}
}
