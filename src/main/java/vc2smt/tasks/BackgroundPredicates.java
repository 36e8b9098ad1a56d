// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vc2smt.tasks;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Resources;

/**
 * The background theory prepended to every emitted script. The text of the
 * process-wide instance is loaded once, on first use, from the classpath.
 *
 * @author David J. Pearce
 *
 */
public final class BackgroundPredicates {
	public static final String RESOURCE = "vc2smt/UnivBackPred2.smt2";

	private static BackgroundPredicates global;

	private final String text;

	private BackgroundPredicates(String text) {
		this.text = text.replace("\r\n", "\n").replace('\r', '\n');
	}

	/**
	 * Get the process-wide background predicates, loading them if necessary.
	 *
	 * @return
	 * @throws ProverException if the resource cannot be found or read.
	 */
	public static synchronized BackgroundPredicates global() throws ProverException {
		if (global == null) {
			global = load(RESOURCE);
		}
		return global;
	}

	/**
	 * Construct background predicates from given text, bypassing the
	 * process-wide instance.
	 *
	 * @param text
	 * @return
	 */
	public static BackgroundPredicates of(String text) {
		return new BackgroundPredicates(text);
	}

	static BackgroundPredicates load(String resource) throws ProverException {
		URL url = BackgroundPredicates.class.getClassLoader().getResource(resource);
		if (url == null) {
			throw new ProverException("cannot find background predicates: " + resource);
		}
		try {
			return new BackgroundPredicates(Resources.toString(url, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new ProverException("cannot read background predicates: " + resource, e);
		}
	}

	public String getText() {
		return text;
	}
}
