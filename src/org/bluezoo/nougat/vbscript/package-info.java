/*
 * package-info.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of nougat, a classic ASP page engine.
 *
 * nougat is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * nougat is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with nougat.  If not, see <http://www.gnu.org/licenses/>.
 */

/**
 * A VBScript interpreter for server-side page scripts.
 *
 * <p>Source is tokenized by {@link org.bluezoo.nougat.vbscript.Tokenizer},
 * grouped into logical lines (statements separated by newlines or
 * colons, with {@code _} line continuations joined), and parsed
 * statement by statement by
 * {@link org.bluezoo.nougat.vbscript.StatementParser}. Block bodies are
 * kept as source text and parsed once, the first time they run.
 * {@link org.bluezoo.nougat.vbscript.StatementExecutor} runs the
 * statements against an
 * {@link org.bluezoo.nougat.vbscript.ExecutionContext}, which holds the
 * variables, function frames and output of one rendering pass.
 *
 * <p>Failures are reported as
 * {@link org.bluezoo.nougat.vbscript.VBScriptException}s carrying a
 * stable numeric code.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.nougat.vbscript;
