/*
 * DimStatement.java
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

package org.bluezoo.nougat.vbscript.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * {@code Dim a, b, c}: declares variables, binding each to null.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DimStatement extends Statement {

    private final List<String> names;

    /**
     * @param names the declared names; duplicates keep their first position
     * @param lineNumber the source line
     */
    public DimStatement(List<String> names, int lineNumber) {
        super(lineNumber);
        this.names = Collections.unmodifiableList(
            new ArrayList<String>(new LinkedHashSet<String>(names)));
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitDim(this);
    }

    @Override
    public String toString() {
        return "Dim" + names;
    }

}
