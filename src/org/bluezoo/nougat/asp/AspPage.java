/*
 * AspPage.java
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

package org.bluezoo.nougat.asp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed ASP page: its segments in document order.
 *
 * <p>Segments are immutable, so a page may be cached and rendered by
 * several requests at once.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AspPage {

    private final String uri;
    private final List<AspSegment> segments = new ArrayList<AspSegment>();

    public AspPage(String uri) {
        this.uri = uri;
    }

    /**
     * Gets the URI the page was loaded from.
     *
     * @return the URI, or null for a page parsed from a string
     */
    public String getUri() {
        return uri;
    }

    void addSegment(AspSegment segment) {
        segments.add(segment);
    }

    public List<AspSegment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    @Override
    public String toString() {
        return "AspPage{uri=" + uri + ", segments=" + segments.size() + "}";
    }

}
