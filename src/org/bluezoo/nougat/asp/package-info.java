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
 * Classic ASP page rendering.
 *
 * <p>This package turns documents mixing HTML with {@code <% %>} script
 * regions into rendered output, running the script with the VBScript
 * interpreter.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.nougat.asp.AspParser} - Splits documents into
 *       text, code, expression and directive segments</li>
 *   <li>{@link org.bluezoo.nougat.asp.SegmentHandler} - Chain of handlers
 *       that segments are dispatched through</li>
 *   <li>{@link org.bluezoo.nougat.asp.AspRenderer} - Renders a page,
 *       containing failures to the segment that raised them</li>
 *   <li>{@link org.bluezoo.nougat.asp.AspServlet} - Serves {@code *.asp}
 *       resources of a web application</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 *
 * <pre>{@code
 * <servlet>
 *   <servlet-name>asp</servlet-name>
 *   <servlet-class>org.bluezoo.nougat.asp.AspServlet</servlet-class>
 *   <init-param>
 *     <param-name>renderTimeout</param-name>
 *     <param-value>5000</param-value>
 *   </init-param>
 * </servlet>
 * <servlet-mapping>
 *   <servlet-name>asp</servlet-name>
 *   <url-pattern>*.asp</url-pattern>
 * </servlet-mapping>
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.nougat.vbscript
 */
package org.bluezoo.nougat.asp;
