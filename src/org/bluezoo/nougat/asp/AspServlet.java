/*
 * AspServlet.java
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

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.ResourceBundle;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.bluezoo.nougat.vbscript.ExecutionContext;

/**
 * Servlet that serves ASP pages from the servlet context.
 *
 * <p>Requests for {@code *.asp} resources are parsed, cached and rendered
 * with a fresh execution context per request. The following init
 * parameters are recognised:
 * <dl>
 *   <dt>{@code encoding}</dt>
 *   <dd>page source and response charset (default UTF-8)</dd>
 *   <dt>{@code renderTimeout}</dt>
 *   <dd>maximum rendering time in milliseconds; 0, the default, means no
 *   limit. A page that overruns is interrupted and answered with 503.</dd>
 *   <dt>{@code errorComments}</dt>
 *   <dd>whether segment failures appear in the page as HTML comments
 *   (default true)</dd>
 * </dl>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AspServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;

    private static final Logger LOGGER = Logger.getLogger(AspServlet.class.getName());
    private static final ResourceBundle L10N =
        ResourceBundle.getBundle("org.bluezoo.nougat.asp.L10N");

    static final String ENCODING = "encoding";
    static final String RENDER_TIMEOUT = "renderTimeout";
    static final String ERROR_COMMENTS = "errorComments";
    static final String DEFAULT_ENCODING = "UTF-8";

    // Parsed pages, keyed by resource path
    private final ConcurrentHashMap<String, AspPage> pageCache = new ConcurrentHashMap<>();

    private transient AspRenderer renderer;
    private transient volatile ExecutorService executor;
    private String encoding = DEFAULT_ENCODING;
    private long renderTimeout;

    @Override
    public void init() throws ServletException {
        String value = getInitParameter(ENCODING);
        if (value != null && !value.trim().isEmpty()) {
            encoding = value.trim();
        }
        value = getInitParameter(RENDER_TIMEOUT);
        if (value != null && !value.trim().isEmpty()) {
            try {
                renderTimeout = Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new ServletException(RENDER_TIMEOUT + ": " + value, e);
            }
        }
        renderer = new AspRenderer();
        value = getInitParameter(ERROR_COMMENTS);
        if (value != null) {
            renderer.setErrorComments(Boolean.parseBoolean(value.trim()));
        }
        if (renderTimeout > 0L) {
            executor = Executors.newCachedThreadPool(new RenderThreadFactory());
        }
        if (LOGGER.isLoggable(Level.CONFIG)) {
            LOGGER.config("ASP servlet initialised: encoding=" + encoding
                          + ", renderTimeout=" + renderTimeout
                          + ", errorComments=" + renderer.isErrorComments());
        }
    }

    @Override
    public void destroy() {
        ExecutorService pool = executor;
        executor = null;
        if (pool != null) {
            pool.shutdownNow();
        }
        pageCache.clear();
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processAspRequest(request, response);
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processAspRequest(request, response);
    }

    /**
     * Loads, renders and writes the requested page.
     */
    private void processAspRequest(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        String aspPath = getAspPath(request);
        AspPage page = aspPath != null ? getPage(aspPath) : null;
        if (page == null) {
            String message = MessageFormat.format(L10N.getString("servlet.not_found"),
                                                  String.valueOf(aspPath));
            response.sendError(HttpServletResponse.SC_NOT_FOUND, message);
            return;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Processing ASP request for: " + aspPath);
        }
        String output;
        try {
            output = render(page);
        } catch (TimeoutException e) {
            String message = MessageFormat.format(L10N.getString("servlet.timeout"),
                                                  aspPath, String.valueOf(renderTimeout));
            LOGGER.warning(message);
            response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, message);
            return;
        } catch (ExecutionException e) {
            String message = MessageFormat.format(L10N.getString("servlet.error"), aspPath);
            LOGGER.log(Level.SEVERE, message, e.getCause());
            response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, message);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServletException(e);
        }
        response.setContentType("text/html; charset=" + encoding);
        PrintWriter out = response.getWriter();
        out.write(output);
        out.flush();
    }

    /**
     * Renders a page, under the configured deadline if there is one.
     */
    private String render(final AspPage page)
            throws ExecutionException, InterruptedException, TimeoutException {
        Callable<String> task = new Callable<String>() {
            @Override
            public String call() {
                ExecutionContext context = new ExecutionContext();
                renderer.render(page, context);
                return context.getOutput();
            }
        };
        ExecutorService pool = executor;
        if (pool == null) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new ExecutionException(e);
            }
        }
        Future<String> future;
        try {
            future = pool.submit(task);
        } catch (RejectedExecutionException e) {
            // shut down by destroy
            throw new ExecutionException(e);
        }
        try {
            return future.get(renderTimeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Gets a parsed page, loading it on first use.
     *
     * @return the page, or null if there is no such resource
     */
    private AspPage getPage(String aspPath) throws IOException {
        AspPage page = pageCache.get(aspPath);
        if (page == null) {
            InputStream in = openPage(aspPath);
            if (in == null) {
                return null;
            }
            try (InputStream pageSource = in) {
                page = renderer.getParser().parse(pageSource, encoding, aspPath);
            }
            AspPage existing = pageCache.putIfAbsent(aspPath, page);
            if (existing != null) {
                page = existing;
            }
        }
        return page;
    }

    /**
     * Opens the source of a page. This implementation reads the resource
     * of that path from the servlet context.
     *
     * @param aspPath the page path
     * @return the page source, or null if there is no such page
     * @throws IOException if the page cannot be opened
     */
    protected InputStream openPage(String aspPath) throws IOException {
        return getServletContext().getResourceAsStream(aspPath);
    }

    /**
     * Clears the parsed page cache, so that modified pages are reloaded.
     */
    public void clearCache() {
        pageCache.clear();
        if (LOGGER.isLoggable(Level.INFO)) {
            LOGGER.info("Cleared ASP page cache");
        }
    }

    public int getCacheSize() {
        return pageCache.size();
    }

    /**
     * Extracts the ASP resource path from the request.
     *
     * @return the path, or null if the request is not for an ASP page
     */
    private String getAspPath(HttpServletRequest request) {
        String servletPath = request.getServletPath();
        String pathInfo = request.getPathInfo();
        String aspPath;
        if (pathInfo != null) {
            aspPath = servletPath != null ? servletPath + pathInfo : pathInfo;
        } else {
            aspPath = servletPath;
        }
        if (aspPath != null && aspPath.toLowerCase(Locale.ROOT).endsWith(".asp")) {
            return aspPath;
        }
        return null;
    }

    @Override
    public String getServletInfo() {
        return "nougat ASP servlet";
    }

    /**
     * Daemon threads named after the servlet.
     */
    private static class RenderThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "nougat-render-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

}
