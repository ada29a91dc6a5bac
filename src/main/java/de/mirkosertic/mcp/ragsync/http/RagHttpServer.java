package de.mirkosertic.mcp.ragsync.http;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty hosting the {@link RagApiServlet} at the root context.
 */
public class RagHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(RagHttpServer.class);

    private final String host;
    private final int port;
    private final RagApiServlet servlet;
    private final Object lifecycleLock = new Object();

    private Server server;
    private ServerConnector connector;

    public RagHttpServer(final String host, final int port, final RagApiServlet servlet) {
        this.host = host;
        this.port = port;
        this.servlet = servlet;
    }

    /**
     * Bind and start serving. A port of 0 picks a free one, see {@link #getPort()}.
     */
    public void start() throws Exception {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return;
            }
            server = new Server();
            connector = new ServerConnector(server);
            connector.setHost(host);
            connector.setPort(port);
            server.addConnector(connector);

            final ServletContextHandler context = new ServletContextHandler();
            context.setContextPath("/");
            context.addServlet(new ServletHolder("rag-api", servlet), "/*");
            server.setHandler(context);

            try {
                server.start();
            } catch (final Exception e) {
                server = null;
                connector = null;
                throw e;
            }
            logger.info("HTTP API listening on http://{}:{}", host, getPort());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            try {
                server.stop();
                logger.info("HTTP API stopped");
            } catch (final Exception e) {
                logger.error("Error stopping HTTP server", e);
            } finally {
                server = null;
                connector = null;
            }
        }
    }

    public void join() throws InterruptedException {
        final Server s;
        synchronized (lifecycleLock) {
            s = server;
        }
        if (s != null) {
            s.join();
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && server.isRunning();
        }
    }

    public int getPort() {
        synchronized (lifecycleLock) {
            if (connector != null && connector.getLocalPort() > 0) {
                return connector.getLocalPort();
            }
            return port;
        }
    }
}
