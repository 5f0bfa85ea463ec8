/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.app;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.crm.client.JsonRpcOdooClient;
import io.odoomcp.crm.client.OdooClient;
import io.odoomcp.crm.tools.CrmToolProvider;
import io.odoomcp.server.McpBridgeServer;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the bridge in embedded Tomcat: {@code /health}, {@code /sse} and {@code /messages}
 * are served by a single async servlet backed by the Odoo CRM tools.
 */
public class OdooMcpServerApplication {

	private static final Logger logger = LoggerFactory.getLogger(OdooMcpServerApplication.class);

	private static final Duration STARTUP_CONNECT_TIMEOUT = Duration.ofSeconds(10);

	private final OdooMcpProperties properties;

	private final OdooClient odooClient;

	private final McpBridgeServer server;

	private final Tomcat tomcat;

	public OdooMcpServerApplication(OdooMcpProperties properties) {
		this.properties = properties;
		ObjectMapper objectMapper = new ObjectMapper();
		this.odooClient = new JsonRpcOdooClient(properties.getOdooClientConfig(), objectMapper);
		this.server = McpBridgeServer.builder()
			.objectMapper(objectMapper)
			.serverInfo(properties.getServiceName(), "1.0.0")
			.instructions("Tools for reading and updating leads, partners, stages and teams in Odoo CRM.")
			.toolProvider(new CrmToolProvider(this.odooClient, objectMapper))
			.toolCallTimeout(properties.getToolCallTimeout())
			.keepAliveInterval(properties.getHeartbeatInterval())
			.sessionIdleTimeout(properties.getSessionIdleTimeout())
			.responseDelivery(properties.getResponseDelivery())
			.build();
		this.tomcat = createTomcat(properties.getHost(), properties.getPort(), this.server);
	}

	static Tomcat createTomcat(String host, int port, McpBridgeServer server) {
		Tomcat tomcat = new Tomcat();
		tomcat.setPort(port);

		String baseDir = System.getProperty("java.io.tmpdir");
		tomcat.setBaseDir(baseDir);

		Context context = tomcat.addContext("", baseDir);

		Wrapper wrapper = context.createWrapper();
		wrapper.setName("mcpServlet");
		wrapper.setServlet(server.getTransport());
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		context.addChild(wrapper);
		context.addServletMappingDecoded("/*", "mcpServlet");

		Connector connector = tomcat.getConnector();
		connector.setProperty("address", host);
		// SSE streams stay open until the client leaves
		connector.setAsyncTimeout(0);
		return tomcat;
	}

	public void start() throws LifecycleException {
		this.tomcat.start();
		logger.info("Odoo MCP bridge listening on http://{}:{} (SSE /sse, messages /messages, health /health)",
				this.properties.getHost(), getPort());
		try {
			this.odooClient.connect().block(STARTUP_CONNECT_TIMEOUT);
			logger.info("Connected to Odoo at {} database {}", this.odooClient.getUrl(),
					this.odooClient.getDatabase());
		}
		catch (RuntimeException e) {
			// tools log in again on first use
			logger.warn("Odoo is not reachable yet: {}", e.getMessage());
		}
	}

	public int getPort() {
		return this.tomcat.getConnector().getLocalPort();
	}

	public McpBridgeServer getServer() {
		return this.server;
	}

	public void await() {
		this.tomcat.getServer().await();
	}

	public void stop() {
		logger.info("Shutting down Odoo MCP bridge...");
		this.server.close();
		try {
			this.tomcat.stop();
			this.tomcat.destroy();
		}
		catch (LifecycleException e) {
			logger.error("Error during Tomcat shutdown", e);
		}
	}

	public static void main(String[] args) throws Exception {
		OdooMcpProperties properties = OdooMcpProperties.load();
		List<String> problems = properties.validate();
		if (!problems.isEmpty()) {
			problems.forEach(problem -> logger.error("Invalid configuration: {}", problem));
			throw new IllegalStateException("Invalid configuration. Check environment variables.");
		}
		logger.info("Starting Odoo MCP bridge with {}", properties);

		OdooMcpServerApplication application = new OdooMcpServerApplication(properties);
		Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "odoo-mcp-shutdown"));
		try {
			application.start();
		}
		catch (LifecycleException e) {
			logger.error("Failed to start Tomcat server", e);
			throw e;
		}
		application.await();
	}

}
