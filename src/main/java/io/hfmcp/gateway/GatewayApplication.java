package io.hfmcp.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the HF MCP Gateway.
 *
 * <p>Serves Hugging Face Hub tools over MCP and proxies the tools of Gradio endpoints chosen per
 * user, over stdio, SSE, streamable HTTP or stateless HTTP.</p>
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
