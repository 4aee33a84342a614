package me.golemcore.mcp.domain.model;

/**
 * Routing key and action extracted from an envelope command.
 */
public record CommandRoute(String agentKey, String action) {
}
