package com.provenant.sandbox;

/**
 * One independent builder: an id and the provider that runs sandboxes on it.
 */
public record BuilderNode(String id, SandboxProvider provider) {}
