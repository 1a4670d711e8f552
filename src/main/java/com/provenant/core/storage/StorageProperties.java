package com.provenant.core.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "provenant.storage")
public class StorageProperties {

    /** Root directory for artifacts, build logs and per-attempt sandbox output. */
    private String root = "./data";

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
}
