package org.carball.bom.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
