package org.carball.sqlinspector.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
