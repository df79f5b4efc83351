package com.carelog.r2dbc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Controls whether the per-user legacy aggregate row is maintained.
 *
 * <pre>
 * carelog:
 *   legacy-aggregate:
 *     mode: auto   # auto | enabled | disabled
 * </pre>
 *
 * {@code auto} looks for the {@code memories} table once at startup.
 */
@ConfigurationProperties(prefix = "carelog.legacy-aggregate")
public class LegacyAggregateProperties {

    public enum Mode { AUTO, ENABLED, DISABLED }

    private Mode mode = Mode.AUTO;

    public Mode getMode() { return mode; }
    public void setMode(Mode mode) { this.mode = mode == null ? Mode.AUTO : mode; }
}
