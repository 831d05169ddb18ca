package com.phillippitts.voicechat.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for change-notification channels.
 */
@ConfigurationProperties(prefix = "realtime")
@Validated
public class RealtimeProperties {

    /** Maximum wait for the transport to acknowledge a channel activation, in milliseconds. */
    @Positive(message = "Activation timeout must be positive")
    private long activationTimeoutMs = 5_000;

    /** Maximum wait for the transport to acknowledge a channel deactivation, in milliseconds. */
    @Positive(message = "Deactivation timeout must be positive")
    private long deactivationTimeoutMs = 5_000;

    /** Database schema the watched tables live in. */
    @NotBlank(message = "Schema must not be blank")
    private String schema = "public";

    /** Suffix appended to a table name to build its shared channel name. */
    @NotBlank(message = "Table channel suffix must not be blank")
    private String tableChannelSuffix = "-changes";

    public long getActivationTimeoutMs() {
        return activationTimeoutMs;
    }

    public void setActivationTimeoutMs(long activationTimeoutMs) {
        this.activationTimeoutMs = activationTimeoutMs;
    }

    public long getDeactivationTimeoutMs() {
        return deactivationTimeoutMs;
    }

    public void setDeactivationTimeoutMs(long deactivationTimeoutMs) {
        this.deactivationTimeoutMs = deactivationTimeoutMs;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getTableChannelSuffix() {
        return tableChannelSuffix;
    }

    public void setTableChannelSuffix(String tableChannelSuffix) {
        this.tableChannelSuffix = tableChannelSuffix;
    }
}
