package com.vidnyan.trustgate;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the verification engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "trustgate.engine")
public class TrustGateProperties {

    /**
     * Maximum number of cached reports.
     * Default: 512
     */
    private int cacheCapacity = 512;

    /**
     * Whether reports are cached by content hash.
     */
    private boolean cacheEnabled = true;

    /**
     * Ids of built-in or plugin rules to switch off.
     */
    private List<String> disabledRules = new ArrayList<>();
}
