package com.rtbhouse.rangeset.api;

import java.util.Map;
import java.util.Properties;

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.rtbhouse.rangeset.impl.Contracts;

/**
 * {@link RangeSet} library configuration, applied with {@link Contracts#configure(RangeSetConfig)}.
 */
public class RangeSetConfig extends AbstractConfig {

    /**
     * Prefix of JVM system properties read by {@link #fromSystemProperties()}.
     */
    public static final String SYSTEM_PROPERTIES_PREFIX = "rangeset.";

    /**
     * Whether preconditions of {@link RangeSet} operations are checked.
     */
    public static final String CONTRACTS_ENABLED = "contracts.enabled";
    private static final String CONTRACTS_ENABLED_DOC = "Whether preconditions of range set operations are checked." +
            " Violations are reported with ContractViolationException.";
    private static final boolean CONTRACTS_ENABLED_DEFAULT = true;

    /**
     * Whether every constructed endpoint list is validated to be strictly ascending and inside the domain. The check
     * is linear in the number of endpoints, so it is configurable separately from the other contract checks.
     */
    public static final String CONTRACTS_ENDPOINTS_VALIDATION_ENABLED = "contracts.endpoints.validation.enabled";
    private static final String CONTRACTS_ENDPOINTS_VALIDATION_ENABLED_DOC = "Whether every constructed endpoint" +
            " list is validated to be strictly ascending and inside the domain. Ignored if contracts.enabled is false.";
    private static final boolean CONTRACTS_ENDPOINTS_VALIDATION_ENABLED_DEFAULT = true;

    private static final ConfigDef CONFIG;

    static {
        CONFIG = new ConfigDef()
                .define(CONTRACTS_ENABLED,
                        Type.BOOLEAN,
                        CONTRACTS_ENABLED_DEFAULT,
                        Importance.HIGH,
                        CONTRACTS_ENABLED_DOC)
                .define(CONTRACTS_ENDPOINTS_VALIDATION_ENABLED,
                        Type.BOOLEAN,
                        CONTRACTS_ENDPOINTS_VALIDATION_ENABLED_DEFAULT,
                        Importance.LOW,
                        CONTRACTS_ENDPOINTS_VALIDATION_ENABLED_DOC);
    }

    public RangeSetConfig(final Map<?, ?> props) {
        super(CONFIG, props, false);
    }

    /**
     * Creates the configuration from JVM system properties starting with {@value #SYSTEM_PROPERTIES_PREFIX}, e.g.
     * {@code -Drangeset.contracts.enabled=false}.
     */
    public static RangeSetConfig fromSystemProperties() {
        return new RangeSetConfig(propertiesWithPrefix(System.getProperties(), SYSTEM_PROPERTIES_PREFIX));
    }

    private static Map<String, Object> propertiesWithPrefix(Properties props, String prefix) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        Maps.fromProperties(props).forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                builder.put(key.substring(prefix.length()), value);
            }
        });
        return builder.build();
    }

    public boolean contractsEnabled() {
        return getBoolean(CONTRACTS_ENABLED);
    }

    public boolean endpointsValidationEnabled() {
        return contractsEnabled() && getBoolean(CONTRACTS_ENDPOINTS_VALIDATION_ENABLED);
    }
}
