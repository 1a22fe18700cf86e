package com.rtbhouse.rangeset.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.rtbhouse.rangeset.api.RangeSetConfig;
import com.rtbhouse.rangeset.impl.errors.ContractViolationException;

/**
 * Fail-fast precondition checks of range set operations. Checks can be switched off with
 * {@link RangeSetConfig#CONTRACTS_ENABLED}, in which case violating a precondition leaves the behaviour undefined.
 */
public final class Contracts {

    private static final Logger logger = LoggerFactory.getLogger(Contracts.class);

    private static volatile boolean enabled;
    private static volatile boolean endpointsValidationEnabled;

    static {
        apply(RangeSetConfig.fromSystemProperties());
    }

    private Contracts() {
    }

    public static void configure(RangeSetConfig config) {
        apply(checkNotNull(config));
        logger.info("Range set contracts reconfigured (enabled: {}, endpoints validation: {})",
                enabled, endpointsValidationEnabled);
    }

    private static void apply(RangeSetConfig config) {
        enabled = config.contractsEnabled();
        endpointsValidationEnabled = config.endpointsValidationEnabled();
        if (!enabled) {
            logger.warn("Range set contract checks are disabled, precondition violations will not be detected");
        }
    }

    public static boolean enabled() {
        return enabled;
    }

    public static boolean endpointsValidationEnabled() {
        return endpointsValidationEnabled;
    }

    public static void checkArgument(boolean expression, String template, Object arg) {
        if (enabled && !expression) {
            throw violation(template, arg);
        }
    }

    public static void checkArgument(boolean expression, String template, Object arg1, Object arg2) {
        if (enabled && !expression) {
            throw violation(template, arg1, arg2);
        }
    }

    public static void checkArgument(boolean expression, String template, Object... args) {
        if (enabled && !expression) {
            throw violation(template, args);
        }
    }

    public static void checkState(boolean expression, String message) {
        if (enabled && !expression) {
            throw new ContractViolationException(message);
        }
    }

    public static void checkState(boolean expression, String template, Object arg) {
        if (enabled && !expression) {
            throw violation(template, arg);
        }
    }

    public static void checkState(boolean expression, String template, Object... args) {
        if (enabled && !expression) {
            throw violation(template, args);
        }
    }

    private static ContractViolationException violation(String template, Object... args) {
        return new ContractViolationException(Strings.lenientFormat(template, args));
    }
}
