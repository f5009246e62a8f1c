// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.config;

import static java.util.Objects.requireNonNull;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the store gas prices and the gas meter settings. Values missing from the given config fall back to the
 * defaults in {@code reference.conf}.
 */
public class GasConfigLoader {
    private static final Logger log = LogManager.getLogger(GasConfigLoader.class);

    public static final String ROOT_PATH = "gas";
    public static final String KV_STORE_PATH = ROOT_PATH + ".kvStore";
    public static final String TRANSIENT_STORE_PATH = ROOT_PATH + ".transientStore";
    public static final String METER_PATH = ROOT_PATH + ".meter";

    private final Config config;

    /**
     * Loads from {@code application.conf}, system properties and {@code reference.conf}.
     */
    public GasConfigLoader() {
        this(ConfigFactory.load());
    }

    /**
     * Loads from the given config.
     *
     * @param config the config to read
     * @throws com.typesafe.config.ConfigException if the {@code gas} block has values of the wrong type
     */
    public GasConfigLoader(@NonNull final Config config) {
        requireNonNull(config);
        final var reference = ConfigFactory.defaultReference();
        this.config = config.withFallback(reference).resolve();
        this.config.checkValid(reference, ROOT_PATH);
    }

    @NonNull
    public StoreGasConfig kvStoreGasConfig() {
        final var prices = StoreGasConfig.from(config.getConfig(KV_STORE_PATH));
        log.debug("Loaded kv store gas prices {}", prices);
        return prices;
    }

    @NonNull
    public StoreGasConfig transientStoreGasConfig() {
        final var prices = StoreGasConfig.from(config.getConfig(TRANSIENT_STORE_PATH));
        log.debug("Loaded transient store gas prices {}", prices);
        return prices;
    }

    @NonNull
    public GasMeterConfig gasMeterConfig() {
        final var meterConfig = GasMeterConfig.from(config.getConfig(METER_PATH));
        log.debug("Loaded {}", meterConfig);
        return meterConfig;
    }
}
