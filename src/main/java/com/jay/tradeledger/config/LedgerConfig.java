package com.jay.tradeledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads and exposes the ledger configuration from ledger.yaml.
 * Values are read once at startup. Edit ledger.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class LedgerConfig {

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    private final Environment env;
    private final String configFile;

    private Market market = new Market();
    private Signals signals = new Signals();
    private Orders orders = new Orders();
    private Premarket premarket = new Premarket();
    private Broker broker = new Broker();

    public LedgerConfig(Environment env,
                        @Value("${ledger.config-file:ledger.yaml}") String configFile) {
        this.env = env;
        this.configFile = configFile;
    }

    /** Resolves ${VAR:default} placeholders using the Spring Environment. */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root.getMarket() != null)    this.market    = root.getMarket();
            if (root.getSignals() != null)   this.signals   = root.getSignals();
            if (root.getOrders() != null)    this.orders    = root.getOrders();
            if (root.getPremarket() != null) this.premarket = root.getPremarket();
            if (root.getBroker() != null)    this.broker    = root.getBroker();

            this.market.setZone(resolve(this.market.getZone()));
            log.info("LedgerConfig loaded from '{}'. Market zone: {}, max retries: {}",
                configFile, market.getZone(), orders.getMaxRetryAttempts());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + configFile, e);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Market market()       { return market; }
    public Signals signals()     { return signals; }
    public Orders orders()       { return orders; }
    public Premarket premarket() { return premarket; }
    public Broker broker()       { return broker; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Market market = new Market();
        private Signals signals = new Signals();
        private Orders orders = new Orders();
        private Premarket premarket = new Premarket();
        private Broker broker = new Broker();
    }

    @Data public static class Market {
        private String zone = "Asia/Kolkata";
        private String sessionStart = "09:00";      // trading-day boundary
        private String syncBlackoutEnd = "16:00";   // no signal sync between session start and this
        private String signalExpiryCutoff = "15:30";
        private List<String> holidays = List.of();

        public LocalTime sessionStartTime()       { return LocalTime.parse(sessionStart); }
        public LocalTime syncBlackoutEndTime()    { return LocalTime.parse(syncBlackoutEnd); }
        public LocalTime signalExpiryCutoffTime() { return LocalTime.parse(signalExpiryCutoff); }

        public Set<LocalDate> holidayDates() {
            return holidays.stream().map(LocalDate::parse).collect(Collectors.toSet());
        }
    }

    @Data public static class Signals {
        private List<String> buyVerdicts = List.of("buy", "strong_buy");
        private List<String> tickerSuffixes = List.of(".NS", ".BO");

        public boolean isBuyClass(String verdict) {
            return verdict != null && buyVerdicts.contains(verdict.trim().toLowerCase(Locale.ROOT));
        }
    }

    @Data public static class Orders {
        private int maxRetryAttempts = 3;
    }

    @Data public static class Premarket {
        private int minQuantity = 1;
    }

    @Data public static class Broker {
        private int authRetryAttempts = 1;
    }
}
