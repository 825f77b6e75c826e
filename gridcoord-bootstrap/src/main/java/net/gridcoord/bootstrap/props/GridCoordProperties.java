package net.gridcoord.bootstrap.props;

import net.gridcoord.core.service.CoordinatorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("gridcoord")
public class GridCoordProperties {
    private Coordinator coordinator = new Coordinator();
    private Reconciliation reconciliation = new Reconciliation();
    private Storage storage = new Storage();
    private Notify notify = new Notify();
    private Api api = new Api();
    private List<Account> accounts = new ArrayList<>(); // ← 가변

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts;
    }

    /** 코어 튜닝값. 기본값은 CoordinatorSettings의 기본값과 같다 */
    public static class Coordinator {
        private int faultThreshold = 5;
        private int maxAttempts = 3;
        private Duration faultCooldown = Duration.ofMinutes(5);
        private Duration probationDelay = Duration.ofMinutes(10);
        private Duration minLeaseTtl = Duration.ofSeconds(150);
        private Duration baseLeaseTtl = Duration.ofSeconds(60);
        private Duration perUnitLeaseCost = Duration.ofSeconds(30);
        private long imageUnitPixels = 512L * 512L;
        private int textUnitTokens = 512;
        private Duration defaultRequestLifetime = Duration.ofMinutes(20);
        private Duration maxRequestLifetime = Duration.ofHours(2);
        private Duration usageHalfLife = Duration.ofHours(1);
        private int maxSlotsPerRequest = 20;
        private int matcherScanLimit = 500;
        private int maxLeaseRaces = 3;

        public CoordinatorSettings toSettings() {
            return CoordinatorSettings.builder()
                    .faultThreshold(faultThreshold)
                    .maxAttempts(maxAttempts)
                    .faultCooldown(faultCooldown)
                    .probationDelay(probationDelay)
                    .minLeaseTtl(minLeaseTtl)
                    .baseLeaseTtl(baseLeaseTtl)
                    .perUnitLeaseCost(perUnitLeaseCost)
                    .imageUnitPixels(imageUnitPixels)
                    .textUnitTokens(textUnitTokens)
                    .defaultRequestLifetime(defaultRequestLifetime)
                    .maxRequestLifetime(maxRequestLifetime)
                    .usageHalfLife(usageHalfLife)
                    .maxSlotsPerRequest(maxSlotsPerRequest)
                    .matcherScanLimit(matcherScanLimit)
                    .maxLeaseRaces(maxLeaseRaces)
                    .build();
        }

        public int getFaultThreshold() {
            return faultThreshold;
        }

        public void setFaultThreshold(int faultThreshold) {
            this.faultThreshold = faultThreshold;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getFaultCooldown() {
            return faultCooldown;
        }

        public void setFaultCooldown(Duration faultCooldown) {
            this.faultCooldown = faultCooldown;
        }

        public Duration getProbationDelay() {
            return probationDelay;
        }

        public void setProbationDelay(Duration probationDelay) {
            this.probationDelay = probationDelay;
        }

        public Duration getMinLeaseTtl() {
            return minLeaseTtl;
        }

        public void setMinLeaseTtl(Duration minLeaseTtl) {
            this.minLeaseTtl = minLeaseTtl;
        }

        public Duration getBaseLeaseTtl() {
            return baseLeaseTtl;
        }

        public void setBaseLeaseTtl(Duration baseLeaseTtl) {
            this.baseLeaseTtl = baseLeaseTtl;
        }

        public Duration getPerUnitLeaseCost() {
            return perUnitLeaseCost;
        }

        public void setPerUnitLeaseCost(Duration perUnitLeaseCost) {
            this.perUnitLeaseCost = perUnitLeaseCost;
        }

        public long getImageUnitPixels() {
            return imageUnitPixels;
        }

        public void setImageUnitPixels(long imageUnitPixels) {
            this.imageUnitPixels = imageUnitPixels;
        }

        public int getTextUnitTokens() {
            return textUnitTokens;
        }

        public void setTextUnitTokens(int textUnitTokens) {
            this.textUnitTokens = textUnitTokens;
        }

        public Duration getDefaultRequestLifetime() {
            return defaultRequestLifetime;
        }

        public void setDefaultRequestLifetime(Duration defaultRequestLifetime) {
            this.defaultRequestLifetime = defaultRequestLifetime;
        }

        public Duration getMaxRequestLifetime() {
            return maxRequestLifetime;
        }

        public void setMaxRequestLifetime(Duration maxRequestLifetime) {
            this.maxRequestLifetime = maxRequestLifetime;
        }

        public Duration getUsageHalfLife() {
            return usageHalfLife;
        }

        public void setUsageHalfLife(Duration usageHalfLife) {
            this.usageHalfLife = usageHalfLife;
        }

        public int getMaxSlotsPerRequest() {
            return maxSlotsPerRequest;
        }

        public void setMaxSlotsPerRequest(int maxSlotsPerRequest) {
            this.maxSlotsPerRequest = maxSlotsPerRequest;
        }

        public int getMatcherScanLimit() {
            return matcherScanLimit;
        }

        public void setMatcherScanLimit(int matcherScanLimit) {
            this.matcherScanLimit = matcherScanLimit;
        }

        public int getMaxLeaseRaces() {
            return maxLeaseRaces;
        }

        public void setMaxLeaseRaces(int maxLeaseRaces) {
            this.maxLeaseRaces = maxLeaseRaces;
        }
    }

    public static class Reconciliation {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private Duration finishedRetention = Duration.ofDays(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public Duration getFinishedRetention() {
            return finishedRetention;
        }

        public void setFinishedRetention(Duration finishedRetention) {
            this.finishedRetention = finishedRetention;
        }
    }

    public static class Storage {
        private String type = "memory"; // memory | jdbc

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Notify {
        private boolean webhookEnabled = true;
        private int threads = 2;
        private int webhookAttempts = 3;
        private Duration webhookTimeout = Duration.ofSeconds(3);

        public boolean isWebhookEnabled() {
            return webhookEnabled;
        }

        public void setWebhookEnabled(boolean webhookEnabled) {
            this.webhookEnabled = webhookEnabled;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getWebhookAttempts() {
            return webhookAttempts;
        }

        public void setWebhookAttempts(int webhookAttempts) {
            this.webhookAttempts = webhookAttempts;
        }

        public Duration getWebhookTimeout() {
            return webhookTimeout;
        }

        public void setWebhookTimeout(Duration webhookTimeout) {
            this.webhookTimeout = webhookTimeout;
        }
    }

    public static class Api {
        private Duration popWait = Duration.ZERO;

        public Duration getPopWait() {
            return popWait;
        }

        public void setPopWait(Duration popWait) {
            this.popWait = popWait;
        }
    }

    public static class Account {
        private String key;
        private String accountId;
        private int trustTier;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getAccountId() {
            return accountId;
        }

        public void setAccountId(String accountId) {
            this.accountId = accountId;
        }

        public int getTrustTier() {
            return trustTier;
        }

        public void setTrustTier(int trustTier) {
            this.trustTier = trustTier;
        }

        // 키는 출력하지 않는다
        @Override
        public String toString() {
            return "Account{" +
                    "accountId='" + accountId + '\'' +
                    ", trustTier=" + trustTier +
                    '}';
        }
    }
}
