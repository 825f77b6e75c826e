package net.gridcoord.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.gridcoord.adapter.memory.InMemoryTxRunner;
import net.gridcoord.adapter.memory.InMemoryUsageLedger;
import net.gridcoord.adapter.memory.RowLocks;
import net.gridcoord.adapter.memory.repo.InMemoryJobRequestRepository;
import net.gridcoord.adapter.memory.repo.InMemoryJobSlotRepository;
import net.gridcoord.adapter.memory.repo.InMemoryWorkerRepository;
import net.gridcoord.bootstrap.catalog.AccountCatalog;
import net.gridcoord.bootstrap.props.GridCoordProperties;
import net.gridcoord.core.maintenance.ReconciliationLoop;
import net.gridcoord.core.notify.AsyncOutcomeNotifier;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.service.CooldownPolicy;
import net.gridcoord.core.service.CoordinatorSettings;
import net.gridcoord.core.service.JobLifecycleCoordinator;
import net.gridcoord.core.service.LeaseManager;
import net.gridcoord.core.service.LeaseTtlPolicy;
import net.gridcoord.core.service.Matcher;
import net.gridcoord.core.service.PriorityScorer;
import net.gridcoord.core.service.WorkSignal;
import net.gridcoord.core.spi.AccountService;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobRequestRepository;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.OutcomeListener;
import net.gridcoord.core.spi.TxRunner;
import net.gridcoord.core.spi.UsageLedger;
import net.gridcoord.core.spi.WorkerRepository;
import net.gridcoord.integration.spring.GridCoordJdbcConfig;
import net.gridcoord.integration.spring.sched.ReconciliationScheduler;
import net.gridcoord.integration.spring.webhook.WebhookOutcomeListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        JacksonAutoConfiguration.class
})
@EnableConfigurationProperties(GridCoordProperties.class)
public class GridCoordAutoConfiguration {

    // --- 저장소: gridcoord.storage.type ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gridcoord.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    static class MemoryStorage {
        @Bean @ConditionalOnMissingBean(TxRunner.class)
        public InMemoryTxRunner txRunner() { return new InMemoryTxRunner(); }

        @Bean @ConditionalOnMissingBean(JobSlotRepository.class)
        public InMemoryJobSlotRepository jobSlotRepository() { return new InMemoryJobSlotRepository(); }

        @Bean @ConditionalOnMissingBean(JobRequestRepository.class)
        public InMemoryJobRequestRepository jobRequestRepository(InMemoryJobSlotRepository slots) {
            return new InMemoryJobRequestRepository(slots, new RowLocks());
        }

        @Bean @ConditionalOnMissingBean(WorkerRepository.class)
        public InMemoryWorkerRepository workerRepository() { return new InMemoryWorkerRepository(new RowLocks()); }

        @Bean @ConditionalOnMissingBean(UsageLedger.class)
        public InMemoryUsageLedger usageLedger(CoordinatorSettings settings) {
            return new InMemoryUsageLedger(settings.usageHalfLife());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gridcoord.storage", name = "type", havingValue = "jdbc")
    @Import(GridCoordJdbcConfig.class) // integration-spring: repos/tx wiring
    static class JdbcStorage {
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public CoordinatorSettings coordinatorSettings(GridCoordProperties props) {
        return props.getCoordinator().toSettings();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock gridcoordClock() {
        return Instant::now;
    }

    @Bean
    @ConditionalOnMissingBean(AccountService.class)
    public AccountService accountService(GridCoordProperties props) {
        return AccountCatalog.load(props.getAccounts());
    }

    // --- 결과 통지 ---

    @Bean
    @ConditionalOnProperty(prefix = "gridcoord.notify", name = "webhook-enabled", havingValue = "true", matchIfMissing = true)
    public WebhookOutcomeListener webhookOutcomeListener(ObjectProvider<ObjectMapper> mapper, GridCoordProperties props) {
        ObjectMapper m = mapper.getIfAvailable(() -> new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        return WebhookOutcomeListener.withTimeout(m, props.getNotify().getWebhookTimeout(),
                props.getNotify().getWebhookAttempts());
    }

    @Bean
    public ThreadPoolTaskExecutor gridcoordNotifyExecutor(GridCoordProperties props) {
        var ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(Math.max(1, props.getNotify().getThreads()));
        ex.setMaxPoolSize(Math.max(1, props.getNotify().getThreads()));
        ex.setQueueCapacity(10_000);
        ex.setThreadNamePrefix("gridcoord-notify-");
        return ex;
    }

    @Bean
    @ConditionalOnMissingBean(OutcomeListener.class)
    public AsyncOutcomeNotifier outcomeNotifier(ThreadPoolTaskExecutor gridcoordNotifyExecutor,
                                                ObjectProvider<WebhookOutcomeListener> webhook) {
        List<OutcomeListener> delegates = new ArrayList<>();
        webhook.ifAvailable(delegates::add);
        return new AsyncOutcomeNotifier(gridcoordNotifyExecutor, delegates);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public WorkSignal workSignal() {
        return new WorkSignal();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerRegistry workerRegistry(WorkerRepository workers,
                                         JobSlotRepository slots,
                                         TxRunner tx,
                                         Clock clock,
                                         CoordinatorSettings settings) {
        return new WorkerRegistry(workers, slots, tx, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseManager leaseManager(JobSlotRepository slots,
                                     JobRequestRepository requests,
                                     WorkerRegistry workers,
                                     UsageLedger usage,
                                     OutcomeListener listener,
                                     CoordinatorSettings settings,
                                     WorkSignal signal,
                                     TxRunner tx,
                                     Clock clock) {
        return new LeaseManager(slots, requests, workers, usage, listener,
                new LeaseTtlPolicy(settings), settings, signal, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Matcher matcher(JobSlotRepository slots,
                           WorkerRegistry workers,
                           UsageLedger usage,
                           CoordinatorSettings settings,
                           TxRunner tx,
                           Clock clock) {
        return new Matcher(slots, workers, usage, new PriorityScorer(settings.usageHalfLife()),
                CooldownPolicy.fixed(settings.faultCooldown()), settings, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLifecycleCoordinator jobLifecycleCoordinator(JobRequestRepository requests,
                                                           JobSlotRepository slots,
                                                           WorkerRegistry workers,
                                                           Matcher matcher,
                                                           LeaseManager leases,
                                                           AccountService accounts,
                                                           WorkSignal signal,
                                                           CoordinatorSettings settings,
                                                           TxRunner tx,
                                                           Clock clock) {
        return new JobLifecycleCoordinator(requests, slots, workers, matcher, leases, accounts,
                signal, settings, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconciliationLoop reconciliationLoop(JobSlotRepository slots,
                                                 JobRequestRepository requests,
                                                 LeaseManager leases,
                                                 TxRunner tx,
                                                 Clock clock) {
        return new ReconciliationLoop(slots, requests, leases, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "gridcoord.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class Scheduling {
        @Bean
        public ReconciliationScheduler reconciliationScheduler(ReconciliationLoop loop, GridCoordProperties props) {
            var s = new ReconciliationScheduler(loop);
            // @Scheduled 딜레이는 gridcoord.reconciliation.interval-ms 에서 직접 읽힘
            s.setFinishedRetention(props.getReconciliation().getFinishedRetention());
            return s;
        }
    }
}
