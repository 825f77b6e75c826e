package net.gridcoord.integration.spring;

import net.gridcoord.adapter.jdbc.JdbcUsageLedger;
import net.gridcoord.adapter.jdbc.repo.JdbcJobRequestRepository;
import net.gridcoord.adapter.jdbc.repo.JdbcJobSlotRepository;
import net.gridcoord.adapter.jdbc.repo.JdbcWorkerRepository;
import net.gridcoord.core.service.CoordinatorSettings;
import net.gridcoord.core.spi.JobRequestRepository;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.TxRunner;
import net.gridcoord.core.spi.UsageLedger;
import net.gridcoord.core.spi.WorkerRepository;
import net.gridcoord.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Oracle 저장소 빈 (adapter-jdbc 재사용). CoordinatorSettings는 부트스트랩이 제공한다. */
@Configuration(proxyBeanMethods = false)
public class GridCoordJdbcConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean public JobRequestRepository jobRequestRepository(DataSource ds) { return new JdbcJobRequestRepository(ds); }
    @Bean public JobSlotRepository jobSlotRepository(DataSource ds) { return new JdbcJobSlotRepository(ds); }
    @Bean public WorkerRepository workerRepository(DataSource ds) { return new JdbcWorkerRepository(ds); }

    @Bean
    public UsageLedger usageLedger(CoordinatorSettings settings) {
        return new JdbcUsageLedger(settings.usageHalfLife());
    }
}
