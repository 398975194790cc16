package com.celflicks.backend.modules.onboarding.config;

import com.celflicks.backend.modules.onboarding.application.BackoffSleeper;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class OnboardingConfig {

    public static final String PROVISIONING_TRANSACTIONS = "provisioningTransactions";

    /**
     * 시도마다 독립된 트랜잭션. 유니크 위반으로 실패한 시도는 통째로 롤백된다.
     */
    @Bean(PROVISIONING_TRANSACTIONS)
    public TransactionOperations provisioningTransactions(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
