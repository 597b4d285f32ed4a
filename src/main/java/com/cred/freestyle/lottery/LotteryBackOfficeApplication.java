package com.cred.freestyle.lottery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Lottery back office service.
 *
 * - Bulk import of a state's lottery game catalog from CSV (validate, preview, commit)
 * - UPC generation for activated ticket packs
 * - Pack UPC sync to store POS price books through NAXML file exchange
 *
 * @author Lottery Back Office Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class LotteryBackOfficeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LotteryBackOfficeApplication.class, args);
    }
}
