package com.mailsync;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MailSync incremental mailbox synchronization engine
 *
 * Pulls new mail from remote IMAP accounts on a schedule
 * - UID cursor per account/folder
 * - Pooled, health-checked IMAP connections (Jakarta Mail)
 * - MyBatis + SQLite persistence
 * - ActiveMQ notification queue (webhook delivery)
 * - Reactor periodic driver
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.mailsync.mapper")
@EnableConfigurationProperties
public class MailSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailSyncApplication.class, args);
    }
}
