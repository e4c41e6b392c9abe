package com.example.cronhooks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class CronhooksApplication {

    public static void main(String[] args) {
        // 原生 SQL 绑定的 java.sql.Timestamp 按 JVM 时区写入，和 hibernate.jdbc.time_zone 保持一致
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(CronhooksApplication.class, args);
    }
}
