package com.work.relay;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：relay 接口 + 后台执行队列/结算轮询。
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.work.relay.core.repository.mapper")
public class RelayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayServiceApplication.class, args);
    }
}
