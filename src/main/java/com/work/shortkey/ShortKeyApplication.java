package com.work.shortkey;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口申请/解析短键。
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.work.shortkey.core.repository.mapper")
public class ShortKeyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShortKeyApplication.class, args);
    }
}
