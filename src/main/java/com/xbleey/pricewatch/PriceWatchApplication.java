package com.xbleey.pricewatch;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.xbleey.pricewatch.mapper")
public class PriceWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceWatchApplication.class, args);
    }
}
