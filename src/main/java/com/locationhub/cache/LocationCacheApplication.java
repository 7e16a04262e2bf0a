package com.locationhub.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 位置查询缓存服务启动类
 */
@SpringBootApplication
@EnableScheduling
public class LocationCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocationCacheApplication.class, args);
    }
}
