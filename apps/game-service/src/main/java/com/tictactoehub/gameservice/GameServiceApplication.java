package com.tictactoehub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * game-service 启动类。
 * 配置属性类由 {@link ConfigurationPropertiesScan} 扫描注册。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
