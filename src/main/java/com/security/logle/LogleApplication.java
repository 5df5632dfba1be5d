package com.security.logle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 日志图分析工具 - SpringBoot启动类
 *
 * @author Security Team
 * @version 1.0.0
 */
@SpringBootApplication
public class LogleApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LogleApplication.class, args)));
    }
}
