package com.clipforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 内容生产调度服务启动类。
 * <p>
 * 位于顶层包路径，扫描所有子模块中的组件。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@SpringBootApplication
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
