package com.bookcraft;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 长篇书籍生成系统主应用类
 *
 * @author BookCraft
 * @version 1.0.0
 */
@SpringBootApplication
@MapperScan("com.bookcraft.repository")
@ConfigurationPropertiesScan("com.bookcraft.config")
@EnableAsync
@EnableScheduling
public class BookCraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookCraftApplication.class, args);
        System.out.println("🚀 书籍生成系统启动成功");
        System.out.println("📚 访问地址: http://localhost:8080/api");
    }
}
