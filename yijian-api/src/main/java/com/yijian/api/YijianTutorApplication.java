package com.yijian.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.yijian")
public class YijianTutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(YijianTutorApplication.class, args);
    }
}
