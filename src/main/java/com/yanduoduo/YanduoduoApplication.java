package com.yanduoduo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class YanduoduoApplication {

    public static void main(String[] args) {
        SpringApplication.run(YanduoduoApplication.class, args);
    }
}
