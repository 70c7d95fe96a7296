package com.jz.langid;


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.jz.langid")
public class LangIdApplication {
    public static void main(String[] args) {
        SpringApplication.run(LangIdApplication.class, args);
    }
}
