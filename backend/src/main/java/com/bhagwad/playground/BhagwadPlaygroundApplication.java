package com.bhagwad.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BhagwadPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(BhagwadPlaygroundApplication.class, args);
    }
}
