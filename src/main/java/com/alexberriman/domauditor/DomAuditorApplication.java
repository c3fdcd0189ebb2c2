package com.alexberriman.domauditor;

import com.alexberriman.domauditor.config.properties.ConcurrencyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ConcurrencyProperties.class)
public class DomAuditorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DomAuditorApplication.class, args);
    }

}
