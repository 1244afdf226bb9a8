package com.tanmi;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class TanmiApplication {

    public static void main(String[] args) {
        // The engine is embedded behind external tool-call surfaces: no web server of its own.
        new SpringApplicationBuilder(TanmiApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
