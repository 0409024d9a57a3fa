package com.starscape.rapidresize;

import com.starscape.rapidresize.common.config.ConsoleProperties;
import com.starscape.rapidresize.common.config.ProcessingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ProcessingProperties.class, ConsoleProperties.class})
public class RapidResizeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RapidResizeApplication.class, args);
    }
}
