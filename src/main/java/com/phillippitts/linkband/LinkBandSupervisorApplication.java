package com.phillippitts.linkband;

import com.phillippitts.linkband.config.properties.SupervisorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SupervisorProperties.class)
public class LinkBandSupervisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkBandSupervisorApplication.class, args);
    }

}
