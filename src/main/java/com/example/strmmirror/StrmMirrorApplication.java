package com.example.strmmirror;

import com.example.strmmirror.common.config.AppHttpProperties;
import com.example.strmmirror.common.config.AppMirrorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        AppMirrorProperties.class,
        AppHttpProperties.class
})
public class StrmMirrorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrmMirrorApplication.class, args);
    }
}
