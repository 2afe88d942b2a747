package com.phillippitts.cipherseal;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WatermarkProperties.class)
public class CipherSealApplication {

    public static void main(String[] args) {
        SpringApplication.run(CipherSealApplication.class, args);
    }

}
