package com.phillippitts.cipherseal.config;

import com.phillippitts.cipherseal.service.codec.KeyedLocationGenerator;
import com.phillippitts.cipherseal.service.codec.LsbBitCodec;
import com.phillippitts.cipherseal.service.text.TextWatermarker;
import com.phillippitts.cipherseal.service.text.ZeroWidthTextWatermarker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Spring-free codec classes as beans.
 */
@Configuration
public class CodecConfig {

    @Bean
    KeyedLocationGenerator keyedLocationGenerator() {
        return new KeyedLocationGenerator();
    }

    @Bean
    LsbBitCodec lsbBitCodec(KeyedLocationGenerator generator) {
        return new LsbBitCodec(generator);
    }

    @Bean
    TextWatermarker textWatermarker() {
        return new ZeroWidthTextWatermarker();
    }
}
