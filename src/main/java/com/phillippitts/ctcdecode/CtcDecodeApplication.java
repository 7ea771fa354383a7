package com.phillippitts.ctcdecode;

import com.phillippitts.ctcdecode.config.decoder.DecoderProperties;
import com.phillippitts.ctcdecode.config.scorer.ScorerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ScorerProperties.class,
        DecoderProperties.class
})
public class CtcDecodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CtcDecodeApplication.class, args);
    }

}
