package com.phillippitts.audio2video;

import com.phillippitts.audio2video.config.encoder.EncoderConfig;
import com.phillippitts.audio2video.config.properties.ConversionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EncoderConfig.class,
        ConversionProperties.class
})
@EnableScheduling
public class Audio2VideoApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Audio2VideoApplication.class, args)));
    }

}
