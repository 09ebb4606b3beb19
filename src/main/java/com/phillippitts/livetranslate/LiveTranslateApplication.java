package com.phillippitts.livetranslate;

import com.phillippitts.livetranslate.config.properties.ClassroomProperties;
import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.config.properties.ProviderProperties;
import com.phillippitts.livetranslate.config.properties.SessionLifecycleProperties;
import com.phillippitts.livetranslate.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        ClassroomProperties.class,
        SessionLifecycleProperties.class,
        DeliveryProperties.class,
        ProviderProperties.class
})
@EnableScheduling
public class LiveTranslateApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveTranslateApplication.class, args);
    }

}
