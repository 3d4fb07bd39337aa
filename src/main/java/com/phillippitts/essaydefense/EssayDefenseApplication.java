package com.phillippitts.essaydefense;

import com.phillippitts.essaydefense.config.properties.DefenseProperties;
import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import com.phillippitts.essaydefense.config.properties.GradingProperties;
import com.phillippitts.essaydefense.config.properties.RecoveryProperties;
import com.phillippitts.essaydefense.config.properties.VoiceProviderProperties;
import com.phillippitts.essaydefense.config.properties.WebhookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DefenseProperties.class,
        WebhookProperties.class,
        RecoveryProperties.class,
        VoiceProviderProperties.class,
        GradingProperties.class,
        ExternalCallProperties.class
})
@EnableScheduling
public class EssayDefenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(EssayDefenseApplication.class, args);
    }

}
