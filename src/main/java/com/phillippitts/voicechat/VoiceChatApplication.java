package com.phillippitts.voicechat;

import com.phillippitts.voicechat.config.properties.RealtimeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(RealtimeProperties.class)
@EnableScheduling
public class VoiceChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceChatApplication.class, args);
    }

}
