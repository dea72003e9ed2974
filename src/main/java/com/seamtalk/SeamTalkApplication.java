package com.seamtalk;

import com.seamtalk.config.audio.AudioCaptureProperties;
import com.seamtalk.config.client.ClientProperties;
import com.seamtalk.config.collaborators.CollaboratorProperties;
import com.seamtalk.config.hotkey.TalkKeyProperties;
import com.seamtalk.config.relay.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RelayProperties.class,
        CollaboratorProperties.class,
        ClientProperties.class,
        TalkKeyProperties.class,
        AudioCaptureProperties.class
})
@EnableScheduling
public class SeamTalkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeamTalkApplication.class, args);
    }

}
