package com.phillippitts.sessioncore;

import com.phillippitts.sessioncore.config.properties.QueueProperties;
import com.phillippitts.sessioncore.config.properties.UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        UploadProperties.class,
        QueueProperties.class
})
@EnableScheduling
public class SessionCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionCoreApplication.class, args);
    }

}
