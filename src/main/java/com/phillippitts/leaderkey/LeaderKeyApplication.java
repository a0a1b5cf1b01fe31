package com.phillippitts.leaderkey;

import com.phillippitts.leaderkey.config.properties.ConfigStoreProperties;
import com.phillippitts.leaderkey.config.properties.NavigationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ConfigStoreProperties.class,
        NavigationProperties.class
})
public class LeaderKeyApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaderKeyApplication.class, args);
    }

}
