package org.audioshelf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioshelfApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioshelfApplication.class, args);
    }
}
