package com.github.revdownloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevDownloaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RevDownloaderApplication.class, args);
    }
}
