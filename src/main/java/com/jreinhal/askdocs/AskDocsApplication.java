package com.jreinhal.askdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AskDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskDocsApplication.class, (String[])args);
    }
}
