package io.lunacore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Luna core: durable memories, conversation ledger and offline keyword retrieval
 * for the Luna voice assistant.
 */
@SpringBootApplication
public class LunaCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LunaCoreApplication.class, args);
    }
}
