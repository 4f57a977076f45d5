package com.chess.replay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PgnReplayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgnReplayApplication.class, args);
    }
}
