package com.tictactoe.gameserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TicTacToeServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicTacToeServerApplication.class, args);
    }
}
