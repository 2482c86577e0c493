package org.stocktake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StockTakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockTakeApplication.class, args);
    }
}
