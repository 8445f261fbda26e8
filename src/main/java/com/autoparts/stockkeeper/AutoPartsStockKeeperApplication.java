package com.autoparts.stockkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoPartsStockKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoPartsStockKeeperApplication.class, args);
	}

}
