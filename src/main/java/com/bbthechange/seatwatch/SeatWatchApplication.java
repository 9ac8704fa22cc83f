package com.bbthechange.seatwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SeatWatchApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeatWatchApplication.class, args);
	}

}
