package com.odin.share_relay_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ShareRelayServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShareRelayServiceApplication.class, args);
	}

}
