package com.crewlife.booking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class BookingAccessApplication {

	private static final Logger logger = LoggerFactory.getLogger(BookingAccessApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(BookingAccessApplication.class);
		app.run(args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Booking access service listening on port {}", event.getWebServer().getPort());
	}

}
