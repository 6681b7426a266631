package com.signalhub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.signalhub.config.SignalingProperties;

/**
 * Main application class for SignalHub
 *
 * A WebRTC signaling hub: peers join rooms over a WebSocket and exchange
 * offers, answers and ICE candidates through the hub. Media never passes
 * through it.
 * - Spring WebFlux on Reactor Netty for the WebSocket endpoint
 * - Scheduling for the janitor sweep and presence expiry
 */
@SpringBootApplication
@EnableScheduling
public class SignalHubApplication implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(SignalHubApplication.class);

	private final SignalingProperties properties;

	public SignalHubApplication(SignalingProperties properties) {
		this.properties = properties;
	}

	public static void main(String[] args) {
		SpringApplication.run(SignalHubApplication.class, args);
	}

	@Override
	public void run(String... args) {
		logger.info("=================================");
		logger.info("SignalHub Server Started");
		logger.info("WebSocket endpoint: {}?room_id=<room>&user_id=<peer>", properties.getEndpoint());
		logger.info("Outbound queue capacity: {}, max message size: {} bytes",
				properties.getConnection().getOutboundQueueCapacity(),
				properties.getConnection().getMaxMessageSize());
		logger.info("Janitor every {}, evicting rooms idle for {}",
				properties.getJanitor().getInterval(),
				properties.getJanitor().getInactivityThreshold());
		logger.info("=================================");
	}
}
