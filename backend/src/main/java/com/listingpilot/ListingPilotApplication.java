package com.listingpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ListingPilot - keyword optimization and scoring engine for marketplace listings.
 */
@SpringBootApplication
public class ListingPilotApplication {

	public static void main(String[] args) {
		SpringApplication.run(ListingPilotApplication.class, args);
	}

}
