package com.example.techpack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the tech pack parser HTTP service.
 * Only wires the application context; the command-line variant lives in
 * {@link com.example.techpack.interfaces.cli.TechPackCli}.
 */
@SpringBootApplication
public class TechPackApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(TechPackApplication.class, args);
	}

}
