package bahn.vision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class BahnVisionApplication {

	public static void main(String[] args) {
		SpringApplication.run(BahnVisionApplication.class, args);
	}

}
