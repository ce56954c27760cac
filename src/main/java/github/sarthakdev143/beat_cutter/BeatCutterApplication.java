package github.sarthakdev143.beat_cutter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BeatCutterApplication {

	public static void main(String[] args) {
		SpringApplication.run(BeatCutterApplication.class, args);
	}

}
