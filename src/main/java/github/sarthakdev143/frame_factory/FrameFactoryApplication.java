package github.sarthakdev143.frame_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FrameFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(FrameFactoryApplication.class, args);
	}

}
